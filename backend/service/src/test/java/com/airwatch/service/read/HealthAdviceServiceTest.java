package com.airwatch.service.read;

import com.airwatch.core.aqi.AqiCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class HealthAdviceServiceTest {
    @Test
    void goodAirIsLowRiskForEveryone() {
        for (SensitiveGroup group : SensitiveGroup.values()) {
            assertEquals("low", HealthAdviceService.riskLevel(group, 50));
        }
    }

    @Test
    void moderateBandDependsOnGroupThreshold() {
        assertEquals("low", HealthAdviceService.riskLevel(SensitiveGroup.ATHLETES, 90));
        assertEquals("moderate", HealthAdviceService.riskLevel(SensitiveGroup.CHILDREN, 90));
        assertEquals("low", HealthAdviceService.riskLevel(SensitiveGroup.ELDERLY, 75));
        assertEquals("moderate", HealthAdviceService.riskLevel(SensitiveGroup.ASTHMATICS, 51));
    }

    @Test
    void higherBandsIgnoreThresholds() {
        assertEquals("moderate", HealthAdviceService.riskLevel(SensitiveGroup.ATHLETES, 150));
        assertEquals("high", HealthAdviceService.riskLevel(SensitiveGroup.ATHLETES, 151));
        assertEquals("high", HealthAdviceService.riskLevel(SensitiveGroup.ASTHMATICS, 200));
        assertEquals("very-high", HealthAdviceService.riskLevel(SensitiveGroup.CHILDREN, 201));
    }

    @Test
    void riskChangesExactlyAtCategoryBoundaries() {
        int[] boundaries = {50, 100, 150, 200, 300};
        String[] atBoundary = {"low", "low", "moderate", "high", "very-high"};
        String[] pastBoundary = {"low", "moderate", "high", "very-high", "very-high"};
        for (int i = 0; i < boundaries.length; i++) {
            assertEquals(atBoundary[i], HealthAdviceService.riskLevel(SensitiveGroup.ATHLETES, boundaries[i]));
            assertEquals(pastBoundary[i], HealthAdviceService.riskLevel(SensitiveGroup.ATHLETES, boundaries[i] + 1));
        }
        assertEquals("low", HealthAdviceService.riskLevel(SensitiveGroup.ASTHMATICS, 0));
        assertEquals("very-high", HealthAdviceService.riskLevel(SensitiveGroup.ASTHMATICS, 999));
    }

    @Test
    void recommendationFollowsCategory() {
        HealthAdviceService.GroupAdvice advice = HealthAdviceService.adviceFor(SensitiveGroup.ASTHMATICS, 158);

        assertEquals(SensitiveGroup.ASTHMATICS.recommendationFor(AqiCategory.UNHEALTHY), advice.recommendation());
        assertEquals("high", advice.riskLevel());
    }

    @Test
    void everyGroupHasAdviceForEveryCategory() {
        for (SensitiveGroup group : SensitiveGroup.values()) {
            for (AqiCategory category : AqiCategory.values()) {
                assertNotNull(group.recommendationFor(category), group + " " + category);
            }
        }
    }
}
