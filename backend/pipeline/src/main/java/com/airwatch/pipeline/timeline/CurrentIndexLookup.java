package com.airwatch.pipeline.timeline;

@FunctionalInterface
public interface CurrentIndexLookup {
    int currentIndex(String target);
}
