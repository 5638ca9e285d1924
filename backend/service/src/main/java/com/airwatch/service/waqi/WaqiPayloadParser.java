package com.airwatch.service.waqi;

import com.airwatch.core.model.DayPoint;
import com.airwatch.core.model.Pollutant;
import com.airwatch.core.util.JsonUtils;
import com.airwatch.pipeline.api.RawPayload;
import com.airwatch.pipeline.error.MalformedPayloadException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

public final class WaqiPayloadParser {
    private static final Logger LOGGER = Logger.getLogger(WaqiPayloadParser.class.getName());

    public RawPayload parse(String target, String body) {
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException(target, "response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedPayloadException(target, "response is not a JSON object");
        }
        String status = root.path("status").asText("");
        if (!"ok".equalsIgnoreCase(status)) {
            String detail = root.path("data").isTextual() ? root.path("data").asText() : status;
            throw new MalformedPayloadException(target, "upstream status is not ok: " + detail);
        }
        JsonNode data = root.path("data");
        if (!data.isObject()) {
            throw new MalformedPayloadException(target, "response has no data object");
        }

        return new RawPayload(
                observedAt(data.path("time")),
                index(data.path("aqi")),
                textOrNull(data.path("dominentpol")),
                concentrations(data.path("iaqi")),
                forecast(target, data.path("forecast").path("daily"))
        );
    }

    private static Integer index(JsonNode node) {
        if (node.isNumber()) {
            return node.asInt();
        }
        // stations report "-" while offline
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Instant observedAt(JsonNode time) {
        String iso = textOrNull(time.path("iso"));
        if (iso != null) {
            try {
                return OffsetDateTime.parse(iso).toInstant();
            } catch (DateTimeParseException e) {
                LOGGER.fine(() -> "Ignoring unparseable observation time " + iso);
            }
        }
        JsonNode epoch = time.path("v");
        if (epoch.isNumber()) {
            return Instant.ofEpochSecond(epoch.asLong());
        }
        return null;
    }

    private static Map<Pollutant, Double> concentrations(JsonNode iaqi) {
        Map<Pollutant, Double> values = new EnumMap<>(Pollutant.class);
        Iterator<Map.Entry<String, JsonNode>> fields = iaqi.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<Pollutant> pollutant = Pollutant.fromCode(field.getKey());
            JsonNode value = field.getValue().path("v");
            if (pollutant.isPresent() && value.isNumber()) {
                values.put(pollutant.get(), value.asDouble());
            }
        }
        return values;
    }

    private static Map<Pollutant, List<DayPoint>> forecast(String target, JsonNode daily) {
        Map<Pollutant, List<DayPoint>> series = new EnumMap<>(Pollutant.class);
        if (!daily.isObject()) {
            return series;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = daily.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<Pollutant> pollutant = Pollutant.fromCode(field.getKey());
            if (pollutant.isEmpty() || !field.getValue().isArray()) {
                continue;
            }
            List<DayPoint> points = new ArrayList<>();
            for (JsonNode day : field.getValue()) {
                try {
                    points.add(new DayPoint(
                            LocalDate.parse(day.path("day").asText("")),
                            numberOrNull(day.path("avg")),
                            numberOrNull(day.path("min")),
                            numberOrNull(day.path("max"))
                    ));
                } catch (DateTimeParseException e) {
                    LOGGER.fine(() -> "Skipping forecast day without a valid date for " + target + ": " + day);
                }
            }
            series.put(pollutant.get(), points);
        }
        return series;
    }

    private static Double numberOrNull(JsonNode node) {
        return node.isNumber() ? node.asDouble() : null;
    }

    private static String textOrNull(JsonNode node) {
        if (!node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText().trim();
    }
}
