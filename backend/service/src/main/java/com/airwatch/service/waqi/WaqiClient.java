package com.airwatch.service.waqi;

import com.airwatch.pipeline.api.AirQualitySource;
import com.airwatch.pipeline.api.RawPayload;
import com.airwatch.pipeline.api.Target;
import com.airwatch.pipeline.api.TargetRegistry;
import com.airwatch.pipeline.error.FetchUnavailableException;
import com.airwatch.pipeline.error.NotConfiguredException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

public final class WaqiClient implements AirQualitySource {
    private static final Logger LOGGER = Logger.getLogger(WaqiClient.class.getName());
    private static final int MAX_ATTEMPTS = 2;

    private final HttpClient httpClient;
    private final TargetRegistry registry;
    private final String baseUrl;
    private final String token;
    private final Duration timeout;
    private final WaqiPayloadParser parser;

    public WaqiClient(HttpClient httpClient, TargetRegistry registry, String baseUrl, String token, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl is required");
        this.token = token == null ? "" : token.trim();
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.parser = new WaqiPayloadParser();
    }

    @Override
    public RawPayload fetch(String targetId) {
        Target target = registry.require(targetId);
        if (token.isBlank()) {
            throw new NotConfiguredException(target.id(), "WAQI API token is not configured");
        }
        if (target.stationId() == null || target.stationId().isBlank()) {
            throw new NotConfiguredException(target.id(), "no WAQI station configured");
        }

        URI uri = URI.create(baseUrl + "/feed/" + target.stationId().trim() + "/?token="
                + URLEncoder.encode(token, StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .build();

        HttpResponse<String> response = send(target.id(), request);
        for (int attempt = 2; attempt <= MAX_ATTEMPTS && response.statusCode() / 100 == 5; attempt++) {
            LOGGER.info("WAQI returned " + response.statusCode() + " for " + target.id() + ", retrying");
            response = send(target.id(), request);
        }
        if (response.statusCode() / 100 != 2) {
            throw new FetchUnavailableException(target.id(), "WAQI request failed with status " + response.statusCode());
        }
        return parser.parse(target.id(), response.body());
    }

    private HttpResponse<String> send(String target, HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchUnavailableException(target, "WAQI request interrupted", e);
        } catch (IOException e) {
            throw new FetchUnavailableException(target, "WAQI request failed: " + e.getMessage(), e);
        }
    }
}
