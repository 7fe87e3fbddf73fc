package org.iceforge.s3bridge.client;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for talking to the issuance endpoint and to S3 with the issued credentials.
 *
 * @param baseUrl           issuance endpoint root, e.g. {@code https://broker.internal}
 * @param apiKey            shared API key; when null the {@code S3BRIDGE_API_KEY} environment variable is used
 * @param requestTimeout    bound on one credential request
 * @param durationSeconds   lifetime to ask for; null lets the broker apply its default
 * @param region            S3 region
 * @param endpointOverride  optional S3-compatible endpoint (path-style addressing is used when set)
 */
public record ClientOptions(
        String baseUrl,
        String apiKey,
        Duration requestTimeout,
        Integer durationSeconds,
        String region,
        URI endpointOverride
) {
    public static final String DEFAULT_BASE_URL = "http://localhost:8080";

    public ClientOptions {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("region is required");
        }
    }

    public static ClientOptions defaults() {
        return new ClientOptions(DEFAULT_BASE_URL, null, Duration.ofSeconds(30), 3600, "us-east-1", null);
    }

    public ClientOptions withBaseUrl(String baseUrl) {
        return new ClientOptions(baseUrl, apiKey, requestTimeout, durationSeconds, region, endpointOverride);
    }

    public ClientOptions withApiKey(String apiKey) {
        return new ClientOptions(baseUrl, apiKey, requestTimeout, durationSeconds, region, endpointOverride);
    }

    public ClientOptions withRequestTimeout(Duration requestTimeout) {
        return new ClientOptions(baseUrl, apiKey, requestTimeout, durationSeconds, region, endpointOverride);
    }

    public ClientOptions withEndpointOverride(URI endpointOverride) {
        return new ClientOptions(baseUrl, apiKey, requestTimeout, durationSeconds, region, endpointOverride);
    }
}
