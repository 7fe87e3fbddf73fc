package org.iceforge.s3bridge.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.iceforge.s3bridge.auth.AuthErrorKind;
import org.iceforge.s3bridge.auth.AuthException;
import org.iceforge.s3bridge.credentials.CredentialBundle;
import org.iceforge.s3bridge.credentials.CredentialSource;
import org.iceforge.s3bridge.registry.PermissionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Fetches credentials from the issuance endpoint:
 * <pre>
 * GET {baseUrl}/credentials?service=analytics&amp;duration=3600
 * X-API-Key: ...
 * </pre>
 * Error responses are mapped back to their {@link AuthErrorKind}. Bodies that carry no
 * recognisable kind fall back on the status: 401/403 mean a bad key, other 4xx an unknown
 * service, anything else an upstream failure. Transport errors and timeouts are upstream
 * failures as well. No retries here; the cache decides.
 */
public class HttpCredentialSource implements CredentialSource {
    private static final Logger logger = LoggerFactory.getLogger(HttpCredentialSource.class);

    public static final String API_KEY_ENV = "S3BRIDGE_API_KEY";
    public static final String API_KEY_HEADER = "X-API-Key";

    private final WebClient webClient;
    private final ClientOptions options;
    private final Supplier<String> environmentKey;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public HttpCredentialSource(ClientOptions options) {
        this(buildWebClient(options), options, () -> System.getenv(API_KEY_ENV), Clock.systemUTC());
    }

    public HttpCredentialSource(WebClient webClient, ClientOptions options,
                                Supplier<String> environmentKey, Clock clock) {
        this.webClient = Objects.requireNonNull(webClient);
        this.options = Objects.requireNonNull(options);
        this.environmentKey = Objects.requireNonNull(environmentKey);
        this.clock = Objects.requireNonNull(clock);
    }

    private static WebClient buildWebClient(ClientOptions options) {
        HttpClient httpClient = HttpClient.create()
                .compress(true)
                .responseTimeout(options.requestTimeout());
        return WebClient.builder()
                .baseUrl(options.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public CredentialBundle fetch(String serviceId) {
        String apiKey = resolveApiKey();
        if (apiKey == null) {
            throw new AuthException(AuthErrorKind.INVALID_API_KEY,
                    "API key not found. Set " + API_KEY_ENV + " or configure an API key");
        }

        ResponseEntity<String> resp;
        try {
            resp = webClient.get()
                    .uri(b -> b.path("/credentials")
                            .queryParam("service", serviceId)
                            .queryParamIfPresent("duration", Optional.ofNullable(options.durationSeconds()))
                            .build())
                    .header(API_KEY_HEADER, apiKey)
                    .accept(MediaType.APPLICATION_JSON)
                    .exchangeToMono(r -> r.toEntity(String.class))
                    .timeout(options.requestTimeout())
                    .block();
        } catch (RuntimeException e) {
            logger.warn("Credential request for service={} failed: {}", serviceId, e.toString());
            throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Credential service unreachable for service " + serviceId, e);
        }
        if (resp == null) {
            throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Credential service returned no response for service " + serviceId);
        }

        int status = resp.getStatusCode().value();
        if (resp.getStatusCode().is2xxSuccessful()) {
            CredentialBundle bundle = toBundle(serviceId, resp.getBody());
            logger.debug("Fetched credentials for service={} expiresAt={}", serviceId, bundle.expiresAt());
            return bundle;
        }
        AuthException ex = toError(status, resp.getBody());
        logger.warn("Credential service refused service={} status={} kind={}", serviceId, status, ex.kind());
        throw ex;
    }

    String resolveApiKey() {
        if (options.apiKey() != null && !options.apiKey().isBlank()) {
            return options.apiKey();
        }
        String env = environmentKey.get();
        return env == null || env.isBlank() ? null : env;
    }

    private CredentialBundle toBundle(String serviceId, String body) {
        try {
            CredentialPayload p = mapper.readValue(body == null ? "" : body, CredentialPayload.class);
            if (p.accessKeyId() == null || p.secretAccessKey() == null || p.sessionToken() == null
                    || p.expiration() == null) {
                throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                        "Credential response for service " + serviceId + " is missing required fields");
            }
            Instant issuedAt = p.issuedAt() != null ? p.issuedAt() : clock.instant();
            PermissionTier tier = p.permissions() == null ? null : PermissionTier.parse(p.permissions());
            return new CredentialBundle(
                    p.accessKeyId(),
                    p.secretAccessKey(),
                    p.sessionToken(),
                    issuedAt,
                    p.expiration(),
                    p.serviceId() == null ? serviceId : p.serviceId(),
                    p.buckets(),
                    tier);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Malformed credential response for service " + serviceId, e);
        }
    }

    AuthException toError(int status, String body) {
        ErrorPayload err = null;
        if (body != null && !body.isBlank()) {
            try {
                err = mapper.readValue(body, ErrorPayload.class);
            } catch (JsonProcessingException e) {
                logger.debug("Error body with status {} is not JSON", status);
            }
        }

        AuthErrorKind kind = err == null ? null : AuthErrorKind.fromWireName(err.errorKind());
        if (kind == null) {
            if (status == 401 || status == 403) {
                kind = AuthErrorKind.INVALID_API_KEY;
            } else if (status >= 400 && status < 500) {
                kind = AuthErrorKind.UNKNOWN_SERVICE;
            } else {
                kind = AuthErrorKind.UPSTREAM_FAILURE;
            }
        }
        String message = err != null && err.message() != null
                ? err.message()
                : "Credential service responded with HTTP " + status;
        return new AuthException(kind, message);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CredentialPayload(
            @JsonProperty("AccessKeyId") String accessKeyId,
            @JsonProperty("SecretAccessKey") String secretAccessKey,
            @JsonProperty("SessionToken") String sessionToken,
            @JsonProperty("Expiration") Instant expiration,
            @JsonProperty("IssuedAt") Instant issuedAt,
            @JsonProperty("ServiceId") String serviceId,
            @JsonProperty("Buckets") List<String> buckets,
            @JsonProperty("Permissions") String permissions
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ErrorPayload(
            @JsonProperty("error_kind") String errorKind,
            @JsonProperty("message") String message
    ) {}
}
