package org.iceforge.s3bridge.api;

import org.iceforge.s3bridge.config.S3BridgeProperties;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unauthenticated health check for load balancers.
 *
 * <p>Status comes from Actuator health. {@code issuing} is false when no API key is configured,
 * in which case every credential request is denied.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final S3BridgeProperties props;

    public HealthController(HealthEndpoint healthEndpoint, S3BridgeProperties props) {
        this.healthEndpoint = Objects.requireNonNull(healthEndpoint);
        this.props = Objects.requireNonNull(props);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        HealthComponent hc = healthEndpoint.health();
        String apiKey = props.getApiKey();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", hc.getStatus().getCode());
        body.put("issuing", apiKey != null && !apiKey.isBlank());
        return body;
    }
}
