package org.iceforge.s3bridge.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Registry backed by {@code SERVICE_<NAME>} environment variables, the format written by the
 * provisioning tooling:
 * <pre>
 * SERVICE_ANALYTICS={"role": "arn:aws:iam::123456789012:role/service-role/analytics-s3-access-role",
 *                    "buckets": ["*-analytics-*", "analytics-*"],
 *                    "permissions": "read-only"}
 * </pre>
 * The service id is the lower-cased suffix. {@code permissions} defaults to {@code read-write}.
 * Variables that do not parse are skipped with a warning. The environment is re-read on every
 * lookup so provisioning changes are picked up without a restart.
 */
public class EnvironmentServiceRegistry implements ServiceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(EnvironmentServiceRegistry.class);

    static final String PREFIX = "SERVICE_";

    private final Supplier<Map<String, String>> environment;
    private final ObjectMapper mapper;

    public EnvironmentServiceRegistry(Supplier<Map<String, String>> environment, ObjectMapper mapper) {
        this.environment = Objects.requireNonNull(environment);
        this.mapper = Objects.requireNonNull(mapper);
    }

    @Override
    public Optional<ServiceDefinition> lookup(String serviceId) {
        if (serviceId == null || serviceId.isBlank()) return Optional.empty();
        return Optional.ofNullable(snapshot().get(serviceId));
    }

    /** All services currently declared in the environment, in declaration order. */
    public Map<String, ServiceDefinition> snapshot() {
        Map<String, String> env = environment.get();
        Map<String, ServiceDefinition> out = new LinkedHashMap<>();
        if (env == null) return out;

        for (Map.Entry<String, String> e : env.entrySet()) {
            String key = e.getKey();
            if (key == null || !key.startsWith(PREFIX) || key.length() == PREFIX.length()) continue;
            String serviceId = key.substring(PREFIX.length()).toLowerCase(Locale.ROOT);
            parse(serviceId, e.getValue()).ifPresent(d -> out.put(serviceId, d));
        }
        return out;
    }

    private Optional<ServiceDefinition> parse(String serviceId, String json) {
        try {
            JsonNode node = mapper.readTree(json == null ? "" : json);
            if (node == null || !node.isObject()) {
                logger.warn("Skipping {}{}: value is not a JSON object", PREFIX, serviceId.toUpperCase(Locale.ROOT));
                return Optional.empty();
            }
            List<String> buckets = new ArrayList<>();
            JsonNode b = node.path("buckets");
            if (b.isArray()) {
                b.forEach(x -> buckets.add(x.asText()));
            }
            PermissionTier tier = node.hasNonNull("permissions")
                    ? PermissionTier.parse(node.get("permissions").asText())
                    : PermissionTier.READ_WRITE;
            return Optional.of(new ServiceDefinition(serviceId, buckets, tier, node.path("role").asText(null)));
        } catch (JsonProcessingException e) {
            logger.warn("Skipping {}{}: invalid JSON ({})", PREFIX, serviceId.toUpperCase(Locale.ROOT), e.getOriginalMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            logger.warn("Skipping {}{}: {}", PREFIX, serviceId.toUpperCase(Locale.ROOT), e.getMessage());
            return Optional.empty();
        }
    }
}
