package org.iceforge.s3bridge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the credential issuance service.
 * <p>
 * Defaults are safe: with no API key configured every request is denied.
 */
@ConfigurationProperties(prefix = "s3bridge")
public class S3BridgeProperties {

    /** Shared API key callers present in the X-API-Key header. */
    private String apiKey;

    private Issuer issuer = new Issuer();
    private Sts sts = new Sts();
    private Registry registry = new Registry();

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public Issuer getIssuer() { return issuer; }
    public void setIssuer(Issuer issuer) { this.issuer = issuer; }

    public Sts getSts() { return sts; }
    public void setSts(Sts sts) { this.sts = sts; }

    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }

    public static class Issuer {
        private Duration defaultDuration = Duration.ofHours(1);
        private Duration minDuration = Duration.ofMinutes(15);
        /** Hard ceiling; may be lowered but never raised above one hour. */
        private Duration maxDuration = Duration.ofHours(1);

        public Duration getDefaultDuration() { return defaultDuration; }
        public void setDefaultDuration(Duration defaultDuration) { this.defaultDuration = defaultDuration; }

        public Duration getMinDuration() { return minDuration; }
        public void setMinDuration(Duration minDuration) { this.minDuration = minDuration; }

        public Duration getMaxDuration() { return maxDuration; }
        public void setMaxDuration(Duration maxDuration) { this.maxDuration = maxDuration; }
    }

    public static class Sts {
        private String region = "us-east-1";
        /** Optional endpoint override (VPC endpoint, LocalStack, ...). */
        private URI endpoint;
        private Duration apiTimeout = Duration.ofSeconds(30);

        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }

        public URI getEndpoint() { return endpoint; }
        public void setEndpoint(URI endpoint) { this.endpoint = endpoint; }

        public Duration getApiTimeout() { return apiTimeout; }
        public void setApiTimeout(Duration apiTimeout) { this.apiTimeout = apiTimeout; }
    }

    public static class Registry {
        /** Read SERVICE_* environment variables on every lookup. */
        private boolean environmentEnabled = true;

        /** Role for the built-in "universal" service (all buckets). Disabled when blank. */
        private String universalRole;

        private Map<String, Service> services = new LinkedHashMap<>();

        public boolean isEnvironmentEnabled() { return environmentEnabled; }
        public void setEnvironmentEnabled(boolean environmentEnabled) { this.environmentEnabled = environmentEnabled; }

        public String getUniversalRole() { return universalRole; }
        public void setUniversalRole(String universalRole) { this.universalRole = universalRole; }

        public Map<String, Service> getServices() { return services; }
        public void setServices(Map<String, Service> services) { this.services = services; }
    }

    public static class Service {
        private String role;
        private List<String> buckets = new ArrayList<>();
        private String permissions = "read-write";

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public List<String> getBuckets() { return buckets; }
        public void setBuckets(List<String> buckets) { this.buckets = buckets; }

        public String getPermissions() { return permissions; }
        public void setPermissions(String permissions) { this.permissions = permissions; }
    }
}
