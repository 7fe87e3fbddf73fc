package org.iceforge.s3bridge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.s3bridge.registry.PermissionTier;
import org.iceforge.s3bridge.registry.ServiceDefinition;
import org.iceforge.s3bridge.registry.ServiceRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IssuerConfigTest {

    private final IssuerConfig config = new IssuerConfig();

    private static S3BridgeProperties props() {
        S3BridgeProperties p = new S3BridgeProperties();
        p.getRegistry().setEnvironmentEnabled(false);
        S3BridgeProperties.Service s = new S3BridgeProperties.Service();
        s.setRole("arn:aws:iam::1:role/analytics");
        s.setBuckets(List.of("*-analytics-*", "analytics-*"));
        s.setPermissions("read-only");
        p.getRegistry().getServices().put("analytics", s);
        return p;
    }

    @Test
    void configuredServicesAreRegistered() {
        ServiceRegistry registry = config.serviceRegistry(props(), new ObjectMapper());

        ServiceDefinition d = registry.lookup("analytics").orElseThrow();
        assertEquals(PermissionTier.READ_ONLY, d.permissionTier());
        assertTrue(registry.lookup("universal").isEmpty());
    }

    @Test
    void universalServiceOnlyWhenRoleConfigured() {
        S3BridgeProperties p = props();
        p.getRegistry().setUniversalRole("arn:aws:iam::1:role/service-role/s3bridge-access-role");

        ServiceDefinition u = config.serviceRegistry(p, new ObjectMapper()).lookup("universal").orElseThrow();

        assertEquals(List.of("*"), u.bucketPatterns());
        assertEquals(PermissionTier.ADMIN, u.permissionTier());
    }

    @Test
    void issuerOptionsComeFromProperties() {
        S3BridgeProperties p = props();
        p.getIssuer().setMaxDuration(Duration.ofMinutes(30));
        p.getIssuer().setDefaultDuration(Duration.ofMinutes(20));

        assertEquals(Duration.ofMinutes(30), config.issuerOptions(p).clamp(7200));
        assertEquals(Duration.ofMinutes(20), config.issuerOptions(p).clamp(null));
    }

    @Test
    void ceilingAboveOneHourIsRejected() {
        S3BridgeProperties p = props();
        p.getIssuer().setMaxDuration(Duration.ofHours(12));

        assertThrows(IllegalArgumentException.class, () -> config.issuerOptions(p));
    }
}
