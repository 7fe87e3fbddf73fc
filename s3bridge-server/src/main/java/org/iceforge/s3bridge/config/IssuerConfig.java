package org.iceforge.s3bridge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.s3bridge.issuer.ApiKeyVerifier;
import org.iceforge.s3bridge.issuer.CredentialIssuer;
import org.iceforge.s3bridge.issuer.IssuerOptions;
import org.iceforge.s3bridge.issuer.RoleAssumptionAuthority;
import org.iceforge.s3bridge.registry.CompositeServiceRegistry;
import org.iceforge.s3bridge.registry.EnvironmentServiceRegistry;
import org.iceforge.s3bridge.registry.InMemoryServiceRegistry;
import org.iceforge.s3bridge.registry.PermissionTier;
import org.iceforge.s3bridge.registry.ServiceDefinition;
import org.iceforge.s3bridge.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Configuration
public class IssuerConfig {
    private static final Logger log = LoggerFactory.getLogger(IssuerConfig.class);

    static final String UNIVERSAL_SERVICE = "universal";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Lookup order: configured services, then SERVICE_* environment variables, then the
     * built-in universal service.
     */
    @Bean
    @ConditionalOnMissingBean
    public ServiceRegistry serviceRegistry(S3BridgeProperties props, ObjectMapper mapper) {
        S3BridgeProperties.Registry cfg = props.getRegistry();
        List<ServiceRegistry> chain = new ArrayList<>();

        List<ServiceDefinition> configured = new ArrayList<>();
        for (Map.Entry<String, S3BridgeProperties.Service> e : cfg.getServices().entrySet()) {
            S3BridgeProperties.Service s = e.getValue();
            configured.add(new ServiceDefinition(e.getKey(), s.getBuckets(),
                    PermissionTier.parse(s.getPermissions()), s.getRole()));
        }
        chain.add(new InMemoryServiceRegistry(configured));

        if (cfg.isEnvironmentEnabled()) {
            chain.add(new EnvironmentServiceRegistry(System::getenv, mapper));
        }

        String universalRole = cfg.getUniversalRole();
        if (universalRole != null && !universalRole.isBlank()) {
            chain.add(InMemoryServiceRegistry.of(new ServiceDefinition(
                    UNIVERSAL_SERVICE, List.of("*"), PermissionTier.ADMIN, universalRole)));
        }

        log.info("Service registry: {} configured service(s), environment={}, universal={}",
                configured.size(), cfg.isEnvironmentEnabled(), universalRole != null && !universalRole.isBlank());
        return new CompositeServiceRegistry(chain);
    }

    @Bean
    public IssuerOptions issuerOptions(S3BridgeProperties props) {
        S3BridgeProperties.Issuer i = props.getIssuer();
        return new IssuerOptions(i.getDefaultDuration(), i.getMinDuration(), i.getMaxDuration());
    }

    @Bean
    public CredentialIssuer credentialIssuer(S3BridgeProperties props,
                                             ServiceRegistry registry,
                                             RoleAssumptionAuthority authority,
                                             IssuerOptions options,
                                             Clock clock) {
        return new CredentialIssuer(new ApiKeyVerifier(props.getApiKey()), registry, authority, options, clock);
    }
}
