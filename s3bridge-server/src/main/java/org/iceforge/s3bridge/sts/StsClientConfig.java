package org.iceforge.s3bridge.sts;

import org.iceforge.s3bridge.config.S3BridgeProperties;
import org.iceforge.s3bridge.issuer.RoleAssumptionAuthority;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.StsClientBuilder;

/**
 * STS client for role assumption. The broker's own identity comes from the standard AWS SDK
 * credential chain (environment, profile, instance/task role).
 */
@Configuration
public class StsClientConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public StsClient stsClient(S3BridgeProperties props) {
        S3BridgeProperties.Sts sts = props.getSts();
        StsClientBuilder b = StsClient.builder()
                .credentialsProvider(DefaultCredentialsProvider.create())
                .region(Region.of(sts.getRegion()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(sts.getApiTimeout())
                        .build());

        if (sts.getEndpoint() != null) {
            b = b.endpointOverride(sts.getEndpoint());
        }
        return b.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RoleAssumptionAuthority roleAssumptionAuthority(StsClient stsClient) {
        return new StsRoleAssumptionAuthority(stsClient);
    }
}
