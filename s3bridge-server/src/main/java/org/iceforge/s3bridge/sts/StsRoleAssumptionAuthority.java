package org.iceforge.s3bridge.sts;

import org.iceforge.s3bridge.issuer.AssumedRole;
import org.iceforge.s3bridge.issuer.RoleAssumptionAuthority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.Credentials;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link RoleAssumptionAuthority} backed by AWS STS {@code AssumeRole}. The STS client carries the
 * API-call timeout, so a hung STS endpoint surfaces as an exception instead of blocking.
 */
public class StsRoleAssumptionAuthority implements RoleAssumptionAuthority {
    private static final Logger logger = LoggerFactory.getLogger(StsRoleAssumptionAuthority.class);

    // STS limit for RoleSessionName
    static final int MAX_SESSION_NAME = 64;

    private final StsClient sts;

    public StsRoleAssumptionAuthority(StsClient sts) {
        this.sts = Objects.requireNonNull(sts);
    }

    @Override
    public AssumedRole assume(String roleReference, String sessionName, Duration duration) {
        String session = sanitizeSessionName(sessionName);
        try {
            AssumeRoleResponse resp = sts.assumeRole(AssumeRoleRequest.builder()
                    .roleArn(roleReference)
                    .roleSessionName(session)
                    .durationSeconds(Math.toIntExact(duration.getSeconds()))
                    .build());

            Credentials c = resp.credentials();
            if (c == null) {
                throw new RoleAssumptionException("STS AssumeRole returned no credentials for " + roleReference);
            }
            logger.debug("Assumed role {} session={} expiration={}", roleReference, session, c.expiration());
            return new AssumedRole(c.accessKeyId(), c.secretAccessKey(), c.sessionToken(), c.expiration());
        } catch (SdkException e) {
            logger.error("STS AssumeRole failed for role={} session={}", roleReference, session, e);
            throw new RoleAssumptionException("STS AssumeRole failed for " + roleReference, e);
        }
    }

    /** Replaces characters STS rejects and truncates to the 64-character limit. */
    static String sanitizeSessionName(String sessionName) {
        String s = sessionName == null ? "s3bridge" : sessionName.replaceAll("[^\\w+=,.@-]", "-");
        return s.length() <= MAX_SESSION_NAME ? s : s.substring(s.length() - MAX_SESSION_NAME);
    }
}
