package org.iceforge.s3bridge.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.iceforge.s3bridge.credentials.CredentialBundle;

import java.util.List;

/** Wire shapes of the issuance API. Success fields keep the STS-style names clients already parse. */
public final class CredentialModels {

    private CredentialModels() {}

    public record CredentialResponse(
            @JsonProperty("AccessKeyId") String accessKeyId,
            @JsonProperty("SecretAccessKey") String secretAccessKey,
            @JsonProperty("SessionToken") String sessionToken,
            @JsonProperty("Expiration") String expiration,
            @JsonProperty("IssuedAt") String issuedAt,
            @JsonProperty("ServiceId") String serviceId,
            @JsonProperty("Buckets") List<String> buckets,
            @JsonProperty("Permissions") String permissions
    ) {
        public static CredentialResponse from(CredentialBundle b) {
            return new CredentialResponse(
                    b.accessKey(),
                    b.secretKey(),
                    b.sessionToken(),
                    b.expiresAt().toString(),
                    b.issuedAt().toString(),
                    b.serviceId(),
                    b.bucketPatterns(),
                    b.permissionTier() == null ? null : b.permissionTier().wireName()
            );
        }
    }

    public record ErrorResponse(
            @JsonProperty("error_kind") String errorKind,
            @JsonProperty("message") String message
    ) {}
}
