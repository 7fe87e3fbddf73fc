package org.iceforge.s3bridge.api;

import org.iceforge.s3bridge.auth.AuthErrorKind;
import org.iceforge.s3bridge.auth.AuthException;
import org.iceforge.s3bridge.credentials.CredentialBundle;
import org.iceforge.s3bridge.issuer.CredentialIssuer;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Objects;

/**
 * Credential issuance endpoint.
 * <pre>
 * GET /credentials?service=analytics&amp;duration=3600
 * X-API-Key: ...
 * </pre>
 * Errors are rendered by {@link ApiExceptionHandler}.
 */
@RestController
public class CredentialController {

    public static final String API_KEY_HEADER = "X-API-Key";

    private final CredentialIssuer issuer;

    public CredentialController(CredentialIssuer issuer) {
        this.issuer = Objects.requireNonNull(issuer);
    }

    @GetMapping("/credentials")
    public ResponseEntity<CredentialModels.CredentialResponse> credentials(
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @RequestParam(value = "service", required = false) String service,
            @RequestParam(value = "duration", required = false) String duration) {

        CredentialBundle bundle = issuer.issue(apiKey, service, parseDuration(duration));

        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(CredentialModels.CredentialResponse.from(bundle));
    }

    static Integer parseDuration(String duration) {
        if (duration == null || duration.isBlank()) return null;
        try {
            return Integer.valueOf(duration.trim());
        } catch (NumberFormatException e) {
            throw new AuthException(AuthErrorKind.INVALID_REQUEST, "duration must be a whole number of seconds: " + duration);
        }
    }
}
