package org.iceforge.s3bridge.api;

import org.iceforge.s3bridge.auth.AuthErrorKind;
import org.iceforge.s3bridge.auth.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps broker failures to {@code {"error_kind", "message"}} bodies. Client errors (bad key,
 * unknown service) are 4xx; upstream failures are 5xx so callers know to retry.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<CredentialModels.ErrorResponse> onAuth(AuthException e) {
        AuthErrorKind kind = e.kind();
        return ResponseEntity.status(kind.httpStatus())
                .body(new CredentialModels.ErrorResponse(kind.name(), e.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<CredentialModels.ErrorResponse> onUnexpected(RuntimeException e) {
        logger.error("Unhandled error while issuing credentials", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new CredentialModels.ErrorResponse(AuthErrorKind.UPSTREAM_FAILURE.name(), "Internal error"));
    }
}
