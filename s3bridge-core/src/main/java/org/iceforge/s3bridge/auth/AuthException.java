package org.iceforge.s3bridge.auth;

import java.util.Objects;

public class AuthException extends RuntimeException {

    private final AuthErrorKind kind;

    public AuthException(AuthErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public AuthException(AuthErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public AuthErrorKind kind() {
        return kind;
    }

    public boolean retryable() {
        return kind.retryable();
    }

    @Override
    public String toString() {
        return "AuthException{kind=" + kind + ", message=" + getMessage() + "}";
    }
}
