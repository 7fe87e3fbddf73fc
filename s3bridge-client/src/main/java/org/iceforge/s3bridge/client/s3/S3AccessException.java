package org.iceforge.s3bridge.client.s3;

import software.amazon.awssdk.services.s3.model.S3Exception;

/** Storage backend failure. The cause is the SDK exception as the backend reported it. */
public class S3AccessException extends RuntimeException {
    public S3AccessException(String message, Throwable cause) { super(message, cause); }
    public S3AccessException(String message) { super(message); }

    /** HTTP status of the backend error, or -1 when the cause carried none. */
    public int statusCode() {
        return getCause() instanceof S3Exception e ? e.statusCode() : -1;
    }
}
