package org.iceforge.s3bridge.sts;

public class RoleAssumptionException extends RuntimeException {
    public RoleAssumptionException(String message, Throwable cause) { super(message, cause); }
    public RoleAssumptionException(String message) { super(message); }
}
