package io.edgeway.core.auth;

public abstract class AuthException extends Exception {

    protected AuthException(String message) {
        super(message);
    }

    protected AuthException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract int httpStatus();

    public abstract String code();
}
