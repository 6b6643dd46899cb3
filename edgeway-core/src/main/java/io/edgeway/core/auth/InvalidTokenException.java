package io.edgeway.core.auth;

public final class InvalidTokenException extends AuthException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int httpStatus() {
        return 401;
    }

    @Override
    public String code() {
        return "invalid_token";
    }
}
