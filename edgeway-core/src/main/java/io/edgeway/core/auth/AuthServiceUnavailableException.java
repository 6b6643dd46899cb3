package io.edgeway.core.auth;

public final class AuthServiceUnavailableException extends AuthException {

    public AuthServiceUnavailableException(String message) {
        super(message);
    }

    public AuthServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int httpStatus() {
        return 503;
    }

    @Override
    public String code() {
        return "auth_service_unavailable";
    }
}
