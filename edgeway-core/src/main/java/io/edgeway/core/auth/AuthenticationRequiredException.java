package io.edgeway.core.auth;

public final class AuthenticationRequiredException extends AuthException {

    public AuthenticationRequiredException(String message) {
        super(message);
    }

    @Override
    public int httpStatus() {
        return 401;
    }

    @Override
    public String code() {
        return "authentication_required";
    }
}
