package io.edgeway.core.auth;

@FunctionalInterface
public interface TokenValidator {
    AuthContext validate(String token) throws InvalidTokenException, AuthServiceUnavailableException;
}
