package io.edgeway.core.security;

public final class SessionKeys {
    public static final String ANONYMOUS = "anonymous";

    private SessionKeys() {
    }

    public static String normalize(String sessionToken) {
        return sessionToken == null || sessionToken.isBlank() ? ANONYMOUS : sessionToken.trim();
    }

    public static String mask(String sessionKey) {
        if (sessionKey == null || sessionKey.isBlank()) {
            return ANONYMOUS;
        }
        if (ANONYMOUS.equals(sessionKey) || sessionKey.length() <= 8) {
            return sessionKey;
        }
        return sessionKey.substring(0, 6) + "..(" + sessionKey.length() + ")";
    }
}
