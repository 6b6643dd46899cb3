package io.edgeway.core.auth;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AuthResolver {
    private static final Logger LOG = LoggerFactory.getLogger(AuthResolver.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String TENANT_ID_HEADER = "X-Tenant-Id";
    public static final String ROLES_HEADER = "X-User-Roles";
    public static final String PERMISSIONS_HEADER = "X-User-Permissions";
    public static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "bearer ";

    private final Optional<TokenValidator> tokenValidator;

    public AuthResolver(Optional<TokenValidator> tokenValidator) {
        this.tokenValidator = tokenValidator == null ? Optional.empty() : tokenValidator;
    }

    public Optional<AuthContext> resolveFromHeaders(Map<String, String> headers) {
        Map<String, String> lookup = caseInsensitive(headers);
        String userId = trimmed(lookup.get(USER_ID_HEADER));
        if (userId.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new AuthContext(
            userId,
            trimmed(lookup.get(TENANT_ID_HEADER)),
            splitCsv(lookup.get(ROLES_HEADER)),
            splitCsv(lookup.get(PERMISSIONS_HEADER)),
            AuthOrigin.FORWARD_AUTH
        ));
    }

    public AuthContext resolveFromToken(String bearerToken) throws AuthException {
        String token = trimmed(bearerToken);
        if (token.isEmpty()) {
            throw new AuthenticationRequiredException("Authentication required");
        }
        TokenValidator validator = tokenValidator.orElseThrow(
            () -> new AuthServiceUnavailableException("Token validation is not available")
        );
        AuthContext context;
        try {
            context = validator.validate(token);
        } catch (InvalidTokenException | AuthServiceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InvalidTokenException("Token validation failed: " + e.getMessage(), e);
        }
        if (context == null || context.userId().isBlank()) {
            throw new InvalidTokenException("Token did not resolve to a user");
        }
        return context;
    }

    public AuthContext resolveForHttp(Map<String, String> headers) throws AuthException {
        Optional<AuthContext> forwarded = resolveFromHeaders(headers);
        if (forwarded.isPresent()) {
            return forwarded.get();
        }
        Optional<String> token = bearerToken(headers);
        if (token.isEmpty()) {
            LOG.debug("No forwarded identity and no bearer token on request");
            throw new AuthenticationRequiredException("Authentication required");
        }
        return resolveFromToken(token.get());
    }

    public boolean validatorAvailable() {
        return tokenValidator.isPresent();
    }

    public static Optional<String> bearerToken(Map<String, String> headers) {
        String raw = trimmed(caseInsensitive(headers).get(AUTHORIZATION_HEADER));
        if (raw.length() <= BEARER_PREFIX.length() || !raw.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = raw.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    static Set<String> splitCsv(String raw) {
        Set<String> values = new LinkedHashSet<>();
        if (raw == null || raw.isBlank()) {
            return values;
        }
        for (String value : raw.split(",")) {
            String item = value.trim();
            if (!item.isEmpty()) {
                values.add(item);
            }
        }
        return values;
    }

    private static Map<String, String> caseInsensitive(Map<String, String> headers) {
        Map<String, String> lookup = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            lookup.putAll(headers);
        }
        return lookup;
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }
}
