package io.edgeway.core.backend;

import io.edgeway.core.auth.AuthContext;
import io.edgeway.core.auth.AuthOrigin;
import io.edgeway.core.auth.AuthServiceUnavailableException;
import io.edgeway.core.auth.InvalidTokenException;
import io.edgeway.core.auth.TokenValidator;
import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HttpTokenValidator implements TokenValidator {
    private static final Logger LOG = LoggerFactory.getLogger(HttpTokenValidator.class);

    private final BackendHttpClient client;

    public HttpTokenValidator(BackendHttpClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public AuthContext validate(String token) throws InvalidTokenException, AuthServiceUnavailableException {
        Map<String, Object> payload;
        try {
            payload = client.post("", Map.of("Authorization", "Bearer " + token), Map.of("token", token));
        } catch (IOException e) {
            LOG.warn("Token validation call to {} failed: {}", client.baseUrl(), e.getMessage());
            throw new AuthServiceUnavailableException("Authentication service not available", e);
        }

        int status = BackendHttpClient.status(payload);
        if (status == 401 || status == 403) {
            throw new InvalidTokenException("Invalid token");
        }
        if (!BackendHttpClient.ok(payload)) {
            LOG.warn("Token validation returned HTTP {}", status);
            throw new AuthServiceUnavailableException("Authentication service returned HTTP " + status);
        }
        if (Boolean.FALSE.equals(payload.get("valid"))) {
            throw new InvalidTokenException("Invalid token");
        }

        String userId = string(payload.get("user_id"));
        if (userId.isBlank()) {
            throw new InvalidTokenException("Token did not resolve to a user");
        }
        return new AuthContext(
            userId,
            string(payload.get("tenant_id")),
            strings(payload.get("roles")),
            strings(payload.get("permissions")),
            AuthOrigin.LOCAL_VALIDATION
        );
    }

    private static String string(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }

    private static Set<String> strings(Object value) {
        Set<String> values = new LinkedHashSet<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                String text = string(item);
                if (!text.isEmpty()) {
                    values.add(text);
                }
            }
        } else if (value instanceof String csv) {
            for (String item : csv.split(",")) {
                if (!item.isBlank()) {
                    values.add(item.trim());
                }
            }
        }
        return values;
    }
}
