package io.edgeway.core.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public record AuthContext(
    @JsonProperty("user_id") String userId,
    @JsonProperty("tenant_id") String tenantId,
    Set<String> roles,
    Set<String> permissions,
    AuthOrigin origin
) {
    public AuthContext {
        userId = userId == null ? "" : userId.trim();
        tenantId = tenantId == null ? "" : tenantId.trim();
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        origin = origin == null ? AuthOrigin.LOCAL_VALIDATION : origin;
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }

    public Map<String, Object> toUserContext(String sessionToken) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("user_id", userId);
        context.put("tenant_id", tenantId.isBlank() ? null : tenantId);
        context.put("roles", roles.stream().sorted().toList());
        context.put("permissions", permissions.stream().sorted().toList());
        context.put("session_id", sessionToken);
        return context;
    }
}
