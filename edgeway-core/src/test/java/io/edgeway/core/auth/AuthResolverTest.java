package io.edgeway.core.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

class AuthResolverTest {

    private static final AuthContext TOKEN_USER =
        new AuthContext("token-user", "tenant-1", Set.of("admin"), Set.of(), AuthOrigin.LOCAL_VALIDATION);

    @Test
    void shouldResolveForwardedHeadersCaseInsensitively() {
        AuthResolver resolver = new AuthResolver(Optional.empty());

        Optional<AuthContext> context = resolver.resolveFromHeaders(Map.of(
            "x-user-id", "u-1",
            "X-TENANT-ID", "t-9",
            "X-User-Roles", "admin, viewer,,",
            "X-User-Permissions", "read"
        ));

        assertThat(context).isPresent();
        assertThat(context.get().userId()).isEqualTo("u-1");
        assertThat(context.get().tenantId()).isEqualTo("t-9");
        assertThat(context.get().roles()).containsExactlyInAnyOrder("admin", "viewer");
        assertThat(context.get().permissions()).containsExactly("read");
        assertThat(context.get().origin()).isEqualTo(AuthOrigin.FORWARD_AUTH);
    }

    @Test
    void headersWithoutUserIdResolveToNothing() {
        AuthResolver resolver = new AuthResolver(Optional.empty());

        assertThat(resolver.resolveFromHeaders(Map.of("X-Tenant-Id", "t"))).isEmpty();
        assertThat(resolver.resolveFromHeaders(Map.of("X-User-Id", "  "))).isEmpty();
    }

    @Test
    void httpResolutionPrefersHeadersOverBearerToken() throws Exception {
        AuthResolver resolver = new AuthResolver(Optional.of(token -> {
            throw new AssertionError("validator must not be called");
        }));

        AuthContext context = resolver.resolveForHttp(Map.of("X-User-Id", "forwarded", "Authorization", "Bearer abc"));

        assertThat(context.userId()).isEqualTo("forwarded");
    }

    @Test
    void httpResolutionFallsBackToBearerToken() throws Exception {
        AuthResolver resolver = new AuthResolver(Optional.of(token -> {
            assertThat(token).isEqualTo("abc");
            return TOKEN_USER;
        }));

        AuthContext context = resolver.resolveForHttp(Map.of("authorization", "bearer abc"));

        assertThat(context).isEqualTo(TOKEN_USER);
    }

    @Test
    void missingCredentialsRequireAuthentication() {
        AuthResolver resolver = new AuthResolver(Optional.of(token -> TOKEN_USER));

        assertThatThrownBy(() -> resolver.resolveForHttp(Map.of()))
            .isInstanceOf(AuthenticationRequiredException.class)
            .satisfies(e -> assertThat(((AuthException) e).httpStatus()).isEqualTo(401));
        assertThatThrownBy(() -> resolver.resolveForHttp(Map.of("Authorization", "Basic xyz")))
            .isInstanceOf(AuthenticationRequiredException.class);
    }

    @Test
    void missingValidatorMeansServiceUnavailable() {
        AuthResolver resolver = new AuthResolver(Optional.empty());

        assertThatThrownBy(() -> resolver.resolveFromToken("abc"))
            .isInstanceOf(AuthServiceUnavailableException.class)
            .satisfies(e -> assertThat(((AuthException) e).httpStatus()).isEqualTo(503));
    }

    @Test
    void validatorFailuresMapToInvalidToken() {
        AuthResolver throwing = new AuthResolver(Optional.of(token -> {
            throw new IllegalStateException("boom");
        }));
        AuthResolver blankUser = new AuthResolver(Optional.of(
            token -> new AuthContext("", "", Set.of(), Set.of(), AuthOrigin.LOCAL_VALIDATION)
        ));

        assertThatThrownBy(() -> throwing.resolveFromToken("abc")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> blankUser.resolveFromToken("abc")).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void userContextRendersSortedRolesAndSession() {
        AuthContext context = new AuthContext("u", "", Set.of("b", "a"), Set.of(), AuthOrigin.FORWARD_AUTH);

        Map<String, Object> rendered = context.toUserContext("sess-1");

        assertThat(rendered).containsEntry("user_id", "u").containsEntry("session_id", "sess-1");
        assertThat(rendered.get("tenant_id")).isNull();
        assertThat(rendered).extractingByKey("roles").asInstanceOf(InstanceOfAssertFactories.LIST).containsExactly("a", "b");
    }
}
