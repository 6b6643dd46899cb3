package io.edgeway.core.http;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.edgeway.core.auth.AuthContext;
import io.edgeway.core.auth.AuthOrigin;
import io.edgeway.core.auth.AuthResolver;
import io.edgeway.core.auth.AuthServiceUnavailableException;
import io.edgeway.core.auth.TokenValidator;
import io.edgeway.core.ratelimit.RateLimiter;
import io.edgeway.core.spi.RequestRouter;
import io.edgeway.core.spi.RoutingException;
import io.edgeway.core.telemetry.TelemetryEvents;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class HttpGatewayHandlerTest {
    private static final AuthContext TOKEN_USER =
        new AuthContext("token-user", "t1", Set.of(), Set.of(), AuthOrigin.LOCAL_VALIDATION);

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final RequestEnvelopeBuilder builder =
        new RequestEnvelopeBuilder(new ObjectMapper(), Duration.ofSeconds(2), executor);
    private final List<String> telemetryEvents = new CopyOnWriteArrayList<>();
    private final AtomicReference<RequestEnvelope> routed = new AtomicReference<>();
    private final AtomicInteger routerCalls = new AtomicInteger();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldRouteAuthenticatedRequestWithForwardedIdentity() {
        HttpGatewayHandler handler = handler(Optional.empty(), recordingRouter(), List.of(), Optional.empty());

        GatewayResponse response = handler.handle(StubRequest.of("POST", "/api/v1/content/parse")
            .header("X-User-Id", "u-1")
            .json("{\"doc\":\"a\"}"));

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.body()).containsEntry("routed", true);
        assertThat(routed.get().endpoint()).isEqualTo("/api/v1/content/parse");
        assertThat(routed.get().pillar()).isEqualTo("content");
        assertThat(routed.get().subPath()).isEqualTo("parse");
        assertThat(routed.get().authContext().userId()).isEqualTo("u-1");
        assertThat(telemetryEvents).containsExactly(TelemetryEvents.HTTP_REQUEST_ROUTED);
    }

    @Test
    void shouldFallBackToBearerToken() {
        TokenValidator validator = token -> TOKEN_USER;
        HttpGatewayHandler handler = handler(Optional.of(validator), recordingRouter(), List.of(), Optional.empty());

        GatewayResponse response = handler.handle(StubRequest.of("GET", "/api/v1/journey/status/42")
            .header("Authorization", "Bearer tok"));

        assertThat(response.status()).isEqualTo(200);
        assertThat(routed.get().subPath()).isEqualTo("status/42");
        assertThat(routed.get().authContext()).isEqualTo(TOKEN_USER);
    }

    @Test
    void missingCredentialsReturn401AndNeverReachRouter() {
        HttpGatewayHandler handler = handler(Optional.empty(), recordingRouter(), List.of(), Optional.empty());

        GatewayResponse response = handler.handle(StubRequest.of("GET", "/api/v1/content/list"));

        assertThat(response.status()).isEqualTo(401);
        assertThat(response.body()).containsEntry("success", false);
        assertThat(routerCalls).hasValue(0);
    }

    @Test
    void validatorOutageReturns503() {
        TokenValidator validator = token -> {
            throw new AuthServiceUnavailableException("validator down");
        };
        HttpGatewayHandler handler = handler(Optional.of(validator), recordingRouter(), List.of(), Optional.empty());

        GatewayResponse response = handler.handle(StubRequest.of("GET", "/api/v1/content/list")
            .header("Authorization", "Bearer tok"));

        assertThat(response.status()).isEqualTo(503);
        assertThat(routerCalls).hasValue(0);
    }

    @Test
    void anonymousRoutesAreRoutedWithoutIdentity() {
        HttpGatewayHandler handler = handler(
            Optional.empty(),
            recordingRouter(),
            List.of("/session/create-user-session"),
            Optional.empty()
        );

        GatewayResponse response = handler.handle(StubRequest.of("POST", "/api/v1/session/create-user-session"));

        assertThat(response.status()).isEqualTo(200);
        assertThat(routed.get().authContext()).isNull();
        assertThat(routed.get().toRouterPayload()).containsEntry("user_id", "anonymous");
    }

    @Test
    void uploadWithEmptyMainFileReturnsStructured400() {
        HttpGatewayHandler handler = handler(Optional.empty(), recordingRouter(), List.of(), Optional.empty());

        GatewayResponse response = handler.handle(StubRequest.of("POST", "/api/v1/content/upload")
            .header("X-User-Id", "u-1")
            .multipart(
                FormPart.file("file", new FileBlob("empty.bin", new byte[0], null)),
                FormPart.file("copybook", new FileBlob("c.cpy", "01".getBytes(StandardCharsets.UTF_8), null))
            ));

        assertThat(response.status()).isEqualTo(400);
        assertThat(response.body())
            .containsEntry("success", false)
            .containsEntry("missing_field", "file")
            .containsEntry("available_files", List.of("copybook"));
        assertThat(response.body().get("error").toString()).contains("Main file");
        assertThat(routerCalls).hasValue(0);
    }

    @Test
    void malformedJsonReturns400() {
        HttpGatewayHandler handler = handler(Optional.empty(), recordingRouter(), List.of(), Optional.empty());

        GatewayResponse response = handler.handle(StubRequest.of("POST", "/api/v1/content/parse")
            .header("X-User-Id", "u-1")
            .json("{oops"));

        assertThat(response.status()).isEqualTo(400);
        assertThat(response.body()).containsEntry("error", "malformed_request");
    }

    @Test
    void routerFailureReturns500() {
        RequestRouter failing = (envelope, auth) -> {
            throw new RoutingException("backend exploded");
        };
        HttpGatewayHandler handler = handler(Optional.empty(), failing, List.of(), Optional.empty());

        GatewayResponse response = handler.handle(StubRequest.of("GET", "/api/v1/content/list")
            .header("X-User-Id", "u-1"));

        assertThat(response.status()).isEqualTo(500);
        assertThat(response.body().get("error").toString()).contains("backend exploded");
    }

    @Test
    void unsupportedMethodAndUnknownPathAreRejected() {
        HttpGatewayHandler handler = handler(Optional.empty(), recordingRouter(), List.of(), Optional.empty());

        assertThat(handler.handle(StubRequest.of("OPTIONS", "/api/v1/content/list")).status()).isEqualTo(405);
        assertThat(handler.handle(StubRequest.of("GET", "/api/v1/content")).status()).isEqualTo(404);
        assertThat(handler.handle(StubRequest.of("GET", "/other/content/list")).status()).isEqualTo(404);
    }

    @Test
    void rateLimitedRequestsReturn429WithoutTelemetry() {
        RateLimiter limiter = new RateLimiter(2, 100, Duration.ofMinutes(5), Clock.systemUTC());
        HttpGatewayHandler handler = handler(Optional.empty(), recordingRouter(), List.of(), Optional.of(limiter));

        List<Integer> statuses = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            statuses.add(handler.handle(StubRequest.of("GET", "/api/v1/content/list")
                .header("X-User-Id", "u-1")
                .header("X-Session-Token", "s-1")).status());
        }

        assertThat(statuses).containsExactly(200, 200, 429);
        assertThat(telemetryEvents).hasSize(2);
    }

    private RequestRouter recordingRouter() {
        return (envelope, auth) -> {
            routerCalls.incrementAndGet();
            routed.set(envelope);
            return Map.of("routed", true);
        };
    }

    private HttpGatewayHandler handler(
        Optional<TokenValidator> validator,
        RequestRouter router,
        List<String> anonymousRoutes,
        Optional<RateLimiter> limiter
    ) {
        return new HttpGatewayHandler(
            "/api/v1",
            builder,
            new AuthResolver(validator),
            router,
            anonymousRoutes,
            limiter,
            (name, tags) -> telemetryEvents.add(name)
        );
    }
}
