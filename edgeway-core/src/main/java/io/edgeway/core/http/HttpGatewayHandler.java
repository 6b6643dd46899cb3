package io.edgeway.core.http;

import io.edgeway.core.auth.AuthContext;
import io.edgeway.core.auth.AuthException;
import io.edgeway.core.auth.AuthResolver;
import io.edgeway.core.ratelimit.RateLimiter;
import io.edgeway.core.security.SessionKeys;
import io.edgeway.core.spi.RequestRouter;
import io.edgeway.core.spi.RoutingException;
import io.edgeway.core.telemetry.TelemetryEmitter;
import io.edgeway.core.telemetry.TelemetryEvents;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HttpGatewayHandler {
    private static final Logger LOG = LoggerFactory.getLogger(HttpGatewayHandler.class);
    private static final Set<String> ALLOWED_METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH");
    static final String RATE_LIMIT_MESSAGE = "Rate limit exceeded. Please slow down your requests.";

    private final String apiPrefix;
    private final RequestEnvelopeBuilder envelopeBuilder;
    private final AuthResolver authResolver;
    private final RequestRouter router;
    private final Set<String> anonymousRoutes;
    private final Optional<RateLimiter> rateLimiter;
    private final TelemetryEmitter telemetry;

    public HttpGatewayHandler(
        String apiPrefix,
        RequestEnvelopeBuilder envelopeBuilder,
        AuthResolver authResolver,
        RequestRouter router,
        List<String> anonymousRoutes,
        Optional<RateLimiter> rateLimiter,
        TelemetryEmitter telemetry
    ) {
        this.apiPrefix = Objects.requireNonNull(apiPrefix, "apiPrefix must not be null");
        this.envelopeBuilder = Objects.requireNonNull(envelopeBuilder, "envelopeBuilder must not be null");
        this.authResolver = Objects.requireNonNull(authResolver, "authResolver must not be null");
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.anonymousRoutes = normalizeRoutes(anonymousRoutes);
        this.rateLimiter = rateLimiter == null ? Optional.empty() : rateLimiter;
        this.telemetry = telemetry == null ? TelemetryEmitter.noop() : telemetry;
    }

    public GatewayResponse handle(RawRequest request) {
        String method = request.method().toUpperCase(Locale.ROOT);
        if (!ALLOWED_METHODS.contains(method)) {
            return GatewayResponse.error(405, "method_not_allowed");
        }

        String relative = relativePath(request.path());
        int slash = relative.indexOf('/');
        String pillar = slash < 0 ? relative : relative.substring(0, slash);
        String subPath = slash < 0 ? "" : relative.substring(slash + 1);
        if (pillar.isBlank() || subPath.isBlank()) {
            return GatewayResponse.error(404, "not_found");
        }
        String endpoint = ("/".equals(apiPrefix) ? "" : apiPrefix) + "/" + pillar + "/" + subPath;

        if (rateLimiter.isPresent() && !rateLimiter.get().checkAndRecord(rateLimitKey(request))) {
            return GatewayResponse.error(429, RATE_LIMIT_MESSAGE);
        }

        RequestEnvelope envelope;
        try {
            envelope = envelopeBuilder.build(request, endpoint, pillar, subPath);
        } catch (MalformedRequestException e) {
            LOG.warn("Malformed request {} {}: {}", method, endpoint, e.getMessage());
            return GatewayResponse.error(400, "malformed_request", e.getMessage());
        }

        AuthContext authContext;
        try {
            authContext = authenticate(envelope);
        } catch (AuthException e) {
            LOG.info("Rejected {} {}: {}", method, endpoint, e.getMessage());
            return GatewayResponse.error(e.httpStatus(), e.code(), e.getMessage());
        }
        envelope = envelope.withAuthContext(authContext);

        if (envelope.missingMainFile()) {
            LOG.error("Main file ('file') not found in upload for {}; available files: {}", endpoint, envelope.availableFiles());
            return GatewayResponse.missingMainFile(envelope.availableFiles());
        }

        GatewayResponse response;
        try {
            Map<String, Object> result = router.route(envelope, authContext);
            response = GatewayResponse.ok(result == null ? new LinkedHashMap<>() : result);
        } catch (RoutingException | RuntimeException e) {
            LOG.error("Error routing {} {}", method, endpoint, e);
            response = GatewayResponse.error(500, "Internal server error: " + e.getMessage());
        }
        recordRouted(envelope, response.status());
        return response;
    }

    private AuthContext authenticate(RequestEnvelope envelope) throws AuthException {
        if (!anonymousRoutes.contains(envelope.route())) {
            return authResolver.resolveForHttp(envelope.headers());
        }
        try {
            return authResolver.resolveForHttp(envelope.headers());
        } catch (AuthException e) {
            LOG.debug("Anonymous access to {} ({})", envelope.route(), e.code());
            return null;
        }
    }

    private String relativePath(String path) {
        String raw = path == null ? "" : path;
        if (raw.startsWith(apiPrefix + "/")) {
            raw = raw.substring(apiPrefix.length() + 1);
        } else if (!"/".equals(apiPrefix) || !raw.startsWith("/")) {
            return "";
        } else {
            raw = raw.substring(1);
        }
        while (raw.endsWith("/")) {
            raw = raw.substring(0, raw.length() - 1);
        }
        return raw;
    }

    private static String rateLimitKey(RawRequest request) {
        String sessionToken = request.header(RequestEnvelope.SESSION_TOKEN_HEADER);
        if (!sessionToken.isBlank()) {
            return sessionToken;
        }
        return AuthResolver.bearerToken(request.headers()).orElse(SessionKeys.ANONYMOUS);
    }

    private void recordRouted(RequestEnvelope envelope, int status) {
        Map<String, Object> tags = new LinkedHashMap<>();
        tags.put("endpoint", envelope.endpoint());
        tags.put("method", envelope.method());
        tags.put("status", status);
        tags.put("user_id", envelope.authContext() == null ? SessionKeys.ANONYMOUS : envelope.authContext().userId());
        telemetry.recordEvent(TelemetryEvents.HTTP_REQUEST_ROUTED, tags);
    }

    private static Set<String> normalizeRoutes(List<String> routes) {
        Set<String> normalized = new LinkedHashSet<>();
        if (routes == null) {
            return normalized;
        }
        for (String route : routes) {
            if (route == null) {
                continue;
            }
            String trimmed = route.trim();
            while (trimmed.startsWith("/")) {
                trimmed = trimmed.substring(1);
            }
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            if (!trimmed.isEmpty()) {
                normalized.add(trimmed);
            }
        }
        return normalized;
    }
}
