package io.edgeway.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.edgeway.core.admission.AdmissionController;
import io.edgeway.core.admission.AdmissionSnapshot;
import io.edgeway.core.auth.AuthResolver;
import io.edgeway.core.config.ConfigPaths;
import io.edgeway.core.config.model.GatewayConfig;
import io.edgeway.core.http.GatewayResponse;
import io.edgeway.core.http.HttpGatewayHandler;
import io.edgeway.core.http.RequestEnvelopeBuilder;
import io.edgeway.core.ratelimit.RateLimiter;
import io.edgeway.core.security.OriginValidator;
import io.edgeway.core.spi.GatewayDependencies;
import io.edgeway.core.ws.Connection;
import io.edgeway.core.ws.ConnectionState;
import io.edgeway.core.ws.ScheduledHeartbeatScheduler;
import io.edgeway.core.ws.WebSocketGatewayHandler;
import io.edgeway.core.ws.WebSocketSettings;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.HttpString;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final HttpString ALLOW_ORIGIN = HttpString.tryFromString("Access-Control-Allow-Origin");
    private static final Map<HttpString, String> CORS_HEADERS = Map.of(
        HttpString.tryFromString("Access-Control-Allow-Methods"), "GET,POST,PUT,DELETE,PATCH,OPTIONS",
        HttpString.tryFromString("Access-Control-Allow-Headers"),
        "Content-Type,Authorization,X-Session-Token,X-User-Id,X-Tenant-Id,X-User-Roles,X-User-Permissions",
        HttpString.tryFromString("Access-Control-Allow-Credentials"), "true",
        HttpString.tryFromString("Access-Control-Max-Age"), "86400"
    );
    private static final String SESSION_TOKEN_PARAM = "session_token";

    private final GatewayConfig config;
    private final ObjectMapper mapper;
    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final OriginValidator originValidator;
    private final AdmissionController admission;
    private final RateLimiter messageRateLimiter;
    private final Optional<RateLimiter> httpRateLimiter;
    private final HttpGatewayHandler httpHandler;
    private final WebSocketGatewayHandler webSocketHandler;
    private final Path uploadTempDir;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(GatewayConfig config, GatewayDependencies dependencies) {
        this(config, dependencies, Clock.systemUTC());
    }

    public GatewayServer(GatewayConfig config, GatewayDependencies dependencies, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(dependencies, "dependencies must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.executor = Executors.newCachedThreadPool(daemonThreads("edgeway-worker"));
        this.scheduler = Executors.newScheduledThreadPool(2, daemonThreads("edgeway-scheduler"));
        this.running = new AtomicBoolean(false);

        this.originValidator = OriginValidator.fromConfig(config.origins());
        this.admission = AdmissionController.fromConfig(config.admission());
        this.messageRateLimiter = RateLimiter.fromConfig(config.rateLimit(), clock);
        this.httpRateLimiter = config.http().rateLimitEnabled()
            ? Optional.of(RateLimiter.fromConfig(config.rateLimit(), clock))
            : Optional.empty();
        AuthResolver authResolver = new AuthResolver(dependencies.tokenValidator());
        this.uploadTempDir = resolveUploadTempDir(config.http().uploadTempDir());

        RequestEnvelopeBuilder envelopeBuilder = new RequestEnvelopeBuilder(
            mapper,
            Duration.ofSeconds(Math.max(1, config.http().jsonParseTimeoutSeconds())),
            executor
        );
        this.httpHandler = new HttpGatewayHandler(
            config.server().normalizedApiPrefix(),
            envelopeBuilder,
            authResolver,
            dependencies.requestRouter(),
            config.auth().anonymousPaths(),
            httpRateLimiter,
            dependencies.telemetry()
        );
        this.webSocketHandler = new WebSocketGatewayHandler(
            WebSocketSettings.fromConfig(config.websocket(), config.auth()),
            originValidator,
            admission,
            messageRateLimiter,
            authResolver,
            dependencies,
            new ScheduledHeartbeatScheduler(scheduler),
            executor,
            clock,
            mapper
        );
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        HttpHandler wsHandler = Handlers.websocket(this::onWebSocketConnect);
        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", getOnly(exchange -> writeJson(exchange, 200, Map.of("status", "ok"))))
            .addExactPath("/gateway/stats", getOnly(exchange -> writeJson(exchange, 200, statsPayload())))
            .addExactPath(config.websocket().path(), wsHandler)
            .addPrefixPath(config.server().normalizedApiPrefix(), this::handleApi);

        server = Undertow.builder()
            .addHttpListener(config.server().port(), config.server().host())
            .setHandler(exchange -> routeAllowingCors(routes, exchange))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, config.server().port());

        long sweepSeconds = Math.max(1, config.rateLimit().sweepIntervalSeconds());
        scheduler.scheduleAtFixedRate(this::sweepRateLimits, sweepSeconds, sweepSeconds, TimeUnit.SECONDS);
        LOG.info(
            "Gateway listening on {}:{} (api {}, websocket {})",
            config.server().host(),
            actualPort,
            config.server().normalizedApiPrefix(),
            config.websocket().path()
        );
    }

    public int port() {
        return actualPort;
    }

    public AdmissionController admission() {
        return admission;
    }

    public WebSocketGatewayHandler webSocketHandler() {
        return webSocketHandler;
    }

    @Override
    public void close() {
        running.set(false);
        webSocketHandler.close();
        if (server != null) {
            server.stop();
        }
        scheduler.shutdownNow();
        executor.shutdownNow();
    }

    private void routeAllowingCors(PathHandler routes, HttpServerExchange exchange) throws Exception {
        String origin = exchange.getRequestHeaders().getFirst(Headers.ORIGIN);
        if (origin != null && !origin.isBlank() && originValidator.validate(origin)) {
            exchange.getResponseHeaders().put(ALLOW_ORIGIN, origin);
            CORS_HEADERS.forEach((name, value) -> exchange.getResponseHeaders().put(name, value));
            exchange.getResponseHeaders().put(Headers.VARY, "Origin");
        }
        if (exchange.getRequestMethod().equals(Methods.OPTIONS)) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private HttpHandler getOnly(HttpHandler delegate) {
        return exchange -> {
            if (exchange.getRequestMethod().equals(Methods.GET)) {
                delegate.handleRequest(exchange);
            } else {
                writeJson(exchange, 405, GatewayResponse.error(405, "Method not allowed").body());
            }
        };
    }

    private Map<String, Object> statsPayload() {
        AdmissionSnapshot snapshot = admission.snapshot();
        Map<String, Object> admissionStats = new LinkedHashMap<>();
        admissionStats.put("global_connections", snapshot.globalCount());
        admissionStats.put("sessions", snapshot.perSessionCount().size());
        admissionStats.put("max_global", admission.maxGlobal());
        admissionStats.put("max_per_session", admission.maxPerSession());

        Map<String, Object> byState = new LinkedHashMap<>();
        for (Map.Entry<ConnectionState, Integer> entry : webSocketHandler.connectionsByState().entrySet()) {
            byState.put(entry.getKey().name().toLowerCase(Locale.ROOT), entry.getValue());
        }
        Map<String, Object> connections = new LinkedHashMap<>();
        connections.put("open", webSocketHandler.connectionCount());
        connections.put("by_state", byState);

        Map<String, Object> rateLimit = new LinkedHashMap<>();
        rateLimit.put("websocket_sessions", messageRateLimiter.trackedSessions());
        rateLimit.put("http_sessions", httpRateLimiter.map(RateLimiter::trackedSessions).orElse(0));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("admission", admissionStats);
        payload.put("connections", connections);
        payload.put("rate_limit", rateLimit);
        return payload;
    }

    private void handleApi(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleApi(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        exchange.startBlocking();
        GatewayResponse response = httpHandler.handle(new UndertowRawRequest(exchange, uploadTempDir));
        writeJson(exchange, response.status(), response.body());
    }

    private void onWebSocketConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        String origin = exchange.getRequestHeader("Origin");
        Optional<Connection> admitted = webSocketHandler.onOpen(
            new UndertowGatewaySocket(channel),
            origin,
            firstParam(exchange, SESSION_TOKEN_PARAM)
        );
        if (admitted.isEmpty()) {
            return;
        }
        Connection connection = admitted.get();
        channel.getCloseSetter().set(closed -> webSocketHandler.onClosed(connection, channel.getCloseCode()));
        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel wsChannel, BufferedTextMessage message) {
                webSocketHandler.onText(connection, message.getData());
            }
        });
        channel.resumeReceives();
    }

    private void sweepRateLimits() {
        try {
            messageRateLimiter.sweep();
            httpRateLimiter.ifPresent(RateLimiter::sweep);
        } catch (RuntimeException e) {
            LOG.warn("Rate limit sweep failed", e);
        }
    }

    private void writeJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] json = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders()
            .put(Headers.CONTENT_TYPE, "application/json; charset=utf-8")
            .put(Headers.CONTENT_LENGTH, json.length);
        exchange.getResponseSender().send(ByteBuffer.wrap(json));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.error("Unhandled error on {} {}", exchange.getRequestMethod(), exchange.getRequestPath(), error);
        try {
            writeJson(exchange, 500, GatewayResponse.error(500, "Internal server error: " + error.getMessage()).body());
        } catch (IOException e) {
            LOG.debug("Could not send error response: {}", e.getMessage());
        }
    }

    private static String firstParam(WebSocketHttpExchange exchange, String key) {
        List<String> values = exchange.getRequestParameters().get(key);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static Path resolveUploadTempDir(String configured) {
        if (configured == null || configured.isBlank()) {
            return Path.of(System.getProperty("java.io.tmpdir"), "edgeway-uploads");
        }
        return ConfigPaths.expandHome(configured);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}
