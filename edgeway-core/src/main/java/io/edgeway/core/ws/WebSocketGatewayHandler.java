package io.edgeway.core.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.edgeway.core.admission.AdmissionController;
import io.edgeway.core.admission.AdmitResult;
import io.edgeway.core.auth.AuthContext;
import io.edgeway.core.auth.AuthException;
import io.edgeway.core.auth.AuthResolver;
import io.edgeway.core.auth.AuthServiceUnavailableException;
import io.edgeway.core.auth.AuthenticationRequiredException;
import io.edgeway.core.ratelimit.RateLimiter;
import io.edgeway.core.security.OriginValidator;
import io.edgeway.core.security.SessionKeys;
import io.edgeway.core.spi.AgentMessageHandler;
import io.edgeway.core.spi.DependencyUnavailableException;
import io.edgeway.core.spi.GatewayDependencies;
import io.edgeway.core.spi.SessionRegistry;
import io.edgeway.core.telemetry.TelemetryEvents;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Frames of one connection are processed by at most one task at a time, in arrival order. Every
 * exit path goes through {@link #closeConnection(Connection, int, String)}, which runs once.
 */
public final class WebSocketGatewayHandler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketGatewayHandler.class);
    static final String RATE_LIMIT_MESSAGE = "Rate limit exceeded. Please slow down your requests.";

    private final WebSocketSettings settings;
    private final OriginValidator originValidator;
    private final AdmissionController admission;
    private final RateLimiter rateLimiter;
    private final AuthResolver authResolver;
    private final GatewayDependencies dependencies;
    private final HeartbeatScheduler heartbeatScheduler;
    private final Executor executor;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    public WebSocketGatewayHandler(
        WebSocketSettings settings,
        OriginValidator originValidator,
        AdmissionController admission,
        RateLimiter rateLimiter,
        AuthResolver authResolver,
        GatewayDependencies dependencies,
        HeartbeatScheduler heartbeatScheduler,
        Executor executor,
        Clock clock,
        ObjectMapper mapper
    ) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.originValidator = Objects.requireNonNull(originValidator, "originValidator must not be null");
        this.admission = Objects.requireNonNull(admission, "admission must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.authResolver = Objects.requireNonNull(authResolver, "authResolver must not be null");
        this.dependencies = Objects.requireNonNull(dependencies, "dependencies must not be null");
        this.heartbeatScheduler = Objects.requireNonNull(heartbeatScheduler, "heartbeatScheduler must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public Optional<Connection> onOpen(GatewaySocket socket, String origin, String sessionToken) {
        Objects.requireNonNull(socket, "socket must not be null");
        if (!originValidator.validate(origin)) {
            LOG.warn("WebSocket connection rejected: origin {} not allowed", origin);
            reject(socket, CloseCodes.ORIGIN_REJECTED, "Origin not allowed", "origin_not_allowed", origin);
            return Optional.empty();
        }

        String token = sessionToken == null || sessionToken.isBlank() ? null : sessionToken.trim();
        String sessionKey = SessionKeys.normalize(token);
        AdmitResult admit = admission.tryAdmit(sessionKey);
        if (!admit.accepted()) {
            if (admit.reason() == AdmitResult.RejectReason.PER_SESSION_LIMIT) {
                reject(socket, CloseCodes.PER_SESSION_LIMIT, "Connection limit exceeded", "per_session_limit", origin);
            } else {
                reject(socket, CloseCodes.SERVER_AT_CAPACITY, "Server at capacity", "server_at_capacity", origin);
            }
            return Optional.empty();
        }

        Connection connection = new Connection(
            UUID.randomUUID().toString(),
            sessionKey,
            token,
            origin,
            clock.instant(),
            socket,
            settings.inboxCapacity()
        );
        connections.put(connection.id(), connection);

        Map<String, Object> tags = new LinkedHashMap<>();
        tags.put("session_token", SessionKeys.mask(sessionKey));
        tags.put("origin", origin == null ? "unknown" : origin);
        tags.put("global_connections", admission.globalCount());
        emit(TelemetryEvents.CONNECTION_ACCEPTED, tags);
        LOG.info(
            "WebSocket connection {} accepted (session {}, origin {}, global connections {})",
            connection.id(),
            SessionKeys.mask(sessionKey),
            origin,
            admission.globalCount()
        );

        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("connection_id", connection.id());
            send(connection, ResponseFrame.system(settings.welcomeMessage(), data));
            HeartbeatHandle heartbeat = heartbeatScheduler.start(
                connection.id(),
                () -> heartbeatTick(connection),
                settings.heartbeatInterval()
            );
            if (!connection.attachHeartbeat(heartbeat)) {
                heartbeat.cancel();
            }
        } catch (IOException | RuntimeException e) {
            LOG.error("WebSocket setup failed for connection {}", connection.id(), e);
            closeConnection(connection, CloseCodes.INTERNAL_ERROR, "Setup failed: " + e.getMessage());
            return Optional.empty();
        }
        return Optional.of(connection);
    }

    public void onText(Connection connection, String text) {
        if (connection.state().isTerminating()) {
            return;
        }
        if (!connection.offer(text)) {
            LOG.warn("Inbound queue full for connection {}, closing", connection.id());
            closeConnection(connection, CloseCodes.RATE_LIMITED, "Inbound queue overflow");
            return;
        }
        scheduleDrain(connection);
    }

    public void onClosed(Connection connection, int code) {
        closeConnection(connection, code, "Closed by peer");
    }

    public void closeConnection(Connection connection, int code, String reason) {
        if (!connection.beginCleanup()) {
            return;
        }
        LOG.info("Closing WebSocket connection {} ({}: {})", connection.id(), code, reason);

        HeartbeatHandle heartbeat = connection.detachHeartbeat();
        if (heartbeat != null) {
            try {
                heartbeat.cancel();
            } catch (RuntimeException e) {
                LOG.warn("Failed to cancel heartbeat for connection {}", connection.id(), e);
            }
        }
        try {
            admission.release(connection.sessionKey());
        } catch (RuntimeException e) {
            LOG.warn("Failed to release admission for connection {}", connection.id(), e);
        }
        if (connection.sessionLinked()) {
            dependencies.sessionRegistry().ifPresent(registry -> unlinkSession(registry, connection));
        }
        if (connection.handlerOpened()) {
            dependencies.agentMessageHandler().ifPresent(handler -> releaseAgent(handler, connection));
        }
        connection.clearInbox();
        try {
            if (connection.socket().isOpen()) {
                connection.socket().close(code, reason);
            }
        } catch (RuntimeException e) {
            LOG.warn("Failed to close socket for connection {}", connection.id(), e);
        }
        connection.markClosed();
        connections.remove(connection.id());

        Map<String, Object> tags = new LinkedHashMap<>();
        tags.put("connection_id", connection.id());
        tags.put("code", code);
        tags.put("duration_ms", Duration.between(connection.openedAt(), clock.instant()).toMillis());
        emit(TelemetryEvents.CONNECTION_CLOSED, tags);
    }

    public Optional<Connection> connection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public int connectionCount() {
        return connections.size();
    }

    public Map<ConnectionState, Integer> connectionsByState() {
        Map<ConnectionState, Integer> counts = new EnumMap<>(ConnectionState.class);
        for (ConnectionState state : ConnectionState.values()) {
            counts.put(state, 0);
        }
        for (Connection connection : connections.values()) {
            counts.merge(connection.state(), 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public void close() {
        List<Connection> open = new ArrayList<>(connections.values());
        for (Connection connection : open) {
            closeConnection(connection, CloseCodes.GOING_AWAY, "Server shutting down");
        }
    }

    private void scheduleDrain(Connection connection) {
        if (!connection.tryStartDrain()) {
            return;
        }
        try {
            executor.execute(() -> drain(connection));
        } catch (RejectedExecutionException e) {
            connection.endDrain();
            LOG.warn("Executor rejected frames for connection {}", connection.id(), e);
            closeConnection(connection, CloseCodes.GOING_AWAY, "Server shutting down");
        }
    }

    private void drain(Connection connection) {
        try {
            String frame;
            while ((frame = connection.pollFrame()) != null) {
                if (connection.state().isTerminating()) {
                    connection.clearInbox();
                    return;
                }
                processFrame(connection, frame);
            }
        } catch (IOException | RuntimeException e) {
            failLoop(connection, e);
        } finally {
            connection.endDrain();
            if (connection.hasPendingFrames() && !connection.state().isTerminating()) {
                scheduleDrain(connection);
            }
        }
    }

    void processFrame(Connection connection, String raw) throws IOException {
        AgentMessage message;
        try {
            message = mapper.readValue(raw, AgentMessage.class);
        } catch (JsonProcessingException e) {
            LOG.debug("Invalid frame on connection {}: {}", connection.id(), e.getOriginalMessage());
            message = null;
        }
        if (message == null) {
            send(connection, ResponseFrame.error("Invalid message format: expected a JSON object", null));
            return;
        }

        if (message.isHeartbeat()) {
            handleHeartbeat(connection, message);
            return;
        }

        if (!rateLimiter.checkAndRecord(connection.sessionKey())) {
            try {
                send(connection, ResponseFrame.error(RATE_LIMIT_MESSAGE, message));
            } catch (IOException e) {
                LOG.debug("Could not deliver rate limit notice to {}: {}", connection.id(), e.getMessage());
            }
            closeConnection(connection, CloseCodes.RATE_LIMITED, "Rate limit exceeded");
            return;
        }

        Map<String, Object> tags = new LinkedHashMap<>();
        tags.put("agent_type", message.agentTypeOrUnknown());
        tags.put("pillar", message.pillar() == null ? "none" : message.pillar());
        tags.put("connection_id", connection.id());
        emit(TelemetryEvents.MESSAGE_RECEIVED, tags);

        String invalid = message.validationError();
        if (invalid != null) {
            send(connection, ResponseFrame.error(invalid, message));
            return;
        }

        if (!ensureSetup(connection, message)) {
            return;
        }
        forward(connection, message);
    }

    private void handleHeartbeat(Connection connection, AgentMessage message) throws IOException {
        if (message.isPong()) {
            connection.recordHeartbeat(clock.instant());
            LOG.debug("Heartbeat pong from connection {}", connection.id());
        } else if (message.isPing()) {
            send(connection, ResponseFrame.heartbeat("pong"));
        } else {
            LOG.debug("Ignoring heartbeat action '{}' from connection {}", message.action(), connection.id());
        }
    }

    private boolean ensureSetup(Connection connection, AgentMessage message) throws IOException {
        if (connection.state() == ConnectionState.ACTIVE) {
            return true;
        }
        int attempt = connection.recordSetupAttempt();
        try {
            AgentMessageHandler handler = dependencies.agentMessageHandler()
                .orElseThrow(() -> new DependencyUnavailableException("Agent message handler is not available"));
            if (!connection.handlerOpened()) {
                handler.open(connection.id(), connection.sessionKey());
                if (!connection.markHandlerOpened()) {
                    // peer left while open() was in flight; cleanup has already run
                    releaseAgent(handler, connection);
                    return false;
                }
            }
            if (!linkSession(connection)) {
                return false;
            }
            AuthContext context = authenticate(connection);
            connection.activate(context);
            if (connection.state().isTerminating()) {
                return false;
            }
            LOG.info(
                "Connection {} active after {} setup attempt(s) (user {})",
                connection.id(),
                attempt,
                context == null ? SessionKeys.ANONYMOUS : context.userId()
            );
            return true;
        } catch (DependencyUnavailableException | AuthException | RuntimeException e) {
            if (!connection.moveTo(ConnectionState.DEGRADED)) {
                LOG.debug("Setup attempt {} for closed connection {} abandoned: {}", attempt, connection.id(), e.getMessage());
                return false;
            }
            LOG.warn("Setup attempt {} failed for connection {}: {}", attempt, connection.id(), e.getMessage());
            send(connection, ResponseFrame.error("Agent service is not ready: " + e.getMessage() + ". Please retry.", message));
            return false;
        }
    }

    private boolean linkSession(Connection connection) {
        Optional<SessionRegistry> registry = dependencies.sessionRegistry();
        if (registry.isEmpty() || connection.sessionLinked() || connection.sessionToken() == null) {
            return true;
        }
        try {
            registry.get().link(connection.id(), connection.sessionToken());
        } catch (DependencyUnavailableException | RuntimeException e) {
            LOG.warn("Failed to link WebSocket {} to session: {}", connection.id(), e.getMessage());
            return true;
        }
        if (!connection.markSessionLinked()) {
            unlinkSession(registry.get(), connection);
            return false;
        }
        return true;
    }

    private void unlinkSession(SessionRegistry registry, Connection connection) {
        try {
            registry.unlink(connection.id());
        } catch (RuntimeException e) {
            LOG.warn("Failed to unlink WebSocket {} from session", connection.id(), e);
        }
    }

    private void releaseAgent(AgentMessageHandler handler, Connection connection) {
        try {
            handler.release(connection.id());
        } catch (RuntimeException e) {
            LOG.warn("Failed to release agent connection {}", connection.id(), e);
        }
    }

    private AuthContext authenticate(Connection connection) throws AuthException {
        String token = connection.sessionToken();
        if (token == null) {
            if (settings.requireAuth()) {
                throw new AuthenticationRequiredException("Authentication required");
            }
            return null;
        }
        if (!authResolver.validatorAvailable()) {
            if (settings.requireAuth()) {
                throw new AuthServiceUnavailableException("Token validation is not available");
            }
            LOG.debug("No token validator configured, connection {} continues without identity", connection.id());
            return null;
        }
        return authResolver.resolveFromToken(token);
    }

    private void forward(Connection connection, AgentMessage message) throws IOException {
        if (connection.state().isTerminating()) {
            return;
        }
        Optional<AgentMessageHandler> handler = dependencies.agentMessageHandler();
        if (handler.isEmpty()) {
            connection.transition(ConnectionState.ACTIVE, ConnectionState.DEGRADED);
            send(connection, ResponseFrame.error("Agent message handler is not available", message));
            return;
        }
        ResponseFrame reply;
        try {
            reply = handler.get().handle(message, connection.authContext(), connection.id());
        } catch (DependencyUnavailableException e) {
            connection.transition(ConnectionState.ACTIVE, ConnectionState.DEGRADED);
            LOG.warn("Agent service unavailable for connection {}: {}", connection.id(), e.getMessage());
            send(connection, ResponseFrame.error("Agent service is temporarily unavailable: " + e.getMessage(), message));
            return;
        } catch (RuntimeException e) {
            LOG.error("Agent handler failed for connection {}", connection.id(), e);
            send(connection, ResponseFrame.error("Internal error: " + e.getMessage(), message));
            return;
        }
        if (reply == null) {
            send(connection, ResponseFrame.error("Agent returned no response", message));
            return;
        }
        send(connection, reply.withDefaultsFrom(message));
    }

    private void heartbeatTick(Connection connection) {
        if (connection.state().isTerminating()) {
            return;
        }
        Instant now = clock.instant();
        Duration silence = Duration.between(connection.lastActivity(), now);
        if (silence.compareTo(settings.staleAfter()) > 0) {
            LOG.info("Connection {} stale, no heartbeat for {} s", connection.id(), silence.toSeconds());
            closeConnection(connection, CloseCodes.GOING_AWAY, "Heartbeat timeout");
            return;
        }
        try {
            send(connection, ResponseFrame.heartbeat("ping"));
            connection.recordPingSent(clock.instant());
        } catch (IOException e) {
            LOG.debug("Heartbeat send failed for connection {}: {}", connection.id(), e.getMessage());
            closeConnection(connection, CloseCodes.GOING_AWAY, "Heartbeat send failed");
        }
    }

    private void failLoop(Connection connection, Exception error) {
        LOG.error("Error in WebSocket message loop for connection {}", connection.id(), error);
        try {
            send(connection, ResponseFrame.error("Internal error: " + error.getMessage(), null));
        } catch (IOException | RuntimeException e) {
            LOG.debug("Could not deliver error frame to {}: {}", connection.id(), e.getMessage());
        }
        closeConnection(connection, CloseCodes.INTERNAL_ERROR, "Internal error");
    }

    private void reject(GatewaySocket socket, int code, String reason, String tag, String origin) {
        try {
            socket.close(code, reason);
        } catch (RuntimeException e) {
            LOG.warn("Failed to close rejected socket", e);
        }
        Map<String, Object> tags = new LinkedHashMap<>();
        tags.put("reason", tag);
        tags.put("code", code);
        tags.put("origin", origin == null ? "unknown" : origin);
        emit(TelemetryEvents.CONNECTION_REJECTED, tags);
    }

    private void send(Connection connection, ResponseFrame frame) throws IOException {
        connection.socket().send(mapper.writeValueAsString(frame));
    }

    private void emit(String name, Map<String, Object> tags) {
        try {
            dependencies.telemetry().recordEvent(name, tags);
        } catch (RuntimeException e) {
            LOG.debug("Telemetry event {} dropped: {}", name, e.getMessage());
        }
    }
}
