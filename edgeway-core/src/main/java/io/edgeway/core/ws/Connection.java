package io.edgeway.core.ws;

import io.edgeway.core.auth.AuthContext;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public final class Connection {
    private final String id;
    private final String sessionKey;
    private final String sessionToken;
    private final String origin;
    private final Instant openedAt;
    private final GatewaySocket socket;
    private final BlockingQueue<String> inbox;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.ACCEPTED);
    private final AtomicBoolean cleanupStarted = new AtomicBoolean(false);
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicInteger setupAttempts = new AtomicInteger();
    private volatile AuthContext authContext;
    private volatile Instant lastHeartbeatAt;
    private volatile Instant lastPingSentAt;
    private HeartbeatHandle heartbeat;
    private boolean handlerOpened;
    private boolean sessionLinked;

    Connection(
        String id,
        String sessionKey,
        String sessionToken,
        String origin,
        Instant openedAt,
        GatewaySocket socket,
        int inboxCapacity
    ) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.sessionKey = Objects.requireNonNull(sessionKey, "sessionKey must not be null");
        this.sessionToken = sessionToken;
        this.origin = origin;
        this.openedAt = Objects.requireNonNull(openedAt, "openedAt must not be null");
        this.socket = Objects.requireNonNull(socket, "socket must not be null");
        this.inbox = new ArrayBlockingQueue<>(Math.max(1, inboxCapacity));
    }

    public String id() {
        return id;
    }

    public String sessionKey() {
        return sessionKey;
    }

    public String sessionToken() {
        return sessionToken;
    }

    public String origin() {
        return origin;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public ConnectionState state() {
        return state.get();
    }

    public AuthContext authContext() {
        return authContext;
    }

    public Instant lastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public Instant lastPingSentAt() {
        return lastPingSentAt;
    }

    public Instant lastActivity() {
        Instant heartbeatAt = lastHeartbeatAt;
        return heartbeatAt == null ? openedAt : heartbeatAt;
    }

    public int setupAttempts() {
        return setupAttempts.get();
    }

    GatewaySocket socket() {
        return socket;
    }

    void recordHeartbeat(Instant at) {
        lastHeartbeatAt = at;
    }

    void recordPingSent(Instant at) {
        lastPingSentAt = at;
    }

    boolean transition(ConnectionState from, ConnectionState to) {
        return state.compareAndSet(from, to);
    }

    boolean moveTo(ConnectionState to) {
        while (true) {
            ConnectionState current = state.get();
            if (current.isTerminating()) {
                return false;
            }
            if (state.compareAndSet(current, to)) {
                return true;
            }
        }
    }

    void markClosed() {
        state.set(ConnectionState.CLOSED);
    }

    boolean beginCleanup() {
        if (!cleanupStarted.compareAndSet(false, true)) {
            return false;
        }
        state.set(ConnectionState.CLOSING);
        return true;
    }

    void activate(AuthContext context) {
        this.authContext = context;
        moveTo(ConnectionState.ACTIVE);
    }

    int recordSetupAttempt() {
        return setupAttempts.incrementAndGet();
    }

    /**
     * @return false when cleanup already started, in which case the caller owns the cancel
     */
    synchronized boolean attachHeartbeat(HeartbeatHandle handle) {
        if (cleanupStarted.get()) {
            return false;
        }
        this.heartbeat = handle;
        return true;
    }

    synchronized HeartbeatHandle detachHeartbeat() {
        HeartbeatHandle handle = heartbeat;
        heartbeat = null;
        return handle;
    }

    boolean offer(String frame) {
        return inbox.offer(frame);
    }

    String pollFrame() {
        return inbox.poll();
    }

    boolean hasPendingFrames() {
        return !inbox.isEmpty();
    }

    void clearInbox() {
        inbox.clear();
    }

    boolean tryStartDrain() {
        return draining.compareAndSet(false, true);
    }

    void endDrain() {
        draining.set(false);
    }

    synchronized boolean handlerOpened() {
        return handlerOpened;
    }

    /**
     * @return false when cleanup already started, in which case the caller owns the release
     */
    synchronized boolean markHandlerOpened() {
        if (cleanupStarted.get()) {
            return false;
        }
        handlerOpened = true;
        return true;
    }

    synchronized boolean sessionLinked() {
        return sessionLinked;
    }

    /**
     * @return false when cleanup already started, in which case the caller owns the unlink
     */
    synchronized boolean markSessionLinked() {
        if (cleanupStarted.get()) {
            return false;
        }
        sessionLinked = true;
        return true;
    }
}
