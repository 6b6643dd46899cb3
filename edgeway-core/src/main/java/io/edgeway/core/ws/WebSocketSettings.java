package io.edgeway.core.ws;

import io.edgeway.core.config.model.AuthConfig;
import io.edgeway.core.config.model.WebSocketConfig;
import java.time.Duration;
import java.util.Objects;

public record WebSocketSettings(
    Duration heartbeatInterval,
    Duration staleAfter,
    int inboxCapacity,
    String welcomeMessage,
    boolean requireAuth
) {
    public WebSocketSettings {
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval must not be null");
        Objects.requireNonNull(staleAfter, "staleAfter must not be null");
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (staleAfter.compareTo(heartbeatInterval) < 0) {
            throw new IllegalArgumentException("staleAfter must not be shorter than heartbeatInterval");
        }
        inboxCapacity = Math.max(1, inboxCapacity);
        welcomeMessage = welcomeMessage == null || welcomeMessage.isBlank() ? "Connected" : welcomeMessage;
    }

    public static WebSocketSettings fromConfig(WebSocketConfig websocket, AuthConfig auth) {
        return new WebSocketSettings(
            Duration.ofSeconds(Math.max(1, websocket.heartbeatIntervalSeconds())),
            Duration.ofSeconds(Math.max(1, Math.max(websocket.heartbeatIntervalSeconds(), websocket.staleAfterSeconds()))),
            websocket.inboxCapacity(),
            websocket.welcomeMessage(),
            auth.requireWebSocketAuth()
        );
    }
}
