package io.edgeway.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebSocketConfig(
    String path,
    @JsonAlias({"heartbeat_interval_seconds"}) int heartbeatIntervalSeconds,
    @JsonAlias({"stale_after_seconds"}) int staleAfterSeconds,
    @JsonAlias({"inbox_capacity"}) int inboxCapacity,
    @JsonAlias({"welcome_message"}) String welcomeMessage
) {

    public static WebSocketConfig defaults() {
        return new WebSocketConfig(
            "/ws/agent",
            30,
            90,
            256,
            "Connected to agent gateway"
        );
    }
}
