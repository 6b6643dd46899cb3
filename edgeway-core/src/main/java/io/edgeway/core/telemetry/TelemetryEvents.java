package io.edgeway.core.telemetry;

public final class TelemetryEvents {
    public static final String CONNECTION_ACCEPTED = "websocket.connection.accepted";
    public static final String CONNECTION_REJECTED = "websocket.connection.rejected";
    public static final String CONNECTION_CLOSED = "websocket.connection.closed";
    public static final String MESSAGE_RECEIVED = "websocket.message.received";
    public static final String HTTP_REQUEST_ROUTED = "http.request.routed";

    private TelemetryEvents() {
    }
}
