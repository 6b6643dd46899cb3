package io.edgeway.core.ws;

public enum ConnectionState {
    ACCEPTED,
    DEGRADED,
    ACTIVE,
    CLOSING,
    CLOSED;

    public boolean isTerminating() {
        return this == CLOSING || this == CLOSED;
    }
}
