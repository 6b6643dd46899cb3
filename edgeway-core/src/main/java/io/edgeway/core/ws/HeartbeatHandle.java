package io.edgeway.core.ws;

public interface HeartbeatHandle {

    void cancel();

    boolean isCancelled();
}
