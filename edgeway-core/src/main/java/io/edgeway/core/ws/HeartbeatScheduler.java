package io.edgeway.core.ws;

import java.time.Duration;

@FunctionalInterface
public interface HeartbeatScheduler {

    HeartbeatHandle start(String connectionId, Runnable tick, Duration interval);
}
