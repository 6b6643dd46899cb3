package io.edgeway.core.telemetry;

import java.util.Map;

@FunctionalInterface
public interface TelemetryEmitter {

    void recordEvent(String name, Map<String, Object> tags);

    static TelemetryEmitter noop() {
        return (name, tags) -> {
        };
    }
}
