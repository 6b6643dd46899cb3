package io.edgeway.core.telemetry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TelemetryEvent(
    String id,
    Instant timestamp,
    String name,
    Map<String, Object> tags
) {
    public TelemetryEvent {
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }
}
