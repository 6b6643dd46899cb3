package io.edgeway.core.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingTelemetryEmitter implements TelemetryEmitter {
    private static final Logger TELEMETRY_LOG = LoggerFactory.getLogger("edgeway.telemetry");

    private final ObjectMapper mapper;
    private final Clock clock;

    public LoggingTelemetryEmitter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void recordEvent(String name, Map<String, Object> tags) {
        if (!TELEMETRY_LOG.isInfoEnabled()) {
            return;
        }
        TelemetryEvent event = new TelemetryEvent(UUID.randomUUID().toString(), clock.instant(), name, tags);
        try {
            TELEMETRY_LOG.info(mapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            TELEMETRY_LOG.warn("Could not serialise telemetry event {}: {}", name, e.getMessage());
        }
    }
}
