package io.edgeway.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RateLimitConfig(
    @JsonAlias({"max_per_second"}) int maxPerSecond,
    @JsonAlias({"max_per_minute"}) int maxPerMinute,
    @JsonAlias({"idle_eviction_seconds"}) int idleEvictionSeconds,
    @JsonAlias({"sweep_interval_seconds"}) int sweepIntervalSeconds
) {

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(10, 100, 300, 60);
    }
}
