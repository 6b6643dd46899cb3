package io.edgeway.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HttpConfig(
    @JsonAlias({"json_parse_timeout_seconds"}) int jsonParseTimeoutSeconds,
    @JsonAlias({"rate_limit_enabled"}) boolean rateLimitEnabled,
    @JsonAlias({"upload_temp_dir"}) String uploadTempDir
) {

    public static HttpConfig defaults() {
        return new HttpConfig(10, false, "");
    }
}
