package io.edgeway.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BackendConfig(
    @JsonAlias({"base_url"}) String baseUrl,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds,
    @JsonAlias({"route_path"}) String routePath,
    @JsonAlias({"agent_path"}) String agentPath,
    @JsonAlias({"session_path"}) String sessionPath
) {

    public static BackendConfig defaults() {
        return new BackendConfig("", 30, "/gateway/route", "/gateway/agent", "/gateway/sessions");
    }

    public boolean configured() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
