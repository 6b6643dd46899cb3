package io.edgeway.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthConfig(
    @JsonAlias({"anonymous_paths"}) List<String> anonymousPaths,
    @JsonAlias({"require_websocket_auth"}) boolean requireWebSocketAuth,
    @JsonAlias({"validator_url"}) String validatorUrl,
    @JsonAlias({"validator_timeout_seconds"}) int validatorTimeoutSeconds
) {

    public static AuthConfig defaults() {
        return new AuthConfig(List.of("session/create-user-session"), false, "", 5);
    }

    public boolean validatorConfigured() {
        return validatorUrl != null && !validatorUrl.isBlank();
    }
}
