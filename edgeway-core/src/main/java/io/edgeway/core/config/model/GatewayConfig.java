package io.edgeway.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(
    ServerConfig server,
    OriginConfig origins,
    AdmissionConfig admission,
    @JsonProperty("rate_limit") RateLimitConfig rateLimit,
    WebSocketConfig websocket,
    AuthConfig auth,
    HttpConfig http,
    BackendConfig backend
) {

    public static GatewayConfig defaults() {
        return new GatewayConfig(
            ServerConfig.defaults(),
            OriginConfig.defaults(),
            AdmissionConfig.defaults(),
            RateLimitConfig.defaults(),
            WebSocketConfig.defaults(),
            AuthConfig.defaults(),
            HttpConfig.defaults(),
            BackendConfig.defaults()
        );
    }

    public GatewayConfig withServer(ServerConfig newServer) {
        return new GatewayConfig(newServer, origins, admission, rateLimit, websocket, auth, http, backend);
    }
}
