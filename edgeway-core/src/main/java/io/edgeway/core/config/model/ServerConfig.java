package io.edgeway.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(
    String host,
    int port,
    @JsonAlias({"api_prefix"}) String apiPrefix
) {

    public static ServerConfig defaults() {
        return new ServerConfig("0.0.0.0", 8787, "/api/v1");
    }

    public ServerConfig withHost(String newHost) {
        return new ServerConfig(newHost, port, apiPrefix);
    }

    public ServerConfig withPort(int newPort) {
        return new ServerConfig(host, newPort, apiPrefix);
    }

    public String normalizedApiPrefix() {
        String prefix = apiPrefix == null || apiPrefix.isBlank() ? "/api/v1" : apiPrefix.trim();
        if (!prefix.startsWith("/")) {
            prefix = "/" + prefix;
        }
        while (prefix.length() > 1 && prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix;
    }
}
