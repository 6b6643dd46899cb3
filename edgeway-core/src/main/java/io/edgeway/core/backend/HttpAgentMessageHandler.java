package io.edgeway.core.backend;

import io.edgeway.core.auth.AuthContext;
import io.edgeway.core.spi.AgentMessageHandler;
import io.edgeway.core.spi.DependencyUnavailableException;
import io.edgeway.core.ws.AgentMessage;
import io.edgeway.core.ws.ResponseFrame;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HttpAgentMessageHandler implements AgentMessageHandler {
    private static final Logger LOG = LoggerFactory.getLogger(HttpAgentMessageHandler.class);

    private final BackendHttpClient client;
    private final String agentPath;

    public HttpAgentMessageHandler(BackendHttpClient client, String agentPath) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.agentPath = agentPath == null ? "" : agentPath;
    }

    @Override
    public void open(String connectionId, String sessionKey) throws DependencyUnavailableException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("connection_id", connectionId);
        body.put("session_token", sessionKey);
        call(agentPath + "/connections", body);
    }

    @Override
    public ResponseFrame handle(AgentMessage message, AuthContext authContext, String connectionId)
        throws DependencyUnavailableException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("connection_id", connectionId);
        body.put("message", message);
        body.put("user_context", authContext == null ? null : authContext.toUserContext(null));
        Map<String, Object> payload = call(agentPath + "/messages", body);
        if (!BackendHttpClient.ok(payload)) {
            Object error = payload.getOrDefault("error", "Agent request failed");
            return ResponseFrame.error(String.valueOf(error), message);
        }
        return client.mapper().convertValue(BackendHttpClient.body(payload), ResponseFrame.class);
    }

    @Override
    public void release(String connectionId) {
        try {
            client.delete(agentPath + "/connections/" + connectionId);
        } catch (IOException e) {
            LOG.warn("Failed to release agent connection {}: {}", connectionId, e.getMessage());
        }
    }

    private Map<String, Object> call(String path, Map<String, Object> body) throws DependencyUnavailableException {
        Map<String, Object> payload;
        try {
            payload = client.post(path, Map.of(), body);
        } catch (IOException e) {
            throw new DependencyUnavailableException("Agent service unreachable: " + e.getMessage(), e);
        }
        int status = BackendHttpClient.status(payload);
        if (status >= 500) {
            throw new DependencyUnavailableException("Agent service returned HTTP " + status);
        }
        return payload;
    }
}
