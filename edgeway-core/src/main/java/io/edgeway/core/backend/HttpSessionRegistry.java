package io.edgeway.core.backend;

import io.edgeway.core.spi.DependencyUnavailableException;
import io.edgeway.core.spi.SessionRegistry;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HttpSessionRegistry implements SessionRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(HttpSessionRegistry.class);

    private final BackendHttpClient client;
    private final String sessionPath;

    public HttpSessionRegistry(BackendHttpClient client, String sessionPath) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.sessionPath = sessionPath == null ? "" : sessionPath;
    }

    @Override
    public void link(String connectionId, String sessionKey) throws DependencyUnavailableException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("action", "link");
        body.put("websocket_id", connectionId);
        body.put("session_id", sessionKey);
        Map<String, Object> payload;
        try {
            payload = client.post(sessionPath, Map.of(), body);
        } catch (IOException e) {
            throw new DependencyUnavailableException("Session service unreachable: " + e.getMessage(), e);
        }
        if (!BackendHttpClient.ok(payload)) {
            throw new DependencyUnavailableException("Session link returned HTTP " + BackendHttpClient.status(payload));
        }
    }

    @Override
    public void unlink(String connectionId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("action", "unlink");
        body.put("websocket_id", connectionId);
        try {
            Map<String, Object> payload = client.post(sessionPath, Map.of(), body);
            if (!BackendHttpClient.ok(payload)) {
                LOG.warn("Session unlink for {} returned HTTP {}", connectionId, BackendHttpClient.status(payload));
            }
        } catch (IOException e) {
            LOG.warn("Failed to unlink WebSocket {} from session: {}", connectionId, e.getMessage());
        }
    }
}
