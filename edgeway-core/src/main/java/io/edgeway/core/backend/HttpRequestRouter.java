package io.edgeway.core.backend;

import io.edgeway.core.auth.AuthContext;
import io.edgeway.core.http.RequestEnvelope;
import io.edgeway.core.spi.RequestRouter;
import io.edgeway.core.spi.RoutingException;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;

public final class HttpRequestRouter implements RequestRouter {
    private final BackendHttpClient client;
    private final String routePath;

    public HttpRequestRouter(BackendHttpClient client, String routePath) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.routePath = routePath == null ? "" : routePath;
    }

    @Override
    public Map<String, Object> route(RequestEnvelope envelope, AuthContext authContext) throws RoutingException {
        Map<String, Object> payload;
        try {
            payload = client.post(routePath, Map.of(), envelope.toRouterPayload());
        } catch (IOException e) {
            throw new RoutingException("Backend unreachable: " + e.getMessage(), e);
        }
        int status = BackendHttpClient.status(payload);
        if (status >= 500) {
            throw new RoutingException("Backend returned HTTP " + status);
        }
        return BackendHttpClient.body(payload);
    }
}
