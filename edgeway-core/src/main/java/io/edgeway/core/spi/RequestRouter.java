package io.edgeway.core.spi;

import io.edgeway.core.auth.AuthContext;
import io.edgeway.core.http.RequestEnvelope;
import java.util.Map;

@FunctionalInterface
public interface RequestRouter {

    Map<String, Object> route(RequestEnvelope envelope, AuthContext authContext) throws RoutingException;
}
