package io.edgeway.core.spi;

import io.edgeway.core.auth.AuthContext;
import io.edgeway.core.ws.AgentMessage;
import io.edgeway.core.ws.ResponseFrame;

public interface AgentMessageHandler {

    default void open(String connectionId, String sessionKey) throws DependencyUnavailableException {
    }

    ResponseFrame handle(AgentMessage message, AuthContext authContext, String connectionId)
        throws DependencyUnavailableException;

    default void release(String connectionId) {
    }
}
