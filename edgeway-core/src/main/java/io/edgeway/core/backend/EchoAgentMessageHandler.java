package io.edgeway.core.backend;

import io.edgeway.core.auth.AuthContext;
import io.edgeway.core.spi.AgentMessageHandler;
import io.edgeway.core.ws.AgentMessage;
import io.edgeway.core.ws.ResponseFrame;

public final class EchoAgentMessageHandler implements AgentMessageHandler {
    private final String name;

    public EchoAgentMessageHandler(String name) {
        this.name = name;
    }

    @Override
    public ResponseFrame handle(AgentMessage message, AuthContext authContext, String connectionId) {
        return ResponseFrame.response("[" + name + "] " + message.message(), message);
    }
}
