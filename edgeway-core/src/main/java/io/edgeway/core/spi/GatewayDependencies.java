package io.edgeway.core.spi;

import io.edgeway.core.auth.TokenValidator;
import io.edgeway.core.telemetry.TelemetryEmitter;
import java.util.Objects;
import java.util.Optional;

public record GatewayDependencies(
    Optional<TokenValidator> tokenValidator,
    RequestRouter requestRouter,
    Optional<AgentMessageHandler> agentMessageHandler,
    Optional<SessionRegistry> sessionRegistry,
    TelemetryEmitter telemetry
) {
    public GatewayDependencies {
        tokenValidator = tokenValidator == null ? Optional.empty() : tokenValidator;
        Objects.requireNonNull(requestRouter, "requestRouter must not be null");
        agentMessageHandler = agentMessageHandler == null ? Optional.empty() : agentMessageHandler;
        sessionRegistry = sessionRegistry == null ? Optional.empty() : sessionRegistry;
        telemetry = telemetry == null ? TelemetryEmitter.noop() : telemetry;
    }

    public static GatewayDependencies of(RequestRouter requestRouter) {
        return new GatewayDependencies(Optional.empty(), requestRouter, Optional.empty(), Optional.empty(), null);
    }

    public GatewayDependencies withTokenValidator(TokenValidator validator) {
        return new GatewayDependencies(Optional.ofNullable(validator), requestRouter, agentMessageHandler, sessionRegistry, telemetry);
    }

    public GatewayDependencies withAgentMessageHandler(AgentMessageHandler handler) {
        return new GatewayDependencies(tokenValidator, requestRouter, Optional.ofNullable(handler), sessionRegistry, telemetry);
    }

    public GatewayDependencies withSessionRegistry(SessionRegistry registry) {
        return new GatewayDependencies(tokenValidator, requestRouter, agentMessageHandler, Optional.ofNullable(registry), telemetry);
    }

    public GatewayDependencies withTelemetry(TelemetryEmitter emitter) {
        return new GatewayDependencies(tokenValidator, requestRouter, agentMessageHandler, sessionRegistry, emitter);
    }
}
