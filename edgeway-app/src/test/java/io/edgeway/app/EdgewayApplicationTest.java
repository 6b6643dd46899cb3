package io.edgeway.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.edgeway.core.backend.EchoAgentMessageHandler;
import io.edgeway.core.backend.EchoRequestRouter;
import io.edgeway.core.backend.HttpAgentMessageHandler;
import io.edgeway.core.backend.HttpRequestRouter;
import io.edgeway.core.backend.HttpSessionRegistry;
import io.edgeway.core.backend.HttpTokenValidator;
import io.edgeway.core.config.model.AuthConfig;
import io.edgeway.core.config.model.BackendConfig;
import io.edgeway.core.config.model.GatewayConfig;
import io.edgeway.core.spi.GatewayDependencies;
import java.util.List;
import org.junit.jupiter.api.Test;

class EdgewayApplicationTest {

    @Test
    void shouldFallBackToEchoCollaboratorsWithoutBackend() {
        GatewayDependencies dependencies = EdgewayApplication.buildDependencies(GatewayConfig.defaults());

        assertThat(dependencies.requestRouter()).isInstanceOf(EchoRequestRouter.class);
        assertThat(dependencies.agentMessageHandler().orElseThrow()).isInstanceOf(EchoAgentMessageHandler.class);
        assertThat(dependencies.sessionRegistry()).isEmpty();
        assertThat(dependencies.tokenValidator()).isEmpty();
    }

    @Test
    void shouldWireHttpCollaboratorsWhenConfigured() {
        GatewayConfig defaults = GatewayConfig.defaults();
        GatewayConfig config = new GatewayConfig(
            defaults.server(),
            defaults.origins(),
            defaults.admission(),
            defaults.rateLimit(),
            defaults.websocket(),
            new AuthConfig(List.of(), true, "http://auth:9000/validate", 3),
            defaults.http(),
            new BackendConfig("http://backend:8000", 10, "/route", "/agent", "/sessions")
        );

        GatewayDependencies dependencies = EdgewayApplication.buildDependencies(config);

        assertThat(dependencies.requestRouter()).isInstanceOf(HttpRequestRouter.class);
        assertThat(dependencies.agentMessageHandler().orElseThrow()).isInstanceOf(HttpAgentMessageHandler.class);
        assertThat(dependencies.sessionRegistry().orElseThrow()).isInstanceOf(HttpSessionRegistry.class);
        assertThat(dependencies.tokenValidator().orElseThrow()).isInstanceOf(HttpTokenValidator.class);
    }
}
