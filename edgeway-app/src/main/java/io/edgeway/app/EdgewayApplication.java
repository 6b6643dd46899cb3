package io.edgeway.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.edgeway.cli.CliContext;
import io.edgeway.cli.EdgewayCliCommand;
import io.edgeway.cli.GatewayCommand;
import io.edgeway.cli.InitCommand;
import io.edgeway.cli.StatusCommand;
import io.edgeway.core.api.GatewayServer;
import io.edgeway.core.backend.BackendHttpClient;
import io.edgeway.core.backend.EchoAgentMessageHandler;
import io.edgeway.core.backend.EchoRequestRouter;
import io.edgeway.core.backend.HttpAgentMessageHandler;
import io.edgeway.core.backend.HttpRequestRouter;
import io.edgeway.core.backend.HttpSessionRegistry;
import io.edgeway.core.backend.HttpTokenValidator;
import io.edgeway.core.config.ConfigPaths;
import io.edgeway.core.config.ConfigService;
import io.edgeway.core.config.model.GatewayConfig;
import io.edgeway.core.config.model.ServerConfig;
import io.edgeway.core.spi.GatewayDependencies;
import io.edgeway.core.spi.RequestRouter;
import io.edgeway.core.telemetry.AsyncTelemetryEmitter;
import io.edgeway.core.telemetry.LoggingTelemetryEmitter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class EdgewayApplication {
    private static final Logger LOG = LoggerFactory.getLogger(EdgewayApplication.class);
    private static final int TELEMETRY_QUEUE_CAPACITY = 10_000;

    private EdgewayApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        CliContext context = new CliContext(
            configService,
            ConfigPaths.defaultConfigPath(),
            (configPath, host, port) -> runGateway(configService, configPath, host, port)
        );

        CommandLine commandLine = new CommandLine(new EdgewayCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("gateway", new GatewayCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runGateway(ConfigService configService, Path configPath, String host, Integer port) throws Exception {
        GatewayConfig config = configService.load(configPath);
        ServerConfig server = config.server();
        if (host != null && !host.isBlank()) {
            server = server.withHost(host);
        }
        if (port != null) {
            server = server.withPort(port);
        }
        config = config.withServer(server);

        CountDownLatch shutdown = new CountDownLatch(1);
        try (AsyncTelemetryEmitter telemetry = new AsyncTelemetryEmitter(
                new LoggingTelemetryEmitter(Clock.systemUTC()),
                TELEMETRY_QUEUE_CAPACITY
            );
             GatewayServer gateway = new GatewayServer(config, buildDependencies(config).withTelemetry(telemetry))) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            gateway.start();
            System.out.println("Gateway started on http://" + config.server().host() + ":" + gateway.port());
            System.out.println(
                "Endpoints: " + config.server().normalizedApiPrefix() + "/{pillar}/{path}, WS "
                    + config.websocket().path() + "?session_token=<token>, GET /healthz, GET /gateway/stats"
            );
            shutdown.await();
        }
        return 0;
    }

    static GatewayDependencies buildDependencies(GatewayConfig config) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());

        GatewayDependencies dependencies;
        if (config.backend().configured()) {
            OkHttpClient http = new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(Math.max(1, config.backend().timeoutSeconds())))
                .build();
            BackendHttpClient backend = new BackendHttpClient(http, mapper, config.backend().baseUrl());
            RequestRouter router = new HttpRequestRouter(backend, config.backend().routePath());
            dependencies = GatewayDependencies.of(router)
                .withAgentMessageHandler(new HttpAgentMessageHandler(backend, config.backend().agentPath()))
                .withSessionRegistry(new HttpSessionRegistry(backend, config.backend().sessionPath()));
            LOG.info("Forwarding to backend {}", config.backend().baseUrl());
        } else {
            LOG.warn("No backend configured; requests and agent messages are echoed locally");
            dependencies = GatewayDependencies.of(new EchoRequestRouter())
                .withAgentMessageHandler(new EchoAgentMessageHandler("echo"));
        }

        if (config.auth().validatorConfigured()) {
            OkHttpClient authHttp = new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(Math.max(1, config.auth().validatorTimeoutSeconds())))
                .build();
            dependencies = dependencies.withTokenValidator(
                new HttpTokenValidator(new BackendHttpClient(authHttp, mapper, config.auth().validatorUrl()))
            );
        }
        return dependencies;
    }
}
