package io.edgeway.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.edgeway.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliCommandsTest {

    @TempDir
    Path tempDir;

    @Test
    void initShouldWriteDefaultConfig() throws Exception {
        Path configPath = tempDir.resolve(".edgeway/config.json");
        CliContext context = new CliContext(new ConfigService(), configPath);

        String output = captureOut(() -> assertThat(new CommandLine(new InitCommand(context)).execute()).isZero());

        assertThat(output).contains("Created config");
        assertThat(Files.readString(configPath)).contains("\"rate_limit\"");
    }

    @Test
    void statusShouldSummarizeEffectiveConfig() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "server": { "port": 9100 },
              "admission": { "maxPerUser": 2 }
            }
            """, StandardCharsets.UTF_8);
        CliContext context = new CliContext(new ConfigService(), tempDir.resolve("unused.json"));

        String output = captureOut(() ->
            assertThat(new CommandLine(new StatusCommand(context)).execute("--config", configPath.toString())).isZero()
        );

        assertThat(output)
            .contains("Config exists: true")
            .contains(":9100")
            .contains("2 per session")
            .contains("Backend configured: false");
    }

    @Test
    void statusJsonPrintsFullConfig() throws Exception {
        CliContext context = new CliContext(new ConfigService(), tempDir.resolve("missing.json"));

        String output = captureOut(() -> assertThat(new CommandLine(new StatusCommand(context)).execute("--json")).isZero());

        assertThat(output).contains("\"websocket\"").contains("\"admission\"");
    }

    @Test
    void gatewayShouldPassOverridesToRunner() {
        List<Object> seen = new ArrayList<>();
        Path configPath = tempDir.resolve("config.json");
        CliContext context = new CliContext(new ConfigService(), configPath, (path, host, port) -> {
            seen.add(path);
            seen.add(host);
            seen.add(port);
            return 0;
        });

        int code = new CommandLine(new GatewayCommand(context)).execute("--host", "127.0.0.1", "--port", "9000");

        assertThat(code).isZero();
        assertThat(seen).containsExactly(configPath, "127.0.0.1", 9000);
    }

    @Test
    void gatewayShouldRejectInvalidPortAndReportRunnerFailure() {
        CliContext failing = new CliContext(new ConfigService(), tempDir.resolve("config.json"), (path, host, port) -> {
            throw new IllegalStateException("port in use");
        });

        assertThat(new CommandLine(new GatewayCommand(failing)).execute("--port", "70000")).isEqualTo(2);
        assertThat(new CommandLine(new GatewayCommand(failing)).execute()).isEqualTo(1);
    }

    private static String captureOut(Runnable action) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
