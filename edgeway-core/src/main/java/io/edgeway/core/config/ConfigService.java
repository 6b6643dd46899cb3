package io.edgeway.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.edgeway.core.config.model.GatewayConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public GatewayConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return GatewayConfig.defaults();
        }

        JsonNode fileNode = mapper.readTree(Files.readString(configPath));
        if (fileNode != null && !fileNode.isNull() && !fileNode.isObject()) {
            throw new IOException("Config " + configPath + " must contain a JSON object");
        }
        JsonNode layered = layer(mapper.valueToTree(GatewayConfig.defaults()), fileNode);
        GatewayConfig config = mapper.treeToValue(layered, GatewayConfig.class);

        List<String> problems = validate(config);
        if (!problems.isEmpty()) {
            throw new IOException("Invalid config " + configPath + ": " + String.join("; ", problems));
        }
        return config;
    }

    public void save(Path configPath, GatewayConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean exists = Files.exists(configPath);
        GatewayConfig config = exists && !overwrite ? load(configPath) : GatewayConfig.defaults();
        save(configPath, config);
        return new InitResult(configPath, !exists, exists && overwrite);
    }

    public String toPrettyJson(GatewayConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    static List<String> validate(GatewayConfig config) {
        List<String> problems = new ArrayList<>();
        int port = config.server().port();
        if (port < 0 || port > 65_535) {
            problems.add("server.port must be between 0 and 65535");
        }
        if (config.admission().maxPerUser() <= 0 || config.admission().maxGlobal() <= 0) {
            problems.add("admission limits must be positive");
        }
        if (config.rateLimit().maxPerSecond() <= 0 || config.rateLimit().maxPerMinute() <= 0) {
            problems.add("rate_limit values must be positive");
        }
        String wsPath = config.websocket().path();
        if (wsPath == null || !wsPath.startsWith("/")) {
            problems.add("websocket.path must start with '/'");
        }
        return problems;
    }

    private static JsonNode layer(JsonNode defaults, JsonNode fromFile) {
        if (fromFile == null || fromFile.isNull()) {
            return defaults;
        }
        if (defaults == null || !defaults.isObject() || !fromFile.isObject()) {
            return fromFile;
        }

        ObjectNode result = ((ObjectNode) defaults).deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = fromFile.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = canonicalKey(result, field.getKey());
            result.set(key, layer(result.get(key), field.getValue()));
        }
        return result;
    }

    private static String canonicalKey(ObjectNode known, String key) {
        if (known.has(key) || key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder camel = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                camel.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        String candidate = camel.toString();
        return known.has(candidate) ? candidate : key;
    }
}
