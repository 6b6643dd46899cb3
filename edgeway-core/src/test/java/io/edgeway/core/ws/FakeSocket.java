package io.edgeway.core.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

final class FakeSocket implements GatewaySocket {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failSends;
    private volatile int closeCode = -1;
    private volatile String closeReason;
    private volatile int closeCalls;

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String text) throws IOException {
        if (failSends || !open) {
            throw new IOException("socket is gone");
        }
        sent.add(text);
    }

    @Override
    public void close(int code, String reason) {
        closeCalls++;
        closeCode = code;
        closeReason = reason;
        open = false;
    }

    void failSends() {
        failSends = true;
    }

    List<JsonNode> frames() {
        return sent.stream().map(FakeSocket::parse).collect(Collectors.toList());
    }

    List<JsonNode> framesOfType(String type) {
        return frames().stream().filter(frame -> type.equals(frame.path("type").asText())).collect(Collectors.toList());
    }

    JsonNode lastFrame() {
        List<JsonNode> frames = frames();
        return frames.get(frames.size() - 1);
    }

    int closeCode() {
        return closeCode;
    }

    String closeReason() {
        return closeReason;
    }

    int closeCalls() {
        return closeCalls;
    }

    private static JsonNode parse(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
