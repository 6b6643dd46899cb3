package io.edgeway.core.api;

import io.edgeway.core.ws.GatewaySocket;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class UndertowGatewaySocket implements GatewaySocket {
    private static final Logger LOG = LoggerFactory.getLogger(UndertowGatewaySocket.class);
    private static final int MAX_REASON_BYTES = 123;

    private final WebSocketChannel channel;
    private final WebSocketCallback<Void> sendCallback = new WebSocketCallback<>() {
        @Override
        public void complete(WebSocketChannel ws, Void context) {
        }

        @Override
        public void onError(WebSocketChannel ws, Void context, Throwable throwable) {
            LOG.debug("WebSocket send to {} failed: {}", ws.getPeerAddress(), throwable.getMessage());
            try {
                ws.close();
            } catch (IOException e) {
                LOG.debug("Closing failed WebSocket channel raised {}", e.getMessage());
            }
        }
    };

    UndertowGatewaySocket(WebSocketChannel channel) {
        this.channel = channel;
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameSent();
    }

    @Override
    public synchronized void send(String text) throws IOException {
        if (!isOpen()) {
            throw new IOException("WebSocket channel is closed");
        }
        WebSockets.sendText(text, channel, sendCallback);
    }

    @Override
    public void close(int code, String reason) {
        WebSockets.sendClose(code, truncate(reason), channel, null);
    }

    private static String truncate(String reason) {
        String safe = reason == null ? "" : reason;
        while (safe.getBytes(StandardCharsets.UTF_8).length > MAX_REASON_BYTES) {
            safe = safe.substring(0, safe.length() - 1);
        }
        return safe;
    }
}
