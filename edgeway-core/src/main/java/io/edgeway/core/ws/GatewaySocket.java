package io.edgeway.core.ws;

import java.io.IOException;

public interface GatewaySocket {

    boolean isOpen();

    void send(String text) throws IOException;

    void close(int code, String reason);
}
