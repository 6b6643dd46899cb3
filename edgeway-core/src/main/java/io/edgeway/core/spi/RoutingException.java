package io.edgeway.core.spi;

public final class RoutingException extends Exception {

    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
