package io.edgeway.core.spi;

public final class DependencyUnavailableException extends Exception {

    public DependencyUnavailableException(String message) {
        super(message);
    }

    public DependencyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
