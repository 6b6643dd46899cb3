package io.edgeway.core.spi;

public interface SessionRegistry {

    void link(String connectionId, String sessionKey) throws DependencyUnavailableException;

    void unlink(String connectionId);
}
