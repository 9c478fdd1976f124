package com.linlay.agentteam.common.exception;

/**
 * A runtime team could not be assembled from a hierarchy. The request that triggered the
 * assembly fails and no cache entry is left behind.
 */
public class TeamAssemblyException extends RuntimeException {

    public TeamAssemblyException(String message) {
        super(message);
    }

    public TeamAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
