package com.linlay.agentteam.hierarchy.store;

/**
 * The document store could not read or write a hierarchy record. Not retried here.
 */
public class HierarchyStorageException extends RuntimeException {

    public HierarchyStorageException(String message) {
        super(message);
    }

    public HierarchyStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
