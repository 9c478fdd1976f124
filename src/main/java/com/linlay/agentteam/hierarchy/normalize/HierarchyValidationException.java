package com.linlay.agentteam.hierarchy.normalize;

/**
 * A single agent or tool entry of a hierarchy payload could not be interpreted. Callers that
 * normalize whole lists recover by dropping the offending entry.
 */
public class HierarchyValidationException extends RuntimeException {

    public HierarchyValidationException(String message) {
        super(message);
    }
}
