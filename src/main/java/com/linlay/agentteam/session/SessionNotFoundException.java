package com.linlay.agentteam.session;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String tenantId, String instanceId, String sessionId) {
        super("Session not found: tenantId=" + tenantId + ", instanceId=" + instanceId + ", sessionId=" + sessionId);
    }
}
