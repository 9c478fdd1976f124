package com.linlay.agentteam.common.exception;

public class ToolBindingException extends TeamAssemblyException {

    public ToolBindingException(String message) {
        super(message);
    }

    public ToolBindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
