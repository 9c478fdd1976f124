package com.linlay.agentteam.common.exception;

public class ModelBindingException extends TeamAssemblyException {

    public ModelBindingException(String message) {
        super(message);
    }

    public ModelBindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
