package com.demo.chatrelay.service;

/**
 * The language model backend could not produce a reply.
 */
public class AssistantBackendException extends RuntimeException {

    private final boolean unreachable;

    public AssistantBackendException(String message, boolean unreachable, Throwable cause) {
        super(message, cause);
        this.unreachable = unreachable;
    }

    /**
     * True when no connection to the backend could be made at all.
     */
    public boolean isUnreachable() {
        return unreachable;
    }
}
