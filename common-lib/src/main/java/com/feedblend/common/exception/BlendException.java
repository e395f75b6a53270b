package com.feedblend.common.exception;

/**
 * Base type for caller configuration errors raised by the ranking-and-injection engine.
 *
 * <p>Carries the name of the component that rejected the input so the request layer
 * can report it without parsing the message.
 */
public class BlendException extends RuntimeException {
    private final String component;

    public BlendException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public BlendException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
