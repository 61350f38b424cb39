package com.groundgate.core.engine;

/**
 * Infrastructure failure while calling the {@link Router}. Propagates to the caller;
 * validation problems never use this type.
 */
public class RouterException extends RuntimeException {

    public RouterException(String message) {
        super(message);
    }

    public RouterException(String message, Throwable cause) {
        super(message, cause);
    }
}
