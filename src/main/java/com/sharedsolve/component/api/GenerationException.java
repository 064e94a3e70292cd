package com.sharedsolve.component.api;

/**
 * The text generator could not produce an answer. Not retried by the coordination layer.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
