package com.waveforge.backend;

/**
 * Thrown when the operating system or container runtime refuses a start, inspect or kill request.
 */
public class BackendException extends RuntimeException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
