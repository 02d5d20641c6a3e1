package com.waveforge.core.parser;

/**
 * Thrown when the task list cannot be read.
 */
public class TaskListException extends RuntimeException {

    public TaskListException(String message) {
        super(message);
    }

    public TaskListException(String message, Throwable cause) {
        super(message, cause);
    }
}
