package com.waveforge.core.plan;

import java.nio.file.Path;

/**
 * Thrown when an execution plan document is missing, unreadable or violates the plan invariants.
 */
public class PlanFormatException extends RuntimeException {

    private final Path planFile;

    public PlanFormatException(Path planFile, String message) {
        super(planFile + ": " + message);
        this.planFile = planFile;
    }

    public PlanFormatException(Path planFile, String message, Throwable cause) {
        super(planFile + ": " + message, cause);
        this.planFile = planFile;
    }

    public Path planFile() {
        return planFile;
    }
}
