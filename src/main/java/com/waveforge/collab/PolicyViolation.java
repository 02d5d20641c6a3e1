package com.waveforge.collab;

/**
 * One rule violation found in a changed file.
 */
public record PolicyViolation(String file, int line, String rule, String message) {

    @Override
    public String toString() {
        return file + ":" + line + " - " + rule + ": " + message;
    }
}
