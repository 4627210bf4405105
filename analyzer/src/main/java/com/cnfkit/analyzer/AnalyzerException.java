package com.cnfkit.analyzer;

/**
 * Base type for every failure the analyzer reports to its caller. Each failure is local to one
 * call and never leaves a partially applied grammar behind.
 */
public abstract class AnalyzerException extends RuntimeException {

    protected AnalyzerException(String message) {
        super(message);
    }

    protected AnalyzerException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable machine-readable category, e.g. {@code UNDECLARED_VARIABLE}. */
    public abstract String reasonCode();
}
