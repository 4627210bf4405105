package com.cnfkit.analyzer.gen;

import com.cnfkit.analyzer.AnalyzerException;
import java.util.Objects;

public final class GenerationException extends AnalyzerException {

    public enum Reason {
        NO_GRAMMAR,
        EXHAUSTED
    }

    private final Reason reason;

    public GenerationException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public String reasonCode() {
        return reason.name();
    }
}
