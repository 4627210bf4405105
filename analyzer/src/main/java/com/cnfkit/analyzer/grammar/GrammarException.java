package com.cnfkit.analyzer.grammar;

import com.cnfkit.analyzer.AnalyzerException;
import java.util.Objects;

/** The supplied grammar was rejected before any state was changed. */
public final class GrammarException extends AnalyzerException {

    public enum Reason {
        MISSING_START,
        MALFORMED_VARIABLE,
        NO_PRODUCTIONS,
        UNDECLARED_START,
        UNDECLARED_VARIABLE,
        START_NOT_USEFUL
    }

    private final Reason reason;

    public GrammarException(Reason reason, String message) {
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
