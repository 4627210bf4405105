package com.cnfkit.analyzer.core;

import com.cnfkit.analyzer.AnalyzerException;
import com.cnfkit.analyzer.tree.DerivationTree;
import java.util.Objects;
import java.util.Optional;

public final class ValidationException extends AnalyzerException {

    public enum Reason {
        NO_GRAMMAR,
        TOO_MANY_TOKENS,
        /** The input was accepted but its tree could not be rebuilt completely. */
        RECONSTRUCTION
    }

    private final Reason reason;
    private final DerivationTree partialTree;

    public ValidationException(Reason reason, String message) {
        this(reason, message, null);
    }

    public ValidationException(Reason reason, String message, DerivationTree partialTree) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.partialTree = partialTree;
    }

    public Reason reason() {
        return reason;
    }

    public Optional<DerivationTree> partialTree() {
        return Optional.ofNullable(partialTree);
    }

    @Override
    public String reasonCode() {
        return reason.name();
    }
}
