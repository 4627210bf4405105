package com.cnfkit.analyzer.cnf;

import com.cnfkit.analyzer.grammar.Grammar;
import com.cnfkit.analyzer.grammar.Grammar.Terminal;
import com.cnfkit.analyzer.grammar.Grammar.Variable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A grammar in Chomsky Normal Form together with the table of terminal-wrapper variables the
 * conversion introduced. The two lookup directions are built from one table and stay inverse.
 */
public final class CnfGrammar {

    public record Summary(
            String originalStart,
            String start,
            int variables,
            int productions,
            Map<String, String> terminalWrappers,
            String text) {}

    private final Grammar grammar;
    private final Variable originalStart;
    private final Map<Terminal, Variable> wrapperByTerminal;
    private final Map<Variable, Terminal> terminalByWrapper;

    CnfGrammar(Grammar grammar, Variable originalStart, Map<Terminal, Variable> wrapperByTerminal) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.originalStart = Objects.requireNonNull(originalStart, "originalStart");
        Map<Terminal, Variable> forward = new LinkedHashMap<>(wrapperByTerminal);
        Map<Variable, Terminal> inverse = new LinkedHashMap<>();
        forward.forEach((terminal, wrapper) -> inverse.put(wrapper, terminal));
        this.wrapperByTerminal = Collections.unmodifiableMap(forward);
        this.terminalByWrapper = Collections.unmodifiableMap(inverse);
    }

    public Grammar grammar() {
        return grammar;
    }

    public Variable start() {
        return grammar.start();
    }

    public Variable originalStart() {
        return originalStart;
    }

    /** True when the start variable was replaced because the original one was nullable. */
    public boolean startRenamed() {
        return !grammar.start().equals(originalStart);
    }

    /** Whether the converted start keeps an epsilon production, i.e. the language contains ε. */
    public boolean derivesEmpty() {
        return grammar.hasEpsilon(grammar.start());
    }

    public Optional<Variable> wrapperFor(Terminal terminal) {
        return Optional.ofNullable(wrapperByTerminal.get(terminal));
    }

    public Optional<Terminal> terminalFor(Variable wrapper) {
        return Optional.ofNullable(terminalByWrapper.get(wrapper));
    }

    public Map<Terminal, Variable> wrapperByTerminal() {
        return wrapperByTerminal;
    }

    public Map<Variable, Terminal> terminalByWrapper() {
        return terminalByWrapper;
    }

    public Summary summary() {
        Map<String, String> wrappers = new LinkedHashMap<>();
        wrapperByTerminal.forEach((terminal, wrapper) -> wrappers.put(terminal.text, wrapper.name));
        return new Summary(
                originalStart.name,
                grammar.start().name,
                grammar.variables().size(),
                grammar.productionCount(),
                Collections.unmodifiableMap(wrappers),
                grammar.toString());
    }

    @Override
    public String toString() {
        return grammar.toString();
    }
}
