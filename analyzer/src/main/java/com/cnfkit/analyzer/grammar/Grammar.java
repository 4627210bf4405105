package com.cnfkit.analyzer.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Immutable in-memory representation of a context-free grammar: a start variable plus, for every
 * variable, its ordered list of alternatives.
 *
 * <p>Symbols are classified exactly once, when a grammar is read ({@link #symbol(String)}). All
 * later stages work on typed {@link Variable} and {@link Terminal} values, and machine-generated
 * variables carry their {@link Origin} instead of relying on a naming convention.
 */
public final class Grammar {

    private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Z][A-Za-z0-9_]*'?");

    public static final String EPSILON_TEXT = "ε";

    public interface Symbol {
        String name();
    }

    /** Where a variable came from. Everything except {@link #DECLARED} is produced by conversion. */
    public enum Origin {
        DECLARED,
        START,
        CHAIN,
        TERMINAL_WRAPPER
    }

    public static final class Variable implements Symbol {
        public final String name;
        public final Origin origin;

        public Variable(String name) {
            this(name, Origin.DECLARED);
        }

        public Variable(String name, Origin origin) {
            this.name = Objects.requireNonNull(name, "name");
            this.origin = Objects.requireNonNull(origin, "origin");
        }

        @Override
        public String name() {
            return name;
        }

        public boolean isChain() {
            return origin == Origin.CHAIN;
        }

        public boolean isTerminalWrapper() {
            return origin == Origin.TERMINAL_WRAPPER;
        }

        // Names are unique within a grammar; the origin travels with the name.
        @Override
        public boolean equals(Object o) {
            return o instanceof Variable other && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Terminal implements Symbol {
        public static final Terminal EPSILON = new Terminal(EPSILON_TEXT);

        public final String text;

        public Terminal(String text) {
            this.text = Objects.requireNonNull(text, "text");
        }

        @Override
        public String name() {
            return text;
        }

        public boolean isEpsilon() {
            return EPSILON_TEXT.equals(text);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Terminal other && text.equals(other.text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /** A right-hand side. The single-symbol sequence {@code [ε]} is the empty derivation. */
    public static final class Production {
        public static final Production EPSILON = new Production(List.of(Terminal.EPSILON));

        public final List<Symbol> rhs;

        public Production(List<? extends Symbol> rhs) {
            this.rhs = List.copyOf(Objects.requireNonNull(rhs, "rhs"));
            if (this.rhs.isEmpty()) {
                throw new IllegalArgumentException("right-hand side must not be empty");
            }
        }

        public static Production of(Symbol... symbols) {
            return new Production(Arrays.asList(symbols));
        }

        public int size() {
            return rhs.size();
        }

        public Symbol get(int index) {
            return rhs.get(index);
        }

        public boolean isEpsilon() {
            return rhs.size() == 1 && rhs.get(0) instanceof Terminal t && t.isEpsilon();
        }

        public boolean isUnit() {
            return rhs.size() == 1 && rhs.get(0) instanceof Variable;
        }

        /** {@code A -> a} for a real (non-epsilon) terminal. */
        public boolean isLexical() {
            return rhs.size() == 1 && rhs.get(0) instanceof Terminal t && !t.isEpsilon();
        }

        public boolean isBinary() {
            return rhs.size() == 2
                    && rhs.get(0) instanceof Variable
                    && rhs.get(1) instanceof Variable;
        }

        public List<Variable> variables() {
            List<Variable> result = new ArrayList<>();
            for (Symbol symbol : rhs) {
                if (symbol instanceof Variable variable) {
                    result.add(variable);
                }
            }
            return result;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Production other && rhs.equals(other.rhs);
        }

        @Override
        public int hashCode() {
            return rhs.hashCode();
        }

        @Override
        public String toString() {
            return rhs.stream().map(Symbol::name).collect(Collectors.joining(" "));
        }
    }

    private final Variable start;
    private final Map<Variable, List<Production>> byLhs;

    public Grammar(Variable start, Map<Variable, ? extends Collection<Production>> rules) {
        this.start = Objects.requireNonNull(start, "start");
        Map<Variable, List<Production>> copy = new LinkedHashMap<>();
        for (Map.Entry<Variable, ? extends Collection<Production>> entry : rules.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(new LinkedHashSet<>(entry.getValue())));
        }
        this.byLhs = Collections.unmodifiableMap(copy);
    }

    /** True when {@code token} has the lexical shape of a variable name. */
    public static boolean isVariableName(String token) {
        return token != null && VARIABLE_NAME.matcher(token).matches();
    }

    /** Classifies a source token. {@code ε} is the epsilon terminal. */
    public static Symbol symbol(String token) {
        if (EPSILON_TEXT.equals(token)) {
            return Terminal.EPSILON;
        }
        return isVariableName(token) ? new Variable(token) : new Terminal(token);
    }

    public Variable start() {
        return start;
    }

    public Set<Variable> variables() {
        return byLhs.keySet();
    }

    public Map<Variable, List<Production>> rules() {
        return byLhs;
    }

    public List<Production> productions(Variable variable) {
        return byLhs.getOrDefault(variable, List.of());
    }

    public Optional<Variable> variable(String name) {
        return byLhs.keySet().stream().filter(v -> v.name.equals(name)).findFirst();
    }

    public boolean hasEpsilon(Variable variable) {
        return productions(variable).stream().anyMatch(Production::isEpsilon);
    }

    public int productionCount() {
        return byLhs.values().stream().mapToInt(List::size).sum();
    }

    /**
     * True when every production is {@code A -> a} or {@code A -> B C}. The start variable may
     * additionally derive epsilon.
     */
    public boolean isCnf() {
        for (Map.Entry<Variable, List<Production>> entry : byLhs.entrySet()) {
            for (Production production : entry.getValue()) {
                boolean allowedEpsilon = production.isEpsilon() && entry.getKey().equals(start);
                if (!production.isLexical() && !production.isBinary() && !allowedEpsilon) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Variable, List<Production>> entry : byLhs.entrySet()) {
            sb.append(entry.getKey().name)
                    .append(" -> ")
                    .append(
                            entry.getValue().stream()
                                    .map(Production::toString)
                                    .collect(Collectors.joining(" | ")))
                    .append('\n');
        }
        return sb.toString();
    }
}
