package com.cnfkit.analyzer.cnf;

import com.cnfkit.analyzer.grammar.Grammar;
import com.cnfkit.analyzer.grammar.Grammar.Origin;
import com.cnfkit.analyzer.grammar.Grammar.Production;
import com.cnfkit.analyzer.grammar.Grammar.Symbol;
import com.cnfkit.analyzer.grammar.Grammar.Terminal;
import com.cnfkit.analyzer.grammar.Grammar.Variable;
import com.cnfkit.analyzer.util.Fixpoint;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a cleaned grammar into Chomsky Normal Form:
 *
 * <ol>
 *   <li>nullable variables (fixpoint);
 *   <li>epsilon elimination, adding a primed start variable when the start is nullable;
 *   <li>unit elimination through the unit closure of every variable;
 *   <li>binarization of long right-hand sides with terminal isolation.
 * </ol>
 *
 * <p>Every step rewrites the whole grammar. Epsilon elimination enumerates every keep/drop choice
 * of the nullable symbols in a right-hand side, so its output is exponential in the number of
 * nullable occurrences per production.
 *
 * <p>Fresh names ({@code X1, X2, ...} and {@code S'}) are checked against every name already in
 * use at the moment they are allocated. Generated variables carry their {@link Origin}.
 */
public final class CnfConverter {

    private static final Logger log = LoggerFactory.getLogger(CnfConverter.class);

    static final int NULLABLE_WARN_THRESHOLD = 12;

    private final Grammar source;
    private final Set<String> taken = new HashSet<>();
    private final Map<Terminal, Variable> wrapperByTerminal = new LinkedHashMap<>();
    private int counter;

    private CnfConverter(Grammar source) {
        this.source = source;
        for (Variable variable : source.variables()) {
            taken.add(variable.name);
        }
        for (List<Production> productions : source.rules().values()) {
            for (Production production : productions) {
                production.variables().forEach(v -> taken.add(v.name));
            }
        }
    }

    public static CnfGrammar convert(Grammar cleaned) {
        return new CnfConverter(cleaned).run();
    }

    private CnfGrammar run() {
        Set<Variable> nullable = nullable(source.rules());
        Map<Variable, Set<Production>> rules = eliminateEpsilon(source.rules(), nullable);

        Variable start = source.start();
        if (nullable.contains(start)) {
            Variable renamed = freshStart(start);
            Map<Variable, Set<Production>> withStart = new LinkedHashMap<>();
            withStart.put(
                    renamed, new LinkedHashSet<>(List.of(Production.of(start), Production.EPSILON)));
            withStart.putAll(rules);
            rules = withStart;
            start = renamed;
        }
        pruneEmpty(rules);

        rules = eliminateUnits(rules);
        Map<Variable, Set<Production>> binary = binarize(rules);

        Grammar cnf = new Grammar(start, binary);
        log.debug(
                "Converted grammar to CNF: {} variables, {} productions, {} terminal wrappers",
                cnf.variables().size(),
                cnf.productionCount(),
                wrapperByTerminal.size());
        return new CnfGrammar(cnf, source.start(), wrapperByTerminal);
    }

    /**
     * A variable is nullable when some production consists only of epsilon and nullable variables.
     * Real terminals are never nullable.
     */
    public static Set<Variable> nullable(Map<Variable, ? extends Collection<Production>> rules) {
        Set<Variable> nullable = new HashSet<>();
        Fixpoint.iterate(
                "nullable",
                rules.size() + 2,
                () -> {
                    boolean changed = false;
                    for (Map.Entry<Variable, ? extends Collection<Production>> entry : rules.entrySet()) {
                        if (nullable.contains(entry.getKey())) {
                            continue;
                        }
                        for (Production production : entry.getValue()) {
                            if (derivesEmpty(production, nullable)) {
                                nullable.add(entry.getKey());
                                changed = true;
                                break;
                            }
                        }
                    }
                    return changed;
                });
        return nullable;
    }

    private static boolean derivesEmpty(Production production, Set<Variable> nullable) {
        for (Symbol symbol : production.rhs) {
            if (symbol instanceof Terminal terminal && !terminal.isEpsilon()) {
                return false;
            }
            if (symbol instanceof Variable variable && !nullable.contains(variable)) {
                return false;
            }
        }
        return true;
    }

    private static Map<Variable, Set<Production>> eliminateEpsilon(
            Map<Variable, List<Production>> rules, Set<Variable> nullable) {
        Map<Variable, Set<Production>> result = new LinkedHashMap<>();
        for (Map.Entry<Variable, List<Production>> entry : rules.entrySet()) {
            Set<Production> expanded = new LinkedHashSet<>();
            for (Production production : entry.getValue()) {
                if (production.isEpsilon()) {
                    continue;
                }
                for (List<Symbol> subset : keepOrDrop(entry.getKey(), production, nullable)) {
                    if (!subset.isEmpty()) {
                        expanded.add(new Production(subset));
                    }
                }
            }
            result.put(entry.getKey(), expanded);
        }
        return result;
    }

    private static List<List<Symbol>> keepOrDrop(
            Variable lhs, Production production, Set<Variable> nullable) {
        long optional =
                production.variables().stream().filter(nullable::contains).count();
        if (optional > NULLABLE_WARN_THRESHOLD) {
            log.warn(
                    "Production {} -> {} has {} nullable symbols; epsilon elimination yields up to 2^{} alternatives",
                    lhs,
                    production,
                    optional,
                    optional);
        }
        List<List<Symbol>> partial = new ArrayList<>();
        partial.add(new ArrayList<>());
        for (Symbol symbol : production.rhs) {
            if (symbol instanceof Terminal terminal && terminal.isEpsilon()) {
                continue;
            }
            boolean droppable = symbol instanceof Variable variable && nullable.contains(variable);
            List<List<Symbol>> next = new ArrayList<>();
            for (List<Symbol> prefix : partial) {
                List<Symbol> kept = new ArrayList<>(prefix);
                kept.add(symbol);
                next.add(kept);
                if (droppable) {
                    next.add(prefix);
                }
            }
            partial = next;
        }
        return partial;
    }

    /** Drops variables left without productions and every production that mentions them. */
    private static void pruneEmpty(Map<Variable, Set<Production>> rules) {
        Fixpoint.iterate(
                "empty-variable pruning",
                rules.size() + 2,
                () -> {
                    Set<Variable> empty = new HashSet<>();
                    rules.forEach((variable, productions) -> {
                        if (productions.isEmpty()) {
                            empty.add(variable);
                        }
                    });
                    if (empty.isEmpty()) {
                        return false;
                    }
                    rules.keySet().removeAll(empty);
                    for (Set<Production> productions : rules.values()) {
                        productions.removeIf(p -> p.variables().stream().anyMatch(empty::contains));
                    }
                    return true;
                });
    }

    /**
     * Replaces every unit production {@code A -> B} by the non-unit productions reachable from
     * {@code B} through unit productions, in order of appearance. Self loops vanish.
     */
    private static Map<Variable, Set<Production>> eliminateUnits(Map<Variable, Set<Production>> rules) {
        Map<Variable, Set<Production>> result = new LinkedHashMap<>();
        for (Map.Entry<Variable, Set<Production>> entry : rules.entrySet()) {
            Set<Production> merged = new LinkedHashSet<>();
            Set<Variable> visited = new HashSet<>();
            visited.add(entry.getKey());
            Deque<Iterator<Production>> work = new ArrayDeque<>();
            work.push(entry.getValue().iterator());
            while (!work.isEmpty()) {
                Iterator<Production> pending = work.peek();
                if (!pending.hasNext()) {
                    work.pop();
                    continue;
                }
                Production production = pending.next();
                if (!production.isUnit()) {
                    merged.add(production);
                    continue;
                }
                Variable target = (Variable) production.get(0);
                if (visited.add(target)) {
                    work.push(rules.getOrDefault(target, Set.of()).iterator());
                }
            }
            result.put(entry.getKey(), merged);
        }
        return result;
    }

    private Map<Variable, Set<Production>> binarize(Map<Variable, Set<Production>> rules) {
        Map<Variable, Set<Production>> out = new LinkedHashMap<>();
        for (Map.Entry<Variable, Set<Production>> entry : rules.entrySet()) {
            Variable lhs = entry.getKey();
            out.computeIfAbsent(lhs, key -> new LinkedHashSet<>());
            for (Production production : entry.getValue()) {
                int size = production.size();
                if (size == 1) {
                    if (production.get(0) instanceof Terminal) {
                        out.get(lhs).add(production);
                    }
                    continue;
                }
                Variable current = lhs;
                for (int i = 0; i < size - 2; i++) {
                    Variable head = isolate(production.get(i));
                    Variable chain = fresh(Origin.CHAIN);
                    out.computeIfAbsent(current, key -> new LinkedHashSet<>())
                            .add(Production.of(head, chain));
                    current = chain;
                }
                out.computeIfAbsent(current, key -> new LinkedHashSet<>())
                        .add(
                                Production.of(
                                        isolate(production.get(size - 2)),
                                        isolate(production.get(size - 1))));
            }
        }

        wrapperByTerminal.forEach(
                (terminal, wrapper) ->
                        out.computeIfAbsent(wrapper, key -> new LinkedHashSet<>())
                                .add(Production.of(terminal)));

        for (Set<Production> productions : out.values()) {
            productions.removeIf(Production::isUnit);
        }
        out.values().removeIf(Set::isEmpty);
        return out;
    }

    private Variable isolate(Symbol symbol) {
        if (symbol instanceof Variable variable) {
            return variable;
        }
        Terminal terminal = (Terminal) symbol;
        Variable wrapper = wrapperByTerminal.get(terminal);
        if (wrapper == null) {
            wrapper = fresh(Origin.TERMINAL_WRAPPER);
            wrapperByTerminal.put(terminal, wrapper);
        }
        return wrapper;
    }

    private Variable fresh(Origin origin) {
        String name;
        do {
            name = "X" + (++counter);
        } while (!taken.add(name));
        return new Variable(name, origin);
    }

    private Variable freshStart(Variable start) {
        String name = start.name + "'";
        while (!taken.add(name)) {
            name = name + "'";
        }
        return new Variable(name, Origin.START);
    }
}
