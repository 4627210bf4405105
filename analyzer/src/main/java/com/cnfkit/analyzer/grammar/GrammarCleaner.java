package com.cnfkit.analyzer.grammar;

import com.cnfkit.analyzer.grammar.Grammar.Production;
import com.cnfkit.analyzer.grammar.Grammar.Variable;
import com.cnfkit.analyzer.grammar.GrammarException.Reason;
import com.cnfkit.analyzer.util.Fixpoint;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes non-generating variables, then variables unreachable from the start. The cleaned grammar
 * feeds both the CNF converter and, unconverted, the sentence generator.
 */
public final class GrammarCleaner {

    private static final Logger log = LoggerFactory.getLogger(GrammarCleaner.class);

    private GrammarCleaner() {}

    public record Result(
            Grammar grammar, List<String> removedNonGenerating, List<String> removedUnreachable) {}

    public static Result clean(Grammar grammar) {
        Variable start = grammar.start();
        Set<Variable> useful = generating(grammar.rules());
        if (!useful.contains(start)) {
            throw new GrammarException(
                    Reason.START_NOT_USEFUL,
                    "Start symbol '"
                            + start.name
                            + "' generates nothing. Check for non-terminating recursion or missing terminal rules.");
        }

        List<String> nonGenerating = new ArrayList<>();
        Map<Variable, List<Production>> kept = new LinkedHashMap<>();
        for (Map.Entry<Variable, List<Production>> entry : grammar.rules().entrySet()) {
            if (!useful.contains(entry.getKey())) {
                nonGenerating.add(entry.getKey().name);
                continue;
            }
            List<Production> productions = new ArrayList<>();
            for (Production production : entry.getValue()) {
                if (useful.containsAll(production.variables())) {
                    productions.add(production);
                }
            }
            kept.put(entry.getKey(), productions);
        }

        Set<Variable> reachable = reachable(start, kept);
        List<String> unreachable = new ArrayList<>();
        Map<Variable, List<Production>> cleaned = new LinkedHashMap<>();
        for (Map.Entry<Variable, List<Production>> entry : kept.entrySet()) {
            if (reachable.contains(entry.getKey())) {
                cleaned.put(entry.getKey(), entry.getValue());
            } else {
                unreachable.add(entry.getKey().name);
            }
        }

        if (!nonGenerating.isEmpty()) {
            log.info("Removed non-generating variables {}", nonGenerating);
        }
        if (!unreachable.isEmpty()) {
            log.info("Removed unreachable variables {}", unreachable);
        }
        return new Result(new Grammar(start, cleaned), List.copyOf(nonGenerating), List.copyOf(unreachable));
    }

    /**
     * Variables that derive some terminal string: a variable qualifies once one of its productions
     * mentions only qualifying variables. Terminals, epsilon included, never block a production.
     */
    static Set<Variable> generating(Map<Variable, List<Production>> rules) {
        Set<Variable> useful = new HashSet<>();
        Fixpoint.iterate(
                "usefulness",
                rules.size() + 2,
                () -> {
                    boolean changed = false;
                    for (Map.Entry<Variable, List<Production>> entry : rules.entrySet()) {
                        if (useful.contains(entry.getKey())) {
                            continue;
                        }
                        for (Production production : entry.getValue()) {
                            if (useful.containsAll(production.variables())) {
                                useful.add(entry.getKey());
                                changed = true;
                                break;
                            }
                        }
                    }
                    return changed;
                });
        return useful;
    }

    static Set<Variable> reachable(Variable start, Map<Variable, List<Production>> rules) {
        Set<Variable> seen = new HashSet<>();
        Deque<Variable> stack = new ArrayDeque<>();
        seen.add(start);
        stack.push(start);
        while (!stack.isEmpty()) {
            Variable current = stack.pop();
            for (Production production : rules.getOrDefault(current, List.of())) {
                for (Variable next : production.variables()) {
                    if (rules.containsKey(next) && seen.add(next)) {
                        stack.push(next);
                    }
                }
            }
        }
        return seen;
    }
}
