package com.cnfkit.analyzer.grammar;

import com.cnfkit.analyzer.grammar.Grammar.Production;
import com.cnfkit.analyzer.grammar.Grammar.Symbol;
import com.cnfkit.analyzer.grammar.Grammar.Variable;
import com.cnfkit.analyzer.grammar.GrammarException.Reason;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns declared rows into a typed {@link Grammar}, failing fast on the first problem. The result
 * is validated but not yet cleaned; see {@link GrammarCleaner}.
 */
public final class GrammarParser {

    private GrammarParser() {}

    public static Grammar read(String startName, List<GrammarRow> rows) {
        if (startName == null || startName.isBlank()) {
            throw new GrammarException(Reason.MISSING_START, "Start variable must be a non-empty string.");
        }
        String startText = startName.strip();
        if (!Grammar.isVariableName(startText)) {
            throw new GrammarException(
                    Reason.MALFORMED_VARIABLE,
                    "Invalid start variable '" + startText + "'. Must start with an uppercase letter.");
        }

        Map<Variable, Set<List<String>>> declared = new LinkedHashMap<>();
        for (GrammarRow row : rows) {
            if (row == null || row.lhs() == null || row.lhs().isBlank()) {
                continue;
            }
            String lhs = row.lhs().strip();
            if (!Grammar.isVariableName(lhs)) {
                throw new GrammarException(
                        Reason.MALFORMED_VARIABLE,
                        "Invalid variable format on left-hand side: '"
                                + lhs
                                + "'. Variables must start with an uppercase letter (e.g., S, NP, Det).");
            }
            declared.computeIfAbsent(new Variable(lhs), key -> new LinkedHashSet<>())
                    .addAll(row.alternatives());
        }
        if (declared.isEmpty()) {
            throw new GrammarException(
                    Reason.NO_PRODUCTIONS, "No production rules defined. Add at least one rule.");
        }

        Variable start = new Variable(startText);
        if (!declared.containsKey(start)) {
            throw new GrammarException(
                    Reason.UNDECLARED_START,
                    "Start variable '" + startText + "' has no production rules.");
        }

        Map<Variable, List<Production>> rules = new LinkedHashMap<>();
        for (Map.Entry<Variable, Set<List<String>>> entry : declared.entrySet()) {
            List<Production> productions = new ArrayList<>();
            for (List<String> tokens : entry.getValue()) {
                List<Symbol> rhs = new ArrayList<>();
                for (String token : tokens) {
                    Symbol symbol = Grammar.symbol(token);
                    if (symbol instanceof Variable variable && !declared.containsKey(variable)) {
                        throw new GrammarException(
                                Reason.UNDECLARED_VARIABLE,
                                "Undeclared variable '"
                                        + token
                                        + "' used on right-hand side in rule: \""
                                        + entry.getKey().name
                                        + " -> "
                                        + String.join(" ", tokens)
                                        + "\"");
                    }
                    rhs.add(symbol);
                }
                productions.add(new Production(rhs));
            }
            rules.put(entry.getKey(), productions);
        }
        return new Grammar(start, rules);
    }
}
