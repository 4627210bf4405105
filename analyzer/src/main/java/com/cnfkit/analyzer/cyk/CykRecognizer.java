package com.cnfkit.analyzer.cyk;

import com.cnfkit.analyzer.cnf.CnfGrammar;
import com.cnfkit.analyzer.cyk.RecognitionTable.Literal;
import com.cnfkit.analyzer.cyk.RecognitionTable.Split;
import com.cnfkit.analyzer.grammar.Grammar.Production;
import com.cnfkit.analyzer.grammar.Grammar.Terminal;
import com.cnfkit.analyzer.grammar.Grammar.Variable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cocke–Younger–Kasami membership test over an immutable {@link CnfGrammar}. Runs in
 * {@code O(n^3 * |binary rules|)} time; the table is filled in a fixed order so the same input
 * always yields the same witnesses.
 */
public final class CykRecognizer {

    private static final Logger log = LoggerFactory.getLogger(CykRecognizer.class);

    public record Recognition(RecognitionTable table, boolean accepted) {}

    private record BinaryRule(Variable lhs, Variable left, Variable right) {}

    private final CnfGrammar grammar;
    private final Map<String, List<Variable>> lexical = new HashMap<>();
    private final List<BinaryRule> binary = new ArrayList<>();

    public CykRecognizer(CnfGrammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        grammar.grammar()
                .rules()
                .forEach(
                        (lhs, productions) -> {
                            for (Production production : productions) {
                                if (production.isLexical()) {
                                    String text = ((Terminal) production.get(0)).text;
                                    lexical.computeIfAbsent(text, key -> new ArrayList<>()).add(lhs);
                                } else if (production.isBinary()) {
                                    binary.add(
                                            new BinaryRule(
                                                    lhs,
                                                    (Variable) production.get(0),
                                                    (Variable) production.get(1)));
                                }
                            }
                        });
    }

    public CnfGrammar grammar() {
        return grammar;
    }

    /**
     * Fills the table for a non-empty token sequence. Empty input is answered by the caller from
     * the grammar's epsilon productions.
     */
    public Recognition recognize(List<String> tokens) {
        int n = tokens.size();
        if (n == 0) {
            throw new IllegalArgumentException("CYK requires at least one token");
        }
        RecognitionTable table = new RecognitionTable(n);

        for (int i = 0; i < n; i++) {
            String token = tokens.get(i);
            for (Variable variable : lexical.getOrDefault(token, List.of())) {
                table.record(i, i, variable, new Literal(token));
            }
        }

        for (int length = 2; length <= n; length++) {
            for (int i = 0; i + length - 1 < n; i++) {
                int j = i + length - 1;
                for (int k = i; k < j; k++) {
                    if (table.cell(i, k).isEmpty() || table.cell(k + 1, j).isEmpty()) {
                        continue;
                    }
                    for (BinaryRule rule : binary) {
                        if (table.contains(i, k, rule.left) && table.contains(k + 1, j, rule.right)) {
                            table.record(i, j, rule.lhs, new Split(k, rule.left, rule.right));
                        }
                    }
                }
            }
        }

        boolean accepted = table.contains(0, n - 1, grammar.start());
        log.debug("CYK over {} tokens: {} entries, accepted={}", n, table.entryCount(), accepted);
        return new Recognition(table, accepted);
    }
}
