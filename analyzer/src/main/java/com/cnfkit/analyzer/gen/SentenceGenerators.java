package com.cnfkit.analyzer.gen;

import com.cnfkit.analyzer.gen.GenerationException.Reason;
import com.cnfkit.analyzer.grammar.Grammar;
import com.cnfkit.analyzer.grammar.Grammar.Production;
import com.cnfkit.analyzer.grammar.Grammar.Symbol;
import com.cnfkit.analyzer.grammar.Grammar.Terminal;
import com.cnfkit.analyzer.grammar.Grammar.Variable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Random sentence generation over a cleaned (non-CNF) grammar, independent of the CNF/CYK path.
 */
public final class SentenceGenerators {

    private SentenceGenerators() {}

    public interface SentenceGenerator {
        /** One random derivation from {@code start}, or empty when it ran past {@code maxDepth}. */
        Optional<List<String>> generate(Variable start, int maxDepth);
    }

    /** Bounds for {@link #collect}. */
    public record Limits(int count, int attempts, int maxDepth, int maxChars, int maxTokens) {}

    /** Picks productions uniformly at random at every step. */
    public static final class NaiveGenerator implements SentenceGenerator {
        private final Grammar grammar;
        private final Random random;

        public NaiveGenerator(Grammar grammar, Random random) {
            this.grammar = grammar;
            this.random = random;
        }

        @Override
        public Optional<List<String>> generate(Variable start, int maxDepth) {
            List<String> tokens = new ArrayList<>();
            return expand(start, 0, maxDepth, tokens) ? Optional.of(tokens) : Optional.empty();
        }

        private boolean expand(Symbol symbol, int depth, int maxDepth, List<String> out) {
            if (depth > maxDepth) {
                return false;
            }
            if (symbol instanceof Terminal terminal) {
                if (!terminal.isEpsilon()) {
                    out.add(terminal.text);
                }
                return true;
            }
            List<Production> rules = grammar.productions((Variable) symbol);
            if (rules.isEmpty()) {
                return true;
            }
            Production rule = rules.get(random.nextInt(rules.size()));
            for (Symbol next : rule.rhs) {
                if (!expand(next, depth + 1, maxDepth, out)) {
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Runs up to {@code attempts} derivations and keeps distinct space-joined results within the
     * length bounds. Truncated attempts are discarded whole. The empty string is kept when an
     * attempt produces it.
     *
     * @throws GenerationException if nothing was produced and the start has no epsilon production
     */
    public static Set<String> collect(SentenceGenerator generator, Grammar grammar, Limits limits) {
        Set<String> generated = new LinkedHashSet<>();
        for (int attempt = 0; attempt < limits.attempts() && generated.size() < limits.count(); attempt++) {
            Optional<List<String>> tokens = generator.generate(grammar.start(), limits.maxDepth());
            if (tokens.isEmpty()) {
                continue;
            }
            String sentence = String.join(" ", tokens.get());
            if (sentence.isEmpty()
                    || (sentence.length() < limits.maxChars() && tokens.get().size() <= limits.maxTokens())) {
                generated.add(sentence);
            }
        }
        if (generated.isEmpty()) {
            if (grammar.hasEpsilon(grammar.start())) {
                return Set.of("");
            }
            throw new GenerationException(
                    Reason.EXHAUSTED,
                    "No strings generated within "
                            + limits.attempts()
                            + " attempts (max depth "
                            + limits.maxDepth()
                            + ").");
        }
        return Collections.unmodifiableSet(generated);
    }
}
