package com.cnfkit.analyzer.gen;

import static org.junit.jupiter.api.Assertions.*;

import com.cnfkit.analyzer.grammar.Grammar;
import com.cnfkit.analyzer.grammar.GrammarCleaner;
import com.cnfkit.analyzer.grammar.GrammarParser;
import com.cnfkit.analyzer.grammar.GrammarRow;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class SentenceGeneratorsTest {

    private static final SentenceGenerators.Limits DEFAULTS =
            new SentenceGenerators.Limits(10, 50, 15, 200, 30);

    private static Grammar cleaned(String start, String... lines) {
        return GrammarCleaner.clean(GrammarParser.read(start, GrammarRow.parseAll(lines))).grammar();
    }

    @Test
    void balancedGrammarOnlyProducesBalancedStrings() {
        Grammar grammar = cleaned("S", "S -> a S b | ε");
        var generator = new SentenceGenerators.NaiveGenerator(grammar, new Random(7));

        Set<String> generated = SentenceGenerators.collect(generator, grammar, DEFAULTS);

        assertFalse(generated.isEmpty());
        for (String sentence : generated) {
            String[] tokens = sentence.isEmpty() ? new String[0] : sentence.split(" ");
            int depth = 0;
            int half = tokens.length / 2;
            for (int i = 0; i < tokens.length; i++) {
                assertEquals(i < half ? "a" : "b", tokens[i], sentence);
                depth += tokens[i].equals("a") ? 1 : -1;
                assertTrue(depth >= 0, sentence);
            }
            assertEquals(0, depth, sentence);
        }
    }

    @Test
    void derivationsPastMaxDepthAreDiscarded() {
        Grammar grammar = cleaned("S", "S -> a S | a");
        var generator = new SentenceGenerators.NaiveGenerator(grammar, new Random(1));

        for (int i = 0; i < 100; i++) {
            Optional<List<String>> tokens = generator.generate(grammar.start(), 3);
            tokens.ifPresent(list -> assertTrue(list.size() <= 3, list.toString()));
        }
    }

    @Test
    void resultsAreDistinctAndBounded() {
        Grammar grammar = cleaned("S", "S -> x | y | z");
        var generator = new SentenceGenerators.NaiveGenerator(grammar, new Random(3));

        Set<String> generated =
                SentenceGenerators.collect(generator, grammar, new SentenceGenerators.Limits(2, 50, 15, 200, 30));

        assertEquals(2, generated.size());
        assertTrue(Set.of("x", "y", "z").containsAll(generated));
    }

    @Test
    void longSentencesAreDropped() {
        Grammar grammar = cleaned("S", "S -> a a a a a");
        var generator = new SentenceGenerators.NaiveGenerator(grammar, new Random(3));

        assertThrows(
                GenerationException.class,
                () ->
                        SentenceGenerators.collect(
                                generator, grammar, new SentenceGenerators.Limits(10, 5, 15, 200, 4)));
    }

    @Test
    void fallsBackToEpsilonWhenOnlyTheEmptyStringFits() {
        Grammar grammar = cleaned("S", "S -> ε | a S");
        var generator = new SentenceGenerators.NaiveGenerator(grammar, new Random(5));

        Set<String> generated =
                SentenceGenerators.collect(generator, grammar, new SentenceGenerators.Limits(10, 20, 0, 200, 30));

        assertEquals(Set.of(""), generated);
    }

    @Test
    void exhaustedBudgetWithoutEpsilonFails() {
        Grammar grammar = cleaned("S", "S -> a");
        var generator = new SentenceGenerators.NaiveGenerator(grammar, new Random(5));

        GenerationException e =
                assertThrows(
                        GenerationException.class,
                        () ->
                                SentenceGenerators.collect(
                                        generator, grammar, new SentenceGenerators.Limits(10, 20, 0, 200, 30)));
        assertEquals(GenerationException.Reason.EXHAUSTED, e.reason());
    }
}
