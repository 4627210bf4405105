package com.cnfkit.analyzer.cyk;

import static org.junit.jupiter.api.Assertions.*;

import com.cnfkit.analyzer.cnf.CnfConverter;
import com.cnfkit.analyzer.cnf.CnfGrammar;
import com.cnfkit.analyzer.cyk.RecognitionTable.Literal;
import com.cnfkit.analyzer.cyk.RecognitionTable.Split;
import com.cnfkit.analyzer.grammar.Grammar.Variable;
import com.cnfkit.analyzer.grammar.GrammarCleaner;
import com.cnfkit.analyzer.grammar.GrammarParser;
import com.cnfkit.analyzer.grammar.GrammarRow;
import java.util.List;
import org.junit.jupiter.api.Test;

final class CykRecognizerTest {

    private static CnfGrammar cnf(String start, String... lines) {
        return CnfConverter.convert(
                GrammarCleaner.clean(GrammarParser.read(start, GrammarRow.parseAll(lines))).grammar());
    }

    @Test
    void acceptsBalancedStrings() {
        CykRecognizer recognizer = new CykRecognizer(cnf("S", "S -> a S b | ε"));

        assertTrue(recognizer.recognize(List.of("a", "b")).accepted());
        assertTrue(recognizer.recognize(List.of("a", "a", "b", "b")).accepted());
        assertFalse(recognizer.recognize(List.of("a", "b", "b")).accepted());
        assertFalse(recognizer.recognize(List.of("b", "a")).accepted());
        assertFalse(recognizer.recognize(List.of("a", "b", "a", "b")).accepted());
    }

    @Test
    void unknownTokensAreRejectedNotFailed() {
        CykRecognizer recognizer = new CykRecognizer(cnf("S", "S -> S S | a"));
        CykRecognizer.Recognition recognition = recognizer.recognize(List.of("a", "z", "a"));
        assertFalse(recognition.accepted());
        assertTrue(recognition.table().cell(1, 1).isEmpty());
    }

    @Test
    void baseCellsHoldLiteralWitnesses() {
        CykRecognizer recognizer = new CykRecognizer(cnf("S", "S -> S S | a"));
        RecognitionTable table = recognizer.recognize(List.of("a", "a", "a")).table();

        assertEquals(3, table.size());
        assertEquals(new Literal("a"), table.witness(new Variable("S"), 0, 0).orElseThrow());
        assertInstanceOf(Split.class, table.witness(new Variable("S"), 0, 2).orElseThrow());
    }

    @Test
    void keepsOnlyTheFirstWitnessPerVariable() {
        CykRecognizer recognizer = new CykRecognizer(cnf("S", "S -> S S | a"));
        RecognitionTable table = recognizer.recognize(List.of("a", "a", "a")).table();

        // Split points are tried from left to right, so k = 0 wins over k = 1.
        Split split = (Split) table.witness(new Variable("S"), 0, 2).orElseThrow();
        assertEquals(0, split.k());
        assertEquals(1, table.cell(0, 2).size());
    }

    @Test
    void tableIsDeterministic() {
        CnfGrammar grammar = cnf("E", "E -> E + E | E * E | ( E ) | id");
        List<String> input = List.of("id", "+", "id", "*", "(", "id", ")");

        RecognitionTable first = new CykRecognizer(grammar).recognize(input).table();
        RecognitionTable second = new CykRecognizer(grammar).recognize(input).table();

        for (int i = 0; i < input.size(); i++) {
            for (int j = i; j < input.size(); j++) {
                assertEquals(first.cell(i, j), second.cell(i, j));
            }
        }
    }

    @Test
    void emptyInputIsNotRecognizedHere() {
        CykRecognizer recognizer = new CykRecognizer(cnf("S", "S -> a"));
        assertThrows(IllegalArgumentException.class, () -> recognizer.recognize(List.of()));
    }

    @Test
    void lowerTriangleIsOutOfBounds() {
        RecognitionTable table = new CykRecognizer(cnf("S", "S -> a b")).recognize(List.of("a", "b")).table();
        assertThrows(IndexOutOfBoundsException.class, () -> table.cell(1, 0));
    }
}
