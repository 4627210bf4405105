package com.cnfkit.analyzer.grammar;

import static org.junit.jupiter.api.Assertions.*;

import com.cnfkit.analyzer.grammar.Grammar.Production;
import com.cnfkit.analyzer.grammar.Grammar.Terminal;
import com.cnfkit.analyzer.grammar.Grammar.Variable;
import java.util.List;
import org.junit.jupiter.api.Test;

final class GrammarParserTest {

    @Test
    void classifiesSymbolsByLexicalShape() {
        assertInstanceOf(Variable.class, Grammar.symbol("S"));
        assertInstanceOf(Variable.class, Grammar.symbol("NP_2"));
        assertInstanceOf(Variable.class, Grammar.symbol("S'"));
        assertInstanceOf(Terminal.class, Grammar.symbol("a"));
        assertInstanceOf(Terminal.class, Grammar.symbol("S''"));
        assertInstanceOf(Terminal.class, Grammar.symbol("+"));
        assertSame(Terminal.EPSILON, Grammar.symbol("ε"));
    }

    @Test
    void parsesRowsIntoTypedProductions() {
        Grammar grammar =
                GrammarParser.read("S", GrammarRow.parseAll("S -> a S b |", "S → c", "A -> a"));

        Variable s = new Variable("S");
        List<Production> productions = grammar.productions(s);
        assertEquals(3, productions.size(), "rows with the same lhs merge");
        assertEquals("a S b", productions.get(0).toString());
        assertTrue(productions.get(1).isEpsilon(), "empty alternative is epsilon");
        assertEquals("c", productions.get(2).toString());
        assertInstanceOf(Variable.class, productions.get(0).get(1));
    }

    @Test
    void dropsEpsilonInsideLongerAlternative() {
        Grammar grammar = GrammarParser.read("S", GrammarRow.parseAll("S -> a ε b | ε"));
        List<Production> productions = grammar.productions(grammar.start());
        assertEquals("a b", productions.get(0).toString());
        assertTrue(productions.get(1).isEpsilon());
    }

    @Test
    void rejectsUndeclaredRightHandSideVariable() {
        GrammarException e =
                assertThrows(
                        GrammarException.class,
                        () -> GrammarParser.read("S", GrammarRow.parseAll("S -> A b")));
        assertEquals(GrammarException.Reason.UNDECLARED_VARIABLE, e.reason());
        assertTrue(e.getMessage().contains("'A'"), e.getMessage());
        assertTrue(e.getMessage().contains("S -> A b"), e.getMessage());
    }

    @Test
    void rejectsMissingAndMalformedStart() {
        List<GrammarRow> rows = GrammarRow.parseAll("S -> a");
        assertEquals(
                GrammarException.Reason.MISSING_START,
                assertThrows(GrammarException.class, () -> GrammarParser.read("  ", rows)).reason());
        assertEquals(
                GrammarException.Reason.MALFORMED_VARIABLE,
                assertThrows(GrammarException.class, () -> GrammarParser.read("s", rows)).reason());
        assertEquals(
                GrammarException.Reason.UNDECLARED_START,
                assertThrows(GrammarException.class, () -> GrammarParser.read("T", rows)).reason());
    }

    @Test
    void rejectsMalformedLeftHandSide() {
        GrammarException e =
                assertThrows(
                        GrammarException.class,
                        () -> GrammarParser.read("S", GrammarRow.parseAll("S -> a", "np -> b")));
        assertEquals(GrammarException.Reason.MALFORMED_VARIABLE, e.reason());
        assertTrue(e.getMessage().contains("'np'"));
    }

    @Test
    void rejectsGrammarWithoutRows() {
        List<GrammarRow> rows = List.of(new GrammarRow("  ", "a"));
        GrammarException e = assertThrows(GrammarException.class, () -> GrammarParser.read("S", rows));
        assertEquals(GrammarException.Reason.NO_PRODUCTIONS, e.reason());
    }

    @Test
    void rowParsingRequiresArrow() {
        assertThrows(IllegalArgumentException.class, () -> GrammarRow.parse("S a b"));
        GrammarRow row = GrammarRow.parse("  NP ->  Det   N | N ");
        assertEquals("NP", row.lhs());
        assertEquals(List.of(List.of("Det", "N"), List.of("N")), row.alternatives());
    }
}
