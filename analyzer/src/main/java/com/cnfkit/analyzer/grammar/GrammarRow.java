package com.cnfkit.analyzer.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * One declared row of a grammar: a left-hand side and a {@code |}-delimited list of
 * space-delimited alternatives. An empty alternative stands for epsilon.
 */
public record GrammarRow(String lhs, String rhs) {

    /** Parses {@code "S -> a S b | ε"}; the arrow may also be written {@code →}. */
    public static GrammarRow parse(String line) {
        String text = line.strip();
        int arrow = text.indexOf("->");
        int width = 2;
        if (arrow < 0) {
            arrow = text.indexOf('→');
            width = 1;
        }
        if (arrow < 0) {
            throw new IllegalArgumentException("Missing '->' in grammar line: " + line);
        }
        return new GrammarRow(text.substring(0, arrow).strip(), text.substring(arrow + width).strip());
    }

    public static List<GrammarRow> parseAll(String... lines) {
        List<GrammarRow> rows = new ArrayList<>();
        for (String line : lines) {
            if (!line.isBlank()) {
                rows.add(parse(line));
            }
        }
        return rows;
    }

    /**
     * Splits the right-hand side into alternatives of tokens. Epsilon alternatives come back as
     * {@code [ε]}; an {@code ε} inside a longer alternative derives nothing and is dropped.
     */
    public List<List<String>> alternatives() {
        List<List<String>> result = new ArrayList<>();
        String source = rhs == null ? "" : rhs;
        for (String part : source.split("\\|", -1)) {
            List<String> tokens = new ArrayList<>();
            for (String token : part.strip().split("\\s+")) {
                if (!token.isEmpty() && !Grammar.EPSILON_TEXT.equals(token)) {
                    tokens.add(token);
                }
            }
            if (tokens.isEmpty()) {
                tokens.add(Grammar.EPSILON_TEXT);
            }
            result.add(tokens);
        }
        return result;
    }
}
