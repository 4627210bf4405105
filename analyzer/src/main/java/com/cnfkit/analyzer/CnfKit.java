package com.cnfkit.analyzer;

import com.cnfkit.analyzer.core.GrammarSession;
import com.cnfkit.analyzer.core.ValidationException;
import com.cnfkit.analyzer.grammar.GrammarRow;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Command-line front end:
 *
 * <pre>
 * CnfKit --grammar=grammar.txt [--start=S] [--validate="a a b b"] [--generate[=N]]
 * </pre>
 *
 * Grammar files hold one {@code LHS -> alt | alt} row per line; {@code #} starts a comment.
 */
public final class CnfKit {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private CnfKit() {
        // Utility class
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        String grammarFile = option(args, "--grammar");
        if (grammarFile == null) {
            err.println("Usage: CnfKit --grammar=<file> [--start=S] [--validate=\"tokens\"] [--generate[=N]]");
            return EXIT_USAGE;
        }

        List<GrammarRow> rows;
        try {
            rows = readRows(Path.of(grammarFile));
        } catch (IOException e) {
            err.println("Cannot read grammar file " + grammarFile + ": " + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }
        String start = option(args, "--start");
        if (start == null && !rows.isEmpty()) {
            start = rows.get(0).lhs();
        }

        GrammarSession session = new GrammarSession();
        try {
            GrammarSession.GrammarSummary summary = session.setGrammar(start, rows);
            out.println("CNF grammar (start " + summary.cnf().start() + "):");
            out.print(summary.cnf().text());

            if (hasFlag(args, "--generate")) {
                int count = parseCount(option(args, "--generate"), err);
                Set<String> generated = session.generate(count, 50, 15);
                out.println("Generated:");
                for (String sentence : generated) {
                    out.println("  " + (sentence.isEmpty() ? "ε" : sentence));
                }
            }

            String input = option(args, "--validate");
            if (input != null) {
                GrammarSession.ValidationResult result = session.validate(GrammarSession.tokenize(input));
                out.println(result.accepted() ? "Accepted" : "Rejected");
                result.derivation().ifPresent(tree -> out.println(tree.toBracketString()));
            }
            return EXIT_OK;
        } catch (ValidationException e) {
            err.println(e.reasonCode() + ": " + e.getMessage());
            e.partialTree().ifPresent(tree -> err.println(tree.toBracketString()));
            return EXIT_FAILED;
        } catch (AnalyzerException e) {
            err.println(e.reasonCode() + ": " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static List<GrammarRow> readRows(Path file) throws IOException {
        List<GrammarRow> rows = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String text = line.strip();
            if (text.isEmpty() || text.startsWith("#")) {
                continue;
            }
            rows.add(GrammarRow.parse(text));
        }
        return rows;
    }

    private static String option(String[] args, String name) {
        if (args == null) {
            return null;
        }
        for (String arg : args) {
            if (arg != null && arg.startsWith(name + "=")) {
                return arg.substring(name.length() + 1);
            }
        }
        return null;
    }

    private static boolean hasFlag(String[] args, String name) {
        if (args == null) {
            return false;
        }
        for (String arg : args) {
            if (arg != null && (arg.equals(name) || arg.startsWith(name + "="))) {
                return true;
            }
        }
        return false;
    }

    private static int parseCount(String value, PrintStream err) {
        if (value == null) {
            return 10;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ignored) {
            err.println("Invalid generate count: " + value);
            return 10;
        }
    }
}
