package com.cnfkit.analyzer.core;

import com.cnfkit.analyzer.cnf.CnfConverter;
import com.cnfkit.analyzer.cnf.CnfGrammar;
import com.cnfkit.analyzer.cyk.CykRecognizer;
import com.cnfkit.analyzer.gen.GenerationException;
import com.cnfkit.analyzer.gen.SentenceGenerators;
import com.cnfkit.analyzer.grammar.Grammar;
import com.cnfkit.analyzer.grammar.Grammar.Terminal;
import com.cnfkit.analyzer.grammar.GrammarCleaner;
import com.cnfkit.analyzer.grammar.GrammarParser;
import com.cnfkit.analyzer.grammar.GrammarRow;
import com.cnfkit.analyzer.tree.DerivationTree;
import com.cnfkit.analyzer.tree.TreeReconstructor;
import com.cnfkit.analyzer.util.TreeOps;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the active grammar and answers the four caller-facing operations. The grammar, its CNF
 * form and the recognizer live in one immutable snapshot that {@link #setGrammar} swaps in a
 * single write; a failed call leaves the previous snapshot untouched.
 */
public final class GrammarSession {

    private static final Logger log = LoggerFactory.getLogger(GrammarSession.class);

    public static final class Config {
        public int maxTokens = 30;
        public int maxDepth = 15;
        public int count = 10;
        public int attempts = 50;
        public int maxGeneratedChars = 200;
        // Matches maxTokens so every generated sentence can be validated.
        public int maxGeneratedTokens = 30;
        public Random random = new Random();
    }

    public record GrammarSummary(
            Grammar cleaned,
            CnfGrammar.Summary cnf,
            List<String> removedNonGenerating,
            List<String> removedUnreachable) {}

    public record ValidationResult(boolean accepted, DerivationTree tree) {
        public Optional<DerivationTree> derivation() {
            return Optional.ofNullable(tree);
        }
    }

    private record Snapshot(Grammar cleaned, CnfGrammar cnf, CykRecognizer recognizer) {}

    private final Config config;
    private volatile Snapshot current;
    private volatile DerivationTree lastTree;

    public GrammarSession() {
        this(new Config());
    }

    public GrammarSession(Config config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Splits caller input on whitespace. */
    public static List<String> tokenize(String input) {
        List<String> tokens = new ArrayList<>();
        if (input == null) {
            return tokens;
        }
        for (String token : input.strip().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public GrammarSummary setGrammar(String start, List<GrammarRow> rows) {
        Grammar parsed = GrammarParser.read(start, rows);
        GrammarCleaner.Result cleaned = GrammarCleaner.clean(parsed);
        CnfGrammar cnf = CnfConverter.convert(cleaned.grammar());
        Snapshot snapshot = new Snapshot(cleaned.grammar(), cnf, new CykRecognizer(cnf));

        current = snapshot;
        lastTree = null;
        log.info(
                "Grammar set: start={} variables={} cnfStart={} cnfProductions={}",
                cleaned.grammar().start(),
                cleaned.grammar().variables().size(),
                cnf.start(),
                cnf.grammar().productionCount());
        return new GrammarSummary(
                cleaned.grammar(), cnf.summary(), cleaned.removedNonGenerating(), cleaned.removedUnreachable());
    }

    public Set<String> generate() {
        return generate(config.count, config.attempts, config.maxDepth);
    }

    public Set<String> generate(int count, int attempts, int maxDepth) {
        Snapshot snapshot = current;
        if (snapshot == null) {
            throw new GenerationException(GenerationException.Reason.NO_GRAMMAR, "Grammar is not set.");
        }
        SentenceGenerators.Limits limits =
                new SentenceGenerators.Limits(
                        count, attempts, maxDepth, config.maxGeneratedChars, config.maxGeneratedTokens);
        return SentenceGenerators.collect(
                new SentenceGenerators.NaiveGenerator(snapshot.cleaned(), config.random),
                snapshot.cleaned(),
                limits);
    }

    public ValidationResult validate(List<String> tokens) {
        Snapshot snapshot = current;
        if (snapshot == null) {
            throw new ValidationException(ValidationException.Reason.NO_GRAMMAR, "Please set a grammar first.");
        }
        List<String> input = List.copyOf(tokens);
        if (input.size() > config.maxTokens) {
            throw new ValidationException(
                    ValidationException.Reason.TOO_MANY_TOKENS,
                    "Input has " + input.size() + " tokens; at most " + config.maxTokens + " are allowed.");
        }

        if (input.isEmpty()) {
            Grammar cleaned = snapshot.cleaned();
            boolean accepted = cleaned.hasEpsilon(cleaned.start()) || snapshot.cnf().derivesEmpty();
            DerivationTree tree =
                    accepted
                            ? new DerivationTree(
                                    DerivationTree.Node.of(
                                            cleaned.start(), List.of(DerivationTree.Node.leaf(Terminal.EPSILON))))
                            : null;
            lastTree = tree;
            return new ValidationResult(accepted, tree);
        }

        CykRecognizer.Recognition recognition = snapshot.recognizer().recognize(input);
        if (!recognition.accepted()) {
            lastTree = null;
            return new ValidationResult(false, null);
        }
        DerivationTree tree = TreeReconstructor.reconstruct(recognition.table(), snapshot.cnf());
        lastTree = tree;
        if (tree.hasErrors()) {
            log.error(
                    "Accepted input {} but {} node(s) could not be reconstructed: {}",
                    input,
                    TreeOps.countErrors(tree),
                    tree.toBracketString());
            throw new ValidationException(
                    ValidationException.Reason.RECONSTRUCTION,
                    "Input was accepted but its derivation tree is incomplete.",
                    tree);
        }
        return new ValidationResult(true, tree);
    }

    public Optional<DerivationTree> lastTree() {
        return Optional.ofNullable(lastTree);
    }

    public Optional<Grammar> cleanedGrammar() {
        Snapshot snapshot = current;
        return snapshot == null ? Optional.empty() : Optional.of(snapshot.cleaned());
    }

    public Optional<CnfGrammar> cnfGrammar() {
        Snapshot snapshot = current;
        return snapshot == null ? Optional.empty() : Optional.of(snapshot.cnf());
    }
}
