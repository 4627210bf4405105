package com.cnfkit.analyzer.tree;

import com.cnfkit.analyzer.cnf.CnfGrammar;
import com.cnfkit.analyzer.cyk.RecognitionTable;
import com.cnfkit.analyzer.cyk.RecognitionTable.Literal;
import com.cnfkit.analyzer.cyk.RecognitionTable.Split;
import com.cnfkit.analyzer.cyk.RecognitionTable.Witness;
import com.cnfkit.analyzer.grammar.Grammar.Terminal;
import com.cnfkit.analyzer.grammar.Grammar.Variable;
import com.cnfkit.analyzer.tree.DerivationTree.Node;
import com.cnfkit.analyzer.util.TreeOps;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks the witnesses of a {@link RecognitionTable} back into a derivation tree. Terminal wrappers
 * collapse into their terminal leaf and binarization chains are spliced into their parent, so the
 * tree shows the original n-ary right-hand sides.
 */
public final class TreeReconstructor {

    private final RecognitionTable table;
    private final CnfGrammar grammar;

    private TreeReconstructor(RecognitionTable table, CnfGrammar grammar) {
        this.table = table;
        this.grammar = grammar;
    }

    public static DerivationTree reconstruct(RecognitionTable table, CnfGrammar grammar) {
        return reconstruct(table, grammar, grammar.start(), 0, table.size() - 1);
    }

    public static DerivationTree reconstruct(
            RecognitionTable table, CnfGrammar grammar, Variable root, int i, int j) {
        return new DerivationTree(new TreeReconstructor(table, grammar).build(root, i, j));
    }

    private Node build(Variable variable, int i, int j) {
        Optional<Witness> witness = table.witness(variable, i, j);
        if (witness.isEmpty()) {
            return Node.error(variable);
        }
        if (witness.get() instanceof Literal literal) {
            Optional<Terminal> wrapped = grammar.terminalFor(variable);
            if (wrapped.isPresent()) {
                return Node.leaf(wrapped.get());
            }
            return Node.of(variable, List.of(Node.leaf(new Terminal(literal.token()))));
        }
        Split split = (Split) witness.get();
        Node left = build(split.left(), i, split.k());
        Node right = build(split.right(), split.k() + 1, j);
        List<Node> children = new ArrayList<>();
        TreeOps.appendSpliced(children, left);
        TreeOps.appendSpliced(children, right);
        return Node.of(variable, children);
    }
}
