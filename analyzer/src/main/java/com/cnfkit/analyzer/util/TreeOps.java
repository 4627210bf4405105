package com.cnfkit.analyzer.util;

import com.cnfkit.analyzer.grammar.Grammar.Variable;
import com.cnfkit.analyzer.tree.DerivationTree;
import java.util.List;

/**
 * Structural helpers for assembling derivation trees out of CNF derivations.
 */
public final class TreeOps {

    private TreeOps() {}

    /**
     * Appends {@code child} to {@code siblings}, or, when it is a binarization chain node, its
     * children in its place. Chain children were spliced already, so one level suffices.
     */
    public static void appendSpliced(List<DerivationTree.Node> siblings, DerivationTree.Node child) {
        if (!child.error && child.symbol instanceof Variable variable && variable.isChain()) {
            siblings.addAll(child.children);
        } else {
            siblings.add(child);
        }
    }

    public static int countErrors(DerivationTree tree) {
        return (int) tree.root.preOrder().stream().filter(node -> node.error).count();
    }
}
