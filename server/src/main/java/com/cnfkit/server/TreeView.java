package com.cnfkit.server;

import com.cnfkit.analyzer.tree.DerivationTree;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * JSON shape of a derivation tree for the rendering layer: {@code {name, children}}, children
 * omitted on leaves, terminal leaves quoted.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
record TreeView(String name, List<TreeView> children) {

    static TreeView of(DerivationTree tree) {
        return of(tree.root);
    }

    static TreeView of(DerivationTree.Node node) {
        return new TreeView(node.displayLabel(), node.children.stream().map(TreeView::of).toList());
    }
}
