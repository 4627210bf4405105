package com.cnfkit.analyzer.tree;

import com.cnfkit.analyzer.grammar.Grammar.Symbol;
import com.cnfkit.analyzer.grammar.Grammar.Terminal;
import com.cnfkit.analyzer.grammar.Grammar.Variable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * Immutable derivation tree handed to renderers. Inner nodes are labelled with variables, leaves
 * hold terminal text. Nodes that could not be derived are kept as error markers so a partial tree
 * can still be shown.
 */
public final class DerivationTree {

    public static final class Node {
        public final Symbol symbol;
        public final List<Node> children;
        public final boolean error;

        private Node(Symbol symbol, List<Node> children, boolean error) {
            this.symbol = Objects.requireNonNull(symbol, "symbol");
            this.children = List.copyOf(children);
            this.error = error;
        }

        public static Node leaf(Terminal terminal) {
            return new Node(terminal, List.of(), false);
        }

        public static Node of(Variable variable, List<Node> children) {
            return new Node(variable, children, false);
        }

        public static Node error(Variable variable) {
            return new Node(variable, List.of(), true);
        }

        public String label() {
            return error ? "ERROR:" + symbol.name() : symbol.name();
        }

        /** Label as shown to users: terminal text is quoted. */
        public String displayLabel() {
            return symbol instanceof Terminal ? "\"" + symbol.name() + "\"" : label();
        }

        public boolean isLeaf() {
            return children.isEmpty();
        }

        public List<Node> preOrder() {
            List<Node> result = new ArrayList<>();
            Deque<Node> stack = new ArrayDeque<>();
            stack.push(this);
            while (!stack.isEmpty()) {
                Node current = stack.pop();
                result.add(current);
                ListIterator<Node> iterator = current.children.listIterator(current.children.size());
                while (iterator.hasPrevious()) {
                    stack.push(iterator.previous());
                }
            }
            return result;
        }
    }

    public final Node root;

    public DerivationTree(Node root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    /** Terminal leaves from left to right; epsilon leaves contribute nothing. */
    public List<String> yield() {
        List<String> tokens = new ArrayList<>();
        for (Node node : root.preOrder()) {
            if (node.symbol instanceof Terminal terminal && !terminal.isEpsilon()) {
                tokens.add(terminal.text);
            }
        }
        return tokens;
    }

    public boolean hasErrors() {
        return root.preOrder().stream().anyMatch(node -> node.error);
    }

    /** Renders {@code (S (A "a") "b")}. */
    public String toBracketString() {
        StringBuilder sb = new StringBuilder();
        render(root, sb);
        return sb.toString();
    }

    private static void render(Node node, StringBuilder sb) {
        if (node.isLeaf()) {
            sb.append(node.displayLabel());
            return;
        }
        sb.append('(').append(node.label());
        for (Node child : node.children) {
            sb.append(' ');
            render(child, sb);
        }
        sb.append(')');
    }

    @Override
    public String toString() {
        return toBracketString();
    }
}
