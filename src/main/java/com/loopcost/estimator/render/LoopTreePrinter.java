package com.loopcost.estimator.render;

import com.loopcost.estimator.model.LoopNode;

import java.util.Objects;

/**
 * Prints a loop tree as indented text, four spaces per nesting level.
 */
public class LoopTreePrinter {

    private static final String INDENT = "    ";

    public String print(LoopNode root) {
        Objects.requireNonNull(root, "root");
        StringBuilder out = new StringBuilder();
        appendNode(root, 0, out);
        return out.toString();
    }

    private void appendNode(LoopNode node, int level, StringBuilder out) {
        out.append(INDENT.repeat(level)).append(label(node)).append('\n');
        for (LoopNode child : node.getChildren()) {
            appendNode(child, level + 1, out);
        }
    }

    static String label(LoopNode node) {
        return switch (node.getKind()) {
            case ROOT, WHILE -> node.getKind().getLabel();
            case FOR -> "For (iterable: " + node.getIterationFactor().orElseThrow().getTag() + ")";
        };
    }
}
