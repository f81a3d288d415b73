package com.xpdustry.prefixtrie.core.collection;

import java.util.ArrayDeque;
import java.util.Deque;

final class TrieRenderer {

    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";
    private static final String INDENT = "│   ";
    private static final String LAST_INDENT = "    ";

    private TrieRenderer() {}

    static String render(final TrieNode root, final UnitEncoding encoding) {
        final var builder = new StringBuilder("Root\n");
        final Deque<Line> lines = new ArrayDeque<>();
        pushChildren(lines, root, "");

        while (!lines.isEmpty()) {
            final var line = lines.pop();
            builder.append(line.indent()).append(line.last() ? LAST_BRANCH : BRANCH);
            encoding.append(builder, line.node().key());
            if (line.node().isTerminal()) {
                builder.append(" *");
            }
            builder.append('\n');
            pushChildren(lines, line.node(), line.indent() + (line.last() ? LAST_INDENT : INDENT));
        }

        return builder.toString();
    }

    // Pushed in reverse so the smallest unit pops first
    private static void pushChildren(final Deque<Line> lines, final TrieNode node, final String indent) {
        final var keys = node.sortedKeys();
        final var first = keys.length > 0 && keys[0] == TrieNode.END ? 1 : 0;
        for (int i = keys.length - 1; i >= first; i--) {
            final var child = node.child(keys[i]);
            if (child != null) {
                lines.push(new Line(child, indent, i == keys.length - 1));
            }
        }
    }

    private record Line(TrieNode node, String indent, boolean last) {}
}
