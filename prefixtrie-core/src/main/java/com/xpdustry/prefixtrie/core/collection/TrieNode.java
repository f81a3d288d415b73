package com.xpdustry.prefixtrie.core.collection;

import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.jspecify.annotations.Nullable;

final class TrieNode {

    /**
     * Key of the child marking the end of a stored string. No encoding produces negative units.
     */
    static final int END = -1;

    static final int ROOT = -2;

    private final int key;
    private @Nullable TIntObjectMap<TrieNode> children = null;

    TrieNode(final int key) {
        this.key = key;
    }

    static TrieNode root() {
        return new TrieNode(ROOT);
    }

    int key() {
        return this.key;
    }

    boolean isEnd() {
        return this.key == END;
    }

    boolean isTerminal() {
        return this.child(END) != null;
    }

    @Nullable TrieNode child(final int unit) {
        return this.children == null ? null : this.children.get(unit);
    }

    TrieNode childOrCreate(final int unit) {
        if (this.children == null) {
            this.children = new TIntObjectHashMap<>();
        }
        var child = this.children.get(unit);
        if (child == null) {
            child = new TrieNode(unit);
            this.children.put(unit, child);
        }
        return child;
    }

    @Nullable TrieNode removeChild(final int unit) {
        if (this.children == null) {
            return null;
        }
        final var removed = this.children.remove(unit);
        if (this.children.isEmpty()) {
            this.children = null;
        }
        return removed;
    }

    boolean hasChildren() {
        return this.children != null;
    }

    int childCount() {
        return this.children == null ? 0 : this.children.size();
    }

    Collection<TrieNode> children() {
        return this.children == null ? List.of() : this.children.valueCollection();
    }

    // END sorts first
    int[] sortedKeys() {
        if (this.children == null) {
            return new int[0];
        }
        final var keys = this.children.keys();
        Arrays.sort(keys);
        return keys;
    }
}
