package com.xpdustry.prefixtrie.core.collection;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TIntArrayList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

final class PrefixTrieImpl implements PrefixTrie.Mutable {

    // Rough per-object sizes on a 64-bit JVM with compressed oops
    private static final long NODE_BYTES = 24L;
    private static final long CHILD_MAP_BYTES = 64L;
    // Trove keeps a key, a value and a state byte per slot, at a 0.5 load factor
    private static final long CHILD_ENTRY_BYTES = 18L;

    private final UnitEncoding encoding;
    private TrieNode root = TrieNode.root();

    PrefixTrieImpl(final UnitEncoding encoding) {
        this.encoding = Preconditions.checkNotNull(encoding, "encoding");
    }

    @Override
    public UnitEncoding encoding() {
        return this.encoding;
    }

    @Override
    public boolean insert(final CharSequence chars) {
        Preconditions.checkNotNull(chars, "chars");
        if (chars.length() == 0) {
            return false;
        }

        var node = this.root;
        for (final var unit : this.encoding.units(chars)) {
            node = node.childOrCreate(unit);
        }

        if (node.isTerminal()) {
            return false;
        }
        node.childOrCreate(TrieNode.END);
        return true;
    }

    @Override
    public boolean remove(final CharSequence chars) {
        Preconditions.checkNotNull(chars, "chars");
        if (chars.length() == 0) {
            return false;
        }

        final var units = this.encoding.units(chars);
        final var path = new TrieNode[units.length + 1];
        path[0] = this.root;
        for (int i = 0; i < units.length; i++) {
            final var next = path[i].child(units[i]);
            if (next == null) {
                return false;
            }
            path[i + 1] = next;
        }

        if (path[units.length].removeChild(TrieNode.END) == null) {
            return false;
        }

        // A node is only ever detached by its parent, once it has no children left
        for (int i = units.length; i > 0 && !path[i].hasChildren(); i--) {
            path[i - 1].removeChild(units[i - 1]);
        }
        return true;
    }

    @Override
    public void clear() {
        this.root = TrieNode.root();
    }

    @Override
    public boolean contains(final CharSequence chars, final boolean partial) {
        Preconditions.checkNotNull(chars, "chars");
        final var node = this.walk(this.encoding.units(chars));
        if (node == null) {
            return false;
        }
        return partial || node.isTerminal();
    }

    @Override
    public int count(final CharSequence prefix) {
        Preconditions.checkNotNull(prefix, "prefix");
        final var start = this.walk(this.encoding.units(prefix));
        if (start == null) {
            return 0;
        }

        int count = 0;
        final Deque<TrieNode> nodes = new ArrayDeque<>();
        nodes.push(start);
        while (!nodes.isEmpty()) {
            final var node = nodes.pop();
            for (final var child : node.children()) {
                if (child.isEnd()) {
                    count++;
                } else {
                    nodes.push(child);
                }
            }
        }
        return count;
    }

    @Override
    public boolean isEmpty() {
        return !this.root.hasChildren();
    }

    @Override
    public void match(final CharSequence prefix, final Consumer<? super String> consumer) {
        Preconditions.checkNotNull(prefix, "prefix");
        Preconditions.checkNotNull(consumer, "consumer");

        final var units = this.encoding.units(prefix);
        final var start = this.walk(units);
        if (start == null) {
            return;
        }

        final var path = new TIntArrayList(units);
        final Deque<Frame> frames = new ArrayDeque<>();
        for (final var child : start.children()) {
            frames.push(new Frame(child, units.length));
        }

        while (!frames.isEmpty()) {
            final var frame = frames.pop();
            truncate(path, frame.depth());

            if (frame.node().isEnd()) {
                consumer.accept(this.encoding.decode(path));
                continue;
            }

            path.add(frame.node().key());
            for (final var child : frame.node().children()) {
                frames.push(new Frame(child, frame.depth() + 1));
            }
        }
    }

    @Override
    public List<String> matches(final CharSequence prefix) {
        final var builder = ImmutableList.<String>builder();
        this.match(prefix, builder::add);
        return builder.build();
    }

    @Override
    public List<FuzzyMatch> matchFuzzy(final CharSequence query, final int maxDistance) {
        Preconditions.checkNotNull(query, "query");
        if (maxDistance < 0) {
            return List.of();
        }

        final var target = this.encoding.units(query);
        // Distances between the query prefixes and the empty string
        final var base = new int[target.length + 1];
        for (int i = 0; i < base.length; i++) {
            base[i] = i;
        }

        final List<FuzzyMatch> results = new ArrayList<>();
        final var path = new TIntArrayList();
        final Deque<FuzzyFrame> frames = new ArrayDeque<>();
        for (final var child : this.root.children()) {
            frames.push(new FuzzyFrame(child, base, 0));
        }

        while (!frames.isEmpty()) {
            final var frame = frames.pop();
            truncate(path, frame.depth());
            final var previous = frame.parentRow();

            if (frame.node().isEnd()) {
                final var distance = previous[target.length];
                if (distance <= maxDistance) {
                    results.add(new FuzzyMatch(this.encoding.decode(path), distance));
                }
                continue;
            }

            final var unit = frame.node().key();
            final var row = new int[previous.length];
            row[0] = previous[0] + 1;
            var minimum = row[0];
            for (int i = 1; i < row.length; i++) {
                final var substitution = previous[i - 1] + (target[i - 1] == unit ? 0 : 1);
                row[i] = Math.min(Math.min(row[i - 1] + 1, previous[i] + 1), substitution);
                minimum = Math.min(minimum, row[i]);
            }

            // Distances never decrease deeper in the subtree
            if (minimum > maxDistance) {
                continue;
            }

            path.add(unit);
            for (final var child : frame.node().children()) {
                frames.push(new FuzzyFrame(child, row, frame.depth() + 1));
            }
        }

        return results;
    }

    @Override
    public Stats stats() {
        int strings = 0;
        int nodes = 1;
        int maxDepth = 0;
        long totalDepth = 0;
        int parents = 0;
        long totalChildren = 0;
        int maps = 0;
        long entries = 0;

        final Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(this.root, 0));
        while (!frames.isEmpty()) {
            final var frame = frames.pop();
            final var node = frame.node();

            if (node.isEnd()) {
                strings++;
                totalDepth += frame.depth();
                maxDepth = Math.max(maxDepth, frame.depth());
                continue;
            }

            final var children = node.childCount();
            if (children > 0) {
                maps++;
                entries += children;
                // The branching factor only covers the nodes below the root
                if (node != this.root) {
                    parents++;
                    totalChildren += children;
                }
            }
            for (final var child : node.children()) {
                nodes++;
                frames.push(new Frame(child, child.isEnd() ? frame.depth() : frame.depth() + 1));
            }
        }

        return new Stats(
                strings,
                nodes,
                maxDepth,
                strings == 0 ? 0D : (double) totalDepth / strings,
                parents == 0 ? 0D : (double) totalChildren / parents,
                nodes * NODE_BYTES + maps * CHILD_MAP_BYTES + entries * CHILD_ENTRY_BYTES);
    }

    @Override
    public String visualize() {
        return TrieRenderer.render(this.root, this.encoding);
    }

    @Override
    public PrefixTrie.Mutable copy() {
        final var copy = new PrefixTrieImpl(this.encoding);
        final Deque<TrieNode[]> pairs = new ArrayDeque<>();
        pairs.push(new TrieNode[] {this.root, copy.root});
        while (!pairs.isEmpty()) {
            final var pair = pairs.pop();
            for (final var child : pair[0].children()) {
                pairs.push(new TrieNode[] {child, pair[1].childOrCreate(child.key())});
            }
        }
        return copy;
    }

    @Override
    public String toString() {
        return "PrefixTrie{encoding=" + this.encoding + ", size=" + this.size() + '}';
    }

    private @Nullable TrieNode walk(final int[] units) {
        var node = this.root;
        for (final var unit : units) {
            node = node.child(unit);
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    private static void truncate(final TIntArrayList path, final int length) {
        if (path.size() > length) {
            path.remove(length, path.size() - length);
        }
    }

    private record Frame(TrieNode node, int depth) {}

    private record FuzzyFrame(TrieNode node, int[] parentRow, int depth) {}
}
