package com.xpdustry.prefixtrie.core.collection;

import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * An in-memory set of strings indexed by their code units, supporting prefix lookup,
 * prefix enumeration and edit-distance bounded matching.
 * <p>
 * Implementations are not thread-safe. Read operations may run concurrently with each other,
 * but never with a mutation. Use {@link #copy()} to hand a stable snapshot to other readers.
 */
public interface PrefixTrie {

    static PrefixTrie.Mutable create() {
        return create(UnitEncoding.UTF_16);
    }

    static PrefixTrie.Mutable create(final UnitEncoding encoding) {
        return new PrefixTrieImpl(encoding);
    }

    UnitEncoding encoding();

    /**
     * Equivalent to {@code contains(chars, true)}.
     */
    default boolean contains(final CharSequence chars) {
        return this.contains(chars, true);
    }

    /**
     * Checks whether the given units occur in this trie.
     *
     * @param chars the units to look up
     * @param partial if {@code true}, a prefix of a stored string is enough, which makes the empty
     *                string always present. Otherwise, {@code chars} must be a stored string.
     */
    boolean contains(final CharSequence chars, final boolean partial);

    /**
     * Returns the number of stored strings starting with {@code prefix}.
     */
    int count(final CharSequence prefix);

    default int size() {
        return this.count("");
    }

    boolean isEmpty();

    /**
     * Passes every stored string starting with {@code prefix} to the consumer, once each and in no
     * particular order. The empty prefix matches every string.
     */
    void match(final CharSequence prefix, final Consumer<? super String> consumer);

    default void match(final CharSequence prefix, final Collection<? super String> target) {
        this.match(prefix, target::add);
    }

    List<String> matches(final CharSequence prefix);

    /**
     * Finds the stored strings within {@code maxDistance} insertions, deletions or substitutions of
     * {@code query}. A negative distance yields an empty list.
     */
    List<FuzzyMatch> matchFuzzy(final CharSequence query, final int maxDistance);

    Stats stats();

    /**
     * Renders the tree for debugging, children sorted by unit and complete strings marked with {@code *}.
     */
    String visualize();

    PrefixTrie.Mutable copy();

    record FuzzyMatch(String word, int distance) {}

    /**
     * @param strings number of stored strings
     * @param nodes number of nodes, including the root and the end markers
     * @param maxDepth length in units of the longest stored string
     * @param averageDepth average length in units of the stored strings
     * @param averageBranchingFactor average child count of the nodes below the root having children
     * @param estimatedBytes rough heap footprint of the node graph
     */
    record Stats(
            int strings,
            int nodes,
            int maxDepth,
            double averageDepth,
            double averageBranchingFactor,
            long estimatedBytes) {}

    interface Mutable extends PrefixTrie {

        /**
         * Stores a string. The empty string is ignored.
         *
         * @return {@code true} if the string was not already stored
         */
        boolean insert(final CharSequence chars);

        default int insertAll(final Iterable<? extends CharSequence> strings) {
            int inserted = 0;
            for (final var string : strings) {
                if (this.insert(string)) {
                    inserted++;
                }
            }
            return inserted;
        }

        /**
         * Removes a stored string and prunes the branch nodes it no longer needs.
         *
         * @return {@code true} if the string was stored
         */
        boolean remove(final CharSequence chars);

        void clear();
    }
}
