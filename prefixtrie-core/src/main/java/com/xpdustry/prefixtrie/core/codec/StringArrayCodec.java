package com.xpdustry.prefixtrie.core.codec;

import com.xpdustry.prefixtrie.core.collection.PrefixTrie;
import com.xpdustry.prefixtrie.core.functional.Result;

/**
 * Converts the strings of a trie from and to a JSON array of strings.
 */
public interface StringArrayCodec {

    static StringArrayCodec create() {
        return create("");
    }

    /**
     * @param indent the indentation of each array element, or an empty string for compact output
     */
    static StringArrayCodec create(final String indent) {
        return new StringArrayCodecImpl(indent);
    }

    /**
     * Writes every stored string, sorted in natural order.
     */
    String encode(final PrefixTrie trie);

    /**
     * Clears the target, then inserts each string of the array as it is read. Parsing stops at the first
     * error, leaving the strings read so far in the target.
     *
     * @return the number of array elements read, or the reason the input was rejected
     */
    Result<Integer, DecodeError> decode(final String json, final PrefixTrie.Mutable target);
}
