package com.xpdustry.prefixtrie.core.collection;

import gnu.trove.list.TIntList;

/**
 * The code unit a trie edge is keyed by.
 */
public enum UnitEncoding {

    /**
     * One unit per UTF-16 {@code char}, supplementary characters take two units.
     */
    UTF_16 {
        @Override
        public int[] units(final CharSequence chars) {
            final var units = new int[chars.length()];
            for (int i = 0; i < units.length; i++) {
                units[i] = chars.charAt(i);
            }
            return units;
        }

        @Override
        public void append(final StringBuilder builder, final int unit) {
            builder.append((char) unit);
        }
    },

    /**
     * One unit per Unicode code point. Unpaired surrogates are kept as their own unit.
     */
    CODE_POINTS {
        @Override
        public int[] units(final CharSequence chars) {
            return chars.codePoints().toArray();
        }

        @Override
        public void append(final StringBuilder builder, final int unit) {
            builder.appendCodePoint(unit);
        }
    };

    public abstract int[] units(final CharSequence chars);

    public abstract void append(final StringBuilder builder, final int unit);

    public String decode(final TIntList units) {
        final var builder = new StringBuilder(units.size());
        for (int i = 0; i < units.size(); i++) {
            this.append(builder, units.get(i));
        }
        return builder.toString();
    }
}
