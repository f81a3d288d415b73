package com.xpdustry.prefixtrie.core.codec;

import com.google.common.escape.ArrayBasedCharEscaper;
import java.util.Map;

/**
 * Escapes the content of a JSON string literal, keeping the output within printable ASCII.
 */
final class JsonStringEscaper extends ArrayBasedCharEscaper {

    static final JsonStringEscaper INSTANCE = new JsonStringEscaper();

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private JsonStringEscaper() {
        super(
                Map.of(
                        '"', "\\\"",
                        '\\', "\\\\",
                        '\n', "\\n",
                        '\r', "\\r",
                        '\t', "\\t",
                        '\b', "\\b",
                        '\f', "\\f"),
                ' ',
                '~');
    }

    @Override
    protected char[] escapeUnsafe(final char c) {
        return new char[] {'\\', 'u', HEX[(c >> 12) & 0xF], HEX[(c >> 8) & 0xF], HEX[(c >> 4) & 0xF], HEX[c & 0xF]};
    }
}
