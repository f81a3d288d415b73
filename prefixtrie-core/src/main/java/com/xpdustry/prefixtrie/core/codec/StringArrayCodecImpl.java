package com.xpdustry.prefixtrie.core.codec;

import com.google.common.base.Preconditions;
import com.google.gson.Strictness;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.xpdustry.prefixtrie.core.collection.PrefixTrie;
import com.xpdustry.prefixtrie.core.functional.Result;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class StringArrayCodecImpl implements StringArrayCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(StringArrayCodecImpl.class);

    private final String indent;

    StringArrayCodecImpl(final String indent) {
        this.indent = Preconditions.checkNotNull(indent, "indent");
    }

    @Override
    public String encode(final PrefixTrie trie) {
        Preconditions.checkNotNull(trie, "trie");

        final List<String> strings = new ArrayList<>(trie.size());
        trie.match("", strings);
        strings.sort(Comparator.naturalOrder());

        final var output = new StringWriter();
        try (final var writer = new JsonWriter(output)) {
            writer.setIndent(this.indent);
            writer.beginArray();
            for (final var string : strings) {
                writer.jsonValue('"' + JsonStringEscaper.INSTANCE.escape(string) + '"');
            }
            writer.endArray();
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to write the string array", e);
        }
        return output.toString();
    }

    @Override
    public Result<Integer, DecodeError> decode(final String json, final PrefixTrie.Mutable target) {
        Preconditions.checkNotNull(json, "json");
        Preconditions.checkNotNull(target, "target");

        target.clear();
        int count = 0;
        try (final var reader = new JsonReader(new StringReader(json))) {
            // Rejects unknown escapes and raw control characters inside strings
            reader.setStrictness(Strictness.STRICT);
            if (reader.peek() != JsonToken.BEGIN_ARRAY) {
                return this.failure("Expected an array but was " + reader.peek() + " at " + reader.getPath());
            }
            reader.beginArray();
            while (reader.hasNext()) {
                if (reader.peek() != JsonToken.STRING) {
                    return this.failure("Expected a string but was " + reader.peek() + " at " + reader.getPath());
                }
                target.insert(reader.nextString());
                count++;
            }
            reader.endArray();
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                return this.failure("Unexpected content after the array at " + reader.getPath());
            }
        } catch (final IOException e) {
            return this.failure("Malformed string array after " + count + " elements: " + e.getMessage());
        }

        LOGGER.debug("Decoded {} strings into {}", count, target);
        return Result.success(count);
    }

    private Result<Integer, DecodeError> failure(final String message) {
        LOGGER.debug("Rejected string array: {}", message);
        return Result.failure(new DecodeError(message));
    }
}
