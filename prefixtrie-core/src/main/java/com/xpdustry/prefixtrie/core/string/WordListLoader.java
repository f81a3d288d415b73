package com.xpdustry.prefixtrie.core.string;

import com.google.common.base.Preconditions;
import com.xpdustry.prefixtrie.core.collection.PrefixTrie;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads newline separated word lists. Lines are trimmed, blank lines and lines starting with {@code #} are skipped.
 *
 * @param lowercase whether words are lowercased with {@link Locale#ROOT} before insertion
 */
public record WordListLoader(boolean lowercase) {

    public static final WordListLoader DEFAULT = new WordListLoader(true);

    private static final Logger LOGGER = LoggerFactory.getLogger(WordListLoader.class);

    /**
     * @return the number of words that were not already stored in the target
     */
    public int load(final Reader reader, final PrefixTrie.Mutable target) throws IOException {
        Preconditions.checkNotNull(reader, "reader");
        Preconditions.checkNotNull(target, "target");

        final var buffered = reader instanceof BufferedReader cast ? cast : new BufferedReader(reader);
        int inserted = 0;
        String line;
        while ((line = buffered.readLine()) != null) {
            line = line.trim();
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            if (this.lowercase) {
                line = line.toLowerCase(Locale.ROOT);
            }
            if (target.insert(line)) {
                inserted++;
            }
        }
        return inserted;
    }

    /**
     * Loads a UTF-8 classpath resource.
     *
     * @throws IllegalStateException if the resource is missing or cannot be read
     */
    public int loadResource(final String path, final PrefixTrie.Mutable target) {
        Preconditions.checkNotNull(path, "path");
        final var stream = WordListLoader.class.getResourceAsStream(path);
        if (stream == null) {
            throw new IllegalStateException("Missing word list resource " + path);
        }
        try (final var reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            final var inserted = this.load(reader, target);
            LOGGER.info("Loaded {} words from {}", inserted, path);
            return inserted;
        } catch (final IOException e) {
            throw new IllegalStateException("Failed to load word list " + path, e);
        }
    }
}
