package com.xpdustry.lexiscan.common.dictionary;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.xpdustry.lexiscan.common.collection.Trie;
import com.xpdustry.lexiscan.common.search.NormalizedBuffer;
import com.xpdustry.lexiscan.common.text.Normalizer;
import com.xpdustry.lexiscan.common.text.Tokenizer;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DictionaryLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DictionaryLoader.class);
    private static final Splitter FIELDS = Splitter.on('\t').limit(2).trimResults();

    private final Normalizer normalizer;
    private final Tokenizer tokenizer;

    public DictionaryLoader(final Normalizer normalizer, final Tokenizer tokenizer) {
        this.normalizer = Preconditions.checkNotNull(normalizer, "normalizer");
        this.tokenizer = Preconditions.checkNotNull(tokenizer, "tokenizer");
    }

    public Dictionary load(final Path path) {
        Preconditions.checkNotNull(path, "path");
        try (final var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return this.load(reader, path.toString());
        } catch (final IOException e) {
            throw new DictionaryLoadException("Failed to read the dictionary at " + path, path.toString(), e);
        }
    }

    public Dictionary loadResource(final String resource) {
        Preconditions.checkNotNull(resource, "resource");
        final var stream = DictionaryLoader.class.getResourceAsStream(resource);
        if (stream == null) {
            throw new DictionaryLoadException("Missing dictionary resource " + resource, resource);
        }
        try (final var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return this.load(reader, resource);
        } catch (final IOException e) {
            throw new DictionaryLoadException("Failed to read the dictionary resource " + resource, resource, e);
        }
    }

    public Dictionary load(final BufferedReader reader, final String source) throws IOException {
        Preconditions.checkNotNull(reader, "reader");
        final Trie.Mutable<String> trie = Trie.create();
        var entries = 0;
        var number = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            number++;
            line = line.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            final var fields = FIELDS.splitToList(line);
            final var key = NormalizedBuffer.normalize(fields.get(0), this.normalizer, this.tokenizer);
            if (key.isEmpty()) {
                LOGGER.warn("Skipping line {} of {}, the entry \"{}\" has no tokens", number, source, fields.get(0));
                continue;
            }

            final var meta = fields.size() > 1 && !fields.get(1).isEmpty() ? fields.get(1) : null;
            final var existing = trie.find(key);
            if (existing != null && existing.isFinal()) {
                LOGGER.debug("Line {} of {} overrides the entry \"{}\"", number, source, key);
            } else {
                entries++;
            }
            trie.put(key, meta);
        }

        LOGGER.info("Loaded {} dictionary entries from {}", entries, source);
        return new Dictionary(source, trie.freeze(), entries);
    }
}
