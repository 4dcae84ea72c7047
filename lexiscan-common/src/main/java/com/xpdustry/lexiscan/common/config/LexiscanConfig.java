package com.xpdustry.lexiscan.common.config;

import com.google.common.base.Preconditions;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

public record LexiscanConfig(NormalizerType normalizer, TokenizerType tokenizer, @Nullable String dictionary) {

    public static final String CLASSPATH_PREFIX = "classpath:";

    public static final LexiscanConfig DEFAULT = new LexiscanConfig(NormalizerType.FOLDING, TokenizerType.WORD, null);

    private static final Gson GSON = new Gson();

    public LexiscanConfig {
        normalizer = Objects.requireNonNullElse(normalizer, NormalizerType.FOLDING);
        tokenizer = Objects.requireNonNullElse(tokenizer, TokenizerType.WORD);
    }

    public static LexiscanConfig load(final Path path) {
        Preconditions.checkNotNull(path, "path");
        try (final var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        } catch (final IOException e) {
            throw new ConfigLoadException("Failed to read the config at " + path, path.toString(), e);
        }
    }

    public static LexiscanConfig load(final Reader reader, final String source) {
        Preconditions.checkNotNull(reader, "reader");
        final LexiscanConfig config;
        try {
            final var tree = JsonParser.parseReader(reader);
            config = GSON.fromJson(tree, LexiscanConfig.class);
            if (config != null) {
                checkVariant(tree, "normalizer", NormalizerType.class, source);
                checkVariant(tree, "tokenizer", TokenizerType.class, source);
            }
        } catch (final JsonParseException e) {
            throw new ConfigLoadException("Malformed config in " + source, source, e);
        }
        return config == null ? DEFAULT : config;
    }

    // Gson maps unknown enum names to null, which would silently fall back to the default
    private static <E extends Enum<E>> void checkVariant(
            final JsonElement tree, final String field, final Class<E> type, final String source) {
        final var value = tree.getAsJsonObject().get(field);
        if (value != null && !value.isJsonNull() && GSON.fromJson(value, type) == null) {
            throw new ConfigLoadException("Unknown " + field + " " + value + " in " + source, source);
        }
    }
}
