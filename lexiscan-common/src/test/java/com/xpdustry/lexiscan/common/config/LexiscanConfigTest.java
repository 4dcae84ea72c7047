package com.xpdustry.lexiscan.common.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class LexiscanConfigTest {

    @Test
    void test_load_file(final @TempDir Path temp) throws IOException {
        final var file = temp.resolve("lexiscan.json");
        Files.writeString(
                file,
                """
                {
                  "normalizer": "simple",
                  "tokenizer": "character",
                  "dictionary": "words.txt"
                }
                """);

        assertThat(LexiscanConfig.load(file))
                .isEqualTo(new LexiscanConfig(NormalizerType.SIMPLE, TokenizerType.CHARACTER, "words.txt"));
    }

    @Test
    void test_defaults() {
        assertThat(LexiscanConfig.load(new StringReader("{}"), "inline")).isEqualTo(LexiscanConfig.DEFAULT);
        assertThat(LexiscanConfig.load(new StringReader(""), "inline")).isEqualTo(LexiscanConfig.DEFAULT);
        assertThat(LexiscanConfig.load(new StringReader("{\"dictionary\": \"classpath:/words.txt\"}"), "inline"))
                .isEqualTo(new LexiscanConfig(NormalizerType.FOLDING, TokenizerType.WORD, "classpath:/words.txt"));
    }

    @Test
    void test_malformed(final @TempDir Path temp) throws IOException {
        final var file = temp.resolve("lexiscan.json");
        Files.writeString(file, "{\"normalizer\": ");

        assertThatThrownBy(() -> LexiscanConfig.load(file))
                .isInstanceOf(ConfigLoadException.class)
                .satisfies(e -> assertThat(((ConfigLoadException) e).source()).isEqualTo(file.toString()));
    }

    @Test
    void test_unknown_variant() {
        assertThatThrownBy(() -> LexiscanConfig.load(new StringReader("{\"normalizer\": \"foldng\"}"), "inline"))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("normalizer")
                .hasMessageContaining("foldng");
        assertThatThrownBy(() -> LexiscanConfig.load(new StringReader("{\"tokenizer\": \"words\"}"), "inline"))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("tokenizer");
        assertThat(LexiscanConfig.load(new StringReader("{\"normalizer\": null}"), "inline"))
                .isEqualTo(LexiscanConfig.DEFAULT);
    }

    @Test
    void test_missing(final @TempDir Path temp) {
        assertThatThrownBy(() -> LexiscanConfig.load(temp.resolve("missing.json")))
                .isInstanceOf(ConfigLoadException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
