package com.xpdustry.lexiscan.common.search;

import com.xpdustry.lexiscan.common.text.CharacterTokenizer;
import com.xpdustry.lexiscan.common.text.FoldingNormalizer;
import com.xpdustry.lexiscan.common.text.SimpleNormalizer;
import com.xpdustry.lexiscan.common.text.Span;
import com.xpdustry.lexiscan.common.text.WordTokenizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class NormalizedBufferTest {

    @Test
    void test_shrinking_normalization() {
        final var buffer = "Visit  the Cafe\u0301, today";
        final var normalized = NormalizedBuffer.of(buffer, FoldingNormalizer.INSTANCE, WordTokenizer.INSTANCE);
        Assertions.assertEquals("visit the cafe today", normalized.text());

        Assertions.assertEquals(new Span(0, 5), normalized.translate(0, 5));
        Assertions.assertEquals(new Span(7, 10), normalized.translate(6, 9));
        Assertions.assertEquals(new Span(11, 16), normalized.translate(10, 14));
        Assertions.assertEquals(new Span(18, 23), normalized.translate(15, 20));
        Assertions.assertEquals(new Span(7, 16), normalized.translate(6, 14));
    }

    @Test
    void test_expanding_normalization() {
        final var normalized =
                NormalizedBuffer.of("Visit \u0130stanbul now", SimpleNormalizer.INSTANCE, WordTokenizer.INSTANCE);
        Assertions.assertEquals("visit i\u0307stanbul now", normalized.text());

        Assertions.assertEquals(new Span(6, 14), normalized.translate(6, 15));
        Assertions.assertEquals(new Span(15, 18), normalized.translate(16, 19));
        Assertions.assertEquals(new Span(0, 18), normalized.translate(0, 19));
        Assertions.assertNull(normalized.translate(6, 14));
    }

    @Test
    void test_only_token_boundaries() {
        final var normalized = NormalizedBuffer.of("the category", SimpleNormalizer.INSTANCE, WordTokenizer.INSTANCE);
        Assertions.assertNull(normalized.translate(4, 7));
        Assertions.assertNull(normalized.translate(5, 12));
        Assertions.assertNull(normalized.translate(3, 12));
        Assertions.assertNull(normalized.translate(-1, 3));
        Assertions.assertEquals(new Span(4, 12), normalized.translate(4, 12));
        Assertions.assertEquals(-1, normalized.originalStart(3));
        Assertions.assertEquals(-1, normalized.originalEnd(4));
        Assertions.assertEquals(4, normalized.originalStart(4));
        Assertions.assertEquals(3, normalized.originalEnd(3));
    }

    @Test
    void test_empty_separator() {
        final var normalized = NormalizedBuffer.of("A b", SimpleNormalizer.INSTANCE, CharacterTokenizer.INSTANCE);
        Assertions.assertEquals("ab", normalized.text());
        Assertions.assertEquals(new Span(0, 1), normalized.translate(0, 1));
        Assertions.assertEquals(new Span(2, 3), normalized.translate(1, 2));
        Assertions.assertEquals(new Span(0, 3), normalized.translate(0, 2));
    }

    @Test
    void test_skips_empty_tokens() {
        final var normalized = NormalizedBuffer.of("a \u0301 b", FoldingNormalizer.INSTANCE, WordTokenizer.INSTANCE);
        Assertions.assertEquals("a b", normalized.text());
        Assertions.assertEquals(new Span(0, 5), normalized.translate(0, 3));
    }

    @Test
    void test_empty() {
        final var normalized = NormalizedBuffer.of("", FoldingNormalizer.INSTANCE, WordTokenizer.INSTANCE);
        Assertions.assertEquals("", normalized.text());
        Assertions.assertNull(normalized.translate(0, 0));
    }
}
