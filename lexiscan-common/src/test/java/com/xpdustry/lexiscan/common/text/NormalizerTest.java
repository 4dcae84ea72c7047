package com.xpdustry.lexiscan.common.text;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class NormalizerTest {

    private static final String DECOMPOSED = "Cafe\u0301";
    private static final String COMPOSED = "Caf\u00e9";

    @Test
    void test_simple_normalizer() {
        final var normalizer = SimpleNormalizer.INSTANCE;
        Assertions.assertEquals(COMPOSED, normalizer.canonicalize(DECOMPOSED));
        Assertions.assertEquals("caf\u00e9", normalizer.normalize(COMPOSED));
        Assertions.assertEquals("hello", normalizer.normalize("HeLLo"));
    }

    @Test
    void test_folding_normalizer() {
        final var normalizer = FoldingNormalizer.INSTANCE;
        Assertions.assertEquals(COMPOSED, normalizer.canonicalize(DECOMPOSED));
        Assertions.assertEquals("cafe", normalizer.normalize(COMPOSED));
        Assertions.assertEquals("cafe", normalizer.normalize(DECOMPOSED));
        Assertions.assertEquals("sao paulo", normalizer.normalize("São Paulo"));
        Assertions.assertEquals("ærø", normalizer.normalize("Ærø"));
    }
}
