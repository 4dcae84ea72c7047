package com.xpdustry.lexiscan.common.text;

import com.google.common.base.Preconditions;
import java.util.Locale;
import java.util.regex.Pattern;

public final class FoldingNormalizer implements Normalizer {

    public static final FoldingNormalizer INSTANCE = new FoldingNormalizer();

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private FoldingNormalizer() {}

    @Override
    public String canonicalize(final String buffer) {
        Preconditions.checkNotNull(buffer, "buffer");
        return java.text.Normalizer.normalize(buffer, java.text.Normalizer.Form.NFC);
    }

    // "Café" -> "cafe", "Ærø" -> "ærø" (only combining marks are dropped)
    @Override
    public String normalize(final String token) {
        Preconditions.checkNotNull(token, "token");
        final var decomposed = java.text.Normalizer.normalize(token, java.text.Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }
}
