package com.xpdustry.lexiscan.common.text;

import com.google.common.base.Preconditions;
import java.util.Locale;

public final class SimpleNormalizer implements Normalizer {

    public static final SimpleNormalizer INSTANCE = new SimpleNormalizer();

    private SimpleNormalizer() {}

    @Override
    public String canonicalize(final String buffer) {
        Preconditions.checkNotNull(buffer, "buffer");
        return java.text.Normalizer.normalize(buffer, java.text.Normalizer.Form.NFC);
    }

    @Override
    public String normalize(final String token) {
        Preconditions.checkNotNull(token, "token");
        return token.toLowerCase(Locale.ROOT);
    }
}
