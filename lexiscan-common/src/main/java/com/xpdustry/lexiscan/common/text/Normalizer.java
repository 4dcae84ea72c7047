package com.xpdustry.lexiscan.common.text;

public interface Normalizer {

    String canonicalize(final String buffer);

    String normalize(final String token);
}
