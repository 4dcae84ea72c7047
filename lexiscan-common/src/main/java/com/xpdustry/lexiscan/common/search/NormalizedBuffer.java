package com.xpdustry.lexiscan.common.search;

import com.google.common.base.Preconditions;
import com.xpdustry.lexiscan.common.text.Normalizer;
import com.xpdustry.lexiscan.common.text.Span;
import com.xpdustry.lexiscan.common.text.Tokenizer;
import gnu.trove.impl.Constants;
import gnu.trove.map.TIntIntMap;
import gnu.trove.map.hash.TIntIntHashMap;
import org.jspecify.annotations.Nullable;

/**
 * The normalized projection of a buffer, along with the token boundaries linking its offsets back to the original
 * buffer. Only offsets where a normalized token starts or ends can be translated.
 */
public final class NormalizedBuffer {

    private static final int NO_ENTRY = -1;

    private final String text;
    private final TIntIntMap starts;
    private final TIntIntMap ends;

    private NormalizedBuffer(final String text, final TIntIntMap starts, final TIntIntMap ends) {
        this.text = text;
        this.starts = starts;
        this.ends = ends;
    }

    public static NormalizedBuffer of(final String buffer, final Normalizer normalizer, final Tokenizer tokenizer) {
        Preconditions.checkNotNull(buffer, "buffer");
        Preconditions.checkNotNull(normalizer, "normalizer");
        Preconditions.checkNotNull(tokenizer, "tokenizer");

        final var builder = new StringBuilder(buffer.length());
        final var separator = tokenizer.separator();
        final TIntIntMap starts = createBoundaryMap();
        final TIntIntMap ends = createBoundaryMap();

        for (final var token : tokenizer.tokens(buffer)) {
            final var normalized = normalizer.normalize(normalizer.canonicalize(token.term()));
            if (normalized.isEmpty()) {
                continue;
            }
            if (!starts.isEmpty()) {
                builder.append(separator);
            }
            starts.put(builder.length(), token.span().start());
            builder.append(normalized);
            ends.put(builder.length(), token.span().end());
        }

        return new NormalizedBuffer(builder.toString(), starts, ends);
    }

    public static String normalize(final String buffer, final Normalizer normalizer, final Tokenizer tokenizer) {
        return of(buffer, normalizer, tokenizer).text();
    }

    public String text() {
        return this.text;
    }

    public int originalStart(final int offset) {
        return this.starts.get(offset);
    }

    public int originalEnd(final int offset) {
        return this.ends.get(offset);
    }

    public @Nullable Span translate(final int start, final int end) {
        if (start < 0 || end < start) {
            return null;
        }
        final var originalStart = this.starts.get(start);
        if (originalStart == NO_ENTRY) {
            return null;
        }
        final var originalEnd = this.ends.get(end);
        if (originalEnd == NO_ENTRY) {
            return null;
        }
        return new Span(originalStart, originalEnd);
    }

    private static TIntIntMap createBoundaryMap() {
        return new TIntIntHashMap(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, NO_ENTRY, NO_ENTRY);
    }
}
