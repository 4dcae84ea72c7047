package com.xpdustry.lexiscan.common.search;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Streams;
import com.xpdustry.lexiscan.common.collection.Trie;
import com.xpdustry.lexiscan.common.text.Normalizer;
import com.xpdustry.lexiscan.common.text.Tokenizer;
import java.util.Collections;
import java.util.Iterator;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Finds every dictionary entry of a trie occurring in a buffer, in a single left-to-right pass over its normalized
 * projection. Matches must start and end on token boundaries, and are reported in the original buffer coordinates.
 *
 * <p>The normalizer and tokenizer must be the ones used to build the trie. A finder holds no mutable state: scans
 * over different buffers can run concurrently if the normalizer and tokenizer allow it.
 */
public final class StringFinder<V> {

    private final Automaton<V> automaton;
    private final Normalizer normalizer;
    private final Tokenizer tokenizer;

    private StringFinder(final Automaton<V> automaton, final Normalizer normalizer, final Tokenizer tokenizer) {
        this.automaton = Preconditions.checkNotNull(automaton, "automaton");
        this.normalizer = Preconditions.checkNotNull(normalizer, "normalizer");
        this.tokenizer = Preconditions.checkNotNull(tokenizer, "tokenizer");
    }

    public static <V> StringFinder<V> create(
            final Trie<V> trie, final Normalizer normalizer, final Tokenizer tokenizer) {
        return new StringFinder<>(Automaton.build(trie), normalizer, tokenizer);
    }

    public static <V> StringFinder<V> create(
            final Automaton<V> automaton, final Normalizer normalizer, final Tokenizer tokenizer) {
        return new StringFinder<>(automaton, normalizer, tokenizer);
    }

    /**
     * Lazily scans the buffer. Matches are ordered by their end in the normalized buffer, matches ending on the same
     * symbol follow the output order of the automaton.
     */
    public Iterator<Match<V>> scan(final CharSequence buffer) {
        Preconditions.checkNotNull(buffer, "buffer");
        return new Scan(buffer.toString());
    }

    public Stream<Match<V>> stream(final CharSequence buffer) {
        return Streams.stream(this.scan(buffer));
    }

    public Automaton<V> automaton() {
        return this.automaton;
    }

    private final class Scan extends AbstractIterator<Match<V>> {

        private final String buffer;
        private @Nullable NormalizedBuffer normalized = null;
        private Trie.Node<V> node;
        private int index = 0;
        private Iterator<String> pending = Collections.emptyIterator();

        private Scan(final String buffer) {
            this.buffer = buffer;
            this.node = StringFinder.this.automaton.root();
        }

        @Override
        protected @Nullable Match<V> computeNext() {
            var normalized = this.normalized;
            if (normalized == null) {
                normalized = NormalizedBuffer.of(this.buffer, StringFinder.this.normalizer, StringFinder.this.tokenizer);
                this.normalized = normalized;
            }

            final var text = normalized.text();
            while (true) {
                while (this.pending.hasNext()) {
                    final var match = this.accept(normalized, this.pending.next(), this.index - 1);
                    if (match != null) {
                        return match;
                    }
                }
                if (this.index >= text.length()) {
                    return this.endOfData();
                }
                this.node = StringFinder.this.automaton.step(this.node, text.charAt(this.index++));
                this.pending = StringFinder.this.automaton.output(this.node).iterator();
            }
        }

        private @Nullable Match<V> accept(
                final NormalizedBuffer normalized, final String output, final int end) {
            final var span = normalized.translate(end - output.length() + 1, end + 1);
            if (span == null) {
                return null;
            }
            final var tokenizer = StringFinder.this.tokenizer;
            final var surface = tokenizer.join(
                    tokenizer.strings(StringFinder.this.normalizer.canonicalize(span.substring(this.buffer))));
            return new Match<>(output, surface, this.node.meta(), span);
        }
    }
}
