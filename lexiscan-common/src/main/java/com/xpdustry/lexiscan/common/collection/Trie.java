package com.xpdustry.lexiscan.common.collection;

import com.google.common.base.Preconditions;
import com.xpdustry.lexiscan.common.search.NormalizedBuffer;
import com.xpdustry.lexiscan.common.text.Normalizer;
import com.xpdustry.lexiscan.common.text.Tokenizer;
import java.util.Map;
import org.jspecify.annotations.Nullable;

public interface Trie<V> {

    static <V> Trie.Mutable<V> create() {
        return new TrieImpl<>();
    }

    static <V> Trie<V> fromStrings(
            final Map<String, ? extends @Nullable V> entries, final Normalizer normalizer, final Tokenizer tokenizer) {
        Preconditions.checkNotNull(entries, "entries");
        final Trie.Mutable<V> trie = create();
        for (final var entry : entries.entrySet()) {
            final var key = NormalizedBuffer.normalize(entry.getKey(), normalizer, tokenizer);
            if (!key.isEmpty()) {
                trie.put(key, entry.getValue());
            }
        }
        return trie.freeze();
    }

    Node<V> root();

    int size();

    /** Whether the trie rejects further insertions. */
    boolean isFrozen();

    @Nullable Node<V> find(final CharSequence chars);

    interface Node<V> {

        int id();

        @Nullable Node<V> child(final char symbol);

        char[] transitions();

        boolean isFinal();

        @Nullable V meta();
    }

    interface Mutable<V> extends Trie<V> {

        @Nullable V put(final CharSequence chars, final @Nullable V meta);

        Trie<V> freeze();
    }
}
