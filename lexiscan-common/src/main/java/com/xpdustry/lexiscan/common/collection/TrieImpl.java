package com.xpdustry.lexiscan.common.collection;

import com.google.common.base.Preconditions;
import gnu.trove.map.TCharObjectMap;
import gnu.trove.map.hash.TCharObjectHashMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

final class TrieImpl<V> implements Trie.Mutable<V> {

    private static final char[] NO_TRANSITIONS = new char[0];

    private final List<NodeImpl<V>> nodes = new ArrayList<>();
    private final NodeImpl<V> root;
    private boolean frozen = false;

    TrieImpl() {
        this.root = this.allocate();
    }

    @Override
    public Node<V> root() {
        return this.root;
    }

    @Override
    public int size() {
        return this.nodes.size();
    }

    @Override
    public @Nullable Node<V> find(final CharSequence chars) {
        Preconditions.checkNotNull(chars, "chars");

        Node<V> node = this.root;
        for (int i = 0; i < chars.length(); i++) {
            node = node.child(chars.charAt(i));
            if (node == null) {
                return null;
            }
        }

        return node;
    }

    @Override
    public @Nullable V put(final CharSequence chars, final @Nullable V meta) {
        Preconditions.checkNotNull(chars, "chars");
        Preconditions.checkState(!this.frozen, "The trie is frozen");

        var node = this.root;
        for (int i = 0; i < chars.length(); i++) {
            final var c = chars.charAt(i);
            if (node.children == null) {
                node.children = new TCharObjectHashMap<>();
            }
            var next = node.children.get(c);
            if (next == null) {
                next = this.allocate();
                node.children.put(c, next);
            }
            node = next;
        }

        final var previous = node.meta;
        node.terminal = true;
        node.meta = meta;
        return previous;
    }

    @Override
    public Trie<V> freeze() {
        this.frozen = true;
        return this;
    }

    @Override
    public boolean isFrozen() {
        return this.frozen;
    }

    private NodeImpl<V> allocate() {
        final var node = new NodeImpl<V>(this.nodes.size());
        this.nodes.add(node);
        return node;
    }

    private static final class NodeImpl<V> implements Node<V> {

        private final int id;
        private @Nullable TCharObjectMap<NodeImpl<V>> children = null;
        private boolean terminal = false;
        private @Nullable V meta = null;

        private NodeImpl(final int id) {
            this.id = id;
        }

        @Override
        public int id() {
            return this.id;
        }

        @Override
        public @Nullable Node<V> child(final char symbol) {
            return this.children == null ? null : this.children.get(symbol);
        }

        @Override
        public char[] transitions() {
            if (this.children == null) {
                return NO_TRANSITIONS;
            }
            final var symbols = this.children.keys();
            Arrays.sort(symbols);
            return symbols;
        }

        @Override
        public boolean isFinal() {
            return this.terminal;
        }

        @Override
        public @Nullable V meta() {
            return this.meta;
        }

        @Override
        public String toString() {
            return "Node{id=" + this.id + ", final=" + this.terminal + '}';
        }
    }
}
