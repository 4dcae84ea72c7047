package com.xpdustry.lexiscan.common.search;

import com.google.common.base.Preconditions;
import com.xpdustry.lexiscan.common.collection.Trie;
import gnu.trove.map.TIntObjectMap;
import java.util.List;

/**
 * Aho-Corasick automaton over a frozen {@link Trie}. Both the failure and output functions are indexed by
 * {@link Trie.Node#id()}, so only nodes of the trie this automaton was built from are accepted.
 */
public final class Automaton<V> {

    private final Trie<V> trie;
    private final Trie.Node<V>[] nodes;
    private final int[] failure;
    private final TIntObjectMap<List<String>> output;

    Automaton(
            final Trie<V> trie,
            final Trie.Node<V>[] nodes,
            final int[] failure,
            final TIntObjectMap<List<String>> output) {
        this.trie = trie;
        this.nodes = nodes;
        this.failure = failure;
        this.output = output;
    }

    public static <V> Automaton<V> build(final Trie<V> trie) {
        return new AutomatonBuilder<>(trie).build();
    }

    public Trie<V> trie() {
        return this.trie;
    }

    public Trie.Node<V> root() {
        return this.trie.root();
    }

    public Trie.Node<V> failure(final Trie.Node<V> node) {
        return this.nodes[this.failure[this.check(node)]];
    }

    public List<String> output(final Trie.Node<V> node) {
        final var outputs = this.output.get(this.check(node));
        return outputs == null ? List.of() : outputs;
    }

    /**
     * Consumes one symbol from the given state, following failure links on mismatch. Returns the root when no suffix
     * of the current prefix can be extended by the symbol.
     */
    public Trie.Node<V> step(final Trie.Node<V> node, final char symbol) {
        this.check(node);
        final var root = this.trie.root();
        var current = node;
        var child = current.child(symbol);
        while (child == null && current != root) {
            current = this.nodes[this.failure[current.id()]];
            child = current.child(symbol);
        }
        return child == null ? root : child;
    }

    private int check(final Trie.Node<V> node) {
        Preconditions.checkNotNull(node, "node");
        final var id = node.id();
        Preconditions.checkArgument(
                id >= 0 && id < this.nodes.length && this.nodes[id] == node,
                "The node %s does not belong to this automaton",
                node);
        return id;
    }
}
