package com.xpdustry.lexiscan.common.search;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.xpdustry.lexiscan.common.collection.Trie;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AutomatonBuilder<V> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AutomatonBuilder.class);

    private final Trie<V> trie;
    private final Trie.Node<V>[] nodes;
    private final int[] failure;
    private final TIntObjectMap<List<String>> output = new TIntObjectHashMap<>();
    private boolean outputBuilt = false;
    private boolean failureBuilt = false;

    @SuppressWarnings("unchecked")
    public AutomatonBuilder(final Trie<V> trie) {
        this.trie = Preconditions.checkNotNull(trie, "trie");
        Preconditions.checkArgument(trie.isFrozen(), "The trie must be frozen before building an automaton");
        this.nodes = (Trie.Node<V>[]) new Trie.Node<?>[trie.size()];
        this.failure = new int[trie.size()];
    }

    public Automaton<V> build() {
        final var stopwatch = Stopwatch.createStarted();
        if (!this.outputBuilt) {
            this.buildOutput();
        }
        if (!this.failureBuilt) {
            this.buildFailure();
        }

        final TIntObjectMap<List<String>> frozen = new TIntObjectHashMap<>(this.output.size());
        this.output.forEachEntry((id, outputs) -> {
            frozen.put(id, List.copyOf(outputs));
            return true;
        });

        LOGGER.debug(
                "Built automaton over {} nodes with {} output states in {}",
                this.nodes.length,
                frozen.size(),
                stopwatch);
        return new Automaton<>(this.trie, this.nodes.clone(), this.failure.clone(), frozen);
    }

    void buildOutput() {
        Preconditions.checkState(!this.outputBuilt, "The output is already built");
        final var root = this.trie.root();
        final var queue = new ArrayDeque<Pending<V>>();
        queue.add(new Pending<>(root, ""));

        while (!queue.isEmpty()) {
            final var pending = queue.removeFirst();
            final var node = pending.node();
            this.nodes[this.index(node)] = node;

            // The empty string is never reported
            if (node.isFinal() && node != root) {
                final List<String> outputs = new ArrayList<>();
                outputs.add(pending.prefix());
                this.output.put(node.id(), outputs);
            }

            for (final var symbol : node.transitions()) {
                queue.addLast(new Pending<>(this.child(node, symbol), pending.prefix() + symbol));
            }
        }

        this.outputBuilt = true;
    }

    void buildFailure() {
        Preconditions.checkState(this.outputBuilt, "The output must be built before the failure");
        Preconditions.checkState(!this.failureBuilt, "The failure is already built");
        final var root = this.trie.root();
        final var queue = new int[this.nodes.length];
        var head = 0;
        var tail = 0;

        this.failure[root.id()] = root.id();
        for (final var symbol : root.transitions()) {
            final var child = this.child(root, symbol);
            this.failure[child.id()] = root.id();
            queue[tail++] = child.id();
        }

        while (head < tail) {
            final var node = this.nodes[queue[head++]];
            for (final var symbol : node.transitions()) {
                final var child = this.child(node, symbol);
                queue[tail++] = child.id();

                var fallback = this.nodes[this.failure[node.id()]];
                while (fallback.child(symbol) == null && fallback != root) {
                    fallback = this.nodes[this.failure[fallback.id()]];
                }
                final var target = fallback.child(symbol);
                if (target == null) {
                    this.failure[child.id()] = root.id();
                    continue;
                }

                this.failure[child.id()] = target.id();
                final var inherited = this.output.get(target.id());
                if (inherited != null) {
                    var outputs = this.output.get(child.id());
                    if (outputs == null) {
                        outputs = new ArrayList<>(inherited.size());
                        this.output.put(child.id(), outputs);
                    }
                    outputs.addAll(inherited);
                }
            }
        }

        this.failureBuilt = true;
    }

    List<String> output(final Trie.Node<V> node) {
        final var outputs = this.output.get(node.id());
        return outputs == null ? List.of() : outputs;
    }

    Trie.Node<V> failure(final Trie.Node<V> node) {
        Preconditions.checkState(this.failureBuilt, "The failure is not built yet");
        return this.nodes[this.failure[node.id()]];
    }

    private Trie.Node<V> child(final Trie.Node<V> node, final char symbol) {
        final var child = node.child(symbol);
        Preconditions.checkState(child != null, "Node %s lists a transition on '%s' without a child", node, symbol);
        return child;
    }

    private int index(final Trie.Node<V> node) {
        final var id = node.id();
        Preconditions.checkArgument(
                id >= 0 && id < this.nodes.length, "Node id %s is out of range [0, %s)", id, this.nodes.length);
        return id;
    }

    private record Pending<V>(Trie.Node<V> node, String prefix) {}
}
