package com.controls.cdl.engine;

import com.controls.cdl.model.Block;
import com.controls.cdl.model.BlockInstance;
import com.controls.cdl.model.Connection;
import com.controls.cdl.model.InstancePath;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scheduling dependencies among the children of one composite instance.
 *
 * <p>
 * Nodes are the children's qualified paths in declaration order. There is an
 * edge {@code from -> to} ("to depends on from") for every connection whose
 * destination is an input of child {@code to} and whose source is an output of
 * child {@code from}. Connections fed by the composite's own inputs, and
 * connections into the composite's own outputs, are not scheduling
 * dependencies. A child wired to itself yields a self-loop.
 *
 * <p>
 * Pure and immutable: the graph depends only on the block definition.
 */
public final class DependencyGraph {
    private final InstancePath owner;
    private final List<InstancePath> nodes;
    private final Map<InstancePath, Integer> indexOf;
    // successors.get(i) holds the declaration indices that depend on node i, ascending
    private final List<List<Integer>> successors;
    private final List<List<Integer>> predecessors;
    private final int edgeCount;

    private DependencyGraph(InstancePath owner, List<InstancePath> nodes, Map<InstancePath, Integer> indexOf,
            List<List<Integer>> successors, List<List<Integer>> predecessors, int edgeCount) {
        this.owner = owner;
        this.nodes = nodes;
        this.indexOf = indexOf;
        this.successors = successors;
        this.predecessors = predecessors;
        this.edgeCount = edgeCount;
    }

    /**
     * Builds the graph of a composite instance.
     *
     * @param owner     qualified path of the composite instance
     * @param composite its definition
     * @throws IllegalArgumentException if a connection names an unknown child
     */
    public static DependencyGraph of(InstancePath owner, Block composite) {
        return of(owner, composite.children(), composite.connections());
    }

    /**
     * Builds the graph from an explicit child list and a subset of connections.
     * The validator uses this to build a graph from the connections it has
     * already found resolvable.
     */
    public static DependencyGraph of(InstancePath owner, List<BlockInstance> children,
            Collection<Connection> connections) {
        Builder b = builder(owner);
        for (BlockInstance child : children)
            b.addNode(child.name());
        for (Connection c : connections) {
            if (c.shape() == Connection.Shape.SIBLING)
                b.addEdge(c.from().instance(), c.to().instance());
        }
        return b.build();
    }

    public static Builder builder(InstancePath owner) {
        return new Builder(owner);
    }

    /** Path of the composite instance whose children this graph orders. */
    public InstancePath owner() {
        return owner;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    /** Node at a declaration index. */
    public InstancePath node(int index) {
        return nodes.get(index);
    }

    public List<InstancePath> nodes() {
        return nodes;
    }

    public int indexOf(InstancePath path) {
        Integer i = indexOf.get(path);
        if (i == null)
            throw new IllegalArgumentException("Unknown instance: " + path);
        return i;
    }

    /** Declaration indices of the nodes that depend on {@code index}. */
    public List<Integer> successors(int index) {
        return successors.get(index);
    }

    /** Declaration indices of the nodes {@code index} depends on. */
    public List<Integer> predecessors(int index) {
        return predecessors.get(index);
    }

    public boolean dependsOn(InstancePath to, InstancePath from) {
        return successors.get(indexOf(from)).contains(indexOf(to));
    }

    /**
     * Accumulates nodes by child name and edges between them. Parallel edges
     * collapse into one.
     */
    public static final class Builder {
        private final InstancePath owner;
        private final List<InstancePath> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final List<Set<Integer>> forwardEdges = new ArrayList<>();

        private Builder(InstancePath owner) {
            this.owner = owner;
        }

        public Builder addNode(String childName) {
            if (nameToIdx.containsKey(childName))
                throw new IllegalArgumentException("Duplicate instance name: " + childName);
            nameToIdx.put(childName, nodes.size());
            nodes.add(owner.child(childName));
            forwardEdges.add(new LinkedHashSet<>());
            return this;
        }

        public Builder addEdge(String fromChild, String toChild) {
            forwardEdges.get(requireIndex(fromChild)).add(requireIndex(toChild));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown instance: " + owner.child(name));
            return idx;
        }

        public DependencyGraph build() {
            int n = nodes.size();
            List<List<Integer>> succ = new ArrayList<>(n);
            List<List<Integer>> pred = new ArrayList<>(n);
            for (int i = 0; i < n; i++)
                pred.add(new ArrayList<>());
            int edges = 0;
            for (int i = 0; i < n; i++) {
                List<Integer> s = new ArrayList<>(forwardEdges.get(i));
                Collections.sort(s);
                for (int to : s)
                    pred.get(to).add(i);
                edges += s.size();
                succ.add(Collections.unmodifiableList(s));
            }
            for (int i = 0; i < n; i++) {
                Collections.sort(pred.get(i));
                pred.set(i, Collections.unmodifiableList(pred.get(i)));
            }
            Map<InstancePath, Integer> index = new HashMap<>(n * 2);
            for (int i = 0; i < n; i++)
                index.put(nodes.get(i), i);
            return new DependencyGraph(owner, List.copyOf(nodes), Collections.unmodifiableMap(index),
                    Collections.unmodifiableList(succ), Collections.unmodifiableList(pred), edges);
        }
    }
}
