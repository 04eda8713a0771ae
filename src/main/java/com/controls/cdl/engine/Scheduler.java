package com.controls.cdl.engine;

import com.controls.cdl.model.InstancePath;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Computes the evaluation order of a {@link DependencyGraph}.
 *
 * <h3>Algorithm</h3>
 * Kahn's algorithm: repeatedly take a node whose dependencies have all been
 * scheduled, append it, and release its dependents. When several nodes are
 * ready at once the one declared first in the composite wins, so the order is
 * reproducible across runs.
 *
 * <h3>Cycles</h3>
 * If nodes remain once nothing is ready, the remainder contains at least one
 * cycle. The strongly connected components of the remainder are computed and
 * each component that has more than one member or a self-loop is covered by
 * simple cycles until every member is named at least once. A remaining node
 * that is only downstream of a cycle is not reported.
 */
@Log4j2
public final class Scheduler {

    private Scheduler() {
        // Utility class
    }

    /**
     * Orders the graph's nodes.
     *
     * @throws AlgebraicLoopException if the graph has a cycle; the exception
     *                                names every instance on every cycle.
     */
    public static EvaluationOrder schedule(DependencyGraph graph) {
        int[] ordered = kahn(graph);
        if (ordered.length != graph.nodeCount()) {
            List<List<InstancePath>> cycles = cyclesAmongRemaining(graph, ordered);
            log.debug("Scheduling {} failed after {} of {} instances: {} cycle(s)", graph.owner(),
                    ordered.length, graph.nodeCount(), cycles.size());
            throw new AlgebraicLoopException(cycles);
        }
        List<InstancePath> order = new ArrayList<>(ordered.length);
        for (int idx : ordered)
            order.add(graph.node(idx));
        return new EvaluationOrder(order);
    }

    /**
     * Returns every cycle in the graph, or an empty list if it is acyclic.
     * Cycles are listed by the declaration index of their first member.
     */
    public static List<List<InstancePath>> findCycles(DependencyGraph graph) {
        int[] ordered = kahn(graph);
        if (ordered.length == graph.nodeCount())
            return List.of();
        return cyclesAmongRemaining(graph, ordered);
    }

    /** Returns scheduled declaration indices; shorter than nodeCount on a cycle. */
    private static int[] kahn(DependencyGraph graph) {
        int n = graph.nodeCount();
        int[] inDegree = new int[n];

        // 1. In-degrees
        for (int i = 0; i < n; i++)
            for (int child : graph.successors(i))
                inDegree[child]++;

        // 2. Ready set ordered by declaration index
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++)
            if (inDegree[i] == 0)
                ready.add(i);

        // 3. Drain
        int[] order = new int[n];
        int count = 0;
        while (!ready.isEmpty()) {
            int curr = ready.poll();
            order[count++] = curr;
            for (int child : graph.successors(curr))
                if (--inDegree[child] == 0)
                    ready.add(child);
        }
        return count == n ? order : Arrays.copyOf(order, count);
    }

    private static List<List<InstancePath>> cyclesAmongRemaining(DependencyGraph graph, int[] ordered) {
        int n = graph.nodeCount();
        boolean[] remaining = new boolean[n];
        Arrays.fill(remaining, true);
        for (int idx : ordered)
            remaining[idx] = false;

        List<List<Integer>> components = new Tarjan(graph, remaining).run();
        List<List<Integer>> cycles = new ArrayList<>();
        for (List<Integer> scc : components) {
            int first = scc.get(0);
            boolean selfLoop = graph.successors(first).contains(first);
            if (scc.size() > 1 || selfLoop)
                cycles.addAll(coverComponent(graph, scc));
        }
        cycles.sort(Comparator.comparingInt(c -> c.get(0)));

        List<List<InstancePath>> result = new ArrayList<>(cycles.size());
        for (List<Integer> c : cycles) {
            List<InstancePath> paths = new ArrayList<>(c.size());
            for (int idx : c)
                paths.add(graph.node(idx));
            result.add(Collections.unmodifiableList(paths));
        }
        return result;
    }

    /**
     * Reports the component's first cycle, then adds a shortest cycle through
     * each member not yet named, in declaration order.
     */
    private static List<List<Integer>> coverComponent(DependencyGraph graph, List<Integer> scc) {
        Set<Integer> members = new HashSet<>(scc);
        List<List<Integer>> cycles = new ArrayList<>();
        List<Integer> first = extractCycle(graph, members, Collections.min(scc));
        cycles.add(first);
        Set<Integer> covered = new HashSet<>(first);
        for (int member : scc) {
            if (covered.contains(member))
                continue;
            List<Integer> cycle = shortestCycleThrough(graph, members, member);
            covered.addAll(cycle);
            cycles.add(cycle);
        }
        return cycles;
    }

    /**
     * Breadth-first search from {@code start} back to itself inside the
     * component, visiting successors in declaration order.
     */
    private static List<Integer> shortestCycleThrough(DependencyGraph graph, Set<Integer> members, int start) {
        Map<Integer, Integer> parent = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        int last = -1;
        while (!queue.isEmpty() && last < 0) {
            int cur = queue.poll();
            for (int s : graph.successors(cur)) {
                if (!members.contains(s))
                    continue;
                if (s == start) {
                    last = cur;
                    break;
                }
                if (!parent.containsKey(s)) {
                    parent.put(s, cur);
                    queue.add(s);
                }
            }
        }
        if (last < 0)
            throw new IllegalStateException("No cycle through " + graph.node(start) + " inside its component");

        List<Integer> cycle = new ArrayList<>();
        for (int v = last; v != start; v = parent.get(v))
            cycle.add(v);
        cycle.add(start);
        Collections.reverse(cycle);
        rotateToEarliest(cycle);
        return cycle;
    }

    /**
     * Walks forward inside one strongly connected component, always taking the
     * earliest-declared successor, until a node repeats. The repeated stretch
     * is a simple cycle; it is rotated to start at its earliest-declared node.
     */
    private static List<Integer> extractCycle(DependencyGraph graph, Set<Integer> members, int from) {
        Map<Integer, Integer> positionInWalk = new HashMap<>();
        List<Integer> walk = new ArrayList<>();
        int cur = from;
        while (!positionInWalk.containsKey(cur)) {
            positionInWalk.put(cur, walk.size());
            walk.add(cur);
            int next = -1;
            for (int s : graph.successors(cur)) {
                if (members.contains(s)) {
                    next = s;
                    break;
                }
            }
            if (next < 0)
                throw new IllegalStateException("Strongly connected component without internal edge at "
                        + graph.node(cur));
            cur = next;
        }
        List<Integer> cycle = new ArrayList<>(walk.subList(positionInWalk.get(cur), walk.size()));
        rotateToEarliest(cycle);
        return cycle;
    }

    private static void rotateToEarliest(List<Integer> cycle) {
        Collections.rotate(cycle, -cycle.indexOf(Collections.min(cycle)));
    }

    /** Tarjan's strongly connected components restricted to the remaining nodes. */
    private static final class Tarjan {
        private final DependencyGraph graph;
        private final boolean[] remaining;
        private final int[] index;
        private final int[] lowLink;
        private final boolean[] onStack;
        private final Deque<Integer> stack = new ArrayDeque<>();
        private final List<List<Integer>> components = new ArrayList<>();
        private int counter;

        Tarjan(DependencyGraph graph, boolean[] remaining) {
            this.graph = graph;
            this.remaining = remaining;
            int n = graph.nodeCount();
            this.index = new int[n];
            this.lowLink = new int[n];
            this.onStack = new boolean[n];
            Arrays.fill(index, -1);
        }

        List<List<Integer>> run() {
            for (int v = 0; v < remaining.length; v++)
                if (remaining[v] && index[v] < 0)
                    connect(v);
            return components;
        }

        private void connect(int v) {
            index[v] = counter;
            lowLink[v] = counter;
            counter++;
            stack.push(v);
            onStack[v] = true;

            for (int w : graph.successors(v)) {
                if (!remaining[w])
                    continue;
                if (index[w] < 0) {
                    connect(w);
                    lowLink[v] = Math.min(lowLink[v], lowLink[w]);
                } else if (onStack[w]) {
                    lowLink[v] = Math.min(lowLink[v], index[w]);
                }
            }

            if (lowLink[v] == index[v]) {
                List<Integer> scc = new ArrayList<>();
                int w;
                do {
                    w = stack.pop();
                    onStack[w] = false;
                    scc.add(w);
                } while (w != v);
                Collections.sort(scc);
                components.add(scc);
            }
        }
    }
}
