package com.controls.cdl.engine;

import com.controls.cdl.model.InstancePath;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class SchedulerTest {
    private static final InstancePath M = InstancePath.root("M");

    private static InstancePath p(String name) {
        return M.child(name);
    }

    private static List<String> names(EvaluationOrder order) {
        return order.paths().stream().map(InstancePath::name).toList();
    }

    @Test
    public void testEmptyGraph() {
        EvaluationOrder order = Scheduler.schedule(DependencyGraph.builder(M).build());
        assertEquals(0, order.size());
    }

    @Test
    public void testSingleNode() {
        EvaluationOrder order = Scheduler.schedule(DependencyGraph.builder(M).addNode("A").build());
        assertEquals(1, order.size());
        assertEquals(p("A"), order.get(0));
        assertEquals(0, order.positionOf(p("A")));
    }

    @Test
    public void testLinearGraphDeclaredBackwards() {
        // C declared first but depends on B, which depends on A
        DependencyGraph g = DependencyGraph.builder(M)
                .addNode("C").addNode("B").addNode("A")
                .addEdge("A", "B")
                .addEdge("B", "C")
                .build();

        assertEquals(List.of("A", "B", "C"), names(Scheduler.schedule(g)));
    }

    @Test
    public void testDiamondGraph() {
        // A -> B, A -> C, B -> D, C -> D
        DependencyGraph g = DependencyGraph.builder(M)
                .addNode("D").addNode("C").addNode("B").addNode("A")
                .addEdge("A", "B")
                .addEdge("A", "C")
                .addEdge("B", "D")
                .addEdge("C", "D")
                .build();

        EvaluationOrder order = Scheduler.schedule(g);
        assertEquals(4, order.size());
        int a = order.positionOf(p("A"));
        int b = order.positionOf(p("B"));
        int c = order.positionOf(p("C"));
        int d = order.positionOf(p("D"));
        assertEquals(0, a);
        assertTrue(d > b);
        assertTrue(d > c);
        // C is declared before B, so it wins the tie
        assertTrue(c < b);
    }

    @Test
    public void testTieBreakIsDeclarationOrder() {
        DependencyGraph g = DependencyGraph.builder(M)
                .addNode("x").addNode("b").addNode("a").addNode("y")
                .addEdge("a", "y")
                .build();
        // x, b, a are all ready at once
        assertEquals(List.of("x", "b", "a", "y"), names(Scheduler.schedule(g)));
    }

    @Test
    public void testOrderIsReproducible() {
        DependencyGraph.Builder b = DependencyGraph.builder(M);
        for (int i = 0; i < 50; i++)
            b.addNode("n" + i);
        for (int i = 0; i < 49; i += 3)
            b.addEdge("n" + (i + 1), "n" + i);
        DependencyGraph g = b.build();

        List<InstancePath> first = Scheduler.schedule(g).paths();
        for (int run = 0; run < 10; run++)
            assertEquals(first, Scheduler.schedule(g).paths());
    }

    @Test
    public void testCycleDetection() {
        // A -> B -> C -> A
        DependencyGraph g = DependencyGraph.builder(M)
                .addNode("A").addNode("B").addNode("C")
                .addEdge("A", "B")
                .addEdge("B", "C")
                .addEdge("C", "A")
                .build();
        try {
            Scheduler.schedule(g);
            fail("Expected AlgebraicLoopException");
        } catch (AlgebraicLoopException e) {
            assertEquals(List.of(p("A"), p("B"), p("C")), e.cycle());
            assertTrue(e.getMessage().contains("M.A -> M.B -> M.C -> M.A"));
        }
    }

    @Test
    public void testCycleIsRotatedToEarliestDeclared() {
        // Declared C, A, B; cycle A -> B -> C -> A is reported from C
        DependencyGraph g = DependencyGraph.builder(M)
                .addNode("C").addNode("A").addNode("B")
                .addEdge("A", "B")
                .addEdge("B", "C")
                .addEdge("C", "A")
                .build();
        assertEquals(List.of(List.of(p("C"), p("A"), p("B"))), Scheduler.findCycles(g));
    }

    @Test(expected = IllegalStateException.class)
    public void testSelfLoopDetection() {
        Scheduler.schedule(DependencyGraph.builder(M).addNode("A").addEdge("A", "A").build());
    }

    @Test
    public void testSelfLoopIsReportedAsSingleMemberCycle() {
        DependencyGraph g = DependencyGraph.builder(M).addNode("A").addEdge("A", "A").build();
        assertEquals(List.of(List.of(p("A"))), Scheduler.findCycles(g));
    }

    @Test
    public void testEveryCycleIsReportedButNotItsDownstream() {
        // A <-> B, C <-> D, B -> E (E is only downstream)
        DependencyGraph g = DependencyGraph.builder(M)
                .addNode("A").addNode("B").addNode("C").addNode("D").addNode("E")
                .addEdge("A", "B").addEdge("B", "A")
                .addEdge("C", "D").addEdge("D", "C")
                .addEdge("B", "E")
                .build();

        List<List<InstancePath>> cycles = Scheduler.findCycles(g);
        assertEquals(2, cycles.size());
        assertEquals(List.of(p("A"), p("B")), cycles.get(0));
        assertEquals(List.of(p("C"), p("D")), cycles.get(1));
    }

    @Test
    public void testFigureEightNamesBothLoops() {
        // A <-> B and A <-> C share A and form one component
        DependencyGraph g = DependencyGraph.builder(M)
                .addNode("A").addNode("B").addNode("C")
                .addEdge("B", "A").addEdge("C", "A")
                .addEdge("A", "B").addEdge("A", "C")
                .build();

        List<List<InstancePath>> cycles = Scheduler.findCycles(g);
        assertEquals(List.of(List.of(p("A"), p("B")), List.of(p("A"), p("C"))), cycles);
        try {
            Scheduler.schedule(g);
            fail("Expected AlgebraicLoopException");
        } catch (AlgebraicLoopException e) {
            assertTrue(e.getMessage().contains("M.A -> M.B -> M.A"));
            assertTrue(e.getMessage().contains("M.A -> M.C -> M.A"));
        }
    }

    @Test
    public void testEveryComponentMemberIsNamed() {
        // A -> B -> C -> A and B -> C -> D -> B share the edge B -> C
        DependencyGraph g = DependencyGraph.builder(M)
                .addNode("A").addNode("B").addNode("C").addNode("D")
                .addEdge("A", "B").addEdge("B", "C").addEdge("C", "A")
                .addEdge("C", "D").addEdge("D", "B")
                .build();

        List<List<InstancePath>> cycles = Scheduler.findCycles(g);
        assertEquals(List.of(p("A"), p("B"), p("C")), cycles.get(0));
        assertEquals(2, cycles.size());
        assertEquals(List.of(p("B"), p("C"), p("D")), cycles.get(1));
    }

    @Test
    public void testAcyclicGraphHasNoCycles() {
        DependencyGraph g = DependencyGraph.builder(M)
                .addNode("A").addNode("B")
                .addEdge("A", "B")
                .build();
        assertTrue(Scheduler.findCycles(g).isEmpty());
    }

    @Test
    public void testRenderCycle() {
        assertEquals("M.A -> M.B -> M.A", AlgebraicLoopException.render(List.of(p("A"), p("B"))));
    }
}
