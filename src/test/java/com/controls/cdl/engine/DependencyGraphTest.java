package com.controls.cdl.engine;

import com.controls.cdl.model.Block;
import com.controls.cdl.model.InstancePath;
import com.controls.cdl.support.TestBlocks;
import com.controls.cdl.support.TestModels;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class DependencyGraphTest {
    private static final InstancePath M = InstancePath.root("M");

    @Test
    public void testNodesFollowDeclarationOrder() {
        DependencyGraph g = DependencyGraph.of(M, TestModels.scaledSum());
        assertEquals(List.of(M.child("a"), M.child("b"), M.child("sum")), g.nodes());
        assertEquals(M, g.owner());
    }

    @Test
    public void testOnlySiblingConnectionsAreEdges() {
        // u -> a.u, u -> b.u and sum.y -> y are not scheduling dependencies
        DependencyGraph g = DependencyGraph.of(M, TestModels.scaledSum());
        assertEquals(2, g.edgeCount());
        assertTrue(g.dependsOn(M.child("sum"), M.child("a")));
        assertTrue(g.dependsOn(M.child("sum"), M.child("b")));
        assertFalse(g.dependsOn(M.child("a"), M.child("b")));
        assertEquals(List.of(0, 1), g.predecessors(g.indexOf(M.child("sum"))));
        assertTrue(g.successors(g.indexOf(M.child("sum"))).isEmpty());
    }

    @Test
    public void testParallelConnectionsCollapse() {
        Block b = Block.composite("Twice")
                .child("src", TestBlocks.constant())
                .child("sum", TestBlocks.add())
                .connect("src.y", "sum.u1")
                .connect("src.y", "sum.u2")
                .build();
        DependencyGraph g = DependencyGraph.of(M, b);
        assertEquals(1, g.edgeCount());
    }

    @Test
    public void testSelfConnectionIsSelfLoop() {
        Block b = Block.composite("Self")
                .child("g", TestBlocks.gain())
                .connect("g.y", "g.u")
                .build();
        DependencyGraph g = DependencyGraph.of(M, b);
        assertEquals(List.of(0), g.successors(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownInstanceRejected() {
        Block b = Block.composite("Dangling")
                .child("g", TestBlocks.gain())
                .connect("ghost.y", "g.u")
                .build();
        DependencyGraph.of(M, b);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeRejected() {
        DependencyGraph.builder(M).addNode("A").addNode("A");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownPathLookupRejected() {
        DependencyGraph.builder(M).addNode("A").build().indexOf(M.child("B"));
    }
}
