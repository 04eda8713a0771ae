package com.controls.cdl.engine;

import com.controls.cdl.model.Block;
import com.controls.cdl.model.DataType;
import com.controls.cdl.model.InstancePath;
import com.controls.cdl.support.TestBlocks;
import com.controls.cdl.support.TestModels;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.Assert.*;

public class NestedCompositeTest {
    private ExecutionContext ctx;

    @Before
    public void setUp() {
        ctx = new ExecutionContext(TestModels.plant(), TestBlocks.registry());
        ctx.initialize();
    }

    @Test
    public void testNestedValues() {
        ctx.setInput("u", 1.0);
        ctx.step();
        assertEquals(7.0, (Double) ctx.getOutput("direct"), 0.0);
        assertEquals(7.0, (Double) ctx.getOutput("total"), 0.0);

        ctx.step();
        assertEquals(7.0, (Double) ctx.getOutput("direct"), 0.0);
        assertEquals(14.0, (Double) ctx.getOutput("total"), 0.0);

        ctx.setInput("u", 0.5);
        ctx.step();
        assertEquals(3.5, (Double) ctx.getOutput("direct"), 0.0);
        assertEquals(17.5, (Double) ctx.getOutput("total"), 0.0);
    }

    @Test
    public void testParentParameterResolvesAgainstEnclosingInstance() {
        assertEquals(4.0, ctx.parameters(InstancePath.parse("Plant.pre")).real("k"), 0.0);
        assertEquals(4.0, ctx.parameters(InstancePath.parse("Plant.pre.a")).real("k"), 0.0);
        assertEquals(3.0, ctx.parameters(InstancePath.parse("Plant.pre.b")).real("k"), 0.0);
    }

    @Test
    public void testSameDefinitionInTwoPlacesDoesNotAlias() {
        Block twice = Block.composite("Twice")
                .input("u", DataType.REAL)
                .output("y1", DataType.REAL)
                .output("y2", DataType.REAL)
                .child("first", TestModels.integrator())
                .child("second", TestModels.integrator())
                .connect("u", "first.u")
                .connect("first.y", "second.u")
                .connect("first.y", "y1")
                .connect("second.y", "y2")
                .build();
        ExecutionContext c = new ExecutionContext(twice, TestBlocks.registry());
        c.initialize();
        c.setInput("u", 1.0);
        c.step();
        c.step();
        c.step();
        // first: 1, 2, 3; second: 1, 3, 6
        assertEquals(3.0, (Double) c.getOutput("y1"), 0.0);
        assertEquals(6.0, (Double) c.getOutput("y2"), 0.0);
        assertEquals(3.0, (Double) c.getOutput("Twice.first.acc", "y"), 0.0);
        assertEquals(6.0, (Double) c.getOutput("Twice.second.acc", "y"), 0.0);
    }

    @Test
    public void testDeepSignalsReadable() {
        ctx.setInput("u", 2.0);
        ctx.step();
        assertEquals(8.0, (Double) ctx.getOutput("Plant.pre.a", "y"), 0.0);
        assertEquals(6.0, (Double) ctx.getOutput("Plant.pre.b", "y"), 0.0);
        assertEquals(14.0, (Double) ctx.getOutput("Plant.pre.sum", "y"), 0.0);
        assertEquals(14.0, (Double) ctx.getOutput("Plant.int.acc", "u"), 0.0);
        assertEquals(14.0, (Double) ctx.getOutput("Plant.pre", "y"), 0.0);
    }

    @Test
    public void testNestedContextsHaveOwnOrderAndCounter() {
        Optional<ExecutionContext> pre = ctx.nested("pre");
        assertTrue(pre.isPresent());
        assertEquals(InstancePath.parse("Plant.pre"), pre.get().rootPath());
        assertEquals(3, pre.get().evaluationOrder().size());
        assertFalse(ctx.nested("missing").isPresent());

        ctx.setInput("u", 1.0);
        ctx.step();
        ctx.step();
        assertEquals(2, pre.get().stepCount());
        assertEquals(2, ctx.stepCount());
    }

    @Test
    public void testBlockAt() {
        assertEquals("Lib.ScaledSum", ctx.blockAt(InstancePath.parse("Plant.pre")).typeName());
        assertEquals(TestBlocks.ACCUMULATOR, ctx.blockAt(InstancePath.parse("Plant.int.acc")).typeName());
        assertEquals("Plant", ctx.blockAt(ctx.rootPath()).typeName());
    }

    @Test
    public void testResetDiscardsNestedState() {
        ctx.setInput("u", 1.0);
        ctx.step();
        ctx.step();
        ctx.reset();
        assertEquals(0, ctx.nested("int").get().stepCount());
        ctx.setInput("u", 1.0);
        ctx.step();
        assertEquals(7.0, (Double) ctx.getOutput("total"), 0.0);
    }

    @Test
    public void testNestedContextIsDrivenOnlyByItsParent() {
        ctx.setInput("u", 1.0);
        ctx.step();
        ExecutionContext inner = ctx.nested("int").get();

        Runnable[] direct = {
                () -> inner.setInput("u", 100.0),
                () -> inner.setInput(inner.rootPath(), "u", 100.0),
                inner::step,
                () -> inner.step(Map.of("u", 100.0)),
                inner::reset,
                () -> inner.setListener(null),
        };
        for (Runnable r : direct) {
            try {
                r.run();
                fail("Expected IllegalStateException");
            } catch (IllegalStateException e) {
                assertTrue(e.getMessage().contains("Plant.int"));
            }
        }

        assertEquals(1, inner.stepCount());
        assertEquals(7.0, (Double) ctx.getOutput("total"), 0.0);
        ctx.step();
        assertEquals(2, inner.stepCount());
        assertEquals(14.0, (Double) ctx.getOutput("total"), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownDeepInstance() {
        ctx.getOutput("Plant.pre.nope", "y");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPathOutsideModel() {
        ctx.getOutput("Other.pre", "y");
    }
}
