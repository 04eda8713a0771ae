package com.controls.cdl.engine;

import com.controls.cdl.config.EngineOptions;
import com.controls.cdl.model.Block;
import com.controls.cdl.model.BlockInstance;
import com.controls.cdl.model.Connector;
import com.controls.cdl.model.DataType;
import com.controls.cdl.model.InstancePath;
import com.controls.cdl.registry.ImplementationRegistry;
import com.controls.cdl.support.TestBlocks;
import com.controls.cdl.support.TestModels;
import com.controls.cdl.validation.ValidationException;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class ExecutionContextTest {
    private ImplementationRegistry registry;

    @Before
    public void setUp() {
        registry = TestBlocks.registry();
    }

    private ExecutionContext initialized(Block block) {
        ExecutionContext ctx = new ExecutionContext(block, registry);
        ctx.initialize();
        return ctx;
    }

    @Test
    public void testPassThrough() {
        ExecutionContext ctx = initialized(TestModels.passThrough());
        ctx.setInput("u", 3.0);
        assertEquals(1, ctx.step());
        assertEquals(6.0, (Double) ctx.getOutput("y"), 0.0);
        assertEquals(3.0, (Double) ctx.getOutput("PassThrough.gain", "u"), 0.0);
        assertEquals(6.0, (Double) ctx.getOutput("PassThrough.gain", "y"), 0.0);
        assertEquals(1, ctx.stepCount());
    }

    @Test
    public void testRootPathIsSimpleTypeName() {
        ExecutionContext ctx = initialized(TestModels.scaledSum());
        assertEquals(InstancePath.root("ScaledSum"), ctx.rootPath());
    }

    @Test
    public void testEvaluationOrderIsCachedAndDependencyRespecting() {
        ExecutionContext ctx = initialized(TestModels.scaledSum());
        EvaluationOrder order = ctx.evaluationOrder();
        InstancePath root = ctx.rootPath();
        assertTrue(order.positionOf(root.child("sum")) > order.positionOf(root.child("a")));
        assertTrue(order.positionOf(root.child("sum")) > order.positionOf(root.child("b")));

        ctx.setInput("u", 1.0);
        ctx.step();
        ctx.step();
        assertSame(order, ctx.evaluationOrder());
        assertTrue(ctx.dependencyGraph().isPresent());
    }

    @Test
    public void testIntegerInputNormalizedToReal() {
        ExecutionContext ctx = initialized(TestModels.passThrough());
        ctx.setInput("u", 3);
        ctx.step();
        assertEquals(Double.valueOf(6.0), ctx.getOutput("y"));
    }

    @Test
    public void testDeterministicAcrossContexts() {
        List<Object> first = run(TestModels.plant());
        List<Object> second = run(TestModels.plant());
        assertEquals(first, second);
    }

    private List<Object> run(Block model) {
        ExecutionContext ctx = initialized(model);
        List<Object> trace = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            ctx.setInput("u", i * 0.25);
            ctx.step();
            trace.add(new ArrayList<>(ctx.signalValues().values()));
            trace.add(ctx.getOutput("total"));
        }
        return trace;
    }

    @Test
    public void testIndependentContextsDoNotShareState() {
        ExecutionContext one = initialized(TestModels.integrator());
        ExecutionContext two = initialized(TestModels.integrator());
        one.setInput("u", 1.0);
        two.setInput("u", 10.0);
        one.step();
        one.step();
        two.step();
        assertEquals(2.0, (Double) one.getOutput("y"), 0.0);
        assertEquals(10.0, (Double) two.getOutput("y"), 0.0);
    }

    @Test
    public void testMissingRootInputFails() {
        ExecutionContext ctx = initialized(TestModels.passThrough());
        try {
            ctx.step();
            fail("Expected MissingSignalException");
        } catch (MissingSignalException e) {
            assertEquals(ctx.rootPath().child("gain"), e.instance());
            assertEquals(1, e.step());
        }
        assertEquals(ContextState.FAULTED, ctx.state());
    }

    @Test
    public void testStartValueSeedsRootInput() {
        Block b = Block.composite("Seeded")
                .connector(Connector.input("u", DataType.REAL).start(1.5).build())
                .output("y", DataType.REAL)
                .child(TestBlocks.gain("g", 2.0))
                .connect("u", "g.u")
                .connect("g.y", "y")
                .build();
        ExecutionContext ctx = initialized(b);
        assertEquals(1.5, (Double) ctx.getOutput("u"), 0.0);
        ctx.step();
        assertEquals(3.0, (Double) ctx.getOutput("y"), 0.0);
    }

    @Test
    public void testUnboundOutputIsMissingNotDefaulted() {
        ExecutionContext ctx = initialized(TestModels.passThrough());
        assertFalse(ctx.findSignal(ctx.rootPath(), "y").isPresent());
        try {
            ctx.getOutput("y");
            fail("Expected MissingSignalException");
        } catch (MissingSignalException e) {
            assertEquals("y", e.signal().connector());
        }
    }

    @Test
    public void testLifecycleStates() {
        ExecutionContext ctx = new ExecutionContext(TestModels.passThrough(), registry);
        assertEquals(ContextState.UNVALIDATED, ctx.state());
        try {
            ctx.step();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException expected) {
            // not initialized
        }
        ctx.initialize();
        assertEquals(ContextState.INITIALIZED, ctx.state());
        ctx.setInput("u", 1.0);
        ctx.step();
        assertEquals(ContextState.STEPPING, ctx.state());
        ctx.reset();
        assertEquals(ContextState.INITIALIZED, ctx.state());
        assertEquals(0, ctx.stepCount());
        assertFalse(ctx.findSignal(ctx.rootPath(), "u").isPresent());
    }

    @Test(expected = IllegalStateException.class)
    public void testDoubleInitializeRejected() {
        ExecutionContext ctx = initialized(TestModels.passThrough());
        ctx.initialize();
    }

    @Test
    public void testInvalidModelStaysUnvalidated() {
        ExecutionContext ctx = new ExecutionContext(TestModels.twoCycle(), registry);
        try {
            ctx.initialize();
            fail("Expected ValidationException");
        } catch (ValidationException e) {
            assertEquals(1, e.report().errors().size());
        }
        assertEquals(ContextState.UNVALIDATED, ctx.state());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSetInputOfInnerInstanceRejected() {
        ExecutionContext ctx = initialized(TestModels.passThrough());
        ctx.setInput("PassThrough.gain", "u", 1.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownInputRejected() {
        initialized(TestModels.passThrough()).setInput("nope", 1.0);
    }

    @Test
    public void testTypeMismatchedInputRejected() {
        ExecutionContext ctx = initialized(TestModels.passThrough());
        try {
            ctx.setInput("u", "three");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("PassThrough.u"));
        }
        assertFalse(ctx.findSignal(ctx.rootPath(), "u").isPresent());
    }

    @Test
    public void testNonFiniteInputRejectedByDefault() {
        ExecutionContext ctx = initialized(TestModels.passThrough());
        try {
            ctx.setInput("u", Double.NaN);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("non-finite"));
        }
        try {
            ctx.setInput("u", Double.POSITIVE_INFINITY);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // rejected
        }
    }

    @Test
    public void testNonFiniteAllowedByOption() {
        EngineOptions options = EngineOptions.builder().allowNonFiniteReals(true).build();
        ExecutionContext ctx = new ExecutionContext(TestModels.passThrough(), registry, options);
        ctx.initialize();
        ctx.setInput("u", Double.POSITIVE_INFINITY);
        ctx.step();
        assertEquals(Double.POSITIVE_INFINITY, (Double) ctx.getOutput("y"), 0.0);
    }

    @Test
    public void testStepWithInputsAppliesAllOrNothing() {
        Block b = Block.composite("Sum")
                .input("a", DataType.REAL)
                .input("b", DataType.REAL)
                .output("y", DataType.REAL)
                .child("add", TestBlocks.add())
                .connect("a", "add.u1")
                .connect("b", "add.u2")
                .connect("add.y", "y")
                .build();
        ExecutionContext ctx = initialized(b);

        Map<String, Object> bad = new LinkedHashMap<>();
        bad.put("a", 1.0);
        bad.put("b", "oops");
        try {
            ctx.step(bad);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // b is not a Real
        }
        assertFalse(ctx.findSignal(ctx.rootPath(), "a").isPresent());
        assertEquals(0, ctx.stepCount());

        assertEquals(1, ctx.step(Map.of("a", 1.0, "b", 2.5)));
        assertEquals(3.5, (Double) ctx.getOutput("y"), 0.0);
    }

    @Test
    public void testElementaryRoot() {
        ExecutionContext ctx = initialized(TestBlocks.gain());
        assertEquals(InstancePath.root("Gain"), ctx.rootPath());
        assertFalse(ctx.dependencyGraph().isPresent());
        ctx.setInput("u", 4.0);
        ctx.step();
        assertEquals(4.0, (Double) ctx.getOutput("y"), 0.0);
    }

    @Test
    public void testRootInstanceOverridesBindParameters() {
        ExecutionContext ctx = new ExecutionContext(
                BlockInstance.of("model", TestModels.scaledSum()).with("k", 10.0),
                registry, EngineOptions.defaults());
        ctx.initialize();
        assertEquals(10.0, ctx.parameters().real("k"), 0.0);
        assertEquals(10.0, ctx.parameters(InstancePath.parse("model.a")).real("k"), 0.0);
        ctx.setInput("u", 1.0);
        ctx.step();
        assertEquals(13.0, (Double) ctx.getOutput("y"), 0.0);
    }

    @Test
    public void testIntegerToRealConversionWhenEnabled() {
        Block b = Block.composite("Convert")
                .output("y", DataType.REAL)
                .child("c", TestBlocks.intConstant())
                .child(TestBlocks.gain("g", 0.5))
                .connect("c.y", "g.u")
                .connect("g.y", "y")
                .build();

        try {
            initialized(b);
            fail("Expected ValidationException");
        } catch (ValidationException expected) {
            // Integer into Real without an enabled conversion
        }

        EngineOptions options = EngineOptions.builder()
                .compatibleConversions(Set.of(new EngineOptions.Conversion(DataType.INTEGER, DataType.REAL)))
                .build();
        ExecutionContext ctx = new ExecutionContext(b, registry, options);
        ctx.initialize();
        ctx.step();
        assertEquals(Double.valueOf(1.0), ctx.getOutput("Convert.g", "u"));
        assertEquals(0.5, (Double) ctx.getOutput("y"), 0.0);
    }

    @Test
    public void testUnknownConnectorAndInstanceLookups() {
        ExecutionContext ctx = initialized(TestModels.passThrough());
        try {
            ctx.getOutput("PassThrough.nope", "y");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // unknown instance
        }
        try {
            ctx.getOutput("PassThrough.gain", "nope");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // unknown connector
        }
    }

    @Test
    public void testPreviousOutputVisibleToImplementation() {
        ImplementationRegistry reg = new ImplementationRegistry()
                .registerFunction(TestBlocks.GAIN, inv -> {
                    Object prev = inv.previousOutput("y");
                    double base = prev == null ? 0.0 : (Double) prev;
                    inv.setOutput("y", base + inv.realInput("u"));
                });
        ExecutionContext ctx = new ExecutionContext(TestModels.passThrough(), reg);
        ctx.initialize();
        ctx.setInput("u", 2.0);
        ctx.step();
        ctx.step();
        ctx.step();
        assertEquals(6.0, (Double) ctx.getOutput("y"), 0.0);
    }

    @Test
    public void testRevalidateLeavesStateUntouched() {
        ExecutionContext ctx = initialized(TestModels.integrator());
        ctx.setInput("u", 2.0);
        ctx.step();
        assertTrue(ctx.revalidate().isValid());
        ctx.step();
        assertEquals(4.0, (Double) ctx.getOutput("y"), 0.0);
        assertEquals(2, ctx.stepCount());
    }
}
