package com.controls.cdl.util;

import com.controls.cdl.api.EvaluationListener;
import com.controls.cdl.engine.ContextState;
import com.controls.cdl.engine.EvaluationException;
import com.controls.cdl.engine.ExecutionContext;
import com.controls.cdl.model.InstancePath;
import com.controls.cdl.support.TestBlocks;
import com.controls.cdl.support.TestModels;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class InstanceProfileListenerTest {
    private ExecutionContext ctx;

    @Before
    public void setUp() {
        ctx = new ExecutionContext(TestModels.plant(), TestBlocks.registry());
        ctx.initialize();
    }

    @Test
    public void testCountsEveryInstanceAtEveryDepth() {
        InstanceProfileListener profile = new InstanceProfileListener();
        ctx.setListener(profile);
        ctx.setInput("u", 1.0);
        for (int i = 0; i < 4; i++)
            ctx.step();

        assertEquals(4, profile.completedSteps());
        assertEquals(0, profile.failedSteps());
        assertEquals(4, profile.stats(InstancePath.parse("Plant.pre")).count);
        assertEquals(4, profile.stats(InstancePath.parse("Plant.pre.sum")).count);
        assertEquals(4, profile.stats(InstancePath.parse("Plant.int.acc")).count);
        // pre, a, b, sum, int, acc
        assertEquals(6, profile.all().size());
        assertNull(profile.stats(InstancePath.parse("Plant.missing")));

        String dump = profile.dump();
        assertTrue(dump.contains("Plant.pre.sum"));
        assertTrue(dump.startsWith(String.format("%-40s", "Instance")));

        profile.reset();
        assertTrue(profile.all().isEmpty());
        assertEquals(0, profile.completedSteps());
    }

    @Test
    public void testFailedStepCounted() {
        InstanceProfileListener profile = new InstanceProfileListener();
        ctx.setListener(profile);
        // u is never set
        try {
            ctx.step();
            fail("Expected EvaluationException");
        } catch (EvaluationException expected) {
            // missing input
        }
        assertEquals(0, profile.completedSteps());
        assertEquals(1, profile.failedSteps());
        assertEquals(1, profile.stats(InstancePath.parse("Plant.pre")).errors);
    }

    @Test
    public void testCompositeFansOutInOrder() {
        List<String> calls = new ArrayList<>();
        CompositeEvaluationListener composite = new CompositeEvaluationListener()
                .add(recorder("first", calls))
                .add(recorder("second", calls));
        assertEquals(2, composite.size());

        ExecutionContext c = new ExecutionContext(TestModels.passThrough(), TestBlocks.registry());
        c.initialize();
        c.setListener(composite);
        c.setInput("u", 1.0);
        c.step();

        assertEquals(List.of("first:start", "second:start", "first:PassThrough.gain", "second:PassThrough.gain",
                "first:end", "second:end"), calls);
    }

    @Test
    public void testCompositeRemove() {
        List<String> calls = new ArrayList<>();
        EvaluationListener first = recorder("first", calls);
        CompositeEvaluationListener composite = new CompositeEvaluationListener()
                .add(first)
                .add(recorder("second", calls));
        assertTrue(composite.remove(first));
        assertFalse(composite.remove(first));
        assertEquals(1, composite.size());

        composite.onStepStart(InstancePath.root("M"), 1);
        assertEquals(List.of("second:start"), calls);
    }

    @Test
    public void testFailingListenerDoesNotFaultTheStep() {
        List<String> calls = new ArrayList<>();
        EvaluationListener broken = new EvaluationListener() {
            @Override
            public void onStepStart(InstancePath context, long step) {
                throw new IllegalStateException("observer bug");
            }

            @Override
            public void onInstanceEvaluated(long step, int orderIndex, InstancePath instance, long durationNanos) {
                throw new IllegalStateException("observer bug");
            }

            @Override
            public void onInstanceError(long step, int orderIndex, InstancePath instance, Throwable error) {
            }

            @Override
            public void onStepEnd(InstancePath context, long step, int evaluated, boolean completed) {
            }
        };
        ExecutionContext c = new ExecutionContext(TestModels.passThrough(), TestBlocks.registry());
        c.initialize();
        c.setListener(new CompositeEvaluationListener().add(broken).add(recorder("ok", calls)));
        c.setInput("u", 3.0);
        c.step();

        assertEquals(ContextState.STEPPING, c.state());
        assertEquals(List.of("ok:start", "ok:PassThrough.gain", "ok:end"), calls);
    }

    @Test(expected = NullPointerException.class)
    public void testCompositeRejectsNull() {
        new CompositeEvaluationListener().add(null);
    }

    @Test
    public void testNestedCallbacksArriveInsideCompositeEvaluation() {
        List<String> calls = new ArrayList<>();
        ctx.setListener(recorder("l", calls));
        ctx.setInput("u", 1.0);
        ctx.step();

        int innerStart = calls.indexOf("l:start@Plant.pre");
        int innerChild = calls.indexOf("l:Plant.pre.a");
        int outerPre = calls.indexOf("l:Plant.pre");
        assertTrue(innerStart >= 0);
        assertTrue(innerStart < innerChild);
        assertTrue(innerChild < outerPre);

        ctx.setListener(null);
        calls.clear();
        ctx.step();
        assertTrue(calls.isEmpty());
    }

    @Test
    public void testLoggingListenerDoesNotDisturbStepping() {
        ctx.setListener(new CompositeEvaluationListener().add(new LoggingEvaluationListener()));
        ctx.setInput("u", 1.0);
        ctx.step();
        assertEquals(7.0, (Double) ctx.getOutput("total"), 0.0);
    }

    private static EvaluationListener recorder(String name, List<String> calls) {
        return new EvaluationListener() {
            @Override
            public void onStepStart(InstancePath context, long step) {
                calls.add(context.isRoot() ? name + ":start" : name + ":start@" + context);
            }

            @Override
            public void onInstanceEvaluated(long step, int orderIndex, InstancePath instance, long durationNanos) {
                calls.add(name + ":" + instance);
            }

            @Override
            public void onInstanceError(long step, int orderIndex, InstancePath instance, Throwable error) {
                calls.add(name + ":error:" + instance);
            }

            @Override
            public void onStepEnd(InstancePath context, long step, int evaluated, boolean completed) {
                calls.add(context.isRoot() ? name + ":end" : name + ":end@" + context);
            }
        };
    }
}
