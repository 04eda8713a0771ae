package com.controls.cdl.wiring;

import com.controls.cdl.engine.ContextState;
import com.controls.cdl.engine.ExecutionContext;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Bridges a ring buffer of {@link InputEvent}s to one execution context.
 *
 * <p>
 * Runs on the single consumer thread, which becomes the context's only
 * driver. Each event sets one root input; at the end of a batch (the ring
 * buffer drained, or an event flagged {@code batchEnd}) the context steps
 * once, so a burst of inputs costs a single step.
 *
 * <p>
 * A rejected input is logged and skipped, and the batch it belongs to is not
 * stepped. A failing step faults the context; the failure is logged and later
 * batches are dropped until the context is reset. Neither kills the consumer
 * thread.
 */
public final class StepPublisher {
    private static final Logger log = LogManager.getLogger(StepPublisher.class);

    private final ExecutionContext context;
    private PostStepCallback postStep;
    private boolean batchRejected;
    private long droppedBatches;

    public StepPublisher(ExecutionContext context) {
        this.context = context;
    }

    /** Sets a callback invoked after every completed step. */
    public void setPostStepCallback(PostStepCallback cb) {
        this.postStep = cb;
    }

    /**
     * Processes one event from the ring buffer.
     *
     * @param event      the event carried by the ring buffer
     * @param sequence   its sequence number
     * @param endOfBatch whether it is the last event currently available
     */
    public void onEvent(InputEvent event, long sequence, boolean endOfBatch) {
        // 1. Apply the input
        try {
            if (event.instance() == null)
                context.setInput(event.connector(), event.value());
            else
                context.setInput(event.instance(), event.connector(), event.value());
        } catch (RuntimeException e) {
            log.error("Rejected input event {} (seq {}): {}", event, sequence, e.getMessage());
            batchRejected = true;
        }

        // 2. Step at the end of the batch
        if (!event.isBatchEnd() && !endOfBatch)
            return;
        boolean rejected = batchRejected;
        batchRejected = false;
        if (rejected) {
            droppedBatches++;
            return;
        }
        if (context.state() == ContextState.FAULTED) {
            droppedBatches++;
            log.debug("Dropping batch ending at seq {}: {} is faulted", sequence, context.rootPath());
            return;
        }
        try {
            int n = context.step();
            if (postStep != null)
                postStep.onStepped(context.stepCount(), n);
        } catch (RuntimeException e) {
            droppedBatches++;
            log.error("Step failed for batch ending at seq {}: {}", sequence, e.getMessage());
        }
    }

    /** Batches that ended without a completed step. */
    public long droppedBatches() {
        return droppedBatches;
    }

    /** Callback for post-step actions. */
    @FunctionalInterface
    public interface PostStepCallback {
        /**
         * Called after the context completed a step.
         *
         * @param step      the number of completed steps
         * @param evaluated instances evaluated in the step
         */
        void onStepped(long step, int evaluated);
    }
}
