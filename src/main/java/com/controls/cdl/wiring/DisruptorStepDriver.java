package com.controls.cdl.wiring;

import com.controls.cdl.engine.ExecutionContext;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import lombok.extern.log4j.Log4j2;

/**
 * Feeds external inputs to an execution context through an LMAX Disruptor
 * ring buffer.
 *
 * <p>
 * Producers call {@link #publish}; one consumer thread applies the inputs and
 * steps the context at the end of each batch (see {@link StepPublisher}).
 * Once {@link #start()} is called the consumer thread owns the context: no
 * other thread may step it or set its inputs until {@link #close()} returns.
 * Publishing is single-producer.
 */
@Log4j2
public final class DisruptorStepDriver implements AutoCloseable {
    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private final ExecutionContext context;
    private final StepPublisher publisher;
    private final Disruptor<InputEvent> disruptor;
    private volatile RingBuffer<InputEvent> ringBuffer;

    public DisruptorStepDriver(ExecutionContext context) {
        this(context, DEFAULT_BUFFER_SIZE);
    }

    /** @param bufferSize ring size, a power of two */
    public DisruptorStepDriver(ExecutionContext context, int bufferSize) {
        this.context = context;
        this.publisher = new StepPublisher(context);
        this.disruptor = new Disruptor<>(
                InputEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith((event, sequence, endOfBatch) -> {
            publisher.onEvent(event, sequence, endOfBatch);
            event.clear();
        });
    }

    public StepPublisher publisher() {
        return publisher;
    }

    public synchronized void start() {
        if (ringBuffer != null)
            throw new IllegalStateException("Driver already started");
        ringBuffer = disruptor.start();
        log.info("Input driver started for {} (buffer {})", context.rootPath(), ringBuffer.getBufferSize());
    }

    /** Publishes a value for a root input. */
    public void publish(String connector, Object value, boolean batchEnd) {
        publish(null, connector, value, batchEnd);
    }

    public void publish(String instance, String connector, Object value, boolean batchEnd) {
        RingBuffer<InputEvent> rb = ringBuffer;
        if (rb == null)
            throw new IllegalStateException("Driver not started");
        long seq = rb.next();
        try {
            rb.get(seq).set(instance, connector, value, batchEnd, seq);
        } finally {
            rb.publish(seq);
        }
    }

    /** Waits for every published event to be processed, then stops the consumer thread. */
    @Override
    public synchronized void close() {
        if (ringBuffer == null)
            return;
        disruptor.shutdown();
        ringBuffer = null;
        log.info("Input driver stopped for {} after {} step(s)", context.rootPath(), context.stepCount());
    }
}
