package com.formulize.compute.wiring;

import com.formulize.compute.engine.ComputationDispatcher;
import com.formulize.compute.registry.VariableRegistry;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Lets any thread publish variable updates to the engine. Updates travel
 * through an LMAX Disruptor ring buffer to a single consumer thread, which is
 * the only thread touching the registry once the publisher is started.
 */
public final class ComputationPublisher implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ComputationPublisher.class);

    private final Disruptor<VariableEvent> disruptor;
    private final VariableEventHandler handler;
    private volatile RingBuffer<VariableEvent> ringBuffer;

    /**
     * @param bufferSize Ring size, a power of two.
     */
    public ComputationPublisher(VariableRegistry registry, ComputationDispatcher dispatcher, int bufferSize) {
        this.handler = new VariableEventHandler(registry, dispatcher);
        this.disruptor = new Disruptor<>(
                VariableEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(handler);
    }

    public VariableEventHandler handler() {
        return handler;
    }

    public void start() {
        ringBuffer = disruptor.start();
        log.info("Computation publisher started (buffer {})", ringBuffer.getBufferSize());
    }

    public void publishValue(String variableId, double value) {
        publishValue(variableId, value, false);
    }

    /**
     * @param batchEnd Forces a recompute right after this update even if more
     *                 updates are queued.
     */
    public void publishValue(String variableId, double value, boolean batchEnd) {
        RingBuffer<VariableEvent> rb = requireStarted();
        long seq = rb.next();
        try {
            rb.get(seq).setScalarUpdate(variableId, value, batchEnd, seq);
        } finally {
            rb.publish(seq);
        }
    }

    public void publishSet(String variableId, List<?> elements) {
        RingBuffer<VariableEvent> rb = requireStarted();
        long seq = rb.next();
        try {
            rb.get(seq).setSetUpdate(variableId, elements, false, seq);
        } finally {
            rb.publish(seq);
        }
    }

    private RingBuffer<VariableEvent> requireStarted() {
        RingBuffer<VariableEvent> rb = ringBuffer;
        if (rb == null)
            throw new IllegalStateException("Publisher not started");
        return rb;
    }

    /** Waits for queued updates to be applied, then stops the consumer. */
    public void shutdown() {
        if (ringBuffer == null)
            return;
        disruptor.shutdown();
        log.info("Computation publisher stopped");
    }

    @Override
    public void close() {
        shutdown();
    }
}
