package com.formulize.compute.wiring;

import com.formulize.compute.engine.ComputationDispatcher;
import com.formulize.compute.registry.VariableRegistry;
import com.lmax.disruptor.EventHandler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Consumes {@link VariableEvent}s on the engine thread.
 *
 * Events of one Disruptor batch are applied with the registry in bulk mode, so
 * a burst of slider updates costs a single recompute at the end of the batch
 * (or earlier if an event asks for it). In step mode the batch is applied
 * without recompute. A bad event is logged and skipped; the consumer thread
 * never sees an exception.
 */
public final class VariableEventHandler implements EventHandler<VariableEvent> {
    private static final Logger log = LogManager.getLogger(VariableEventHandler.class);

    private final VariableRegistry registry;
    private final ComputationDispatcher dispatcher;
    private RecomputeCallback afterRecompute;
    private long rejected;

    public VariableEventHandler(VariableRegistry registry, ComputationDispatcher dispatcher) {
        this.registry = registry;
        this.dispatcher = dispatcher;
    }

    public void setRecomputeCallback(RecomputeCallback callback) {
        this.afterRecompute = callback;
    }

    @Override
    public void onEvent(VariableEvent event, long sequence, boolean endOfBatch) {
        if (!registry.isBulk())
            registry.beginBulk();
        try {
            apply(event);
        } catch (RuntimeException e) {
            rejected++;
            log.error("Error applying update to {} (seq {}): {}", event.variableId(), event.sequenceId(),
                    e.getMessage(), e);
        }

        boolean flush = event.isBatchEnd() || endOfBatch;
        event.clear();
        if (flush) {
            registry.endBulk();
            // staged values belong to the step driver
            int updated = registry.isStepMode() ? 0 : dispatcher.recompute();
            if (afterRecompute != null)
                afterRecompute.onRecomputed(dispatcher.epoch(), updated);
        }
    }

    private void apply(VariableEvent event) {
        String id = event.variableId();
        if (id == null) {
            rejected++;
            log.error("Received event without variable id (seq {})", event.sequenceId());
            return;
        }
        boolean accepted = event.isSetUpdate()
                ? registry.setSetValue(id, event.elements())
                : registry.setValue(id, event.scalar());
        if (!accepted)
            rejected++;
    }

    /** Events that were dropped because they were invalid. */
    public long rejectedCount() {
        return rejected;
    }

    /**
     * Invoked on the engine thread at the end of every batch, also in step mode
     * where no recompute ran.
     */
    @FunctionalInterface
    public interface RecomputeCallback {
        /**
         * @param epoch   The dispatcher's pass number.
         * @param updated Computed variables that accepted a result.
         */
        void onRecomputed(long epoch, int updated);
    }
}
