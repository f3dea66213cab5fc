package com.formulize.compute.wiring;

import java.util.List;

/**
 * Mutable ring buffer slot carrying one variable update from a producer thread
 * to the engine thread.
 *
 * Instances are pre-allocated by the ring buffer and reused; the consumer
 * clears each one after applying it.
 */
public final class VariableEvent {
    private String variableId;
    private double scalar;
    private List<Object> elements;
    private boolean batchEnd;
    private long sequenceId;

    /**
     * @param variableId Target variable.
     * @param value      New scalar value.
     * @param batchEnd   Forces a recompute right after this event.
     * @param seqId      Sequence id, for correlation in logs.
     */
    public void setScalarUpdate(String variableId, double value, boolean batchEnd, long seqId) {
        this.variableId = variableId;
        this.scalar = value;
        this.elements = null;
        this.batchEnd = batchEnd;
        this.sequenceId = seqId;
    }

    /**
     * @param variableId Target variable.
     * @param elements   New set elements; the list is copied.
     * @param batchEnd   Forces a recompute right after this event.
     * @param seqId      Sequence id, for correlation in logs.
     */
    public void setSetUpdate(String variableId, List<?> elements, boolean batchEnd, long seqId) {
        this.variableId = variableId;
        this.scalar = Double.NaN;
        this.elements = List.copyOf(elements);
        this.batchEnd = batchEnd;
        this.sequenceId = seqId;
    }

    public String variableId() {
        return variableId;
    }

    public double scalar() {
        return scalar;
    }

    public List<Object> elements() {
        return elements;
    }

    public boolean isSetUpdate() {
        return elements != null;
    }

    public boolean isBatchEnd() {
        return batchEnd;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        variableId = null;
        scalar = 0;
        elements = null;
        batchEnd = false;
        sequenceId = 0;
    }
}
