package com.ryuqq.decider.core.spi;

/**
 * Thrown by deduplicating repositories when a sequence number was already applied or arrives out
 * of order.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class DuplicateSequenceException extends RuntimeException {

    private final transient Object sequence;
    private final transient Object lastSequence;

    /**
     * Creates a duplicate-sequence failure.
     *
     * @param sequence the rejected sequence
     * @param lastSequence the last applied sequence, may be null
     */
    public DuplicateSequenceException(Object sequence, Object lastSequence) {
        super("Sequence " + sequence + " rejected, last applied was " + lastSequence);
        this.sequence = sequence;
        this.lastSequence = lastSequence;
    }

    public Object sequence() {
        return sequence;
    }

    public Object lastSequence() {
        return lastSequence;
    }
}
