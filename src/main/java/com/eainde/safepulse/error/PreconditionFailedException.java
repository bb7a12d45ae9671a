package com.eainde.safepulse.error;

/**
 * An operation was invoked in a state that does not allow it. Never a silent no-op:
 * callers can tell exactly which precondition failed from {@link #getPrecondition()}.
 */
public class PreconditionFailedException extends RuntimeException {

    private final Precondition precondition;

    public PreconditionFailedException(Precondition precondition) {
        this(precondition, precondition.description());
    }

    public PreconditionFailedException(Precondition precondition, String message) {
        super(message);
        this.precondition = precondition;
    }

    public Precondition getPrecondition() {
        return precondition;
    }
}
