package com.eainde.safepulse.signal;

/**
 * A closed, per-domain category of evidence with a fixed scoring weight.
 * <p>
 * Implemented by enums only, so that an unknown kind can never reach an
 * aggregator: string input from capture collaborators is resolved through
 * {@link SignalKinds#resolve(Class, String)} first.
 * </p>
 */
public interface SignalKind {

    /** Multiplier applied to a signal's value before decay. */
    double weight();

    /** Snake-case name used by capture collaborators, e.g. {@code forced_unlock}. */
    String wireName();
}
