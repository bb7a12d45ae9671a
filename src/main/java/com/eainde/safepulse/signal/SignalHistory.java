package com.eainde.safepulse.signal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, arrival-ordered signal buffer. When full, the oldest arrival is evicted.
 * <p>
 * Not thread-safe; owned by exactly one aggregator which serializes access.
 * </p>
 */
public class SignalHistory<K extends Enum<K> & SignalKind> {

    private final int capacity;
    private final Deque<Signal<K>> signals;

    public SignalHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.signals = new ArrayDeque<>(capacity);
    }

    /** Appends at the tail regardless of timestamp order. */
    public void append(Signal<K> signal) {
        if (signals.size() == capacity) {
            signals.removeFirst();
        }
        signals.addLast(signal);
    }

    public List<Signal<K>> snapshot() {
        return List.copyOf(signals);
    }

    public int size() {
        return signals.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return signals.isEmpty();
    }

    public void clear() {
        signals.clear();
    }
}
