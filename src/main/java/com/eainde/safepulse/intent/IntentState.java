package com.eainde.safepulse.intent;

import java.time.Instant;
import java.util.List;

/**
 * Result of one correlation pass.
 *
 * @param events            full bounded history, including events outside the window
 * @param confirmed         whether the confirmation rule holds over the trailing window now
 * @param confirmationScore advisory 0-100 score; never gates {@code confirmed}
 * @param keywordCount      keyword events inside the window
 * @param lastDropTime      latest phone drop in the history, or null
 * @param triggered         whether the confirmation callback has fired since the last reset
 */
public record IntentState(
        List<IntentEvent> events,
        boolean confirmed,
        int confirmationScore,
        int keywordCount,
        Instant lastDropTime,
        boolean triggered
) {
    public IntentState {
        events = List.copyOf(events);
    }
}
