package com.eainde.safepulse.intent;

import java.time.Instant;

public record IntentEvent(
        IntentEventKind kind,
        double confidence,
        Instant timestamp
) {
}
