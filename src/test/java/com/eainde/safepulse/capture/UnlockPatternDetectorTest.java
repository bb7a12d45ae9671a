package com.eainde.safepulse.capture;

import com.eainde.safepulse.signal.CoercionSignalKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class UnlockPatternDetectorTest {

    private static final Instant T0 = Instant.parse("2025-05-10T21:00:00Z");

    private UnlockPatternDetector detector;

    @BeforeEach
    void setUp() {
        detector = new UnlockPatternDetector();
    }

    @Test
    @DisplayName("the third rapid unlock should emit forced unlock and restart the count")
    void thirdRapidUnlock() {
        assertThat(detector.recordUnlock(T0)).isEmpty();
        assertThat(detector.recordUnlock(T0.plusSeconds(2))).isEmpty();
        assertThat(detector.recordUnlock(T0.plusSeconds(4))).isEmpty();

        DetectedSignal<CoercionSignalKind> signal = detector.recordUnlock(T0.plusSeconds(6)).orElseThrow();
        assertThat(signal.kind()).isEqualTo(CoercionSignalKind.FORCED_UNLOCK);
        assertThat(signal.value()).isEqualTo(45);

        assertThat(detector.recordUnlock(T0.plusSeconds(8))).isEmpty();
    }

    @Test
    @DisplayName("an unlock exactly five seconds later should not count as rapid")
    void boundary() {
        detector.recordUnlock(T0);
        detector.recordUnlock(T0.plusSeconds(1));
        detector.recordUnlock(T0.plusSeconds(2));
        assertThat(detector.recordUnlock(T0.plusSeconds(7))).isEmpty();
        // count fell back to one, two more rapid unlocks are needed
        assertThat(detector.recordUnlock(T0.plusSeconds(8))).isEmpty();
        assertThat(detector.recordUnlock(T0.plusSeconds(9))).isPresent();
    }
}
