package com.eainde.safepulse.intent;

import com.eainde.safepulse.MutableClock;
import com.eainde.safepulse.alert.AlertDispatcher;
import com.eainde.safepulse.alert.AlertEvent;
import com.eainde.safepulse.alert.AlertNotifier;
import com.eainde.safepulse.alert.IncidentResponder;
import com.eainde.safepulse.error.InvalidSignalException;
import com.eainde.safepulse.signal.SafetyDomain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class IntentCorrelatorTest {

    @Mock
    private AlertNotifier alertNotifier;

    @Mock
    private IncidentResponder incidentResponder;

    private MutableClock clock;
    private IntentCorrelator correlator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-06-01T02:00:00Z");
        correlator = new IntentCorrelator(clock, new AlertDispatcher(alertNotifier, incidentResponder, Runnable::run));
    }

    // =========================================================================
    //  Confirmation rule
    // =========================================================================

    @Nested
    @DisplayName("Confirmation rule")
    class Rule {

        @Test
        @DisplayName("drop plus keyword should confirm")
        void dropAndKeyword() {
            correlator.registerPhoneDrop(0.9);
            IntentState state = correlator.registerKeyword(0.8);

            assertThat(state.confirmed()).isTrue();
            // 27 + 20 + 20 bonus
            assertThat(state.confirmationScore()).isEqualTo(67);
            assertThat(state.keywordCount()).isEqualTo(1);
            assertThat(state.lastDropTime()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("two keywords should confirm without a drop")
        void twoKeywords() {
            correlator.registerKeyword(1.0);
            IntentState state = correlator.registerKeyword(1.0);

            assertThat(state.confirmed()).isTrue();
            assertThat(state.confirmationScore()).isEqualTo(75);
        }

        @Test
        @DisplayName("scream, stress and stillness should never confirm on their own")
        void advisoryOnly() {
            correlator.registerScream(1.0);
            correlator.registerStressSpike(1.0);
            IntentState state = correlator.registerStillness(1.0);

            assertThat(state.confirmed()).isFalse();
            assertThat(state.confirmationScore()).isEqualTo(45);
            verify(alertNotifier, never()).notify(any());
        }

        @Test
        @DisplayName("a high score should not confirm without the required pattern")
        void scoreDoesNotGate() {
            correlator.registerPhoneDrop(1.0);
            correlator.registerPhoneDrop(1.0);
            correlator.registerScream(1.0);
            IntentState state = correlator.registerStressSpike(1.0);

            assertThat(state.confirmationScore()).isGreaterThanOrEqualTo(95);
            assertThat(state.confirmed()).isFalse();
        }
    }

    // =========================================================================
    //  Window
    // =========================================================================

    @Nested
    @DisplayName("Two-minute window")
    class Window {

        @Test
        @DisplayName("keywords 1m59s apart should confirm")
        void insideWindow() {
            correlator.registerKeyword(0.7);
            clock.advance(Duration.ofSeconds(119));

            assertThat(correlator.registerKeyword(0.7).confirmed()).isTrue();
        }

        @Test
        @DisplayName("keywords exactly 2m apart should not confirm")
        void boundaryExcluded() {
            correlator.registerKeyword(0.7);
            clock.advance(IntentCorrelator.WINDOW);

            IntentState state = correlator.registerKeyword(0.7);
            assertThat(state.confirmed()).isFalse();
            assertThat(state.keywordCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("keywords 2m01s apart should not confirm")
        void outsideWindow() {
            correlator.registerKeyword(0.7);
            clock.advance(Duration.ofSeconds(121));

            assertThat(correlator.registerKeyword(0.7).confirmed()).isFalse();
        }

        @Test
        @DisplayName("old events should remain in the history even when outside the window")
        void historyKept() {
            correlator.registerPhoneDrop(0.5);
            clock.advance(Duration.ofMinutes(5));

            IntentState state = correlator.currentState();
            assertThat(state.events()).hasSize(1);
            assertThat(state.lastDropTime()).isNotNull();
            assertThat(state.confirmationScore()).isZero();
        }

        @Test
        @DisplayName("history should hold at most fifty events")
        void bounded() {
            for (int i = 0; i < IntentCorrelator.HISTORY_CAPACITY + 10; i++) {
                correlator.registerStillness(0.1);
            }
            assertThat(correlator.currentState().events()).hasSize(IntentCorrelator.HISTORY_CAPACITY);
        }
    }

    // =========================================================================
    //  Latch
    // =========================================================================

    @Nested
    @DisplayName("Confirmation callback")
    class Latch {

        @Test
        @DisplayName("should fire once until reset, then re-arm")
        void firesOnce() {
            correlator.registerKeyword(0.9);
            correlator.registerKeyword(0.9);
            IntentState again = correlator.registerKeyword(0.9);

            assertThat(again.triggered()).isTrue();
            verify(alertNotifier, times(1)).notify(any());
            verify(incidentResponder, times(1)).respond(any());

            correlator.resetIntent();
            assertThat(correlator.currentState().events()).isEmpty();
            assertThat(correlator.currentState().triggered()).isFalse();

            correlator.registerPhoneDrop(0.9);
            correlator.registerKeyword(0.9);
            verify(incidentResponder, times(2)).respond(any());
        }

        @Test
        @DisplayName("should hand the in-window events to the collaborators")
        void alertPayload() {
            correlator.registerPhoneDrop(0.9);
            correlator.registerKeyword(0.8);

            ArgumentCaptor<AlertEvent> captor = ArgumentCaptor.forClass(AlertEvent.class);
            verify(alertNotifier).notify(captor.capture());
            assertThat(captor.getValue().domain()).isEqualTo(SafetyDomain.INTENT);
            assertThat(captor.getValue().signals()).extracting(s -> s.kind())
                    .containsExactly("phone_drop", "keyword_detected");
        }
    }

    @Test
    @DisplayName("should reject confidence outside [0, 1] and a missing kind")
    void invalidInput() {
        assertThatThrownBy(() -> correlator.registerKeyword(1.2)).isInstanceOf(InvalidSignalException.class);
        assertThatThrownBy(() -> correlator.registerKeyword(-0.1)).isInstanceOf(InvalidSignalException.class);
        assertThatThrownBy(() -> correlator.registerEvent(null, 0.5)).isInstanceOf(InvalidSignalException.class);
        assertThat(correlator.currentState().events()).isEmpty();
    }
}
