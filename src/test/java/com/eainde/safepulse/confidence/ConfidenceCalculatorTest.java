package com.eainde.safepulse.confidence;

import com.eainde.safepulse.signal.CoercionSignalKind;
import com.eainde.safepulse.signal.DangerSignalKind;
import com.eainde.safepulse.signal.Signal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceCalculatorTest {

    private static final Instant T0 = Instant.parse("2025-01-01T12:00:00Z");

    // =========================================================================
    //  Decay
    // =========================================================================

    @Nested
    @DisplayName("Linear decay")
    class Decay {

        @Test
        @DisplayName("should be 1 at observation time and 0 at the half-life")
        void endpoints() {
            Duration halfLife = Duration.ofMinutes(5);
            assertThat(ConfidenceCalculator.decay(T0, halfLife, T0)).isEqualTo(1.0);
            assertThat(ConfidenceCalculator.decay(T0, halfLife, T0.plus(halfLife))).isEqualTo(0.0);
            assertThat(ConfidenceCalculator.decay(T0, halfLife, T0.plus(Duration.ofHours(2)))).isEqualTo(0.0);
        }

        @Test
        @DisplayName("should halve at half of the half-life")
        void midpoint() {
            assertThat(ConfidenceCalculator.decay(T0, Duration.ofMinutes(10), T0.plus(Duration.ofMinutes(5))))
                    .isCloseTo(0.5, within(1e-9));
        }

        @Test
        @DisplayName("should treat a future timestamp as age zero")
        void clockSkew() {
            assertThat(ConfidenceCalculator.decay(T0.plusSeconds(30), Duration.ofMinutes(5), T0)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("score should never increase as time passes without new signals")
        void monotonic() {
            List<Signal<CoercionSignalKind>> signals = List.of(
                    new Signal<>(CoercionSignalKind.FORCED_UNLOCK, 45, T0, "a"),
                    new Signal<>(CoercionSignalKind.SHAKING_HANDS, 30, T0.plusSeconds(40), "b"),
                    new Signal<>(CoercionSignalKind.STRESS_PATTERN, 40, T0.plusSeconds(90), "c"));

            int previous = Integer.MAX_VALUE;
            for (int second = 90; second <= 600; second += 7) {
                int score = ConfidenceCalculator.score(signals, DomainProfiles.COERCION, T0.plusSeconds(second));
                assertThat(score).isLessThanOrEqualTo(previous);
                previous = score;
            }
            assertThat(previous).isZero();
        }
    }

    // =========================================================================
    //  Score
    // =========================================================================

    @Nested
    @DisplayName("Weighted score")
    class Score {

        @Test
        @DisplayName("single fresh signal should score round(value x weight / normalizer)")
        void singleSignal() {
            List<Signal<CoercionSignalKind>> signals =
                    List.of(new Signal<>(CoercionSignalKind.FORCED_UNLOCK, 45, T0, null));

            // 45 * 1.5 / 2 = 33.75
            assertThat(ConfidenceCalculator.score(signals, DomainProfiles.COERCION, T0)).isEqualTo(34);
        }

        @Test
        @DisplayName("empty history should score zero")
        void empty() {
            assertThat(ConfidenceCalculator.score(List.<Signal<DangerSignalKind>>of(), DomainProfiles.DANGER, T0))
                    .isZero();
        }

        @Test
        @DisplayName("should cap at 100")
        void capped() {
            List<Signal<DangerSignalKind>> signals = List.of(
                    new Signal<>(DangerSignalKind.VOICE, 100, T0, null),
                    new Signal<>(DangerSignalKind.VOICE, 100, T0, null),
                    new Signal<>(DangerSignalKind.VOICE, 100, T0, null),
                    new Signal<>(DangerSignalKind.VOICE, 100, T0, null));

            assertThat(ConfidenceCalculator.score(signals, DomainProfiles.DANGER, T0)).isEqualTo(100);
        }

        @Test
        @DisplayName("contribution should apply weight and decay")
        void contribution() {
            Signal<DangerSignalKind> motion = new Signal<>(DangerSignalKind.MOTION, 80, T0, null);

            assertThat(ConfidenceCalculator.contribution(motion, Duration.ofMinutes(10), T0.plus(Duration.ofMinutes(5))))
                    .isCloseTo(80 * 25 * 0.5, within(1e-9));
        }
    }

    // =========================================================================
    //  Levels
    // =========================================================================

    @Nested
    @DisplayName("Level thresholds")
    class Levels {

        @Test
        @DisplayName("coercion thresholds are inclusive lower bounds")
        void coercion() {
            assertThat(DomainProfiles.COERCION.levelFor(39)).isEqualTo(CoercionLevel.NONE);
            assertThat(DomainProfiles.COERCION.levelFor(40)).isEqualTo(CoercionLevel.SUSPECTED);
            assertThat(DomainProfiles.COERCION.levelFor(69)).isEqualTo(CoercionLevel.SUSPECTED);
            assertThat(DomainProfiles.COERCION.levelFor(70)).isEqualTo(CoercionLevel.CONFIRMED);
        }

        @Test
        @DisplayName("danger distinguishes HIGH at exactly 80 from EMERGENCY above it")
        void danger() {
            assertThat(DomainProfiles.DANGER.levelFor(59)).isEqualTo(DangerLevel.SAFE);
            assertThat(DomainProfiles.DANGER.levelFor(60)).isEqualTo(DangerLevel.UNCERTAIN);
            assertThat(DomainProfiles.DANGER.levelFor(80)).isEqualTo(DangerLevel.HIGH);
            assertThat(DomainProfiles.DANGER.levelFor(81)).isEqualTo(DangerLevel.EMERGENCY);
        }

        @Test
        @DisplayName("situational has four levels")
        void situational() {
            assertThat(DomainProfiles.SITUATIONAL.levelFor(29)).isEqualTo(SituationalLevel.NONE);
            assertThat(DomainProfiles.SITUATIONAL.levelFor(30)).isEqualTo(SituationalLevel.MONITORING);
            assertThat(DomainProfiles.SITUATIONAL.levelFor(50)).isEqualTo(SituationalLevel.ARMED);
            assertThat(DomainProfiles.SITUATIONAL.levelFor(75)).isEqualTo(SituationalLevel.CRITICAL);
        }
    }
}
