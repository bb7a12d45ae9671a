package com.eainde.safepulse.capture;

import com.eainde.safepulse.signal.DangerSignalKind;

import java.time.LocalTime;
import java.util.List;

/**
 * Checks a position against the user's safe zones during late hours. Distances use a flat
 * approximation of {@value #METERS_PER_DEGREE} meters per degree, which is adequate at zone scale.
 */
public class SafeZoneEvaluator {

    static final double METERS_PER_DEGREE = 111_000;
    static final double LOCATION_VALUE = 50;
    static final double TIME_VALUE = 30;

    /** 23:00 through 05:59 local time. */
    public static boolean isLateNight(LocalTime time) {
        int hour = time.getHour();
        return hour >= 23 || hour <= 5;
    }

    public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
        return Math.hypot(lat1 - lat2, lon1 - lon2) * METERS_PER_DEGREE;
    }

    public boolean isInsideAny(double latitude, double longitude, List<SafeZone> zones) {
        return zones.stream().anyMatch(zone ->
                distanceMeters(zone.latitude(), zone.longitude(), latitude, longitude) < zone.effectiveRadius());
    }

    /**
     * Emits {@code location} and {@code time} when the user is outside every zone late at night.
     * With no zones configured there is nothing to compare against and nothing is emitted.
     */
    public List<DetectedSignal<DangerSignalKind>> evaluate(double latitude, double longitude,
                                                           List<SafeZone> zones, LocalTime localTime) {
        if (!isLateNight(localTime) || zones.isEmpty() || isInsideAny(latitude, longitude, zones)) {
            return List.of();
        }
        return List.of(
                new DetectedSignal<>(DangerSignalKind.LOCATION, LOCATION_VALUE, "Outside safe zone during late hours"),
                new DetectedSignal<>(DangerSignalKind.TIME, TIME_VALUE,
                        "Late night activity detected (" + localTime.getHour() + ":00)"));
    }
}
