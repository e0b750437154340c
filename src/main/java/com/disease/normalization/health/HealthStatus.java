package com.disease.normalization.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one component or of the whole normalizer.
 *
 * @param status  UP, DEGRADED or DOWN, in increasing severity
 * @param message short explanation
 * @param details extra diagnostic values, in insertion order
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> extended = new LinkedHashMap<>(details);
        extended.put(key, value);
        return new HealthStatus(status, message, extended);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    /**
     * Returns true if this status is more severe than the other.
     */
    public boolean isWorseThan(Status other) {
        return status.ordinal() > other.ordinal();
    }
}
