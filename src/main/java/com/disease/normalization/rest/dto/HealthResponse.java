package com.disease.normalization.rest.dto;

import com.disease.normalization.health.HealthStatus;

import java.util.Map;

public record HealthResponse(String status, String message, Map<String, Object> details) {

    public static HealthResponse from(HealthStatus status) {
        return new HealthResponse(status.status().name(), status.message(), status.details());
    }
}
