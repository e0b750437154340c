package com.disease.normalization.rest.dto;

import com.disease.normalization.api.QueryWarning;

import java.util.List;

public record WarningDto(String type, String message, List<String> conceptIds) {

    public static WarningDto from(QueryWarning warning) {
        return new WarningDto(warning.type().getKey(), warning.message(), warning.conceptIds());
    }

    public static List<WarningDto> fromAll(List<QueryWarning> warnings) {
        return warnings.stream().map(WarningDto::from).toList();
    }
}
