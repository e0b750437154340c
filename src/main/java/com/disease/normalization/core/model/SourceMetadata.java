package com.disease.normalization.core.model;

import java.util.Objects;

/**
 * License, version and provenance information for one ingested source.
 */
public record SourceMetadata(
        String dataLicense,
        String dataLicenseUrl,
        String version,
        String dataUrl,
        String rdpUrl,
        boolean nonCommercial,
        boolean shareAlike,
        boolean attribution
) {
    public SourceMetadata {
        Objects.requireNonNull(dataLicense, "dataLicense is required");
        Objects.requireNonNull(version, "version is required");
    }
}
