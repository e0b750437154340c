package com.disease.normalization.rest.dto;

import com.disease.normalization.core.model.NamespacePrefix;

import java.util.Locale;
import java.util.Optional;

/**
 * SKOS-style mapping from a normalized concept to a reference in another system.
 *
 * @param code     the local code, or the full CURIE for Mondo and DO
 * @param system   system URI of the reference's namespace
 * @param relation {@code exactMatch} or {@code relatedMatch}
 */
public record ConceptMappingDto(String code, String system, String relation) {

    public static final String EXACT_MATCH = "exactMatch";
    public static final String RELATED_MATCH = "relatedMatch";

    /**
     * Builds a mapping for a CURIE. Empty if the reference has no prefix or the
     * prefix is not a known namespace.
     */
    public static Optional<ConceptMappingDto> of(String curie, String relation) {
        int colon = curie.indexOf(':');
        if (colon <= 0) {
            return Optional.empty();
        }
        return NamespacePrefix.fromPrefix(curie.substring(0, colon)).map(namespace -> {
            String code = switch (namespace) {
                case MONDO -> curie.toUpperCase(Locale.ROOT);
                case DOID -> curie;
                default -> curie.substring(colon + 1);
            };
            return new ConceptMappingDto(code, namespace.getSystemUri(), relation);
        });
    }
}
