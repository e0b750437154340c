package com.disease.normalization.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of ontology sources whose records are ingested and merged.
 *
 * <p>Declaration order is the source priority used for merge_ref selection,
 * merged label selection and normalize tie-breaks: NCIt outranks Mondo, which
 * outranks OMIM, then OncoTree, then DO. The order must never vary at runtime.</p>
 */
public enum SourceName {
    NCIT("NCIt", "ncit"),
    MONDO("Mondo", "mondo"),
    OMIM("OMIM", "MIM"),
    ONCOTREE("OncoTree", "oncotree"),
    DO("DO", "DOID");

    private final String displayName;
    private final String namespacePrefix;

    SourceName(String displayName, String namespacePrefix) {
        this.displayName = displayName;
        this.namespacePrefix = namespacePrefix;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Namespace prefix used in concept ids owned by this source, as stored.
     */
    public String getNamespacePrefix() {
        return namespacePrefix;
    }

    /**
     * Rank in the fixed source priority; lower is better.
     */
    public int priority() {
        return ordinal() + 1;
    }

    /**
     * Returns true if the given concept id carries this source's namespace prefix.
     */
    public boolean ownsConceptId(String conceptId) {
        int colon = conceptId.indexOf(':');
        return colon > 0 && conceptId.substring(0, colon).equalsIgnoreCase(namespacePrefix);
    }

    /**
     * Looks up a source by display name or enum name, ignoring case.
     */
    public static Optional<SourceName> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        for (SourceName source : values()) {
            if (source.displayName.toLowerCase(Locale.ROOT).equals(lower)
                    || source.name().toLowerCase(Locale.ROOT).equals(lower)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up the source owning a concept id's namespace prefix, ignoring case.
     */
    public static Optional<SourceName> fromConceptId(String conceptId) {
        if (conceptId == null) {
            return Optional.empty();
        }
        for (SourceName source : values()) {
            if (source.ownsConceptId(conceptId)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }
}
