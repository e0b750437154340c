package com.disease.normalization.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A disease concept as described by exactly one source ontology.
 * Immutable; collection fields are deduplicated case-sensitively as written.
 */
public class SourceRecord {
    private final String conceptId;
    private final SourceName sourceName;
    private final String label;
    private final List<String> aliases;
    private final List<String> xrefs;
    private final List<String> associatedWith;
    private final Boolean pediatricDisease;
    private final Boolean oncologicDisease;
    private final String mergeRef;

    private SourceRecord(Builder builder) {
        this.conceptId = builder.conceptId;
        this.sourceName = builder.sourceName;
        this.label = builder.label;
        this.aliases = distinct(builder.aliases);
        this.xrefs = distinct(builder.xrefs);
        this.associatedWith = distinct(builder.associatedWith);
        this.pediatricDisease = builder.pediatricDisease;
        this.oncologicDisease = builder.oncologicDisease;
        this.mergeRef = builder.mergeRef;
    }

    private static List<String> distinct(Collection<String> values) {
        List<String> result = new ArrayList<>();
        for (String value : new LinkedHashSet<>(values)) {
            if (value != null && !value.isEmpty()) {
                result.add(value);
            }
        }
        return List.copyOf(result);
    }

    public String getConceptId() {
        return conceptId;
    }

    /**
     * Case-folded concept id used for all comparisons.
     */
    public String getConceptIdKey() {
        return conceptId.toLowerCase(Locale.ROOT);
    }

    /**
     * The owning source, or null if the source could not be recognized.
     */
    public SourceName getSourceName() {
        return sourceName;
    }

    public boolean hasRankedSource() {
        return sourceName != null;
    }

    public String getLabel() {
        return label;
    }

    public boolean hasLabel() {
        return label != null && !label.isEmpty();
    }

    public List<String> getAliases() {
        return aliases;
    }

    public List<String> getXrefs() {
        return xrefs;
    }

    public List<String> getAssociatedWith() {
        return associatedWith;
    }

    public Boolean getPediatricDisease() {
        return pediatricDisease;
    }

    public Boolean getOncologicDisease() {
        return oncologicDisease;
    }

    /**
     * The merge_ref of the group this record belonged to at the last committed
     * rebuild, if it was merged with records from other sources.
     */
    public Optional<String> getMergeRef() {
        return Optional.ofNullable(mergeRef);
    }

    /**
     * Returns a copy of this record pointing at the given merge_ref (null clears it).
     */
    public SourceRecord withMergeRef(String newMergeRef) {
        return builder(this).mergeRef(newMergeRef).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceRecord that = (SourceRecord) o;
        return Objects.equals(conceptId, that.conceptId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conceptId);
    }

    @Override
    public String toString() {
        return "SourceRecord{" +
                "conceptId='" + conceptId + '\'' +
                ", sourceName=" + sourceName +
                ", label='" + label + '\'' +
                ", aliases=" + aliases.size() +
                ", xrefs=" + xrefs +
                ", mergeRef='" + mergeRef + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(SourceRecord record) {
        return new Builder()
                .conceptId(record.conceptId)
                .sourceName(record.sourceName)
                .label(record.label)
                .aliases(record.aliases)
                .xrefs(record.xrefs)
                .associatedWith(record.associatedWith)
                .pediatricDisease(record.pediatricDisease)
                .oncologicDisease(record.oncologicDisease)
                .mergeRef(record.mergeRef);
    }

    public static class Builder {
        private String conceptId;
        private SourceName sourceName;
        private String label;
        private final List<String> aliases = new ArrayList<>();
        private final List<String> xrefs = new ArrayList<>();
        private final List<String> associatedWith = new ArrayList<>();
        private Boolean pediatricDisease;
        private Boolean oncologicDisease;
        private String mergeRef;

        public Builder conceptId(String conceptId) {
            this.conceptId = conceptId;
            return this;
        }

        public Builder sourceName(SourceName sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder aliases(Collection<String> aliases) {
            this.aliases.clear();
            if (aliases != null) {
                this.aliases.addAll(aliases);
            }
            return this;
        }

        public Builder alias(String alias) {
            this.aliases.add(alias);
            return this;
        }

        public Builder xrefs(Collection<String> xrefs) {
            this.xrefs.clear();
            if (xrefs != null) {
                this.xrefs.addAll(xrefs);
            }
            return this;
        }

        public Builder xref(String xref) {
            this.xrefs.add(xref);
            return this;
        }

        public Builder associatedWith(Collection<String> associatedWith) {
            this.associatedWith.clear();
            if (associatedWith != null) {
                this.associatedWith.addAll(associatedWith);
            }
            return this;
        }

        public Builder associatedWith(String reference) {
            this.associatedWith.add(reference);
            return this;
        }

        public Builder pediatricDisease(Boolean pediatricDisease) {
            this.pediatricDisease = pediatricDisease;
            return this;
        }

        public Builder oncologicDisease(Boolean oncologicDisease) {
            this.oncologicDisease = oncologicDisease;
            return this;
        }

        public Builder mergeRef(String mergeRef) {
            this.mergeRef = mergeRef;
            return this;
        }

        public SourceRecord build() {
            Objects.requireNonNull(conceptId, "conceptId is required");
            if (conceptId.isBlank()) {
                throw new IllegalArgumentException("conceptId must not be blank");
            }
            return new SourceRecord(this);
        }
    }
}
