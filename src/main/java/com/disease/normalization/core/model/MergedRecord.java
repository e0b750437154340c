package com.disease.normalization.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Normalized, user-facing concept for one merge group.
 *
 * @param conceptId        the group's merge_ref
 * @param label            chosen label, or null if no member has one
 * @param aliases          case-insensitively distinct alternate names
 * @param xrefs            non-primary member ids plus declared cross-references
 * @param associatedWith   related-but-not-identical references
 * @param pediatricDisease OR-reduced flag, null when no member asserts a value
 * @param oncologicDisease OR-reduced flag, null when no member asserts a value
 * @param members          sorted concept ids of every group member, merge_ref included
 */
public record MergedRecord(
        String conceptId,
        String label,
        List<String> aliases,
        List<String> xrefs,
        List<String> associatedWith,
        Boolean pediatricDisease,
        Boolean oncologicDisease,
        List<String> members
) {
    public MergedRecord {
        Objects.requireNonNull(conceptId, "conceptId is required");
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        xrefs = xrefs != null ? List.copyOf(xrefs) : List.of();
        associatedWith = associatedWith != null ? List.copyOf(associatedWith) : List.of();
        members = members != null && !members.isEmpty() ? List.copyOf(members) : List.of(conceptId);
    }

    public String conceptIdKey() {
        return conceptId.toLowerCase(Locale.ROOT);
    }

    public boolean hasLabel() {
        return label != null && !label.isEmpty();
    }

    /**
     * Returns true if this record stands for more than one source record.
     */
    public boolean isMultiMember() {
        return members.size() > 1;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String conceptId;
        private String label;
        private List<String> aliases = new ArrayList<>();
        private List<String> xrefs = new ArrayList<>();
        private List<String> associatedWith = new ArrayList<>();
        private Boolean pediatricDisease;
        private Boolean oncologicDisease;
        private List<String> members = new ArrayList<>();

        public Builder conceptId(String conceptId) {
            this.conceptId = conceptId;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder aliases(List<String> aliases) {
            this.aliases = aliases;
            return this;
        }

        public Builder xrefs(List<String> xrefs) {
            this.xrefs = xrefs;
            return this;
        }

        public Builder associatedWith(List<String> associatedWith) {
            this.associatedWith = associatedWith;
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

        public Builder members(List<String> members) {
            this.members = members;
            return this;
        }

        public MergedRecord build() {
            return new MergedRecord(conceptId, label, aliases, xrefs, associatedWith,
                    pediatricDisease, oncologicDisease, members);
        }
    }
}
