package com.disease.normalization.api;

import java.util.List;

/**
 * A non-fatal remark attached to a query result.
 *
 * @param type       the kind of warning
 * @param message    human-readable description
 * @param conceptIds concept ids involved, e.g. the competing merge refs of an ambiguous match
 */
public record QueryWarning(Type type, String message, List<String> conceptIds) {

    public QueryWarning {
        conceptIds = conceptIds != null ? List.copyOf(conceptIds) : List.of();
    }

    public static QueryWarning nonBreakingSpace() {
        return new QueryWarning(Type.NBSP,
                "Non-breaking space characters were detected in the query.", List.of());
    }

    public static QueryWarning ambiguousMatch(List<String> mergeRefs) {
        return new QueryWarning(Type.AMBIGUOUS_MATCH,
                "Query matched concepts in " + mergeRefs.size() + " distinct groups; returning the highest-priority one.",
                mergeRefs);
    }

    public enum Type {
        NBSP("non_breaking_space_characters"),
        AMBIGUOUS_MATCH("ambiguous_match");

        private final String key;

        Type(String key) {
            this.key = key;
        }

        public String getKey() {
            return key;
        }
    }
}
