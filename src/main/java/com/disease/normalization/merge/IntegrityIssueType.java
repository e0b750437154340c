package com.disease.normalization.merge;

/**
 * Kinds of data-integrity problems detected while grouping source records.
 * None of them abort a rebuild; the offending edge or record is left out of
 * grouping and the issue is reported.
 */
public enum IntegrityIssueType {
    /**
     * Cross-reference to a concept id that was never ingested.
     */
    DANGLING_XREF,

    /**
     * Cross-reference from a record to its own concept id.
     */
    SELF_XREF,

    /**
     * Record whose source is not in the ranked source set.
     */
    UNRANKED_SOURCE,

    /**
     * Record whose concept id prefix belongs to a different source than its declared one.
     */
    SOURCE_PREFIX_MISMATCH,

    /**
     * Concept id that occurs more than once (case-insensitively).
     */
    DUPLICATE_CONCEPT_ID,

    /**
     * Two or more records from the same source in one merge group.
     */
    SAME_SOURCE_CONFLICT
}
