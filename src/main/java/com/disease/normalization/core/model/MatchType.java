package com.disease.normalization.core.model;

/**
 * Tier at which a query matched a record.
 *
 * <p>Precedence is declaration order: a hit at an earlier tier always wins and
 * later tiers are not consulted. The score is informational only; ALIAS, XREF
 * and ASSOCIATED_WITH share a score but not a precedence.</p>
 */
public enum MatchType {
    CONCEPT_ID(100, LookupField.CONCEPT_ID),
    LABEL(80, LookupField.LABEL),
    ALIAS(60, LookupField.ALIAS),
    XREF(60, LookupField.XREF),
    ASSOCIATED_WITH(60, LookupField.ASSOCIATED_WITH),
    NO_MATCH(0, null);

    private final int score;
    private final LookupField lookupField;

    MatchType(int score, LookupField lookupField) {
        this.score = score;
        this.lookupField = lookupField;
    }

    public int getScore() {
        return score;
    }

    /**
     * The field searched for this tier, or null for NO_MATCH.
     */
    public LookupField getLookupField() {
        return lookupField;
    }

    public boolean isMatch() {
        return this != NO_MATCH;
    }

    /**
     * Returns true if this tier takes precedence over the other.
     */
    public boolean outranks(MatchType other) {
        return ordinal() < other.ordinal();
    }
}
