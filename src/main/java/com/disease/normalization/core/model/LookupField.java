package com.disease.normalization.core.model;

/**
 * Record fields that can be used as exact, case-insensitive lookup targets.
 */
public enum LookupField {
    CONCEPT_ID("concept_id"),
    LABEL("label"),
    ALIAS("alias"),
    XREF("xref"),
    ASSOCIATED_WITH("associated_with");

    private final String key;

    LookupField(String key) {
        this.key = key;
    }

    /**
     * Storage key for this field.
     */
    public String getKey() {
        return key;
    }

    public static LookupField fromKey(String key) {
        for (LookupField field : values()) {
            if (field.key.equals(key)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown lookup field: " + key);
    }
}
