package com.disease.normalization.core.model;

import java.util.Comparator;

/**
 * Fixed total order over source records: source priority first, then the
 * case-folded concept id, then the raw concept id. Records from an
 * unrecognized source sort after every ranked source.
 */
public final class SourcePriority {

    public static final int UNRANKED = Integer.MAX_VALUE;

    public static final Comparator<SourceRecord> RECORD_ORDER = Comparator
            .comparingInt(SourcePriority::rank)
            .thenComparing(SourceRecord::getConceptIdKey)
            .thenComparing(SourceRecord::getConceptId);

    private SourcePriority() {
    }

    public static int rank(SourceRecord record) {
        return record.hasRankedSource() ? record.getSourceName().priority() : UNRANKED;
    }
}
