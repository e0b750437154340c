package com.disease.normalization.merge;

import com.disease.normalization.core.model.SourcePriority;
import com.disease.normalization.core.model.SourceRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Immutable view of every source record loaded for one rebuild.
 * Records are held in {@link SourcePriority#RECORD_ORDER}, so anything derived
 * from a snapshot is independent of the order the store returned them in.
 */
public final class SourceRecordSnapshot {

    private final List<SourceRecord> records;

    private SourceRecordSnapshot(List<SourceRecord> records) {
        this.records = records;
    }

    public static SourceRecordSnapshot of(Collection<SourceRecord> records) {
        List<SourceRecord> sorted = new ArrayList<>(records);
        sorted.sort(SourcePriority.RECORD_ORDER);
        return new SourceRecordSnapshot(List.copyOf(sorted));
    }

    public List<SourceRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
