package com.disease.normalization.store;

import com.disease.normalization.core.model.LookupField;
import com.disease.normalization.core.model.MergedRecord;
import com.disease.normalization.core.model.SourceMetadata;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Heap-backed {@link ConceptStore}.
 *
 * <p>Source records live in concurrent maps with one case-folded hash index per
 * {@link LookupField}. The merged set and the merge pointers derived from it
 * form a single immutable {@link MergeState} published through an
 * {@link AtomicReference}, so a reader sees one committed rebuild or the next,
 * never a mixture.</p>
 */
public class InMemoryConceptStore implements ConceptStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryConceptStore.class);

    private final Map<String, SourceRecord> sourceRecords = new ConcurrentHashMap<>();
    private final Map<LookupField, Map<String, Set<String>>> indexes = new EnumMap<>(LookupField.class);
    private final Map<SourceName, SourceMetadata> metadata = new ConcurrentHashMap<>();
    private final AtomicReference<MergeState> mergeState = new AtomicReference<>(MergeState.EMPTY);
    private final Object writeLock = new Object();

    public InMemoryConceptStore() {
        for (LookupField field : LookupField.values()) {
            indexes.put(field, new ConcurrentHashMap<>());
        }
    }

    @Override
    public List<SourceRecord> loadAllSourceRecords() {
        MergeState state = mergeState.get();
        List<SourceRecord> records = new ArrayList<>(sourceRecords.size());
        for (SourceRecord record : sourceRecords.values()) {
            records.add(withPointer(record, state));
        }
        return records;
    }

    @Override
    public void replaceMergedRecords(Collection<MergedRecord> mergedRecords) {
        Map<String, MergedRecord> merged = new HashMap<>();
        Map<String, String> pointers = new HashMap<>();
        for (MergedRecord record : mergedRecords) {
            merged.put(record.conceptIdKey(), record);
            if (record.isMultiMember()) {
                for (String member : record.members()) {
                    pointers.put(member.toLowerCase(Locale.ROOT), record.conceptId());
                }
            }
        }
        mergeState.set(new MergeState(Map.copyOf(merged), Map.copyOf(pointers)));
        log.debug("store.merged.replaced mergedRecords={} pointers={}", merged.size(), pointers.size());
    }

    @Override
    public Set<String> lookup(LookupField field, String value) {
        if (value == null) {
            return Set.of();
        }
        Set<String> ids = indexes.get(field).get(value.toLowerCase(Locale.ROOT));
        return ids != null ? Set.copyOf(ids) : Set.of();
    }

    @Override
    public Optional<SourceRecord> getSourceRecord(String conceptId) {
        if (conceptId == null) {
            return Optional.empty();
        }
        SourceRecord record = sourceRecords.get(conceptId.toLowerCase(Locale.ROOT));
        return Optional.ofNullable(record).map(r -> withPointer(r, mergeState.get()));
    }

    @Override
    public Optional<MergedRecord> getMergedRecord(String conceptId) {
        if (conceptId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mergeState.get().merged().get(conceptId.toLowerCase(Locale.ROOT)));
    }

    @Override
    public Optional<MergedRecord> getMergedRecordForMember(String conceptId) {
        if (conceptId == null) {
            return Optional.empty();
        }
        MergeState state = mergeState.get();
        String mergeRef = state.pointers().get(conceptId.toLowerCase(Locale.ROOT));
        if (mergeRef == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(state.merged().get(mergeRef.toLowerCase(Locale.ROOT)));
    }

    @Override
    public List<MergedRecord> getAllMergedRecords() {
        List<MergedRecord> all = new ArrayList<>(mergeState.get().merged().values());
        all.sort(Comparator.comparing(MergedRecord::conceptIdKey));
        return all;
    }

    @Override
    public void addSourceRecord(SourceRecord record) {
        SourceRecord stored = record.withMergeRef(null);
        synchronized (writeLock) {
            SourceRecord previous = sourceRecords.put(stored.getConceptIdKey(), stored);
            if (previous != null) {
                if (previous.getSourceName() != stored.getSourceName()) {
                    log.warn("store.record.replaced conceptId={} previousSource={} newSource={}",
                            stored.getConceptId(), previous.getSourceName(), stored.getSourceName());
                }
                unindex(previous);
            }
            index(stored);
        }
    }

    @Override
    public int deleteSource(SourceName source) {
        int removed = 0;
        synchronized (writeLock) {
            for (SourceRecord record : List.copyOf(sourceRecords.values())) {
                if (record.getSourceName() == source) {
                    sourceRecords.remove(record.getConceptIdKey());
                    unindex(record);
                    removed++;
                }
            }
            metadata.remove(source);
        }
        log.info("store.source.deleted source={} records={}", source.getDisplayName(), removed);
        return removed;
    }

    @Override
    public void addSourceMetadata(SourceName source, SourceMetadata sourceMetadata) {
        metadata.put(source, sourceMetadata);
    }

    @Override
    public Optional<SourceMetadata> getSourceMetadata(SourceName source) {
        return Optional.ofNullable(metadata.get(source));
    }

    @Override
    public Map<SourceName, SourceMetadata> getAllSourceMetadata() {
        Map<SourceName, SourceMetadata> copy = new EnumMap<>(SourceName.class);
        copy.putAll(metadata);
        return copy;
    }

    @Override
    public boolean isInitialized() {
        return true;
    }

    @Override
    public boolean isPopulated() {
        return !sourceRecords.isEmpty() && !mergeState.get().merged().isEmpty();
    }

    private void index(SourceRecord record) {
        String id = record.getConceptId();
        addToIndex(LookupField.CONCEPT_ID, id, id);
        if (record.hasLabel()) {
            addToIndex(LookupField.LABEL, record.getLabel(), id);
        }
        record.getAliases().forEach(v -> addToIndex(LookupField.ALIAS, v, id));
        record.getXrefs().forEach(v -> addToIndex(LookupField.XREF, v, id));
        record.getAssociatedWith().forEach(v -> addToIndex(LookupField.ASSOCIATED_WITH, v, id));
    }

    private void unindex(SourceRecord record) {
        String id = record.getConceptId();
        removeFromIndex(LookupField.CONCEPT_ID, id, id);
        if (record.hasLabel()) {
            removeFromIndex(LookupField.LABEL, record.getLabel(), id);
        }
        record.getAliases().forEach(v -> removeFromIndex(LookupField.ALIAS, v, id));
        record.getXrefs().forEach(v -> removeFromIndex(LookupField.XREF, v, id));
        record.getAssociatedWith().forEach(v -> removeFromIndex(LookupField.ASSOCIATED_WITH, v, id));
    }

    private void addToIndex(LookupField field, String value, String conceptId) {
        indexes.get(field)
                .computeIfAbsent(value.toLowerCase(Locale.ROOT), k -> ConcurrentHashMap.newKeySet())
                .add(conceptId);
    }

    private void removeFromIndex(LookupField field, String value, String conceptId) {
        indexes.get(field).computeIfPresent(value.toLowerCase(Locale.ROOT), (k, ids) -> {
            ids.remove(conceptId);
            return ids.isEmpty() ? null : ids;
        });
    }

    private static SourceRecord withPointer(SourceRecord record, MergeState state) {
        String mergeRef = state.pointers().get(record.getConceptIdKey());
        return mergeRef != null ? record.withMergeRef(mergeRef) : record;
    }

    /**
     * One committed merged set together with the member-to-merge_ref pointers it implies.
     */
    private record MergeState(Map<String, MergedRecord> merged, Map<String, String> pointers) {
        static final MergeState EMPTY = new MergeState(Map.of(), Map.of());
    }
}
