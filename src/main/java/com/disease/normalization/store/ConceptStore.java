package com.disease.normalization.store;

import com.disease.normalization.core.model.LookupField;
import com.disease.normalization.core.model.MergedRecord;
import com.disease.normalization.core.model.SourceMetadata;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.core.model.SourceRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Storage for source records, merged records and source metadata.
 *
 * <p>All lookups by concept id or term are exact and case-insensitive. Reads
 * may run concurrently with each other and with
 * {@link #replaceMergedRecords(Collection)}; readers see either the previous or
 * the new merged set, never a mixture.</p>
 *
 * <p>Implementations signal infrastructure failures with {@link StoreReadException}
 * or {@link StoreWriteException}.</p>
 */
public interface ConceptStore {

    /**
     * Returns every stored source record, across all sources.
     */
    List<SourceRecord> loadAllSourceRecords();

    /**
     * Atomically replaces the whole merged-record set and resets every source
     * record's merge pointer from the members of the new records. Source records
     * not named as a member of any multi-member record lose their pointer.
     *
     * @throws StoreWriteException if the new set could not be committed; the
     *                             previous set remains visible
     */
    void replaceMergedRecords(Collection<MergedRecord> mergedRecords);

    /**
     * Returns the concept ids of source records whose {@code field} holds
     * {@code value}, compared case-insensitively. For {@link LookupField#CONCEPT_ID}
     * the result holds at most one id.
     */
    Set<String> lookup(LookupField field, String value);

    Optional<SourceRecord> getSourceRecord(String conceptId);

    Optional<MergedRecord> getMergedRecord(String conceptId);

    /**
     * Returns the merged record of the group a source record belongs to in the
     * visible merged set. The membership and the merged record are read from the
     * same committed rebuild. Empty if the record is a singleton or unknown.
     */
    Optional<MergedRecord> getMergedRecordForMember(String conceptId);

    List<MergedRecord> getAllMergedRecords();

    /**
     * Adds or replaces a source record. Any merge pointer on the given record is
     * ignored; pointers are only set by {@link #replaceMergedRecords(Collection)}.
     */
    void addSourceRecord(SourceRecord record);

    /**
     * Deletes every record of the given source along with its metadata.
     *
     * @return number of records removed
     */
    int deleteSource(SourceName source);

    void addSourceMetadata(SourceName source, SourceMetadata metadata);

    Optional<SourceMetadata> getSourceMetadata(SourceName source);

    Map<SourceName, SourceMetadata> getAllSourceMetadata();

    /**
     * Returns true if the backing schema (indexes, version pointer) exists.
     */
    boolean isInitialized();

    /**
     * Returns true if at least one source record and one merged record are stored.
     */
    boolean isPopulated();
}
