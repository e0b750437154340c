package com.disease.normalization.store;

import com.disease.normalization.core.model.LookupField;
import com.disease.normalization.core.model.MergedRecord;
import com.disease.normalization.core.model.SourceMetadata;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.core.model.SourceRecord;
import com.disease.normalization.graph.CypherExecutor;
import com.disease.normalization.graph.GraphConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * FalkorDB-backed {@link ConceptStore}.
 *
 * <p>Source records are {@code :SourceConcept} nodes; every lookup value is a
 * {@code :Term} node with an indexed lower-cased value. List properties are
 * stored as JSON strings.</p>
 *
 * <p>Merged records are written under a new version number next to the visible
 * set, then a single {@code :MergeVersion} pointer node is flipped to that
 * version. Readers always filter merged nodes and membership edges by the
 * pointer, so they observe the old set or the new one. Nodes of superseded
 * versions are deleted after the flip.</p>
 */
public class GraphConceptStore implements ConceptStore {
    private static final Logger log = LoggerFactory.getLogger(GraphConceptStore.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final CypherExecutor executor;
    private final ObjectMapper objectMapper;

    public GraphConceptStore(GraphConnection connection) {
        this(new CypherExecutor(connection), true);
    }

    public GraphConceptStore(CypherExecutor executor, boolean initializeSchema) {
        this.executor = executor;
        this.objectMapper = new ObjectMapper();
        if (initializeSchema) {
            try {
                executor.initializeSchema();
            } catch (RuntimeException e) {
                throw new StoreWriteException("Failed to initialize graph schema: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public List<SourceRecord> loadAllSourceRecords() {
        try {
            return executor.findAllSourceConcepts().stream()
                    .map(this::mapToSourceRecord)
                    .toList();
        } catch (RuntimeException e) {
            throw new StoreReadException("Failed to load source records: " + e.getMessage(), e);
        }
    }

    @Override
    public void replaceMergedRecords(Collection<MergedRecord> mergedRecords) {
        long current;
        try {
            current = executor.currentMergeVersion();
        } catch (RuntimeException e) {
            throw new StoreReadException("Failed to read merge version: " + e.getMessage(), e);
        }
        long next = current + 1;

        try {
            // Leftovers of an earlier failed attempt
            executor.deleteMergedConceptsExceptVersion(current);
            for (MergedRecord record : mergedRecords) {
                List<String> membersLower = record.isMultiMember()
                        ? record.members().stream().map(m -> m.toLowerCase(Locale.ROOT)).toList()
                        : List.of();
                executor.createMergedConcept(mergedProperties(record), membersLower, next);
            }
        } catch (RuntimeException e) {
            discardVersion(next);
            throw new StoreWriteException("Failed to write merged records: " + e.getMessage(), e);
        }

        try {
            executor.setMergeVersion(next);
        } catch (RuntimeException e) {
            discardVersion(next);
            throw new StoreWriteException("Failed to publish merge version " + next + ": " + e.getMessage(), e);
        }
        log.info("store.merged.replaced version={} mergedRecords={}", next, mergedRecords.size());

        try {
            executor.deleteMergedConceptsOfVersion(current);
        } catch (RuntimeException e) {
            log.warn("store.merged.cleanup.failed version={} error={}", current, e.getMessage());
        }
    }

    private void discardVersion(long version) {
        try {
            executor.deleteMergedConceptsOfVersion(version);
        } catch (RuntimeException e) {
            log.warn("store.merged.discard.failed version={} error={}", version, e.getMessage());
        }
    }

    @Override
    public Set<String> lookup(LookupField field, String value) {
        if (value == null) {
            return Set.of();
        }
        String valueLower = value.toLowerCase(Locale.ROOT);
        try {
            List<Map<String, Object>> rows = field == LookupField.CONCEPT_ID
                    ? executor.findConceptIdsByConceptId(valueLower)
                    : executor.findConceptIdsByTerm(field.getKey(), valueLower);
            Set<String> ids = new LinkedHashSet<>();
            for (Map<String, Object> row : rows) {
                ids.add((String) row.get("conceptId"));
            }
            return ids;
        } catch (RuntimeException e) {
            throw new StoreReadException("Lookup failed for " + field.getKey() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<SourceRecord> getSourceRecord(String conceptId) {
        if (conceptId == null) {
            return Optional.empty();
        }
        try {
            List<Map<String, Object>> rows = executor.findSourceConcept(conceptId.toLowerCase(Locale.ROOT));
            return rows.isEmpty() ? Optional.empty() : Optional.of(mapToSourceRecord(rows.get(0)));
        } catch (RuntimeException e) {
            throw new StoreReadException("Failed to read source record " + conceptId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<MergedRecord> getMergedRecord(String conceptId) {
        if (conceptId == null) {
            return Optional.empty();
        }
        try {
            List<Map<String, Object>> rows = executor.findMergedConcept(conceptId.toLowerCase(Locale.ROOT));
            return rows.isEmpty() ? Optional.empty() : Optional.of(mapToMergedRecord(rows.get(0)));
        } catch (RuntimeException e) {
            throw new StoreReadException("Failed to read merged record " + conceptId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<MergedRecord> getMergedRecordForMember(String conceptId) {
        if (conceptId == null) {
            return Optional.empty();
        }
        try {
            List<Map<String, Object>> rows = executor.findMergedConceptOfMember(conceptId.toLowerCase(Locale.ROOT));
            return rows.isEmpty() ? Optional.empty() : Optional.of(mapToMergedRecord(rows.get(0)));
        } catch (RuntimeException e) {
            throw new StoreReadException("Failed to read merged record of " + conceptId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<MergedRecord> getAllMergedRecords() {
        try {
            return executor.findAllMergedConcepts().stream()
                    .map(this::mapToMergedRecord)
                    .toList();
        } catch (RuntimeException e) {
            throw new StoreReadException("Failed to load merged records: " + e.getMessage(), e);
        }
    }

    @Override
    public void addSourceRecord(SourceRecord record) {
        String conceptIdLower = record.getConceptIdKey();
        Map<String, Object> properties = new HashMap<>();
        properties.put("conceptIdLower", conceptIdLower);
        properties.put("conceptId", record.getConceptId());
        properties.put("sourceName", record.hasRankedSource() ? record.getSourceName().getDisplayName() : null);
        properties.put("label", record.getLabel());
        properties.put("aliases", toJson(record.getAliases()));
        properties.put("xrefs", toJson(record.getXrefs()));
        properties.put("associatedWith", toJson(record.getAssociatedWith()));
        properties.put("pediatricDisease", record.getPediatricDisease());
        properties.put("oncologicDisease", record.getOncologicDisease());
        try {
            Optional<String> previousSource = executor.upsertSourceConcept(properties);
            if (previousSource.isPresent() && !previousSource.get().equals(properties.get("sourceName"))) {
                log.warn("store.record.replaced conceptId={} previousSource={} newSource={}",
                        record.getConceptId(), previousSource.get(), properties.get("sourceName"));
            }
            executor.deleteTerms(conceptIdLower);
            if (record.hasLabel()) {
                executor.createTerms(conceptIdLower, LookupField.LABEL.getKey(), lower(List.of(record.getLabel())));
            }
            executor.createTerms(conceptIdLower, LookupField.ALIAS.getKey(), lower(record.getAliases()));
            executor.createTerms(conceptIdLower, LookupField.XREF.getKey(), lower(record.getXrefs()));
            executor.createTerms(conceptIdLower, LookupField.ASSOCIATED_WITH.getKey(),
                    lower(record.getAssociatedWith()));
        } catch (RuntimeException e) {
            throw new StoreWriteException("Failed to write source record " + record.getConceptId()
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int deleteSource(SourceName source) {
        String sourceName = source.getDisplayName();
        try {
            int count = (int) executor.countSourceConcepts(sourceName);
            executor.deleteSourceConcepts(sourceName);
            executor.deleteSourceMetadata(sourceName);
            log.info("store.source.deleted source={} records={}", sourceName, count);
            return count;
        } catch (RuntimeException e) {
            throw new StoreWriteException("Failed to delete source " + sourceName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void addSourceMetadata(SourceName source, SourceMetadata metadata) {
        Map<String, Object> properties = new HashMap<>();
        properties.put("sourceName", source.getDisplayName());
        properties.put("dataLicense", metadata.dataLicense());
        properties.put("dataLicenseUrl", metadata.dataLicenseUrl());
        properties.put("version", metadata.version());
        properties.put("dataUrl", metadata.dataUrl());
        properties.put("rdpUrl", metadata.rdpUrl());
        properties.put("nonCommercial", metadata.nonCommercial());
        properties.put("shareAlike", metadata.shareAlike());
        properties.put("attribution", metadata.attribution());
        try {
            executor.upsertSourceMetadata(properties);
        } catch (RuntimeException e) {
            throw new StoreWriteException("Failed to write metadata for " + source.getDisplayName()
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<SourceMetadata> getSourceMetadata(SourceName source) {
        try {
            List<Map<String, Object>> rows = executor.findSourceMetadata(source.getDisplayName());
            return rows.isEmpty() ? Optional.empty() : Optional.of(mapToMetadata(rows.get(0)));
        } catch (RuntimeException e) {
            throw new StoreReadException("Failed to read metadata for " + source.getDisplayName()
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Map<SourceName, SourceMetadata> getAllSourceMetadata() {
        Map<SourceName, SourceMetadata> result = new EnumMap<>(SourceName.class);
        try {
            for (Map<String, Object> row : executor.findAllSourceMetadata()) {
                SourceName.fromName((String) row.get("sourceName"))
                        .ifPresent(source -> result.put(source, mapToMetadata(row)));
            }
        } catch (RuntimeException e) {
            throw new StoreReadException("Failed to read source metadata: " + e.getMessage(), e);
        }
        return result;
    }

    @Override
    public boolean isInitialized() {
        try {
            return executor.mergeVersionExists();
        } catch (RuntimeException e) {
            log.warn("store.check.failed check=initialized error={}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isPopulated() {
        try {
            return executor.countAllSourceConcepts() > 0 && executor.countCurrentMergedConcepts() > 0;
        } catch (RuntimeException e) {
            log.warn("store.check.failed check=populated error={}", e.getMessage());
            return false;
        }
    }

    private Map<String, Object> mergedProperties(MergedRecord record) {
        Map<String, Object> properties = new HashMap<>();
        properties.put("conceptId", record.conceptId());
        properties.put("conceptIdLower", record.conceptIdKey());
        properties.put("label", record.label());
        properties.put("aliases", toJson(record.aliases()));
        properties.put("xrefs", toJson(record.xrefs()));
        properties.put("associatedWith", toJson(record.associatedWith()));
        properties.put("pediatricDisease", record.pediatricDisease());
        properties.put("oncologicDisease", record.oncologicDisease());
        properties.put("members", toJson(record.members()));
        return properties;
    }

    private SourceRecord mapToSourceRecord(Map<String, Object> row) {
        String conceptId = (String) row.get("conceptId");
        String sourceName = (String) row.get("sourceName");
        SourceName source = SourceName.fromName(sourceName).orElse(null);
        if (source == null) {
            log.warn("store.source.unrecognized conceptId={} sourceName={}", conceptId, sourceName);
        }
        return SourceRecord.builder()
                .conceptId(conceptId)
                .sourceName(source)
                .label((String) row.get("label"))
                .aliases(fromJson(row.get("aliases")))
                .xrefs(fromJson(row.get("xrefs")))
                .associatedWith(fromJson(row.get("associatedWith")))
                .pediatricDisease((Boolean) row.get("pediatricDisease"))
                .oncologicDisease((Boolean) row.get("oncologicDisease"))
                .mergeRef((String) row.get("mergeRef"))
                .build();
    }

    private MergedRecord mapToMergedRecord(Map<String, Object> row) {
        return MergedRecord.builder()
                .conceptId((String) row.get("conceptId"))
                .label((String) row.get("label"))
                .aliases(fromJson(row.get("aliases")))
                .xrefs(fromJson(row.get("xrefs")))
                .associatedWith(fromJson(row.get("associatedWith")))
                .pediatricDisease((Boolean) row.get("pediatricDisease"))
                .oncologicDisease((Boolean) row.get("oncologicDisease"))
                .members(fromJson(row.get("members")))
                .build();
    }

    private static SourceMetadata mapToMetadata(Map<String, Object> row) {
        return new SourceMetadata(
                (String) row.get("dataLicense"),
                (String) row.get("dataLicenseUrl"),
                (String) row.get("version"),
                (String) row.get("dataUrl"),
                (String) row.get("rdpUrl"),
                Boolean.TRUE.equals(row.get("nonCommercial")),
                Boolean.TRUE.equals(row.get("shareAlike")),
                Boolean.TRUE.equals(row.get("attribution")));
    }

    private static List<String> lower(List<String> values) {
        return values.stream()
                .map(v -> v.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new StoreWriteException("Failed to serialize list property: " + e.getMessage(), e);
        }
    }

    private List<String> fromJson(Object json) {
        if (json == null || ((String) json).isEmpty()) {
            return List.of();
        }
        try {
            return objectMapper.readValue((String) json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new StoreReadException("Corrupt list property: " + e.getMessage(), e);
        }
    }
}
