package com.disease.normalization.bulk;

import com.disease.normalization.core.model.MergeGroup;
import com.disease.normalization.core.model.MergedRecord;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.core.model.SourceRecord;
import com.disease.normalization.logging.LogContext;
import com.disease.normalization.merge.RecordMerger;
import com.disease.normalization.store.ConceptStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes term mappings as JSON Lines, one concept per line:
 *
 * <pre>
 * {"concept_id":"ncit:C2926","label":"Lung Non-Small Cell Carcinoma","aliases":["NSCLC"],"xrefs":["DOID:3908","mondo:0005233"]}
 * </pre>
 *
 * <p>{@code xrefs} holds a concept's cross-references followed by its
 * associated_with references. Lines are ordered by case-folded concept id.</p>
 */
public class TermMappingExporter {
    private static final Logger log = LoggerFactory.getLogger(TermMappingExporter.class);

    private final ConceptStore store;
    private final RecordMerger recordMerger;
    private final ObjectMapper objectMapper;

    public TermMappingExporter(ConceptStore store) {
        this.store = store;
        this.recordMerger = new RecordMerger();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Exports every normalized concept: the committed merged records plus every
     * source record that belongs to no merge group.
     */
    public ExportResult exportNormalized(OutputStream output, ProgressCallback callback) {
        return exportNormalized(new OutputStreamWriter(output, StandardCharsets.UTF_8), callback);
    }

    public ExportResult exportNormalized(Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<MergedRecord> merged = store.getAllMergedRecords();
        List<MergedRecord> singletons = new ArrayList<>();
        for (SourceRecord record : store.loadAllSourceRecords()) {
            if (record.getMergeRef().isEmpty()) {
                singletons.add(recordMerger.merge(MergeGroup.singleton(record.getConceptId()), List.of(record)));
            }
        }

        List<MergedRecord> all = new ArrayList<>(merged);
        all.addAll(singletons);
        all.sort(Comparator.comparing(MergedRecord::conceptIdKey));

        try (LogContext logCtx = LogContext.forBulk(LogContext.generateCorrelationId(), "export")) {
            writeLines(writer, all, cb);
        }
        ExportResult result = new ExportResult(all.size(), merged.size(), singletons.size());
        cb.onProgress(all.size(), all.size(), "Export completed");
        log.info("export.completed scope=normalized result={}", result);
        return result;
    }

    /**
     * Exports the records of one source as ingested, ignoring merge groups.
     */
    public ExportResult exportSource(SourceName source, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<MergedRecord> records = new ArrayList<>();
        for (SourceRecord record : store.loadAllSourceRecords()) {
            if (record.getSourceName() == source) {
                records.add(MergedRecord.builder()
                        .conceptId(record.getConceptId())
                        .label(record.getLabel())
                        .aliases(record.getAliases())
                        .xrefs(record.getXrefs())
                        .associatedWith(record.getAssociatedWith())
                        .build());
            }
        }
        records.sort(Comparator.comparing(MergedRecord::conceptIdKey));

        try (LogContext logCtx = LogContext.forBulk(LogContext.generateCorrelationId(), "export")
                .with("source", source.getDisplayName())) {
            writeLines(writer, records, cb);
        }
        ExportResult result = new ExportResult(records.size(), 0, records.size());
        cb.onProgress(records.size(), records.size(), "Export completed");
        log.info("export.completed scope={} result={}", source.getDisplayName(), result);
        return result;
    }

    private void writeLines(Writer writer, List<MergedRecord> records, ProgressCallback cb) {
        BufferedWriter out = writer instanceof BufferedWriter b ? b : new BufferedWriter(writer);
        long written = 0;
        try {
            for (MergedRecord record : records) {
                out.write(objectMapper.writeValueAsString(toMapping(record)));
                out.newLine();
                written++;
                if (written % 1_000 == 0) {
                    cb.onProgress(written, records.size(), "Exported " + written + " concepts");
                }
            }
            out.flush();
        } catch (IOException e) {
            log.error("export.failed written={} error={}", written, e.getMessage());
            throw new UncheckedIOException("Term mapping export failed after " + written + " lines", e);
        }
    }

    private static Map<String, Object> toMapping(MergedRecord record) {
        List<String> xrefs = new ArrayList<>(record.xrefs());
        xrefs.addAll(record.associatedWith());
        Map<String, Object> mapping = new LinkedHashMap<>();
        mapping.put("concept_id", record.conceptId());
        mapping.put("label", record.label());
        mapping.put("aliases", record.aliases());
        mapping.put("xrefs", xrefs);
        return mapping;
    }
}
