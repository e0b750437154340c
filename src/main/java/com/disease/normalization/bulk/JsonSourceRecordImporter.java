package com.disease.normalization.bulk;

import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.core.model.SourceRecord;
import com.disease.normalization.logging.LogContext;
import com.disease.normalization.store.ConceptStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON Lines importer for source records.
 *
 * <p>One record per line:</p>
 * <pre>
 * {"concept_id": "ncit:C2926", "source": "NCIt", "label": "Lung Non-Small Cell Carcinoma",
 *  "aliases": ["NSCLC"], "xrefs": ["DOID:3908"], "associated_with": ["umls:C0007131"],
 *  "oncologic_disease": true}
 * </pre>
 *
 * <p>{@code source} may be omitted when the concept id prefix identifies it.
 * A JSON array spread over lines with one object per line is accepted as well.
 * Bad lines are reported in the {@link ImportResult} and do not stop the import.
 * Imported records only become part of merge groups after the next rebuild.</p>
 */
public class JsonSourceRecordImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonSourceRecordImporter.class);
    private static final int PROGRESS_INTERVAL = 1_000;

    private final ConceptStore store;
    private final ObjectMapper objectMapper;

    public JsonSourceRecordImporter(ConceptStore store) {
        this.store = store;
        this.objectMapper = new ObjectMapper();
    }

    public ImportResult importRecords(InputStream input, ProgressCallback callback) {
        return importRecords(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    public ImportResult importRecords(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long totalRecords = 0;
        long imported = 0;

        try (LogContext logCtx = LogContext.forBulk(LogContext.generateCorrelationId(), "import");
             BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty() || line.equals("[") || line.equals("]") || line.equals(",")) {
                    continue;
                }
                if (line.endsWith(",")) {
                    line = line.substring(0, line.length() - 1);
                }
                totalRecords++;

                String conceptId = "";
                try {
                    JsonNode node = objectMapper.readTree(line);
                    conceptId = node.path("concept_id").asText("");
                    store.addSourceRecord(toSourceRecord(node));
                    imported++;
                } catch (JsonProcessingException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, conceptId,
                            "Malformed JSON: " + e.getOriginalMessage()));
                    log.warn("import.error line={} error=malformed-json", lineNumber);
                } catch (RuntimeException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, conceptId, e.getMessage()));
                    log.warn("import.error line={} conceptId={} error={}", lineNumber, conceptId, e.getMessage());
                }

                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Processed " + totalRecords + " records");
                }
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(totalRecords, imported, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    SourceRecord toSourceRecord(JsonNode node) {
        String conceptId = node.path("concept_id").asText("");
        if (conceptId.isBlank()) {
            throw new IllegalArgumentException("concept_id is required");
        }
        return SourceRecord.builder()
                .conceptId(conceptId)
                .sourceName(resolveSource(node, conceptId))
                .label(textOrNull(node, "label"))
                .aliases(strings(node, "aliases"))
                .xrefs(strings(node, "xrefs"))
                .associatedWith(strings(node, "associated_with"))
                .pediatricDisease(booleanOrNull(node, "pediatric_disease"))
                .oncologicDisease(booleanOrNull(node, "oncologic_disease"))
                .build();
    }

    private static SourceName resolveSource(JsonNode node, String conceptId) {
        String declared = textOrNull(node, "source");
        if (declared != null) {
            return SourceName.fromName(declared)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown source: " + declared));
        }
        Optional<SourceName> inferred = SourceName.fromConceptId(conceptId);
        return inferred.orElseThrow(() ->
                new IllegalArgumentException("Cannot determine source of " + conceptId));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Boolean booleanOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isBoolean()) {
            throw new IllegalArgumentException(field + " must be true, false or null");
        }
        return value.booleanValue();
    }

    private static List<String> strings(JsonNode node, String field) {
        JsonNode array = node.get(field);
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new IllegalArgumentException(field + " must be an array");
        }
        List<String> values = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (element.isNull()) {
                continue;
            }
            if (!element.isTextual()) {
                throw new IllegalArgumentException(field + " must hold only strings");
            }
            values.add(element.textValue());
        }
        return values;
    }
}
