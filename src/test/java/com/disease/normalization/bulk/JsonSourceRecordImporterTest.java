package com.disease.normalization.bulk;

import com.disease.normalization.core.model.LookupField;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.core.model.SourceRecord;
import com.disease.normalization.store.ConceptStore;
import com.disease.normalization.store.InMemoryConceptStore;
import com.disease.normalization.store.StoreWriteException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@DisplayName("JsonSourceRecordImporter Tests")
class JsonSourceRecordImporterTest {

    private InMemoryConceptStore store;
    private JsonSourceRecordImporter importer;

    @BeforeEach
    void setUp() {
        store = new InMemoryConceptStore();
        importer = new JsonSourceRecordImporter(store);
    }

    @Test
    @DisplayName("Imports every field of a valid record")
    void importsFullRecord() {
        String json = """
                {"concept_id": "ncit:C2926", "source": "NCIt", "label": "Lung Non-Small Cell Carcinoma", "aliases": ["NSCLC"], "xrefs": ["DOID:3908"], "associated_with": ["umls:C0007131"], "oncologic_disease": true}
                """;

        ImportResult result = importer.importRecords(new StringReader(json), null);

        assertEquals(1, result.totalRecords());
        assertEquals(1, result.recordsImported());
        assertFalse(result.hasErrors());

        SourceRecord record = store.getSourceRecord("ncit:C2926").orElseThrow();
        assertEquals(SourceName.NCIT, record.getSourceName());
        assertEquals("Lung Non-Small Cell Carcinoma", record.getLabel());
        assertEquals(List.of("NSCLC"), record.getAliases());
        assertEquals(List.of("DOID:3908"), record.getXrefs());
        assertEquals(List.of("umls:C0007131"), record.getAssociatedWith());
        assertEquals(Boolean.TRUE, record.getOncologicDisease());
        assertNull(record.getPediatricDisease());
        assertEquals(Set.of("ncit:C2926"), store.lookup(LookupField.ALIAS, "nsclc"));
    }

    @Test
    @DisplayName("Infers the source from the concept id prefix")
    void infersSource() {
        String json = "{\"concept_id\": \"DOID:3908\", \"label\": \"lung non-small cell carcinoma\"}";

        ImportResult result = importer.importRecords(
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), null);

        assertEquals(1, result.recordsImported());
        assertEquals(SourceName.DO, store.getSourceRecord("DOID:3908").orElseThrow().getSourceName());
    }

    @Test
    @DisplayName("Bad lines are reported without stopping the import")
    void badLinesReported() {
        String json = String.join("\n",
                "{\"concept_id\": \"ncit:C1\", \"label\": \"one\"}",
                "{not json",
                "{\"concept_id\": \"x:1\", \"source\": \"UMLS\"}",
                "{\"concept_id\": \"foo:2\"}",
                "{\"concept_id\": \"mondo:3\", \"pediatric_disease\": \"yes\"}",
                "{\"concept_id\": \"mondo:4\", \"aliases\": \"single\"}",
                "{\"label\": \"no id\"}",
                "{\"concept_id\": \"mondo:5\", \"label\": \"five\"}");

        ImportResult result = importer.importRecords(new StringReader(json), null);

        assertEquals(8, result.totalRecords());
        assertEquals(2, result.recordsImported());
        assertEquals(6, result.errorCount());

        List<ImportResult.ImportError> errors = result.errors();
        assertEquals(2, errors.get(0).lineNumber());
        assertTrue(errors.get(0).message().startsWith("Malformed JSON"));
        assertEquals("Unknown source: UMLS", errors.get(1).message());
        assertEquals("x:1", errors.get(1).conceptId());
        assertEquals("Cannot determine source of foo:2", errors.get(2).message());
        assertEquals("pediatric_disease must be true, false or null", errors.get(3).message());
        assertEquals("aliases must be an array", errors.get(4).message());
        assertEquals("concept_id is required", errors.get(5).message());
        assertTrue(store.getSourceRecord("mondo:5").isPresent());
    }

    @Test
    @DisplayName("Null list elements are dropped rather than stored as text")
    void nullElementsSkipped() {
        String json = "{\"concept_id\": \"mondo:0005233\", \"aliases\": [null, \"NSCLC\"], \"xrefs\": [null]}";

        ImportResult result = importer.importRecords(new StringReader(json), null);

        assertFalse(result.hasErrors());
        SourceRecord record = store.getSourceRecord("mondo:0005233").orElseThrow();
        assertEquals(List.of("NSCLC"), record.getAliases());
        assertTrue(record.getXrefs().isEmpty());
        assertTrue(store.lookup(LookupField.ALIAS, "null").isEmpty());
    }

    @Test
    @DisplayName("Non-string list elements are reported as line errors")
    void nonStringElementsReported() {
        String json = String.join("\n",
                "{\"concept_id\": \"mondo:1\", \"xrefs\": [\"DOID:1\", 42]}",
                "{\"concept_id\": \"mondo:2\", \"associated_with\": [{\"id\": \"umls:C1\"}]}");

        ImportResult result = importer.importRecords(new StringReader(json), null);

        assertEquals(0, result.recordsImported());
        assertEquals("xrefs must hold only strings", result.errors().get(0).message());
        assertEquals("mondo:1", result.errors().get(0).conceptId());
        assertEquals("associated_with must hold only strings", result.errors().get(1).message());
        assertTrue(store.getSourceRecord("mondo:1").isEmpty());
    }

    @Test
    @DisplayName("Accepts a JSON array with one object per line")
    void arrayFormat() {
        String json = """
                [
                  {"concept_id": "mondo:0005233", "label": "non-small cell lung carcinoma"},
                  {"concept_id": "oncotree:NSCLC", "label": "Non-Small Cell Lung Cancer"}
                ]
                """;

        ImportResult result = importer.importRecords(new StringReader(json), null);

        assertEquals(2, result.recordsImported());
        assertEquals(SourceName.ONCOTREE, store.getSourceRecord("oncotree:NSCLC").orElseThrow().getSourceName());
    }

    @Test
    @DisplayName("Reports completion through the progress callback")
    void progressCallback() {
        List<String> messages = new ArrayList<>();

        importer.importRecords(new StringReader("{\"concept_id\": \"ncit:C1\"}"),
                (processed, total, message) -> messages.add(processed + "/" + total + " " + message));

        assertEquals(List.of("1/1 Import completed"), messages);
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("With a failing store")
    class FailingStoreTests {

        @Mock
        private ConceptStore failingStore;

        @Test
        @DisplayName("Store write failures are reported per line")
        void storeFailureReported() {
            lenient().doThrow(new StoreWriteException("graph unavailable"))
                    .when(failingStore).addSourceRecord(argThat(r -> r.getConceptId().equals("ncit:C2")));
            String json = String.join("\n",
                    "{\"concept_id\": \"ncit:C1\"}",
                    "{\"concept_id\": \"ncit:C2\"}");

            ImportResult result = new JsonSourceRecordImporter(failingStore).importRecords(new StringReader(json), null);

            assertEquals(1, result.recordsImported());
            assertEquals(1, result.errorCount());
            assertEquals("ncit:C2", result.errors().get(0).conceptId());
            assertEquals("graph unavailable", result.errors().get(0).message());
            verify(failingStore, times(2)).addSourceRecord(any());
        }
    }
}
