package com.disease.normalization.rest.dto;

import com.disease.normalization.api.NormalizationResult;
import com.disease.normalization.api.QueryWarning;
import com.disease.normalization.core.model.MatchType;
import com.disease.normalization.core.model.MergedRecord;
import com.disease.normalization.core.model.SourceMetadata;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.merge.DataIntegrityIssue;
import com.disease.normalization.merge.IntegrityIssueType;
import com.disease.normalization.merge.RebuildResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DtoTest {

    @Nested
    @DisplayName("ConceptMappingDto")
    class ConceptMappingTests {

        @Test
        @DisplayName("Mondo codes keep the full CURIE in upper case")
        void mondoCode() {
            ConceptMappingDto mapping = ConceptMappingDto.of("mondo:0005233", ConceptMappingDto.EXACT_MATCH).orElseThrow();
            assertEquals("MONDO:0005233", mapping.code());
            assertEquals("https://purl.obolibrary.org/obo/", mapping.system());
            assertEquals("exactMatch", mapping.relation());
        }

        @Test
        @DisplayName("DO codes keep the full CURIE as given")
        void doCode() {
            assertEquals("DOID:3908",
                    ConceptMappingDto.of("DOID:3908", ConceptMappingDto.EXACT_MATCH).orElseThrow().code());
        }

        @Test
        @DisplayName("Other namespaces use the local code")
        void localCode() {
            ConceptMappingDto ncit = ConceptMappingDto.of("ncit:C2926", ConceptMappingDto.EXACT_MATCH).orElseThrow();
            assertEquals("C2926", ncit.code());

            ConceptMappingDto umls = ConceptMappingDto.of("UMLS:C0007131", ConceptMappingDto.RELATED_MATCH).orElseThrow();
            assertEquals("C0007131", umls.code());
            assertEquals("relatedMatch", umls.relation());
        }

        @Test
        @DisplayName("Unknown or missing prefixes produce no mapping")
        void unknownPrefix() {
            assertTrue(ConceptMappingDto.of("snomed:1234", ConceptMappingDto.EXACT_MATCH).isEmpty());
            assertTrue(ConceptMappingDto.of("C2926", ConceptMappingDto.EXACT_MATCH).isEmpty());
            assertTrue(ConceptMappingDto.of(":C2926", ConceptMappingDto.EXACT_MATCH).isEmpty());
        }
    }

    @Nested
    @DisplayName("NormalizeResponse")
    class NormalizeResponseTests {

        @Test
        @DisplayName("Match carries concept fields and mappings in xref then associated order")
        void match() {
            MergedRecord record = MergedRecord.builder()
                    .conceptId("ncit:C2926")
                    .label("Lung Non-Small Cell Carcinoma")
                    .aliases(List.of("NSCLC"))
                    .xrefs(List.of("mondo:0005233", "foo:1"))
                    .associatedWith(List.of("umls:C0007131"))
                    .oncologicDisease(true)
                    .members(List.of("ncit:C2926", "mondo:0005233"))
                    .build();
            NormalizationResult result = new NormalizationResult(MatchType.ALIAS, record, "mondo:0005233", List.of());

            NormalizeResponse response = NormalizeResponse.from("nsclc", result);

            assertEquals("ALIAS", response.matchType());
            assertEquals(60, response.score());
            assertEquals("ncit:C2926", response.normalizedId());
            assertEquals("mondo:0005233", response.matchedConceptId());
            assertEquals(Boolean.TRUE, response.oncologicDisease());
            assertNull(response.pediatricDisease());
            assertEquals(List.of(
                    new ConceptMappingDto("MONDO:0005233", "https://purl.obolibrary.org/obo/", "exactMatch"),
                    new ConceptMappingDto("C0007131", "https://www.nlm.nih.gov/research/umls/index.html", "relatedMatch")
            ), response.mappings());
        }

        @Test
        @DisplayName("NO_MATCH leaves concept fields empty and keeps warnings")
        void noMatch() {
            NormalizeResponse response = NormalizeResponse.from("x y",
                    NormalizationResult.noMatch(List.of(QueryWarning.nonBreakingSpace())));

            assertEquals("NO_MATCH", response.matchType());
            assertEquals(0, response.score());
            assertNull(response.normalizedId());
            assertNull(response.label());
            assertTrue(response.aliases().isEmpty());
            assertTrue(response.mappings().isEmpty());
            assertTrue(response.sourceMeta().isEmpty());
            assertEquals("non_breaking_space_characters", response.warnings().get(0).type());
        }

        @Test
        @DisplayName("Source metadata is keyed by display name in result order")
        void sourceMeta() {
            MergedRecord record = MergedRecord.builder()
                    .conceptId("ncit:C2926")
                    .xrefs(List.of("mondo:0005233", "DOID:3908"))
                    .members(List.of("ncit:C2926", "mondo:0005233", "DOID:3908"))
                    .build();
            SourceMetadata ncit = new SourceMetadata("CC BY 4.0", "https://creativecommons.org/licenses/by/4.0/",
                    "24.01d", "https://evs.nci.nih.gov/ftp1/NCI_Thesaurus/", null, false, false, true);
            SourceMetadata doid = new SourceMetadata("CC0 1.0", "https://creativecommons.org/publicdomain/zero/1.0/",
                    "2023-12-19", "https://github.com/DiseaseOntology/HumanDiseaseOntology", null, false, false, false);
            Map<SourceName, SourceMetadata> metadata = new LinkedHashMap<>();
            metadata.put(SourceName.NCIT, ncit);
            metadata.put(SourceName.DO, doid);

            NormalizeResponse response = NormalizeResponse.from("nsclc",
                    new NormalizationResult(MatchType.ALIAS, record, "ncit:C2926", List.of(), metadata));

            assertEquals(List.of("NCIt", "DO"), List.copyOf(response.sourceMeta().keySet()));
            assertEquals(ncit, response.sourceMeta().get("NCIt"));
            assertEquals("2023-12-19", response.sourceMeta().get("DO").version());
        }
    }

    @Nested
    @DisplayName("RebuildResponse")
    class RebuildResponseTests {

        @Test
        @DisplayName("Counts issues per type")
        void issueCounts() {
            RebuildResult result = RebuildResult.success(10, 3, List.of(
                    new DataIntegrityIssue(IntegrityIssueType.DANGLING_XREF, "mondo:1", "DOID:9"),
                    new DataIntegrityIssue(IntegrityIssueType.DANGLING_XREF, "mondo:2", "DOID:8"),
                    new DataIntegrityIssue(IntegrityIssueType.SELF_XREF, "ncit:C1", "ncit:C1")
            ), Duration.ofMillis(250));

            RebuildResponse response = RebuildResponse.from(result);

            assertTrue(response.success());
            assertEquals(10, response.groupCount());
            assertEquals(3, response.mergedRecordCount());
            assertEquals(3, response.issueCount());
            assertEquals(Map.of("DANGLING_XREF", 2L, "SELF_XREF", 1L), response.issuesByType());
            assertEquals(250, response.durationMillis());
            assertNull(response.errorMessage());
        }

        @Test
        @DisplayName("Failure carries the error message")
        void failure() {
            RebuildResponse response = RebuildResponse.from(
                    RebuildResult.failure("graph unavailable", Duration.ZERO));

            assertFalse(response.success());
            assertEquals("graph unavailable", response.errorMessage());
            assertTrue(response.issuesByType().isEmpty());
        }
    }

    @Test
    @DisplayName("ErrorResponse factories set status and reason phrase")
    void errorResponses() {
        ErrorResponse conflict = ErrorResponse.conflict("busy", "/api/v1/disease/admin/rebuild");
        assertEquals(409, conflict.status());
        assertEquals("Conflict", conflict.error());
        assertNotNull(conflict.timestamp());

        assertEquals(400, ErrorResponse.badRequest("bad", "/x").status());
        assertEquals(500, ErrorResponse.internalError("oops", "/x").status());
    }
}
