package com.disease.normalization.merge;

import com.disease.normalization.DiseaseFixtures;
import com.disease.normalization.core.model.MergeGroup;
import com.disease.normalization.core.model.MergedRecord;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.core.model.SourceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.disease.normalization.DiseaseFixtures.DO_NSCLC;
import static com.disease.normalization.DiseaseFixtures.MONDO_NSCLC;
import static com.disease.normalization.DiseaseFixtures.NCIT_NSCLC;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordMerger Tests")
class RecordMergerTest {

    private static final MergeGroup NSCLC_GROUP =
            new MergeGroup(NCIT_NSCLC, List.of(NCIT_NSCLC, MONDO_NSCLC, DO_NSCLC));

    private final RecordMerger merger = new RecordMerger();

    @Nested
    @DisplayName("NSCLC group")
    class NsclcGroup {

        private final MergedRecord merged = merger.merge(NSCLC_GROUP, DiseaseFixtures.nsclcGroup());

        @Test
        @DisplayName("Uses the merge_ref as concept id and the NCIt label")
        void conceptIdAndLabel() {
            assertEquals(NCIT_NSCLC, merged.conceptId());
            assertEquals("Lung Non-Small Cell Carcinoma", merged.label());
        }

        @Test
        @DisplayName("Aliases are a case-insensitive union in priority order without the label")
        void aliases() {
            assertEquals(List.of("NSCLC", "Non-Small Cell Lung Cancer", "non-small cell lung carcinoma"),
                    merged.aliases());
        }

        @Test
        @DisplayName("Xrefs list the other members and never the merge_ref")
        void xrefs() {
            assertEquals(List.of(MONDO_NSCLC, DO_NSCLC), merged.xrefs());
        }

        @Test
        @DisplayName("Associated-with references are deduplicated")
        void associatedWith() {
            assertEquals(List.of("umls:C0007131"), merged.associatedWith());
        }

        @Test
        @DisplayName("Flags are OR-reduced and stay null when no member asserts them")
        void flags() {
            assertEquals(Boolean.TRUE, merged.oncologicDisease());
            assertEquals(Boolean.FALSE, merged.pediatricDisease());
        }

        @Test
        @DisplayName("Members are listed in priority order")
        void members() {
            assertEquals(List.of(NCIT_NSCLC, MONDO_NSCLC, DO_NSCLC), merged.members());
            assertTrue(merged.isMultiMember());
        }
    }

    @Test
    @DisplayName("Merging the same input twice gives equal records regardless of record order")
    void idempotent() {
        List<SourceRecord> shuffled = new ArrayList<>(DiseaseFixtures.nsclcGroup());
        Collections.reverse(shuffled);

        MergedRecord first = merger.merge(NSCLC_GROUP, DiseaseFixtures.nsclcGroup());
        MergedRecord second = merger.merge(NSCLC_GROUP, shuffled);

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Falls back to the first labeled member when the primary has no label")
    void labelFallback() {
        SourceRecord ncit = SourceRecord.builder().conceptId("ncit:C20").sourceName(SourceName.NCIT).build();
        SourceRecord mondo = SourceRecord.builder(DiseaseFixtures.mondo("mondo:0000020", "fallback label"))
                .xref("ncit:C20").build();

        MergedRecord merged = merger.merge(new MergeGroup("ncit:C20", List.of("ncit:C20", "mondo:0000020")),
                List.of(ncit, mondo));

        assertEquals("fallback label", merged.label());
        assertTrue(merged.aliases().isEmpty());
    }

    @Test
    @DisplayName("Label stays null when no member has one")
    void noLabel() {
        SourceRecord record = SourceRecord.builder().conceptId("DOID:21").sourceName(SourceName.DO).build();

        MergedRecord merged = merger.merge(MergeGroup.singleton("DOID:21"), List.of(record));

        assertNull(merged.label());
        assertFalse(merged.hasLabel());
        assertNull(merged.pediatricDisease());
        assertNull(merged.oncologicDisease());
    }

    @Test
    @DisplayName("Singleton keeps its own declared xrefs")
    void singletonXrefs() {
        SourceRecord record = SourceRecord.builder(DiseaseFixtures.mondo("mondo:0000022", "disease"))
                .xref("DOID:404").xref("mondo:0000022").build();

        MergedRecord merged = merger.merge(MergeGroup.singleton("mondo:0000022"), List.of(record));

        assertEquals(List.of("DOID:404"), merged.xrefs());
        assertFalse(merged.isMultiMember());
    }

    @Test
    @DisplayName("Rejects a group whose member has no record")
    void missingMember() {
        MergeGroup group = new MergeGroup(NCIT_NSCLC, List.of(NCIT_NSCLC, "mondo:9999999"));

        assertThrows(IllegalArgumentException.class,
                () -> merger.merge(group, List.of(DiseaseFixtures.ncitNsclc())));
    }
}
