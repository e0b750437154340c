package com.disease.normalization.merge;

import com.disease.normalization.DiseaseFixtures;
import com.disease.normalization.core.model.MergeGroup;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.core.model.SourceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.disease.normalization.DiseaseFixtures.DO_NSCLC;
import static com.disease.normalization.DiseaseFixtures.MONDO_NSCLC;
import static com.disease.normalization.DiseaseFixtures.NCIT_NSCLC;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrossReferenceGraphBuilder Tests")
class CrossReferenceGraphBuilderTest {

    private final CrossReferenceGraphBuilder builder = new CrossReferenceGraphBuilder();

    private GroupingResult build(List<SourceRecord> records) {
        return builder.build(SourceRecordSnapshot.of(records));
    }

    private static MergeGroup groupContaining(GroupingResult result, String conceptId) {
        return result.groups().stream()
                .filter(g -> g.memberIds().contains(conceptId))
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("Grouping")
    class Grouping {

        @Test
        @DisplayName("Records linked by cross-references form one group led by the NCIt record")
        void nsclcGroup() {
            GroupingResult result = build(DiseaseFixtures.nsclcGroup());

            assertEquals(1, result.groups().size());
            MergeGroup group = result.groups().get(0);
            assertEquals(NCIT_NSCLC, group.mergeRef());
            assertEquals(List.of(NCIT_NSCLC, MONDO_NSCLC, DO_NSCLC), group.memberIds());
            assertTrue(result.issues().isEmpty());
        }

        @Test
        @DisplayName("Cross-references are treated as undirected and transitive")
        void transitiveClosure() {
            // Only DO points at Mondo and only Mondo points at NCIt
            SourceRecord ncit = DiseaseFixtures.ncit("ncit:C1", "Disease A");
            SourceRecord mondo = SourceRecord.builder(DiseaseFixtures.mondo("mondo:0000001", "disease a"))
                    .xref("ncit:C1").build();
            SourceRecord doid = SourceRecord.builder()
                    .conceptId("DOID:1").sourceName(SourceName.DO).xref("mondo:0000001").build();

            GroupingResult result = build(List.of(doid, mondo, ncit));

            assertEquals(1, result.groups().size());
            assertEquals(List.of("ncit:C1", "mondo:0000001", "DOID:1"), result.groups().get(0).memberIds());
        }

        @Test
        @DisplayName("Cross-references match concept ids case-insensitively")
        void caseInsensitiveTargets() {
            SourceRecord ncit = DiseaseFixtures.ncit("ncit:C2", "Disease B");
            SourceRecord mondo = SourceRecord.builder(DiseaseFixtures.mondo("mondo:0000002", "disease b"))
                    .xref("NCIT:c2").build();

            GroupingResult result = build(List.of(ncit, mondo));

            assertEquals(1, result.groups().size());
            assertEquals("ncit:C2", result.groups().get(0).mergeRef());
        }

        @Test
        @DisplayName("Unlinked records stay singletons")
        void singletons() {
            GroupingResult result = build(List.of(
                    DiseaseFixtures.ncit("ncit:C3", "Disease C"),
                    DiseaseFixtures.mondo("mondo:0000003", "disease d")));

            assertEquals(2, result.groups().size());
            assertTrue(result.groups().stream().allMatch(MergeGroup::isSingleton));
            assertEquals(0, result.multiMemberGroupCount());
        }

        @Test
        @DisplayName("Groups are ordered by case-folded merge_ref")
        void groupOrder() {
            GroupingResult result = build(List.of(
                    DiseaseFixtures.mondo("mondo:0000009", "z"),
                    DiseaseFixtures.ncit("ncit:C9", "y"),
                    SourceRecord.builder().conceptId("DOID:9").sourceName(SourceName.DO).build()));

            assertEquals(List.of("DOID:9", "mondo:0000009", "ncit:C9"),
                    result.groups().stream().map(MergeGroup::mergeRef).toList());
        }
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("Input order does not change groups, members or issues")
        void shuffledInput() {
            List<SourceRecord> records = new ArrayList<>(DiseaseFixtures.nsclcGroup());
            records.add(DiseaseFixtures.ncit("ncit:C4", "Disease E"));
            records.add(SourceRecord.builder(DiseaseFixtures.mondo("mondo:0000004", "disease e"))
                    .xref("ncit:C4").xref("ncit:C404").build());
            records.add(SourceRecord.builder().conceptId("DOID:4").sourceName(SourceName.DO)
                    .xref("mondo:0000004").xref("DOID:4").build());

            GroupingResult expected = build(records);
            Random random = new Random(42);
            for (int i = 0; i < 20; i++) {
                Collections.shuffle(records, random);
                GroupingResult actual = build(records);
                assertEquals(expected.groups(), actual.groups());
                assertEquals(expected.issues(), actual.issues());
            }
        }

        @Test
        @DisplayName("Declaring the same edge from both ends yields the same groups")
        void symmetricEdges() {
            SourceRecord ncitWithBackRef = SourceRecord.builder(DiseaseFixtures.ncitNsclc())
                    .xref(MONDO_NSCLC).build();

            GroupingResult oneWay = build(DiseaseFixtures.nsclcGroup());
            GroupingResult bothWays = build(List.of(ncitWithBackRef, DiseaseFixtures.mondoNsclc(),
                    DiseaseFixtures.doNsclc()));

            assertEquals(oneWay.groups(), bothWays.groups());
        }
    }

    @Nested
    @DisplayName("Integrity issues")
    class IntegrityIssues {

        @Test
        @DisplayName("Dangling cross-reference leaves a singleton with one issue")
        void danglingXref() {
            SourceRecord record = SourceRecord.builder(DiseaseFixtures.mondo("mondo:0000005", "disease f"))
                    .xref("DOID:99999").build();

            GroupingResult result = build(List.of(record));

            assertEquals(1, result.groups().size());
            assertTrue(result.groups().get(0).isSingleton());
            assertEquals(List.of(new DataIntegrityIssue(IntegrityIssueType.DANGLING_XREF,
                    "mondo:0000005", "DOID:99999")), result.issues());
        }

        @Test
        @DisplayName("Self cross-reference is reported and ignored")
        void selfXref() {
            SourceRecord record = SourceRecord.builder(DiseaseFixtures.ncit("ncit:C6", "Disease G"))
                    .xref("NCIT:C6").build();

            GroupingResult result = build(List.of(record));

            assertTrue(result.groups().get(0).isSingleton());
            assertEquals(IntegrityIssueType.SELF_XREF, result.issues().get(0).type());
        }

        @Test
        @DisplayName("Duplicate concept id keeps the first record in priority order")
        void duplicateConceptId() {
            SourceRecord first = DiseaseFixtures.ncit("ncit:C7", "Disease H");
            SourceRecord second = DiseaseFixtures.ncit("NCIT:C7", "Disease H again");

            GroupingResult result = build(List.of(second, first));

            assertEquals(1, result.groups().size());
            assertEquals("NCIT:C7", result.groups().get(0).mergeRef());
            assertEquals(1, result.issues().size());
            assertEquals(IntegrityIssueType.DUPLICATE_CONCEPT_ID, result.issues().get(0).type());
            assertEquals("ncit:C7", result.issues().get(0).conceptId());
        }

        @Test
        @DisplayName("Two records of one source in a component are reported but kept together")
        void sameSourceConflict() {
            SourceRecord mondo = SourceRecord.builder(DiseaseFixtures.mondo("mondo:0000008", "disease i"))
                    .xref("ncit:C8").xref("ncit:C80").build();

            GroupingResult result = build(List.of(
                    DiseaseFixtures.ncit("ncit:C8", "Disease I"),
                    DiseaseFixtures.ncit("ncit:C80", "Disease I variant"),
                    mondo));

            assertEquals(1, result.groups().size());
            assertEquals(3, result.groups().get(0).size());
            assertEquals(List.of(new DataIntegrityIssue(IntegrityIssueType.SAME_SOURCE_CONFLICT,
                    "ncit:C80", "grouped with ncit:C8")), result.issues());
        }

        @Test
        @DisplayName("Record without a recognized source is a singleton and reported")
        void unrankedSource() {
            SourceRecord unranked = SourceRecord.builder().conceptId("ncit:C10").label("Orphan").build();
            SourceRecord mondo = SourceRecord.builder(DiseaseFixtures.mondo("mondo:0000010", "orphan"))
                    .xref("ncit:C10").build();

            GroupingResult result = build(List.of(unranked, mondo));

            assertEquals(2, result.groups().size());
            assertTrue(result.groups().stream().allMatch(MergeGroup::isSingleton));
            assertEquals(1, result.issues().size());
            assertEquals(IntegrityIssueType.UNRANKED_SOURCE, result.issues().get(0).type());
        }

        @Test
        @DisplayName("Record whose id prefix does not match its source is excluded from edges")
        void prefixMismatch() {
            SourceRecord mislabeled = SourceRecord.builder()
                    .conceptId("mondo:0000011").sourceName(SourceName.NCIT).xref("DOID:11").build();
            SourceRecord doid = SourceRecord.builder().conceptId("DOID:11").sourceName(SourceName.DO).build();

            GroupingResult result = build(List.of(mislabeled, doid));

            assertEquals(2, result.groups().size());
            assertEquals(IntegrityIssueType.SOURCE_PREFIX_MISMATCH, result.issues().get(0).type());
            assertEquals("NCIt", result.issues().get(0).detail());
        }
    }

    @Test
    @DisplayName("Empty snapshot yields no groups")
    void emptySnapshot() {
        GroupingResult result = build(List.of());
        assertTrue(result.groups().isEmpty());
        assertTrue(result.issues().isEmpty());
    }
}
