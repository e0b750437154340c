package com.disease.normalization.merge;

import com.disease.normalization.DiseaseFixtures;
import com.disease.normalization.cache.RebuildListener;
import com.disease.normalization.core.model.MergedRecord;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.core.model.SourceRecord;
import com.disease.normalization.metrics.MicrometerMetricsService;
import com.disease.normalization.store.ConceptStore;
import com.disease.normalization.store.InMemoryConceptStore;
import com.disease.normalization.store.StoreReadException;
import com.disease.normalization.store.StoreWriteException;
import com.disease.normalization.tracing.NoOpTracingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.disease.normalization.DiseaseFixtures.NCIT_NSCLC;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@DisplayName("MergeRebuilder Tests")
class MergeRebuilderTest {

    @Nested
    @DisplayName("With in-memory store")
    class InMemory {

        private InMemoryConceptStore store;
        private MergeRebuilder rebuilder;

        @BeforeEach
        void setUp() {
            store = new InMemoryConceptStore();
            rebuilder = new MergeRebuilder(store);
        }

        @Test
        @DisplayName("Commits merged records for multi-member groups only")
        void commitsMultiMemberGroups() {
            List<SourceRecord> records = new ArrayList<>(DiseaseFixtures.nsclcGroup());
            records.add(DiseaseFixtures.ncit("ncit:C30", "Standalone"));
            DiseaseFixtures.load(store, records);

            RebuildResult result = rebuilder.rebuild();

            assertTrue(result.success());
            assertEquals(2, result.groupCount());
            assertEquals(1, result.mergedRecordCount());
            assertEquals(List.of(NCIT_NSCLC),
                    store.getAllMergedRecords().stream().map(MergedRecord::conceptId).toList());
            assertEquals(NCIT_NSCLC, store.getSourceRecord(DiseaseFixtures.DO_NSCLC)
                    .flatMap(SourceRecord::getMergeRef).orElseThrow());
            assertTrue(store.getSourceRecord("ncit:C30").orElseThrow().getMergeRef().isEmpty());
        }

        @Test
        @DisplayName("Reports integrity issues without failing")
        void reportsIssues() {
            store.addSourceRecord(SourceRecord.builder(DiseaseFixtures.mondo("mondo:0000031", "x"))
                    .xref("DOID:31").build());

            RebuildResult result = rebuilder.rebuild();

            assertTrue(result.success());
            assertEquals(1, result.issues().size());
            assertEquals(1L, result.issueCounts().get(IntegrityIssueType.DANGLING_XREF));
        }

        @Test
        @DisplayName("Rebuilding twice without changes yields the same merged set")
        void idempotentRebuild() {
            DiseaseFixtures.load(store, DiseaseFixtures.nsclcGroup());

            rebuilder.rebuild();
            List<MergedRecord> first = store.getAllMergedRecords();
            rebuilder.rebuild();

            assertEquals(first, store.getAllMergedRecords());
        }

        @Test
        @DisplayName("Records that no longer link lose their merge pointer")
        void pointersReset() {
            DiseaseFixtures.load(store, DiseaseFixtures.nsclcGroup());
            rebuilder.rebuild();

            store.deleteSource(SourceName.NCIT);
            store.addSourceRecord(SourceRecord.builder(DiseaseFixtures.mondoNsclc()).xrefs(List.of()).build());
            store.addSourceRecord(SourceRecord.builder(DiseaseFixtures.doNsclc()).xrefs(List.of()).build());
            RebuildResult result = rebuilder.rebuild();

            assertEquals(0, result.mergedRecordCount());
            assertTrue(store.getAllMergedRecords().isEmpty());
            assertTrue(store.getSourceRecord(DiseaseFixtures.MONDO_NSCLC).orElseThrow().getMergeRef().isEmpty());
        }

        @Test
        @DisplayName("Records metrics for a successful rebuild")
        void recordsMetrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            MergeRebuilder instrumented = new MergeRebuilder(store, new CrossReferenceGraphBuilder(),
                    new RecordMerger(), new MicrometerMetricsService(registry), new NoOpTracingService());
            DiseaseFixtures.load(store, DiseaseFixtures.nsclcGroup());

            instrumented.rebuild();

            assertEquals(1, registry.find("disease.rebuild.duration").tag("outcome", "success").timer().count());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        private ConceptStore store;
        private MergeRebuilder rebuilder;

        @BeforeEach
        void setUp() {
            store = mock(ConceptStore.class);
            rebuilder = new MergeRebuilder(store);
        }

        @Test
        @DisplayName("Load failure raises RebuildFailedException and commits nothing")
        void loadFailure() {
            when(store.loadAllSourceRecords()).thenThrow(new StoreReadException("connection refused"));

            RebuildFailedException e = assertThrows(RebuildFailedException.class, rebuilder::rebuild);

            assertTrue(e.getMessage().contains("connection refused"));
            verify(store, never()).replaceMergedRecords(anyCollection());
        }

        @Test
        @DisplayName("Commit failure raises RebuildFailedException and skips listeners")
        void commitFailure() {
            when(store.loadAllSourceRecords()).thenReturn(DiseaseFixtures.nsclcGroup());
            doThrow(new StoreWriteException("write timed out")).when(store).replaceMergedRecords(anyCollection());
            RebuildListener listener = mock(RebuildListener.class);
            rebuilder.addRebuildListener(listener);

            RebuildFailedException e = assertThrows(RebuildFailedException.class, rebuilder::rebuild);

            assertTrue(e.getMessage().startsWith("Failed to commit merged records"));
            assertInstanceOf(StoreWriteException.class, e.getCause());
            verify(listener, never()).onRebuild(anyInt(), anyInt());
        }

        @Test
        @DisplayName("Commits the whole merged set in a single call")
        @SuppressWarnings("unchecked")
        void singleCommit() {
            when(store.loadAllSourceRecords()).thenReturn(DiseaseFixtures.nsclcGroup());

            rebuilder.rebuild();

            ArgumentCaptor<Collection<MergedRecord>> captor = ArgumentCaptor.forClass(Collection.class);
            verify(store, times(1)).replaceMergedRecords(captor.capture());
            assertEquals(1, captor.getValue().size());
        }
    }

    @Nested
    @DisplayName("Listeners")
    class Listeners {

        @Test
        @DisplayName("Listeners are notified with group counts after a commit")
        void notified() {
            InMemoryConceptStore store = new InMemoryConceptStore();
            DiseaseFixtures.load(store, DiseaseFixtures.nsclcGroup());
            MergeRebuilder rebuilder = new MergeRebuilder(store);
            RebuildListener listener = mock(RebuildListener.class);
            rebuilder.addRebuildListener(listener);

            rebuilder.rebuild();

            verify(listener).onRebuild(1, 1);
        }

        @Test
        @DisplayName("A failing listener does not fail the rebuild")
        void failingListener() {
            MergeRebuilder rebuilder = new MergeRebuilder(new InMemoryConceptStore());
            rebuilder.addRebuildListener((groups, merged) -> {
                throw new IllegalStateException("boom");
            });

            assertTrue(rebuilder.rebuild().success());
        }

        @Test
        @DisplayName("Removed listeners are not notified")
        void removed() {
            MergeRebuilder rebuilder = new MergeRebuilder(new InMemoryConceptStore());
            RebuildListener listener = mock(RebuildListener.class);
            rebuilder.addRebuildListener(listener);
            rebuilder.removeRebuildListener(listener);

            rebuilder.rebuild();

            verifyNoInteractions(listener);
        }
    }
}
