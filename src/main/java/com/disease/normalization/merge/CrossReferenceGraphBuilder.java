package com.disease.normalization.merge;

import com.disease.normalization.core.model.MergeGroup;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.core.model.SourcePriority;
import com.disease.normalization.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Groups source records that denote the same disease.
 *
 * <p>Builds an undirected graph whose vertices are concept ids and whose edges
 * are declared cross-references between ingested records, then returns its
 * connected components as {@link MergeGroup}s. The result depends only on the
 * snapshot's content, never on the order records or cross-references were
 * supplied in:</p>
 * <ol>
 *   <li>vertices are indexed by their sorted case-folded concept id</li>
 *   <li>each edge is stored as (lower index, higher index), and the edge list is
 *       sorted and deduplicated before any union</li>
 *   <li>merge_ref and member order follow {@link SourcePriority#RECORD_ORDER}</li>
 * </ol>
 */
public class CrossReferenceGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(CrossReferenceGraphBuilder.class);

    /**
     * Computes merge groups for every record in the snapshot.
     */
    public GroupingResult build(SourceRecordSnapshot snapshot) {
        List<DataIntegrityIssue> issues = new ArrayList<>();

        // Snapshot order is priority order, so the first of any duplicate pair wins
        Map<String, SourceRecord> recordsByKey = new LinkedHashMap<>();
        Set<String> excluded = new HashSet<>();
        for (SourceRecord record : snapshot.records()) {
            String key = record.getConceptIdKey();
            if (recordsByKey.containsKey(key)) {
                issues.add(new DataIntegrityIssue(IntegrityIssueType.DUPLICATE_CONCEPT_ID,
                        record.getConceptId(), "already defined by " + recordsByKey.get(key).getConceptId()));
                continue;
            }
            recordsByKey.put(key, record);

            if (!record.hasRankedSource()) {
                issues.add(new DataIntegrityIssue(IntegrityIssueType.UNRANKED_SOURCE,
                        record.getConceptId(), null));
                excluded.add(key);
            } else if (!record.getSourceName().ownsConceptId(record.getConceptId())) {
                issues.add(new DataIntegrityIssue(IntegrityIssueType.SOURCE_PREFIX_MISMATCH,
                        record.getConceptId(), record.getSourceName().getDisplayName()));
                excluded.add(key);
            }
        }

        String[] vertices = recordsByKey.keySet().toArray(new String[0]);
        Arrays.sort(vertices);
        Map<String, Integer> vertexIndex = new HashMap<>(vertices.length * 2);
        for (int i = 0; i < vertices.length; i++) {
            vertexIndex.put(vertices[i], i);
        }

        long[] edges = collectEdges(vertices, recordsByKey, vertexIndex, excluded, issues);

        UnionFind unionFind = new UnionFind(vertices.length);
        for (long edge : edges) {
            unionFind.union((int) (edge >>> 32), (int) edge);
        }

        List<MergeGroup> groups = collectGroups(vertices, recordsByKey, unionFind, issues);

        log.debug("graph.built vertices={} edges={} groups={} issues={}",
                vertices.length, edges.length, groups.size(), issues.size());
        return new GroupingResult(groups, recordsByKey, issues);
    }

    private long[] collectEdges(String[] vertices, Map<String, SourceRecord> recordsByKey,
                                Map<String, Integer> vertexIndex, Set<String> excluded,
                                List<DataIntegrityIssue> issues) {
        List<Long> edges = new ArrayList<>();
        for (int from = 0; from < vertices.length; from++) {
            if (excluded.contains(vertices[from])) {
                continue;
            }
            SourceRecord record = recordsByKey.get(vertices[from]);
            List<String> xrefs = new ArrayList<>(record.getXrefs());
            xrefs.sort(Comparator.naturalOrder());
            for (String xref : xrefs) {
                String target = xref.toLowerCase(Locale.ROOT);
                if (target.equals(vertices[from])) {
                    issues.add(new DataIntegrityIssue(IntegrityIssueType.SELF_XREF,
                            record.getConceptId(), xref));
                    continue;
                }
                Integer to = vertexIndex.get(target);
                if (to == null) {
                    issues.add(new DataIntegrityIssue(IntegrityIssueType.DANGLING_XREF,
                            record.getConceptId(), xref));
                    continue;
                }
                if (excluded.contains(target)) {
                    log.debug("graph.edge.skipped from={} to={} reason=excluded-target",
                            record.getConceptId(), xref);
                    continue;
                }
                int low = Math.min(from, to);
                int high = Math.max(from, to);
                edges.add(((long) low << 32) | high);
            }
        }
        return edges.stream().mapToLong(Long::longValue).sorted().distinct().toArray();
    }

    private List<MergeGroup> collectGroups(String[] vertices, Map<String, SourceRecord> recordsByKey,
                                           UnionFind unionFind, List<DataIntegrityIssue> issues) {
        Map<Integer, List<SourceRecord>> components = new LinkedHashMap<>();
        for (int i = 0; i < vertices.length; i++) {
            components.computeIfAbsent(unionFind.find(i), k -> new ArrayList<>())
                    .add(recordsByKey.get(vertices[i]));
        }

        List<MergeGroup> groups = new ArrayList<>(components.size());
        for (List<SourceRecord> members : components.values()) {
            members.sort(SourcePriority.RECORD_ORDER);
            if (members.size() > 1) {
                reportSameSourceConflicts(members, issues);
            }
            groups.add(new MergeGroup(
                    members.get(0).getConceptId(),
                    members.stream().map(SourceRecord::getConceptId).toList()));
        }
        groups.sort(Comparator.comparing((MergeGroup g) -> g.mergeRef().toLowerCase(Locale.ROOT))
                .thenComparing(MergeGroup::mergeRef));
        return groups;
    }

    private void reportSameSourceConflicts(List<SourceRecord> members, List<DataIntegrityIssue> issues) {
        Set<SourceName> seen = EnumSet.noneOf(SourceName.class);
        Map<SourceName, String> firstBySource = new HashMap<>();
        for (SourceRecord member : members) {
            SourceName source = member.getSourceName();
            if (!seen.add(source)) {
                issues.add(new DataIntegrityIssue(IntegrityIssueType.SAME_SOURCE_CONFLICT,
                        member.getConceptId(), "grouped with " + firstBySource.get(source)));
            } else {
                firstBySource.put(source, member.getConceptId());
            }
        }
    }
}
