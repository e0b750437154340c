package com.disease.normalization.merge;

import com.disease.normalization.core.model.MergeGroup;
import com.disease.normalization.core.model.SourceRecord;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Output of {@link CrossReferenceGraphBuilder#build(SourceRecordSnapshot)}.
 *
 * @param groups  every merge group, singletons included, ordered by merge_ref
 * @param records the records that took part in grouping, keyed by case-folded concept id
 * @param issues  integrity problems found, in discovery order
 */
public record GroupingResult(
        List<MergeGroup> groups,
        Map<String, SourceRecord> records,
        List<DataIntegrityIssue> issues
) {
    public GroupingResult {
        groups = List.copyOf(groups);
        records = Map.copyOf(records);
        issues = List.copyOf(issues);
    }

    public Optional<SourceRecord> record(String conceptId) {
        return Optional.ofNullable(records.get(conceptId.toLowerCase(Locale.ROOT)));
    }

    public List<SourceRecord> membersOf(MergeGroup group) {
        return group.memberIds().stream()
                .map(id -> records.get(id.toLowerCase(Locale.ROOT)))
                .toList();
    }

    public long multiMemberGroupCount() {
        return groups.stream().filter(g -> !g.isSingleton()).count();
    }
}
