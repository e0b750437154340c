package com.disease.normalization.merge;

import com.disease.normalization.core.model.MergeGroup;
import com.disease.normalization.core.model.MergedRecord;
import com.disease.normalization.core.model.SourcePriority;
import com.disease.normalization.core.model.SourceRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Combines the records of one merge group into a single {@link MergedRecord}.
 *
 * <p>Members are visited in {@link SourcePriority#RECORD_ORDER}; list fields
 * are case-insensitive unions that keep the first casing seen. The merger is
 * stateless and deterministic: the same group and records always yield an
 * equal record with identically ordered lists.</p>
 */
public class RecordMerger {

    /**
     * Merges the given records, which must include every member of the group.
     *
     * @throws IllegalArgumentException if a member of the group has no record
     */
    public MergedRecord merge(MergeGroup group, Collection<SourceRecord> records) {
        List<SourceRecord> members = orderedMembers(group, records);
        String mergeRefKey = group.mergeRef().toLowerCase(Locale.ROOT);
        SourceRecord primary = members.stream()
                .filter(r -> r.getConceptIdKey().equals(mergeRefKey))
                .findFirst()
                .orElseThrow();

        String label = chooseLabel(primary, members);

        CaseInsensitiveUnion aliases = new CaseInsensitiveUnion();
        if (label != null) {
            aliases.exclude(label);
        }
        for (SourceRecord member : members) {
            if (member.hasLabel()) {
                aliases.add(member.getLabel());
            }
            aliases.addAll(sorted(member.getAliases()));
        }

        CaseInsensitiveUnion xrefs = new CaseInsensitiveUnion();
        xrefs.exclude(group.mergeRef());
        for (SourceRecord member : members) {
            if (member != primary) {
                xrefs.add(member.getConceptId());
            }
        }
        for (SourceRecord member : members) {
            String self = member.getConceptIdKey();
            for (String xref : sorted(member.getXrefs())) {
                if (!xref.toLowerCase(Locale.ROOT).equals(self)) {
                    xrefs.add(xref);
                }
            }
        }

        CaseInsensitiveUnion associatedWith = new CaseInsensitiveUnion();
        for (SourceRecord member : members) {
            associatedWith.addAll(sorted(member.getAssociatedWith()));
        }

        return MergedRecord.builder()
                .conceptId(primary.getConceptId())
                .label(label)
                .aliases(aliases.values())
                .xrefs(xrefs.values())
                .associatedWith(associatedWith.values())
                .pediatricDisease(reduceFlag(members, SourceRecord::getPediatricDisease))
                .oncologicDisease(reduceFlag(members, SourceRecord::getOncologicDisease))
                .members(members.stream().map(SourceRecord::getConceptId).toList())
                .build();
    }

    private List<SourceRecord> orderedMembers(MergeGroup group, Collection<SourceRecord> records) {
        Map<String, SourceRecord> byKey = new HashMap<>();
        for (SourceRecord record : records) {
            byKey.putIfAbsent(record.getConceptIdKey(), record);
        }
        List<SourceRecord> members = new ArrayList<>(group.size());
        for (String memberId : group.memberIds()) {
            SourceRecord record = byKey.get(memberId.toLowerCase(Locale.ROOT));
            if (record == null) {
                throw new IllegalArgumentException("No record supplied for group member " + memberId);
            }
            members.add(record);
        }
        members.sort(SourcePriority.RECORD_ORDER);
        return members;
    }

    private static String chooseLabel(SourceRecord primary, List<SourceRecord> members) {
        if (primary.hasLabel()) {
            return primary.getLabel();
        }
        return members.stream()
                .filter(SourceRecord::hasLabel)
                .map(SourceRecord::getLabel)
                .findFirst()
                .orElse(null);
    }

    private static Boolean reduceFlag(List<SourceRecord> members, Function<SourceRecord, Boolean> flag) {
        Boolean result = null;
        for (SourceRecord member : members) {
            Boolean value = flag.apply(member);
            if (Boolean.TRUE.equals(value)) {
                return Boolean.TRUE;
            }
            if (Boolean.FALSE.equals(value)) {
                result = Boolean.FALSE;
            }
        }
        return result;
    }

    private static List<String> sorted(List<String> values) {
        List<String> copy = new ArrayList<>(values);
        copy.sort(null);
        return copy;
    }

    /**
     * Insertion-ordered set of strings compared case-insensitively; the first
     * casing added wins.
     */
    private static final class CaseInsensitiveUnion {
        private final Map<String, String> values = new LinkedHashMap<>();
        private final List<String> excluded = new ArrayList<>();

        void exclude(String value) {
            excluded.add(value.toLowerCase(Locale.ROOT));
        }

        void add(String value) {
            String key = value.toLowerCase(Locale.ROOT);
            if (!excluded.contains(key)) {
                values.putIfAbsent(key, value);
            }
        }

        void addAll(List<String> toAdd) {
            toAdd.forEach(this::add);
        }

        List<String> values() {
            return List.copyOf(values.values());
        }
    }
}
