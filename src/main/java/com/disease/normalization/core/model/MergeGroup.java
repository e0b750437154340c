package com.disease.normalization.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A connected component of the cross-reference graph.
 *
 * @param mergeRef  concept id chosen to represent the group
 * @param memberIds concept ids of all members in deterministic order, merge_ref included
 */
public record MergeGroup(String mergeRef, List<String> memberIds) {

    public MergeGroup {
        Objects.requireNonNull(mergeRef, "mergeRef is required");
        memberIds = List.copyOf(memberIds);
        if (!memberIds.contains(mergeRef)) {
            throw new IllegalArgumentException("mergeRef " + mergeRef + " is not a member of its group");
        }
    }

    public static MergeGroup singleton(String conceptId) {
        return new MergeGroup(conceptId, List.of(conceptId));
    }

    public int size() {
        return memberIds.size();
    }

    public boolean isSingleton() {
        return memberIds.size() == 1;
    }
}
