package com.disease.normalization.cache;

/**
 * Listener for committed merge rebuilds. Implementations can react to a new
 * merged set, e.g. by invalidating cached normalize results.
 */
public interface RebuildListener {

    /**
     * Called after a rebuild committed successfully.
     *
     * @param groupCount        number of merge groups in the new set
     * @param mergedRecordCount number of multi-member merged records committed
     */
    void onRebuild(int groupCount, int mergedRecordCount);
}
