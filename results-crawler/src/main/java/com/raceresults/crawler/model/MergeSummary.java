package com.raceresults.crawler.model;

/**
 * Counters reported after a merge.
 *
 * duplicatesCollapsed counts rows dropped because a later row had the same key.
 */
public record MergeSummary(
        int masterRowsBefore,
        int stagedFilesMerged,
        int stagedRowsRead,
        int duplicatesCollapsed,
        int stagedFilesRejected,
        int masterRowsAfter
) {

    public static MergeSummary unchanged(int masterRows, int rejected) {
        return new MergeSummary(masterRows, 0, 0, 0, rejected, masterRows);
    }
}
