package com.rankpivot.rankpivot.source;

/**
 * File statistics for one category folder.
 */
public record CategoryFileSummary(
        String category,
        int fileCount,
        long totalBytes,
        String firstMonth,
        String lastMonth
) {
}
