package com.rankpivot.rankpivot.update;

import java.util.List;
import java.util.Map;

/**
 * Detected changes for one country, with a readable summary.
 */
public record ChangeReport(
        String country,
        List<String> newMonths,
        Map<String, List<String>> newCategories,
        Map<String, List<String>> pendingMonths,
        int newKeywordsEstimate,
        boolean hasChanges,
        String report
) {
}
