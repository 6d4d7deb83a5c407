package com.rankpivot.rankpivot.store;

import java.util.List;

/**
 * Processed versus pending categories of a country.
 */
public record ProcessingSummary(
        int totalCategories,
        int processed,
        int pending,
        double completionPercentage,
        List<String> processedCategories,
        List<String> pendingCategories
) {
}
