package com.rankpivot.rankpivot.pivot;

import java.util.List;

/**
 * Ranks of one category for one month, in source order.
 */
public record MonthlyRanks(MonthLabel month, List<RankEntry> entries) {

    public MonthlyRanks {
        if (month == null) {
            throw new IllegalArgumentException("month is required");
        }
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
