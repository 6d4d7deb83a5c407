package com.rankpivot.rankpivot.detect;

import com.rankpivot.rankpivot.pivot.MonthLabel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Difference between a table's schema and the source files available for it.
 *
 * @param newMonths               months available in any source but absent from the table, ascending
 * @param newCategoryMonths       categories absent from the table, each with its available months
 * @param pendingMonthsByCategory categories already in the table, each with available months it has not supplied
 * @param newKeywordsEstimate     upper bound on rows a full update would append
 */
public record TableDelta(
        Set<MonthLabel> newMonths,
        Map<String, List<MonthLabel>> newCategoryMonths,
        Map<String, List<MonthLabel>> pendingMonthsByCategory,
        int newKeywordsEstimate
) {

    public TableDelta {
        newMonths = newMonths == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(newMonths));
        newCategoryMonths = copyOf(newCategoryMonths);
        pendingMonthsByCategory = copyOf(pendingMonthsByCategory);
    }

    public static TableDelta none() {
        return new TableDelta(Set.of(), Map.of(), Map.of(), 0);
    }

    public Set<String> newCategories() {
        return newCategoryMonths.keySet();
    }

    public boolean hasNewCategories() {
        return !newCategoryMonths.isEmpty();
    }

    public boolean hasPendingMonths() {
        return !pendingMonthsByCategory.isEmpty();
    }

    public boolean hasChanges() {
        return hasNewCategories() || hasPendingMonths() || !newMonths.isEmpty();
    }

    private static Map<String, List<MonthLabel>> copyOf(Map<String, List<MonthLabel>> source) {
        Map<String, List<MonthLabel>> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((category, months) -> copy.put(category, List.copyOf(months)));
        }
        return Collections.unmodifiableMap(copy);
    }
}
