package com.rankpivot.rankpivot.pivot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiFunction;

/**
 * Normalizes incoming monthly ranks before they touch a table: trims search terms, rejects blank or repeated
 * terms and repeated months, and drops ranks outside {@code [MIN_RANK, MAX_RANK]}.
 */
final class RankSanitizer {

    private static final Logger log = LoggerFactory.getLogger(RankSanitizer.class);

    private RankSanitizer() {
    }

    /**
     * Returns month → (term → rank) with months ascending and terms in source order.
     */
    static TreeMap<MonthLabel, Map<String, Integer>> sanitize(
            String category,
            List<MonthlyRanks> monthlyRanks,
            BiFunction<String, String, PivotTableException> failure
    ) {
        TreeMap<MonthLabel, Map<String, Integer>> byMonth = new TreeMap<>();
        if (monthlyRanks == null) {
            return byMonth;
        }
        for (MonthlyRanks monthly : monthlyRanks) {
            if (byMonth.containsKey(monthly.month())) {
                throw failure.apply(
                        "Month " + monthly.month() + " supplied twice for category " + category,
                        monthly.month().toString());
            }

            Map<String, Integer> valid = new LinkedHashMap<>();
            Map<String, Boolean> seen = new LinkedHashMap<>();
            int dropped = 0;
            for (RankEntry entry : monthly.entries()) {
                String term = normalizeTerm(entry.searchTerm());
                if (term.isEmpty()) {
                    throw failure.apply(
                            "Blank search term in " + category + " for month " + monthly.month(),
                            monthly.month().toString());
                }
                if (seen.put(term, Boolean.TRUE) != null) {
                    throw failure.apply(
                            "Search term listed twice in " + category + " for month " + monthly.month() + ": " + term,
                            term);
                }
                if (entry.rank() < PivotTable.MIN_RANK || entry.rank() > PivotTable.MAX_RANK) {
                    dropped++;
                    continue;
                }
                valid.put(term, entry.rank());
            }
            if (dropped > 0) {
                log.debug("Dropped {} out-of-range ranks from {} {}", dropped, category, monthly.month());
            }
            byMonth.put(monthly.month(), valid);
        }
        return byMonth;
    }

    static String normalizeTerm(String searchTerm) {
        return searchTerm == null ? "" : searchTerm.trim();
    }

    /**
     * Trimmed category name; rejects names that would be ambiguous in the table header.
     */
    static String requireCategoryName(String category) {
        String name = category == null ? "" : category.trim();
        if (name.isEmpty()) {
            throw new SchemaException("Category name is required", String.valueOf(category));
        }
        if (TableSchema.SEARCH_TERM_COLUMN.equalsIgnoreCase(name) || MonthLabel.tryParse(name).isPresent()) {
            throw new SchemaException("Category name collides with a reserved column: " + name, name);
        }
        return name;
    }
}
