package com.rankpivot.rankpivot.pivot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Adds categories and months to a pivot table.
 *
 * <p>Both operations are all-or-nothing: they work on a private copy and return a new table only after it
 * passes {@link PivotTable#verifyInvariants()}. Month columns are shared between categories; when two
 * categories report the same term for the same month, the most recent merge call wins the cell.
 */
@Component
public class PivotMergeEngine {

    private static final Logger log = LoggerFactory.getLogger(PivotMergeEngine.class);

    /**
     * Adds a category that is not yet a column.
     *
     * <p>New terms are appended in first-seen order, iterating months ascending and terms in source order.
     * Terms whose only ranks fall outside the accepted range create no row.
     *
     * @throws DuplicateCategoryException when the category already exists
     * @throws DataIntegrityException     when a month repeats, or a month lists a blank or repeated term
     */
    public PivotTable addCategory(PivotTable table, String categoryName, List<MonthlyRanks> monthlyRanks) {
        String category = RankSanitizer.requireCategoryName(categoryName);
        if (table.hasCategory(category)) {
            throw new DuplicateCategoryException(category);
        }
        TreeMap<MonthLabel, Map<String, Integer>> byMonth =
                RankSanitizer.sanitize(category, monthlyRanks, DataIntegrityException::new);

        TableDraft draft = TableDraft.copyOf(table);
        int rowsBefore = draft.rowCount();
        int categoryIndex = draft.addCategory(category);
        for (Map<String, Integer> ranks : byMonth.values()) {
            for (String term : ranks.keySet()) {
                draft.markPresent(draft.ensureRow(term), categoryIndex);
            }
        }
        writeMonths(draft, category, byMonth);

        PivotTable merged = draft.build();
        log.info("Added category {}: months={}, newRows={}, rows={}",
                category, byMonth.keySet(), merged.rowCount() - rowsBefore, merged.rowCount());
        return merged;
    }

    /**
     * Adds or refreshes months for a category already in the table.
     *
     * <p>Each term in a supplied month is flagged present for the category (appended as a new row when unknown)
     * and its cell written. Cells of terms not in the supplied data are left as they are, so refreshing a
     * shared month never blanks another category's cells.
     *
     * @throws UnknownCategoryException when the category was never added
     * @throws DataIntegrityException   when a month repeats, or a month lists a blank or repeated term
     */
    public PivotTable addMonths(PivotTable table, String categoryName, List<MonthlyRanks> monthlyRanks) {
        String category = categoryName == null ? "" : categoryName.trim();
        if (!table.hasCategory(category)) {
            throw new UnknownCategoryException(category);
        }
        TreeMap<MonthLabel, Map<String, Integer>> byMonth =
                RankSanitizer.sanitize(category, monthlyRanks, DataIntegrityException::new);

        TableDraft draft = TableDraft.copyOf(table);
        int rowsBefore = draft.rowCount();
        int categoryIndex = draft.schema().categoryIndex(category);
        for (Map<String, Integer> ranks : byMonth.values()) {
            for (String term : ranks.keySet()) {
                draft.markPresent(draft.ensureRow(term), categoryIndex);
            }
        }
        writeMonths(draft, category, byMonth);

        PivotTable merged = draft.build();
        log.info("Added months {} for {}: newRows={}, rows={}",
                byMonth.keySet(), category, merged.rowCount() - rowsBefore, merged.rowCount());
        return merged;
    }

    private void writeMonths(TableDraft draft, String category, TreeMap<MonthLabel, Map<String, Integer>> byMonth) {
        for (Map.Entry<MonthLabel, Map<String, Integer>> monthEntry : byMonth.entrySet()) {
            MonthLabel month = monthEntry.getKey();
            draft.ensureMonth(month);
            draft.addSupplier(month, category);
        }
        for (Map.Entry<MonthLabel, Map<String, Integer>> monthEntry : byMonth.entrySet()) {
            int monthIndex = draft.schema().monthIndex(monthEntry.getKey());
            monthEntry.getValue().forEach((term, rank) -> draft.setRank(draft.rowOf(term), monthIndex, rank));
        }
    }
}
