package com.rankpivot.rankpivot.pivot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Wide table of search terms × category presence × monthly rank.
 *
 * <p>Instances are immutable. A table is created once from an anchor category and then only grows through
 * {@link PivotMergeEngine}, which hands back a new instance per merge.
 */
public final class PivotTable {

    public static final int ABSENT_RANK = 0;
    public static final int MIN_RANK = 1;
    public static final int MAX_RANK = 500_000;

    private final TableSchema schema;
    private final List<PivotRow> rows;
    private final Map<String, Integer> rowIndex;

    private PivotTable(TableSchema schema, List<PivotRow> rows) {
        this.schema = schema;
        this.rows = List.copyOf(rows);
        Map<String, Integer> index = new HashMap<>(Math.max(16, rows.size() * 2));
        for (int i = 0; i < this.rows.size(); i++) {
            String term = this.rows.get(i).searchTerm();
            if (index.put(term, i) != null) {
                throw new DataIntegrityException("Duplicate search term row: " + term, term);
            }
        }
        this.rowIndex = Collections.unmodifiableMap(index);
    }

    /**
     * Creates a table from the anchor category. Row order is the most recent month's term order, followed by
     * terms first seen in the anchor's earlier months (ascending). Every row gets presence 1 for the anchor.
     *
     * @throws SchemaException when the anchor name is invalid, a month lists a term twice, or no row survives
     *                         rank filtering
     */
    public static PivotTable create(String anchorCategory, List<MonthlyRanks> anchorMonths) {
        String category = RankSanitizer.requireCategoryName(anchorCategory);
        if (anchorMonths == null || anchorMonths.isEmpty()) {
            throw new SchemaException("Anchor category supplies no months: " + category, category);
        }
        TreeMap<MonthLabel, Map<String, Integer>> byMonth =
                RankSanitizer.sanitize(category, anchorMonths, SchemaException::new);

        TableDraft draft = TableDraft.empty();
        int categoryIndex = draft.addCategory(category);
        for (MonthLabel month : byMonth.keySet()) {
            draft.ensureMonth(month);
            draft.addSupplier(month, category);
        }

        List<MonthLabel> rowOrder = new ArrayList<>();
        rowOrder.add(byMonth.lastKey());
        rowOrder.addAll(byMonth.headMap(byMonth.lastKey()).keySet());
        for (MonthLabel month : rowOrder) {
            for (String term : byMonth.get(month).keySet()) {
                draft.markPresent(draft.ensureRow(term), categoryIndex);
            }
        }
        if (draft.rowCount() == 0) {
            throw new SchemaException("Anchor category has no rows within rank range: " + category, category);
        }

        byMonth.forEach((month, ranks) -> {
            int monthIndex = draft.schema().monthIndex(month);
            ranks.forEach((term, rank) -> draft.setRank(draft.rowOf(term), monthIndex, rank));
        });
        return draft.build();
    }

    /**
     * Rebuilds a table from persisted schema and rows, rejecting data that breaks the table invariants.
     *
     * @throws DataIntegrityException when a row key repeats or a row does not fit the schema
     */
    public static PivotTable restore(TableSchema schema, List<PivotRow> rows) {
        PivotTable table = new PivotTable(schema, rows);
        table.verifyInvariants();
        return table;
    }

    public TableSchema schema() {
        return schema;
    }

    public List<String> columns() {
        return schema.columns();
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasCategory(String category) {
        return schema.hasCategory(category);
    }

    public boolean hasMonth(MonthLabel month) {
        return schema.hasMonth(month);
    }

    public boolean hasRow(String searchTerm) {
        return rowIndex.containsKey(searchTerm);
    }

    public List<PivotRow> rows() {
        return rows;
    }

    public Optional<PivotRow> row(String searchTerm) {
        Integer index = rowIndex.get(searchTerm);
        return index == null ? Optional.empty() : Optional.of(rows.get(index));
    }

    public Set<String> searchTerms() {
        return rowIndex.keySet();
    }

    public List<String> orderedSearchTerms() {
        List<String> terms = new ArrayList<>(rows.size());
        for (PivotRow row : rows) {
            terms.add(row.searchTerm());
        }
        return terms;
    }

    /**
     * Presence flag (0 or 1) of the term in the category.
     *
     * @throws UnknownCategoryException when the category is not a column
     * @throws IllegalArgumentException when the term is not a row
     */
    public int presence(String searchTerm, String category) {
        int categoryIndex = schema.categoryIndex(category);
        if (categoryIndex < 0) {
            throw new UnknownCategoryException(category);
        }
        return requireRow(searchTerm).presenceFlag(categoryIndex);
    }

    /**
     * Rank of the term in the month, {@link #ABSENT_RANK} when none was recorded.
     */
    public int rank(String searchTerm, MonthLabel month) {
        int monthIndex = schema.monthIndex(month);
        if (monthIndex < 0) {
            throw new IllegalArgumentException("Month not present in table: " + month);
        }
        return requireRow(searchTerm).rank(monthIndex);
    }

    /**
     * Number of rows flagged present in the category.
     */
    public int keywordCount(String category) {
        int categoryIndex = schema.categoryIndex(category);
        if (categoryIndex < 0) {
            return 0;
        }
        int count = 0;
        for (PivotRow row : rows) {
            if (row.isPresent(categoryIndex)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Checks row shape, rank range, and that every recorded rank belongs to a row flagged present in at least
     * one category supplying that month.
     *
     * @throws DataIntegrityException naming the first offending row or month
     */
    public void verifyInvariants() {
        int categoryCount = schema.categories().size();
        int monthCount = schema.months().size();
        List<int[]> supplierIndexes = new ArrayList<>(monthCount);
        for (MonthLabel month : schema.months()) {
            Set<String> monthSuppliers = schema.suppliers(month);
            int[] indexes = new int[monthSuppliers.size()];
            int i = 0;
            for (String supplier : monthSuppliers) {
                indexes[i++] = schema.categoryIndex(supplier);
            }
            supplierIndexes.add(indexes);
        }

        for (PivotRow row : rows) {
            String term = row.searchTerm();
            if (term == null || term.isBlank() || !term.equals(term.trim())) {
                throw new DataIntegrityException("Search term is blank or not normalized: '" + term + "'", term);
            }
            if (row.categoryCount() != categoryCount || row.monthCount() != monthCount) {
                throw new DataIntegrityException("Row does not match table columns: " + term, term);
            }
            for (int c = 0; c < categoryCount; c++) {
                byte flag = row.presenceFlag(c);
                if (flag != 0 && flag != 1) {
                    throw new DataIntegrityException("Presence flag must be 0 or 1 for row: " + term, term);
                }
            }
            for (int m = 0; m < monthCount; m++) {
                int rank = row.rank(m);
                if (rank == ABSENT_RANK) {
                    continue;
                }
                MonthLabel month = schema.months().get(m);
                if (rank < MIN_RANK || rank > MAX_RANK) {
                    throw new DataIntegrityException(
                            "Rank " + rank + " out of range for " + term + " in " + month, term);
                }
                if (!presentInAny(row, supplierIndexes.get(m))) {
                    throw new DataIntegrityException(
                            "Rank recorded for " + term + " in " + month + " without a supplying category", term);
                }
            }
        }
    }

    private boolean presentInAny(PivotRow row, int[] categoryIndexes) {
        for (int categoryIndex : categoryIndexes) {
            if (row.isPresent(categoryIndex)) {
                return true;
            }
        }
        return false;
    }

    private PivotRow requireRow(String searchTerm) {
        Integer index = rowIndex.get(searchTerm);
        if (index == null) {
            throw new IllegalArgumentException("Search term not present in table: " + searchTerm);
        }
        return rows.get(index);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PivotTable that)) {
            return false;
        }
        return schema.equals(that.schema) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return 31 * schema.hashCode() + rows.hashCode();
    }

    @Override
    public String toString() {
        return "PivotTable[rows=" + rows.size() + ", columns=" + schema.columns() + "]";
    }
}
