package com.rankpivot.rankpivot.pivot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Private working copy a merge writes into. Only {@link #build()} produces a visible table, so a failed merge
 * leaves its input untouched.
 */
final class TableDraft {

    private TableSchema schema;
    private final List<String> terms;
    private final Map<String, Integer> rowIndex;
    private final List<byte[]> presence;
    private final List<int[]> ranks;

    private TableDraft(TableSchema schema, int expectedRows) {
        this.schema = schema;
        this.terms = new ArrayList<>(expectedRows);
        this.rowIndex = new HashMap<>(Math.max(16, expectedRows * 2));
        this.presence = new ArrayList<>(expectedRows);
        this.ranks = new ArrayList<>(expectedRows);
    }

    static TableDraft empty() {
        return new TableDraft(TableSchema.empty(), 0);
    }

    static TableDraft copyOf(PivotTable table) {
        TableDraft draft = new TableDraft(table.schema(), table.rowCount());
        for (PivotRow row : table.rows()) {
            draft.rowIndex.put(row.searchTerm(), draft.terms.size());
            draft.terms.add(row.searchTerm());
            draft.presence.add(row.presenceCopy());
            draft.ranks.add(row.ranksCopy());
        }
        return draft;
    }

    TableSchema schema() {
        return schema;
    }

    int rowCount() {
        return terms.size();
    }

    int addCategory(String category) {
        schema = schema.withCategory(category);
        for (int i = 0; i < presence.size(); i++) {
            byte[] flags = presence.get(i);
            presence.set(i, Arrays.copyOf(flags, flags.length + 1));
        }
        return schema.categoryIndex(category);
    }

    /**
     * Index of the month column, inserting it at its calendar position with absent cells when missing.
     */
    int ensureMonth(MonthLabel month) {
        int existing = schema.monthIndex(month);
        if (existing >= 0) {
            return existing;
        }
        int position = schema.insertionPoint(month);
        schema = schema.withMonth(month);
        for (int i = 0; i < ranks.size(); i++) {
            int[] current = ranks.get(i);
            int[] widened = new int[current.length + 1];
            System.arraycopy(current, 0, widened, 0, position);
            widened[position] = PivotTable.ABSENT_RANK;
            System.arraycopy(current, position, widened, position + 1, current.length - position);
            ranks.set(i, widened);
        }
        return position;
    }

    void addSupplier(MonthLabel month, String category) {
        schema = schema.withSupplier(month, category);
    }

    int rowOf(String term) {
        return rowIndex.getOrDefault(term, -1);
    }

    /**
     * Row index of the term, appending an empty row at the end when it is new.
     */
    int ensureRow(String term) {
        Integer existing = rowIndex.get(term);
        if (existing != null) {
            return existing;
        }
        int index = terms.size();
        rowIndex.put(term, index);
        terms.add(term);
        presence.add(new byte[schema.categories().size()]);
        ranks.add(new int[schema.months().size()]);
        return index;
    }

    void markPresent(int row, int categoryIndex) {
        presence.get(row)[categoryIndex] = 1;
    }

    void setRank(int row, int monthIndex, int rank) {
        ranks.get(row)[monthIndex] = rank;
    }

    PivotTable build() {
        List<PivotRow> rows = new ArrayList<>(terms.size());
        for (int i = 0; i < terms.size(); i++) {
            rows.add(new PivotRow(terms.get(i), presence.get(i), ranks.get(i)));
        }
        return PivotTable.restore(schema, rows);
    }
}
