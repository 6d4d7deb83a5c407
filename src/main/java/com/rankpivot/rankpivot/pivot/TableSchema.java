package com.rankpivot.rankpivot.pivot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Column layout of a pivot table: categories in insertion order, months in calendar order, and which
 * categories have supplied each month. Immutable; the {@code with*} methods return widened copies.
 */
public final class TableSchema {

    public static final String SEARCH_TERM_COLUMN = "Search Term";

    private static final TableSchema EMPTY = new TableSchema(List.of(), List.of(), Map.of());

    private final List<String> categories;
    private final List<MonthLabel> months;
    private final Map<String, Integer> categoryIndex;
    private final Map<MonthLabel, Integer> monthIndex;
    private final Map<MonthLabel, Set<String>> suppliers;

    private TableSchema(List<String> categories, List<MonthLabel> months, Map<MonthLabel, Set<String>> suppliers) {
        this.categories = List.copyOf(categories);
        this.months = List.copyOf(months);

        Map<String, Integer> categoryPositions = new HashMap<>();
        for (int i = 0; i < this.categories.size(); i++) {
            if (categoryPositions.put(this.categories.get(i), i) != null) {
                throw new SchemaException("Duplicate category column: " + this.categories.get(i), this.categories.get(i));
            }
        }
        Map<MonthLabel, Integer> monthPositions = new HashMap<>();
        for (int i = 0; i < this.months.size(); i++) {
            MonthLabel month = this.months.get(i);
            if (i > 0 && this.months.get(i - 1).compareTo(month) >= 0) {
                throw new SchemaException("Month columns out of calendar order at: " + month, month.toString());
            }
            monthPositions.put(month, i);
        }
        this.categoryIndex = Collections.unmodifiableMap(categoryPositions);
        this.monthIndex = Collections.unmodifiableMap(monthPositions);

        Map<MonthLabel, Set<String>> supplierCopy = new LinkedHashMap<>();
        for (MonthLabel month : this.months) {
            Set<String> monthSuppliers = suppliers.getOrDefault(month, Set.of());
            for (String category : monthSuppliers) {
                if (!categoryPositions.containsKey(category)) {
                    throw new SchemaException("Month " + month + " supplied by unknown category: " + category, category);
                }
            }
            supplierCopy.put(month, Collections.unmodifiableSet(new LinkedHashSet<>(monthSuppliers)));
        }
        this.suppliers = Collections.unmodifiableMap(supplierCopy);
    }

    public static TableSchema empty() {
        return EMPTY;
    }

    /**
     * Builds a schema from persisted metadata. Months are sorted; categories keep the given order.
     */
    public static TableSchema of(List<String> categories, Iterable<MonthLabel> months, Map<MonthLabel, Set<String>> suppliers) {
        List<MonthLabel> sorted = new ArrayList<>(new TreeSet<>(toList(months)));
        return new TableSchema(categories, sorted, suppliers == null ? Map.of() : suppliers);
    }

    public List<String> categories() {
        return categories;
    }

    public List<MonthLabel> months() {
        return months;
    }

    public boolean hasCategory(String category) {
        return categoryIndex.containsKey(category);
    }

    public boolean hasMonth(MonthLabel month) {
        return monthIndex.containsKey(month);
    }

    /**
     * Position of the category among category columns, or -1.
     */
    public int categoryIndex(String category) {
        return categoryIndex.getOrDefault(category, -1);
    }

    /**
     * Position of the month among month columns, or -1.
     */
    public int monthIndex(MonthLabel month) {
        return monthIndex.getOrDefault(month, -1);
    }

    public Set<String> suppliers(MonthLabel month) {
        return suppliers.getOrDefault(month, Set.of());
    }

    public Map<MonthLabel, Set<String>> suppliers() {
        return suppliers;
    }

    public Set<MonthLabel> monthsSuppliedBy(String category) {
        Set<MonthLabel> supplied = new TreeSet<>();
        suppliers.forEach((month, monthSuppliers) -> {
            if (monthSuppliers.contains(category)) {
                supplied.add(month);
            }
        });
        return supplied;
    }

    public int columnCount() {
        return 1 + categories.size() + months.size();
    }

    /**
     * Header order: search term, categories in insertion order, months ascending.
     */
    public List<String> columns() {
        List<String> columns = new ArrayList<>(columnCount());
        columns.add(SEARCH_TERM_COLUMN);
        columns.addAll(categories);
        for (MonthLabel month : months) {
            columns.add(month.toString());
        }
        return columns;
    }

    TableSchema withCategory(String category) {
        List<String> widened = new ArrayList<>(categories);
        widened.add(category);
        return new TableSchema(widened, months, suppliers);
    }

    TableSchema withMonth(MonthLabel month) {
        if (hasMonth(month)) {
            return this;
        }
        List<MonthLabel> widened = new ArrayList<>(months);
        widened.add(insertionPoint(month), month);
        return new TableSchema(categories, widened, suppliers);
    }

    TableSchema withSupplier(MonthLabel month, String category) {
        if (suppliers(month).contains(category)) {
            return this;
        }
        Map<MonthLabel, Set<String>> widened = new LinkedHashMap<>(suppliers);
        Set<String> monthSuppliers = new LinkedHashSet<>(suppliers(month));
        monthSuppliers.add(category);
        widened.put(month, monthSuppliers);
        return new TableSchema(categories, months, widened);
    }

    /**
     * Index at which {@code month} sits (or would be inserted) among the sorted month columns.
     */
    int insertionPoint(MonthLabel month) {
        int position = Collections.binarySearch(months, month);
        return position >= 0 ? position : -(position + 1);
    }

    private static List<MonthLabel> toList(Iterable<MonthLabel> months) {
        List<MonthLabel> list = new ArrayList<>();
        if (months != null) {
            months.forEach(list::add);
        }
        return list;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TableSchema that)) {
            return false;
        }
        return categories.equals(that.categories) && months.equals(that.months) && suppliers.equals(that.suppliers);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * categories.hashCode() + months.hashCode()) + suppliers.hashCode();
    }

    @Override
    public String toString() {
        return "TableSchema" + columns();
    }
}
