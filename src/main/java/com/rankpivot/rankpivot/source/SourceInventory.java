package com.rankpivot.rankpivot.source;

import com.rankpivot.rankpivot.pivot.MonthLabel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Ranking files available for one country, at most one per (category, month).
 */
public final class SourceInventory {

    private final String country;
    private final Map<String, TreeMap<MonthLabel, SourceFile>> byCategory;

    public SourceInventory(String country, List<SourceFile> files) {
        this.country = country;
        Map<String, TreeMap<MonthLabel, SourceFile>> grouped = new LinkedHashMap<>();
        List<SourceFile> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(SourceFile::category).thenComparing(SourceFile::month));
        for (SourceFile file : sorted) {
            grouped.computeIfAbsent(file.category(), key -> new TreeMap<>()).putIfAbsent(file.month(), file);
        }
        this.byCategory = Collections.unmodifiableMap(grouped);
    }

    public static SourceInventory empty(String country) {
        return new SourceInventory(country, List.of());
    }

    public String country() {
        return country;
    }

    public Set<String> categories() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(byCategory.keySet()));
    }

    /**
     * Union of months across categories, ascending.
     */
    public Set<MonthLabel> months() {
        Set<MonthLabel> months = new TreeSet<>();
        byCategory.values().forEach(files -> months.addAll(files.keySet()));
        return months;
    }

    public List<MonthLabel> monthsFor(String category) {
        TreeMap<MonthLabel, SourceFile> files = byCategory.get(category);
        return files == null ? List.of() : List.copyOf(files.keySet());
    }

    public List<SourceFile> filesFor(String category) {
        TreeMap<MonthLabel, SourceFile> files = byCategory.get(category);
        return files == null ? List.of() : List.copyOf(files.values());
    }

    public Optional<SourceFile> file(String category, MonthLabel month) {
        TreeMap<MonthLabel, SourceFile> files = byCategory.get(category);
        return files == null ? Optional.empty() : Optional.ofNullable(files.get(month));
    }

    public List<SourceFile> files() {
        List<SourceFile> all = new ArrayList<>();
        byCategory.values().forEach(files -> all.addAll(files.values()));
        return all;
    }

    public boolean isEmpty() {
        return byCategory.isEmpty();
    }
}
