package com.rankpivot.rankpivot.detect;

import com.rankpivot.rankpivot.pivot.MonthLabel;
import com.rankpivot.rankpivot.pivot.TableSchema;
import com.rankpivot.rankpivot.source.SourceFile;
import com.rankpivot.rankpivot.source.SourceInventory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Works out what a set of discovered source files would add to a table, from the table's schema and keyword
 * set alone. Never reads or changes cell data.
 */
@Component
public class ChangeDetector {

    /**
     * Computes the delta between the schema and the available sources.
     *
     * <p>The keyword estimate only loads files that the delta would merge (new categories and pending months).
     * Files already merged can only hold terms that are rows already or were dropped by rank filtering, so the
     * result stays an upper bound.
     *
     * @param knownKeywords current row keys of the table
     * @param termLoader    supplies the search terms of one file
     */
    public TableDelta detectChanges(
            TableSchema schema,
            Set<String> knownKeywords,
            SourceInventory sources,
            TermSetLoader termLoader
    ) {
        Set<MonthLabel> newMonths = new TreeSet<>(sources.months());
        newMonths.removeAll(schema.months());

        Map<String, List<MonthLabel>> newCategoryMonths = new LinkedHashMap<>();
        Map<String, List<MonthLabel>> pendingMonths = new LinkedHashMap<>();
        List<SourceFile> unmerged = new ArrayList<>();

        for (String category : sources.categories()) {
            if (!schema.hasCategory(category)) {
                newCategoryMonths.put(category, sources.monthsFor(category));
                unmerged.addAll(sources.filesFor(category));
                continue;
            }
            Set<MonthLabel> supplied = schema.monthsSuppliedBy(category);
            List<MonthLabel> pending = new ArrayList<>();
            for (MonthLabel month : sources.monthsFor(category)) {
                if (!supplied.contains(month)) {
                    pending.add(month);
                    sources.file(category, month).ifPresent(unmerged::add);
                }
            }
            if (!pending.isEmpty()) {
                pendingMonths.put(category, pending);
            }
        }

        return new TableDelta(newMonths, newCategoryMonths, pendingMonths,
                estimateNewKeywords(knownKeywords, unmerged, termLoader));
    }

    private int estimateNewKeywords(Set<String> knownKeywords, List<SourceFile> unmerged, TermSetLoader termLoader) {
        if (termLoader == null || unmerged.isEmpty()) {
            return 0;
        }
        Set<String> candidates = new HashSet<>();
        for (SourceFile file : unmerged) {
            for (String term : termLoader.load(file)) {
                if (!knownKeywords.contains(term)) {
                    candidates.add(term);
                }
            }
        }
        return candidates.size();
    }
}
