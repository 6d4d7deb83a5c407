package com.rankpivot.rankpivot.source;

import com.rankpivot.rankpivot.pivot.MonthLabel;
import com.rankpivot.rankpivot.pivot.MonthlyRanks;
import com.rankpivot.rankpivot.plan.RankSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the ranking files of a scanned inventory on demand.
 */
public class InventoryRankSource implements RankSource {

    private final SourceInventory inventory;
    private final RankFileReader rankFileReader;

    public InventoryRankSource(SourceInventory inventory, RankFileReader rankFileReader) {
        this.inventory = inventory;
        this.rankFileReader = rankFileReader;
    }

    @Override
    public List<MonthlyRanks> load(String category, List<MonthLabel> months) {
        List<MonthlyRanks> loaded = new ArrayList<>(months.size());
        for (MonthLabel month : months) {
            SourceFile file = inventory.file(category, month).orElseThrow(() -> new IllegalStateException(
                    "No ranking file for " + category + " " + month + " in " + inventory.country()));
            loaded.add(rankFileReader.read(file));
        }
        return loaded;
    }

    public List<String> fileNames(String category, List<MonthLabel> months) {
        List<String> names = new ArrayList<>(months.size());
        for (MonthLabel month : months) {
            inventory.file(category, month).ifPresent(file -> names.add(file.fileName()));
        }
        return names;
    }
}
