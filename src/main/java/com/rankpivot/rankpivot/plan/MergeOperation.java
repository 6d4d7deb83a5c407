package com.rankpivot.rankpivot.plan;

import com.rankpivot.rankpivot.pivot.MonthLabel;
import com.rankpivot.rankpivot.pivot.PivotMergeEngine;
import com.rankpivot.rankpivot.pivot.PivotTable;

import java.util.List;

/**
 * One planned call into the merge engine.
 */
public interface MergeOperation {

    String category();

    List<MonthLabel> months();

    PivotTable apply(PivotTable table, RankSource rankSource, PivotMergeEngine engine);

    String describe();

    record AddCategory(String category, List<MonthLabel> months) implements MergeOperation {

        public AddCategory {
            months = List.copyOf(months);
        }

        @Override
        public PivotTable apply(PivotTable table, RankSource rankSource, PivotMergeEngine engine) {
            return engine.addCategory(table, category, rankSource.load(category, months));
        }

        @Override
        public String describe() {
            return "add category " + category + " " + months;
        }
    }

    record AddMonths(String category, List<MonthLabel> months) implements MergeOperation {

        public AddMonths {
            months = List.copyOf(months);
        }

        @Override
        public PivotTable apply(PivotTable table, RankSource rankSource, PivotMergeEngine engine) {
            return engine.addMonths(table, category, rankSource.load(category, months));
        }

        @Override
        public String describe() {
            return "add months " + months + " to " + category;
        }
    }
}
