package com.rankpivot.rankpivot.plan;

import com.rankpivot.rankpivot.pivot.MonthLabel;
import com.rankpivot.rankpivot.pivot.MonthlyRanks;

import java.util.List;

/**
 * Loads the ranks a merge operation needs.
 */
public interface RankSource {

    List<MonthlyRanks> load(String category, List<MonthLabel> months);
}
