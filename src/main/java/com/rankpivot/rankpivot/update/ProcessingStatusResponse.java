package com.rankpivot.rankpivot.update;

import com.rankpivot.rankpivot.source.CategoryFileSummary;
import com.rankpivot.rankpivot.store.CategoryStatus;
import com.rankpivot.rankpivot.store.ProcessingSummary;

import java.util.List;

public record ProcessingStatusResponse(
        String country,
        ProcessingSummary summary,
        List<CategoryStatus> categories,
        List<CategoryFileSummary> files
) {
}
