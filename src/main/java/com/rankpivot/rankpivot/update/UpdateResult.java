package com.rankpivot.rankpivot.update;

import java.util.List;

/**
 * Outcome of one update request for a country.
 */
public record UpdateResult(
        Long runId,
        String country,
        String decision,
        String createdFromAnchor,
        List<String> operationsApplied,
        int rowsBefore,
        int rowsAfter,
        int columnsAfter,
        String status,
        String failureReason
) {

    public UpdateResult {
        operationsApplied = operationsApplied == null ? List.of() : List.copyOf(operationsApplied);
    }
}
