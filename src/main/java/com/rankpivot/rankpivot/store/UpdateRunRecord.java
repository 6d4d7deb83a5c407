package com.rankpivot.rankpivot.store;

/**
 * One recorded update attempt for a country's table.
 */
public record UpdateRunRecord(
        long runId,
        String country,
        String decision,
        long runDatetime,
        int operationsApplied,
        int rowsBefore,
        int rowsAfter,
        String status,
        String failureReason
) {
}
