package com.rankpivot.rankpivot.plan;

import com.rankpivot.rankpivot.pivot.PivotTable;

import java.util.List;
import java.util.Optional;

/**
 * Result of executing a plan: the last successfully committed table, the operations that completed, and the
 * operation that stopped the plan, if any.
 */
public record PlanOutcome(
        PivotTable table,
        List<MergeOperation> completed,
        MergeOperation failedOperation,
        RuntimeException failure
) {

    public PlanOutcome {
        completed = List.copyOf(completed);
    }

    public boolean succeeded() {
        return failure == null;
    }

    public Optional<RuntimeException> failureCause() {
        return Optional.ofNullable(failure);
    }
}
