package com.rankpivot.rankpivot.plan;

import com.rankpivot.rankpivot.detect.TableDelta;
import com.rankpivot.rankpivot.pivot.MonthLabel;
import com.rankpivot.rankpivot.pivot.PivotMergeEngine;
import com.rankpivot.rankpivot.pivot.PivotTable;
import com.rankpivot.rankpivot.pivot.PivotTableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Update for one table, driven through {@code AWAITING_DECISION → PLAN_* → COMMITTED}.
 *
 * <p>{@link #decide(UpdateDecision)} fixes the operation list; {@link #execute} runs it once. New categories
 * always go before month additions. The first failing operation stops the plan and operations that already
 * completed stay committed.
 */
public final class UpdatePlan {

    private static final Logger log = LoggerFactory.getLogger(UpdatePlan.class);

    private final TableDelta delta;
    private PlanState state = PlanState.AWAITING_DECISION;
    private UpdateDecision decision;
    private List<MergeOperation> operations = List.of();

    UpdatePlan(TableDelta delta) {
        this.delta = delta;
    }

    public TableDelta delta() {
        return delta;
    }

    public PlanState state() {
        return state;
    }

    public UpdateDecision decision() {
        return decision;
    }

    public List<MergeOperation> operations() {
        return operations;
    }

    /**
     * Applies the caller's decision and builds the ordered operation list.
     *
     * @throws IllegalStateException when a decision was already taken
     */
    public UpdatePlan decide(UpdateDecision decision) {
        if (decision == null) {
            throw new IllegalArgumentException("decision is required");
        }
        if (state != PlanState.AWAITING_DECISION) {
            throw new IllegalStateException("Plan already decided: " + state);
        }
        List<MergeOperation> planned = new ArrayList<>();
        if (decision == UpdateDecision.CATEGORIES_ONLY || decision == UpdateDecision.BOTH) {
            for (Map.Entry<String, List<MonthLabel>> entry : delta.newCategoryMonths().entrySet()) {
                planned.add(new MergeOperation.AddCategory(entry.getKey(), entry.getValue()));
            }
        }
        if (decision == UpdateDecision.MONTHS_ONLY || decision == UpdateDecision.BOTH) {
            for (Map.Entry<String, List<MonthLabel>> entry : delta.pendingMonthsByCategory().entrySet()) {
                planned.add(new MergeOperation.AddMonths(entry.getKey(), entry.getValue()));
            }
        }
        this.decision = decision;
        this.operations = List.copyOf(planned);
        this.state = PlanState.forDecision(decision);
        return this;
    }

    /**
     * Runs the planned operations in order against {@code table}.
     *
     * @return the last good table with completed operations and, when one failed, that operation and its cause
     * @throws IllegalStateException when no decision was taken or the plan already ran
     */
    public PlanOutcome execute(PivotTable table, RankSource rankSource, PivotMergeEngine engine) {
        if (state == PlanState.AWAITING_DECISION) {
            throw new IllegalStateException("Plan has no decision yet");
        }
        if (state == PlanState.COMMITTED) {
            throw new IllegalStateException("Plan already executed");
        }

        PivotTable current = table;
        List<MergeOperation> completed = new ArrayList<>();
        try {
            for (MergeOperation operation : operations) {
                try {
                    current = operation.apply(current, rankSource, engine);
                    completed.add(operation);
                } catch (PivotTableException | IllegalStateException | IllegalArgumentException ex) {
                    log.warn("Update halted at '{}' after {} of {} operations: {}",
                            operation.describe(), completed.size(), operations.size(), ex.getMessage());
                    return new PlanOutcome(current, completed, operation, ex);
                }
            }
            return new PlanOutcome(current, completed, null, null);
        } finally {
            state = PlanState.COMMITTED;
        }
    }
}
