package com.rankpivot.rankpivot.plan;

import com.rankpivot.rankpivot.detect.TableDelta;
import org.springframework.stereotype.Component;

/**
 * Opens update plans for detected deltas.
 */
@Component
public class UpdatePlanner {

    public UpdatePlan plan(TableDelta delta) {
        return new UpdatePlan(delta == null ? TableDelta.none() : delta);
    }

    /**
     * Shortcut for {@code plan(delta).decide(decision)}.
     */
    public UpdatePlan plan(TableDelta delta, UpdateDecision decision) {
        return plan(delta).decide(decision);
    }
}
