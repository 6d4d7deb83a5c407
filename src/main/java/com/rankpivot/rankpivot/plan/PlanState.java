package com.rankpivot.rankpivot.plan;

public enum PlanState {
    AWAITING_DECISION,
    PLAN_MONTHS_ONLY,
    PLAN_CATEGORIES_ONLY,
    PLAN_BOTH,
    PLAN_NONE,
    COMMITTED;

    static PlanState forDecision(UpdateDecision decision) {
        return switch (decision) {
            case MONTHS_ONLY -> PLAN_MONTHS_ONLY;
            case CATEGORIES_ONLY -> PLAN_CATEGORIES_ONLY;
            case BOTH -> PLAN_BOTH;
            case NONE -> PLAN_NONE;
        };
    }
}
