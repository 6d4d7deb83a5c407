package com.rankpivot.rankpivot.pivot;

/**
 * Base failure of a pivot table operation. Carries the category name, month label or search term at fault.
 */
public abstract class PivotTableException extends RuntimeException {

    private final String identifier;

    protected PivotTableException(String message, String identifier) {
        super(message);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
