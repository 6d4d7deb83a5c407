package com.rankpivot.rankpivot.pivot;

/**
 * Source data or a merge result that would break row-key uniqueness, column order or cell ownership.
 */
public class DataIntegrityException extends PivotTableException {

    public DataIntegrityException(String message, String identifier) {
        super(message, identifier);
    }
}
