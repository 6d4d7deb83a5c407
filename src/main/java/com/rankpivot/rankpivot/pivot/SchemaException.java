package com.rankpivot.rankpivot.pivot;

/**
 * Malformed anchor data or column name when building a table.
 */
public class SchemaException extends PivotTableException {

    public SchemaException(String message, String identifier) {
        super(message, identifier);
    }
}
