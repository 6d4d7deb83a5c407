package com.rankpivot.rankpivot.pivot;

public class DuplicateCategoryException extends PivotTableException {

    public DuplicateCategoryException(String category) {
        super("Category already present in table: " + category, category);
    }
}
