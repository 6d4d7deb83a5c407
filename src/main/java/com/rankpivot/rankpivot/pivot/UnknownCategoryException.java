package com.rankpivot.rankpivot.pivot;

public class UnknownCategoryException extends PivotTableException {

    public UnknownCategoryException(String category) {
        super("Category not present in table: " + category, category);
    }
}
