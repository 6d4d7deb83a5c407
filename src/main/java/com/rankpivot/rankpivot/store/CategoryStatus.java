package com.rankpivot.rankpivot.store;

import java.util.List;

/**
 * Processing state of one category of a country's table.
 */
public record CategoryStatus(
        String category,
        String status,
        List<String> filesProcessed,
        List<String> filesAvailable,
        int keywordCount,
        Long lastProcessed
) {

    public CategoryStatus {
        filesProcessed = filesProcessed == null ? List.of() : List.copyOf(filesProcessed);
        filesAvailable = filesAvailable == null ? List.of() : List.copyOf(filesAvailable);
    }
}
