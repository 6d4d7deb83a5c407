package com.rankpivot.rankpivot.update;

import java.util.List;

/**
 * Shape of a country's table as recorded in metadata.
 */
public record TableInfo(
        String country,
        boolean tableFileExists,
        int keywordCount,
        int columnCount,
        List<String> categories,
        List<String> months,
        String filePath
) {
}
