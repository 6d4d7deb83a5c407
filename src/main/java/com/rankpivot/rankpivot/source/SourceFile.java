package com.rankpivot.rankpivot.source;

import com.rankpivot.rankpivot.pivot.MonthLabel;

import java.nio.file.Path;

/**
 * One monthly ranking export discovered under {@code <dataRoot>/<country>/<category>/}.
 */
public record SourceFile(String category, MonthLabel month, Path path, long sizeBytes) {

    public String fileName() {
        return path.getFileName().toString();
    }
}
