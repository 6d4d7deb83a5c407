package com.rankpivot.rankpivot.detect;

import com.rankpivot.rankpivot.source.SourceFile;

import java.util.Set;

/**
 * Supplies the search terms of one source file for keyword estimates.
 */
@FunctionalInterface
public interface TermSetLoader {

    Set<String> load(SourceFile sourceFile);
}
