package com.rankpivot.rankpivot.pivot;

/**
 * One search term with its rank in a monthly export.
 */
public record RankEntry(String searchTerm, int rank) {
}
