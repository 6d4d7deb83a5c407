package com.rankpivot.rankpivot.pivot;

import java.util.Arrays;

/**
 * Fixed-shape row of a pivot table. Presence flags and ranks are positional against the owning table's schema.
 */
public final class PivotRow {

    private final String searchTerm;
    private final byte[] presence;
    private final int[] ranks;

    public PivotRow(String searchTerm, byte[] presence, int[] ranks) {
        this.searchTerm = searchTerm;
        this.presence = presence.clone();
        this.ranks = ranks.clone();
    }

    public String searchTerm() {
        return searchTerm;
    }

    public int categoryCount() {
        return presence.length;
    }

    public int monthCount() {
        return ranks.length;
    }

    public boolean isPresent(int categoryIndex) {
        return presence[categoryIndex] == 1;
    }

    public byte presenceFlag(int categoryIndex) {
        return presence[categoryIndex];
    }

    /**
     * Rank at the month position, {@link PivotTable#ABSENT_RANK} when none was recorded.
     */
    public int rank(int monthIndex) {
        return ranks[monthIndex];
    }

    byte[] presenceCopy() {
        return presence.clone();
    }

    int[] ranksCopy() {
        return ranks.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PivotRow that)) {
            return false;
        }
        return searchTerm.equals(that.searchTerm)
                && Arrays.equals(presence, that.presence)
                && Arrays.equals(ranks, that.ranks);
    }

    @Override
    public int hashCode() {
        int result = searchTerm.hashCode();
        result = 31 * result + Arrays.hashCode(presence);
        return 31 * result + Arrays.hashCode(ranks);
    }

    @Override
    public String toString() {
        return searchTerm + Arrays.toString(presence) + Arrays.toString(ranks);
    }
}
