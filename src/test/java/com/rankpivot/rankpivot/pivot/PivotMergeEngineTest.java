package com.rankpivot.rankpivot.pivot;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.rankpivot.rankpivot.pivot.PivotTableTest.month;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PivotMergeEngineTest {

    private static final MonthLabel MAY = MonthLabel.of(2025, 5);
    private static final MonthLabel JUNE = MonthLabel.of(2025, 6);
    private static final MonthLabel JULY = MonthLabel.of(2025, 7);

    private PivotMergeEngine engine;
    private PivotTable beauty;

    @BeforeEach
    void setUp() {
        engine = new PivotMergeEngine();
        beauty = PivotTable.create("Beauty", List.of(month(JUNE, "kw1", 10, "kw2", 20)));
    }

    @Test
    void shouldAddCategoryWithLastWriteWinsOnSharedMonth() {
        PivotTable merged = engine.addCategory(beauty, "Grocery", List.of(month(JUNE, "kw2", 5, "kw3", 30)));

        assertEquals(List.of("Search Term", "Beauty", "Grocery", "2025-06"), merged.columns());
        assertEquals(List.of("kw1", "kw2", "kw3"), merged.orderedSearchTerms());

        assertEquals(1, merged.presence("kw2", "Beauty"));
        assertEquals(1, merged.presence("kw2", "Grocery"));
        assertEquals(5, merged.rank("kw2", JUNE));

        assertEquals(0, merged.presence("kw3", "Beauty"));
        assertEquals(1, merged.presence("kw3", "Grocery"));
        assertEquals(30, merged.rank("kw3", JUNE));

        assertEquals(0, merged.presence("kw1", "Grocery"));
        assertEquals(10, merged.rank("kw1", JUNE));
        assertEquals(Set.of("Beauty", "Grocery"), merged.schema().suppliers(JUNE));
    }

    @Test
    void shouldDropTermsWhoseOnlyRankIsOutOfRange() {
        PivotTable merged = engine.addMonths(beauty, "Beauty", List.of(month(JULY, "kw4", 600_000)));

        assertFalse(merged.hasRow("kw4"));
        assertEquals(2, merged.rowCount());
        assertTrue(merged.hasMonth(JULY));
        assertEquals(PivotTable.ABSENT_RANK, merged.rank("kw1", JULY));
    }

    @Test
    void shouldRejectDuplicateCategory() {
        DuplicateCategoryException ex = assertThrows(DuplicateCategoryException.class,
                () -> engine.addCategory(beauty, "Beauty", List.of(month(JULY, "kw9", 1))));
        assertEquals("Beauty", ex.getIdentifier());
    }

    @Test
    void shouldRejectMonthsForUnknownCategory() {
        UnknownCategoryException ex = assertThrows(UnknownCategoryException.class,
                () -> engine.addMonths(beauty, "Grocery", List.of(month(JULY, "kw9", 1))));
        assertEquals("Grocery", ex.getIdentifier());
    }

    @Test
    void shouldLeaveInputTableUntouchedOnFailure() {
        PivotTable before = PivotTable.create("Beauty", List.of(month(JUNE, "kw1", 10, "kw2", 20)));

        assertThrows(DataIntegrityException.class,
                () -> engine.addMonths(beauty, "Beauty", List.of(month(JULY, "kw5", 1, "kw5", 2))));
        assertThrows(DataIntegrityException.class,
                () -> engine.addCategory(beauty, "Grocery", List.of(month(JULY, "a", 1), month(JULY, "b", 2))));

        assertEquals(before, beauty);
        assertFalse(beauty.hasCategory("Grocery"));
        assertFalse(beauty.hasMonth(JULY));
    }

    @Test
    void shouldBeIdempotentWhenReapplyingSameMonths() {
        PivotTable once = engine.addMonths(beauty, "Beauty", List.of(month(JULY, "kw1", 3, "kw6", 4)));
        PivotTable twice = engine.addMonths(once, "Beauty", List.of(month(JULY, "kw1", 3, "kw6", 4)));

        assertEquals(once, twice);
    }

    @Test
    void shouldNotBlankOtherCategoryCellsWhenRefreshingSharedMonth() {
        PivotTable merged = engine.addCategory(beauty, "Grocery", List.of(month(JUNE, "kw3", 30)));
        PivotTable refreshed = engine.addMonths(merged, "Grocery", List.of(month(JUNE, "kw7", 70)));

        assertEquals(10, refreshed.rank("kw1", JUNE));
        assertEquals(20, refreshed.rank("kw2", JUNE));
        assertEquals(30, refreshed.rank("kw3", JUNE));
        assertEquals(70, refreshed.rank("kw7", JUNE));
    }

    @Test
    void shouldInsertEarlierMonthInCalendarOrder() {
        PivotTable merged = engine.addMonths(beauty, "Beauty", List.of(month(JULY, "kw1", 1), month(MAY, "kw8", 8)));

        assertEquals(List.of("Search Term", "Beauty", "2025-05", "2025-06", "2025-07"), merged.columns());
        assertEquals(10, merged.rank("kw1", JUNE));
        assertEquals(1, merged.rank("kw1", JULY));
        assertEquals(8, merged.rank("kw8", MAY));
        assertEquals(1, merged.presence("kw8", "Beauty"));
    }

    @Test
    void shouldAppendNewTermsWithoutReorderingExistingRows() {
        PivotTable merged = engine.addCategory(beauty, "Grocery", List.of(
                month(JULY, "g2", 2, "kw1", 1),
                month(JUNE, "g1", 1)
        ));

        assertEquals(List.of("kw1", "kw2", "g1", "g2"), merged.orderedSearchTerms());
        assertEquals(Set.of("Beauty", "Grocery"), merged.schema().suppliers(JUNE));
        assertEquals(Set.of("Grocery"), merged.schema().suppliers(JULY));
    }
}
