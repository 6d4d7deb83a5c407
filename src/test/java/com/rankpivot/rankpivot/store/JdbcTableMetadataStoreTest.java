package com.rankpivot.rankpivot.store;

import com.rankpivot.rankpivot.pivot.MonthLabel;
import com.rankpivot.rankpivot.pivot.MonthlyRanks;
import com.rankpivot.rankpivot.pivot.PivotMergeEngine;
import com.rankpivot.rankpivot.pivot.PivotTable;
import com.rankpivot.rankpivot.pivot.RankEntry;
import com.rankpivot.rankpivot.pivot.TableSchema;
import com.rankpivot.rankpivot.update.PivotConstants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class JdbcTableMetadataStoreTest {

    private static final MonthLabel JUNE = MonthLabel.of(2025, 6);
    private static final MonthLabel JULY = MonthLabel.of(2025, 7);

    @Autowired
    private JdbcTableMetadataStore metadataStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetTables() {
        jdbcTemplate.execute("DELETE FROM " + PivotConstants.TABLE_COLUMN);
        jdbcTemplate.execute("DELETE FROM " + PivotConstants.TABLE_MONTH_SUPPLIER);
        jdbcTemplate.execute("DELETE FROM " + PivotConstants.TABLE_KEYWORD);
        jdbcTemplate.execute("DELETE FROM " + PivotConstants.TABLE_CATEGORY_STATUS);
        jdbcTemplate.execute("DELETE FROM " + PivotConstants.TABLE_UPDATE_RUN);
    }

    @Test
    void shouldRoundTripSchemaAndKeywords() {
        PivotTable table = table();

        metadataStore.saveSchema("us", table);

        TableSchema loaded = metadataStore.loadSchema("US").orElseThrow();
        assertEquals(table.schema(), loaded);
        assertEquals(Set.of("Grocery"), loaded.suppliers(JULY));
        assertEquals(Set.of("kw1", "kw2", "kw3"), metadataStore.loadKeywords("US"));
    }

    @Test
    void shouldReplaceLayoutOnSecondSave() {
        PivotTable beauty = anchor();
        metadataStore.saveSchema("US", beauty);
        metadataStore.saveSchema("US", table());

        assertEquals(List.of("Beauty", "Grocery"), metadataStore.loadSchema("US").orElseThrow().categories());
        assertEquals(3, metadataStore.loadKeywords("US").size());
    }

    @Test
    void shouldKeepPreviousLayoutWhenSaveFails() {
        metadataStore.saveSchema("US", anchor());
        PivotTable oversized = new PivotMergeEngine().addCategory(anchor(), "Grocery", List.of(new MonthlyRanks(JULY,
                List.of(new RankEntry("x".repeat(2000), 5)))));

        assertThrows(DataAccessException.class, () -> metadataStore.saveSchema("US", oversized));

        assertEquals(anchor().schema(), metadataStore.loadSchema("US").orElseThrow());
        assertEquals(Set.of("kw1", "kw2"), metadataStore.loadKeywords("US"));
    }

    @Test
    void shouldReturnEmptyForUnknownCountry() {
        assertTrue(metadataStore.loadSchema("CANADA").isEmpty());
        assertTrue(metadataStore.loadKeywords("CANADA").isEmpty());
    }

    @Test
    void shouldTrackCategoryStatus() {
        metadataStore.markCategoryPending("US", "Grocery", List.of("2025-July.csv"));
        metadataStore.markCategoryProcessed("US", "Beauty", List.of("2025-June.csv"), 2);

        ProcessingSummary pending = metadataStore.processingSummary("US");
        assertEquals(2, pending.totalCategories());
        assertEquals(List.of("Beauty"), pending.processedCategories());
        assertEquals(List.of("Grocery"), pending.pendingCategories());
        assertEquals(50.0, pending.completionPercentage());

        metadataStore.markCategoryProcessed("US", "Grocery", List.of("2025-July.csv"), 2);
        metadataStore.markCategoryProcessed("US", "Beauty", List.of("2025-June.csv", "2025-July.csv"), 3);

        List<CategoryStatus> statuses = metadataStore.categoryStatuses("US");
        CategoryStatus beauty = statuses.get(0);
        assertEquals("Beauty", beauty.category());
        assertEquals(PivotConstants.STATUS_PROCESSED, beauty.status());
        assertEquals(List.of("2025-June.csv", "2025-July.csv"), beauty.filesProcessed());
        assertEquals(3, beauty.keywordCount());
        assertNotNull(beauty.lastProcessed());
        assertEquals(100.0, metadataStore.processingSummary("US").completionPercentage());
    }

    @Test
    void shouldRecordRunsNewestFirst() {
        long first = metadataStore.recordRun("US", "BOTH", 2, 0, 10, PivotConstants.RUN_STATUS_COMMITTED, null);
        long second = metadataStore.recordRun("US", "MONTHS_ONLY", 0, 10, 10, PivotConstants.RUN_STATUS_FAILED,
                "add months [2025-07] to Beauty: missing file");

        assertNotEquals(first, second);
        List<UpdateRunRecord> history = metadataStore.runHistory("US");
        assertEquals(2, history.size());
        assertEquals(second, history.get(0).runId());
        assertEquals("add months [2025-07] to Beauty: missing file", history.get(0).failureReason());
        assertNull(history.get(1).failureReason());
        assertTrue(metadataStore.runHistory("CANADA").isEmpty());
    }

    private static PivotTable anchor() {
        return PivotTable.create("Beauty", List.of(new MonthlyRanks(JUNE, List.of(
                new RankEntry("kw1", 10), new RankEntry("kw2", 20)))));
    }

    private static PivotTable table() {
        return new PivotMergeEngine().addCategory(anchor(), "Grocery", List.of(new MonthlyRanks(JULY,
                List.of(new RankEntry("kw2", 5), new RankEntry("kw3", 30)))));
    }
}
