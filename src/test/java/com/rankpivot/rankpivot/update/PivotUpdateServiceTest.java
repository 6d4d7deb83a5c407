package com.rankpivot.rankpivot.update;

import com.rankpivot.rankpivot.pivot.MonthLabel;
import com.rankpivot.rankpivot.pivot.PivotTable;
import com.rankpivot.rankpivot.plan.UpdateDecision;
import com.rankpivot.rankpivot.store.CategoryStatus;
import com.rankpivot.rankpivot.store.JdbcTableMetadataStore;
import com.rankpivot.rankpivot.store.PivotTableCsvStore;
import com.rankpivot.rankpivot.store.UpdateRunRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class PivotUpdateServiceTest {

    private static final MonthLabel JUNE = MonthLabel.of(2025, 6);
    private static final MonthLabel JULY = MonthLabel.of(2025, 7);

    @Autowired
    private PivotUpdateService pivotUpdateService;

    @Autowired
    private PivotTableCsvStore tableStore;

    @Autowired
    private JdbcTableMetadataStore metadataStore;

    @Autowired
    private PivotProperties pivotProperties;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetState() throws IOException {
        FileSystemUtils.deleteRecursively(Paths.get(pivotProperties.getDataRoot()));
        FileSystemUtils.deleteRecursively(Paths.get(pivotProperties.getOutputDir()));
        Files.createDirectories(Paths.get(pivotProperties.getDataRoot()));
        jdbcTemplate.execute("DELETE FROM " + PivotConstants.TABLE_COLUMN);
        jdbcTemplate.execute("DELETE FROM " + PivotConstants.TABLE_MONTH_SUPPLIER);
        jdbcTemplate.execute("DELETE FROM " + PivotConstants.TABLE_KEYWORD);
        jdbcTemplate.execute("DELETE FROM " + PivotConstants.TABLE_CATEGORY_STATUS);
        jdbcTemplate.execute("DELETE FROM " + PivotConstants.TABLE_UPDATE_RUN);
    }

    @Test
    void shouldCreateTableFromAnchorAndMergeNewCategory() throws IOException {
        rankFile("US", "Beauty", "2025-June.csv", "kw1,10", "kw2,20");
        rankFile("US", "Grocery", "2025-June.csv", "kw2,5", "kw3,30");

        UpdateResult result = pivotUpdateService.update("us", UpdateDecision.BOTH);

        assertEquals("US", result.country());
        assertEquals("Beauty", result.createdFromAnchor());
        assertEquals(PivotConstants.RUN_STATUS_COMMITTED, result.status());
        assertEquals(2, result.operationsApplied().size());
        assertEquals(0, result.rowsBefore());
        assertEquals(3, result.rowsAfter());

        PivotTable table = tableStore.load("US", metadataStore.loadSchema("US").orElse(null)).orElseThrow();
        assertEquals(List.of("Search Term", "Beauty", "Grocery", "2025-06"), table.columns());
        assertEquals(5, table.rank("kw2", JUNE));
        assertEquals(0, table.presence("kw3", "Beauty"));

        assertFalse(pivotUpdateService.analyzeChanges("US").hasChanges());
        assertEquals(100.0, pivotUpdateService.processingStatus("US").summary().completionPercentage());
    }

    @Test
    void shouldDetectAndApplyNewMonth() throws IOException {
        rankFile("US", "Beauty", "2025-June.csv", "kw1,10", "kw2,20");
        pivotUpdateService.update("US", UpdateDecision.BOTH);
        rankFile("US", "Beauty", "US_Top_search_terms_Simple_Month_2025_07_31.csv", "kw1,3", "kw4,600000", "kw5,7");

        ChangeReport report = pivotUpdateService.analyzeChanges("US");
        assertEquals(List.of("2025-07"), report.newMonths());
        assertEquals(Map.of("Beauty", List.of("2025-07")), report.pendingMonths());
        assertEquals(2, report.newKeywordsEstimate());
        assertTrue(report.report().contains("New months (1): 2025-07"));
        assertEquals(PivotConstants.STATUS_PENDING, status("US", "Beauty").status());

        UpdateResult result = pivotUpdateService.update("US", UpdateDecision.MONTHS_ONLY);

        assertEquals(PivotConstants.RUN_STATUS_COMMITTED, result.status());
        assertEquals(2, result.rowsBefore());
        assertEquals(3, result.rowsAfter());
        PivotTable table = tableStore.load("US", metadataStore.loadSchema("US").orElse(null)).orElseThrow();
        assertEquals(3, table.rank("kw1", JULY));
        assertFalse(table.hasRow("kw4"));
        CategoryStatus beauty = status("US", "Beauty");
        assertEquals(PivotConstants.STATUS_PROCESSED, beauty.status());
        assertEquals(2, beauty.filesProcessed().size());
    }

    @Test
    void shouldLeaveNewCategoryPendingForMonthsOnlyDecision() throws IOException {
        rankFile("US", "Beauty", "2025-June.csv", "kw1,10");
        pivotUpdateService.update("US", UpdateDecision.BOTH);
        rankFile("US", "Grocery", "2025-June.csv", "kw2,5");

        UpdateResult result = pivotUpdateService.update("US", UpdateDecision.MONTHS_ONLY);

        assertTrue(result.operationsApplied().isEmpty());
        assertEquals(List.of("Beauty"), pivotUpdateService.tableInfo("US").categories());
        assertEquals(PivotConstants.STATUS_PENDING, status("US", "Grocery").status());
    }

    @Test
    void shouldNotCreateTableForNoneDecision() throws IOException {
        rankFile("US", "Beauty", "2025-June.csv", "kw1,10");

        UpdateResult result = pivotUpdateService.update("US", UpdateDecision.NONE);

        assertTrue(result.operationsApplied().isEmpty());
        assertFalse(tableStore.exists("US"));
        assertFalse(pivotUpdateService.tableInfo("US").tableFileExists());
    }

    @Test
    void shouldHaltOnBrokenSourceAndRecordFailedRun() throws IOException {
        rankFile("US", "Beauty", "2025-June.csv", "kw1,10");
        pivotUpdateService.update("US", UpdateDecision.BOTH);
        rankFile("US", "Beauty", "2025-July.csv", "kw1,4");
        Path broken = Paths.get(pivotProperties.getDataRoot(), "US", "Toys", "2025-July.csv");
        Files.createDirectories(broken.getParent());
        Files.write(broken, List.of("Search Term,Clicks", "kw9,1"), StandardCharsets.UTF_8);

        UpdateResult result = pivotUpdateService.update("US", UpdateDecision.BOTH);

        assertEquals(PivotConstants.RUN_STATUS_FAILED, result.status());
        assertTrue(result.failureReason().contains("Toys"));
        assertTrue(result.operationsApplied().isEmpty());
        PivotTable table = tableStore.load("US", metadataStore.loadSchema("US").orElse(null)).orElseThrow();
        assertFalse(table.hasMonth(JULY));

        List<UpdateRunRecord> runs = pivotUpdateService.runHistory("US");
        assertEquals(2, runs.size());
        assertEquals(PivotConstants.RUN_STATUS_FAILED, runs.get(0).status());
    }

    @Test
    void shouldKeepCompletedMergesWhenRankFileBreaksMidPlan() throws IOException {
        rankFile("US", "Beauty", "2025-June.csv", "kw1,10");
        pivotUpdateService.update("US", UpdateDecision.BOTH);
        rankFile("US", "Grocery", "2025-June.csv", "g1,1", "kw1,2");
        rankFile("US", "Beauty", "2025-July.csv", "kw1,4", "kw2,\"unterminated");

        UpdateResult result = pivotUpdateService.update("US", UpdateDecision.BOTH);

        assertEquals(PivotConstants.RUN_STATUS_FAILED, result.status());
        assertEquals(1, result.operationsApplied().size());
        assertTrue(result.failureReason().contains("Beauty"));
        assertTrue(result.failureReason().contains("2025-July.csv"));
        assertEquals(1, result.rowsBefore());
        assertEquals(2, result.rowsAfter());

        PivotTable table = tableStore.load("US", metadataStore.loadSchema("US").orElse(null)).orElseThrow();
        assertTrue(table.hasCategory("Grocery"));
        assertEquals(2, table.rank("kw1", JUNE));
        assertFalse(table.hasMonth(JULY));
        assertEquals(PivotConstants.STATUS_PROCESSED, status("US", "Grocery").status());
        assertEquals(PivotConstants.STATUS_PENDING, status("US", "Beauty").status());

        UpdateRunRecord latest = pivotUpdateService.runHistory("US").get(0);
        assertEquals(PivotConstants.RUN_STATUS_FAILED, latest.status());
        assertEquals(result.failureReason(), latest.failureReason());
    }

    @Test
    void shouldRecordFailedRunWhenAnchorFileIsMalformed() throws IOException {
        rankFile("US", "Beauty", "2025-June.csv", "kw1,10", "kw2,\"unterminated");

        assertThrows(IllegalStateException.class, () -> pivotUpdateService.update("US", UpdateDecision.BOTH));

        assertFalse(tableStore.exists("US"));
        List<UpdateRunRecord> runs = pivotUpdateService.runHistory("US");
        assertEquals(1, runs.size());
        assertEquals(PivotConstants.RUN_STATUS_FAILED, runs.get(0).status());
        assertTrue(runs.get(0).failureReason().startsWith("create table from Beauty"));
    }

    @Test
    void shouldFallBackToFirstCategoryWhenAnchorIsMissing() throws IOException {
        rankFile("CANADA", "Grocery", "2025-June.csv", "kw1,10");

        UpdateResult result = pivotUpdateService.update("CANADA", UpdateDecision.BOTH);

        assertEquals("Grocery", result.createdFromAnchor());
        assertEquals(List.of("Grocery"), pivotUpdateService.tableInfo("canada").categories());
    }

    @Test
    void shouldUpdateEveryCountryAndReportFailuresSeparately() throws IOException {
        rankFile("US", "Beauty", "2025-June.csv", "kw1,10");
        Files.createDirectories(Paths.get(pivotProperties.getDataRoot(), "EMPTY"));

        List<UpdateResult> results = new ArrayList<>(pivotUpdateService.updateAllCountries(UpdateDecision.BOTH));

        assertEquals(2, results.size());
        assertEquals("EMPTY", results.get(0).country());
        assertEquals(PivotConstants.RUN_STATUS_FAILED, results.get(0).status());
        assertNull(results.get(0).runId());
        assertEquals(PivotConstants.RUN_STATUS_COMMITTED, results.get(1).status());
        assertTrue(tableStore.exists("US"));
    }

    @Test
    void shouldRejectUnknownCountry() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> pivotUpdateService.analyzeChanges("MARS"));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    private CategoryStatus status(String country, String category) {
        return metadataStore.categoryStatuses(country).stream()
                .filter(status -> status.category().equals(category))
                .findFirst()
                .orElseThrow();
    }

    private void rankFile(String country, String category, String fileName, String... rows) throws IOException {
        Path file = Paths.get(pivotProperties.getDataRoot(), country, category, fileName);
        Files.createDirectories(file.getParent());
        List<String> lines = new ArrayList<>();
        lines.add("Search Term,Search Frequency Rank");
        lines.addAll(List.of(rows));
        Files.write(file, lines, StandardCharsets.UTF_8);
    }
}
