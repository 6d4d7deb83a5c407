package com.rankpivot.rankpivot.update;

import com.rankpivot.rankpivot.detect.ChangeDetector;
import com.rankpivot.rankpivot.detect.TableDelta;
import com.rankpivot.rankpivot.pivot.MonthLabel;
import com.rankpivot.rankpivot.pivot.PivotMergeEngine;
import com.rankpivot.rankpivot.pivot.PivotTable;
import com.rankpivot.rankpivot.pivot.PivotTableException;
import com.rankpivot.rankpivot.pivot.TableSchema;
import com.rankpivot.rankpivot.plan.MergeOperation;
import com.rankpivot.rankpivot.plan.PlanOutcome;
import com.rankpivot.rankpivot.plan.UpdateDecision;
import com.rankpivot.rankpivot.plan.UpdatePlan;
import com.rankpivot.rankpivot.plan.UpdatePlanner;
import com.rankpivot.rankpivot.source.InventoryRankSource;
import com.rankpivot.rankpivot.source.RankFileReader;
import com.rankpivot.rankpivot.source.SourceFile;
import com.rankpivot.rankpivot.source.SourceInventory;
import com.rankpivot.rankpivot.source.SourceScanner;
import com.rankpivot.rankpivot.store.JdbcTableMetadataStore;
import com.rankpivot.rankpivot.store.PivotTableCsvStore;
import com.rankpivot.rankpivot.store.UpdateRunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Runs the table lifecycle for a country: discover sources, create the table from the anchor category, detect
 * changes, apply the chosen plan and persist the result with its metadata.
 */
@Service
public class PivotUpdateService {

    private static final Logger log = LoggerFactory.getLogger(PivotUpdateService.class);

    private final SourceScanner sourceScanner;
    private final RankFileReader rankFileReader;
    private final PivotTableCsvStore tableStore;
    private final JdbcTableMetadataStore metadataStore;
    private final ChangeDetector changeDetector;
    private final UpdatePlanner updatePlanner;
    private final PivotMergeEngine mergeEngine;
    private final PivotProperties pivotProperties;
    private final ConcurrentMap<String, Object> countryLocks = new ConcurrentHashMap<>();

    public PivotUpdateService(
            SourceScanner sourceScanner,
            RankFileReader rankFileReader,
            PivotTableCsvStore tableStore,
            JdbcTableMetadataStore metadataStore,
            ChangeDetector changeDetector,
            UpdatePlanner updatePlanner,
            PivotMergeEngine mergeEngine,
            PivotProperties pivotProperties
    ) {
        this.sourceScanner = sourceScanner;
        this.rankFileReader = rankFileReader;
        this.tableStore = tableStore;
        this.metadataStore = metadataStore;
        this.changeDetector = changeDetector;
        this.updatePlanner = updatePlanner;
        this.mergeEngine = mergeEngine;
        this.pivotProperties = pivotProperties;
    }

    public List<String> countries() {
        return sourceScanner.detectCountries();
    }

    public TableInfo tableInfo(String country) {
        String key = requireCountry(country);
        Optional<TableSchema> schema = currentSchema(key);
        String filePath = tableStore.tablePath(key).toString();
        if (schema.isEmpty()) {
            return new TableInfo(key, false, 0, 0, List.of(), List.of(), filePath);
        }
        return new TableInfo(
                key,
                tableStore.exists(key),
                currentKeywords(key).size(),
                schema.get().columnCount(),
                schema.get().categories(),
                monthNames(schema.get().months()),
                filePath
        );
    }

    /**
     * Compares the stored table layout against the source folders without touching cell data, and refreshes
     * the pending status of categories with unmerged files.
     */
    public ChangeReport analyzeChanges(String country) {
        String key = requireCountry(country);
        synchronized (lockFor(key)) {
            SourceInventory inventory = sourceScanner.scanCountry(key);
            TableSchema schema = currentSchema(key).orElse(TableSchema.empty());
            TableDelta delta = changeDetector.detectChanges(schema, currentKeywords(key), inventory,
                    rankFileReader::readTerms);
            markPending(key, inventory, delta);
            log.info("{}: newMonths={}, newCategories={}, pendingCategories={}, newKeywordsEstimate={}",
                    key, delta.newMonths().size(), delta.newCategoryMonths().size(),
                    delta.pendingMonthsByCategory().size(), delta.newKeywordsEstimate());
            return new ChangeReport(
                    key,
                    monthNames(delta.newMonths()),
                    monthNamesByCategory(delta.newCategoryMonths()),
                    monthNamesByCategory(delta.pendingMonthsByCategory()),
                    delta.newKeywordsEstimate(),
                    delta.hasChanges(),
                    renderReport(key, schema, delta)
            );
        }
    }

    /**
     * Brings the country's table up to date according to {@code decision}. A missing table is first created
     * from the anchor category unless the decision is {@link UpdateDecision#NONE}. A failing operation halts the
     * plan; whatever completed before it is saved and the run is recorded as failed.
     */
    public UpdateResult update(String country, UpdateDecision decision) {
        String key = requireCountry(country);
        synchronized (lockFor(key)) {
            SourceInventory inventory = sourceScanner.scanCountry(key);
            if (inventory.isEmpty()) {
                throw new IllegalStateException(PivotConstants.MSG_NO_CATEGORIES.formatted(key));
            }
            InventoryRankSource rankSource = new InventoryRankSource(inventory, rankFileReader);

            Optional<PivotTable> existing = tableStore.load(key, metadataStore.loadSchema(key).orElse(null));
            if (existing.isEmpty() && decision == UpdateDecision.NONE) {
                long runId = metadataStore.recordRun(key, decision.name(), 0, 0, 0,
                        PivotConstants.RUN_STATUS_COMMITTED, null);
                return new UpdateResult(runId, key, decision.name(), null, List.of(), 0, 0, 0,
                        PivotConstants.RUN_STATUS_COMMITTED, null);
            }

            String anchor = null;
            int rowsBefore = existing.map(PivotTable::rowCount).orElse(0);
            PivotTable table;
            if (existing.isPresent()) {
                table = existing.get();
            } else {
                anchor = chooseAnchor(inventory);
                table = createTable(key, decision, anchor, inventory, rankSource);
            }

            TableDelta delta = changeDetector.detectChanges(table.schema(), table.searchTerms(), inventory, null);
            UpdatePlan plan = updatePlanner.plan(delta, decision);
            PlanOutcome outcome = plan.execute(table, rankSource, mergeEngine);
            PivotTable result = outcome.table();

            if (!outcome.completed().isEmpty()) {
                persist(key, result);
            }
            List<String> applied = new ArrayList<>();
            if (anchor != null) {
                applied.add("create table from " + anchor + " " + inventory.monthsFor(anchor));
            }
            for (MergeOperation operation : outcome.completed()) {
                metadataStore.markCategoryProcessed(key, operation.category(),
                        rankSource.fileNames(operation.category(), operation.months()),
                        result.keywordCount(operation.category()));
                applied.add(operation.describe());
            }
            markPending(key, inventory, changeDetector.detectChanges(result.schema(), Set.of(), inventory, null));

            String status = outcome.succeeded() ? PivotConstants.RUN_STATUS_COMMITTED : PivotConstants.RUN_STATUS_FAILED;
            String failureReason = outcome.failureCause()
                    .map(ex -> outcome.failedOperation().describe() + ": " + ex.getMessage())
                    .orElse(null);
            long runId = metadataStore.recordRun(key, decision.name(), applied.size(), rowsBefore,
                    result.rowCount(), status, failureReason);
            log.info("{} update {}: decision={}, operations={}, rows {} -> {}, columns={}",
                    key, status, decision, applied.size(), rowsBefore, result.rowCount(), result.columns().size());
            return new UpdateResult(runId, key, decision.name(), anchor, applied, rowsBefore, result.rowCount(),
                    result.columns().size(), status, failureReason);
        }
    }

    /**
     * Updates every detected country in turn. A failing country is logged and reported without stopping the
     * others.
     */
    public List<UpdateResult> updateAllCountries(UpdateDecision decision) {
        List<UpdateResult> results = new ArrayList<>();
        for (String country : countries()) {
            try {
                results.add(update(country, decision));
            } catch (RuntimeException ex) {
                log.error("Update failed for {}: {}", country, ex.getMessage(), ex);
                results.add(new UpdateResult(null, country.toUpperCase(Locale.ROOT), decision.name(), null,
                        List.of(), 0, 0, 0, PivotConstants.RUN_STATUS_FAILED, ex.getMessage()));
            }
        }
        return results;
    }

    public ProcessingStatusResponse processingStatus(String country) {
        String key = requireCountry(country);
        SourceInventory inventory = sourceScanner.scanCountry(key);
        return new ProcessingStatusResponse(
                key,
                metadataStore.processingSummary(key),
                metadataStore.categoryStatuses(key),
                sourceScanner.summarize(inventory)
        );
    }

    public List<UpdateRunRecord> runHistory(String country) {
        return metadataStore.runHistory(requireCountry(country));
    }

    private PivotTable createTable(
            String key,
            UpdateDecision decision,
            String anchor,
            SourceInventory inventory,
            InventoryRankSource rankSource
    ) {
        List<MonthLabel> months = inventory.monthsFor(anchor);
        try {
            PivotTable table = PivotTable.create(anchor, rankSource.load(anchor, months));
            persist(key, table);
            metadataStore.markCategoryProcessed(key, anchor, rankSource.fileNames(anchor, months),
                    table.keywordCount(anchor));
            log.info("{}: created table from {} with {} months, rows={}", key, anchor, months.size(), table.rowCount());
            return table;
        } catch (PivotTableException | IllegalStateException ex) {
            metadataStore.recordRun(key, decision.name(), 0, 0, 0, PivotConstants.RUN_STATUS_FAILED,
                    "create table from " + anchor + ": " + ex.getMessage());
            throw ex;
        }
    }

    private void persist(String key, PivotTable table) {
        tableStore.save(key, table);
        metadataStore.saveSchema(key, table);
    }

    private String chooseAnchor(SourceInventory inventory) {
        String configured = pivotProperties.getAnchorCategory();
        for (String category : inventory.categories()) {
            if (category.equalsIgnoreCase(configured)) {
                return category;
            }
        }
        String fallback = inventory.categories().iterator().next();
        log.warn("{}: anchor category '{}' not found, using '{}'", inventory.country(), configured, fallback);
        return fallback;
    }

    private void markPending(String key, SourceInventory inventory, TableDelta delta) {
        Map<String, List<MonthLabel>> unmerged = new LinkedHashMap<>(delta.newCategoryMonths());
        unmerged.putAll(delta.pendingMonthsByCategory());
        for (Map.Entry<String, List<MonthLabel>> entry : unmerged.entrySet()) {
            List<String> files = new ArrayList<>();
            for (MonthLabel month : entry.getValue()) {
                inventory.file(entry.getKey(), month).map(SourceFile::fileName).ifPresent(files::add);
            }
            metadataStore.markCategoryPending(key, entry.getKey(), files);
        }
    }

    private Optional<TableSchema> currentSchema(String key) {
        Optional<TableSchema> stored = metadataStore.loadSchema(key);
        if (stored.isPresent()) {
            return stored;
        }
        return tableStore.load(key, null).map(PivotTable::schema);
    }

    private Set<String> currentKeywords(String key) {
        Set<String> keywords = metadataStore.loadKeywords(key);
        if (!keywords.isEmpty()) {
            return keywords;
        }
        return tableStore.load(key, null).map(PivotTable::searchTerms).orElse(Set.of());
    }

    private String requireCountry(String country) {
        if (sourceScanner.countryDirectory(country).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, PivotConstants.MSG_COUNTRY_NOT_FOUND.formatted(country));
        }
        return country.trim().toUpperCase(Locale.ROOT);
    }

    private Object lockFor(String key) {
        return countryLocks.computeIfAbsent(key, ignored -> new Object());
    }

    private String renderReport(String key, TableSchema schema, TableDelta delta) {
        StringBuilder report = new StringBuilder();
        report.append("Update report for ").append(key).append('\n');
        report.append("Table: ").append(schema.categories().size()).append(" categories, ")
                .append(schema.months().size()).append(" months\n");
        if (!delta.hasChanges()) {
            report.append("No changes detected\n");
            return report.toString();
        }
        if (!delta.newMonths().isEmpty()) {
            report.append("New months (").append(delta.newMonths().size()).append("): ")
                    .append(String.join(", ", monthNames(delta.newMonths()))).append('\n');
        }
        for (Map.Entry<String, List<MonthLabel>> entry : delta.newCategoryMonths().entrySet()) {
            report.append("New category: ").append(entry.getKey()).append(' ')
                    .append(monthNames(entry.getValue())).append('\n');
        }
        for (Map.Entry<String, List<MonthLabel>> entry : delta.pendingMonthsByCategory().entrySet()) {
            report.append("Pending months: ").append(entry.getKey()).append(' ')
                    .append(monthNames(entry.getValue())).append('\n');
        }
        report.append("Estimated new keywords: ").append(delta.newKeywordsEstimate()).append('\n');
        return report.toString();
    }

    private static List<String> monthNames(Iterable<MonthLabel> months) {
        List<String> names = new ArrayList<>();
        for (MonthLabel month : months) {
            names.add(month.toString());
        }
        return names;
    }

    private static Map<String, List<String>> monthNamesByCategory(Map<String, List<MonthLabel>> source) {
        Map<String, List<String>> names = new LinkedHashMap<>();
        source.forEach((category, months) -> names.put(category, monthNames(months)));
        return names;
    }
}
