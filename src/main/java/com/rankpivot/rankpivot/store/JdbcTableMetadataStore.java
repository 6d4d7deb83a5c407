package com.rankpivot.rankpivot.store;

import com.rankpivot.rankpivot.pivot.MonthLabel;
import com.rankpivot.rankpivot.pivot.PivotTable;
import com.rankpivot.rankpivot.pivot.TableSchema;
import com.rankpivot.rankpivot.update.PivotConstants;
import jakarta.annotation.PostConstruct;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persists what change detection needs without loading a table's cells: column layout, month suppliers and
 * row keys. Also keeps per-category processing status and the history of update runs.
 */
@Component
public class JdbcTableMetadataStore {

    private static final String LIST_SEPARATOR = "\n";

    private final JdbcTemplate jdbcTemplate;

    public JdbcTableMetadataStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates the metadata tables at startup.
     */
    @PostConstruct
    public void initializeSchema() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + PivotConstants.TABLE_COLUMN + " ("
                + "country VARCHAR(64) NOT NULL, "
                + "column_name VARCHAR(512) NOT NULL, "
                + "column_type VARCHAR(16) NOT NULL, "
                + "column_position INT NOT NULL, "
                + "PRIMARY KEY (country, column_name)"
                + ")");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + PivotConstants.TABLE_MONTH_SUPPLIER + " ("
                + "country VARCHAR(64) NOT NULL, "
                + "category VARCHAR(512) NOT NULL, "
                + "month_label VARCHAR(16) NOT NULL, "
                + "PRIMARY KEY (country, category, month_label)"
                + ")");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + PivotConstants.TABLE_KEYWORD + " ("
                + "country VARCHAR(64) NOT NULL, "
                + "search_term VARCHAR(1024) NOT NULL, "
                + "PRIMARY KEY (country, search_term)"
                + ")");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + PivotConstants.TABLE_CATEGORY_STATUS + " ("
                + "country VARCHAR(64) NOT NULL, "
                + "category VARCHAR(512) NOT NULL, "
                + "status VARCHAR(16) NOT NULL, "
                + "files_processed VARCHAR(20000), "
                + "files_available VARCHAR(20000), "
                + "keyword_count INT NOT NULL, "
                + "last_processed BIGINT, "
                + "PRIMARY KEY (country, category)"
                + ")");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + PivotConstants.TABLE_UPDATE_RUN + " ("
                + "run_id BIGINT PRIMARY KEY, "
                + "country VARCHAR(64) NOT NULL, "
                + "decision VARCHAR(32) NOT NULL, "
                + "run_datetime BIGINT NOT NULL, "
                + "operations_applied INT NOT NULL, "
                + "rows_before INT NOT NULL, "
                + "rows_after INT NOT NULL, "
                + "status VARCHAR(16) NOT NULL, "
                + "failure_reason VARCHAR(4000)"
                + ")");
    }

    /**
     * Replaces the stored column layout and suppliers of the country, and adds row keys not yet stored. Runs in
     * one transaction so a failed save keeps the previous layout.
     */
    @Transactional
    public void saveSchema(String country, PivotTable table) {
        String key = countryKey(country);
        TableSchema schema = table.schema();

        jdbcTemplate.update("DELETE FROM " + PivotConstants.TABLE_COLUMN + " WHERE country = ?", key);
        List<Object[]> columns = new ArrayList<>();
        int position = 0;
        for (String category : schema.categories()) {
            columns.add(new Object[]{key, category, PivotConstants.COLUMN_TYPE_CATEGORY, position++});
        }
        for (MonthLabel month : schema.months()) {
            columns.add(new Object[]{key, month.toString(), PivotConstants.COLUMN_TYPE_MONTH, position++});
        }
        if (!columns.isEmpty()) {
            jdbcTemplate.batchUpdate("INSERT INTO " + PivotConstants.TABLE_COLUMN
                    + " (country, column_name, column_type, column_position) VALUES (?, ?, ?, ?)", columns);
        }

        jdbcTemplate.update("DELETE FROM " + PivotConstants.TABLE_MONTH_SUPPLIER + " WHERE country = ?", key);
        List<Object[]> suppliers = new ArrayList<>();
        schema.suppliers().forEach((month, categories) -> {
            for (String category : categories) {
                suppliers.add(new Object[]{key, category, month.toString()});
            }
        });
        if (!suppliers.isEmpty()) {
            jdbcTemplate.batchUpdate("INSERT INTO " + PivotConstants.TABLE_MONTH_SUPPLIER
                    + " (country, category, month_label) VALUES (?, ?, ?)", suppliers);
        }

        saveKeywords(key, table.orderedSearchTerms());
    }

    /**
     * Rebuilds the schema of the country's table, empty when nothing was stored yet.
     */
    public Optional<TableSchema> loadSchema(String country) {
        String key = countryKey(country);
        List<String> categories = new ArrayList<>();
        List<MonthLabel> months = new ArrayList<>();
        jdbcTemplate.query(
                "SELECT column_name, column_type FROM " + PivotConstants.TABLE_COLUMN
                        + " WHERE country = ? ORDER BY column_position",
                rs -> {
                    String name = rs.getString("column_name");
                    if (PivotConstants.COLUMN_TYPE_MONTH.equals(rs.getString("column_type"))) {
                        months.add(MonthLabel.parse(name));
                    } else {
                        categories.add(name);
                    }
                },
                key
        );
        if (categories.isEmpty() && months.isEmpty()) {
            return Optional.empty();
        }

        Map<MonthLabel, Set<String>> suppliers = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT category, month_label FROM " + PivotConstants.TABLE_MONTH_SUPPLIER
                        + " WHERE country = ? ORDER BY month_label, category",
                rs -> {
                    suppliers.computeIfAbsent(MonthLabel.parse(rs.getString("month_label")), month -> new LinkedHashSet<>())
                            .add(rs.getString("category"));
                },
                key
        );
        return Optional.of(TableSchema.of(categories, months, suppliers));
    }

    public Set<String> loadKeywords(String country) {
        return new HashSet<>(jdbcTemplate.queryForList(
                "SELECT search_term FROM " + PivotConstants.TABLE_KEYWORD + " WHERE country = ?",
                String.class,
                countryKey(country)
        ));
    }

    public void markCategoryProcessed(String country, String category, List<String> processedFiles, int keywordCount) {
        String key = countryKey(country);
        List<String> merged = new ArrayList<>(findCategoryStatus(key, category)
                .map(CategoryStatus::filesProcessed)
                .orElse(List.of()));
        for (String file : processedFiles) {
            if (!merged.contains(file)) {
                merged.add(file);
            }
        }
        long now = Instant.now().toEpochMilli();
        int updated = jdbcTemplate.update(
                "UPDATE " + PivotConstants.TABLE_CATEGORY_STATUS
                        + " SET status = ?, files_processed = ?, files_available = ?, keyword_count = ?, last_processed = ?"
                        + " WHERE country = ? AND category = ?",
                PivotConstants.STATUS_PROCESSED, joinList(merged), "", keywordCount, now, key, category
        );
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO " + PivotConstants.TABLE_CATEGORY_STATUS
                            + " (country, category, status, files_processed, files_available, keyword_count, last_processed)"
                            + " VALUES (?, ?, ?, ?, ?, ?, ?)",
                    key, category, PivotConstants.STATUS_PROCESSED, joinList(merged), "", keywordCount, now
            );
        }
    }

    /**
     * Flags the category as having source files that are not merged yet.
     */
    public void markCategoryPending(String country, String category, List<String> availableFiles) {
        String key = countryKey(country);
        int updated = jdbcTemplate.update(
                "UPDATE " + PivotConstants.TABLE_CATEGORY_STATUS
                        + " SET status = ?, files_available = ? WHERE country = ? AND category = ?",
                PivotConstants.STATUS_PENDING, joinList(availableFiles), key, category
        );
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO " + PivotConstants.TABLE_CATEGORY_STATUS
                            + " (country, category, status, files_processed, files_available, keyword_count, last_processed)"
                            + " VALUES (?, ?, ?, ?, ?, 0, NULL)",
                    key, category, PivotConstants.STATUS_PENDING, "", joinList(availableFiles)
            );
        }
    }

    public List<CategoryStatus> categoryStatuses(String country) {
        return jdbcTemplate.query(
                "SELECT category, status, files_processed, files_available, keyword_count, last_processed FROM "
                        + PivotConstants.TABLE_CATEGORY_STATUS + " WHERE country = ? ORDER BY category",
                (rs, rowNum) -> new CategoryStatus(
                        rs.getString("category"),
                        rs.getString("status"),
                        splitList(rs.getString("files_processed")),
                        splitList(rs.getString("files_available")),
                        rs.getInt("keyword_count"),
                        rs.getObject("last_processed", Long.class)
                ),
                countryKey(country)
        );
    }

    public ProcessingSummary processingSummary(String country) {
        List<String> processed = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        for (CategoryStatus status : categoryStatuses(country)) {
            if (PivotConstants.STATUS_PROCESSED.equals(status.status())) {
                processed.add(status.category());
            } else {
                pending.add(status.category());
            }
        }
        int total = processed.size() + pending.size();
        double completion = total == 0 ? 0.0 : processed.size() * 100.0 / total;
        return new ProcessingSummary(total, processed.size(), pending.size(), completion, processed, pending);
    }

    /**
     * Records one update attempt and returns its run id.
     */
    public long recordRun(
            String country,
            String decision,
            int operationsApplied,
            int rowsBefore,
            int rowsAfter,
            String status,
            String failureReason
    ) {
        long runId = generateRunId();
        jdbcTemplate.update(
                "INSERT INTO " + PivotConstants.TABLE_UPDATE_RUN
                        + " (run_id, country, decision, run_datetime, operations_applied, rows_before, rows_after,"
                        + " status, failure_reason) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                runId, countryKey(country), decision, Instant.now().toEpochMilli(), operationsApplied,
                rowsBefore, rowsAfter, status, truncate(failureReason, 4000)
        );
        return runId;
    }

    public List<UpdateRunRecord> runHistory(String country) {
        return jdbcTemplate.query(
                "SELECT run_id, country, decision, run_datetime, operations_applied, rows_before, rows_after,"
                        + " status, failure_reason FROM " + PivotConstants.TABLE_UPDATE_RUN
                        + " WHERE country = ? ORDER BY run_id DESC",
                (rs, rowNum) -> new UpdateRunRecord(
                        rs.getLong("run_id"),
                        rs.getString("country"),
                        rs.getString("decision"),
                        rs.getLong("run_datetime"),
                        rs.getInt("operations_applied"),
                        rs.getInt("rows_before"),
                        rs.getInt("rows_after"),
                        rs.getString("status"),
                        rs.getString("failure_reason")
                ),
                countryKey(country)
        );
    }

    private void saveKeywords(String key, List<String> searchTerms) {
        Set<String> stored = loadKeywords(key);
        List<Object[]> batch = new ArrayList<>(PivotConstants.KEYWORD_BATCH_SIZE);
        String sql = "INSERT INTO " + PivotConstants.TABLE_KEYWORD + " (country, search_term) VALUES (?, ?)";
        for (String term : searchTerms) {
            if (stored.contains(term)) {
                continue;
            }
            batch.add(new Object[]{key, term});
            if (batch.size() >= PivotConstants.KEYWORD_BATCH_SIZE) {
                jdbcTemplate.batchUpdate(sql, batch);
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            jdbcTemplate.batchUpdate(sql, batch);
        }
    }

    private Optional<CategoryStatus> findCategoryStatus(String key, String category) {
        return categoryStatuses(key).stream()
                .filter(status -> status.category().equals(category))
                .findFirst();
    }

    private long generateRunId() {
        long candidate = Instant.now().toEpochMilli();
        for (int attempt = 0; attempt < 1000; attempt++) {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM " + PivotConstants.TABLE_UPDATE_RUN + " WHERE run_id = ?",
                    Integer.class,
                    candidate
            );
            if (count == null || count == 0) {
                return candidate;
            }
            candidate++;
        }
        throw new IllegalStateException(PivotConstants.MSG_RUN_ID_NOT_GENERATED);
    }

    private String countryKey(String country) {
        if (country == null || country.isBlank()) {
            throw new IllegalArgumentException("country is required");
        }
        return country.trim().toUpperCase(Locale.ROOT);
    }

    private static String joinList(List<String> values) {
        return values == null ? "" : String.join(LIST_SEPARATOR, values);
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(value.split(LIST_SEPARATOR));
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
