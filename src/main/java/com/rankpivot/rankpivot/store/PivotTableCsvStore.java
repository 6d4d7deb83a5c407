package com.rankpivot.rankpivot.store;

import com.rankpivot.rankpivot.pivot.DataIntegrityException;
import com.rankpivot.rankpivot.pivot.MonthLabel;
import com.rankpivot.rankpivot.pivot.PivotRow;
import com.rankpivot.rankpivot.pivot.PivotTable;
import com.rankpivot.rankpivot.pivot.TableSchema;
import com.rankpivot.rankpivot.update.PivotConstants;
import com.rankpivot.rankpivot.update.PivotProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads and writes a country's pivot table as {@code <outputDir>/<country>_pivot_table.csv}. The header order is
 * search term, categories, months; absent ranks are written as {@code 0}.
 */
@Component
public class PivotTableCsvStore {

    private static final Logger log = LoggerFactory.getLogger(PivotTableCsvStore.class);

    private final PivotProperties pivotProperties;

    public PivotTableCsvStore(PivotProperties pivotProperties) {
        this.pivotProperties = pivotProperties;
    }

    public Path tablePath(String country) {
        return Paths.get(pivotProperties.getOutputDir())
                .resolve(country.toLowerCase(Locale.ROOT) + PivotConstants.TABLE_FILE_SUFFIX);
    }

    public boolean exists(String country) {
        return Files.isRegularFile(tablePath(country));
    }

    /**
     * Writes the table through a temporary file so a crash never leaves a half-written table behind.
     */
    public Path save(String country, PivotTable table) {
        Path target = tablePath(country);
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Path temp = Files.createTempFile(target.toAbsolutePath().getParent(), target.getFileName().toString(), ".tmp");
            try {
                writeTable(temp, table);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException ex) {
            throw new IllegalStateException(PivotConstants.MSG_TABLE_WRITE_FAILED.formatted(target), ex);
        }
        log.info("Saved {} table: rows={}, columns={} -> {}", country, table.rowCount(), table.columns().size(), target);
        return target;
    }

    /**
     * Loads the saved table. Header columns listed as categories in {@code knownSchema}, or not readable as a
     * month, become categories. Month suppliers come from {@code knownSchema} when it has any, otherwise they
     * are inferred from which categories hold ranks in each month.
     */
    public Optional<PivotTable> load(String country, TableSchema knownSchema) {
        Path source = tablePath(country);
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        TableSchema hints = knownSchema == null ? TableSchema.empty() : knownSchema;

        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .build();

        try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
             CSVParser parser = csvFormat.parse(reader)) {
            List<String> header = parser.getHeaderNames();
            if (header.isEmpty() || !TableSchema.SEARCH_TERM_COLUMN.equals(header.get(0))) {
                throw new DataIntegrityException(
                        "Pivot table must start with a '" + TableSchema.SEARCH_TERM_COLUMN + "' column: " + source,
                        source.toString());
            }

            List<String> categories = new ArrayList<>();
            List<MonthLabel> headerMonths = new ArrayList<>();
            List<Boolean> isCategoryColumn = new ArrayList<>();
            for (String column : header.subList(1, header.size())) {
                Optional<MonthLabel> month = MonthLabel.tryParse(column);
                if (hints.hasCategory(column) || month.isEmpty()) {
                    categories.add(column);
                    isCategoryColumn.add(Boolean.TRUE);
                } else {
                    headerMonths.add(month.get());
                    isCategoryColumn.add(Boolean.FALSE);
                }
            }

            TableSchema columnsOnly = TableSchema.of(categories, headerMonths, Map.of());
            if (columnsOnly.months().size() != headerMonths.size()) {
                throw new DataIntegrityException("Pivot table repeats a month column: " + source, source.toString());
            }
            int[] monthPositions = new int[headerMonths.size()];
            for (int i = 0; i < headerMonths.size(); i++) {
                monthPositions[i] = columnsOnly.monthIndex(headerMonths.get(i));
            }

            List<PivotRow> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                byte[] presence = new byte[categories.size()];
                int[] ranks = new int[headerMonths.size()];
                int categoryCursor = 0;
                int monthCursor = 0;
                for (int column = 1; column < header.size(); column++) {
                    int value = parseCell(record.isSet(column) ? record.get(column) : "", record, column);
                    if (isCategoryColumn.get(column - 1)) {
                        if (value != 0 && value != 1) {
                            throw new DataIntegrityException(
                                    "Presence flag must be 0 or 1 at line " + record.getRecordNumber(), record.get(0));
                        }
                        presence[categoryCursor++] = (byte) value;
                    } else {
                        ranks[monthPositions[monthCursor++]] = value;
                    }
                }
                rows.add(new PivotRow(record.get(0), presence, ranks));
            }

            TableSchema schema = TableSchema.of(categories, headerMonths, suppliers(hints, columnsOnly, rows));
            PivotTable table = PivotTable.restore(schema, rows);
            log.info("Loaded {} table: rows={}, columns={}", country, table.rowCount(), table.columns().size());
            return Optional.of(table);
        } catch (IOException ex) {
            throw new IllegalStateException(PivotConstants.MSG_TABLE_READ_FAILED.formatted(source), ex);
        }
    }

    private Map<MonthLabel, Set<String>> suppliers(TableSchema hints, TableSchema columnsOnly, List<PivotRow> rows) {
        Map<MonthLabel, Set<String>> suppliers = new LinkedHashMap<>();
        boolean hintsKnown = !hints.suppliers().isEmpty();
        for (MonthLabel month : columnsOnly.months()) {
            Set<String> monthSuppliers = new LinkedHashSet<>();
            if (hintsKnown) {
                for (String category : hints.suppliers(month)) {
                    if (columnsOnly.hasCategory(category)) {
                        monthSuppliers.add(category);
                    }
                }
            } else {
                int monthIndex = columnsOnly.monthIndex(month);
                for (PivotRow row : rows) {
                    if (row.rank(monthIndex) == PivotTable.ABSENT_RANK) {
                        continue;
                    }
                    for (int c = 0; c < row.categoryCount(); c++) {
                        if (row.isPresent(c)) {
                            monthSuppliers.add(columnsOnly.categories().get(c));
                        }
                    }
                }
            }
            suppliers.put(month, monthSuppliers);
        }
        return suppliers;
    }

    private int parseCell(String raw, CSVRecord record, int column) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty()) {
            return PivotTable.ABSENT_RANK;
        }
        if (value.endsWith(".0")) {
            value = value.substring(0, value.length() - 2);
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new DataIntegrityException(
                    "Non-numeric cell '" + raw + "' at line " + record.getRecordNumber() + ", column " + column,
                    record.get(0));
        }
    }

    private void writeTable(Path file, PivotTable table) throws IOException {
        List<String> columns = table.columns();
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader(columns.toArray(new String[0]))
                .build();
        int categoryCount = table.schema().categories().size();
        int monthCount = table.schema().months().size();

        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, csvFormat)) {
            List<Object> values = new ArrayList<>(columns.size());
            for (PivotRow row : table.rows()) {
                values.clear();
                values.add(row.searchTerm());
                for (int c = 0; c < categoryCount; c++) {
                    values.add(row.presenceFlag(c));
                }
                for (int m = 0; m < monthCount; m++) {
                    values.add(row.rank(m));
                }
                printer.printRecord(values);
            }
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move unsupported for {}, falling back to plain replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
