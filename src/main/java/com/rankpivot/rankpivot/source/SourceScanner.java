package com.rankpivot.rankpivot.source;

import com.rankpivot.rankpivot.pivot.MonthLabel;
import com.rankpivot.rankpivot.update.PivotConstants;
import com.rankpivot.rankpivot.update.PivotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Discovers countries, categories and monthly ranking files laid out as
 * {@code <dataRoot>/<country>/<category>/<month file>.csv}.
 */
@Component
public class SourceScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceScanner.class);

    private final PivotProperties pivotProperties;

    public SourceScanner(PivotProperties pivotProperties) {
        this.pivotProperties = pivotProperties;
    }

    /**
     * Returns country folder names in sorted order, or an empty list when the data root does not exist.
     */
    public List<String> detectCountries() {
        Path root = dataRoot();
        if (!Files.isDirectory(root)) {
            log.warn(PivotConstants.MSG_DATA_ROOT_NOT_FOUND.formatted(root));
            return List.of();
        }
        return listDirectories(root);
    }

    /**
     * Scans every category folder of the country. Files whose name carries no recognizable month are skipped.
     */
    public SourceInventory scanCountry(String country) {
        Path countryDir = countryDirectory(country)
                .orElseThrow(() -> new IllegalArgumentException(PivotConstants.MSG_COUNTRY_NOT_FOUND.formatted(country)));

        List<SourceFile> files = new ArrayList<>();
        for (String category : listDirectories(countryDir)) {
            Path categoryDir = countryDir.resolve(category);
            for (Path csv : listCsvFiles(categoryDir)) {
                String fileName = csv.getFileName().toString();
                Optional<MonthLabel> month = MonthLabel.fromFileName(fileName);
                if (month.isEmpty()) {
                    log.warn("Skipping {}/{}: no month in file name {}", country, category, fileName);
                    continue;
                }
                files.add(new SourceFile(category, month.get(), csv, sizeOf(csv)));
            }
        }
        SourceInventory inventory = new SourceInventory(country, files);
        if (inventory.files().size() < files.size()) {
            log.warn("{}: {} files share a category and month with another file and were ignored",
                    country, files.size() - inventory.files().size());
        }
        return inventory;
    }

    /**
     * Resolves the country folder, matching the name case-insensitively.
     */
    public Optional<Path> countryDirectory(String country) {
        if (country == null || country.isBlank()) {
            return Optional.empty();
        }
        for (String candidate : detectCountries()) {
            if (candidate.equalsIgnoreCase(country.trim())) {
                return Optional.of(dataRoot().resolve(candidate));
            }
        }
        return Optional.empty();
    }

    /**
     * Summarizes file counts, sizes and month range per category.
     */
    public List<CategoryFileSummary> summarize(SourceInventory inventory) {
        List<CategoryFileSummary> summaries = new ArrayList<>();
        for (String category : inventory.categories()) {
            List<SourceFile> files = inventory.filesFor(category);
            long totalBytes = files.stream().mapToLong(SourceFile::sizeBytes).sum();
            List<MonthLabel> months = inventory.monthsFor(category);
            summaries.add(new CategoryFileSummary(
                    category,
                    files.size(),
                    totalBytes,
                    months.isEmpty() ? null : months.get(0).toString(),
                    months.isEmpty() ? null : months.get(months.size() - 1).toString()
            ));
        }
        return summaries;
    }

    private Path dataRoot() {
        return Paths.get(pivotProperties.getDataRoot());
    }

    private List<String> listDirectories(Path parent) {
        try (Stream<Path> children = Files.list(parent)) {
            return children
                    .filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new IllegalStateException(PivotConstants.MSG_SCAN_FAILED.formatted(parent), ex);
        }
    }

    private List<Path> listCsvFiles(Path directory) {
        try (Stream<Path> children = Files.list(directory)) {
            return children
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT)
                            .endsWith(PivotConstants.CSV_EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new IllegalStateException(PivotConstants.MSG_SCAN_FAILED.formatted(directory), ex);
        }
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException ex) {
            throw new IllegalStateException(PivotConstants.MSG_SCAN_FAILED.formatted(file), ex);
        }
    }
}
