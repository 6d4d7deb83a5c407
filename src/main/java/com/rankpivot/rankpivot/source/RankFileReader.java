package com.rankpivot.rankpivot.source;

import com.rankpivot.rankpivot.pivot.MonthlyRanks;
import com.rankpivot.rankpivot.pivot.RankEntry;
import com.rankpivot.rankpivot.update.PivotConstants;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Reads monthly ranking exports: an optional metadata line, then a header row with {@code Search Term} and
 * {@code Search Frequency Rank}. Repeated terms keep their first occurrence; rows with a blank term or an
 * unparsable rank are skipped.
 */
@Component
public class RankFileReader {

    private static final Logger log = LoggerFactory.getLogger(RankFileReader.class);
    private static final int HEADER_MARK_LIMIT = 1 << 16;
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    /**
     * Reads the file into ordered ranks. Rank range filtering is left to the merge engine.
     */
    public MonthlyRanks read(SourceFile sourceFile) {
        List<RankEntry> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int[] skipped = new int[1];
        parse(sourceFile.path(), (term, rank) -> {
            if (rank == null) {
                skipped[0]++;
            } else if (seen.add(term)) {
                entries.add(new RankEntry(term, rank));
            }
        });
        if (skipped[0] > 0) {
            log.warn("Skipped {} rows without a usable rank in {}", skipped[0], sourceFile.path());
        }
        return new MonthlyRanks(sourceFile.month(), entries);
    }

    /**
     * Reads only the distinct search terms of the file, in source order.
     */
    public Set<String> readTerms(SourceFile sourceFile) {
        Set<String> terms = new LinkedHashSet<>();
        parse(sourceFile.path(), (term, rank) -> {
            if (rank != null) {
                terms.add(term);
            }
        });
        return terms;
    }

    private void parse(Path path, BiConsumer<String, Integer> sink) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            reader.mark(HEADER_MARK_LIMIT);
            String firstLine = reader.readLine();
            if (firstLine == null) {
                throw new IllegalStateException(PivotConstants.MSG_RANK_FILE_EMPTY.formatted(path));
            }
            if (looksLikeHeader(firstLine)) {
                reader.reset();
            }

            CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                    .setHeader()
                    .setSkipHeaderRecord(true)
                    .setTrim(true)
                    .setAllowMissingColumnNames(true)
                    .setIgnoreEmptyLines(true)
                    .build();

            try (CSVParser parser = csvFormat.parse(reader)) {
                List<String> headerNames = parser.getHeaderNames();
                int termColumn = columnIndex(headerNames, PivotConstants.HEADER_SEARCH_TERM, path);
                int rankColumn = columnIndex(headerNames, PivotConstants.HEADER_SEARCH_FREQUENCY_RANK, path);

                try {
                    for (CSVRecord record : parser) {
                        String term = record.isSet(termColumn) ? record.get(termColumn).trim() : "";
                        if (term.isEmpty()) {
                            continue;
                        }
                        sink.accept(term, record.isSet(rankColumn) ? parseRank(record.get(rankColumn)) : null);
                    }
                } catch (UncheckedIOException ex) {
                    throw new IllegalStateException(PivotConstants.MSG_RANK_FILE_READ_FAILED.formatted(path), ex);
                }
            }
        } catch (IOException ex) {
            throw new IllegalStateException(PivotConstants.MSG_RANK_FILE_READ_FAILED.formatted(path), ex);
        }
    }

    private boolean looksLikeHeader(String line) {
        String normalized = line.toLowerCase(Locale.ROOT);
        return normalized.contains(PivotConstants.HEADER_SEARCH_TERM.toLowerCase(Locale.ROOT))
                && normalized.contains(PivotConstants.HEADER_SEARCH_FREQUENCY_RANK.toLowerCase(Locale.ROOT));
    }

    private int columnIndex(List<String> headerNames, String expected, Path path) {
        for (int i = 0; i < headerNames.size(); i++) {
            String header = headerNames.get(i) == null ? "" : stripByteOrderMark(headerNames.get(i)).trim();
            if (header.equalsIgnoreCase(expected)) {
                return i;
            }
        }
        throw new IllegalStateException(PivotConstants.MSG_RANK_COLUMN_MISSING.formatted(expected, path));
    }

    private static String stripByteOrderMark(String value) {
        return value.startsWith(BYTE_ORDER_MARK) ? value.substring(BYTE_ORDER_MARK.length()) : value;
    }

    /**
     * Parses {@code 1234}, {@code 1,234} or {@code 1234.0}; returns {@code null} for anything else.
     */
    static Integer parseRank(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim().replace(",", "");
        if (value.endsWith(".0")) {
            value = value.substring(0, value.length() - 2);
        }
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
