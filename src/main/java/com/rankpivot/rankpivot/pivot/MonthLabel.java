package com.rankpivot.rankpivot.pivot;

import java.time.DateTimeException;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Calendar month identifying one month column. Ordered by calendar time; canonical text is {@code yyyy-MM}.
 */
public record MonthLabel(YearMonth yearMonth) implements Comparable<MonthLabel> {

    private static final Pattern NUMERIC_LABEL = Pattern.compile("^(\\d{4})-(\\d{1,2})$");
    private static final Pattern NAMED_LABEL = Pattern.compile("^(\\d{4})-([A-Za-z]+)$");
    private static final Pattern SIMPLE_MONTH_FILE = Pattern.compile(
            "^[A-Za-z]+_Top_search_terms_Simple_Month_(\\d{4})_(\\d{2})_(\\d{2})\\.csv$");
    private static final Pattern YEAR_MONTH_FILE = Pattern.compile("^(\\d{4}-[A-Za-z0-9]+)\\.csv$");

    public MonthLabel {
        if (yearMonth == null) {
            throw new IllegalArgumentException("yearMonth is required");
        }
    }

    public static MonthLabel of(int year, int month) {
        return new MonthLabel(YearMonth.of(year, month));
    }

    /**
     * Parses {@code 2025-06} or {@code 2025-June} / {@code 2025-Jun}.
     */
    public static MonthLabel parse(String text) {
        return tryParse(text).orElseThrow(
                () -> new IllegalArgumentException("Not a month label: " + text));
    }

    public static Optional<MonthLabel> tryParse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String value = text.trim();
        try {
            Matcher numeric = NUMERIC_LABEL.matcher(value);
            if (numeric.matches()) {
                return Optional.of(of(Integer.parseInt(numeric.group(1)), Integer.parseInt(numeric.group(2))));
            }
            Matcher named = NAMED_LABEL.matcher(value);
            if (named.matches()) {
                return monthByName(named.group(2))
                        .map(month -> new MonthLabel(YearMonth.of(Integer.parseInt(named.group(1)), month)));
            }
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    /**
     * Derives the month from a ranking export file name, e.g.
     * {@code US_Top_search_terms_Simple_Month_2025_07_31.csv} or {@code 2025-July.csv}.
     */
    public static Optional<MonthLabel> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher simpleMonth = SIMPLE_MONTH_FILE.matcher(fileName);
        if (simpleMonth.matches()) {
            try {
                return Optional.of(of(Integer.parseInt(simpleMonth.group(1)), Integer.parseInt(simpleMonth.group(2))));
            } catch (DateTimeException ex) {
                return Optional.empty();
            }
        }
        Matcher yearMonth = YEAR_MONTH_FILE.matcher(fileName);
        if (yearMonth.matches()) {
            return tryParse(yearMonth.group(1));
        }
        return Optional.empty();
    }

    private static Optional<Month> monthByName(String name) {
        for (Month month : Month.values()) {
            String full = month.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            String shortName = month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
            if (full.equalsIgnoreCase(name) || shortName.equalsIgnoreCase(name)) {
                return Optional.of(month);
            }
        }
        return Optional.empty();
    }

    @Override
    public int compareTo(MonthLabel other) {
        return yearMonth.compareTo(other.yearMonth);
    }

    @Override
    public String toString() {
        return "%04d-%02d".formatted(yearMonth.getYear(), yearMonth.getMonthValue());
    }
}
