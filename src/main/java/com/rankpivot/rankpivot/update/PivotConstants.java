package com.rankpivot.rankpivot.update;

/**
 * Shared constants for pivot table maintenance.
 */
public final class PivotConstants {

    private PivotConstants() {
    }

    public static final String DEFAULT_DATA_ROOT = "DATA";
    public static final String DEFAULT_OUTPUT_DIR = "outputs";
    public static final String DEFAULT_ANCHOR_CATEGORY = "Beauty";
    public static final String DEFAULT_CRON = "0 0 2 * * *";
    public static final String DEFAULT_SCHEDULED_DECISION = "NONE";

    public static final String TABLE_FILE_SUFFIX = "_pivot_table.csv";
    public static final String CSV_EXTENSION = ".csv";

    public static final String HEADER_SEARCH_TERM = "Search Term";
    public static final String HEADER_SEARCH_FREQUENCY_RANK = "Search Frequency Rank";

    public static final String TABLE_COLUMN = "pivot_table_column";
    public static final String TABLE_MONTH_SUPPLIER = "pivot_month_supplier";
    public static final String TABLE_KEYWORD = "pivot_keyword";
    public static final String TABLE_CATEGORY_STATUS = "pivot_category_status";
    public static final String TABLE_UPDATE_RUN = "pivot_update_run";

    public static final String COLUMN_TYPE_CATEGORY = "category";
    public static final String COLUMN_TYPE_MONTH = "month";
    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_PROCESSED = "processed";
    public static final String RUN_STATUS_COMMITTED = "COMMITTED";
    public static final String RUN_STATUS_FAILED = "FAILED";

    public static final int KEYWORD_BATCH_SIZE = 1000;

    public static final String MSG_DATA_ROOT_NOT_FOUND = "Data root not found: %s";
    public static final String MSG_COUNTRY_NOT_FOUND = "No data folder for country: %s";
    public static final String MSG_NO_CATEGORIES = "No category files found for country: %s";
    public static final String MSG_SCAN_FAILED = "Unable to scan data folder: %s";
    public static final String MSG_RANK_FILE_EMPTY = "Ranking file is empty: %s";
    public static final String MSG_RANK_FILE_READ_FAILED = "Unable to read ranking file: %s";
    public static final String MSG_RANK_COLUMN_MISSING = "Column '%s' not found in ranking file: %s";
    public static final String MSG_TABLE_WRITE_FAILED = "Unable to write pivot table: %s";
    public static final String MSG_TABLE_READ_FAILED = "Unable to read pivot table: %s";
    public static final String MSG_RUN_ID_NOT_GENERATED = "Unable to generate unique run id";
}
