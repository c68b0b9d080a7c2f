package com.tickerwolf.audit;

/**
 * Scoring one table failed. The table is reported as FAIL and the run continues.
 */
public class TableScanException extends Exception {
    private final String table;

    public TableScanException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    public String table() {
        return table;
    }
}
