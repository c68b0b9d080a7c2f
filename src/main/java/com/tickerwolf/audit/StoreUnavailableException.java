package com.tickerwolf.audit;

import java.sql.SQLException;

/**
 * The relational store cannot be reached. Aborts a whole audit run.
 */
public class StoreUnavailableException extends Exception {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * True when the failure, or any SQL exception in its cause chain, carries SQLState class 08.
     */
    public static boolean isConnectionFailure(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 16) {
            if (current instanceof SQLException sql) {
                String state = sql.getSQLState();
                if (state != null && state.startsWith("08")) {
                    return true;
                }
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
