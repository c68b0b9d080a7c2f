package com.tickerwolf.db;

import org.apache.ibatis.exceptions.PersistenceException;

import java.sql.SQLException;

final class PersistenceErrors {
    private PersistenceErrors() {
    }

    /**
     * MyBatis wraps driver failures in {@link PersistenceException}; hand the SQL exception back
     * so callers keep its SQLState.
     */
    static SQLException unwrap(PersistenceException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof SQLException sql) {
                return sql;
            }
            cause = cause.getCause();
        }
        return new SQLException("mapper call failed: " + e.getMessage(), e);
    }
}
