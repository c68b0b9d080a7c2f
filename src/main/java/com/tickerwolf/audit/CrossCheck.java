package com.tickerwolf.audit;

import java.sql.SQLException;

/**
 * A self-contained consistency rule evaluated against the store.
 */
@FunctionalInterface
public interface CrossCheck {
    CheckFinding evaluate(CheckContext context) throws SQLException;
}
