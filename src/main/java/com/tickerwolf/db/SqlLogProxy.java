package com.tickerwolf.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Locale;
import java.util.Set;

/**
 * Dynamic proxies that log every executed statement with its elapsed time.
 */
final class SqlLogProxy {
    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "executeBatch", "executeLargeBatch"
    );
    private static final int MAX_SQL_CHARS = 800;

    private SqlLogProxy() {
    }

    static Connection wrapConnection(Connection delegate, Logger logger) {
        InvocationHandler handler = (proxy, method, args) -> {
            Object out = invoke(delegate, method, args);
            String name = method.getName();
            if ("prepareStatement".equals(name) && args != null && args.length > 0
                    && args[0] instanceof String && out instanceof PreparedStatement) {
                return wrap(PreparedStatement.class, (PreparedStatement) out, (String) args[0], logger);
            }
            if ("createStatement".equals(name) && out instanceof Statement) {
                return wrap(Statement.class, (Statement) out, null, logger);
            }
            return out;
        };
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class[]{Connection.class},
                handler
        );
    }

    private static <T extends Statement> T wrap(Class<T> type, T delegate, String preparedSql, Logger logger) {
        InvocationHandler handler = (proxy, method, args) -> {
            String name = method.getName();
            if (!EXECUTE_METHODS.contains(name)) {
                return invoke(delegate, method, args);
            }
            String sql = preparedSql;
            if (sql == null && args != null && args.length > 0 && args[0] instanceof String) {
                sql = (String) args[0];
            }
            long started = System.nanoTime();
            try {
                Object out = invoke(delegate, method, args);
                if (logger.isDebugEnabled()) {
                    logger.debug("SQL ok method={} elapsed_ms={}{} sql={}",
                            name, elapsedMs(started), resultSummary(out), normalizeSql(sql));
                }
                return out;
            } catch (Throwable error) {
                logger.warn("SQL fail method={} elapsed_ms={} err={} sql={}",
                        name, elapsedMs(started), error.getMessage(), normalizeSql(sql));
                throw error;
            }
        };
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class[]{type}, handler));
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    private static String elapsedMs(long startedNanos) {
        return String.format(Locale.US, "%.3f", (System.nanoTime() - startedNanos) / 1_000_000.0);
    }

    private static String normalizeSql(String sql) {
        if (sql == null) {
            return "";
        }
        String normalized = sql.replaceAll("\\s+", " ").trim();
        if (normalized.length() <= MAX_SQL_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_SQL_CHARS) + "...";
    }

    private static String resultSummary(Object result) {
        if (result instanceof Integer || result instanceof Long) {
            return " rows=" + result;
        }
        if (result instanceof int[]) {
            return " batch_size=" + ((int[]) result).length;
        }
        if (result instanceof long[]) {
            return " batch_size=" + ((long[]) result).length;
        }
        if (result instanceof Boolean) {
            return " has_result_set=" + result;
        }
        return "";
    }
}
