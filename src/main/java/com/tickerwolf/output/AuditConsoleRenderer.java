package com.tickerwolf.output;

import com.tickerwolf.audit.AuditReport;
import com.tickerwolf.audit.CrossCheckResult;
import com.tickerwolf.audit.Grade;
import com.tickerwolf.audit.TableAuditResult;
import com.tickerwolf.audit.TableStatus;

import java.io.PrintStream;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Operator-facing text rendering of an audit report.
 *
 * <p>Statuses and grades map to a {@link Style} through fixed tables; each style has one handler.
 */
public final class AuditConsoleRenderer {
    private static final String RULE = "-".repeat(70);

    public enum Style {
        INFO,
        COMMENT,
        ERROR
    }

    private static final Map<TableStatus, Style> STATUS_STYLES = new EnumMap<>(TableStatus.class);
    private static final Map<Grade, Style> GRADE_STYLES = new EnumMap<>(Grade.class);

    static {
        STATUS_STYLES.put(TableStatus.OK, Style.INFO);
        STATUS_STYLES.put(TableStatus.WARN, Style.COMMENT);
        STATUS_STYLES.put(TableStatus.FAIL, Style.ERROR);

        GRADE_STYLES.put(Grade.EXCELLENT, Style.INFO);
        GRADE_STYLES.put(Grade.GOOD, Style.COMMENT);
        GRADE_STYLES.put(Grade.POOR, Style.ERROR);
    }

    private final Map<Style, UnaryOperator<String>> handlers = new EnumMap<>(Style.class);

    public AuditConsoleRenderer(boolean ansi) {
        if (ansi) {
            handlers.put(Style.INFO, line -> "\u001B[32m" + line + "\u001B[0m");
            handlers.put(Style.COMMENT, line -> "\u001B[33m" + line + "\u001B[0m");
            handlers.put(Style.ERROR, line -> "\u001B[31m" + line + "\u001B[0m");
        } else {
            handlers.put(Style.INFO, line -> line);
            handlers.put(Style.COMMENT, line -> line);
            handlers.put(Style.ERROR, line -> "! " + line);
        }
    }

    public static Style styleOf(TableStatus status) {
        return STATUS_STYLES.get(status);
    }

    public static Style styleOf(Grade grade) {
        return GRADE_STYLES.get(grade);
    }

    public static Style styleOf(CrossCheckResult check) {
        if (check.isError()) {
            return Style.ERROR;
        }
        return check.anomalyCount != null && check.anomalyCount > 0L ? Style.COMMENT : Style.INFO;
    }

    public void render(AuditReport report, long elapsedMs, PrintStream out) {
        out.println("Table Summary (with Health %)");
        out.println(RULE);
        for (TableAuditResult table : report.tables.values()) {
            String line = String.format(Locale.US, "%-30s %12s  %-8s  %s",
                    table.tableName,
                    String.format(Locale.US, "%,d", table.rowCount),
                    String.format(Locale.US, "%.2f%%", table.healthPercent),
                    table.status.name());
            if (table.error != null) {
                line = line + "  (" + table.error + ")";
            }
            out.println(apply(styleOf(table.status), line));
            if (report.detail && !table.missingTickers.isEmpty()) {
                out.println("    missing: " + String.join(", ", table.missingTickers));
            }
        }

        out.println();
        out.println("Overall System Health");
        out.println(RULE);
        out.println(apply(styleOf(report.grade), String.format(Locale.US, "Health: %-8s   Grade: %s",
                String.format(Locale.US, "%.2f%%", report.systemHealthPercent),
                report.grade.label())));

        out.println();
        out.println("Cross-Checks");
        out.println(RULE);
        for (CrossCheckResult check : report.cross.values()) {
            String value = check.isError() ? "ERROR: " + check.error : String.valueOf(check.anomalyCount);
            out.println(apply(styleOf(check), String.format(Locale.US, "%-40s %s", check.label + ":", value)));
            if (report.detail && !check.offenders.isEmpty()) {
                out.println("    offenders: " + String.join(", ", check.offenders));
            }
        }

        out.println();
        out.println(String.format(Locale.US, "Audit complete in %.2fs", elapsedMs / 1000.0));
    }

    String apply(Style style, String line) {
        return handlers.get(style).apply(line);
    }
}
