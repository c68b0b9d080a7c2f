package com.tickerwolf.output;

import com.tickerwolf.audit.AuditReport;
import com.tickerwolf.audit.CrossCheckResult;
import com.tickerwolf.audit.TableAuditResult;
import org.json.JSONStringer;
import org.json.JSONWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Serializes an {@link AuditReport} with a fixed key order: tables, cross, overall, parameters,
 * generated_at. Each table keeps the audit result fields at its top level; the sample coverage
 * figures sit under an optional {@code coverage} object.
 */
public final class AuditReportJson {
    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private AuditReportJson() {
    }

    public static String toJson(AuditReport report) {
        return toJson(report, true);
    }

    /**
     * @param withGeneratedAt false drops the only field that differs between runs over unchanged data
     */
    public static String toJson(AuditReport report, boolean withGeneratedAt) {
        JSONStringer json = new JSONStringer();
        json.object();

        json.key("tables").object();
        for (Map.Entry<String, TableAuditResult> entry : report.tables.entrySet()) {
            json.key(entry.getKey());
            writeTable(json, entry.getValue(), report.detail);
        }
        json.endObject();

        json.key("cross").object();
        for (Map.Entry<String, CrossCheckResult> entry : report.cross.entrySet()) {
            json.key(entry.getKey());
            writeCheck(json, entry.getValue(), report.detail);
        }
        json.endObject();

        json.key("overall").object()
                .key("system_health_percent").value(report.systemHealthPercent)
                .key("grade").value(report.grade.label())
                .endObject();

        json.key("parameters").object()
                .key("sample_limit").value(report.sampleLimit)
                .key("detail").value(report.detail)
                .key("sampled_tickers").value(report.sampledTickers)
                .endObject();

        if (withGeneratedAt) {
            json.key("generated_at").value(report.generatedAt.toString());
        }
        json.endObject();
        return json.toString();
    }

    /**
     * Writes {@code tickers_data_audit_yyyyMMdd_HHmmss.json} into {@code dir}, stamped with the
     * report time in {@code zone}.
     */
    public static Path export(AuditReport report, Path dir, ZoneId zone) throws IOException {
        Files.createDirectories(dir);
        String name = "tickers_data_audit_" + FILE_TS.format(report.generatedAt.atZone(zone)) + ".json";
        Path target = dir.resolve(name);
        Files.writeString(target, toJson(report) + System.lineSeparator(), StandardCharsets.UTF_8);
        return target;
    }

    private static void writeTable(JSONWriter json, TableAuditResult table, boolean detail) {
        json.object()
                .key("table_name").value(table.tableName)
                .key("row_count").value(table.rowCount)
                .key("completeness_ratio").value(round4(table.completenessRatio))
                .key("freshness_ratio").value(round4(table.freshnessRatio))
                .key("health_percent").value(table.healthPercent)
                .key("status").value(table.status.name());
        json.key("coverage").object()
                .key("tickers_with_data").value(table.tickersWithData)
                .key("sampled_tickers").value(table.sampledTickers)
                .key("newest_row_date").value(table.newestRowDate == null ? null : table.newestRowDate.toString())
                .endObject();
        if (table.error != null) {
            json.key("error").value(table.error);
        }
        if (detail) {
            json.key("missing_tickers").array();
            for (String symbol : table.missingTickers) {
                json.value(symbol);
            }
            json.endArray();
        }
        json.endObject();
    }

    private static void writeCheck(JSONWriter json, CrossCheckResult check, boolean detail) {
        json.object();
        json.key("label").value(check.label);
        json.key("anomaly_count").value(check.anomalyCount);
        if (check.error != null) {
            json.key("error").value(check.error);
        }
        if (detail) {
            json.key("offenders").array();
            for (String id : check.offenders) {
                json.value(id);
            }
            json.endArray();
        }
        json.endObject();
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
