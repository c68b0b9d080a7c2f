package com.tickerwolf.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single run's structured telemetry and summary.
 */
public final class RunTelemetry {
    public static final String STEP_UNIVERSE = "UNIVERSE";
    public static final String STEP_TABLE_SCAN = "TABLE_SCAN";
    public static final String STEP_CROSS_CHECKS = "CROSS_CHECKS";
    public static final String STEP_AGGREGATE = "AGGREGATE";
    public static final String STEP_INTRADAY_WARM = "INTRADAY_WARM";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runMode;
    private final String trigger;
    private final Clock clock;
    private final Instant startedAt;
    private Instant finishedAt;
    private int errorsTotal;

    private final Map<String, Long> counters = new LinkedHashMap<>();
    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String runMode, String trigger, Clock clock) {
        this.runMode = blankTo(runMode, "ONCE");
        this.trigger = blankTo(trigger, "manual");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.startedAt = this.clock.instant();
        this.finishedAt = null;
        this.errorsTotal = 0;
    }

    public synchronized String runMode() {
        return runMode;
    }

    public synchronized String trigger() {
        return trigger;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(
            String name,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        appendNote(stat, optionalNote);
        if (errorCount > 0L) {
            errorsTotal += (int) Math.max(0L, errorCount);
        }
    }

    public synchronized void setStepNote(String name, String optionalNote) {
        String key = sanitizeStepName(name);
        appendNote(steps.computeIfAbsent(key, StepStat::new), optionalNote);
    }

    public synchronized void incrementCounter(String name, long delta) {
        if (name == null || name.trim().isEmpty() || delta == 0L) {
            return;
        }
        counters.merge(name.trim(), delta, Long::sum);
    }

    public synchronized long counter(String name) {
        Long value = counters.get(name == null ? "" : name.trim());
        return value == null ? 0L : value;
    }

    public synchronized void incrementErrors(int count) {
        if (count <= 0) {
            return;
        }
        this.errorsTotal += count;
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = clock.instant();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? clock.instant() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount,
                    stat.optionalNote
            ));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? clock.instant() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_mode=").append(runMode).append('\n');
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        for (Map.Entry<String, Long> entry : counters.entrySet()) {
            sb.append(entry.getKey()).append('=').append(entry.getValue()).append('\n');
        }
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (stat.optionalNote != null && !stat.optionalNote.isBlank()) {
                sb.append(" note=").append(stat.optionalNote.trim());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private void appendNote(StepStat stat, String optionalNote) {
        if (optionalNote == null || optionalNote.trim().isEmpty()) {
            return;
        }
        String note = optionalNote.trim();
        if (stat.optionalNote.isEmpty()) {
            stat.optionalNote = note;
        } else if (!stat.optionalNote.contains(note)) {
            stat.optionalNote = stat.optionalNote + "; " + note;
        }
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String optionalNote;

        private StepStat(String name) {
            this.name = name;
            this.elapsedMs = 0L;
            this.itemsIn = 0L;
            this.itemsOut = 0L;
            this.errorCount = 0L;
            this.optionalNote = "";
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
    }
}
