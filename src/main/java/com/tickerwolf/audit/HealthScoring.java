package com.tickerwolf.audit;

import com.tickerwolf.config.Config;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Health formula shared by table scoring and the overall aggregate.
 *
 * <p>{@code health = 100 * (wc * completeness + wf * freshness) / (wc + wf)}, rounded to two
 * decimals (half up). Freshness is 1.0 while the newest row is at most {@code cadenceDays}
 * old and then falls linearly to 0 over {@code decayDays}. The system health is the weighted
 * mean of table health values, critical tables counting {@code criticalWeight} times.
 */
public final class HealthScoring {
    private final double completenessWeight;
    private final double freshnessWeight;
    private final int decayDays;
    private final double criticalWeight;

    public HealthScoring(double completenessWeight, double freshnessWeight, int decayDays, double criticalWeight) {
        if (completenessWeight < 0.0 || freshnessWeight < 0.0 || completenessWeight + freshnessWeight <= 0.0) {
            throw new IllegalArgumentException("health weights must be non-negative with a positive sum");
        }
        if (criticalWeight <= 0.0) {
            throw new IllegalArgumentException("critical weight must be positive");
        }
        this.completenessWeight = completenessWeight;
        this.freshnessWeight = freshnessWeight;
        this.decayDays = Math.max(0, decayDays);
        this.criticalWeight = criticalWeight;
    }

    public static HealthScoring fromConfig(Config config) {
        return new HealthScoring(
                config.getDouble("audit.weight.completeness", 0.7),
                config.getDouble("audit.weight.freshness", 0.3),
                config.getInt("audit.freshness.decay_days", 7),
                config.getDouble("audit.critical_weight", 2.0)
        );
    }

    public double completeness(long tickersWithData, long sampledTickers) {
        if (sampledTickers <= 0L) {
            return 0.0;
        }
        return clamp01((double) Math.max(0L, tickersWithData) / (double) sampledTickers);
    }

    public double freshness(LocalDate newestRowDate, LocalDate today, int cadenceDays) {
        if (newestRowDate == null || today == null) {
            return 0.0;
        }
        long age = Math.max(0L, ChronoUnit.DAYS.between(newestRowDate, today));
        if (age <= cadenceDays) {
            return 1.0;
        }
        if (decayDays <= 0) {
            return 0.0;
        }
        long overdue = age - cadenceDays;
        return clamp01(1.0 - (double) overdue / (double) decayDays);
    }

    public double healthPercent(double completeness, double freshness) {
        double blended = (completenessWeight * clamp01(completeness) + freshnessWeight * clamp01(freshness))
                / (completenessWeight + freshnessWeight);
        return round2(clamp(blended * 100.0, 0.0, 100.0));
    }

    public double weightOf(TableSpec spec) {
        return spec != null && spec.critical ? criticalWeight : 1.0;
    }

    /**
     * Weighted mean over {@code healthPercents[i]} with {@code weights[i]}; 0 for an empty list.
     */
    public double systemHealth(List<Double> healthPercents, List<Double> weights) {
        if (healthPercents.size() != weights.size()) {
            throw new IllegalArgumentException("health and weight lists differ in size");
        }
        double sum = 0.0;
        double weightSum = 0.0;
        for (int i = 0; i < healthPercents.size(); i++) {
            double w = weights.get(i);
            sum += w * clamp(healthPercents.get(i), 0.0, 100.0);
            weightSum += w;
        }
        if (weightSum <= 0.0) {
            return 0.0;
        }
        return round2(clamp(sum / weightSum, 0.0, 100.0));
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static double clamp01(double value) {
        return clamp(value, 0.0, 1.0);
    }

    private static double clamp(double value, double min, double max) {
        if (!Double.isFinite(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
