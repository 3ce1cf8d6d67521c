/* (C)2026 */
package com.aethersignal.signal.model;

import com.aethersignal.signal.enumeration.LatencyCategory;
import com.aethersignal.signal.enumeration.TrendDirection;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Trend, burst, novelty and latency analysis of one pair's reporting history.
 *
 * <p>The four sub-results are independent; {@code novelty} and {@code latency} are
 * {@code null} when their inputs were not supplied.
 */
public record TemporalPatternResult(
        String drug,
        String event,
        long totalCases,
        long durationDays,
        Trend trend,
        List<Burst> bursts,
        boolean hasRecentBurst,
        double burstScore,
        List<ChangePoint> changePoints,
        boolean hasChangePoint,
        Novelty novelty,
        LatencyStats latency,
        double temporalRiskScore,
        List<String> flags) {

    public TemporalPatternResult {
        bursts = List.copyOf(bursts);
        changePoints = List.copyOf(changePoints);
        flags = List.copyOf(flags);
    }

    /**
     * Window comparison and least-squares fit over the series.
     *
     * @param recentMean mean count of the most recent window
     * @param olderMean mean count of the preceding window of equal size
     * @param relativeChange (recent - older) / older
     * @param slope least-squares cases per day
     * @param pValue two-tailed p-value of the slope
     */
    public record Trend(
            TrendDirection direction,
            double recentMean,
            double olderMean,
            double relativeChange,
            double slope,
            double rSquared,
            double pValue,
            boolean significant,
            Double doublingTimeDays,
            Double halfLifeDays) {}

    /** A local maximum whose z-score over the rolling baseline exceeds the threshold. */
    public record Burst(
            LocalDate date,
            int count,
            double baselineMean,
            double zScore,
            double foldIncrease,
            double pValue,
            boolean significant) {}

    public record ChangePoint(
            LocalDate date,
            double meanBefore,
            double meanAfter,
            double foldChange,
            double pValue,
            boolean significant) {}

    /**
     * @param firstSeenInWindow whether the first report falls inside the analyzed series
     */
    public record Novelty(
            LocalDate firstReportDate,
            long daysSinceFirstReport,
            long totalReports,
            double score,
            boolean emerging,
            boolean firstSeenInWindow) {}

    public record LatencyStats(
            int caseCount,
            double meanDays,
            double medianDays,
            double q1Days,
            double q3Days,
            Map<LatencyCategory, Integer> distribution) {

        public LatencyStats {
            Map<LatencyCategory, Integer> ordered = new EnumMap<>(LatencyCategory.class);
            ordered.putAll(distribution);
            distribution = Collections.unmodifiableMap(ordered);
        }

        public double iqrDays() {
            return q3Days - q1Days;
        }
    }
}
