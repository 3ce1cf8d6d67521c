/* (C)2026 */
package com.aethersignal.signal.service;

import com.aethersignal.signal.config.SignalDetectionConfig;
import com.aethersignal.signal.config.SignalDetectionConfig.TemporalSettings;
import com.aethersignal.signal.enumeration.LatencyCategory;
import com.aethersignal.signal.enumeration.TrendDirection;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.model.TemporalPatternResult;
import com.aethersignal.signal.model.TemporalPatternResult.Burst;
import com.aethersignal.signal.model.TemporalPatternResult.ChangePoint;
import com.aethersignal.signal.model.TemporalPatternResult.LatencyStats;
import com.aethersignal.signal.model.TemporalPatternResult.Novelty;
import com.aethersignal.signal.model.TemporalPatternResult.Trend;
import com.aethersignal.signal.model.TimeSeriesData;
import com.aethersignal.signal.util.StatisticalFunctions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Time-series pattern analysis of one pair's report counts.
 *
 * <p>Trend, bursts, change points, novelty and latency are computed independently and
 * returned together with a composite temporal risk score. "Today" comes from the injected
 * {@link Clock}, so results are reproducible under a fixed clock.
 */
@ApplicationScoped
public class TemporalPatternAnalyzer {

    private static final Logger LOG = Logger.getLogger(TemporalPatternAnalyzer.class);

    private static final int MIN_BURST_BASELINE = 3;
    private static final int MIN_REGRESSION_POINTS = 3;
    private static final double BURST_SIGNIFICANCE = 0.01;
    private static final double TREND_SIGNIFICANCE = 0.05;
    private static final double CHANGE_POINT_SIGNIFICANCE = 0.05;
    private static final double CHANGE_POINT_MEAN_RATIO = 1.5;
    private static final double FLUCTUATION_CV = 0.5;

    private final TemporalSettings settings;
    private final Clock clock;

    @Inject
    public TemporalPatternAnalyzer(SignalDetectionConfig config, Clock clock) {
        this(config.temporal(), clock);
    }

    public TemporalPatternAnalyzer(TemporalSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Analyzes a reporting history.
     *
     * @param timeSeries bucketed counts, required
     * @param firstReportDate first-ever report of the pair, {@code null} skips novelty
     * @param latencies per-case time to onset in days, {@code null} or empty skips latency
     */
    public TemporalPatternResult analyze(
            String drug,
            String event,
            TimeSeriesData timeSeries,
            LocalDate firstReportDate,
            List<Integer> latencies) {
        if (timeSeries == null) {
            throw ValidationException.missingInput("timeSeries");
        }

        Trend trend = analyzeTrend(timeSeries);
        List<Burst> bursts = detectBursts(timeSeries);
        boolean recentBurst = hasRecentBurst(timeSeries, bursts);
        double burstScore = burstScore(bursts);
        List<ChangePoint> changePoints = detectChangePoints(timeSeries);
        boolean changed = changePoints.stream().anyMatch(ChangePoint::significant);
        Novelty novelty = firstReportDate == null
                ? null
                : assessNovelty(firstReportDate, timeSeries.totalCases(), timeSeries);
        LatencyStats latency = latencies == null || latencies.isEmpty() ? null : analyzeLatencies(latencies);

        List<String> flags = new ArrayList<>();
        double risk = 0.0;
        if (recentBurst) {
            risk += 0.30;
            flags.add("Recent spike detected");
        }
        if (changed) {
            risk += 0.25;
            flags.add("Reporting pattern changed");
        }
        if (trend.direction() == TrendDirection.INCREASING && trend.significant()) {
            risk += 0.20;
            flags.add(trend.doublingTimeDays() == null
                    ? "Increasing trend"
                    : String.format(Locale.ROOT, "Increasing trend (doubling time: %.0f days)", trend.doublingTimeDays()));
        }
        if (novelty != null) {
            if (novelty.emerging()) {
                risk += 0.25;
                flags.add("Emerging signal (new drug-event combination)");
            } else if (novelty.score() > 0.6) {
                risk += 0.15;
                flags.add(String.format(Locale.ROOT, "High novelty (score: %.2f)", novelty.score()));
            }
        }
        risk = Math.min(risk, 1.0);

        LOG.debugf(
                "Temporal %s/%s: %d buckets, trend=%s, bursts=%d, changePoints=%d, risk=%.2f",
                drug, event, timeSeries.size(), trend.direction(), bursts.size(), changePoints.size(), risk);

        return new TemporalPatternResult(
                drug,
                event,
                timeSeries.totalCases(),
                timeSeries.durationDays(),
                trend,
                bursts,
                recentBurst,
                burstScore,
                changePoints,
                changed,
                novelty,
                latency,
                risk,
                flags);
    }

    /**
     * Window comparison for the direction, least-squares fit for slope and significance.
     * A stable window comparison over a noisy series with no significant slope is
     * reported as fluctuating.
     */
    Trend analyzeTrend(TimeSeriesData series) {
        double[] counts = series.countsAsArray();
        int n = counts.length;

        int window = settings.trendWindow();
        if (n < 2 * window) {
            window = n / 2;
        }
        double recentMean = 0.0;
        double olderMean = 0.0;
        double relativeChange = 0.0;
        if (window > 0) {
            recentMean = meanOf(counts, n - window, n);
            olderMean = meanOf(counts, n - 2 * window, n - window);
            if (olderMean > 0) {
                relativeChange = (recentMean - olderMean) / olderMean;
            } else {
                relativeChange = recentMean > 0 ? 1.0 : 0.0;
            }
        }

        double slope = 0.0;
        double rSquared = 0.0;
        double pValue = 1.0;
        if (n >= MIN_REGRESSION_POINTS) {
            double[] fit = linearRegression(series.dates(), counts);
            slope = fit[0];
            rSquared = fit[1];
            pValue = fit[2];
        }
        boolean significant = pValue < TREND_SIGNIFICANCE;

        TrendDirection direction;
        if (relativeChange > settings.trendRelativeChange()) {
            direction = TrendDirection.INCREASING;
        } else if (relativeChange < -settings.trendRelativeChange()) {
            direction = TrendDirection.DECREASING;
        } else if (!significant && coefficientOfVariation(counts) > FLUCTUATION_CV) {
            direction = TrendDirection.FLUCTUATING;
        } else {
            direction = TrendDirection.STABLE;
        }

        double mean = StatisticalFunctions.mean(counts);
        Double doublingTime = null;
        Double halfLife = null;
        if (direction == TrendDirection.INCREASING && slope > 0 && mean > 0) {
            doublingTime = Math.log(2) / (slope / mean);
        }
        if (direction == TrendDirection.DECREASING && slope < 0 && mean > 0) {
            halfLife = Math.log(2) / (Math.abs(slope) / mean);
        }

        return new Trend(
                direction, recentMean, olderMean, relativeChange, slope, rSquared, pValue,
                significant, doublingTime, halfLife);
    }

    /**
     * Local maxima whose z-score over the preceding rolling baseline exceeds the threshold.
     * A flat baseline uses the Poisson standard deviation sqrt(mean), at least 1.
     */
    List<Burst> detectBursts(TimeSeriesData series) {
        double[] counts = series.countsAsArray();
        List<Burst> bursts = new ArrayList<>();
        for (int i = MIN_BURST_BASELINE; i < counts.length; i++) {
            if (!isLocalMaximum(counts, i)) {
                continue;
            }
            int from = Math.max(0, i - settings.burstBaseline());
            double[] baseline = Arrays.copyOfRange(counts, from, i);
            double baselineMean = StatisticalFunctions.mean(baseline);
            double sd = StatisticalFunctions.standardDeviation(baseline);
            if (sd == 0) {
                sd = Math.max(Math.sqrt(baselineMean), 1.0);
            }
            double z = (counts[i] - baselineMean) / sd;
            if (z <= settings.burstZThreshold()) {
                continue;
            }
            double pValue = StatisticalFunctions.poissonUpperTail((long) counts[i], baselineMean);
            double fold = baselineMean > 0 ? counts[i] / baselineMean : Double.POSITIVE_INFINITY;
            bursts.add(new Burst(
                    series.dates().get(i), (int) counts[i], baselineMean, z, fold, pValue,
                    pValue < BURST_SIGNIFICANCE));
        }
        return bursts;
    }

    private boolean hasRecentBurst(TimeSeriesData series, List<Burst> bursts) {
        if (bursts.isEmpty()) {
            return false;
        }
        LocalDate cutoff = series.lastDate().minusDays(settings.recentSpikeDays());
        return bursts.stream().anyMatch(burst -> !burst.date().isBefore(cutoff));
    }

    /** Strongest burst z-score scaled so that twice the threshold maps to 1. */
    double burstScore(List<Burst> bursts) {
        double maxZ = bursts.stream().mapToDouble(Burst::zScore).max().orElse(0.0);
        return StatisticalFunctions.clamp(maxZ / (2.0 * settings.burstZThreshold()), 0.0, 1.0);
    }

    /**
     * Single-split scan for mean shifts of at least 1.5x. Candidates are ranked by the
     * residual sum of squares of the two segments and the best ones are tested with a
     * pooled two-sample t-test. Returned in date order.
     */
    List<ChangePoint> detectChangePoints(TimeSeriesData series) {
        double[] counts = series.countsAsArray();
        int n = counts.length;
        int minSegment = settings.changePointMinSegment();
        if (n < 2 * minSegment) {
            return List.of();
        }

        List<double[]> candidates = new ArrayList<>();
        for (int i = minSegment; i < n - minSegment; i++) {
            double before = meanOf(counts, 0, i);
            double after = meanOf(counts, i, n);
            if (after > before * CHANGE_POINT_MEAN_RATIO || before > after * CHANGE_POINT_MEAN_RATIO) {
                double cost = sumOfSquares(counts, 0, i, before) + sumOfSquares(counts, i, n, after);
                candidates.add(new double[] {i, before, after, cost});
            }
        }
        candidates.sort(Comparator.comparingDouble(candidate -> candidate[3]));

        List<ChangePoint> changePoints = new ArrayList<>();
        for (double[] candidate : candidates.subList(0, Math.min(settings.maxChangePoints(), candidates.size()))) {
            int index = (int) candidate[0];
            double before = candidate[1];
            double after = candidate[2];
            double pValue = pooledTTestPValue(counts, index);
            double fold = before > 0 ? after / before : Double.POSITIVE_INFINITY;
            changePoints.add(new ChangePoint(
                    series.dates().get(index), before, after, fold, pValue, pValue < CHANGE_POINT_SIGNIFICANCE));
        }
        changePoints.sort(Comparator.comparing(ChangePoint::date));
        return changePoints;
    }

    /**
     * Novelty = 0.5 recency + 0.3 volume + 0.2 growth, where recency decays
     * exponentially with the age of the first report.
     */
    Novelty assessNovelty(LocalDate firstReportDate, long totalReports, TimeSeriesData series) {
        LocalDate today = LocalDate.now(clock);
        long days = Math.max(0, ChronoUnit.DAYS.between(firstReportDate, today));

        double recency = Math.exp(-(double) days / settings.noveltyDecayDays());
        double volume = 1.0 / (1.0 + Math.log1p(totalReports));
        double growth = Math.min((double) totalReports / Math.max(days, 1), 1.0);
        double score = 0.5 * recency + 0.3 * volume + 0.2 * growth;

        boolean emerging = days <= settings.emergingDays() && score > 0.5;
        boolean inWindow = series != null && !series.isEmpty() && !firstReportDate.isBefore(series.firstDate());
        return new Novelty(firstReportDate, days, totalReports, score, emerging, inWindow);
    }

    /**
     * Summary statistics and category distribution of per-case time to onset.
     *
     * @throws ValidationException when a latency is negative
     */
    public LatencyStats analyzeLatencies(List<Integer> latencies) {
        Map<LatencyCategory, Integer> distribution = new EnumMap<>(LatencyCategory.class);
        for (LatencyCategory category : LatencyCategory.values()) {
            distribution.put(category, 0);
        }
        double sum = 0;
        for (int i = 0; i < latencies.size(); i++) {
            Integer days = latencies.get(i);
            if (days == null) {
                throw ValidationException.missingInput("latencies[" + i + "]");
            }
            if (days < 0) {
                throw ValidationException.negativeCount("latencies[" + i + "]", days);
            }
            distribution.merge(LatencyCategory.fromDays(days), 1, Integer::sum);
            sum += days;
        }
        return new LatencyStats(
                latencies.size(),
                sum / latencies.size(),
                StatisticalFunctions.percentile(latencies, 50),
                StatisticalFunctions.percentile(latencies, 25),
                StatisticalFunctions.percentile(latencies, 75),
                distribution);
    }

    /** @return {slope per day, r squared, two-tailed p-value of the slope} */
    private static double[] linearRegression(List<LocalDate> dates, double[] y) {
        int n = y.length;
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = ChronoUnit.DAYS.between(dates.get(0), dates.get(i));
        }
        double meanX = StatisticalFunctions.mean(x);
        double meanY = StatisticalFunctions.mean(y);
        double sxx = 0;
        double sxy = 0;
        double syy = 0;
        for (int i = 0; i < n; i++) {
            sxx += (x[i] - meanX) * (x[i] - meanX);
            sxy += (x[i] - meanX) * (y[i] - meanY);
            syy += (y[i] - meanY) * (y[i] - meanY);
        }
        if (sxx == 0 || syy == 0) {
            return new double[] {0.0, 0.0, 1.0};
        }
        double slope = sxy / sxx;
        double r = sxy / Math.sqrt(sxx * syy);
        double rSquared = r * r;
        double pValue;
        if (rSquared >= 1.0) {
            pValue = 0.0;
        } else {
            double t = r * Math.sqrt((n - 2) / (1 - rSquared));
            pValue = StatisticalFunctions.studentTTwoTailedPValue(t, n - 2);
        }
        return new double[] {slope, rSquared, pValue};
    }

    private static double pooledTTestPValue(double[] counts, int split) {
        int n1 = split;
        int n2 = counts.length - split;
        if (n1 < 2 || n2 < 2) {
            return 1.0;
        }
        double mean1 = meanOf(counts, 0, split);
        double mean2 = meanOf(counts, split, counts.length);
        double pooledVariance = (sumOfSquares(counts, 0, split, mean1)
                + sumOfSquares(counts, split, counts.length, mean2)) / (n1 + n2 - 2);
        if (pooledVariance == 0) {
            return mean1 == mean2 ? 1.0 : 0.0;
        }
        double t = (mean1 - mean2) / Math.sqrt(pooledVariance * (1.0 / n1 + 1.0 / n2));
        return StatisticalFunctions.studentTTwoTailedPValue(t, n1 + n2 - 2);
    }

    private static boolean isLocalMaximum(double[] counts, int i) {
        boolean left = counts[i] >= counts[i - 1];
        boolean right = i == counts.length - 1 || counts[i] >= counts[i + 1];
        return left && right;
    }

    private static double coefficientOfVariation(double[] counts) {
        double mean = StatisticalFunctions.mean(counts);
        return mean > 0 ? StatisticalFunctions.standardDeviation(counts) / mean : 0.0;
    }

    private static double meanOf(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return to > from ? sum / (to - from) : 0.0;
    }

    private static double sumOfSquares(double[] values, int from, int to, double mean) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += (values[i] - mean) * (values[i] - mean);
        }
        return sum;
    }
}
