/* (C)2026 */
package com.aethersignal.signal.service;

import com.aethersignal.signal.config.DisproportionalityThresholds;
import com.aethersignal.signal.config.SignalDetectionConfig;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.model.ContingencyTable;
import com.aethersignal.signal.model.DisproportionalityResult;
import com.aethersignal.signal.model.InformationComponent;
import com.aethersignal.signal.model.RatioEstimate;
import com.aethersignal.signal.util.StatisticalFunctions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Classical frequentist disproportionality statistics over a 2x2 contingency table.
 *
 * <p>Computes:
 * <ul>
 *   <li>PRR (proportional reporting ratio) with a log-normal 95% CI</li>
 *   <li>ROR (reporting odds ratio) with a log-normal 95% CI</li>
 *   <li>IC (information component) with the simplified IC025/IC975 bounds</li>
 *   <li>Yates-corrected chi-square and, for small counts, Fisher's exact test</li>
 * </ul>
 *
 * <p>A statistic whose formula divides by a zero cell or marginal is reported as undefined:
 * zero values, {@code signal=false}, {@code defined=false}. It never raises, so one
 * undefined ratio does not stop the other methods.
 */
@ApplicationScoped
public class DisproportionalityAnalyzer {

    private static final Logger LOG = Logger.getLogger(DisproportionalityAnalyzer.class);

    // Fisher's exact test is added below these observed / expected counts
    private static final int SMALL_COUNT = 5;

    private final DisproportionalityThresholds thresholds;

    @Inject
    public DisproportionalityAnalyzer(SignalDetectionConfig config) {
        this(config.thresholds());
    }

    public DisproportionalityAnalyzer(DisproportionalityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Runs all disproportionality methods for one pair.
     *
     * @param drug  drug name, used for logging and the result
     * @param event event name, used for logging and the result
     * @param table contingency table, required
     * @return fresh immutable result
     * @throws ValidationException if {@code table} is null
     */
    public DisproportionalityResult analyze(String drug, String event, ContingencyTable table) {
        if (table == null) {
            throw ValidationException.missingInput("contingencyTable");
        }

        RatioEstimate prr = calculatePrr(table);
        RatioEstimate ror = calculateRor(table);
        InformationComponent ic = calculateIc(table);
        double[] chiSquare = chiSquare(table);

        double expected = table.expected();
        Double fisher = null;
        if (table.total() > 0 && (table.n11() < SMALL_COUNT || expected < SMALL_COUNT)) {
            fisher = StatisticalFunctions.fisherExactTwoTailed(table.n11(), table.n10(), table.n01(), table.n00());
        }

        LOG.debugf(
                "Disproportionality %s/%s: n11=%d, PRR=%.3f (%.3f-%.3f), ROR=%.3f, IC025=%.3f, chi2=%.2f",
                drug, event, table.n11(), prr.value(), prr.ciLower(), prr.ciUpper(),
                ror.value(), ic.ic025(), chiSquare[0]);

        return new DisproportionalityResult(
                drug, event, table, expected, prr, ror, ic, chiSquare[0], chiSquare[1], fisher);
    }

    /**
     * PRR = (n11 / (n11 + n10)) / (n01 / (n01 + n00)).
     *
     * <p>Signal when PRR meets the PRR threshold, n11 meets the minimum case count and the
     * lower CI bound exceeds the CI threshold.
     */
    public RatioEstimate calculatePrr(ContingencyTable table) {
        long a = table.n11();
        long c = table.n01();
        long drugTotal = table.drugTotal();
        long otherTotal = table.otherDrugTotal();
        if (a == 0 || c == 0 || drugTotal == 0 || otherTotal == 0) {
            return RatioEstimate.undefined();
        }

        double prr = ((double) a / drugTotal) / ((double) c / otherTotal);
        double se = Math.sqrt(1.0 / a - 1.0 / drugTotal + 1.0 / c - 1.0 / otherTotal);
        double[] ci = logNormalInterval(prr, se);
        if (!Double.isFinite(prr) || !Double.isFinite(ci[0])) {
            return RatioEstimate.undefined();
        }

        boolean signal = prr >= thresholds.prrThreshold()
                && a >= thresholds.minCases()
                && ci[0] > thresholds.ciLowerThreshold();
        return new RatioEstimate(prr, ci[0], ci[1], signal, true);
    }

    /**
     * ROR = (n11 * n00) / (n10 * n01). Undefined when any cell is zero; no continuity
     * correction is applied.
     */
    public RatioEstimate calculateRor(ContingencyTable table) {
        if (!table.hasAllCellsPositive()) {
            return RatioEstimate.undefined();
        }
        double a = table.n11();
        double b = table.n10();
        double c = table.n01();
        double d = table.n00();

        double ror = (a * d) / (b * c);
        double se = Math.sqrt(1.0 / a + 1.0 / b + 1.0 / c + 1.0 / d);
        double[] ci = logNormalInterval(ror, se);
        if (!Double.isFinite(ror) || !Double.isFinite(ci[0])) {
            return RatioEstimate.undefined();
        }

        boolean signal = ror > thresholds.rorThreshold()
                && table.n11() >= thresholds.minCases()
                && ci[0] > thresholds.ciLowerThreshold();
        return new RatioEstimate(ror, ci[0], ci[1], signal, true);
    }

    /**
     * IC = log2(n11 / E) with E = drugTotal * eventTotal / total, and
     * IC025 = IC - 1.96 sqrt(1 / n11).
     */
    public InformationComponent calculateIc(ContingencyTable table) {
        long a = table.n11();
        if (a == 0 || table.drugTotal() == 0 || table.eventTotal() == 0) {
            return InformationComponent.undefined();
        }
        double expected = table.expected();
        double ic = StatisticalFunctions.log2(a / expected);
        double margin = StatisticalFunctions.Z_95 * Math.sqrt(1.0 / a);
        if (!Double.isFinite(ic)) {
            return InformationComponent.undefined();
        }
        double ic025 = ic - margin;
        return new InformationComponent(ic, ic025, ic + margin, ic025 > thresholds.ic025Threshold(), true);
    }

    /**
     * Pearson chi-square with Yates' continuity correction.
     *
     * @return {statistic, p-value}; {0, 1} when a marginal is zero
     */
    double[] chiSquare(ContingencyTable table) {
        double row1 = table.drugTotal();
        double row2 = table.otherDrugTotal();
        double col1 = table.eventTotal();
        double col2 = table.noEventTotal();
        if (row1 == 0 || row2 == 0 || col1 == 0 || col2 == 0) {
            return new double[] {0.0, 1.0};
        }
        double n = table.total();
        double cross = Math.abs((double) table.n11() * table.n00() - (double) table.n10() * table.n01());
        double corrected = Math.max(0.0, cross - n / 2.0);
        double statistic = n * corrected * corrected / (row1 * row2 * col1 * col2);
        return new double[] {statistic, StatisticalFunctions.chiSquarePValueOneDf(statistic)};
    }

    public DisproportionalityThresholds getThresholds() {
        return thresholds;
    }

    private static double[] logNormalInterval(double estimate, double standardError) {
        double logEstimate = Math.log(estimate);
        double margin = StatisticalFunctions.Z_95 * standardError;
        return new double[] {Math.exp(logEstimate - margin), Math.exp(logEstimate + margin)};
    }
}
