/* (C)2026 */
package com.aethersignal.signal.service;

import com.aethersignal.signal.config.SignalDetectionConfig;
import com.aethersignal.signal.config.SignalDetectionConfig.BayesianSettings;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.model.BayesianSignal;
import com.aethersignal.signal.model.ContingencyTable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Empirical-Bayes shrinkage of the observed-to-expected ratio (EBGM, EB05, EB95).
 *
 * <p>The prior comes from configuration. {@link #estimatePrior(List)} fits a gamma prior
 * to a reference population by the method of moments and returns a new detector; the
 * receiver keeps its prior.
 */
@ApplicationScoped
public class BayesianSignalDetector {

    private static final Logger LOG = Logger.getLogger(BayesianSignalDetector.class);

    private static final int MIN_PRIOR_TABLES = 2;

    private final ShrinkageModel model;
    private final double eb05Threshold;

    @Inject
    public BayesianSignalDetector(SignalDetectionConfig config) {
        this(modelFor(config.bayesian()), config.thresholds().eb05Threshold());
    }

    public BayesianSignalDetector(ShrinkageModel model, double eb05Threshold) {
        if (model == null) {
            throw ValidationException.missingInput("shrinkageModel");
        }
        this.model = model;
        this.eb05Threshold = eb05Threshold;
    }

    static ShrinkageModel modelFor(BayesianSettings settings) {
        switch (settings.method()) {
            case DUMOUCHEL_MIXTURE:
                return new DuMouchelMixtureShrinkage(
                        settings.alpha1(), settings.beta1(),
                        settings.alpha2(), settings.beta2(),
                        settings.mixtureWeight());
            case GAMMA_POISSON:
            default:
                return new GammaPoissonShrinkage(settings.alpha1(), settings.beta1());
        }
    }

    public BayesianSignal detect(ContingencyTable table) {
        if (table == null) {
            throw ValidationException.missingInput("contingencyTable");
        }
        return detect(table.n11(), table.expected());
    }

    public BayesianSignal detect(long observed, double expected) {
        if (observed < 0) {
            throw ValidationException.negativeCount("observed", observed);
        }
        if (!(expected >= 0)) {
            throw ValidationException.invalidParameter("expected", expected, "non-negative value");
        }
        ShrinkageModel.Posterior posterior = model.posterior(observed, expected);
        boolean signal = posterior.eb05() >= eb05Threshold;

        LOG.debugf(
                "Shrinkage (%s): n=%d, E=%.3f, EBGM=%.3f, EB05=%.3f, EB95=%.3f",
                model.method(), observed, expected, posterior.ebgm(), posterior.eb05(), posterior.eb95());

        return new BayesianSignal(
                model.method(),
                observed,
                expected,
                posterior.ebgm(),
                posterior.eb05(),
                posterior.eb95(),
                posterior.mean(),
                signal);
    }

    /**
     * Fits a gamma prior to the observed ratios of a reference population.
     *
     * <p>With {@code r = n / E}: {@code alpha / beta = mean(r)} and
     * {@code alpha / beta^2 = var(r) - mean(r / E)}. When the corrected variance is not
     * positive the population shows no extra-Poisson spread and the current prior is kept.
     *
     * @param tables reference tables; those with zero expected count are ignored
     * @return a detector with the fitted prior
     * @throws ValidationException when fewer than two usable tables are supplied
     */
    public BayesianSignalDetector estimatePrior(List<ContingencyTable> tables) {
        if (tables == null) {
            throw ValidationException.missingInput("tables");
        }
        double sumRatio = 0;
        double sumRatioSq = 0;
        double sumPoissonVar = 0;
        int usable = 0;
        for (ContingencyTable table : tables) {
            double expected = table.expected();
            if (!(expected > 0)) {
                continue;
            }
            double ratio = table.n11() / expected;
            sumRatio += ratio;
            sumRatioSq += ratio * ratio;
            sumPoissonVar += ratio / expected;
            usable++;
        }
        if (usable < MIN_PRIOR_TABLES) {
            throw ValidationException.insufficientData("reference tables", MIN_PRIOR_TABLES, usable);
        }

        double mean = sumRatio / usable;
        double variance = sumRatioSq / usable - mean * mean;
        double excess = variance - sumPoissonVar / usable;
        if (!(mean > 0) || !(excess > 0)) {
            LOG.infof("Prior estimation found no extra-Poisson variance over %d tables; keeping prior", usable);
            return this;
        }

        double alpha = mean * mean / excess;
        double beta = mean / excess;
        LOG.infof("Estimated gamma prior from %d tables: alpha=%.4f, beta=%.4f", usable, alpha, beta);
        return new BayesianSignalDetector(new GammaPoissonShrinkage(alpha, beta), eb05Threshold);
    }

    public ShrinkageModel getModel() {
        return model;
    }

    public double getEb05Threshold() {
        return eb05Threshold;
    }
}
