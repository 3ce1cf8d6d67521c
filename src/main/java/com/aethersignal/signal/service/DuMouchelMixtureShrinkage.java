/* (C)2026 */
package com.aethersignal.signal.service;

import com.aethersignal.signal.enumeration.ShrinkageMethod;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.util.StatisticalFunctions;

/**
 * Two-component gamma mixture prior (DuMouchel's MGPS model).
 *
 * <p>The posterior is again a two-component gamma mixture. Its component weights come from
 * the negative-binomial marginal likelihood of the observed count under each prior
 * component.
 */
public final class DuMouchelMixtureShrinkage implements ShrinkageModel {

    private final double alpha1;
    private final double beta1;
    private final double alpha2;
    private final double beta2;
    private final double weight;

    public DuMouchelMixtureShrinkage(double alpha1, double beta1, double alpha2, double beta2, double weight) {
        if (!(alpha1 > 0 && beta1 > 0 && alpha2 > 0 && beta2 > 0)) {
            throw ValidationException.invalidParameter(
                    "mixture", alpha1 + "," + beta1 + "," + alpha2 + "," + beta2, "positive shapes and rates");
        }
        if (!(weight > 0 && weight < 1)) {
            throw ValidationException.invalidParameter("mixtureWeight", weight, "value in (0, 1)");
        }
        this.alpha1 = alpha1;
        this.beta1 = beta1;
        this.alpha2 = alpha2;
        this.beta2 = beta2;
        this.weight = weight;
    }

    @Override
    public ShrinkageMethod method() {
        return ShrinkageMethod.DUMOUCHEL_MIXTURE;
    }

    @Override
    public Posterior posterior(long observed, double expected) {
        double e = Math.max(0.0, expected);
        double q = posteriorWeight(observed, e);

        double shape1 = alpha1 + observed;
        double rate1 = beta1 + e;
        double shape2 = alpha2 + observed;
        double rate2 = beta2 + e;

        double expectedLog = q * (StatisticalFunctions.digamma(shape1) - Math.log(rate1))
                + (1 - q) * (StatisticalFunctions.digamma(shape2) - Math.log(rate2));
        double mean = q * shape1 / rate1 + (1 - q) * shape2 / rate2;

        return new Posterior(
                Math.exp(expectedLog),
                mixtureQuantile(0.05, q, shape1, rate1, shape2, rate2),
                mixtureQuantile(0.95, q, shape1, rate1, shape2, rate2),
                mean);
    }

    /** Posterior probability that the pair belongs to the first component. */
    double posteriorWeight(long observed, double expected) {
        if (!(expected > 0)) {
            // no exposure: the count carries no information about the component
            return weight;
        }
        double log1 = Math.log(weight) + logNegativeBinomial(observed, expected, alpha1, beta1);
        double log2 = Math.log(1 - weight) + logNegativeBinomial(observed, expected, alpha2, beta2);
        double max = Math.max(log1, log2);
        double p1 = Math.exp(log1 - max);
        double p2 = Math.exp(log2 - max);
        return p1 / (p1 + p2);
    }

    private static double logNegativeBinomial(long n, double e, double alpha, double beta) {
        double value = StatisticalFunctions.logGamma(alpha + n)
                - StatisticalFunctions.logGamma(alpha)
                - StatisticalFunctions.logFactorial(n)
                + alpha * Math.log(beta / (beta + e));
        if (n > 0) {
            value += n * Math.log(e / (beta + e));
        }
        return value;
    }

    private static double mixtureQuantile(
            double p, double q, double shape1, double rate1, double shape2, double rate2) {
        // the mixture quantile lies between the component quantiles
        double first = StatisticalFunctions.gammaQuantile(p, shape1, rate1);
        double second = StatisticalFunctions.gammaQuantile(p, shape2, rate2);
        double lo = Math.min(first, second);
        double hi = Math.max(first, second);
        for (int i = 0; i < 100; i++) {
            double mid = 0.5 * (lo + hi);
            double cdf = q * StatisticalFunctions.regularizedGammaP(shape1, rate1 * mid)
                    + (1 - q) * StatisticalFunctions.regularizedGammaP(shape2, rate2 * mid);
            if (cdf < p) {
                lo = mid;
            } else {
                hi = mid;
            }
            if (hi - lo <= 1e-12 * Math.max(1.0, hi)) {
                break;
            }
        }
        return 0.5 * (lo + hi);
    }
}
