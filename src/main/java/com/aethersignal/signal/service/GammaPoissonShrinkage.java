/* (C)2026 */
package com.aethersignal.signal.service;

import com.aethersignal.signal.enumeration.ShrinkageMethod;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.util.StatisticalFunctions;

/**
 * Single gamma prior: lambda ~ Gamma(alpha, beta), so the posterior is
 * Gamma(alpha + n, beta + E).
 */
public final class GammaPoissonShrinkage implements ShrinkageModel {

    private final double alpha;
    private final double beta;

    public GammaPoissonShrinkage(double alpha, double beta) {
        if (!(alpha > 0)) {
            throw ValidationException.invalidParameter("alpha", alpha, "positive value");
        }
        if (!(beta > 0)) {
            throw ValidationException.invalidParameter("beta", beta, "positive value");
        }
        this.alpha = alpha;
        this.beta = beta;
    }

    @Override
    public ShrinkageMethod method() {
        return ShrinkageMethod.GAMMA_POISSON;
    }

    @Override
    public Posterior posterior(long observed, double expected) {
        double shape = alpha + observed;
        double rate = beta + Math.max(0.0, expected);
        double ebgm = Math.exp(StatisticalFunctions.digamma(shape) - Math.log(rate));
        return new Posterior(
                ebgm,
                StatisticalFunctions.gammaQuantile(0.05, shape, rate),
                StatisticalFunctions.gammaQuantile(0.95, shape, rate),
                shape / rate);
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }
}
