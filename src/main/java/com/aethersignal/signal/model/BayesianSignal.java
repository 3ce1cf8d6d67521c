/* (C)2026 */
package com.aethersignal.signal.model;

import com.aethersignal.signal.enumeration.ShrinkageMethod;

/**
 * Empirical-Bayes shrinkage estimate of the observed-to-expected reporting ratio.
 *
 * @param method model that produced the estimate
 * @param observed n11
 * @param expected count expected under independence
 * @param ebgm empirical Bayes geometric mean of the posterior
 * @param eb05 posterior 5th percentile
 * @param eb95 posterior 95th percentile
 * @param posteriorMean posterior mean of the ratio
 * @param signal whether EB05 meets the configured threshold
 */
public record BayesianSignal(
        ShrinkageMethod method,
        long observed,
        double expected,
        double ebgm,
        double eb05,
        double eb95,
        double posteriorMean,
        boolean signal) {}
