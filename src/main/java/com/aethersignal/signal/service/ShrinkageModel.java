/* (C)2026 */
package com.aethersignal.signal.service;

import com.aethersignal.signal.enumeration.ShrinkageMethod;

/**
 * Empirical-Bayes prior over the true reporting ratio of a drug-event pair.
 *
 * <p>Implementations are immutable and combine the prior with a Poisson likelihood for the
 * observed count given its expected count.
 */
public interface ShrinkageModel {

    ShrinkageMethod method();

    /**
     * Posterior summary for an observed count.
     *
     * @param observed n11, non-negative
     * @param expected count expected under independence, non-negative
     */
    Posterior posterior(long observed, double expected);

    /**
     * Posterior summary of the reporting ratio.
     *
     * @param ebgm exp(E[ln lambda])
     * @param eb05 5th percentile
     * @param eb95 95th percentile
     * @param mean posterior mean
     */
    record Posterior(double ebgm, double eb05, double eb95, double mean) {}
}
