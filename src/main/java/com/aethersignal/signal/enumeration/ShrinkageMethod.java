/* (C)2026 */
package com.aethersignal.signal.enumeration;

/**
 * Empirical-Bayes shrinkage models available to the Bayesian detector.
 */
public enum ShrinkageMethod
{
    /** Single gamma prior with a conjugate Poisson likelihood. */
    GAMMA_POISSON,
    /** DuMouchel's two-component gamma mixture prior (MGPS). */
    DUMOUCHEL_MIXTURE
}
