/* (C)2026 */
package com.aethersignal.signal.enumeration;

/**
 * WHO-UMC causality categories.
 */
public enum CausalityCategory
{
    CERTAIN(0.95),
    PROBABLE(0.75),
    POSSIBLE(0.50),
    UNLIKELY(0.25),
    CONDITIONAL(0.40),
    UNASSESSABLE(0.20);

    private final double baseConfidence;

    CausalityCategory(double baseConfidence) {
        this.baseConfidence = baseConfidence;
    }

    /** Starting confidence before Naranjo and evidence adjustments. */
    public double getBaseConfidence() { return baseConfidence; }

    public boolean isStrong() {
        return this == CERTAIN || this == PROBABLE;
    }
}
