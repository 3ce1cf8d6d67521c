/* (C)2026 */
package com.aethersignal.signal.enumeration;

/**
 * Ordered strength of a disproportionality signal, derived from how many independent
 * methods flag the pair.
 *
 * <p>Declaration order is the severity order, so {@link #compareTo} can be used directly.
 */
public enum SignalStrength
{
    /** No method flags the pair. */
    NONE,
    /** One method flags the pair. */
    WEAK,
    /** Two methods agree. */
    MODERATE,
    /** All three classical methods agree. */
    STRONG,
    /** Classical methods and the Bayesian lower bound agree. */
    VERY_STRONG;

    private static final SignalStrength[] BY_COUNT = {NONE, WEAK, MODERATE, STRONG, VERY_STRONG};

    /**
     * Maps a count of agreeing methods to a strength.
     *
     * @param flaggedMethods number of methods that flagged the pair, 0 or more
     * @return strength for the count; counts above four saturate at {@link #VERY_STRONG}
     */
    public static SignalStrength fromFlaggedCount(int flaggedMethods) {
        if (flaggedMethods < 0) {
            throw new IllegalArgumentException("flaggedMethods must be non-negative");
        }
        return BY_COUNT[Math.min(flaggedMethods, BY_COUNT.length - 1)];
    }

    public boolean isAtLeast(SignalStrength other) {
        return compareTo(other) >= 0;
    }
}
