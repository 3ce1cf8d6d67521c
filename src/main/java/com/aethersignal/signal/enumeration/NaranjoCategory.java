/* (C)2026 */
package com.aethersignal.signal.enumeration;

/**
 * Naranjo adverse drug reaction probability bands.
 */
public enum NaranjoCategory
{
    /** Score of 9 or above. */
    DEFINITE(9),
    /** Score 5 to 8. */
    PROBABLE(5),
    /** Score 1 to 4. */
    POSSIBLE(1),
    /** Score of 0 or below. */
    DOUBTFUL(Integer.MIN_VALUE);

    private final int minimumScore;

    NaranjoCategory(int minimumScore) {
        this.minimumScore = minimumScore;
    }

    public static NaranjoCategory fromScore(int score) {
        if (score >= DEFINITE.minimumScore) return DEFINITE;
        if (score >= PROBABLE.minimumScore) return PROBABLE;
        if (score >= POSSIBLE.minimumScore) return POSSIBLE;
        return DOUBTFUL;
    }

    public int getMinimumScore() { return minimumScore; }
}
