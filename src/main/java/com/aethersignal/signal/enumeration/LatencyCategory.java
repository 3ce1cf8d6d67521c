/* (C)2026 */
package com.aethersignal.signal.enumeration;

/**
 * Time-to-onset bands.
 */
public enum LatencyCategory
{
    /** Up to one day. */
    IMMEDIATE(1),
    /** Two to seven days. */
    EARLY(7),
    /** Eight to thirty days. */
    DELAYED(30),
    /** Thirty-one to ninety days. */
    LATE(90),
    /** More than ninety days. */
    VERY_LATE(Integer.MAX_VALUE);

    private final int maxDays;

    LatencyCategory(int maxDays) {
        this.maxDays = maxDays;
    }

    public static LatencyCategory fromDays(int days) {
        for (LatencyCategory category : values()) {
            if (days <= category.maxDays) {
                return category;
            }
        }
        return VERY_LATE;
    }

    public int getMaxDays() { return maxDays; }
}
