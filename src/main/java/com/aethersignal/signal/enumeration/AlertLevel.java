/* (C)2026 */
package com.aethersignal.signal.enumeration;

import java.util.Locale;
import java.util.Map;

/**
 * Categorical alert derived from a fusion score.
 *
 * <p>Thresholds are supplied by configuration. A score is classified into the most severe
 * level whose threshold it meets or exceeds; {@link #NONE} has no threshold.
 */
public enum AlertLevel
{
    CRITICAL,
    HIGH,
    MODERATE,
    WATCHLIST,
    LOW,
    NONE;

    /**
     * Returns the alert level for a score.
     *
     * @param score fusion score in [0, 1]
     * @param thresholds minimum score per level; levels without an entry are never selected
     */
    public static AlertLevel fromScore(double score, Map<AlertLevel, Double> thresholds) {
        for (AlertLevel level : values()) {
            Double threshold = thresholds.get(level);
            if (threshold != null && score >= threshold) {
                return level;
            }
        }
        return NONE;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
