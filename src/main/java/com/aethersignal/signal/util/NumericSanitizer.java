/* (C)2026 */
package com.aethersignal.signal.util;

/**
 * Replaces non-finite doubles with a fixed out-of-range sentinel before they reach JSON.
 */
public final class NumericSanitizer {

    /** Value substituted for NaN and infinities. Never a legal score or ratio. */
    public static final double SENTINEL = -1.0;

    private NumericSanitizer() {}

    public static double sanitize(double value) {
        return Double.isFinite(value) ? value : SENTINEL;
    }

    /** Null-preserving variant for optional statistics. */
    public static Double sanitize(Double value) {
        return value == null ? null : sanitize(value.doubleValue());
    }

    public static boolean isSentinel(double value) {
        return value == SENTINEL;
    }
}
