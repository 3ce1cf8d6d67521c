/* (C)2026 */
package com.aethersignal.signal.enumeration;

public enum TrendDirection
{
    INCREASING,
    STABLE,
    DECREASING,
    /** No directional change but high dispersion between buckets. */
    FLUCTUATING
}
