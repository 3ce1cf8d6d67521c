/* (C)2026 */
package com.aethersignal.signal.model;

/**
 * Point estimate of a reporting ratio with its 95% confidence interval.
 *
 * @param value point estimate, 0 when undefined
 * @param ciLower lower 95% bound, 0 when undefined
 * @param ciUpper upper 95% bound, 0 when undefined
 * @param signal whether the ratio meets the configured signal rule
 * @param defined false when a zero cell or marginal makes the ratio undefined
 */
public record RatioEstimate(double value, double ciLower, double ciUpper, boolean signal, boolean defined) {

    private static final RatioEstimate UNDEFINED = new RatioEstimate(0.0, 0.0, 0.0, false, false);

    public static RatioEstimate undefined() {
        return UNDEFINED;
    }
}
