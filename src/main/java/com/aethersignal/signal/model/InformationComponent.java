/* (C)2026 */
package com.aethersignal.signal.model;

/**
 * Information component IC = log2(observed / expected) with its simplified credibility
 * bounds.
 *
 * @param ic point estimate, 0 when undefined
 * @param ic025 lower bound, IC - 1.96 sqrt(1/n11)
 * @param ic975 upper bound, IC + 1.96 sqrt(1/n11)
 * @param signal whether IC025 exceeds the configured threshold
 * @param defined false when n11 or a marginal is zero
 */
public record InformationComponent(double ic, double ic025, double ic975, boolean signal, boolean defined) {

    private static final InformationComponent UNDEFINED =
            new InformationComponent(0.0, 0.0, 0.0, false, false);

    public static InformationComponent undefined() {
        return UNDEFINED;
    }
}
