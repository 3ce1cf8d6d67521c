/* (C)2026 */
package com.aethersignal.signal.config;

import com.aethersignal.signal.exception.ValidationException;

/**
 * Decision thresholds shared by the PRR, ROR, IC and EB05 signal rules.
 *
 * @param prrThreshold minimum PRR point estimate
 * @param rorThreshold ROR point estimate must exceed this
 * @param ciLowerThreshold lower 95% CI bound of PRR and ROR must exceed this
 * @param ic025Threshold IC025 must exceed this
 * @param minCases minimum drug-event co-reports for PRR and ROR
 * @param eb05Threshold EB05 must meet or exceed this
 */
public record DisproportionalityThresholds(
        double prrThreshold,
        double rorThreshold,
        double ciLowerThreshold,
        double ic025Threshold,
        int minCases,
        double eb05Threshold) {

    public DisproportionalityThresholds {
        if (prrThreshold <= 0) {
            throw ValidationException.invalidParameter("prrThreshold", prrThreshold, "positive value");
        }
        if (rorThreshold <= 0) {
            throw ValidationException.invalidParameter("rorThreshold", rorThreshold, "positive value");
        }
        if (ciLowerThreshold <= 0) {
            throw ValidationException.invalidParameter(
                    "ciLowerThreshold", ciLowerThreshold, "positive value");
        }
        if (minCases < 1) {
            throw ValidationException.invalidParameter("minCases", minCases, "at least 1");
        }
        if (eb05Threshold <= 0) {
            throw ValidationException.invalidParameter("eb05Threshold", eb05Threshold, "positive value");
        }
    }

    public DisproportionalityThresholds withMinCases(int cases) {
        return new DisproportionalityThresholds(
                prrThreshold, rorThreshold, ciLowerThreshold, ic025Threshold, cases, eb05Threshold);
    }
}
