/* (C)2026 */
package com.aethersignal.signal.model;

import com.aethersignal.signal.enumeration.CausalityCategory;
import com.aethersignal.signal.enumeration.NaranjoCategory;
import java.util.List;

/**
 * Combined WHO-UMC and Naranjo causality assessment for one drug-event pair.
 *
 * @param confidence overall confidence in the causal link, in [0, 0.98]
 * @param latencyConsistency comparison of the case onset with the population latency
 *     distribution, {@code null} when either side is unknown
 */
public record CausalityAssessment(
        String drug,
        String event,
        CausalityCategory whoCategory,
        String whoReasoning,
        int naranjoScore,
        NaranjoCategory naranjoCategory,
        List<NaranjoAnswer> naranjoDetails,
        double confidence,
        List<String> primaryFactors,
        List<String> supportingFactors,
        List<String> conflictingFactors,
        String recommendation,
        String clinicalAction,
        LatencyConsistency latencyConsistency) {

    public CausalityAssessment {
        naranjoDetails = List.copyOf(naranjoDetails);
        primaryFactors = List.copyOf(primaryFactors);
        supportingFactors = List.copyOf(supportingFactors);
        conflictingFactors = List.copyOf(conflictingFactors);
    }

    public enum Answer { YES, NO, UNKNOWN }

    /** One Naranjo questionnaire item. */
    public record NaranjoAnswer(int question, String text, Answer answer, int points) {}

    /**
     * Whether a case's time to onset falls inside the population interquartile range.
     */
    public record LatencyConsistency(int onsetDays, double q1, double q3, boolean consistent) {}
}
