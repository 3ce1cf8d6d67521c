/* (C)2026 */
package com.aethersignal.signal.model;

import com.aethersignal.signal.enumeration.SignalStrength;
import java.util.List;

/**
 * Classical, Bayesian, causality and temporal evidence for one drug-event pair.
 *
 * @param causality {@code null} when no clinical features were supplied
 * @param temporal {@code null} when no time series was supplied
 * @param signal true when at least one of PRR, ROR, IC flags the pair
 * @param methodsFlagged flagged method names in PRR, ROR, IC order, then EBGM when the
 *     Bayesian estimate counts toward strength
 * @param compositeScore weighted classical/Bayesian/temporal/causality score in [0, 1]
 */
public record UnifiedSignalResult(
        String drug,
        String event,
        ContingencyTable table,
        DisproportionalityResult disproportionality,
        BayesianSignal bayesian,
        CausalityAssessment causality,
        TemporalPatternResult temporal,
        boolean signal,
        SignalStrength signalStrength,
        List<String> methodsFlagged,
        double compositeScore,
        List<String> keyFindings,
        List<String> riskFactors,
        List<String> recommendations) {

    public UnifiedSignalResult {
        methodsFlagged = List.copyOf(methodsFlagged);
        keyFindings = List.copyOf(keyFindings);
        riskFactors = List.copyOf(riskFactors);
        recommendations = List.copyOf(recommendations);
    }
}
