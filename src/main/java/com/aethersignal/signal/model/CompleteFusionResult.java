/* (C)2026 */
package com.aethersignal.signal.model;

import com.aethersignal.signal.enumeration.AlertLevel;

/**
 * Final fused score for one drug-event pair.
 *
 * <p>Rank fields are {@code null} until a batch ranking pass assigns them through
 * {@link #withRanks}, which returns a copy.
 *
 * @param unified classical/Bayesian result, {@code null} without a contingency table
 * @param classicalScore composite score of {@code unified}, {@code null} without one
 * @param quantumScoreLayer2 {@code null} when no multi-source evidence was present
 * @param percentile {@code quantumRank / batchSize}
 */
public record CompleteFusionResult(
        String drug,
        String event,
        long count,
        UnifiedSignalResult unified,
        Double classicalScore,
        double quantumScoreLayer1,
        Double quantumScoreLayer2,
        double fusionScore,
        AlertLevel alertLevel,
        QuantumComponents components,
        Integer quantumRank,
        Integer classicalRank,
        Double percentile) {

    public CompleteFusionResult withRanks(int quantum, Integer classical, double batchPercentile) {
        return new CompleteFusionResult(
                drug,
                event,
                count,
                unified,
                classicalScore,
                quantumScoreLayer1,
                quantumScoreLayer2,
                fusionScore,
                alertLevel,
                components,
                quantum,
                classical,
                batchPercentile);
    }
}
