/* (C)2026 */
package com.aethersignal.signal.dto;

import static com.aethersignal.signal.util.NumericSanitizer.sanitize;

import com.aethersignal.signal.model.CompleteFusionResult;
import com.aethersignal.signal.model.Layer2Components;
import com.aethersignal.signal.model.QuantumComponents;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Fused score for one pair with its per-layer breakdown.
 *
 * <p>Ranks and percentile are only present for batch and query results.
 */
@Schema(description = "Three-layer fusion result")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FusionResultDTO(
        @Schema(description = "Drug name") String drug,
        @Schema(description = "Adverse event term") String event,
        @Schema(description = "Matching case count") Long count,
        @Schema(description = "Fused score in [0, 1]") Double fusionScore,
        @Schema(
                        description = "Alert level",
                        enumeration = {"CRITICAL", "HIGH", "MODERATE", "WATCHLIST", "LOW", "NONE"})
                String alertLevel,
        @Schema(description = "Classical layer score; absent without a contingency table") Double classicalScore,
        @Schema(description = "Single-source quantum layer score") Double quantumScoreLayer1,
        @Schema(description = "Multi-source quantum layer score; absent without sources") Double quantumScoreLayer2,
        @Schema(description = "Per-factor breakdown") Map<String, Double> components,
        @Schema(description = "Rank by fusion score within the batch, 1-based") Integer quantumRank,
        @Schema(description = "Rank by classical score within the batch, 1-based") Integer classicalRank,
        @Schema(description = "quantumRank / batch size") Double percentile,
        @Schema(description = "Unified classical and Bayesian result") UnifiedSignalResponseDTO unified) {

    public static FusionResultDTO from(CompleteFusionResult result) {
        return new FusionResultDTO(
                result.drug(),
                result.event(),
                result.count(),
                sanitize(result.fusionScore()),
                result.alertLevel().name(),
                sanitize(result.classicalScore()),
                sanitize(result.quantumScoreLayer1()),
                sanitize(result.quantumScoreLayer2()),
                components(result.components()),
                result.quantumRank(),
                result.classicalRank(),
                sanitize(result.percentile()),
                UnifiedSignalResponseDTO.from(result.unified()));
    }

    static Map<String, Double> components(QuantumComponents components) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("rarity", sanitize(components.rarity()));
        values.put("seriousness", sanitize(components.seriousness()));
        values.put("recency", sanitize(components.recency()));
        values.put("countNormalized", sanitize(components.countNormalized()));
        values.put("baseScore", sanitize(components.baseScore()));
        values.put("interactionRareSerious", sanitize(components.interactionRareSerious()));
        values.put("interactionRareRecent", sanitize(components.interactionRareRecent()));
        values.put("interactionSeriousRecent", sanitize(components.interactionSeriousRecent()));
        values.put("interactionAllThree", sanitize(components.interactionAllThree()));
        values.put("tunnelingBonus", sanitize(components.tunnelingBonus()));
        Layer2Components layer2 = components.layer2();
        if (layer2 != null) {
            values.put("layer2Frequency", sanitize(layer2.frequency()));
            values.put("layer2Severity", sanitize(layer2.severity()));
            values.put("layer2Burst", sanitize(layer2.burst()));
            values.put("layer2Novelty", sanitize(layer2.novelty()));
            values.put("layer2Consensus", sanitize(layer2.consensus()));
            values.put("layer2Mechanism", sanitize(layer2.mechanism()));
        }
        return values;
    }
}
