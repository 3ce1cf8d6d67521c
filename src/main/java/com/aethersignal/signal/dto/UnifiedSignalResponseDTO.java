/* (C)2026 */
package com.aethersignal.signal.dto;

import static com.aethersignal.signal.util.NumericSanitizer.sanitize;

import com.aethersignal.signal.model.UnifiedSignalResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Unified signal detection result")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnifiedSignalResponseDTO(
        @Schema(description = "Drug name") String drug,
        @Schema(description = "Adverse event term") String event,
        @Schema(description = "Whether any method flagged the pair") Boolean signal,
        @Schema(description = "Signal strength", enumeration = {"NONE", "WEAK", "MODERATE", "STRONG", "VERY_STRONG"})
                String signalStrength,
        @Schema(description = "Methods that flagged the pair") List<String> methodsFlagged,
        @Schema(description = "Composite score in [0, 1]") Double compositeScore,
        @Schema(description = "Classical statistics") DisproportionalityResponseDTO disproportionality,
        @Schema(description = "Bayesian shrinkage estimate") BayesianSignalDTO bayesian,
        @Schema(description = "Causality assessment, when clinical features were given") CausalityAssessmentDTO causality,
        @Schema(description = "Temporal analysis, when a time series was given") TemporalPatternDTO temporal,
        @Schema(description = "Key findings") List<String> keyFindings,
        @Schema(description = "Risk factors") List<String> riskFactors,
        @Schema(description = "Recommendations") List<String> recommendations) {

    public static UnifiedSignalResponseDTO from(UnifiedSignalResult result) {
        if (result == null) {
            return null;
        }
        return new UnifiedSignalResponseDTO(
                result.drug(),
                result.event(),
                result.signal(),
                result.signalStrength().name(),
                result.methodsFlagged(),
                sanitize(result.compositeScore()),
                DisproportionalityResponseDTO.from(result.disproportionality()),
                BayesianSignalDTO.from(result.bayesian()),
                CausalityAssessmentDTO.from(result.causality()),
                TemporalPatternDTO.from(result.temporal()),
                result.keyFindings(),
                result.riskFactors(),
                result.recommendations());
    }
}
