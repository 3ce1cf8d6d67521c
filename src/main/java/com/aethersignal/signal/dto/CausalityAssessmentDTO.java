/* (C)2026 */
package com.aethersignal.signal.dto;

import static com.aethersignal.signal.util.NumericSanitizer.sanitize;

import com.aethersignal.signal.model.CausalityAssessment;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "WHO-UMC and Naranjo causality assessment")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CausalityAssessmentDTO(
        @Schema(description = "WHO-UMC category") String whoCategory,
        @Schema(description = "Why the WHO-UMC category was chosen") String whoReasoning,
        @Schema(description = "Naranjo total score (-4 to 13)") Integer naranjoScore,
        @Schema(description = "Naranjo category") String naranjoCategory,
        @Schema(description = "Naranjo answers by question") List<CausalityAssessment.NaranjoAnswer> naranjoDetails,
        @Schema(description = "Overall confidence in [0, 0.98]") Double confidence,
        @Schema(description = "Primary factors") List<String> primaryFactors,
        @Schema(description = "Supporting factors") List<String> supportingFactors,
        @Schema(description = "Conflicting factors") List<String> conflictingFactors,
        @Schema(description = "Recommendation") String recommendation,
        @Schema(description = "Clinical action") String clinicalAction,
        @Schema(description = "Onset compared with the population latency IQR")
                CausalityAssessment.LatencyConsistency latencyConsistency) {

    public static CausalityAssessmentDTO from(CausalityAssessment assessment) {
        if (assessment == null) {
            return null;
        }
        return new CausalityAssessmentDTO(
                assessment.whoCategory().name(),
                assessment.whoReasoning(),
                assessment.naranjoScore(),
                assessment.naranjoCategory().name(),
                assessment.naranjoDetails(),
                sanitize(assessment.confidence()),
                assessment.primaryFactors(),
                assessment.supportingFactors(),
                assessment.conflictingFactors(),
                assessment.recommendation(),
                assessment.clinicalAction(),
                assessment.latencyConsistency());
    }
}
