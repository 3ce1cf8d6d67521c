/* (C)2026 */
package com.aethersignal.signal.dto;

import com.aethersignal.signal.model.ClinicalFeatures;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Patient-level evidence. Omitted fields mean "not assessed".
 */
@Schema(description = "Clinical evidence for causality assessment")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClinicalFeaturesDTO(
        @Schema(description = "Days from first dose to onset") Integer timeToOnsetDays,
        @Schema(description = "Reaction improved after withdrawal") Boolean dechallengeImproved,
        @Schema(description = "Reaction recurred on re-administration") Boolean rechallengeRecurred,
        @Schema(description = "Alternative causes found; empty when none were found") List<String> alternativeCauses,
        @Schema(description = "Severity changed with dose") Boolean doseResponse,
        @Schema(description = "Reaction is known for the drug") Boolean knownReaction,
        @Schema(description = "Objective laboratory evidence") Boolean labEvidence,
        @Schema(description = "Drug detected at toxic concentration") Boolean toxicDrugLevel,
        @Schema(description = "Similar reaction to the same or a similar drug before") Boolean previousSimilarReaction,
        @Schema(description = "Concomitant drugs could explain the reaction") Boolean concomitantDrugsCouldCause,
        @Schema(description = "The treated condition could explain the reaction") Boolean indicationCouldCause,
        @Schema(description = "Route of administration is plausible for the reaction") Boolean routePlausible) {

    public ClinicalFeatures toModel() {
        return ClinicalFeatures.builder()
                .timeToOnsetDays(timeToOnsetDays)
                .dechallengeImproved(Boolean.TRUE.equals(dechallengeImproved))
                .rechallengeRecurred(rechallengeRecurred)
                .alternativeCauses(alternativeCauses)
                .doseResponse(Boolean.TRUE.equals(doseResponse))
                .knownReaction(knownReaction)
                .labEvidence(labEvidence)
                .toxicDrugLevel(toxicDrugLevel)
                .previousSimilarReaction(previousSimilarReaction)
                .concomitantDrugsCouldCause(concomitantDrugsCouldCause)
                .indicationCouldCause(indicationCouldCause)
                .routePlausible(routePlausible)
                .build();
    }
}
