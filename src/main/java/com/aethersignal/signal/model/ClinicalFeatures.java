/* (C)2026 */
package com.aethersignal.signal.model;

import java.util.List;

/**
 * Patient-level evidence for causality assessment.
 *
 * <p>A {@code null} field means "not assessed", which is different from {@code false}.
 * Only {@code dechallengeImproved} and {@code doseResponse} are plain booleans that
 * default to {@code false}. An empty {@code alternativeCauses} list means alternatives were
 * looked for and none were found; {@code null} means nobody looked.
 */
public record ClinicalFeatures(
        Integer timeToOnsetDays,
        boolean dechallengeImproved,
        Boolean rechallengeRecurred,
        List<String> alternativeCauses,
        boolean doseResponse,
        Boolean knownReaction,
        Boolean labEvidence,
        Boolean toxicDrugLevel,
        Boolean previousSimilarReaction,
        Boolean concomitantDrugsCouldCause,
        Boolean indicationCouldCause,
        Boolean routePlausible) {

    public ClinicalFeatures {
        alternativeCauses = alternativeCauses == null ? null : ModelInputs.listOf(alternativeCauses, "alternativeCauses");
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean alternativesAssessed() {
        return alternativeCauses != null;
    }

    public int alternativeCauseCount() {
        return alternativeCauses == null ? 0 : alternativeCauses.size();
    }

    /** True when at least one field carries information. */
    public boolean hasAnyAssessment() {
        return timeToOnsetDays != null
                || dechallengeImproved
                || rechallengeRecurred != null
                || alternativeCauses != null
                || doseResponse
                || knownReaction != null
                || labEvidence != null
                || toxicDrugLevel != null
                || previousSimilarReaction != null
                || concomitantDrugsCouldCause != null
                || indicationCouldCause != null
                || routePlausible != null;
    }

    public static final class Builder {
        private Integer timeToOnsetDays;
        private boolean dechallengeImproved;
        private Boolean rechallengeRecurred;
        private List<String> alternativeCauses;
        private boolean doseResponse;
        private Boolean knownReaction;
        private Boolean labEvidence;
        private Boolean toxicDrugLevel;
        private Boolean previousSimilarReaction;
        private Boolean concomitantDrugsCouldCause;
        private Boolean indicationCouldCause;
        private Boolean routePlausible;

        private Builder() {}

        public Builder timeToOnsetDays(Integer value) {
            this.timeToOnsetDays = value;
            return this;
        }

        public Builder dechallengeImproved(boolean value) {
            this.dechallengeImproved = value;
            return this;
        }

        public Builder rechallengeRecurred(Boolean value) {
            this.rechallengeRecurred = value;
            return this;
        }

        public Builder alternativeCauses(List<String> value) {
            this.alternativeCauses = value;
            return this;
        }

        public Builder doseResponse(boolean value) {
            this.doseResponse = value;
            return this;
        }

        public Builder knownReaction(Boolean value) {
            this.knownReaction = value;
            return this;
        }

        public Builder labEvidence(Boolean value) {
            this.labEvidence = value;
            return this;
        }

        public Builder toxicDrugLevel(Boolean value) {
            this.toxicDrugLevel = value;
            return this;
        }

        public Builder previousSimilarReaction(Boolean value) {
            this.previousSimilarReaction = value;
            return this;
        }

        public Builder concomitantDrugsCouldCause(Boolean value) {
            this.concomitantDrugsCouldCause = value;
            return this;
        }

        public Builder indicationCouldCause(Boolean value) {
            this.indicationCouldCause = value;
            return this;
        }

        public Builder routePlausible(Boolean value) {
            this.routePlausible = value;
            return this;
        }

        public ClinicalFeatures build() {
            return new ClinicalFeatures(
                    timeToOnsetDays,
                    dechallengeImproved,
                    rechallengeRecurred,
                    alternativeCauses,
                    doseResponse,
                    knownReaction,
                    labEvidence,
                    toxicDrugLevel,
                    previousSimilarReaction,
                    concomitantDrugsCouldCause,
                    indicationCouldCause,
                    routePlausible);
        }
    }
}
