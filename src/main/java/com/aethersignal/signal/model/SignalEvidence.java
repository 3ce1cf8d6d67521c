/* (C)2026 */
package com.aethersignal.signal.model;

import com.aethersignal.signal.exception.ValidationException;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything known about one drug-event pair, ready for fusion.
 *
 * <p>{@code drug}, {@code event}, {@code signalData} and a positive {@code totalCases} are
 * required. Every other field is optional and only enables the analyses that need it.
 *
 * @param totalCases size of the case population, the denominator for rarity
 * @param latencies per-case time-to-onset values in days
 * @param sources sources available to the query; a non-empty list enables Layer 2
 * @param labelReactions reactions on the product label, used for novelty and mechanism
 */
public record SignalEvidence(
        String drug,
        String event,
        SignalData signalData,
        long totalCases,
        ContingencyTable contingencyTable,
        ClinicalFeatures clinicalFeatures,
        TimeSeriesData timeSeries,
        LocalDate firstReportDate,
        List<Integer> latencies,
        List<String> sources,
        List<String> labelReactions) {

    public SignalEvidence {
        if (drug == null || drug.isBlank()) throw ValidationException.missingInput("drug");
        if (event == null || event.isBlank()) throw ValidationException.missingInput("event");
        if (signalData == null) throw ValidationException.missingInput("signalData");
        if (totalCases <= 0) {
            throw ValidationException.invalidParameter("totalCases", totalCases, "positive value");
        }
        latencies = ModelInputs.listOf(latencies, "latencies");
        sources = ModelInputs.listOf(sources, "sources");
        labelReactions = ModelInputs.listOf(labelReactions, "labelReactions");
    }

    public static Builder builder(String drug, String event) {
        return new Builder(drug, event);
    }

    /** True when multi-source scoring applies. */
    public boolean hasMultiSourceEvidence() {
        return !sources.isEmpty() || !signalData.sources().isEmpty();
    }

    public static final class Builder {
        private final String drug;
        private final String event;
        private SignalData signalData;
        private long totalCases;
        private ContingencyTable contingencyTable;
        private ClinicalFeatures clinicalFeatures;
        private TimeSeriesData timeSeries;
        private LocalDate firstReportDate;
        private List<Integer> latencies;
        private List<String> sources;
        private List<String> labelReactions;

        private Builder(String drug, String event) {
            this.drug = drug;
            this.event = event;
        }

        public Builder signalData(SignalData value) {
            this.signalData = value;
            return this;
        }

        public Builder totalCases(long value) {
            this.totalCases = value;
            return this;
        }

        public Builder contingencyTable(ContingencyTable value) {
            this.contingencyTable = value;
            return this;
        }

        public Builder clinicalFeatures(ClinicalFeatures value) {
            this.clinicalFeatures = value;
            return this;
        }

        public Builder timeSeries(TimeSeriesData value) {
            this.timeSeries = value;
            return this;
        }

        public Builder firstReportDate(LocalDate value) {
            this.firstReportDate = value;
            return this;
        }

        public Builder latencies(List<Integer> value) {
            this.latencies = value;
            return this;
        }

        public Builder sources(List<String> value) {
            this.sources = value;
            return this;
        }

        public Builder labelReactions(List<String> value) {
            this.labelReactions = value;
            return this;
        }

        public SignalEvidence build() {
            return new SignalEvidence(
                    drug,
                    event,
                    signalData,
                    totalCases,
                    contingencyTable,
                    clinicalFeatures,
                    timeSeries,
                    firstReportDate,
                    latencies,
                    sources,
                    labelReactions);
        }
    }
}
