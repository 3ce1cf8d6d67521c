/* (C)2026 */
package com.aethersignal.signal.model;

import com.aethersignal.signal.enumeration.SourceType;
import com.aethersignal.signal.exception.ValidationException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregated case-level facts for one pair, as supplied by a metrics provider.
 *
 * @param count matching case reports
 * @param seriousCount of which marked serious
 * @param seriousness explicit serious fraction in [0, 1]; overrides {@code seriousCount / count}
 * @param dates report or onset dates
 * @param outcomes free-text case outcomes
 * @param sources names of the sources that reported the pair
 * @param sourceConfidence per-source confidence in [0, 1], default 0.5
 * @param sourceStrength per-source signal strength in [0, 1], default 0.5
 * @param sourceTypes explicit source types, overriding name-based inference
 * @param severity explicit severity score in [0, 1]
 * @param burstScore precomputed burst score in [0, 1]; derived from the time series otherwise
 * @param mechanismScore explicit mechanism plausibility in [0, 1]
 * @param mostRecentDate most recent report date when individual dates are not listed
 */
public record SignalData(
        long count,
        long seriousCount,
        Double seriousness,
        List<LocalDate> dates,
        List<String> outcomes,
        List<String> sources,
        Map<String, Double> sourceConfidence,
        Map<String, Double> sourceStrength,
        Map<String, SourceType> sourceTypes,
        Double severity,
        Double burstScore,
        Double mechanismScore,
        LocalDate mostRecentDate) {

    public SignalData {
        if (count < 0) throw ValidationException.negativeCount("count", count);
        if (seriousCount < 0) throw ValidationException.negativeCount("seriousCount", seriousCount);
        if (seriousCount > count) {
            throw ValidationException.invalidParameter("seriousCount", seriousCount, "at most count (" + count + ")");
        }
        ModelInputs.unitInterval(seriousness, "seriousness");
        ModelInputs.unitInterval(severity, "severity");
        ModelInputs.unitInterval(burstScore, "burstScore");
        ModelInputs.unitInterval(mechanismScore, "mechanismScore");
        dates = ModelInputs.listOf(dates, "dates");
        outcomes = ModelInputs.listOf(outcomes, "outcomes");
        sources = ModelInputs.listOf(sources, "sources");
        sourceConfidence = ModelInputs.unitIntervalMapOf(sourceConfidence, "sourceConfidence");
        sourceStrength = ModelInputs.unitIntervalMapOf(sourceStrength, "sourceStrength");
        sourceTypes = ModelInputs.mapOf(sourceTypes, "sourceTypes");
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Serious fraction: the explicit value when given, else seriousCount / count. */
    public double seriousFraction() {
        if (seriousness != null) {
            return seriousness;
        }
        return count == 0 ? 0.0 : (double) seriousCount / count;
    }

    public boolean anySerious() {
        return seriousCount > 0 || (seriousness != null && seriousness > 0);
    }

    /** Latest of the listed dates and {@code mostRecentDate}. */
    public Optional<LocalDate> latestDate() {
        LocalDate latest = mostRecentDate;
        for (LocalDate date : dates) {
            if (latest == null || date.isAfter(latest)) {
                latest = date;
            }
        }
        return Optional.ofNullable(latest);
    }

    public SourceType sourceTypeOf(String source) {
        SourceType explicit = sourceTypes.get(source);
        return explicit != null ? explicit : SourceType.infer(source);
    }

    public static final class Builder {
        private long count;
        private long seriousCount;
        private Double seriousness;
        private List<LocalDate> dates;
        private List<String> outcomes;
        private List<String> sources;
        private Map<String, Double> sourceConfidence;
        private Map<String, Double> sourceStrength;
        private Map<String, SourceType> sourceTypes;
        private Double severity;
        private Double burstScore;
        private Double mechanismScore;
        private LocalDate mostRecentDate;

        private Builder() {}

        public Builder count(long value) {
            this.count = value;
            return this;
        }

        public Builder seriousCount(long value) {
            this.seriousCount = value;
            return this;
        }

        public Builder seriousness(Double value) {
            this.seriousness = value;
            return this;
        }

        public Builder dates(List<LocalDate> value) {
            this.dates = value;
            return this;
        }

        public Builder outcomes(List<String> value) {
            this.outcomes = value;
            return this;
        }

        public Builder sources(List<String> value) {
            this.sources = value;
            return this;
        }

        public Builder sourceConfidence(Map<String, Double> value) {
            this.sourceConfidence = value;
            return this;
        }

        public Builder sourceStrength(Map<String, Double> value) {
            this.sourceStrength = value;
            return this;
        }

        public Builder sourceTypes(Map<String, SourceType> value) {
            this.sourceTypes = value;
            return this;
        }

        public Builder severity(Double value) {
            this.severity = value;
            return this;
        }

        public Builder burstScore(Double value) {
            this.burstScore = value;
            return this;
        }

        public Builder mechanismScore(Double value) {
            this.mechanismScore = value;
            return this;
        }

        public Builder mostRecentDate(LocalDate value) {
            this.mostRecentDate = value;
            return this;
        }

        public SignalData build() {
            return new SignalData(
                    count,
                    seriousCount,
                    seriousness,
                    dates,
                    outcomes,
                    sources,
                    sourceConfidence,
                    sourceStrength,
                    sourceTypes,
                    severity,
                    burstScore,
                    mechanismScore,
                    mostRecentDate);
        }
    }
}
