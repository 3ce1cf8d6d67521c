/* (C)2026 */
package com.aethersignal.signal.config;

import com.aethersignal.signal.enumeration.AlertLevel;
import com.aethersignal.signal.enumeration.ShrinkageMethod;
import com.aethersignal.signal.enumeration.SourceType;
import com.aethersignal.signal.enumeration.ThresholdPreset;
import com.aethersignal.signal.exception.ValidationException;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Immutable thresholds and weights for every stage of signal detection and fusion.
 *
 * <p>Built once at startup by {@link SignalDetectionConfigProducer} and shared read-only
 * across requests. Per-organization or per-user overrides are expressed by deriving a new
 * instance with {@link #toBuilder()}; the shared instance is never modified.
 */
public record SignalDetectionConfig(
        ThresholdPreset preset,
        DisproportionalityThresholds thresholds,
        BayesianSettings bayesian,
        CompositeWeights compositeWeights,
        Layer1Weights layer1Weights,
        InteractionSettings interactions,
        TunnelingSettings tunneling,
        SeriousnessWeights seriousness,
        RecencySettings recency,
        Layer2Weights layer2Weights,
        Map<SourceType, Double> sourcePriorities,
        NavigableMap<Long, Double> frequencyBands,
        ConsensusBoost consensusBoost,
        NoveltySettings novelty,
        MechanismSettings mechanism,
        FusionWeights fusionWeights,
        Map<AlertLevel, Double> alertThresholds,
        TemporalSettings temporal,
        QuerySettings query) {

    public SignalDetectionConfig {
        require(preset, "preset");
        require(thresholds, "thresholds");
        require(bayesian, "bayesian");
        require(compositeWeights, "compositeWeights");
        require(layer1Weights, "layer1Weights");
        require(interactions, "interactions");
        require(tunneling, "tunneling");
        require(seriousness, "seriousness");
        require(recency, "recency");
        require(layer2Weights, "layer2Weights");
        require(consensusBoost, "consensusBoost");
        require(novelty, "novelty");
        require(mechanism, "mechanism");
        require(fusionWeights, "fusionWeights");
        require(temporal, "temporal");
        require(query, "query");
        sourcePriorities = copyOf(SourceType.class, require(sourcePriorities, "sourcePriorities"));
        frequencyBands = Collections.unmodifiableNavigableMap(new TreeMap<>(require(frequencyBands, "frequencyBands")));
        alertThresholds = copyOf(AlertLevel.class, require(alertThresholds, "alertThresholds"));
    }

    /** Platform defaults with the {@link ThresholdPreset#STANDARD} preset. */
    public static SignalDetectionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Empirical-Bayes prior and model selection.
     *
     * @param method shrinkage model
     * @param alpha1 shape of the (first) gamma component
     * @param beta1 rate of the (first) gamma component
     * @param alpha2 shape of the second mixture component
     * @param beta2 rate of the second mixture component
     * @param mixtureWeight prior weight of the first mixture component
     * @param countsTowardStrength whether an EB05 signal counts as a fourth agreeing method
     */
    public record BayesianSettings(
            ShrinkageMethod method,
            double alpha1,
            double beta1,
            double alpha2,
            double beta2,
            double mixtureWeight,
            boolean countsTowardStrength) {

        public BayesianSettings {
            require(method, "bayesian.method");
            positive(alpha1, "bayesian.alpha1");
            positive(beta1, "bayesian.beta1");
            positive(alpha2, "bayesian.alpha2");
            positive(beta2, "bayesian.beta2");
            if (mixtureWeight <= 0 || mixtureWeight >= 1) {
                throw ValidationException.invalidParameter("bayesian.mixtureWeight", mixtureWeight, "value in (0, 1)");
            }
        }
    }

    /** Weights of the unified composite score. */
    public record CompositeWeights(double classical, double bayesian, double temporal, double causality) {}

    public record Layer1Weights(double rarity, double seriousness, double recency, double count) {}

    /**
     * Gates and weights of the Layer 1 interaction terms. An interaction contributes
     * {@code weight * product(factors)} only when every factor exceeds its gate.
     */
    public record InteractionSettings(
            double rareSeriousGate,
            double rareRecentGate,
            double seriousRecentGate,
            double allThreeGate,
            double rareSeriousWeight,
            double rareRecentWeight,
            double seriousRecentWeight,
            double allThreeWeight) {}

    /**
     * Borderline-signal bonus.
     *
     * @param elevatedThreshold a Layer 1 factor above this counts as elevated
     * @param bonusPerFactor bonus per elevated factor
     * @param minElevatedFactors elevated factors required before any bonus applies
     * @param nearMissRatio PRR at or above this fraction of the PRR threshold is a near miss
     * @param nearMissIc025 IC025 above this value is a near miss
     */
    public record TunnelingSettings(
            double elevatedThreshold,
            double bonusPerFactor,
            int minElevatedFactors,
            double nearMissRatio,
            double nearMissIc025) {}

    public record SeriousnessWeights(
            double seriousFraction, double flag, double death, double hospitalization, double disability) {}

    public record RecencySettings(
            int recentDays,
            int moderateDays,
            double recentWeight,
            double moderateWeight,
            double oldWeight,
            double undatedScore) {}

    public record Layer2Weights(
            double frequency, double severity, double burst, double novelty, double consensus, double mechanism) {}

    public record ConsensusBoost(
            double highConfidenceThreshold,
            double highStrengthThreshold,
            int minHighConfidenceSources,
            double boostAmount) {}

    /** Day cut-offs for off-label and on-label novelty bands. */
    public record NoveltySettings(
            int veryRecentDays,
            int recentDays,
            int moderateDays,
            int oldDays,
            int onLabelRecentDays,
            int onLabelModerateDays) {}

    /** Mechanism plausibility when no explicit score is supplied. */
    public record MechanismSettings(double labeled, double unlabeled, double unknown) {}

    public record FusionWeights(double classical, double layer1, double layer2) {

        public boolean allPositive() {
            return classical > 0 && layer1 > 0 && layer2 > 0;
        }
    }

    /**
     * Temporal analysis parameters.
     *
     * @param trendWindow buckets compared at each end of the series
     * @param trendRelativeChange relative change needed to call a trend
     * @param burstBaseline rolling baseline length in buckets
     * @param burstZThreshold z-score a local maximum must exceed to be a burst
     * @param recentSpikeDays a burst within this many days of the last bucket is recent
     * @param noveltyDecayDays e-folding time of the novelty recency term
     * @param emergingDays pairs first seen within this many days can be emerging
     * @param changePointMinSegment minimum buckets on each side of a change point
     * @param maxChangePoints change points reported at most
     */
    public record TemporalSettings(
            int trendWindow,
            double trendRelativeChange,
            int burstBaseline,
            double burstZThreshold,
            int recentSpikeDays,
            int noveltyDecayDays,
            int emergingDays,
            int changePointMinSegment,
            int maxChangePoints) {}

    public record QuerySettings(Duration evidenceTimeout, int defaultLimit) {

        public QuerySettings {
            if (evidenceTimeout == null || evidenceTimeout.isNegative() || evidenceTimeout.isZero()) {
                throw ValidationException.invalidParameter("query.evidenceTimeout", evidenceTimeout, "positive duration");
            }
            if (defaultLimit < 1) {
                throw ValidationException.invalidParameter("query.defaultLimit", defaultLimit, "at least 1");
            }
        }
    }

    /**
     * Mutable assembler for {@link SignalDetectionConfig}. Starts from platform defaults.
     */
    public static final class Builder {

        private ThresholdPreset preset = ThresholdPreset.STANDARD;
        private DisproportionalityThresholds thresholds = ThresholdPreset.STANDARD.thresholds();
        private BayesianSettings bayesian =
                new BayesianSettings(ShrinkageMethod.GAMMA_POISSON, 0.2, 0.1, 2.0, 4.0, 0.1, false);
        private CompositeWeights compositeWeights = new CompositeWeights(0.30, 0.40, 0.20, 0.10);
        private Layer1Weights layer1Weights = new Layer1Weights(0.40, 0.35, 0.20, 0.05);
        private InteractionSettings interactions =
                new InteractionSettings(0.7, 0.7, 0.7, 0.6, 0.15, 0.10, 0.10, 0.20);
        private TunnelingSettings tunneling = new TunnelingSettings(0.5, 0.05, 2, 0.75, -0.5);
        private SeriousnessWeights seriousness = new SeriousnessWeights(0.7, 0.1, 0.3, 0.2, 0.15);
        private RecencySettings recency = new RecencySettings(365, 730, 1.0, 0.5, 0.2, 0.5);
        private Layer2Weights layer2Weights = new Layer2Weights(0.25, 0.20, 0.15, 0.15, 0.15, 0.10);
        private Map<SourceType, Double> sourcePriorities = defaultSourcePriorities();
        private NavigableMap<Long, Double> frequencyBands = defaultFrequencyBands();
        private ConsensusBoost consensusBoost = new ConsensusBoost(0.7, 0.7, 3, 0.2);
        private NoveltySettings novelty = new NoveltySettings(30, 90, 180, 365, 30, 90);
        private MechanismSettings mechanism = new MechanismSettings(0.8, 0.4, 0.5);
        private FusionWeights fusionWeights = new FusionWeights(0.35, 0.40, 0.25);
        private Map<AlertLevel, Double> alertThresholds = defaultAlertThresholds();
        private TemporalSettings temporal = new TemporalSettings(3, 0.20, 8, 3.0, 90, 90, 180, 10, 3);
        private QuerySettings query = new QuerySettings(Duration.ofSeconds(5), 50);

        private Builder() {}

        private Builder(SignalDetectionConfig source) {
            this.preset = source.preset;
            this.thresholds = source.thresholds;
            this.bayesian = source.bayesian;
            this.compositeWeights = source.compositeWeights;
            this.layer1Weights = source.layer1Weights;
            this.interactions = source.interactions;
            this.tunneling = source.tunneling;
            this.seriousness = source.seriousness;
            this.recency = source.recency;
            this.layer2Weights = source.layer2Weights;
            this.sourcePriorities = source.sourcePriorities;
            this.frequencyBands = source.frequencyBands;
            this.consensusBoost = source.consensusBoost;
            this.novelty = source.novelty;
            this.mechanism = source.mechanism;
            this.fusionWeights = source.fusionWeights;
            this.alertThresholds = source.alertThresholds;
            this.temporal = source.temporal;
            this.query = source.query;
        }

        /** Selects a preset and resets the disproportionality thresholds to it. */
        public Builder preset(ThresholdPreset value) {
            this.preset = value;
            this.thresholds = value.thresholds();
            return this;
        }

        public Builder thresholds(DisproportionalityThresholds value) {
            this.thresholds = value;
            return this;
        }

        public Builder bayesian(BayesianSettings value) {
            this.bayesian = value;
            return this;
        }

        public Builder compositeWeights(CompositeWeights value) {
            this.compositeWeights = value;
            return this;
        }

        public Builder layer1Weights(Layer1Weights value) {
            this.layer1Weights = value;
            return this;
        }

        public Builder interactions(InteractionSettings value) {
            this.interactions = value;
            return this;
        }

        public Builder tunneling(TunnelingSettings value) {
            this.tunneling = value;
            return this;
        }

        public Builder seriousness(SeriousnessWeights value) {
            this.seriousness = value;
            return this;
        }

        public Builder recency(RecencySettings value) {
            this.recency = value;
            return this;
        }

        public Builder layer2Weights(Layer2Weights value) {
            this.layer2Weights = value;
            return this;
        }

        public Builder sourcePriorities(Map<SourceType, Double> value) {
            this.sourcePriorities = value;
            return this;
        }

        public Builder frequencyBands(NavigableMap<Long, Double> value) {
            this.frequencyBands = value;
            return this;
        }

        public Builder consensusBoost(ConsensusBoost value) {
            this.consensusBoost = value;
            return this;
        }

        public Builder novelty(NoveltySettings value) {
            this.novelty = value;
            return this;
        }

        public Builder mechanism(MechanismSettings value) {
            this.mechanism = value;
            return this;
        }

        public Builder fusionWeights(FusionWeights value) {
            this.fusionWeights = value;
            return this;
        }

        public Builder alertThresholds(Map<AlertLevel, Double> value) {
            this.alertThresholds = value;
            return this;
        }

        public Builder temporal(TemporalSettings value) {
            this.temporal = value;
            return this;
        }

        public Builder query(QuerySettings value) {
            this.query = value;
            return this;
        }

        public SignalDetectionConfig build() {
            return new SignalDetectionConfig(
                    preset,
                    thresholds,
                    bayesian,
                    compositeWeights,
                    layer1Weights,
                    interactions,
                    tunneling,
                    seriousness,
                    recency,
                    layer2Weights,
                    sourcePriorities,
                    frequencyBands,
                    consensusBoost,
                    novelty,
                    mechanism,
                    fusionWeights,
                    alertThresholds,
                    temporal,
                    query);
        }
    }

    static Map<SourceType, Double> defaultSourcePriorities() {
        Map<SourceType, Double> priorities = new EnumMap<>(SourceType.class);
        for (SourceType type : SourceType.values()) {
            priorities.put(type, type.getDefaultPriority());
        }
        return priorities;
    }

    static NavigableMap<Long, Double> defaultFrequencyBands() {
        NavigableMap<Long, Double> bands = new TreeMap<>();
        bands.put(1L, 0.1);
        bands.put(3L, 0.2);
        bands.put(5L, 0.3);
        bands.put(10L, 0.4);
        bands.put(20L, 0.6);
        bands.put(50L, 0.8);
        bands.put(100L, 1.0);
        return bands;
    }

    static Map<AlertLevel, Double> defaultAlertThresholds() {
        Map<AlertLevel, Double> levels = new EnumMap<>(AlertLevel.class);
        levels.put(AlertLevel.CRITICAL, 0.95);
        levels.put(AlertLevel.HIGH, 0.80);
        levels.put(AlertLevel.MODERATE, 0.65);
        levels.put(AlertLevel.WATCHLIST, 0.45);
        levels.put(AlertLevel.LOW, 0.25);
        return levels;
    }

    private static <K extends Enum<K>> Map<K, Double> copyOf(Class<K> type, Map<K, Double> source) {
        Map<K, Double> copy = new EnumMap<>(type);
        copy.putAll(source);
        return Collections.unmodifiableMap(copy);
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw ValidationException.missingInput(name);
        }
        return value;
    }

    private static void positive(double value, String name) {
        if (!(value > 0)) {
            throw ValidationException.invalidParameter(name, value, "positive value");
        }
    }
}
