/* (C)2026 */
package com.aethersignal.signal.config;

import com.aethersignal.signal.enumeration.AlertLevel;
import com.aethersignal.signal.enumeration.ShrinkageMethod;
import com.aethersignal.signal.enumeration.ThresholdPreset;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer that reads {@code signal.*} properties once and publishes an immutable
 * {@link SignalDetectionConfig}.
 *
 * <p>Defaults match {@link SignalDetectionConfig#defaults()}. Explicit
 * {@code signal.thresholds.*} values override the selected preset field by field.
 */
@ApplicationScoped
public class SignalDetectionConfigProducer {

    private static final Logger LOG = Logger.getLogger(SignalDetectionConfigProducer.class);

    @ConfigProperty(name = "signal.thresholds.preset", defaultValue = "STANDARD")
    ThresholdPreset preset;

    @ConfigProperty(name = "signal.thresholds.prr")
    Optional<Double> prrThreshold;

    @ConfigProperty(name = "signal.thresholds.ror")
    Optional<Double> rorThreshold;

    @ConfigProperty(name = "signal.thresholds.ci-lower")
    Optional<Double> ciLowerThreshold;

    @ConfigProperty(name = "signal.thresholds.ic025")
    Optional<Double> ic025Threshold;

    @ConfigProperty(name = "signal.thresholds.min-cases")
    Optional<Integer> minCases;

    @ConfigProperty(name = "signal.thresholds.eb05")
    Optional<Double> eb05Threshold;

    @ConfigProperty(name = "signal.bayesian.model", defaultValue = "GAMMA_POISSON")
    ShrinkageMethod shrinkageMethod;

    @ConfigProperty(name = "signal.bayesian.alpha1", defaultValue = "0.2")
    double alpha1;

    @ConfigProperty(name = "signal.bayesian.beta1", defaultValue = "0.1")
    double beta1;

    @ConfigProperty(name = "signal.bayesian.alpha2", defaultValue = "2.0")
    double alpha2;

    @ConfigProperty(name = "signal.bayesian.beta2", defaultValue = "4.0")
    double beta2;

    @ConfigProperty(name = "signal.bayesian.mixture-weight", defaultValue = "0.1")
    double mixtureWeight;

    @ConfigProperty(name = "signal.bayesian.counts-toward-strength", defaultValue = "false")
    boolean bayesianCountsTowardStrength;

    @ConfigProperty(name = "signal.composite.classical", defaultValue = "0.30")
    double compositeClassical;

    @ConfigProperty(name = "signal.composite.bayesian", defaultValue = "0.40")
    double compositeBayesian;

    @ConfigProperty(name = "signal.composite.temporal", defaultValue = "0.20")
    double compositeTemporal;

    @ConfigProperty(name = "signal.composite.causality", defaultValue = "0.10")
    double compositeCausality;

    @ConfigProperty(name = "signal.layer1.rarity", defaultValue = "0.40")
    double rarityWeight;

    @ConfigProperty(name = "signal.layer1.seriousness", defaultValue = "0.35")
    double seriousnessWeight;

    @ConfigProperty(name = "signal.layer1.recency", defaultValue = "0.20")
    double recencyWeight;

    @ConfigProperty(name = "signal.layer1.count", defaultValue = "0.05")
    double countWeight;

    @ConfigProperty(name = "signal.interaction.rare-serious.gate", defaultValue = "0.7")
    double rareSeriousGate;

    @ConfigProperty(name = "signal.interaction.rare-recent.gate", defaultValue = "0.7")
    double rareRecentGate;

    @ConfigProperty(name = "signal.interaction.serious-recent.gate", defaultValue = "0.7")
    double seriousRecentGate;

    @ConfigProperty(name = "signal.interaction.all-three.gate", defaultValue = "0.6")
    double allThreeGate;

    @ConfigProperty(name = "signal.interaction.rare-serious.weight", defaultValue = "0.15")
    double rareSeriousWeight;

    @ConfigProperty(name = "signal.interaction.rare-recent.weight", defaultValue = "0.10")
    double rareRecentWeight;

    @ConfigProperty(name = "signal.interaction.serious-recent.weight", defaultValue = "0.10")
    double seriousRecentWeight;

    @ConfigProperty(name = "signal.interaction.all-three.weight", defaultValue = "0.20")
    double allThreeWeight;

    @ConfigProperty(name = "signal.tunneling.elevated-threshold", defaultValue = "0.5")
    double tunnelingElevatedThreshold;

    @ConfigProperty(name = "signal.tunneling.bonus-per-factor", defaultValue = "0.05")
    double tunnelingBonusPerFactor;

    @ConfigProperty(name = "signal.tunneling.min-factors", defaultValue = "2")
    int tunnelingMinFactors;

    @ConfigProperty(name = "signal.tunneling.near-miss-ratio", defaultValue = "0.75")
    double tunnelingNearMissRatio;

    @ConfigProperty(name = "signal.tunneling.near-miss-ic025", defaultValue = "-0.5")
    double tunnelingNearMissIc025;

    @ConfigProperty(name = "signal.seriousness.serious-fraction", defaultValue = "0.7")
    double seriousFractionWeight;

    @ConfigProperty(name = "signal.seriousness.flag", defaultValue = "0.1")
    double seriousFlagWeight;

    @ConfigProperty(name = "signal.seriousness.death", defaultValue = "0.3")
    double deathWeight;

    @ConfigProperty(name = "signal.seriousness.hospitalization", defaultValue = "0.2")
    double hospitalizationWeight;

    @ConfigProperty(name = "signal.seriousness.disability", defaultValue = "0.15")
    double disabilityWeight;

    @ConfigProperty(name = "signal.recency.recent-days", defaultValue = "365")
    int recentDays;

    @ConfigProperty(name = "signal.recency.moderate-days", defaultValue = "730")
    int moderateDays;

    @ConfigProperty(name = "signal.recency.recent-weight", defaultValue = "1.0")
    double recentRecencyWeight;

    @ConfigProperty(name = "signal.recency.moderate-weight", defaultValue = "0.5")
    double moderateRecencyWeight;

    @ConfigProperty(name = "signal.recency.old-weight", defaultValue = "0.2")
    double oldRecencyWeight;

    @ConfigProperty(name = "signal.recency.undated-score", defaultValue = "0.5")
    double undatedRecencyScore;

    @ConfigProperty(name = "signal.layer2.frequency", defaultValue = "0.25")
    double frequencyWeight;

    @ConfigProperty(name = "signal.layer2.severity", defaultValue = "0.20")
    double severityWeight;

    @ConfigProperty(name = "signal.layer2.burst", defaultValue = "0.15")
    double burstWeight;

    @ConfigProperty(name = "signal.layer2.novelty", defaultValue = "0.15")
    double noveltyWeight;

    @ConfigProperty(name = "signal.layer2.consensus", defaultValue = "0.15")
    double consensusWeight;

    @ConfigProperty(name = "signal.layer2.mechanism", defaultValue = "0.10")
    double mechanismWeight;

    @ConfigProperty(name = "signal.layer2.consensus.high-confidence", defaultValue = "0.7")
    double consensusHighConfidence;

    @ConfigProperty(name = "signal.layer2.consensus.high-strength", defaultValue = "0.7")
    double consensusHighStrength;

    @ConfigProperty(name = "signal.layer2.consensus.min-sources", defaultValue = "3")
    int consensusMinSources;

    @ConfigProperty(name = "signal.layer2.consensus.boost", defaultValue = "0.2")
    double consensusBoostAmount;

    @ConfigProperty(name = "signal.layer2.mechanism.labeled", defaultValue = "0.8")
    double mechanismLabeled;

    @ConfigProperty(name = "signal.layer2.mechanism.unlabeled", defaultValue = "0.4")
    double mechanismUnlabeled;

    @ConfigProperty(name = "signal.layer2.mechanism.unknown", defaultValue = "0.5")
    double mechanismUnknown;

    @ConfigProperty(name = "signal.novelty.very-recent-days", defaultValue = "30")
    int noveltyVeryRecentDays;

    @ConfigProperty(name = "signal.novelty.recent-days", defaultValue = "90")
    int noveltyRecentDays;

    @ConfigProperty(name = "signal.novelty.moderate-days", defaultValue = "180")
    int noveltyModerateDays;

    @ConfigProperty(name = "signal.novelty.old-days", defaultValue = "365")
    int noveltyOldDays;

    @ConfigProperty(name = "signal.novelty.on-label-recent-days", defaultValue = "30")
    int noveltyOnLabelRecentDays;

    @ConfigProperty(name = "signal.novelty.on-label-moderate-days", defaultValue = "90")
    int noveltyOnLabelModerateDays;

    @ConfigProperty(name = "signal.fusion.classical", defaultValue = "0.35")
    double fusionClassical;

    @ConfigProperty(name = "signal.fusion.layer1", defaultValue = "0.40")
    double fusionLayer1;

    @ConfigProperty(name = "signal.fusion.layer2", defaultValue = "0.25")
    double fusionLayer2;

    @ConfigProperty(name = "signal.alert.critical", defaultValue = "0.95")
    double alertCritical;

    @ConfigProperty(name = "signal.alert.high", defaultValue = "0.80")
    double alertHigh;

    @ConfigProperty(name = "signal.alert.moderate", defaultValue = "0.65")
    double alertModerate;

    @ConfigProperty(name = "signal.alert.watchlist", defaultValue = "0.45")
    double alertWatchlist;

    @ConfigProperty(name = "signal.alert.low", defaultValue = "0.25")
    double alertLow;

    @ConfigProperty(name = "signal.temporal.trend-window", defaultValue = "3")
    int trendWindow;

    @ConfigProperty(name = "signal.temporal.trend-relative-change", defaultValue = "0.20")
    double trendRelativeChange;

    @ConfigProperty(name = "signal.temporal.burst-baseline", defaultValue = "8")
    int burstBaseline;

    @ConfigProperty(name = "signal.temporal.burst-z-threshold", defaultValue = "3.0")
    double burstZThreshold;

    @ConfigProperty(name = "signal.temporal.recent-spike-days", defaultValue = "90")
    int recentSpikeDays;

    @ConfigProperty(name = "signal.temporal.novelty-decay-days", defaultValue = "90")
    int noveltyDecayDays;

    @ConfigProperty(name = "signal.temporal.emerging-days", defaultValue = "180")
    int emergingDays;

    @ConfigProperty(name = "signal.temporal.change-point-min-segment", defaultValue = "10")
    int changePointMinSegment;

    @ConfigProperty(name = "signal.temporal.max-change-points", defaultValue = "3")
    int maxChangePoints;

    @ConfigProperty(name = "signal.query.evidence-timeout", defaultValue = "5s")
    Duration evidenceTimeout;

    @ConfigProperty(name = "signal.query.default-limit", defaultValue = "50")
    int defaultLimit;

    /**
     * Produces the shared configuration. Records cannot be client-proxied, hence the
     * {@link Singleton} pseudo-scope.
     */
    @Produces
    @Singleton
    public SignalDetectionConfig signalDetectionConfig() {
        DisproportionalityThresholds base = preset.thresholds();
        DisproportionalityThresholds thresholds =
                new DisproportionalityThresholds(
                        prrThreshold.orElse(base.prrThreshold()),
                        rorThreshold.orElse(base.rorThreshold()),
                        ciLowerThreshold.orElse(base.ciLowerThreshold()),
                        ic025Threshold.orElse(base.ic025Threshold()),
                        minCases.orElse(base.minCases()),
                        eb05Threshold.orElse(base.eb05Threshold()));

        Map<AlertLevel, Double> alerts = new EnumMap<>(AlertLevel.class);
        alerts.put(AlertLevel.CRITICAL, alertCritical);
        alerts.put(AlertLevel.HIGH, alertHigh);
        alerts.put(AlertLevel.MODERATE, alertModerate);
        alerts.put(AlertLevel.WATCHLIST, alertWatchlist);
        alerts.put(AlertLevel.LOW, alertLow);

        SignalDetectionConfig config =
                SignalDetectionConfig.builder()
                        .preset(preset)
                        .thresholds(thresholds)
                        .bayesian(
                                new SignalDetectionConfig.BayesianSettings(
                                        shrinkageMethod,
                                        alpha1,
                                        beta1,
                                        alpha2,
                                        beta2,
                                        mixtureWeight,
                                        bayesianCountsTowardStrength))
                        .compositeWeights(
                                new SignalDetectionConfig.CompositeWeights(
                                        compositeClassical,
                                        compositeBayesian,
                                        compositeTemporal,
                                        compositeCausality))
                        .layer1Weights(
                                new SignalDetectionConfig.Layer1Weights(
                                        rarityWeight, seriousnessWeight, recencyWeight, countWeight))
                        .interactions(
                                new SignalDetectionConfig.InteractionSettings(
                                        rareSeriousGate,
                                        rareRecentGate,
                                        seriousRecentGate,
                                        allThreeGate,
                                        rareSeriousWeight,
                                        rareRecentWeight,
                                        seriousRecentWeight,
                                        allThreeWeight))
                        .tunneling(
                                new SignalDetectionConfig.TunnelingSettings(
                                        tunnelingElevatedThreshold,
                                        tunnelingBonusPerFactor,
                                        tunnelingMinFactors,
                                        tunnelingNearMissRatio,
                                        tunnelingNearMissIc025))
                        .seriousness(
                                new SignalDetectionConfig.SeriousnessWeights(
                                        seriousFractionWeight,
                                        seriousFlagWeight,
                                        deathWeight,
                                        hospitalizationWeight,
                                        disabilityWeight))
                        .recency(
                                new SignalDetectionConfig.RecencySettings(
                                        recentDays,
                                        moderateDays,
                                        recentRecencyWeight,
                                        moderateRecencyWeight,
                                        oldRecencyWeight,
                                        undatedRecencyScore))
                        .layer2Weights(
                                new SignalDetectionConfig.Layer2Weights(
                                        frequencyWeight,
                                        severityWeight,
                                        burstWeight,
                                        noveltyWeight,
                                        consensusWeight,
                                        mechanismWeight))
                        .consensusBoost(
                                new SignalDetectionConfig.ConsensusBoost(
                                        consensusHighConfidence,
                                        consensusHighStrength,
                                        consensusMinSources,
                                        consensusBoostAmount))
                        .mechanism(
                                new SignalDetectionConfig.MechanismSettings(
                                        mechanismLabeled, mechanismUnlabeled, mechanismUnknown))
                        .novelty(
                                new SignalDetectionConfig.NoveltySettings(
                                        noveltyVeryRecentDays,
                                        noveltyRecentDays,
                                        noveltyModerateDays,
                                        noveltyOldDays,
                                        noveltyOnLabelRecentDays,
                                        noveltyOnLabelModerateDays))
                        .fusionWeights(
                                new SignalDetectionConfig.FusionWeights(
                                        fusionClassical, fusionLayer1, fusionLayer2))
                        .alertThresholds(alerts)
                        .temporal(
                                new SignalDetectionConfig.TemporalSettings(
                                        trendWindow,
                                        trendRelativeChange,
                                        burstBaseline,
                                        burstZThreshold,
                                        recentSpikeDays,
                                        noveltyDecayDays,
                                        emergingDays,
                                        changePointMinSegment,
                                        maxChangePoints))
                        .query(new SignalDetectionConfig.QuerySettings(evidenceTimeout, defaultLimit))
                        .build();

        LOG.infof(
                "Signal detection configured: preset=%s, shrinkage=%s, fusion weights=%.2f/%.2f/%.2f",
                preset, shrinkageMethod, fusionClassical, fusionLayer1, fusionLayer2);
        return config;
    }
}
