/* (C)2026 */
package com.aethersignal.signal.service;

import com.aethersignal.signal.config.SignalDetectionConfig;
import com.aethersignal.signal.config.SignalDetectionConfig.InteractionSettings;
import com.aethersignal.signal.config.SignalDetectionConfig.Layer1Weights;
import com.aethersignal.signal.config.SignalDetectionConfig.RecencySettings;
import com.aethersignal.signal.config.SignalDetectionConfig.SeriousnessWeights;
import com.aethersignal.signal.config.SignalDetectionConfig.TunnelingSettings;
import com.aethersignal.signal.enumeration.SeriousOutcome;
import com.aethersignal.signal.model.DisproportionalityResult;
import com.aethersignal.signal.model.QuantumComponents;
import com.aethersignal.signal.model.SignalData;
import com.aethersignal.signal.util.StatisticalFunctions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Layer 1 scoring from a single source's aggregated case facts.
 *
 * <p>The base score is a weighted sum of rarity, seriousness, recency and normalized
 * count. Interaction terms reward factors that are high together, and the tunneling
 * bonus lifts borderline pairs whose classical statistics fell just short.
 */
@ApplicationScoped
public class SingleSourceQuantumScorer {

    // count at which the count term saturates
    private static final double COUNT_SATURATION = 10.0;

    private final SignalDetectionConfig config;
    private final Clock clock;

    @Inject
    public SingleSourceQuantumScorer(SignalDetectionConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Scores one pair.
     *
     * @param classical disproportionality result, {@code null} when no contingency table
     *     was available
     * @return components without Layer 2; see {@link QuantumComponents#layer1Score()}
     */
    public QuantumComponents score(SignalData data, long totalCases, DisproportionalityResult classical) {
        double rarity = rarity(data.count(), totalCases);
        double seriousness = seriousness(data);
        double recency = recency(data.latestDate());
        double countNormalized = Math.min(1.0, data.count() / COUNT_SATURATION);

        Layer1Weights weights = config.layer1Weights();
        double base = weights.rarity() * rarity
                + weights.seriousness() * seriousness
                + weights.recency() * recency
                + weights.count() * countNormalized;

        InteractionSettings interactions = config.interactions();
        double rareSerious = interaction(
                interactions.rareSeriousWeight(), interactions.rareSeriousGate(), rarity, seriousness);
        double rareRecent = interaction(
                interactions.rareRecentWeight(), interactions.rareRecentGate(), rarity, recency);
        double seriousRecent = interaction(
                interactions.seriousRecentWeight(), interactions.seriousRecentGate(), seriousness, recency);
        double allThree = interaction(
                interactions.allThreeWeight(), interactions.allThreeGate(), rarity, seriousness, recency);

        TunnelingSettings tunneling = config.tunneling();
        int elevated = countAbove(tunneling.elevatedThreshold(), rarity, seriousness, recency);
        boolean eligible = tunnelingEligible(classical);
        double bonus = eligible && elevated >= tunneling.minElevatedFactors()
                ? tunneling.bonusPerFactor() * elevated
                : 0.0;

        return new QuantumComponents(
                rarity,
                seriousness,
                recency,
                countNormalized,
                base,
                rareSerious,
                rareRecent,
                seriousRecent,
                allThree,
                eligible,
                elevated,
                bonus,
                null);
    }

    /** 1 - count / totalCases, clamped to [0, 1]. */
    static double rarity(long count, long totalCases) {
        if (totalCases <= 0) {
            return 0.0;
        }
        return StatisticalFunctions.clamp(1.0 - (double) count / totalCases, 0.0, 1.0);
    }

    /**
     * Weighted serious fraction, plus a flat amount when any case is serious and the weight
     * of the worst outcome mentioned.
     */
    double seriousness(SignalData data) {
        SeriousnessWeights weights = config.seriousness();
        double score = weights.seriousFraction() * data.seriousFraction();
        if (data.anySerious()) {
            score += weights.flag();
        }
        Optional<SeriousOutcome> worst = SeriousOutcome.worstOf(data.outcomes());
        if (worst.isPresent()) {
            switch (worst.get()) {
                case DEATH:
                    score += weights.death();
                    break;
                case HOSPITALIZATION:
                    score += weights.hospitalization();
                    break;
                case DISABILITY:
                    score += weights.disability();
                    break;
                default:
                    break;
            }
        }
        return StatisticalFunctions.clamp(score, 0.0, 1.0);
    }

    /**
     * Piecewise decay on days since the latest report: a gentle slope inside the recent
     * window, a steeper one inside the moderate window and a slow tail afterwards.
     */
    double recency(Optional<LocalDate> latest) {
        RecencySettings settings = config.recency();
        if (latest.isEmpty()) {
            return settings.undatedScore();
        }
        long daysAgo = Math.max(0, ChronoUnit.DAYS.between(latest.get(), LocalDate.now(clock)));
        double score;
        if (daysAgo <= settings.recentDays()) {
            score = settings.recentWeight() - ((double) daysAgo / settings.recentDays()) * 0.5;
        } else if (daysAgo <= settings.moderateDays()) {
            score = settings.moderateWeight()
                    - ((double) (daysAgo - settings.recentDays()) / settings.recentDays()) * 0.3;
        } else {
            score = Math.max(0.0, settings.oldWeight() - (daysAgo - settings.moderateDays()) / 3650.0);
        }
        return StatisticalFunctions.clamp(score, 0.0, 1.0);
    }

    /**
     * Tunneling applies without a classical result, or when the classical result is not a
     * signal but PRR or IC025 came close to its threshold.
     */
    boolean tunnelingEligible(DisproportionalityResult classical) {
        if (classical == null) {
            return true;
        }
        if (classical.isSignal()) {
            return false;
        }
        TunnelingSettings tunneling = config.tunneling();
        double prrThreshold = config.thresholds().prrThreshold();
        boolean prrNearMiss = classical.prr().defined()
                && classical.prr().value() >= tunneling.nearMissRatio() * prrThreshold;
        boolean icNearMiss = classical.ic().defined() && classical.ic().ic025() > tunneling.nearMissIc025();
        return prrNearMiss || icNearMiss;
    }

    private static double interaction(double weight, double gate, double... factors) {
        double product = 1.0;
        for (double factor : factors) {
            if (factor <= gate) {
                return 0.0;
            }
            product *= factor;
        }
        return weight * product;
    }

    private static int countAbove(double threshold, double... factors) {
        int count = 0;
        for (double factor : factors) {
            if (factor > threshold) {
                count++;
            }
        }
        return count;
    }
}
