/* (C)2026 */
package com.aethersignal.signal.service;

import com.aethersignal.signal.config.SignalDetectionConfig;
import com.aethersignal.signal.config.SignalDetectionConfig.ConsensusBoost;
import com.aethersignal.signal.config.SignalDetectionConfig.Layer2Weights;
import com.aethersignal.signal.config.SignalDetectionConfig.MechanismSettings;
import com.aethersignal.signal.config.SignalDetectionConfig.NoveltySettings;
import com.aethersignal.signal.enumeration.SourceType;
import com.aethersignal.signal.model.Layer2Components;
import com.aethersignal.signal.model.SignalData;
import com.aethersignal.signal.model.SignalEvidence;
import com.aethersignal.signal.model.TemporalPatternResult;
import com.aethersignal.signal.util.StatisticalFunctions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Layer 2 scoring across independent sources: frequency, severity, burst, novelty,
 * consensus and mechanism plausibility.
 */
@ApplicationScoped
public class MultiSourceQuantumScorer {

    // number of source types assumed available when the request does not list them
    private static final int DEFAULT_AVAILABLE_SOURCES = 7;

    private static final double DEFAULT_SOURCE_SCORE = 0.5;
    private static final double MIN_CONFIDENCE = 0.1;

    private final SignalDetectionConfig config;
    private final Clock clock;

    @Inject
    public MultiSourceQuantumScorer(SignalDetectionConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param temporal temporal analysis of the pair, used for the burst factor when the
     *     evidence does not carry a precomputed burst score; may be {@code null}
     */
    public Layer2Components components(SignalEvidence evidence, TemporalPatternResult temporal) {
        SignalData data = evidence.signalData();
        boolean labeled = isLabeled(evidence.event(), evidence.labelReactions());

        double burst = 0.0;
        if (data.burstScore() != null) {
            burst = data.burstScore();
        } else if (temporal != null) {
            burst = temporal.burstScore();
        }

        return new Layer2Components(
                frequency(data.count()),
                data.severity() != null ? data.severity() : 0.0,
                burst,
                novelty(data.latestDate(), labeled),
                consensus(data, evidence.sources()),
                mechanism(data, evidence.labelReactions(), labeled));
    }

    /** Weighted sum of the components, clipped to [0, 1]. */
    public double score(Layer2Components components) {
        Layer2Weights weights = config.layer2Weights();
        double score = weights.frequency() * components.frequency()
                + weights.severity() * components.severity()
                + weights.burst() * components.burst()
                + weights.novelty() * components.novelty()
                + weights.consensus() * components.consensus()
                + weights.mechanism() * components.mechanism();
        return StatisticalFunctions.clamp(score, 0.0, 1.0);
    }

    /** Score of the highest frequency band whose lower bound the count reaches. */
    double frequency(long count) {
        if (count <= 0) {
            return 0.0;
        }
        Map.Entry<Long, Double> band = config.frequencyBands().floorEntry(count);
        return band == null ? 0.0 : band.getValue();
    }

    /**
     * Off-label reactions decay through five bands, on-label ones through three lower
     * bands. Without a date the score is neutral for off-label and low for on-label.
     */
    double novelty(Optional<LocalDate> latest, boolean labeled) {
        if (latest.isEmpty()) {
            return labeled ? 0.2 : 0.5;
        }
        NoveltySettings settings = config.novelty();
        long daysAgo = Math.max(0, ChronoUnit.DAYS.between(latest.get(), LocalDate.now(clock)));
        if (labeled) {
            if (daysAgo <= settings.onLabelRecentDays()) return 0.6;
            if (daysAgo <= settings.onLabelModerateDays()) return 0.4;
            return 0.2;
        }
        if (daysAgo <= settings.veryRecentDays()) return 1.0;
        if (daysAgo <= settings.recentDays()) return 0.8;
        if (daysAgo <= settings.moderateDays()) return 0.6;
        if (daysAgo <= settings.oldDays()) return 0.4;
        return 0.2;
    }

    /**
     * Priority-weighted agreement of the reporting sources. Priorities are normalized over
     * the source types present; each source contributes
     * {@code priority * strength * max(0.1, confidence)}. Enough high-confidence,
     * high-strength sources add a boost.
     */
    double consensus(SignalData data, List<String> availableSources) {
        List<String> sources = data.sources();
        if (sources.isEmpty()) {
            return 0.0;
        }
        Map<SourceType, Double> priorities = config.sourcePriorities();
        Map<SourceType, Double> present = new EnumMap<>(SourceType.class);
        for (String source : sources) {
            SourceType type = data.sourceTypeOf(source);
            Double priority = priorities.get(type);
            if (priority != null) {
                present.put(type, priority);
            }
        }
        double totalPriority = present.values().stream().mapToDouble(Double::doubleValue).sum();

        if (present.isEmpty() || totalPriority <= 0) {
            int unique = new LinkedHashSet<>(sources).size();
            int available = availableSources.isEmpty() ? DEFAULT_AVAILABLE_SOURCES : availableSources.size();
            return Math.min((double) unique / available, 1.0);
        }

        ConsensusBoost boost = config.consensusBoost();
        double weighted = 0.0;
        int highConfidence = 0;
        for (String source : sources) {
            SourceType type = data.sourceTypeOf(source);
            Double priority = present.get(type);
            if (priority == null) {
                continue;
            }
            double confidence = data.sourceConfidence().getOrDefault(source, DEFAULT_SOURCE_SCORE);
            double strength = data.sourceStrength().getOrDefault(source, DEFAULT_SOURCE_SCORE);
            weighted += (priority / totalPriority) * strength * Math.max(MIN_CONFIDENCE, confidence);
            if (confidence >= boost.highConfidenceThreshold() && strength >= boost.highStrengthThreshold()) {
                highConfidence++;
            }
        }
        double consensus = Math.min(1.0, weighted);
        if (highConfidence >= boost.minHighConfidenceSources()) {
            consensus = Math.min(1.0, consensus + boost.boostAmount());
        }
        return consensus;
    }

    double mechanism(SignalData data, List<String> labelReactions, boolean labeled) {
        if (data.mechanismScore() != null) {
            return data.mechanismScore();
        }
        MechanismSettings settings = config.mechanism();
        if (labelReactions.isEmpty()) {
            return settings.unknown();
        }
        return labeled ? settings.labeled() : settings.unlabeled();
    }

    /** Case-insensitive substring match in either direction. */
    static boolean isLabeled(String event, List<String> labelReactions) {
        if (event == null || labelReactions.isEmpty()) {
            return false;
        }
        String reaction = event.toLowerCase(Locale.ROOT);
        for (String known : labelReactions) {
            if (known == null || known.isBlank()) {
                continue;
            }
            String label = known.toLowerCase(Locale.ROOT);
            if (label.contains(reaction) || reaction.contains(label)) {
                return true;
            }
        }
        return false;
    }
}
