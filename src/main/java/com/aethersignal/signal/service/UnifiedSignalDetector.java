/* (C)2026 */
package com.aethersignal.signal.service;

import com.aethersignal.signal.config.SignalDetectionConfig;
import com.aethersignal.signal.config.SignalDetectionConfig.CompositeWeights;
import com.aethersignal.signal.enumeration.SignalStrength;
import com.aethersignal.signal.enumeration.TrendDirection;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.model.BayesianSignal;
import com.aethersignal.signal.model.CausalityAssessment;
import com.aethersignal.signal.model.ClinicalFeatures;
import com.aethersignal.signal.model.ContingencyTable;
import com.aethersignal.signal.model.DisproportionalityResult;
import com.aethersignal.signal.model.PairObservation;
import com.aethersignal.signal.model.TemporalPatternResult;
import com.aethersignal.signal.model.TemporalPatternResult.LatencyStats;
import com.aethersignal.signal.model.TimeSeriesData;
import com.aethersignal.signal.model.UnifiedSignalResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.jboss.logging.Logger;

/**
 * Orchestrates disproportionality, Bayesian shrinkage, causality and temporal analysis
 * into one {@link UnifiedSignalResult} per drug-event pair.
 *
 * <p>The contingency table is the only required input. Causality runs only when clinical
 * features are supplied and temporal analysis only when a time series is supplied.
 */
@ApplicationScoped
public class UnifiedSignalDetector {

    private static final Logger LOG = Logger.getLogger(UnifiedSignalDetector.class);

    public static final String EBGM = "EBGM";

    private static final int SUBSTANTIAL_CASE_COUNT = 10;

    private final SignalDetectionConfig config;
    private final DisproportionalityAnalyzer disproportionalityAnalyzer;
    private final BayesianSignalDetector bayesianDetector;
    private final CausalityAssessor causalityAssessor;
    private final TemporalPatternAnalyzer temporalAnalyzer;

    @Inject
    public UnifiedSignalDetector(
            SignalDetectionConfig config,
            DisproportionalityAnalyzer disproportionalityAnalyzer,
            BayesianSignalDetector bayesianDetector,
            CausalityAssessor causalityAssessor,
            TemporalPatternAnalyzer temporalAnalyzer) {
        this.config = config;
        this.disproportionalityAnalyzer = disproportionalityAnalyzer;
        this.bayesianDetector = bayesianDetector;
        this.causalityAssessor = causalityAssessor;
        this.temporalAnalyzer = temporalAnalyzer;
    }

    public UnifiedSignalResult detectSignal(String drug, String event, ContingencyTable table) {
        return detectSignal(drug, event, table, null, null, null);
    }

    public UnifiedSignalResult detectSignal(
            String drug,
            String event,
            ContingencyTable table,
            ClinicalFeatures clinicalFeatures,
            TimeSeriesData timeSeries,
            LocalDate firstReportDate) {
        return detectSignal(new PairObservation(
                drug, event, table, clinicalFeatures, timeSeries, firstReportDate, List.of()));
    }

    /**
     * Runs every applicable analysis for one pair.
     *
     * @throws ValidationException when the contingency table is missing
     */
    public UnifiedSignalResult detectSignal(PairObservation observation) {
        return detect(observation, bayesianDetector);
    }

    /** Evaluates each pair independently; results keep the input order. */
    public List<UnifiedSignalResult> detectSignalsBatch(List<PairObservation> observations) {
        return detectSignalsBatch(observations, false);
    }

    /**
     * Evaluates each pair independently, optionally fitting the shrinkage prior to the
     * batch's own tables first. The fitted prior is scoped to this call.
     */
    public List<UnifiedSignalResult> detectSignalsBatch(List<PairObservation> observations, boolean estimatePrior) {
        if (observations == null) {
            throw ValidationException.missingInput("observations");
        }
        BayesianSignalDetector detector = bayesianDetector;
        if (estimatePrior && observations.size() >= 2) {
            List<ContingencyTable> tables = new ArrayList<>(observations.size());
            for (PairObservation observation : observations) {
                if (observation.table() != null) {
                    tables.add(observation.table());
                }
            }
            detector = bayesianDetector.estimatePrior(tables);
        }

        List<UnifiedSignalResult> results = new ArrayList<>(observations.size());
        for (PairObservation observation : observations) {
            results.add(detect(observation, detector));
        }
        LOG.infof(
                "Analyzed %d drug-event pairs, %d signals",
                results.size(), results.stream().filter(UnifiedSignalResult::signal).count());
        return results;
    }

    /** Returns a new list sorted by composite score, highest first; ties keep their order. */
    public List<UnifiedSignalResult> rankByCompositeScore(List<UnifiedSignalResult> results) {
        List<UnifiedSignalResult> ranked = new ArrayList<>(results);
        ranked.sort(Comparator.comparingDouble(UnifiedSignalResult::compositeScore).reversed());
        return ranked;
    }

    private UnifiedSignalResult detect(PairObservation observation, BayesianSignalDetector detector) {
        if (observation == null) {
            throw ValidationException.missingInput("observation");
        }
        String drug = observation.drug();
        String event = observation.event();
        ContingencyTable table = observation.table();
        if (table == null) {
            throw ValidationException.missingInput("contingencyTable");
        }

        DisproportionalityResult classical = disproportionalityAnalyzer.analyze(drug, event, table);
        BayesianSignal bayesian = detector.detect(table);

        TemporalPatternResult temporal = null;
        if (observation.timeSeries() != null) {
            temporal = temporalAnalyzer.analyze(
                    drug, event, observation.timeSeries(), observation.firstReportDate(), observation.latencies());
        }

        CausalityAssessment causality = null;
        if (observation.clinicalFeatures() != null) {
            LatencyStats latency = temporal != null ? temporal.latency() : null;
            if (latency == null && !observation.latencies().isEmpty()) {
                latency = temporalAnalyzer.analyzeLatencies(observation.latencies());
            }
            causality = causalityAssessor.assess(drug, event, observation.clinicalFeatures(), latency);
        }

        List<String> methods = new ArrayList<>(classical.flaggedMethods());
        if (config.bayesian().countsTowardStrength() && bayesian.signal()) {
            methods.add(EBGM);
        }
        SignalStrength strength = SignalStrength.fromFlaggedCount(methods.size());
        boolean signal = !methods.isEmpty();
        double composite = compositeScore(classical, bayesian, temporal, causality);

        List<String> findings = new ArrayList<>();
        List<String> riskFactors = new ArrayList<>();
        describe(classical, bayesian, temporal, causality, findings, riskFactors);

        LOG.debugf(
                "Unified %s/%s: signal=%s, strength=%s, methods=%s, composite=%.3f",
                drug, event, signal, strength, methods, composite);

        return new UnifiedSignalResult(
                drug,
                event,
                table,
                classical,
                bayesian,
                causality,
                temporal,
                signal,
                strength,
                methods,
                composite,
                findings,
                riskFactors,
                recommendations(strength));
    }

    /**
     * Weighted classical/Bayesian/temporal/causality score in [0, 1]. A missing temporal
     * result moves its weight to the Bayesian term; a missing causality assessment moves
     * its weight to the classical term.
     */
    double compositeScore(
            DisproportionalityResult classical,
            BayesianSignal bayesian,
            TemporalPatternResult temporal,
            CausalityAssessment causality) {
        CompositeWeights weights = config.compositeWeights();
        double classicalScore = classicalScore(classical);
        double bayesianScore = bayesianScore(bayesian);

        double score = weights.classical() * classicalScore + weights.bayesian() * bayesianScore;
        score += weights.temporal() * (temporal != null ? temporal.temporalRiskScore() : bayesianScore);
        score += weights.causality() * (causality != null ? causality.confidence() : classicalScore);
        return Math.min(Math.max(score, 0.0), 1.0);
    }

    static double classicalScore(DisproportionalityResult classical) {
        double base;
        switch (classical.flaggedCount()) {
            case 3:
                base = 0.9;
                break;
            case 2:
                base = 0.7;
                break;
            case 1:
                base = 0.5;
                break;
            default:
                base = 0.2;
        }
        double averageRatio = (classical.prr().value() + classical.ror().value()) / 2.0;
        if (averageRatio > 5.0) {
            base += 0.10;
        } else if (averageRatio > 3.0) {
            base += 0.05;
        }
        return Math.min(base, 1.0);
    }

    static double bayesianScore(BayesianSignal bayesian) {
        double eb05 = bayesian.eb05();
        if (eb05 > 4.0) return 0.95;
        if (eb05 > 2.0) return 0.80;
        if (eb05 > 1.0) return 0.60;
        return 0.30;
    }

    private static void describe(
            DisproportionalityResult classical,
            BayesianSignal bayesian,
            TemporalPatternResult temporal,
            CausalityAssessment causality,
            List<String> findings,
            List<String> riskFactors) {
        if (classical.isSignal()) {
            List<String> methods = new ArrayList<>(3);
            if (classical.prr().signal()) methods.add(String.format(Locale.ROOT, "PRR=%.2f", classical.prr().value()));
            if (classical.ror().signal()) methods.add(String.format(Locale.ROOT, "ROR=%.2f", classical.ror().value()));
            if (classical.ic().signal()) methods.add(String.format(Locale.ROOT, "IC=%.2f", classical.ic().ic()));
            findings.add("Disproportionality detected: " + String.join(", ", methods));
        }
        if (bayesian.signal()) {
            findings.add(String.format(Locale.ROOT,
                    "Bayesian signal confirmed: EBGM=%.2f (EB05=%.2f)", bayesian.ebgm(), bayesian.eb05()));
        }
        if (classical.table().n11() >= SUBSTANTIAL_CASE_COUNT) {
            findings.add("Substantial case count: " + classical.table().n11() + " reports");
        }
        if (temporal != null) {
            if (temporal.hasRecentBurst()) {
                findings.add("Recent spike in reporting detected");
                riskFactors.add("Sudden increase in case reports");
            }
            if (temporal.trend().direction() == TrendDirection.INCREASING) {
                findings.add("Increasing trend in reporting");
                riskFactors.add("Growing number of reports over time");
            }
            if (temporal.novelty() != null && temporal.novelty().emerging()) {
                findings.add("Emerging signal (new drug-event combination)");
                riskFactors.add("Novel adverse event for this drug");
            }
        }
        if (causality != null) {
            if (causality.whoCategory().isStrong()) {
                findings.add("Causality assessment: " + causality.whoCategory().name().toLowerCase(Locale.ROOT));
            }
            riskFactors.addAll(causality.primaryFactors());
        }
    }

    private static List<String> recommendations(SignalStrength strength) {
        switch (strength) {
            case VERY_STRONG:
            case STRONG:
                return List.of(
                        "Escalate to medical review immediately",
                        "Consider regulatory reporting if serious",
                        "Evaluate need for product labeling update");
            case MODERATE:
                return List.of(
                        "Enhanced monitoring recommended",
                        "Gather additional case details",
                        "Consider literature review");
            case WEAK:
                return List.of("Continue routine monitoring", "Re-evaluate if case count increases");
            default:
                return List.of("No immediate action required");
        }
    }

    public SignalDetectionConfig getConfig() {
        return config;
    }
}
