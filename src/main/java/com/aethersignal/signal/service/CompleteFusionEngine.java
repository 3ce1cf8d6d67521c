/* (C)2026 */
package com.aethersignal.signal.service;

import com.aethersignal.signal.config.ExecutorProducer;
import com.aethersignal.signal.config.SignalDetectionConfig;
import com.aethersignal.signal.config.SignalDetectionConfig.FusionWeights;
import com.aethersignal.signal.enumeration.AlertLevel;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.model.CompleteFusionResult;
import com.aethersignal.signal.model.Layer2Components;
import com.aethersignal.signal.model.PairObservation;
import com.aethersignal.signal.model.QuantumComponents;
import com.aethersignal.signal.model.SignalEvidence;
import com.aethersignal.signal.model.TemporalPatternResult;
import com.aethersignal.signal.model.UnifiedSignalResult;
import com.aethersignal.signal.util.StatisticalFunctions;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Fuses the classical composite score with the single-source (Layer 1) and multi-source
 * (Layer 2) quantum-inspired scores into one fusion score and alert level.
 *
 * <p>Per-pair evaluation is a pure function of the evidence and the injected clock.
 * Batches fan out on the batch executor and are ranked in a second, sequential pass.
 */
@ApplicationScoped
public class CompleteFusionEngine {

    private static final Logger LOG = Logger.getLogger(CompleteFusionEngine.class);

    private final SignalDetectionConfig config;
    private final UnifiedSignalDetector unifiedDetector;
    private final TemporalPatternAnalyzer temporalAnalyzer;
    private final SingleSourceQuantumScorer singleSourceScorer;
    private final MultiSourceQuantumScorer multiSourceScorer;
    private final Executor executor;
    private final MeterRegistry meterRegistry;

    @Inject
    public CompleteFusionEngine(
            SignalDetectionConfig config,
            UnifiedSignalDetector unifiedDetector,
            TemporalPatternAnalyzer temporalAnalyzer,
            SingleSourceQuantumScorer singleSourceScorer,
            MultiSourceQuantumScorer multiSourceScorer,
            @Named(ExecutorProducer.BATCH_EXECUTOR) ManagedExecutor executor,
            MeterRegistry meterRegistry) {
        this(config, unifiedDetector, temporalAnalyzer, singleSourceScorer, multiSourceScorer,
                (Executor) executor, meterRegistry);
    }

    public CompleteFusionEngine(
            SignalDetectionConfig config,
            UnifiedSignalDetector unifiedDetector,
            TemporalPatternAnalyzer temporalAnalyzer,
            SingleSourceQuantumScorer singleSourceScorer,
            MultiSourceQuantumScorer multiSourceScorer,
            Executor executor,
            MeterRegistry meterRegistry) {
        this.config = config;
        this.unifiedDetector = unifiedDetector;
        this.temporalAnalyzer = temporalAnalyzer;
        this.singleSourceScorer = singleSourceScorer;
        this.multiSourceScorer = multiSourceScorer;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Evaluates one pair.
     *
     * <ol>
     *   <li>classical score: composite of the unified result, only with a contingency table</li>
     *   <li>Layer 1 from the aggregated case facts</li>
     *   <li>Layer 2 when multi-source evidence is present</li>
     *   <li>fusion score over the layers present, then the alert level</li>
     * </ol>
     *
     * @throws ValidationException when the evidence is missing
     */
    public CompleteFusionResult detectSignal(SignalEvidence evidence) {
        if (evidence == null) {
            throw ValidationException.missingInput("evidence");
        }
        String drug = evidence.drug();
        String event = evidence.event();

        UnifiedSignalResult unified = null;
        if (evidence.contingencyTable() != null) {
            unified = unifiedDetector.detectSignal(new PairObservation(
                    drug,
                    event,
                    evidence.contingencyTable(),
                    evidence.clinicalFeatures(),
                    evidence.timeSeries(),
                    evidence.firstReportDate(),
                    evidence.latencies()));
        }

        TemporalPatternResult temporal = unified != null ? unified.temporal() : null;
        if (temporal == null && unified == null && evidence.timeSeries() != null) {
            temporal = temporalAnalyzer.analyze(
                    drug, event, evidence.timeSeries(), evidence.firstReportDate(), evidence.latencies());
        }

        Double classicalScore = unified != null ? unified.compositeScore() : null;

        QuantumComponents components = singleSourceScorer.score(
                evidence.signalData(),
                evidence.totalCases(),
                unified != null ? unified.disproportionality() : null);
        double layer1 = components.layer1Score();

        Double layer2 = null;
        if (evidence.hasMultiSourceEvidence()) {
            Layer2Components layer2Components = multiSourceScorer.components(evidence, temporal);
            layer2 = multiSourceScorer.score(layer2Components);
            components = components.withLayer2(layer2Components);
        }

        double fusion = fuse(classicalScore, layer1, layer2);
        AlertLevel alert = AlertLevel.fromScore(fusion, config.alertThresholds());
        recordAlert(alert);

        LOG.debugf(
                "Fusion %s/%s: classical=%s, layer1=%.3f, layer2=%s, tunneling=%.3f, fusion=%.3f, alert=%s",
                drug, event, classicalScore, layer1, layer2, components.tunnelingBonus(), fusion, alert);

        return new CompleteFusionResult(
                drug,
                event,
                evidence.signalData().count(),
                unified,
                classicalScore,
                layer1,
                layer2,
                fusion,
                alert,
                components,
                null,
                null,
                null);
    }

    /**
     * Evaluates every pair on the batch executor, then ranks the results. A pair whose
     * evaluation fails is logged and left out of the ranking.
     */
    public List<CompleteFusionResult> detectSignalsBatch(List<SignalEvidence> batch) {
        if (batch == null) {
            throw ValidationException.missingInput("batch");
        }
        List<CompletableFuture<CompleteFusionResult>> futures = new ArrayList<>(batch.size());
        for (SignalEvidence evidence : batch) {
            futures.add(CompletableFuture.supplyAsync(() -> detectSignal(evidence), executor));
        }

        List<CompleteFusionResult> results = new ArrayList<>(batch.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                SignalEvidence evidence = batch.get(i);
                LOG.warnf(
                        e.getCause(),
                        "Skipping %s/%s in batch: %s",
                        evidence == null ? null : evidence.drug(),
                        evidence == null ? null : evidence.event(),
                        e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            }
        }

        List<CompleteFusionResult> ranked = rank(results);
        LOG.infof("Fused %d of %d pairs, %d at moderate or above",
                ranked.size(), batch.size(),
                ranked.stream().filter(r -> r.alertLevel().compareTo(AlertLevel.MODERATE) <= 0).count());
        return ranked;
    }

    /**
     * Second pass over computed results: sorts by fusion score (descending, stable),
     * assigns quantum ranks 1..N, classical ranks by classical score alone and
     * percentile = rank / N. Results without a classical score get no classical rank.
     */
    public List<CompleteFusionResult> rank(List<CompleteFusionResult> results) {
        List<CompleteFusionResult> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparingDouble(CompleteFusionResult::fusionScore).reversed());
        int n = sorted.size();

        List<Integer> byClassical = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (sorted.get(i).classicalScore() != null) {
                byClassical.add(i);
            }
        }
        byClassical.sort(Comparator.comparingDouble((Integer i) -> sorted.get(i).classicalScore()).reversed());
        Integer[] classicalRanks = new Integer[n];
        for (int rank = 0; rank < byClassical.size(); rank++) {
            classicalRanks[byClassical.get(rank)] = rank + 1;
        }

        List<CompleteFusionResult> ranked = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int quantumRank = i + 1;
            ranked.add(sorted.get(i).withRanks(quantumRank, classicalRanks[i], (double) quantumRank / n));
        }
        return ranked;
    }

    /**
     * Weighted mean of the layers present, with the configured weights renormalized over
     * those layers, clipped to [0, 1].
     */
    double fuse(Double classicalScore, double layer1, Double layer2) {
        FusionWeights weights = config.fusionWeights();
        double weighted = weights.layer1() * layer1;
        double totalWeight = weights.layer1();
        if (classicalScore != null) {
            weighted += weights.classical() * classicalScore;
            totalWeight += weights.classical();
        }
        if (layer2 != null) {
            weighted += weights.layer2() * layer2;
            totalWeight += weights.layer2();
        }
        if (totalWeight <= 0) {
            return 0.0;
        }
        return StatisticalFunctions.clamp(weighted / totalWeight, 0.0, 1.0);
    }

    private void recordAlert(AlertLevel level) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("signal_fusion_alerts_total")
                .description("Fusion results by alert level")
                .tag("level", level.label())
                .register(meterRegistry)
                .increment();
    }
}
