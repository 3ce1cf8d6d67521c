/* (C)2026 */
package com.aethersignal.signal.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.aethersignal.signal.config.SignalDetectionConfig;
import com.aethersignal.signal.enumeration.AlertLevel;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.model.CompleteFusionResult;
import com.aethersignal.signal.model.ContingencyTable;
import com.aethersignal.signal.model.SignalData;
import com.aethersignal.signal.model.SignalEvidence;
import com.aethersignal.signal.model.TimeSeriesData;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link CompleteFusionEngine}.
 *
 * <p>Batches run on a same-thread executor so that results are deterministic.
 */
class CompleteFusionEngineTest
{

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-06-30T08:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2026, 6, 30);
    private static final ContingencyTable STRONG = new ContingencyTable(45, 955, 120, 9880);

    private SimpleMeterRegistry registry;
    private CompleteFusionEngine engine;

    static CompleteFusionEngine engine(SignalDetectionConfig config, SimpleMeterRegistry registry)
    {
        TemporalPatternAnalyzer temporal = new TemporalPatternAnalyzer(config, CLOCK);
        UnifiedSignalDetector unified = new UnifiedSignalDetector(
                config,
                new DisproportionalityAnalyzer(config),
                new BayesianSignalDetector(config),
                new CausalityAssessor(),
                temporal);
        return new CompleteFusionEngine(
                config,
                unified,
                temporal,
                new SingleSourceQuantumScorer(config, CLOCK),
                new MultiSourceQuantumScorer(config, CLOCK),
                Runnable::run,
                registry);
    }

    @BeforeEach
    void setUp()
    {
        registry = new SimpleMeterRegistry();
        engine = engine(SignalDetectionConfig.defaults(), registry);
    }

    @Test
    void fusionRenormalizesWeightsOverPresentLayers()
    {
        assertThat(engine.fuse(null, 0.6, null)).isCloseTo(0.6, within(1e-12));
        assertThat(engine.fuse(0.8, 0.6, null)).isCloseTo((0.35 * 0.8 + 0.40 * 0.6) / 0.75, within(1e-12));
        assertThat(engine.fuse(0.8, 0.6, 0.4)).isCloseTo(0.35 * 0.8 + 0.40 * 0.6 + 0.25 * 0.4, within(1e-12));
        assertThat(engine.fuse(null, 0.0, 0.0)).isZero();
    }

    @Test
    void fullEvidenceUsesAllThreeLayers()
    {
        SignalEvidence evidence = SignalEvidence.builder("warfarin", "Haemorrhage")
                .signalData(SignalData.builder()
                        .count(45)
                        .seriousCount(30)
                        .outcomes(List.of("hospitalized"))
                        .sources(List.of("FAERS", "PubMed"))
                        .mostRecentDate(TODAY.minusDays(20))
                        .build())
                .totalCases(11_000)
                .contingencyTable(STRONG)
                .labelReactions(List.of("Haemorrhage"))
                .build();

        CompleteFusionResult result = engine.detectSignal(evidence);

        assertThat(result.unified()).isNotNull();
        assertThat(result.classicalScore()).isEqualTo(result.unified().compositeScore());
        assertThat(result.quantumScoreLayer2()).isNotNull();
        assertThat(result.components().layer2()).isNotNull();
        assertThat(result.components().tunnelingEligible()).isFalse();
        assertThat(result.fusionScore()).isCloseTo(
                engine.fuse(result.classicalScore(), result.quantumScoreLayer1(), result.quantumScoreLayer2()),
                within(1e-12));
        assertThat(result.alertLevel())
                .isEqualTo(AlertLevel.fromScore(result.fusionScore(), SignalDetectionConfig.defaults().alertThresholds()));
        assertThat(result.quantumRank()).isNull();
        assertThat(result.count()).isEqualTo(45);
        assertThat(registry.get("signal_fusion_alerts_total")
                        .tag("level", result.alertLevel().label())
                        .counter()
                        .count())
                .isEqualTo(1.0);
    }

    @Test
    void repeatedFusionIsIdentical()
    {
        SignalEvidence evidence = SignalEvidence.builder("warfarin", "Haemorrhage")
                .signalData(SignalData.builder()
                        .count(45)
                        .seriousCount(12)
                        .outcomes(List.of("hospitalized"))
                        .sources(List.of("FAERS", "EudraVigilance"))
                        .dates(List.of(TODAY.minusDays(40), TODAY.minusDays(5)))
                        .build())
                .totalCases(11_000)
                .contingencyTable(STRONG)
                .latencies(List.of(4, 9, 15))
                .labelReactions(List.of("Nausea"))
                .build();

        CompleteFusionResult first = engine.detectSignal(evidence);
        CompleteFusionResult second = engine.detectSignal(evidence);

        assertThat(second).isEqualTo(first);
        assertThat(engine.detectSignalsBatch(List.of(evidence)).get(0).fusionScore()).isEqualTo(first.fusionScore());
    }

    @Test
    void caseFactsAloneFuseToLayerOne()
    {
        SignalEvidence evidence = SignalEvidence.builder("metformin", "Lactic acidosis")
                .signalData(SignalData.builder().count(3).seriousCount(1).build())
                .totalCases(500)
                .build();

        CompleteFusionResult result = engine.detectSignal(evidence);

        assertThat(result.unified()).isNull();
        assertThat(result.classicalScore()).isNull();
        assertThat(result.quantumScoreLayer2()).isNull();
        assertThat(result.components().layer2()).isNull();
        assertThat(result.fusionScore()).isCloseTo(result.quantumScoreLayer1(), within(1e-12));
    }

    @Test
    void timeSeriesWithoutTableFeedsTheBurstFactor()
    {
        List<LocalDate> dates = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            dates.add(TODAY.minusWeeks(11 - i));
        }
        SignalEvidence evidence = SignalEvidence.builder("warfarin", "Haemorrhage")
                .signalData(SignalData.builder().count(52).sources(List.of("FAERS")).build())
                .totalCases(5000)
                .timeSeries(new TimeSeriesData(dates, List.of(2, 3, 2, 3, 2, 3, 2, 3, 2, 20, 3, 2)))
                .build();

        CompleteFusionResult result = engine.detectSignal(evidence);

        assertThat(result.unified()).isNull();
        assertThat(result.components().layer2().burst()).isEqualTo(1.0);
    }

    @Test
    void rankingAssignsQuantumAndClassicalRanks()
    {
        List<CompleteFusionResult> results = List.of(
                result("c", null, 0.3),
                result("b", 0.8, 0.5),
                result("a", 0.2, 0.9));

        List<CompleteFusionResult> ranked = engine.rank(results);

        assertThat(ranked).extracting(CompleteFusionResult::drug).containsExactly("a", "b", "c");
        assertThat(ranked).extracting(CompleteFusionResult::quantumRank).containsExactly(1, 2, 3);
        assertThat(ranked).extracting(CompleteFusionResult::classicalRank).containsExactly(2, 1, null);
        assertThat(ranked.get(0).percentile()).isCloseTo(1.0 / 3.0, within(1e-12));
        assertThat(ranked.get(2).percentile()).isEqualTo(1.0);
        // input is left untouched
        assertThat(results.get(0).quantumRank()).isNull();
    }

    @Test
    void rankingIsStableForTies()
    {
        List<CompleteFusionResult> ranked =
                engine.rank(List.of(result("first", 0.5, 0.4), result("second", 0.5, 0.4), result("top", 0.5, 0.7)));

        assertThat(ranked).extracting(CompleteFusionResult::drug).containsExactly("top", "first", "second");
        assertThat(ranked).extracting(CompleteFusionResult::percentile).isSorted();
    }

    @Test
    void batchDropsFailedPairsAndRanksTheRest()
    {
        SignalEvidence weak = SignalEvidence.builder("aspirin", "Nausea")
                .signalData(SignalData.builder().count(400).build())
                .totalCases(1000)
                .build();
        SignalEvidence strong = SignalEvidence.builder("warfarin", "Haemorrhage")
                .signalData(SignalData.builder()
                        .count(45)
                        .seriousCount(45)
                        .outcomes(List.of("death"))
                        .mostRecentDate(TODAY)
                        .build())
                .totalCases(11_000)
                .contingencyTable(STRONG)
                .build();

        List<CompleteFusionResult> ranked = engine.detectSignalsBatch(Arrays.asList(weak, null, strong));

        assertThat(ranked).hasSize(2);
        assertThat(ranked).extracting(CompleteFusionResult::drug).containsExactly("warfarin", "aspirin");
        assertThat(ranked).extracting(CompleteFusionResult::quantumRank).containsExactly(1, 2);
        assertThat(ranked.get(0).classicalRank()).isEqualTo(1);
        assertThat(ranked.get(1).classicalRank()).isNull();
        assertThat(ranked.get(1).percentile()).isEqualTo(1.0);
    }

    @Test
    void emptyBatchYieldsEmptyRanking()
    {
        assertThat(engine.detectSignalsBatch(List.of())).isEmpty();
    }

    @Test
    void missingInputsAreRejected()
    {
        assertThatThrownBy(() -> engine.detectSignal(null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> engine.detectSignalsBatch(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void worksWithoutMeterRegistry()
    {
        CompleteFusionEngine unmetered = engine(SignalDetectionConfig.defaults(), null);
        SignalEvidence evidence = SignalEvidence.builder("metformin", "Diarrhoea")
                .signalData(SignalData.builder().count(2).build())
                .totalCases(100)
                .build();

        assertThat(unmetered.detectSignal(evidence).alertLevel()).isNotNull();
    }

    private static CompleteFusionResult result(String drug, Double classical, double fusion)
    {
        return new CompleteFusionResult(
                drug, "event", 1, null, classical, fusion, null, fusion, AlertLevel.NONE, null, null, null, null);
    }
}
