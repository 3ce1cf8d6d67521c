/* (C)2026 */
package com.aethersignal.signal.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.aethersignal.signal.config.SignalDetectionConfig;
import com.aethersignal.signal.config.SignalDetectionConfig.BayesianSettings;
import com.aethersignal.signal.enumeration.ShrinkageMethod;
import com.aethersignal.signal.enumeration.SignalStrength;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.model.ClinicalFeatures;
import com.aethersignal.signal.model.ContingencyTable;
import com.aethersignal.signal.model.PairObservation;
import com.aethersignal.signal.model.TimeSeriesData;
import com.aethersignal.signal.model.UnifiedSignalResult;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link UnifiedSignalDetector}, wired with real analyzers.
 */
class UnifiedSignalDetectorTest
{

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-06-30T08:00:00Z"), ZoneOffset.UTC);
    private static final ContingencyTable STRONG = new ContingencyTable(45, 955, 120, 9880);
    private static final ContingencyTable EMPTY_CELL = new ContingencyTable(0, 100, 50, 5000);

    private final UnifiedSignalDetector detector = detector(SignalDetectionConfig.defaults());

    private static UnifiedSignalDetector detector(SignalDetectionConfig config)
    {
        return new UnifiedSignalDetector(
                config,
                new DisproportionalityAnalyzer(config),
                new BayesianSignalDetector(config),
                new CausalityAssessor(),
                new TemporalPatternAnalyzer(config, CLOCK));
    }

    @Test
    void strongTableIsStrongSignalWithEscalation()
    {
        UnifiedSignalResult result = detector.detectSignal("warfarin", "Haemorrhage", STRONG);

        assertThat(result.signal()).isTrue();
        assertThat(result.methodsFlagged()).containsExactly("PRR", "ROR", "IC");
        assertThat(result.signalStrength()).isEqualTo(SignalStrength.STRONG);
        assertThat(result.keyFindings())
                .contains("Disproportionality detected: PRR=3.75, ROR=3.88, IC=1.58")
                .contains("Substantial case count: 45 reports");
        assertThat(result.recommendations()).first().isEqualTo("Escalate to medical review immediately");
        assertThat(result.causality()).isNull();
        assertThat(result.temporal()).isNull();
    }

    @Test
    void missingTemporalAndCausalityWeightsAreReassigned()
    {
        UnifiedSignalResult result = detector.detectSignal("warfarin", "Haemorrhage", STRONG);

        double classical = UnifiedSignalDetector.classicalScore(result.disproportionality());
        double bayesian = UnifiedSignalDetector.bayesianScore(result.bayesian());
        // three methods and a mean ratio above 3
        assertThat(classical).isCloseTo(0.95, within(1e-12));
        assertThat(result.compositeScore())
                .isCloseTo(0.30 * classical + 0.40 * bayesian + 0.20 * bayesian + 0.10 * classical, within(1e-12));
    }

    @Test
    void emptyCellTableIsNoSignal()
    {
        UnifiedSignalResult result = detector.detectSignal("drug", "event", EMPTY_CELL);

        assertThat(result.signal()).isFalse();
        assertThat(result.signalStrength()).isEqualTo(SignalStrength.NONE);
        assertThat(result.methodsFlagged()).isEmpty();
        assertThat(result.recommendations()).containsExactly("No immediate action required");
        assertThat(result.compositeScore()).isCloseTo(0.40 * 0.2 + 0.60 * 0.30, within(1e-12));
    }

    @Test
    void clinicalFeaturesAndTimeSeriesEnableTheirAnalyses()
    {
        List<LocalDate> dates = new ArrayList<>();
        List<Integer> counts = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            dates.add(LocalDate.of(2026, 1, 5).plusWeeks(i));
            counts.add(4);
        }
        ClinicalFeatures features = ClinicalFeatures.builder()
                .timeToOnsetDays(10)
                .dechallengeImproved(true)
                .alternativeCauses(List.of())
                .knownReaction(true)
                .build();
        PairObservation observation = new PairObservation(
                "warfarin", "Haemorrhage", STRONG, features, new TimeSeriesData(dates, counts), null, List.of(5, 10, 20));

        UnifiedSignalResult result = detector.detectSignal(observation);

        assertThat(result.temporal()).isNotNull();
        assertThat(result.temporal().latency().caseCount()).isEqualTo(3);
        assertThat(result.causality()).isNotNull();
        double classical = UnifiedSignalDetector.classicalScore(result.disproportionality());
        double bayesian = UnifiedSignalDetector.bayesianScore(result.bayesian());
        assertThat(result.compositeScore()).isCloseTo(
                0.30 * classical + 0.40 * bayesian + 0.20 * result.temporal().temporalRiskScore()
                        + 0.10 * result.causality().confidence(),
                within(1e-12));
    }

    @Test
    void causalityFallsBackToRawLatenciesWithoutTimeSeries()
    {
        ClinicalFeatures features = ClinicalFeatures.builder().timeToOnsetDays(30).build();
        PairObservation observation =
                new PairObservation("warfarin", "Haemorrhage", STRONG, features, null, null, List.of(5, 10, 20));

        UnifiedSignalResult result = detector.detectSignal(observation);

        assertThat(result.temporal()).isNull();
        assertThat(result.causality()).isNotNull();
        // quartiles of 5, 10 and 20 days are 7.5 and 15
        assertThat(result.causality().latencyConsistency()).isNotNull();
        assertThat(result.causality().latencyConsistency().consistent()).isFalse();
    }

    @Test
    void bayesianSignalCountsTowardStrengthWhenConfigured()
    {
        SignalDetectionConfig config = SignalDetectionConfig.builder()
                .bayesian(new BayesianSettings(ShrinkageMethod.GAMMA_POISSON, 0.2, 0.1, 2.0, 4.0, 0.1, true))
                .build();

        UnifiedSignalResult result = detector(config).detectSignal("warfarin", "Haemorrhage", STRONG);

        assertThat(result.methodsFlagged()).containsExactly("PRR", "ROR", "IC", "EBGM");
        assertThat(result.signalStrength()).isEqualTo(SignalStrength.VERY_STRONG);
    }

    @Test
    void repeatedDetectionIsIdentical()
    {
        List<LocalDate> dates = new ArrayList<>();
        List<Integer> counts = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            dates.add(LocalDate.of(2026, 1, 5).plusWeeks(i));
            counts.add(i == 12 ? 25 : 3 + i % 3);
        }
        PairObservation observation = new PairObservation(
                "warfarin",
                "Haemorrhage",
                STRONG,
                ClinicalFeatures.builder().timeToOnsetDays(12).dechallengeImproved(true).build(),
                new TimeSeriesData(dates, counts),
                LocalDate.of(2026, 1, 5),
                List.of(5, 12, 20));

        UnifiedSignalResult first = detector.detectSignal(observation);
        UnifiedSignalResult second = detector.detectSignal(observation);

        assertThat(second).isEqualTo(first);
        assertThat(detector.detectSignalsBatch(List.of(observation, observation)))
                .containsExactly(first, first);
    }

    @Test
    void missingTableIsRejected()
    {
        assertThatThrownBy(() -> detector.detectSignal("warfarin", "Haemorrhage", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("contingencyTable");
        assertThatThrownBy(() -> detector.detectSignalsBatch(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void batchKeepsInputOrder()
    {
        List<PairObservation> observations = List.of(
                PairObservation.of("drug", "event", EMPTY_CELL),
                PairObservation.of("warfarin", "Haemorrhage", STRONG));

        List<UnifiedSignalResult> results = detector.detectSignalsBatch(observations);

        assertThat(results).extracting(UnifiedSignalResult::drug).containsExactly("drug", "warfarin");
        assertThat(results.get(1).bayesian())
                .isEqualTo(detector.detectSignal("warfarin", "Haemorrhage", STRONG).bayesian());
    }

    @Test
    void fittedPriorIsScopedToTheBatch()
    {
        ContingencyTable frequent = new ContingencyTable(50, 950, 950, 98_050);
        List<PairObservation> observations = List.of(
                PairObservation.of("a", "x", new ContingencyTable(10, 990, 990, 98_010)),
                PairObservation.of("b", "x", frequent),
                PairObservation.of("c", "x", new ContingencyTable(2, 998, 998, 98_002)));
        double before = detector.detectSignal("b", "x", frequent).bayesian().ebgm();

        List<UnifiedSignalResult> fitted = detector.detectSignalsBatch(observations, true);

        assertThat(fitted.get(1).bayesian().ebgm()).isNotCloseTo(before, within(1e-6));
        assertThat(detector.detectSignal("b", "x", frequent).bayesian().ebgm()).isEqualTo(before);
    }

    @Test
    void rankingSortsByCompositeDescendingWithoutMutatingInput()
    {
        List<UnifiedSignalResult> results = detector.detectSignalsBatch(List.of(
                PairObservation.of("drug", "event", EMPTY_CELL),
                PairObservation.of("warfarin", "Haemorrhage", STRONG)));

        List<UnifiedSignalResult> ranked = detector.rankByCompositeScore(results);

        assertThat(ranked).extracting(UnifiedSignalResult::drug).containsExactly("warfarin", "drug");
        assertThat(results).extracting(UnifiedSignalResult::drug).containsExactly("drug", "warfarin");
    }
}
