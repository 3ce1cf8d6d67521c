/* (C)2026 */
package com.aethersignal.signal.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aethersignal.signal.config.SignalDetectionConfig;
import com.aethersignal.signal.config.SignalDetectionConfig.QuerySettings;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.model.ContingencyTable;
import com.aethersignal.signal.model.MappedTerm;
import com.aethersignal.signal.model.RankedSignal;
import com.aethersignal.signal.model.SignalData;
import com.aethersignal.signal.model.SignalEvidence;
import com.aethersignal.signal.model.SignalQuerySpec;
import com.aethersignal.signal.provider.MetricsProvider;
import com.aethersignal.signal.provider.TerminologyNormalizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for {@link QueryRouter} with a mocked metrics provider and terminology.
 */
class QueryRouterTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 6, 30);

    private final SignalEvidence warfarin = SignalEvidence.builder("warfarin", "Haemorrhage")
            .signalData(SignalData.builder()
                    .count(45)
                    .seriousCount(45)
                    .outcomes(List.of("death"))
                    .mostRecentDate(TODAY)
                    .build())
            .totalCases(11_000)
            .contingencyTable(new ContingencyTable(45, 955, 120, 9880))
            .build();
    private final SignalEvidence aspirin = SignalEvidence.builder("aspirin", "Haemorrhage")
            .signalData(SignalData.builder().count(400).build())
            .totalCases(1000)
            .build();

    private MetricsProvider provider;
    private TerminologyNormalizer normalizer;
    private SimpleMeterRegistry registry;
    private CompleteFusionEngine engine;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        provider = mock(MetricsProvider.class);
        normalizer = mock(TerminologyNormalizer.class);
        registry = new SimpleMeterRegistry();
        engine = CompleteFusionEngineTest.engine(SignalDetectionConfig.defaults(), null);
        pool = Executors.newFixedThreadPool(4);

        when(normalizer.map("bleeding")).thenReturn(Optional.of(new MappedTerm("bleeding", "Haemorrhage", 0.9)));
        when(normalizer.map("nausea")).thenReturn(Optional.of(new MappedTerm("nausea", "Nausea", 1.0)));
        when(provider.evidence(eq("warfarin"), eq("Haemorrhage"), any())).thenReturn(Optional.of(warfarin));
        when(provider.evidence(eq("aspirin"), eq("Haemorrhage"), any())).thenReturn(Optional.of(aspirin));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private QueryRouter router(SignalDetectionConfig config, CompleteFusionEngine fusionEngine) {
        return new QueryRouter(config, fusionEngine, provider, normalizer, pool, registry);
    }

    private QueryRouter router() {
        return router(SignalDetectionConfig.defaults(), engine);
    }

    private double skipped(String reason) {
        return registry.find("signal_query_candidates_skipped_total").tag("reason", reason).counter() == null
                ? 0.0
                : registry.get("signal_query_candidates_skipped_total").tag("reason", reason).counter().count();
    }

    @Test
    void queryReturnsRankedExplainedResults() {
        List<RankedSignal> signals =
                router().runQuery(SignalQuerySpec.of(List.of("aspirin", "warfarin"), List.of("bleeding"), 10));

        assertThat(signals).hasSize(2);
        assertThat(signals).extracting(s -> s.result().drug()).containsExactly("warfarin", "aspirin");
        assertThat(signals.get(0).fusionScore()).isGreaterThanOrEqualTo(signals.get(1).fusionScore());
        assertThat(signals).extracting(s -> s.result().quantumRank()).containsExactly(1, 2);
        assertThat(signals.get(0).explanation())
                .startsWith("warfarin / Haemorrhage; alert level: " + signals.get(0).result().alertLevel().label())
                .contains("fusion score: ")
                .contains("classical signal (PRR, ROR, IC)");
    }

    @Test
    void limitTruncatesAfterRanking() {
        List<RankedSignal> signals =
                router().runQuery(SignalQuerySpec.of(List.of("aspirin", "warfarin"), List.of("bleeding"), 1));

        assertThat(signals).extracting(s -> s.result().drug()).containsExactly("warfarin");
    }

    @Test
    void nonPositiveLimitFallsBackToConfiguredDefault() {
        SignalDetectionConfig config = SignalDetectionConfig.builder()
                .query(new QuerySettings(Duration.ofSeconds(5), 1))
                .build();

        List<RankedSignal> signals = router(config, engine)
                .runQuery(SignalQuerySpec.of(List.of("aspirin", "warfarin"), List.of("bleeding"), 0));

        assertThat(signals).hasSize(1);
    }

    @Test
    void candidatesWithoutEvidenceAreSkipped() {
        when(provider.evidence(eq("aspirin"), eq("Haemorrhage"), any())).thenReturn(Optional.empty());

        List<RankedSignal> signals =
                router().runQuery(SignalQuerySpec.of(List.of("aspirin", "warfarin"), List.of("bleeding"), 10));

        assertThat(signals).extracting(s -> s.result().drug()).containsExactly("warfarin");
        assertThat(skipped(QueryRouter.SKIP_NO_EVIDENCE)).isEqualTo(1.0);
    }

    @Test
    void failingProviderSkipsOnlyThatCandidate() {
        when(provider.evidence(eq("aspirin"), eq("Haemorrhage"), any()))
                .thenThrow(new IllegalStateException("database unavailable"));

        List<RankedSignal> signals =
                router().runQuery(SignalQuerySpec.of(List.of("aspirin", "warfarin"), List.of("bleeding"), 10));

        assertThat(signals).extracting(s -> s.result().drug()).containsExactly("warfarin");
        assertThat(skipped(QueryRouter.SKIP_PROVIDER_ERROR)).isEqualTo(1.0);
    }

    @Test
    void slowProviderTimesOut() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(provider.evidence(eq("aspirin"), eq("Haemorrhage"), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return Optional.of(aspirin);
        });
        SignalDetectionConfig config = SignalDetectionConfig.builder()
                .query(new QuerySettings(Duration.ofMillis(200), 50))
                .build();

        try {
            List<RankedSignal> signals = router(config, engine)
                    .runQuery(SignalQuerySpec.of(List.of("aspirin", "warfarin"), List.of("bleeding"), 10));

            assertThat(signals).extracting(s -> s.result().drug()).containsExactly("warfarin");
            assertThat(skipped(QueryRouter.SKIP_TIMEOUT)).isEqualTo(1.0);
        } finally {
            release.countDown();
        }
    }

    @Test
    void queuedLookupsAreNotChargedForWaitingTime() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        List<String> drugs = List.of("d1", "d2", "d3", "d4", "d5", "d6", "d7", "d8");
        when(provider.evidence(anyString(), eq("Haemorrhage"), any())).thenAnswer(invocation -> {
            Thread.sleep(60);
            String drug = invocation.getArgument(0);
            return Optional.of(SignalEvidence.builder(drug, "Haemorrhage")
                    .signalData(SignalData.builder().count(5).build())
                    .totalCases(1000)
                    .build());
        });
        SignalDetectionConfig config = SignalDetectionConfig.builder()
                .query(new QuerySettings(Duration.ofMillis(200), 50))
                .build();

        try {
            // eight 60ms fetches on one thread take far longer than a single 200ms budget
            List<RankedSignal> signals = new QueryRouter(config, engine, provider, normalizer, single, registry)
                    .runQuery(SignalQuerySpec.of(drugs, List.of("bleeding"), 10));

            assertThat(signals).hasSize(8);
            assertThat(skipped(QueryRouter.SKIP_TIMEOUT)).isZero();
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void rejectedLookupSkipsOnlyThatCandidate() {
        pool.shutdown();

        List<RankedSignal> signals =
                router().runQuery(SignalQuerySpec.of(List.of("aspirin", "warfarin"), List.of("bleeding"), 10));

        assertThat(signals).isEmpty();
        assertThat(skipped(QueryRouter.SKIP_PROVIDER_ERROR)).isEqualTo(2.0);
    }

    @Test
    void fusionFailureSkipsTheCandidate() {
        CompleteFusionEngine failing = spy(engine);
        doThrow(new IllegalStateException("boom")).when(failing).detectSignal(aspirin);

        List<RankedSignal> signals = router(SignalDetectionConfig.defaults(), failing)
                .runQuery(SignalQuerySpec.of(List.of("aspirin", "warfarin"), List.of("bleeding"), 10));

        assertThat(signals).extracting(s -> s.result().drug()).containsExactly("warfarin");
        assertThat(skipped(QueryRouter.SKIP_FUSION_ERROR)).isEqualTo(1.0);
    }

    @Test
    void unmatchedReactionsProduceNoCandidates() {
        List<RankedSignal> signals =
                router().runQuery(SignalQuerySpec.of(List.of("warfarin"), List.of("feeling odd"), 10));

        assertThat(signals).isEmpty();
        verify(provider, never()).evidence(anyString(), anyString(), any());
    }

    @Test
    void candidatePairsAreTrimmedAndDeduplicated() {
        List<String[]> pairs = QueryRouter.buildCandidatePairs(
                Arrays.asList(" warfarin ", "warfarin", "", null, "aspirin"),
                List.of("Haemorrhage", "Nausea", "Haemorrhage"));

        assertThat(pairs).extracting(pair -> pair[0] + "/" + pair[1]).containsExactly(
                "warfarin/Haemorrhage", "warfarin/Nausea", "aspirin/Haemorrhage", "aspirin/Nausea");
    }

    @Test
    void filtersAreMappedOntoTheQuerySpec() {
        Map<String, Object> filters = Map.of(
                "drugs", List.of("warfarin"),
                "reactions", "bleeding",
                "seriousness_only", true,
                "age_min", "65",
                "time_window", "LAST_12_MONTHS",
                "limit", 3,
                "raw_text", "serious bleeding in elderly on warfarin");

        List<RankedSignal> signals = router().routeFilters(filters, 50);

        ArgumentCaptor<SignalQuerySpec> spec = ArgumentCaptor.forClass(SignalQuerySpec.class);
        verify(provider).evidence(eq("warfarin"), eq("Haemorrhage"), spec.capture());
        assertThat(spec.getValue().task()).isEqualTo(SignalQuerySpec.DEFAULT_TASK);
        assertThat(spec.getValue().seriousnessOnly()).isTrue();
        assertThat(spec.getValue().ageMin()).isEqualTo(65);
        assertThat(spec.getValue().ageMax()).isNull();
        assertThat(spec.getValue().timeWindow()).isEqualTo("LAST_12_MONTHS");
        assertThat(spec.getValue().limit()).isEqualTo(3);
        assertThat(spec.getValue().rawText()).startsWith("serious bleeding");
        assertThat(signals).hasSize(1);
    }

    @Test
    void callerLimitCapsFilterLimit() {
        router().routeFilters(Map.of("drugs", List.of("warfarin"), "reactions", List.of("bleeding"), "limit", 100), 5);

        ArgumentCaptor<SignalQuerySpec> spec = ArgumentCaptor.forClass(SignalQuerySpec.class);
        verify(provider).evidence(eq("warfarin"), eq("Haemorrhage"), spec.capture());
        assertThat(spec.getValue().limit()).isEqualTo(5);
    }

    @Test
    void malformedFiltersAreRejected() {
        assertThatThrownBy(() -> router().routeFilters(Map.of("limit", "many"), 10))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("limit");
        assertThatThrownBy(() -> router().routeFilters(null, 10)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> router().runQuery(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void explanationNamesTwoStrongestFactorsAndBonus() {
        SignalEvidence borderline = SignalEvidence.builder("metformin", "Lactic acidosis")
                .signalData(SignalData.builder()
                        .count(2)
                        .seriousCount(2)
                        .outcomes(List.of("hospitalized"))
                        .mostRecentDate(TODAY.minusDays(400))
                        .build())
                .totalCases(1000)
                .build();

        String explanation = QueryRouter.explain(engine.detectSignal(borderline));

        assertThat(explanation)
                .startsWith("metformin / Lactic acidosis; alert level: ")
                .contains("drivers: seriousness 1.00, rarity 1.00")
                .contains("borderline bonus 0.10")
                .doesNotContain("classical signal")
                .doesNotContain("multi-source consensus");
    }
}
