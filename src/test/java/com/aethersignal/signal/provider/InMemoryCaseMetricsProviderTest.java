/* (C)2026 */
package com.aethersignal.signal.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.aethersignal.signal.model.CaseReport;
import com.aethersignal.signal.model.ContingencyTable;
import com.aethersignal.signal.model.SignalEvidence;
import com.aethersignal.signal.model.SignalQuerySpec;
import com.aethersignal.signal.model.TimeSeriesData;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link InMemoryCaseMetricsProvider} over a small fixed case list.
 */
class InMemoryCaseMetricsProviderTest
{

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-01T00:00:00Z"), ZoneOffset.UTC);

    private static final List<CaseReport> CASES = List.of(
            report("C-001", "Warfarin", "Haemorrhage", true, "2026-03-04", 72, "US", "hospitalization", "FAERS", 12),
            report("C-002", "Warfarin", "Haemorrhage", true, "2026-04-11", 68, "US", "death", "FAERS", 20),
            report("C-003", "Warfarin", "Gastrointestinal haemorrhage", true, "2026-05-19", 81, "EU",
                    "hospitalization", "EudraVigilance", 15),
            report("C-004", "Warfarin", "Haemorrhage", false, "2026-06-02", 59, "US", "recovered", "FAERS", 30),
            report("C-005", "Warfarin", "Nausea", false, "2026-06-21", 64, "US", "recovered", "FAERS", 3),
            report("C-006", "Aspirin", "Nausea", false, "2026-02-14", 45, "US", "recovered", "FAERS", 1),
            report("C-007", "Aspirin", "Headache", false, "2026-03-30", 38, "EU", "recovered", "FAERS", 2),
            report("C-008", "Aspirin", "Haemorrhage", true, "2026-07-08", 77, "US", "hospitalization", "FAERS", 40),
            report("C-009", "Metformin", "Lactic acidosis", true, "2026-01-22", 66, "US", "hospitalization", "FAERS", 90),
            report("C-010", "Metformin", "Diarrhoea", false, "2026-05-05", 52, "EU", "recovered", "FAERS", 5),
            report("C-011", "Metformin", "Nausea", false, "2026-08-17", 49, "US", "recovered", "FAERS", 4),
            report("C-012", "Atorvastatin", "Myalgia", false, "2026-09-01", 61, "US", "recovered", "FAERS", 60));

    private final InMemoryCaseMetricsProvider provider = new InMemoryCaseMetricsProvider(
            new CaseDataset(CASES, Map.of("Warfarin", List.of("Haemorrhage", "Nausea"))), CLOCK);

    private static CaseReport report(
            String id, String drug, String reaction, boolean serious, String date, int age, String region,
            String outcome, String source, int onset)
    {
        return new CaseReport(id, drug, reaction, serious, LocalDate.parse(date), age, region, outcome, source, onset);
    }

    private static SignalQuerySpec spec(boolean seriousOnly, Integer ageMin, List<String> regions, String window)
    {
        return new SignalQuerySpec(null, List.of(), List.of(), seriousOnly, ageMin, null, regions, window, 10, null);
    }

    @Test
    void buildsEvidenceFromWholePopulation()
    {
        SignalEvidence evidence = provider.evidence("warfarin", "haemorrhage", spec(false, null, null, null))
                .orElseThrow();

        // 4 matching, 5 warfarin, 5 haemorrhage, 12 in total
        assertThat(evidence.contingencyTable()).isEqualTo(new ContingencyTable(4, 1, 1, 6));
        assertThat(evidence.totalCases()).isEqualTo(12);
        assertThat(evidence.signalData().count()).isEqualTo(4);
        assertThat(evidence.signalData().seriousCount()).isEqualTo(3);
        assertThat(evidence.signalData().dates()).containsExactly(
                LocalDate.of(2026, 3, 4), LocalDate.of(2026, 4, 11), LocalDate.of(2026, 5, 19), LocalDate.of(2026, 6, 2));
        assertThat(evidence.signalData().outcomes()).contains("death");
        assertThat(evidence.signalData().sources()).containsExactly("FAERS", "EudraVigilance");
        assertThat(evidence.sources()).containsExactly("FAERS", "EudraVigilance");
        assertThat(evidence.latencies()).containsExactly(12, 20, 15, 30);
        assertThat(evidence.firstReportDate()).isEqualTo(LocalDate.of(2026, 3, 4));
        assertThat(evidence.labelReactions()).containsExactly("Haemorrhage", "Nausea");
        assertThat(evidence.timeSeries().counts()).containsExactly(1, 1, 1, 1);
        assertThat(evidence.timeSeries().dates().get(0)).isEqualTo(LocalDate.of(2026, 3, 1));
    }

    @Test
    void seriousnessFilterNarrowsThePopulation()
    {
        SignalEvidence evidence = provider.evidence("Warfarin", "Haemorrhage", spec(true, null, null, null))
                .orElseThrow();

        assertThat(evidence.totalCases()).isEqualTo(5);
        assertThat(evidence.contingencyTable()).isEqualTo(new ContingencyTable(3, 0, 1, 1));
    }

    @Test
    void ageAndRegionFiltersApply()
    {
        SignalEvidence elderly = provider.evidence("warfarin", "haemorrhage", spec(false, 70, null, null))
                .orElseThrow();
        SignalEvidence europe = provider.evidence("warfarin", "haemorrhage", spec(false, null, List.of("eu"), null))
                .orElseThrow();

        assertThat(elderly.signalData().count()).isEqualTo(2);
        assertThat(elderly.totalCases()).isEqualTo(3);
        assertThat(europe.signalData().count()).isEqualTo(1);
        assertThat(europe.signalData().sources()).containsExactly("EudraVigilance");
    }

    @Test
    void timeWindowFiltersCasesButNotFirstReportDate()
    {
        // LAST_3_MONTHS from 2026-10-01 starts on 2026-07-03
        assertThat(provider.evidence("warfarin", "haemorrhage", spec(false, null, null, "LAST_3_MONTHS"))).isEmpty();

        SignalEvidence aspirin = provider.evidence("aspirin", "haemorrhage", spec(false, null, null, "LAST_3_MONTHS"))
                .orElseThrow();
        assertThat(aspirin.totalCases()).isEqualTo(3);
        assertThat(aspirin.firstReportDate()).isEqualTo(LocalDate.of(2026, 7, 8));
        assertThat(aspirin.labelReactions()).isEmpty();
    }

    @Test
    void unmatchedPairHasNoEvidence()
    {
        Optional<SignalEvidence> evidence = provider.evidence("atorvastatin", "Haemorrhage", spec(false, null, null, null));

        assertThat(evidence).isEmpty();
        assertThat(provider.size()).isEqualTo(12);
    }

    @Test
    void monthlySeriesIsZeroFilled()
    {
        TimeSeriesData series = InMemoryCaseMetricsProvider.monthlySeries(List.of(
                LocalDate.of(2026, 1, 15), LocalDate.of(2026, 3, 2), LocalDate.of(2026, 3, 20)));

        assertThat(series.dates()).containsExactly(
                LocalDate.of(2026, 1, 1), LocalDate.of(2026, 2, 1), LocalDate.of(2026, 3, 1));
        assertThat(series.counts()).containsExactly(1, 0, 2);
        assertThat(InMemoryCaseMetricsProvider.monthlySeries(List.of())).isNull();
    }
}
