/* (C)2026 */
package com.aethersignal.signal.provider;

import com.aethersignal.signal.model.CaseReport;
import com.aethersignal.signal.model.ContingencyTable;
import com.aethersignal.signal.model.SignalData;
import com.aethersignal.signal.model.SignalEvidence;
import com.aethersignal.signal.model.SignalQuerySpec;
import com.aethersignal.signal.model.TimeSeriesData;
import com.aethersignal.signal.util.TimeWindows;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * {@link MetricsProvider} over an in-memory list of case reports.
 *
 * <p>The query filters (seriousness, age range, regions, time window) define the case
 * population. Within it, drug and reaction match by case-insensitive substring. The
 * population is the denominator for rarity and the basis of the contingency table.
 */
public class InMemoryCaseMetricsProvider implements MetricsProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryCaseMetricsProvider.class);

    private final List<CaseReport> cases;
    private final Map<String, List<String>> labels;
    private final Clock clock;

    public InMemoryCaseMetricsProvider(List<CaseReport> cases, Map<String, List<String>> labels, Clock clock) {
        this.cases = List.copyOf(cases);
        this.labels = labels.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(e -> normalize(e.getKey()), Map.Entry::getValue));
        this.clock = clock;
    }

    public InMemoryCaseMetricsProvider(CaseDataset dataset, Clock clock) {
        this(dataset.cases(), dataset.labels(), clock);
    }

    @Override
    public Optional<SignalEvidence> evidence(String drug, String event, SignalQuerySpec spec) {
        Predicate<CaseReport> filters = filtersFor(spec);
        Predicate<CaseReport> drugMatch = c -> contains(c.drug(), drug);
        Predicate<CaseReport> eventMatch = c -> contains(c.reaction(), event);

        List<CaseReport> population = cases.stream().filter(filters).collect(Collectors.toList());
        List<CaseReport> matching = population.stream()
                .filter(drugMatch.and(eventMatch))
                .collect(Collectors.toList());
        if (matching.isEmpty()) {
            LOG.debugf("No cases for %s/%s", drug, event);
            return Optional.empty();
        }

        long n11 = matching.size();
        long drugCases = population.stream().filter(drugMatch).count();
        long eventCases = population.stream().filter(eventMatch).count();
        ContingencyTable table = new ContingencyTable(
                n11, drugCases - n11, eventCases - n11, population.size() - drugCases - eventCases + n11);

        List<LocalDate> dates = matching.stream()
                .map(CaseReport::eventDate)
                .filter(d -> d != null)
                .sorted()
                .collect(Collectors.toList());
        List<String> outcomes = matching.stream()
                .map(CaseReport::outcome)
                .filter(o -> o != null && !o.isBlank())
                .collect(Collectors.toList());
        List<String> sources = distinctSources(matching);
        List<Integer> latencies = matching.stream()
                .map(CaseReport::timeToOnsetDays)
                .filter(d -> d != null && d >= 0)
                .collect(Collectors.toList());

        SignalData data = SignalData.builder()
                .count(n11)
                .seriousCount(matching.stream().filter(CaseReport::serious).count())
                .dates(dates)
                .outcomes(outcomes)
                .sources(sources)
                .build();

        SignalEvidence evidence = SignalEvidence.builder(drug, event)
                .signalData(data)
                .totalCases(population.size())
                .contingencyTable(table)
                .timeSeries(monthlySeries(dates))
                .firstReportDate(firstReportDate(drug, event).orElse(null))
                .latencies(latencies)
                .sources(distinctSources(population))
                .labelReactions(labels.getOrDefault(normalize(drug), List.of()))
                .build();
        return Optional.of(evidence);
    }

    private Predicate<CaseReport> filtersFor(SignalQuerySpec spec) {
        Predicate<CaseReport> predicate = c -> true;
        if (spec.seriousnessOnly()) {
            predicate = predicate.and(CaseReport::serious);
        }
        if (spec.ageMin() != null) {
            predicate = predicate.and(c -> c.ageYears() != null && c.ageYears() >= spec.ageMin());
        }
        if (spec.ageMax() != null) {
            predicate = predicate.and(c -> c.ageYears() != null && c.ageYears() <= spec.ageMax());
        }
        if (!spec.regionCodes().isEmpty()) {
            List<String> regions = spec.regionCodes().stream()
                    .map(InMemoryCaseMetricsProvider::normalize)
                    .collect(Collectors.toList());
            predicate = predicate.and(c -> c.region() != null && regions.contains(normalize(c.region())));
        }
        Optional<LocalDate> from = TimeWindows.startOf(spec.timeWindow(), clock);
        if (from.isPresent()) {
            LocalDate start = from.get();
            predicate = predicate.and(c -> c.eventDate() != null && !c.eventDate().isBefore(start));
        }
        return predicate;
    }

    /** Earliest report of the pair over all cases, regardless of query filters. */
    private Optional<LocalDate> firstReportDate(String drug, String event) {
        return cases.stream()
                .filter(c -> contains(c.drug(), drug) && contains(c.reaction(), event))
                .map(CaseReport::eventDate)
                .filter(d -> d != null)
                .min(LocalDate::compareTo);
    }

    /** Zero-filled monthly counts keyed by the first day of each month. */
    static TimeSeriesData monthlySeries(List<LocalDate> dates) {
        if (dates.isEmpty()) {
            return null;
        }
        TreeMap<LocalDate, Integer> buckets = new TreeMap<>();
        for (LocalDate date : dates) {
            buckets.merge(date.withDayOfMonth(1), 1, Integer::sum);
        }
        List<LocalDate> months = new ArrayList<>();
        List<Integer> counts = new ArrayList<>();
        for (LocalDate month = buckets.firstKey(); !month.isAfter(buckets.lastKey()); month = month.plusMonths(1)) {
            months.add(month);
            counts.add(buckets.getOrDefault(month, 0));
        }
        return new TimeSeriesData(months, counts);
    }

    private static List<String> distinctSources(List<CaseReport> reports) {
        LinkedHashSet<String> sources = new LinkedHashSet<>();
        for (CaseReport report : reports) {
            if (report.source() != null && !report.source().isBlank()) {
                sources.add(report.source());
            }
        }
        return List.copyOf(sources);
    }

    private static boolean contains(String value, String fragment) {
        return value != null && fragment != null && normalize(value).contains(normalize(fragment));
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    public int size() {
        return cases.size();
    }
}
