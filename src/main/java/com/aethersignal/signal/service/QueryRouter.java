/* (C)2026 */
package com.aethersignal.signal.service;

import com.aethersignal.signal.config.ExecutorProducer;
import com.aethersignal.signal.config.SignalDetectionConfig;
import com.aethersignal.signal.exception.EvidenceUnavailableException;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.model.CompleteFusionResult;
import com.aethersignal.signal.model.MappedTerm;
import com.aethersignal.signal.model.QuantumComponents;
import com.aethersignal.signal.model.RankedSignal;
import com.aethersignal.signal.model.SignalEvidence;
import com.aethersignal.signal.model.SignalQuerySpec;
import com.aethersignal.signal.provider.MetricsProvider;
import com.aethersignal.signal.provider.TerminologyNormalizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Turns a structured query into ranked fusion results.
 *
 * <p>Reactions are normalized through the {@link TerminologyNormalizer}, drugs and terms are
 * crossed into candidate pairs, and evidence for every candidate is fetched from the
 * {@link MetricsProvider} concurrently with a per-candidate timeout. Candidates without
 * evidence, with a failing provider or with a failing evaluation are skipped; the query
 * itself only fails on a structurally invalid spec.
 */
@ApplicationScoped
public class QueryRouter {

    private static final Logger LOG = Logger.getLogger(QueryRouter.class);

    static final String SKIP_NO_EVIDENCE = "no_evidence";
    static final String SKIP_TIMEOUT = "timeout";
    static final String SKIP_PROVIDER_ERROR = "provider_error";
    static final String SKIP_FUSION_ERROR = "fusion_error";

    private static final int EXPLANATION_DRIVERS = 2;

    private final SignalDetectionConfig config;
    private final CompleteFusionEngine fusionEngine;
    private final MetricsProvider metricsProvider;
    private final TerminologyNormalizer terminologyNormalizer;
    private final Executor executor;
    private final MeterRegistry meterRegistry;

    @Inject
    public QueryRouter(
            SignalDetectionConfig config,
            CompleteFusionEngine fusionEngine,
            MetricsProvider metricsProvider,
            TerminologyNormalizer terminologyNormalizer,
            @Named(ExecutorProducer.BATCH_EXECUTOR) ManagedExecutor executor,
            MeterRegistry meterRegistry) {
        this(config, fusionEngine, metricsProvider, terminologyNormalizer, (Executor) executor, meterRegistry);
    }

    public QueryRouter(
            SignalDetectionConfig config,
            CompleteFusionEngine fusionEngine,
            MetricsProvider metricsProvider,
            TerminologyNormalizer terminologyNormalizer,
            Executor executor,
            MeterRegistry meterRegistry) {
        this.config = config;
        this.fusionEngine = fusionEngine;
        this.metricsProvider = metricsProvider;
        this.terminologyNormalizer = terminologyNormalizer;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Runs a query.
     *
     * @return results sorted by fusion score, highest first, at most {@code spec.limit()}
     *     long (the configured default limit when the spec's limit is not positive)
     * @throws ValidationException when {@code spec} is null
     */
    public List<RankedSignal> runQuery(SignalQuerySpec spec) {
        if (spec == null) {
            throw ValidationException.missingInput("querySpec");
        }
        int limit = spec.limit() > 0 ? spec.limit() : config.query().defaultLimit();

        List<String> terms = normalizeReactions(spec.reactions());
        List<String[]> candidates = buildCandidatePairs(spec.drugs(), terms);
        if (candidates.isEmpty()) {
            LOG.infof("No candidate pairs for drugs=%s, reactions=%s", spec.drugs(), spec.reactions());
            return List.of();
        }

        Duration timeout = config.query().evidenceTimeout();
        List<CompletableFuture<Optional<SignalEvidence>>> lookups = new ArrayList<>(candidates.size());
        for (String[] pair : candidates) {
            lookups.add(lookup(pair[0], pair[1], spec, timeout));
        }

        List<CompleteFusionResult> results = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            String drug = candidates.get(i)[0];
            String event = candidates.get(i)[1];

            Optional<SignalEvidence> evidence;
            try {
                evidence = awaitEvidence(drug, event, lookups.get(i));
            } catch (EvidenceUnavailableException e) {
                boolean timedOut = e.getCause() instanceof TimeoutException;
                LOG.warnf("Skipping %s/%s: %s", drug, event,
                        timedOut ? "evidence lookup timed out after " + timeout : e.getCause());
                recordSkip(timedOut ? SKIP_TIMEOUT : SKIP_PROVIDER_ERROR);
                continue;
            }
            if (evidence == null || evidence.isEmpty()) {
                LOG.debugf("No evidence for %s/%s", drug, event);
                recordSkip(SKIP_NO_EVIDENCE);
                continue;
            }

            try {
                results.add(fusionEngine.detectSignal(evidence.get()));
            } catch (RuntimeException e) {
                LOG.warnf(e, "Fusion failed for %s/%s", drug, event);
                recordSkip(SKIP_FUSION_ERROR);
            }
        }

        List<CompleteFusionResult> ranked = fusionEngine.rank(results);
        List<RankedSignal> signals = new ArrayList<>(Math.min(limit, ranked.size()));
        for (CompleteFusionResult result : ranked.subList(0, Math.min(limit, ranked.size()))) {
            signals.add(new RankedSignal(result, explain(result)));
        }
        LOG.infof("Query evaluated %d of %d candidates, returning %d",
                results.size(), candidates.size(), signals.size());
        return signals;
    }

    /**
     * Convenience entry for a loose filter map, as produced by an upstream parser.
     *
     * <p>Recognized keys: {@code task}, {@code drugs}, {@code reactions},
     * {@code seriousness_only}, {@code age_min}, {@code age_max}, {@code region_codes},
     * {@code time_window}, {@code limit}, {@code raw_text}. The effective limit is the
     * smaller of {@code limit} and the map's own limit.
     */
    public List<RankedSignal> routeFilters(Map<String, ?> filters, int limit) {
        if (filters == null) {
            throw ValidationException.missingInput("filters");
        }
        Integer requested = intValue(filters, "limit");
        SignalQuerySpec spec = new SignalQuerySpec(
                stringValue(filters, "task"),
                listValue(filters, "drugs"),
                listValue(filters, "reactions"),
                Boolean.parseBoolean(String.valueOf(filters.get("seriousness_only"))),
                intValue(filters, "age_min"),
                intValue(filters, "age_max"),
                listValue(filters, "region_codes"),
                stringValue(filters, "time_window"),
                requested == null ? limit : Math.min(limit, requested),
                stringValue(filters, "raw_text"));
        return runQuery(spec);
    }

    /** Canonical terms for the requested reactions; unmatched terms are dropped. */
    List<String> normalizeReactions(List<String> reactions) {
        List<String> terms = new ArrayList<>(reactions.size());
        for (String reaction : reactions) {
            Optional<MappedTerm> mapped = terminologyNormalizer.map(reaction);
            if (mapped.isPresent()) {
                terms.add(mapped.get().preferredTerm());
            } else {
                LOG.infof("No preferred term for reaction '%s'", reaction);
            }
        }
        return terms;
    }

    /** Drugs x terms, blank drugs skipped, duplicates removed, first occurrence kept. */
    static List<String[]> buildCandidatePairs(List<String> drugs, List<String> terms) {
        LinkedHashSet<List<String>> pairs = new LinkedHashSet<>();
        for (String drug : drugs) {
            String cleaned = drug == null ? "" : drug.trim();
            if (cleaned.isEmpty()) {
                continue;
            }
            for (String term : terms) {
                pairs.add(List.of(cleaned, term));
            }
        }
        List<String[]> candidates = new ArrayList<>(pairs.size());
        for (List<String> pair : pairs) {
            candidates.add(new String[] {pair.get(0), pair.get(1)});
        }
        return candidates;
    }

    /** One-line explanation naming the alert level, the score and its dominant drivers. */
    static String explain(CompleteFusionResult result) {
        StringBuilder explanation = new StringBuilder()
                .append(result.drug()).append(" / ").append(result.event())
                .append("; alert level: ").append(result.alertLevel().label())
                .append(String.format(Locale.ROOT, "; fusion score: %.3f", result.fusionScore()));

        List<String> drivers = new ArrayList<>();
        QuantumComponents components = result.components();
        List<Map.Entry<String, Double>> factors = new ArrayList<>(List.of(
                Map.entry("rarity", components.rarity()),
                Map.entry("seriousness", components.seriousness()),
                Map.entry("recency", components.recency())));
        factors.sort(Map.Entry.<String, Double>comparingByValue().reversed());
        for (Map.Entry<String, Double> factor : factors.subList(0, EXPLANATION_DRIVERS)) {
            drivers.add(String.format(Locale.ROOT, "%s %.2f", factor.getKey(), factor.getValue()));
        }
        if (result.unified() != null && result.unified().signal()) {
            drivers.add("classical signal (" + String.join(", ", result.unified().methodsFlagged()) + ")");
        }
        if (components.tunnelingBonus() > 0) {
            drivers.add(String.format(Locale.ROOT, "borderline bonus %.2f", components.tunnelingBonus()));
        }
        if (components.layer2() != null && components.layer2().consensus() >= 0.7) {
            drivers.add("multi-source consensus");
        }
        return explanation.append("; drivers: ").append(String.join(", ", drivers)).toString();
    }

    /**
     * Fetches evidence on the executor. The timeout clock starts when the fetch starts, so
     * time spent queued behind other candidates is not charged to this one.
     */
    private CompletableFuture<Optional<SignalEvidence>> lookup(
            String drug, String event, SignalQuerySpec spec, Duration timeout) {
        CompletableFuture<Optional<SignalEvidence>> lookup = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                lookup.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
                try {
                    lookup.complete(metricsProvider.evidence(drug, event, spec));
                } catch (RuntimeException e) {
                    lookup.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            lookup.completeExceptionally(e);
        }
        return lookup;
    }

    private Optional<SignalEvidence> awaitEvidence(
            String drug, String event, CompletableFuture<Optional<SignalEvidence>> lookup) {
        try {
            return lookup.join();
        } catch (CompletionException e) {
            throw new EvidenceUnavailableException(drug, event, e.getCause() == null ? e : e.getCause());
        }
    }

    private void recordSkip(String reason) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("signal_query_candidates_skipped_total")
                .description("Query candidates skipped by reason")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    private static String stringValue(Map<String, ?> filters, String key) {
        Object value = filters.get(key);
        return value == null ? null : value.toString();
    }

    private static Integer intValue(Map<String, ?> filters, String key) {
        Object value = filters.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw ValidationException.invalidParameter(key, value, "integer");
        }
    }

    private static List<String> listValue(Map<String, ?> filters, String key) {
        Object value = filters.get(key);
        if (value == null) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    values.add(item.toString());
                }
            }
        } else {
            values.add(value.toString());
        }
        return values;
    }
}
