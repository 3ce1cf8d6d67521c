/* (C)2026 */
package com.aethersignal.signal.provider;

import com.aethersignal.signal.model.MappedTerm;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Dictionary-based normalizer: exact preferred-term match, then synonym, then substring.
 *
 * <p>Matching is case-insensitive. Confidence is 1.0 for a preferred term, 0.9 for a
 * synonym and 0.7 for a substring match, where the shortest matching preferred term wins.
 */
public class SynonymTerminologyNormalizer implements TerminologyNormalizer {

    static final double EXACT_CONFIDENCE = 1.0;
    static final double SYNONYM_CONFIDENCE = 0.9;
    static final double SUBSTRING_CONFIDENCE = 0.7;

    private static final Map<String, String> DEFAULT_SYNONYMS = Map.ofEntries(
            Map.entry("bleeding", "Haemorrhage"),
            Map.entry("hemorrhage", "Haemorrhage"),
            Map.entry("gi bleeding", "Gastrointestinal haemorrhage"),
            Map.entry("gastrointestinal bleeding", "Gastrointestinal haemorrhage"),
            Map.entry("liver failure", "Hepatic failure"),
            Map.entry("liver injury", "Drug-induced liver injury"),
            Map.entry("heart attack", "Myocardial infarction"),
            Map.entry("stroke", "Cerebrovascular accident"),
            Map.entry("rash", "Rash"),
            Map.entry("itching", "Pruritus"),
            Map.entry("throwing up", "Vomiting"),
            Map.entry("feeling sick", "Nausea"),
            Map.entry("headache", "Headache"),
            Map.entry("dizzy", "Dizziness"),
            Map.entry("kidney failure", "Renal failure"),
            Map.entry("kidney injury", "Acute kidney injury"),
            Map.entry("low blood sugar", "Hypoglycaemia"),
            Map.entry("hypoglycemia", "Hypoglycaemia"),
            Map.entry("low platelets", "Thrombocytopenia"),
            Map.entry("blood clot", "Thrombosis"),
            Map.entry("irregular heartbeat", "Arrhythmia"),
            Map.entry("allergic reaction", "Hypersensitivity"),
            Map.entry("anaphylaxis", "Anaphylactic reaction"),
            Map.entry("pancreas inflammation", "Pancreatitis"),
            Map.entry("muscle pain", "Myalgia"));

    private final Map<String, String> preferredTerms = new LinkedHashMap<>();
    private final Map<String, String> synonyms = new LinkedHashMap<>();

    /** Normalizer over the built-in synonym table. */
    public SynonymTerminologyNormalizer() {
        this(DEFAULT_SYNONYMS);
    }

    /**
     * @param synonyms free-text synonym to preferred term; every value also becomes a
     *     preferred term
     */
    public SynonymTerminologyNormalizer(Map<String, String> synonyms) {
        this(synonyms, synonyms.values());
    }

    public SynonymTerminologyNormalizer(Map<String, String> synonyms, Collection<String> preferredTerms) {
        for (String term : preferredTerms) {
            this.preferredTerms.put(key(term), term);
        }
        synonyms.forEach((synonym, preferred) -> {
            this.synonyms.put(key(synonym), preferred);
            this.preferredTerms.putIfAbsent(key(preferred), preferred);
        });
    }

    @Override
    public Optional<MappedTerm> map(String term) {
        if (term == null || term.isBlank()) {
            return Optional.empty();
        }
        String key = key(term);

        String exact = preferredTerms.get(key);
        if (exact != null) {
            return Optional.of(new MappedTerm(term, exact, EXACT_CONFIDENCE));
        }
        String synonym = synonyms.get(key);
        if (synonym != null) {
            return Optional.of(new MappedTerm(term, synonym, SYNONYM_CONFIDENCE));
        }

        String best = null;
        for (Map.Entry<String, String> entry : preferredTerms.entrySet()) {
            String candidate = entry.getKey();
            if (candidate.contains(key) || key.contains(candidate)) {
                if (best == null || entry.getValue().length() < best.length()) {
                    best = entry.getValue();
                }
            }
        }
        return best == null
                ? Optional.empty()
                : Optional.of(new MappedTerm(term, best, SUBSTRING_CONFIDENCE));
    }

    private static String key(String term) {
        return term.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
