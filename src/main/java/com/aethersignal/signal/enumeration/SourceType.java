/* (C)2026 */
package com.aethersignal.signal.enumeration;

import java.util.List;
import java.util.Locale;

/**
 * Provenance of a piece of evidence, used to weight multi-source consensus.
 *
 * <p>Constants are declared in keyword-matching order: the first type whose keyword
 * occurs in a source name wins. Unknown names fall back to {@link #SOCIAL}, the
 * lowest-priority type that still counts toward consensus.
 */
public enum SourceType
{
    FAERS(0.40, List.of("faers", "fda")),
    RWE(0.25, List.of("rwe", "real-world")),
    CLINICAL_TRIALS(0.15, List.of("clinical", "trial")),
    PUBMED(0.10, List.of("pubmed", "literature", "pub")),
    SOCIAL(0.07, List.of("social", "twitter", "reddit")),
    LABEL(0.03, List.of("label", "package"));

    private final double defaultPriority;
    private final List<String> keywords;

    SourceType(double defaultPriority, List<String> keywords) {
        this.defaultPriority = defaultPriority;
        this.keywords = keywords;
    }

    /**
     * Infers the source type from a free-text source name.
     *
     * @param sourceName e.g. {@code "FAERS-2024Q3"} or {@code "pubmed"}
     * @return matching type, {@link #SOCIAL} when nothing matches
     */
    public static SourceType infer(String sourceName) {
        if (sourceName == null) {
            return SOCIAL;
        }
        String lower = sourceName.toLowerCase(Locale.ROOT);
        for (SourceType type : values()) {
            for (String keyword : type.keywords) {
                if (lower.contains(keyword)) {
                    return type;
                }
            }
        }
        return SOCIAL;
    }

    public double getDefaultPriority() { return defaultPriority; }
}
