/* (C)2026 */
package com.aethersignal.signal.enumeration;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Serious case outcomes recognized in free-text outcome fields, most severe first.
 */
public enum SeriousOutcome
{
    DEATH(List.of("death", "fatal", "died", "deceased")),
    HOSPITALIZATION(List.of("hospital", "life", "threatening")),
    DISABILITY(List.of("disability", "disabled", "permanent"));

    private final List<String> keywords;

    SeriousOutcome(List<String> keywords) {
        this.keywords = keywords;
    }

    public static Optional<SeriousOutcome> infer(String outcome) {
        if (outcome == null || outcome.isBlank()) {
            return Optional.empty();
        }
        String lower = outcome.toLowerCase(Locale.ROOT);
        for (SeriousOutcome candidate : values()) {
            if (candidate.keywords.stream().anyMatch(lower::contains)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the most severe outcome mentioned across all outcome strings.
     */
    public static Optional<SeriousOutcome> worstOf(Collection<String> outcomes) {
        SeriousOutcome worst = null;
        for (String outcome : outcomes) {
            Optional<SeriousOutcome> parsed = infer(outcome);
            if (parsed.isPresent() && (worst == null || parsed.get().ordinal() < worst.ordinal())) {
                worst = parsed.get();
            }
        }
        return Optional.ofNullable(worst);
    }
}
