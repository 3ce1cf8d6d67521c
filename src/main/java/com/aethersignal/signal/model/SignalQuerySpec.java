/* (C)2026 */
package com.aethersignal.signal.model;

import java.util.List;

/**
 * Structured query: which drugs and reactions to rank, with case filters.
 *
 * @param timeWindow window token such as {@code LAST_12_MONTHS}, {@code SINCE_2020},
 *     {@code LAST_30_DAYS} or an ISO date
 * @param limit maximum number of results
 * @param rawText original free-text question, kept for traceability
 */
public record SignalQuerySpec(
        String task,
        List<String> drugs,
        List<String> reactions,
        boolean seriousnessOnly,
        Integer ageMin,
        Integer ageMax,
        List<String> regionCodes,
        String timeWindow,
        int limit,
        String rawText) {

    public static final String DEFAULT_TASK = "rank_signals";

    public SignalQuerySpec {
        task = task == null || task.isBlank() ? DEFAULT_TASK : task;
        drugs = ModelInputs.listOf(drugs, "drugs");
        reactions = ModelInputs.listOf(reactions, "reactions");
        regionCodes = ModelInputs.listOf(regionCodes, "regionCodes");
    }

    public static SignalQuerySpec of(List<String> drugs, List<String> reactions, int limit) {
        return new SignalQuerySpec(DEFAULT_TASK, drugs, reactions, false, null, null, List.of(), null, limit, null);
    }
}
