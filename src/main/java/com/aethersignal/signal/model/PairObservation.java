/* (C)2026 */
package com.aethersignal.signal.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Inputs of one unified detection: the contingency table plus optional clinical and
 * temporal evidence.
 */
public record PairObservation(
        String drug,
        String event,
        ContingencyTable table,
        ClinicalFeatures clinicalFeatures,
        TimeSeriesData timeSeries,
        LocalDate firstReportDate,
        List<Integer> latencies) {

    public PairObservation {
        latencies = ModelInputs.listOf(latencies, "latencies");
    }

    public static PairObservation of(String drug, String event, ContingencyTable table) {
        return new PairObservation(drug, event, table, null, null, null, List.of());
    }
}
