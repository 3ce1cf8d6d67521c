/* (C)2026 */
package com.aethersignal.signal.provider;

import com.aethersignal.signal.model.CaseReport;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of the case file loaded by {@link ProviderProducer}.
 *
 * @param cases individual case reports
 * @param labels drug name to reactions listed on its product label
 */
public record CaseDataset(List<CaseReport> cases, Map<String, List<String>> labels) {

    public CaseDataset {
        cases = cases == null ? List.of() : List.copyOf(cases);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
