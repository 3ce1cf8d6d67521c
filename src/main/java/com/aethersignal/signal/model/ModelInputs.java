/* (C)2026 */
package com.aethersignal.signal.model;

import com.aethersignal.signal.exception.ValidationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copies of record collections that report null entries as missing input.
 */
final class ModelInputs {

    private ModelInputs() {}

    /** Copy of {@code values}, empty for {@code null}; null elements are rejected. */
    static <T> List<T> listOf(List<T> values, String name) {
        if (values == null) {
            return List.of();
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) throw ValidationException.missingInput(name + "[" + i + "]");
        }
        return List.copyOf(values);
    }

    /** Copy of {@code values}, empty for {@code null}; null keys and values are rejected. */
    static <V> Map<String, V> mapOf(Map<String, V> values, String name) {
        if (values == null) {
            return Map.of();
        }
        Map<String, V> checked = new LinkedHashMap<>(values.size());
        for (Map.Entry<String, V> entry : values.entrySet()) {
            if (entry.getKey() == null) throw ValidationException.missingInput(name + " key");
            if (entry.getValue() == null) {
                throw ValidationException.missingInput(name + "[" + entry.getKey() + "]");
            }
            checked.put(entry.getKey(), entry.getValue());
        }
        return Map.copyOf(checked);
    }

    /** Like {@link #mapOf} with every value in [0, 1]. */
    static Map<String, Double> unitIntervalMapOf(Map<String, Double> values, String name) {
        Map<String, Double> checked = mapOf(values, name);
        for (Map.Entry<String, Double> entry : checked.entrySet()) {
            unitInterval(entry.getValue(), name + "[" + entry.getKey() + "]");
        }
        return checked;
    }

    static void unitInterval(Double value, String name) {
        if (value != null && !(value >= 0.0 && value <= 1.0)) {
            throw ValidationException.invalidParameter(name, value, "value in [0, 1]");
        }
    }
}
