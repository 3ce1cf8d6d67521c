/* (C)2026 */
package com.aethersignal.signal.enumeration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SourceTypeTest {

    @ParameterizedTest
    @CsvSource({
        "FAERS-2024Q3, FAERS",
        "fda medwatch, FAERS",
        "RWE-claims, RWE",
        "clinical trial NCT01, CLINICAL_TRIALS",
        "PubMed, PUBMED",
        "literature review, PUBMED",
        "reddit, SOCIAL",
        "package insert, LABEL",
        "EudraVigilance, SOCIAL"
    })
    void infersTypeFromSourceName(String name, SourceType expected) {
        assertThat(SourceType.infer(name)).isEqualTo(expected);
    }

    @Test
    void nullNameFallsBackToSocial() {
        assertThat(SourceType.infer(null)).isEqualTo(SourceType.SOCIAL);
    }

    @Test
    void defaultPrioritiesSumToOne() {
        double total = Arrays.stream(SourceType.values()).mapToDouble(SourceType::getDefaultPriority).sum();

        assertThat(total).isCloseTo(1.0, within(1e-12));
    }
}
