/* (C)2026 */
package com.aethersignal.signal.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProviderProducerTest {

    private ProviderProducer producer;

    @BeforeEach
    void setUp() {
        producer = new ProviderProducer();
        producer.objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        producer.clock = Clock.fixed(Instant.parse("2026-10-01T00:00:00Z"), ZoneOffset.UTC);
    }

    @Test
    void loadsCaseFileFromClasspath() {
        CaseDataset dataset = producer.load("test-cases.json");

        assertThat(dataset.cases()).hasSize(12);
        assertThat(dataset.cases().get(0).eventDate()).isEqualTo(LocalDate.of(2026, 3, 4));
        assertThat(dataset.labels()).containsKeys("warfarin", "metformin");
    }

    @Test
    void configuredCaseFileBacksTheProvider() {
        producer.caseFile = Optional.of("/test-cases.json");

        MetricsProvider provider = producer.metricsProvider();

        assertThat(provider).isInstanceOf(InMemoryCaseMetricsProvider.class);
        assertThat(((InMemoryCaseMetricsProvider) provider).size()).isEqualTo(12);
    }

    @Test
    void missingCaseFileSettingGivesEmptyProvider() {
        producer.caseFile = Optional.empty();

        InMemoryCaseMetricsProvider provider = (InMemoryCaseMetricsProvider) producer.metricsProvider();

        assertThat(provider.size()).isZero();
    }

    @Test
    void unknownLocationIsReported() {
        assertThatThrownBy(() -> producer.load("no-such-cases.json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no-such-cases.json");
    }

    @Test
    void terminologyNormalizerDefaultsToSynonymDictionary() {
        assertThat(producer.terminologyNormalizer()).isInstanceOf(SynonymTerminologyNormalizer.class);
    }
}
