/* (C)2026 */
package com.aethersignal.signal.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

@QuarkusTest
class SignalDetectionConfigProducerTest {

    @Inject SignalDetectionConfig config;

    @Test
    void producedConfigMatchesPlatformDefaults() {
        assertThat(config).isEqualTo(SignalDetectionConfig.defaults());
    }
}
