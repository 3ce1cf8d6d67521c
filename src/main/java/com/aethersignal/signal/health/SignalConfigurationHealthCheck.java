/* (C)2026 */
package com.aethersignal.signal.health;

import com.aethersignal.signal.config.SignalDetectionConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Locale;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check for the detection configuration.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: all three fusion weights are positive</li>
 *   <li>DOWN: a fusion layer is weighted out, which silently drops it from every score</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class SignalConfigurationHealthCheck implements HealthCheck {

    @Inject SignalDetectionConfig config;

    @Override
    public HealthCheckResponse call() {
        SignalDetectionConfig.FusionWeights weights = config.fusionWeights();
        boolean valid = weights.allPositive();

        return HealthCheckResponse.named("signal-configuration")
                .status(valid)
                .withData("preset", config.preset().name())
                .withData("shrinkage-model", config.bayesian().method().name())
                .withData(
                        "fusion-weights",
                        String.format(Locale.ROOT, "classical=%.2f, layer1=%.2f, layer2=%.2f",
                                weights.classical(), weights.layer1(), weights.layer2()))
                .build();
    }
}
