/* (C)2026 */
package com.aethersignal.signal.dto;

import static com.aethersignal.signal.util.NumericSanitizer.sanitize;

import com.aethersignal.signal.model.BayesianSignal;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Empirical-Bayes shrinkage estimate")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BayesianSignalDTO(
        @Schema(description = "Shrinkage model") String method,
        @Schema(description = "Observed count") Long observed,
        @Schema(description = "Expected count") Double expected,
        @Schema(description = "Empirical Bayes geometric mean") Double ebgm,
        @Schema(description = "Posterior 5th percentile") Double eb05,
        @Schema(description = "Posterior 95th percentile") Double eb95,
        @Schema(description = "Posterior mean") Double posteriorMean,
        @Schema(description = "EB05 meets the threshold") Boolean signal) {

    public static BayesianSignalDTO from(BayesianSignal signal) {
        if (signal == null) {
            return null;
        }
        return new BayesianSignalDTO(
                signal.method().name(),
                signal.observed(),
                sanitize(signal.expected()),
                sanitize(signal.ebgm()),
                sanitize(signal.eb05()),
                sanitize(signal.eb95()),
                sanitize(signal.posteriorMean()),
                signal.signal());
    }
}
