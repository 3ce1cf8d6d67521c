/* (C)2026 */
package com.aethersignal.signal.dto;

import static com.aethersignal.signal.util.NumericSanitizer.sanitize;

import com.aethersignal.signal.model.TemporalPatternResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Summary view of a temporal analysis. Burst and change-point detail is reduced to
 * dates and fold changes.
 */
@Schema(description = "Temporal pattern summary")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TemporalPatternDTO(
        @Schema(description = "Trend direction") String trend,
        @Schema(description = "Least-squares slope in cases per day") Double trendSlope,
        @Schema(description = "Slope is statistically significant") Boolean trendSignificant,
        @Schema(description = "Doubling time in days for increasing trends") Double doublingTimeDays,
        @Schema(description = "Significant bursts") List<Event> bursts,
        @Schema(description = "A burst falls in the recent window") Boolean hasRecentBurst,
        @Schema(description = "Burst score in [0, 1]") Double burstScore,
        @Schema(description = "Detected change points") List<Event> changePoints,
        @Schema(description = "Novelty score in [0, 1]") Double noveltyScore,
        @Schema(description = "Pair is emerging") Boolean emerging,
        @Schema(description = "Median time to onset in days") Double medianLatencyDays,
        @Schema(description = "Temporal risk score in [0, 1]") Double temporalRiskScore,
        @Schema(description = "Human-readable flags") List<String> flags) {

    @Schema(description = "Dated temporal event")
    public record Event(
            @Schema(description = "Bucket date") LocalDate date,
            @Schema(description = "Fold change against the baseline") Double foldChange,
            @Schema(description = "p-value") Double pValue) {}

    public static TemporalPatternDTO from(TemporalPatternResult result) {
        if (result == null) {
            return null;
        }
        List<Event> bursts = new ArrayList<>();
        for (TemporalPatternResult.Burst burst : result.bursts()) {
            if (burst.significant()) {
                bursts.add(new Event(burst.date(), sanitize(burst.foldIncrease()), sanitize(burst.pValue())));
            }
        }
        List<Event> changePoints = new ArrayList<>();
        for (TemporalPatternResult.ChangePoint point : result.changePoints()) {
            changePoints.add(new Event(point.date(), sanitize(point.foldChange()), sanitize(point.pValue())));
        }
        TemporalPatternResult.Trend trend = result.trend();
        return new TemporalPatternDTO(
                trend == null ? null : trend.direction().name(),
                trend == null ? null : sanitize(trend.slope()),
                trend == null ? null : trend.significant(),
                trend == null ? null : sanitize(trend.doublingTimeDays()),
                bursts,
                result.hasRecentBurst(),
                sanitize(result.burstScore()),
                changePoints,
                result.novelty() == null ? null : sanitize(result.novelty().score()),
                result.novelty() == null ? null : result.novelty().emerging(),
                result.latency() == null ? null : sanitize(result.latency().medianDays()),
                sanitize(result.temporalRiskScore()),
                result.flags());
    }
}
