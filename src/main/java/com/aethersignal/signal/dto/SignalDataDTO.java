/* (C)2026 */
package com.aethersignal.signal.dto;

import com.aethersignal.signal.enumeration.SourceType;
import com.aethersignal.signal.model.SignalData;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Aggregated case-level facts for one pair")
public record SignalDataDTO(
        @Schema(description = "Matching case reports") @NotNull @PositiveOrZero Long count,
        @Schema(description = "Serious case reports") @PositiveOrZero Long seriousCount,
        @Schema(description = "Explicit serious fraction in [0, 1]") Double seriousness,
        @Schema(description = "Report or onset dates") List<LocalDate> dates,
        @Schema(description = "Case outcomes, e.g. death, hospitalization") List<String> outcomes,
        @Schema(description = "Sources that reported the pair") List<String> sources,
        @Schema(description = "Per-source confidence in [0, 1]") Map<String, Double> sourceConfidence,
        @Schema(description = "Per-source signal strength in [0, 1]") Map<String, Double> sourceStrength,
        @Schema(description = "Explicit source types by source name") Map<String, SourceType> sourceTypes,
        @Schema(description = "Explicit severity in [0, 1]") Double severity,
        @Schema(description = "Precomputed burst score in [0, 1]") Double burstScore,
        @Schema(description = "Mechanism plausibility in [0, 1]") Double mechanismScore,
        @Schema(description = "Most recent report date") LocalDate mostRecentDate) {

    public SignalData toModel() {
        return SignalData.builder()
                .count(count == null ? 0L : count)
                .seriousCount(seriousCount == null ? 0L : seriousCount)
                .seriousness(seriousness)
                .dates(dates)
                .outcomes(outcomes)
                .sources(sources)
                .sourceConfidence(sourceConfidence)
                .sourceStrength(sourceStrength)
                .sourceTypes(sourceTypes)
                .severity(severity)
                .burstScore(burstScore)
                .mechanismScore(mechanismScore)
                .mostRecentDate(mostRecentDate)
                .build();
    }
}
