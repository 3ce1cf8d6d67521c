/* (C)2026 */
package com.aethersignal.signal.dto;

import com.aethersignal.signal.model.PairObservation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Unified detection request: the contingency table plus optional clinical and temporal
 * evidence.
 */
@Schema(description = "Unified signal detection request")
public record DetectRequestDTO(
        @Schema(description = "Drug name") @NotBlank String drug,
        @Schema(description = "Adverse event term") @NotBlank String event,
        @Schema(description = "Contingency table") @NotNull @Valid ContingencyTableDTO table,
        @Schema(description = "Clinical evidence for causality assessment") ClinicalFeaturesDTO clinicalFeatures,
        @Schema(description = "Reporting time series") @Valid TimeSeriesDTO timeSeries,
        @Schema(description = "Date of the first report of the pair") LocalDate firstReportDate,
        @Schema(description = "Per-case time to onset in days") List<Integer> latencies) {

    public PairObservation toModel() {
        return new PairObservation(
                drug,
                event,
                table.toModel(),
                clinicalFeatures == null ? null : clinicalFeatures.toModel(),
                timeSeries == null ? null : timeSeries.toModel(),
                firstReportDate,
                latencies);
    }
}
