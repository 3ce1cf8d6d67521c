/* (C)2026 */
package com.aethersignal.signal.dto;

import com.aethersignal.signal.model.SignalEvidence;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.LocalDate;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Evidence for one drug-event pair. Only drug, event, signal data and total cases are
 * required; each optional block enables the analyses that need it.
 */
@Schema(description = "Fusion evidence for one drug-event pair")
public record FusionRequestDTO(
        @Schema(description = "Drug name") @NotBlank String drug,
        @Schema(description = "Adverse event term") @NotBlank String event,
        @Schema(description = "Aggregated case data") @NotNull @Valid SignalDataDTO signalData,
        @Schema(description = "Size of the case population") @NotNull @Positive Long totalCases,
        @Schema(description = "Contingency table; enables the classical layer") @Valid ContingencyTableDTO contingencyTable,
        @Schema(description = "Clinical evidence") ClinicalFeaturesDTO clinicalFeatures,
        @Schema(description = "Reporting time series") @Valid TimeSeriesDTO timeSeries,
        @Schema(description = "Date of the first report of the pair") LocalDate firstReportDate,
        @Schema(description = "Per-case time to onset in days") List<Integer> latencies,
        @Schema(description = "Sources available to the query; enables Layer 2") List<String> sources,
        @Schema(description = "Reactions listed on the product label") List<String> labelReactions) {

    public SignalEvidence toModel() {
        return SignalEvidence.builder(drug, event)
                .signalData(signalData.toModel())
                .totalCases(totalCases)
                .contingencyTable(contingencyTable == null ? null : contingencyTable.toModel())
                .clinicalFeatures(clinicalFeatures == null ? null : clinicalFeatures.toModel())
                .timeSeries(timeSeries == null ? null : timeSeries.toModel())
                .firstReportDate(firstReportDate)
                .latencies(latencies)
                .sources(sources)
                .labelReactions(labelReactions)
                .build();
    }
}
