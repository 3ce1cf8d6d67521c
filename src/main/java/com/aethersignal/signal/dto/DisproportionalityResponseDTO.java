/* (C)2026 */
package com.aethersignal.signal.dto;

import static com.aethersignal.signal.util.NumericSanitizer.sanitize;

import com.aethersignal.signal.model.DisproportionalityResult;
import com.aethersignal.signal.model.InformationComponent;
import com.aethersignal.signal.model.RatioEstimate;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Classical disproportionality statistics. Undefined ratios are reported as 0 with
 * {@code defined=false}; non-finite values are replaced by the sentinel -1.
 */
@Schema(description = "PRR, ROR and IC with confidence bounds")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DisproportionalityResponseDTO(
        @Schema(description = "Drug name") String drug,
        @Schema(description = "Adverse event term") String event,
        @Schema(description = "Contingency table") ContingencyTableDTO table,
        @Schema(description = "Count expected under independence") Double expectedCount,
        @Schema(description = "Proportional reporting ratio") RatioDTO prr,
        @Schema(description = "Reporting odds ratio") RatioDTO ror,
        @Schema(description = "Information component (log2 observed/expected)") RatioDTO ic,
        @Schema(description = "Yates-corrected chi-square statistic") Double chiSquare,
        @Schema(description = "Chi-square p-value (1 d.o.f.)") Double chiSquarePValue,
        @Schema(description = "Two-tailed Fisher exact p-value, for small counts only") Double fisherPValue,
        @Schema(description = "Whether any method flagged the pair") Boolean signal,
        @Schema(description = "Methods that flagged the pair") List<String> flaggedMethods) {

    @Schema(description = "Point estimate with 95% bounds")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RatioDTO(
            @Schema(description = "Point estimate") Double value,
            @Schema(description = "Lower 95% bound") Double lower,
            @Schema(description = "Upper 95% bound") Double upper,
            @Schema(description = "Meets the signal rule") Boolean signal,
            @Schema(description = "False when a zero cell makes the statistic undefined") Boolean defined) {

        static RatioDTO from(RatioEstimate estimate) {
            return new RatioDTO(
                    sanitize(estimate.value()),
                    sanitize(estimate.ciLower()),
                    sanitize(estimate.ciUpper()),
                    estimate.signal(),
                    estimate.defined());
        }

        static RatioDTO from(InformationComponent ic) {
            return new RatioDTO(
                    sanitize(ic.ic()), sanitize(ic.ic025()), sanitize(ic.ic975()), ic.signal(), ic.defined());
        }
    }

    public static DisproportionalityResponseDTO from(DisproportionalityResult result) {
        if (result == null) {
            return null;
        }
        return new DisproportionalityResponseDTO(
                result.drug(),
                result.event(),
                ContingencyTableDTO.from(result.table()),
                sanitize(result.expectedCount()),
                RatioDTO.from(result.prr()),
                RatioDTO.from(result.ror()),
                RatioDTO.from(result.ic()),
                sanitize(result.chiSquare()),
                sanitize(result.chiSquarePValue()),
                sanitize(result.fisherPValue()),
                result.isSignal(),
                result.flaggedMethods());
    }
}
