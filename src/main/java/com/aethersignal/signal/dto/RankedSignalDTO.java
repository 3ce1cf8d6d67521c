/* (C)2026 */
package com.aethersignal.signal.dto;

import com.aethersignal.signal.model.RankedSignal;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Query result entry")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RankedSignalDTO(
        @Schema(description = "Fusion result") FusionResultDTO result,
        @Schema(description = "One-line explanation of the score") String explanation) {

    public static RankedSignalDTO from(RankedSignal signal) {
        return new RankedSignalDTO(FusionResultDTO.from(signal.result()), signal.explanation());
    }
}
