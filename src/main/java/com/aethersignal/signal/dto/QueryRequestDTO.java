/* (C)2026 */
package com.aethersignal.signal.dto;

import com.aethersignal.signal.model.SignalQuerySpec;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Structured signal query")
public record QueryRequestDTO(
        @Schema(description = "Task type", example = "rank_signals") String task,
        @Schema(description = "Drug names") @NotEmpty List<String> drugs,
        @Schema(description = "Reaction terms, normalized before lookup") @NotEmpty List<String> reactions,
        @Schema(description = "Only count serious cases") Boolean seriousnessOnly,
        @Schema(description = "Minimum patient age in years") Integer ageMin,
        @Schema(description = "Maximum patient age in years") Integer ageMax,
        @Schema(description = "Region codes") List<String> regionCodes,
        @Schema(description = "LAST_3_MONTHS, LAST_6_MONTHS, LAST_12_MONTHS, LAST_<n>_DAYS, SINCE_<yyyy> or an ISO date")
                String timeWindow,
        @Schema(description = "Maximum results; server default when omitted") Integer limit,
        @Schema(description = "Original user query, for traceability") String rawText) {

    public SignalQuerySpec toModel() {
        return new SignalQuerySpec(
                task,
                drugs,
                reactions,
                Boolean.TRUE.equals(seriousnessOnly),
                ageMin,
                ageMax,
                regionCodes,
                timeWindow,
                limit == null ? 0 : limit,
                rawText);
    }
}
