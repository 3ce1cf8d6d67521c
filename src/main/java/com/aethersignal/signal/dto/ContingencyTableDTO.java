/* (C)2026 */
package com.aethersignal.signal.dto;

import com.aethersignal.signal.model.ContingencyTable;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "2x2 report counts for one drug-event pair")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContingencyTableDTO(
        @Schema(description = "Reports with the drug and the event") @NotNull @PositiveOrZero Long n11,
        @Schema(description = "Reports with the drug, without the event") @NotNull @PositiveOrZero Long n10,
        @Schema(description = "Reports with the event, without the drug") @NotNull @PositiveOrZero Long n01,
        @Schema(description = "Reports with neither") @NotNull @PositiveOrZero Long n00) {

    public ContingencyTable toModel() {
        return new ContingencyTable(count(n11), count(n10), count(n01), count(n00));
    }

    public static ContingencyTableDTO from(ContingencyTable table) {
        if (table == null) {
            return null;
        }
        return new ContingencyTableDTO(table.n11(), table.n10(), table.n01(), table.n00());
    }

    private static long count(Long value) {
        return value == null ? 0L : value;
    }
}
