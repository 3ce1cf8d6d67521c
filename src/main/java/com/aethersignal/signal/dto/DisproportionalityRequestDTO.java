/* (C)2026 */
package com.aethersignal.signal.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Disproportionality analysis request")
public record DisproportionalityRequestDTO(
        @Schema(description = "Drug name", example = "warfarin") @NotBlank String drug,
        @Schema(description = "Adverse event term", example = "Haemorrhage") @NotBlank String event,
        @Schema(description = "Contingency table") @NotNull @Valid ContingencyTableDTO table) {}
