/* (C)2026 */
package com.aethersignal.signal.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Batch of fusion evidence, ranked together")
public record BatchFusionRequestDTO(
        @Schema(description = "Evidence per pair") @NotEmpty List<@Valid FusionRequestDTO> items) {}
