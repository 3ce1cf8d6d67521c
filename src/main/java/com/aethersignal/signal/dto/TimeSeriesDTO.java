/* (C)2026 */
package com.aethersignal.signal.dto;

import com.aethersignal.signal.model.TimeSeriesData;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Report counts per time bucket")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeSeriesDTO(
        @Schema(description = "Bucket dates (ISO-8601)") @NotNull List<LocalDate> dates,
        @Schema(description = "Report count per bucket, same length as dates") @NotNull List<Integer> counts) {

    public TimeSeriesData toModel() {
        return new TimeSeriesData(dates, counts);
    }
}
