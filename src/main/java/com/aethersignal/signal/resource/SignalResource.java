/* (C)2026 */
package com.aethersignal.signal.resource;

import com.aethersignal.signal.dto.BatchFusionRequestDTO;
import com.aethersignal.signal.dto.DetectRequestDTO;
import com.aethersignal.signal.dto.DisproportionalityRequestDTO;
import com.aethersignal.signal.dto.DisproportionalityResponseDTO;
import com.aethersignal.signal.dto.FusionRequestDTO;
import com.aethersignal.signal.dto.FusionResultDTO;
import com.aethersignal.signal.dto.QueryRequestDTO;
import com.aethersignal.signal.dto.RankedSignalDTO;
import com.aethersignal.signal.dto.UnifiedSignalResponseDTO;
import com.aethersignal.signal.model.CompleteFusionResult;
import com.aethersignal.signal.model.DisproportionalityResult;
import com.aethersignal.signal.model.RankedSignal;
import com.aethersignal.signal.model.SignalEvidence;
import com.aethersignal.signal.model.UnifiedSignalResult;
import com.aethersignal.signal.properties.ApiProperties;
import com.aethersignal.signal.service.CompleteFusionEngine;
import com.aethersignal.signal.service.DisproportionalityAnalyzer;
import com.aethersignal.signal.service.QueryRouter;
import com.aethersignal.signal.service.UnifiedSignalDetector;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.enums.SchemaType;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for drug-event signal detection.
 *
 * <p>Request bodies are validated at the boundary and turned into explicit evidence
 * records before they reach the engines. Structurally invalid input is answered with
 * 400; a batch or query never fails because one pair is pathological.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Signal API", description = "Pharmacovigilance signal detection and fusion")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SignalResource {

    private static final Logger LOG = Logger.getLogger(SignalResource.class);

    @Inject
    DisproportionalityAnalyzer disproportionalityAnalyzer;

    @Inject
    UnifiedSignalDetector unifiedSignalDetector;

    @Inject
    CompleteFusionEngine fusionEngine;

    @Inject
    QueryRouter queryRouter;

    @POST
    @Path(ApiProperties.Signals.DISPROPORTIONALITY)
    @Operation(
            summary = "Disproportionality analysis",
            description = "Calculates PRR, ROR and IC with confidence bounds, chi-square and, for small counts, Fisher's exact test")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Statistics calculated",
                content = @Content(schema = @Schema(implementation = DisproportionalityResponseDTO.class))),
        @APIResponse(responseCode = "400", description = "Missing or negative counts")
    })
    public Response disproportionality(@NotNull @Valid DisproportionalityRequestDTO request) {
        LOG.debugf("Disproportionality request for %s/%s", request.drug(), request.event());

        DisproportionalityResult result =
                disproportionalityAnalyzer.analyze(request.drug(), request.event(), request.table().toModel());
        return Response.ok(DisproportionalityResponseDTO.from(result)).build();
    }

    @POST
    @Path(ApiProperties.Signals.DETECT)
    @Operation(
            summary = "Unified signal detection",
            description = "Combines classical, Bayesian, causality and temporal evidence into a composite score")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Detection completed",
                content = @Content(schema = @Schema(implementation = UnifiedSignalResponseDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid evidence")
    })
    public Response detect(@NotNull @Valid DetectRequestDTO request) {
        LOG.debugf("Unified detection request for %s/%s", request.drug(), request.event());

        UnifiedSignalResult result = unifiedSignalDetector.detectSignal(request.toModel());
        return Response.ok(UnifiedSignalResponseDTO.from(result)).build();
    }

    @POST
    @Path(ApiProperties.Signals.FUSION)
    @Operation(
            summary = "Three-layer fusion",
            description = "Fuses the classical layer with the single-source and multi-source quantum layers and classifies an alert level")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Fusion completed",
                content = @Content(schema = @Schema(implementation = FusionResultDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid evidence")
    })
    public Response fusion(@NotNull @Valid FusionRequestDTO request) {
        LOG.debugf("Fusion request for %s/%s", request.drug(), request.event());

        CompleteFusionResult result = fusionEngine.detectSignal(request.toModel());
        return Response.ok(FusionResultDTO.from(result)).build();
    }

    @POST
    @Path(ApiProperties.Signals.FUSION_BATCH)
    @Operation(
            summary = "Batch fusion",
            description = "Fuses every pair of the batch and ranks them by fusion score; pairs that fail are dropped")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Ranked fusion results",
                content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = FusionResultDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid evidence")
    })
    public Response fusionBatch(@NotNull @Valid BatchFusionRequestDTO request) {
        List<SignalEvidence> batch = new ArrayList<>(request.items().size());
        for (FusionRequestDTO item : request.items()) {
            batch.add(item.toModel());
        }

        List<CompleteFusionResult> results = fusionEngine.detectSignalsBatch(batch);
        List<FusionResultDTO> response = new ArrayList<>(results.size());
        for (CompleteFusionResult result : results) {
            response.add(FusionResultDTO.from(result));
        }
        LOG.infof("Batch fusion ranked %d of %d pairs", response.size(), batch.size());
        return Response.ok(response).build();
    }

    @POST
    @Path(ApiProperties.Signals.QUERY)
    @Operation(
            summary = "Ranked signal query",
            description = "Normalizes reaction terms, gathers evidence for each drug-event candidate and returns signals ranked by fusion score")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Ranked signals, possibly empty",
                content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = RankedSignalDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid query")
    })
    public Response query(@NotNull @Valid QueryRequestDTO request) {
        List<RankedSignal> signals = queryRouter.runQuery(request.toModel());

        List<RankedSignalDTO> response = new ArrayList<>(signals.size());
        for (RankedSignal signal : signals) {
            response.add(RankedSignalDTO.from(signal));
        }
        return Response.ok(response).build();
    }
}
