package com.phiguard.interfaces.api;

import com.phiguard.application.RotationOrchestrator;
import com.phiguard.config.PhiGuardProperties;
import com.phiguard.domain.model.RotationJob;
import com.phiguard.interfaces.api.dto.BatchResultResponse;
import com.phiguard.interfaces.api.dto.ErrorResponse;
import com.phiguard.interfaces.api.dto.RotationJobResponse;
import com.phiguard.interfaces.api.dto.StartRotationRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Operator control surface for key rotation jobs.
 *
 * Authentication and authorization are enforced in front of this service.
 *
 * @author Security Team
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1/rotations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Rotations", description = "Key rotation job control")
public class RotationController {

    private final RotationOrchestrator orchestrator;
    private final PhiGuardProperties properties;

    @PostMapping(
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Start key rotation",
        description = "Promotes the new key to write-current and creates a pending re-encryption job"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Rotation job created",
            content = @Content(schema = @Schema(implementation = RotationJobResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid version or weak key",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Another rotation is active",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<RotationJobResponse> start(@Valid @RequestBody StartRotationRequest request) {
        boolean abortOnFirstFailure = request.getAbortOnFirstFailure() != null
            ? request.getAbortOnFirstFailure()
            : properties.getRotation().isAbortOnFirstFailure();

        RotationJob job = orchestrator.start(request.getNewVersion(), abortOnFirstFailure, request.getRequestedBy());

        log.info("Rotation {} requested by {}", job.getId(), request.getRequestedBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(RotationJobResponse.from(job));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List rotation jobs", description = "All jobs, newest first")
    public List<RotationJobResponse> list() {
        return orchestrator.list().stream().map(RotationJobResponse::from).toList();
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get rotation job", description = "Status and checkpoint of one job")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Job found"),
        @ApiResponse(
            responseCode = "404",
            description = "Job not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public RotationJobResponse status(@PathVariable UUID id) {
        return RotationJobResponse.from(orchestrator.status(id));
    }

    @PostMapping(value = "/{id}/step", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Process one batch", description = "Re-encrypts the next batch after the checkpoint")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Batch committed"),
        @ApiResponse(
            responseCode = "409",
            description = "Job not steppable or lease held elsewhere",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public BatchResultResponse step(
            @PathVariable UUID id,
            @RequestParam(required = false) Integer batchSize) {

        int size = batchSize != null ? batchSize : properties.getRotation().getBatchSize();
        return BatchResultResponse.from(orchestrator.step(id, size));
    }

    @PostMapping(value = "/{id}/pause", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Pause rotation job")
    public RotationJobResponse pause(@PathVariable UUID id) {
        return RotationJobResponse.from(orchestrator.pause(id));
    }

    @PostMapping(value = "/{id}/resume", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Resume rotation job")
    public RotationJobResponse resume(@PathVariable UUID id) {
        return RotationJobResponse.from(orchestrator.resume(id));
    }

    @PostMapping(value = "/{id}/complete", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Complete rotation job",
        description = "Requires a fully scanned dataset; leftover or failed rows need acceptPartial=true"
    )
    public RotationJobResponse complete(
            @PathVariable UUID id,
            @RequestParam(defaultValue = "false") boolean acceptPartial) {

        return RotationJobResponse.from(orchestrator.complete(id, acceptPartial));
    }

    @PostMapping(value = "/{id}/rollback", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Roll back rotation job", description = "Reinstates the source key as write-current")
    public RotationJobResponse rollback(
            @PathVariable UUID id,
            @RequestParam(required = false) String reason) {

        return RotationJobResponse.from(orchestrator.rollback(id, reason));
    }

    @PostMapping(value = "/{id}/abort", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Abort rotation job")
    public RotationJobResponse abort(@PathVariable UUID id) {
        return RotationJobResponse.from(orchestrator.abort(id));
    }
}
