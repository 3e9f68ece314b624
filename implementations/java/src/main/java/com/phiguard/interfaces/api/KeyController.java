package com.phiguard.interfaces.api;

import com.phiguard.application.KeyManagementService;
import com.phiguard.interfaces.api.dto.ErrorResponse;
import com.phiguard.interfaces.api.dto.KeyVersionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/keys")
@RequiredArgsConstructor
@Tag(name = "Keys", description = "Key version lifecycle")
public class KeyController {

    private final KeyManagementService keyManagement;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List key versions", description = "Labels, roles and activation times")
    public List<KeyVersionResponse> list() {
        return keyManagement.versions().stream().map(KeyVersionResponse::from).toList();
    }

    @PostMapping(value = "/{label}/retire", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Retire key version", description = "Drops the key once no row or active job needs it")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Key retired"),
        @ApiResponse(
            responseCode = "404",
            description = "Unknown key version",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Key still in use",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public KeyVersionResponse retire(
            @PathVariable String label,
            @RequestParam(defaultValue = "operator") String requestedBy) {

        return KeyVersionResponse.from(keyManagement.retire(label, requestedBy));
    }
}
