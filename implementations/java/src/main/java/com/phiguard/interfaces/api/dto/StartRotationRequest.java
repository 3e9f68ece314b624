package com.phiguard.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for starting a key rotation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartRotationRequest {

    /**
     * Target key version; the next version label when omitted.
     */
    @Pattern(regexp = "^v[0-9]{1,9}$", message = "Version must look like v2")
    private String newVersion;

    /**
     * Stop and fail the job at the first row that cannot be re-encrypted.
     * Configured default when omitted.
     */
    private Boolean abortOnFirstFailure;

    @NotBlank(message = "Requester is required")
    @Size(max = 128, message = "Requester must not exceed 128 characters")
    private String requestedBy;
}
