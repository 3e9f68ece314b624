package com.phiguard.interfaces.api.dto;

import com.phiguard.domain.model.KeyVersion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Key version metadata. Never carries key material.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyVersionResponse {

    private String label;
    private String role;
    private Instant activatedAt;

    public static KeyVersionResponse from(KeyVersion key) {
        return KeyVersionResponse.builder()
            .label(key.getLabel())
            .role(key.getRole().name())
            .activatedAt(key.getActivatedAt())
            .build();
    }
}
