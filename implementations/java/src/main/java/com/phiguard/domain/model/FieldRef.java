package com.phiguard.domain.model;

import java.util.Objects;

/**
 * Identifies one protected field: {@code resourceType/resourceId#fieldName}.
 */
public record FieldRef(String resourceType, String resourceId, String fieldName) {

    public FieldRef {
        Objects.requireNonNull(resourceType, "Resource type must not be null");
        Objects.requireNonNull(resourceId, "Resource ID must not be null");
        Objects.requireNonNull(fieldName, "Field name must not be null");
    }

    @Override
    public String toString() {
        return resourceType + "/" + resourceId + "#" + fieldName;
    }
}
