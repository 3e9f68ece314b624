package com.phiguard.application;

/**
 * A single row could not be migrated. Carries the row id only.
 */
public class RotationRowException extends RuntimeException {

    private final Long rowId;

    public RotationRowException(Long rowId, Throwable cause) {
        super("Row " + rowId + " could not be re-encrypted: " + cause.getMessage(), cause);
        this.rowId = rowId;
    }

    public Long getRowId() {
        return rowId;
    }
}
