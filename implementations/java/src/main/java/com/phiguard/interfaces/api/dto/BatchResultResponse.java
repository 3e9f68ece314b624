package com.phiguard.interfaces.api.dto;

import com.phiguard.application.BatchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResultResponse {

    private UUID jobId;
    private String status;
    private long scanned;
    private long migrated;
    private long skipped;
    private long failed;
    private Long cursor;
    private boolean exhausted;
    private List<Long> failedRowIds;

    public static BatchResultResponse from(BatchResult result) {
        return BatchResultResponse.builder()
            .jobId(result.jobId())
            .status(result.status().name())
            .scanned(result.batch().scanned())
            .migrated(result.batch().migrated())
            .skipped(result.batch().skipped())
            .failed(result.batch().failed())
            .cursor(result.cursor())
            .exhausted(result.exhausted())
            .failedRowIds(result.failedRowIds())
            .build();
    }
}
