package com.github.dimitryivaniuta.domainflow.web.dto;

import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import java.time.Instant;

public record JobResponse(
        String jobId,
        String jobType,
        String status,
        int attempts,
        int maxAttempts,
        String lockedBy,
        Instant nextExecutionAt,
        String lastError
) {
    public static JobResponse from(CampaignJob j) {
        return new JobResponse(j.getId(), j.getJobType().name(), j.getStatus().name(), j.getAttempts(),
                j.getMaxAttempts(), j.getLockedBy(), j.getNextExecutionAt(), j.getLastError());
    }
}
