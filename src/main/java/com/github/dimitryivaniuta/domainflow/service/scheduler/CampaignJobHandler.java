package com.github.dimitryivaniuta.domainflow.service.scheduler;

import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.JobType;

/**
 * Executes one batch of work for a campaign job.
 *
 * <p>Per-item failures are handled inside; an exception escaping {@link #execute} is treated as a
 * job-level crash and consumes an attempt.</p>
 */
public interface CampaignJobHandler {

    JobType jobType();

    /**
     * Processes one batch.
     *
     * @param job   claimed job, status RUNNING
     * @param lease lease handle for renewal during long batches
     * @return outcome
     */
    JobOutcome execute(CampaignJob job, JobLease lease);
}
