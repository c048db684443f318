package com.github.dimitryivaniuta.domainflow.service.scheduler;

/**
 * A worker's hold on a job.
 *
 * @param jobId     job id
 * @param workerId  lock holder
 * @param scheduler scheduler that granted the lease
 */
public record JobLease(String jobId, String workerId, JobScheduler scheduler) {

    /**
     * Refreshes {@code locked_at}.
     *
     * @throws com.github.dimitryivaniuta.domainflow.service.error.LeaseExpiredException when the lease was reclaimed
     */
    public void renew() {
        scheduler.renewLease(jobId, workerId);
    }
}
