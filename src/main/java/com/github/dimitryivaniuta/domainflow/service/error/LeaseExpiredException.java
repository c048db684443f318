package com.github.dimitryivaniuta.domainflow.service.error;

/**
 * The worker no longer holds the lease on the job it tried to finish or renew.
 */
public class LeaseExpiredException extends RuntimeException {

    public LeaseExpiredException(String jobId, String workerId) {
        super("Lease on job " + jobId + " is no longer held by " + workerId);
    }
}
