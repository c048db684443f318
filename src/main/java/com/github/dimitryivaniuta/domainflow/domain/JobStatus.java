package com.github.dimitryivaniuta.domainflow.domain;

/**
 * Campaign job status.
 *
 * <p>{@code PENDING -> LOCKED -> RUNNING -> {COMPLETED, FAILED, RETRY_PENDING -> PENDING}}.
 * Kept as VARCHAR in the DB and enforced in code.</p>
 */
public enum JobStatus {
    /** Claimable once {@code nextExecutionAt} has passed. */
    PENDING,
    /** Claimed by a worker, not yet started. */
    LOCKED,
    /** Executing under a lease. */
    RUNNING,
    /** Finished; the campaign needs no more work from this job. */
    COMPLETED,
    /** Permanently failed after {@code maxAttempts}. */
    FAILED,
    /** Failed attempt waiting for its backoff to elapse. */
    RETRY_PENDING
}
