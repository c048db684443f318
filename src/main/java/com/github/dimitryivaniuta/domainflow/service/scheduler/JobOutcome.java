package com.github.dimitryivaniuta.domainflow.service.scheduler;

/**
 * What a handler asks the scheduler to do with the job after one execution.
 */
public enum JobOutcome {
    /** Campaign finished; job completes. */
    COMPLETED,
    /** More work ready; requeue immediately without consuming an attempt. */
    CONTINUE,
    /** Nothing to do yet (source idle or campaign rate limit reached); requeue after the predecessor poll delay. */
    WAIT,
    /** Campaign is not runnable (paused, cancelled, degraded); job completes without work. */
    ABANDONED,
    /** Handler already failed the campaign; job fails without retry. */
    FAILED
}
