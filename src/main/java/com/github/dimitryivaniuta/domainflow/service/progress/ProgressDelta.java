package com.github.dimitryivaniuta.domainflow.service.progress;

import java.time.Duration;

/**
 * Counter changes from one committed batch.
 *
 * @param totalItems  new lower bound for {@code total_items}; the total never shrinks while running
 * @param processed   items processed in the batch
 * @param successful  of which succeeded
 * @param failed      of which failed
 * @param elapsed     wall time of the batch, for the rate estimate
 */
public record ProgressDelta(long totalItems, long processed, long successful, long failed, Duration elapsed) {

    public ProgressDelta {
        if (processed < 0 || successful < 0 || failed < 0 || totalItems < 0) {
            throw new IllegalArgumentException("Progress deltas must not be negative");
        }
        if (successful + failed > processed) {
            throw new IllegalArgumentException("successful + failed exceeds processed in batch");
        }
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
    }
}
