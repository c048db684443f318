package com.github.dimitryivaniuta.domainflow.service.progress;

import java.time.Duration;
import java.time.Instant;

/**
 * Derived progress figures.
 */
public final class ProgressMath {

    private ProgressMath() {
    }

    public static double percentage(long processed, long total) {
        if (total <= 0) {
            return 0.0d;
        }
        return Math.min(100.0d, processed * 100.0d / total);
    }

    /**
     * Exponentially weighted moving average.
     *
     * @param previous previous average, null for the first sample
     * @param sample   newest sample
     * @param alpha    weight of the newest sample, 0..1
     * @return new average
     */
    public static double ewma(Double previous, double sample, double alpha) {
        if (previous == null) {
            return sample;
        }
        double a = Math.max(0.0d, Math.min(1.0d, alpha));
        return a * sample + (1.0d - a) * previous;
    }

    /**
     * Items per second over {@code elapsed}; null when the interval is empty.
     */
    public static Double rate(long items, Duration elapsed) {
        long millis = elapsed.toMillis();
        if (items <= 0 || millis <= 0) {
            return null;
        }
        return items * 1000.0d / millis;
    }

    /**
     * Extrapolated completion time, null when there is no usable rate.
     */
    public static Instant eta(Instant now, long remaining, Double ratePerSecond) {
        if (remaining <= 0) {
            return now;
        }
        if (ratePerSecond == null || ratePerSecond <= 0.0d) {
            return null;
        }
        long millis = (long) Math.ceil(remaining * 1000.0d / ratePerSecond);
        return now.plusMillis(millis);
    }
}
