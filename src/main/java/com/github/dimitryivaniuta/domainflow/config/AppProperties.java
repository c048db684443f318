package com.github.dimitryivaniuta.domainflow.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 *
 * <p>All tunables of the orchestration engine live here instead of being sprinkled across the
 * codebase as {@code @Value} lookups.</p>
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private final Worker worker = new Worker();
    private final Scheduler scheduler = new Scheduler();
    private final Generation generation = new Generation();
    private final Pool pool = new Pool();
    private final Validation validation = new Validation();
    private final Outbox outbox = new Outbox();
    private final Cache cache = new Cache();

    @Getter
    @Setter
    public static class Worker {
        /**
         * Number of worker threads polling the job scheduler in this instance.
         */
        private int count = 4;

        /**
         * Sleep between polls when no job could be claimed.
         */
        private Duration pollInterval = Duration.ofSeconds(1);

        /**
         * Identifier of this process; worker threads append their index.
         * Defaults to a random value when blank.
         */
        private String instanceId = "";

        /**
         * Whether the worker threads are started with the application context.
         */
        private boolean autoStart = true;
    }

    @Getter
    @Setter
    public static class Scheduler {
        /**
         * Fixed delay between lease-expiry sweeps in milliseconds.
         */
        private long leaseSweepIntervalMs = 15_000L;

        /**
         * Fixed delay between predecessor-linkage sweeps in milliseconds.
         */
        private long linkageSweepIntervalMs = 5_000L;

        /**
         * Base delay for retry backoff: {@code base * 2^attempts}.
         */
        private Duration baseBackoff = Duration.ofSeconds(2);

        /**
         * Backoff cap.
         */
        private Duration maxBackoff = Duration.ofMinutes(5);

        private int defaultMaxAttempts = 3;

        /**
         * Lease duration; a job locked longer than this is treated as a crashed worker.
         */
        private int defaultTimeoutSeconds = 600;

        /**
         * Priority in the range 1..10; higher runs first.
         */
        private int defaultPriority = 5;

        /**
         * Requeue delay for a validation job whose predecessor has produced no new rows yet.
         */
        private Duration predecessorPollDelay = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Generation {
        private int defaultBatchSize = 1000;

        /**
         * Attempts to write one reserved range before the campaign is failed.
         */
        private int maxWriteAttempts = 3;

        /**
         * Compare-and-swap retries for a single range reservation under contention.
         */
        private int maxCursorCasRetries = 50;

        /**
         * Smoothing factor for the rolling generation rate (0..1, weight of the newest sample).
         */
        private double rateSmoothing = 0.3;
    }

    @Getter
    @Setter
    public static class Pool {
        /**
         * Consecutive failures after which a resource's circuit opens.
         */
        private int circuitFailureThreshold = 5;

        /**
         * Minimum time between health probes of an open-circuit resource.
         */
        private Duration probeInterval = Duration.ofMinutes(1);

        private long probeSweepIntervalMs = 30_000L;

        /**
         * URL fetched through a proxy to probe it.
         */
        private String probeUrl = "https://www.example.com/";

        /**
         * Domain resolved through a DNS persona to probe it.
         */
        private String probeDomain = "example.com";

        private Duration probeTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Validation {
        /**
         * Upper bound on response bytes read per HTTP check.
         */
        private int maxBodyBytes = 5 * 1024 * 1024;

        private int contentSnippetLength = 256;

        private String defaultUserAgent = "DomainFlowHTTPValidator/1.0";

        private boolean allowInsecureTls = false;

        /**
         * Threads shared by the check lanes of all validation batches in this instance.
         */
        private int executorThreads = 32;

        private int executorQueueCapacity = 1000;

        /**
         * How long a check lane waits for a permit of its campaign's rate limiter before the batch
         * is cut short.
         */
        private Duration rateLimitMaxWait = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class Outbox {
        /**
         * Kafka topic for campaign progress and status events.
         */
        private String campaignEventsTopic = "campaign-events";

        /**
         * Max number of events per batch.
         */
        private int batchSize = 100;

        /**
         * Fixed delay between publisher runs in milliseconds.
         */
        private long publishIntervalMs = 1000L;

        /**
         * Kafka send acknowledgment timeout.
         */
        private Duration sendTimeout = Duration.ofSeconds(5);

        /**
         * Max number of send attempts before moving to DEAD.
         */
        private int maxAttempts = 10;

        /**
         * Base backoff used for retries (exponential).
         */
        private Duration baseBackoff = Duration.ofSeconds(1);

        /**
         * Maximum backoff cap.
         */
        private Duration maxBackoff = Duration.ofMinutes(2);
    }

    @Getter
    @Setter
    public static class Cache {
        /**
         * Enables the Redis-backed snapshot cache.
         */
        private boolean enabled = true;

        private Duration snapshotTtl = Duration.ofMinutes(10);
    }
}
