package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-campaign throttles for {@code processingSpeedPerMinute}. A limiter outlives single batches so
 * the rate holds across consecutive jobs of the same campaign on this instance.
 */
@Component
public class CampaignRateLimiters {

    private static final Logger log = LoggerFactory.getLogger(CampaignRateLimiters.class);

    private final Map<String, RateLimiter> limiters = new ConcurrentHashMap<>();
    private final Duration maxWait;

    public CampaignRateLimiters(AppProperties properties) {
        this.maxWait = properties.getValidation().getRateLimitMaxWait();
    }

    /**
     * Limiter for a campaign, empty when {@code perMinute} is zero (unlimited).
     */
    public Optional<RateLimiter> forCampaign(String campaignId, int perMinute) {
        if (perMinute <= 0) {
            limiters.remove(campaignId);
            return Optional.empty();
        }
        return Optional.of(limiters.compute(campaignId, (id, existing) -> {
            if (existing != null && existing.getRateLimiterConfig().getLimitForPeriod() == perMinute) {
                return existing;
            }
            log.info("Rate limiting campaign {} to {} checks/min", id, perMinute);
            return RateLimiter.of("campaign-" + id, RateLimiterConfig.custom()
                    .limitRefreshPeriod(Duration.ofMinutes(1))
                    .limitForPeriod(perMinute)
                    .timeoutDuration(maxWait)
                    .build());
        }));
    }

    /**
     * Drops the limiter of a campaign that will not run again.
     */
    public void release(String campaignId) {
        limiters.remove(campaignId);
    }
}
