package com.github.dimitryivaniuta.domainflow;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Application entry point for the DomainFlow campaign orchestration engine.
 *
 * <p>Scheduling drives the lease reaper, the stage-linkage sweep, the resource health prober and
 * the outbox dispatcher. Campaign work itself runs on the worker threads started by
 * {@link com.github.dimitryivaniuta.domainflow.service.scheduler.CampaignWorkerPool}.</p>
 */
@SpringBootApplication
@EnableScheduling
@EnableCaching
@EnableConfigurationProperties(AppProperties.class)
public class DomainFlowApplication {

    /**
     * Bootstraps the Spring Boot application.
     *
     * @param args CLI args
     */
    public static void main(String[] args) {
        SpringApplication.run(DomainFlowApplication.class, args);
    }
}
