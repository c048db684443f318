package com.github.dimitryivaniuta.domainflow.service.scheduler;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Worker threads of this process. Each thread polls the shared scheduler independently; several
 * processes can run against the same database.
 */
@Component
public class CampaignWorkerPool implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CampaignWorkerPool.class);

    private final JobExecutor executor;
    private final AppProperties.Worker settings;
    private final String instanceId;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<Thread> threads = new ArrayList<>();

    public CampaignWorkerPool(JobExecutor executor, AppProperties properties) {
        this.executor = executor;
        this.settings = properties.getWorker();
        this.instanceId = settings.getInstanceId() == null || settings.getInstanceId().isBlank()
                ? UUID.randomUUID().toString().substring(0, 8)
                : settings.getInstanceId();
    }

    @Override
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (int i = 1; i <= settings.getCount(); i++) {
            String workerId = instanceId + "-" + i;
            Thread t = new Thread(() -> pollLoop(workerId), "campaign-worker-" + i);
            t.setDaemon(true);
            t.start();
            threads.add(t);
        }
        log.info("Started {} campaign workers for instance {}", settings.getCount(), instanceId);
    }

    void pollLoop(String workerId) {
        while (running.get()) {
            boolean worked;
            try {
                worked = executor.runOnce(workerId);
            } catch (RuntimeException e) {
                log.error("Worker {} failed to poll the job queue", workerId, e);
                worked = false;
            }
            if (!worked) {
                try {
                    Thread.sleep(settings.getPollInterval().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.debug("Worker {} stopped", workerId);
    }

    @Override
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        for (Thread t : threads) {
            t.interrupt();
        }
        for (Thread t : threads) {
            try {
                t.join(settings.getPollInterval().toMillis() + 5_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        threads.clear();
        log.info("Stopped campaign workers for instance {}", instanceId);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return settings.isAutoStart();
    }

    public String getInstanceId() {
        return instanceId;
    }
}
