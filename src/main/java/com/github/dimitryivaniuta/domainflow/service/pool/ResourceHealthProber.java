package com.github.dimitryivaniuta.domainflow.service.pool;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.Persona;
import com.github.dimitryivaniuta.domainflow.domain.PooledResource;
import com.github.dimitryivaniuta.domainflow.domain.Proxy;
import com.github.dimitryivaniuta.domainflow.domain.persona.DnsPersonaConfig;
import com.github.dimitryivaniuta.domainflow.domain.persona.HttpPersonaConfig;
import com.github.dimitryivaniuta.domainflow.service.error.TransportException;
import com.github.dimitryivaniuta.domainflow.service.validation.DnsLookup;
import com.github.dimitryivaniuta.domainflow.service.validation.DnsResolver;
import com.github.dimitryivaniuta.domainflow.service.validation.FetchRequest;
import com.github.dimitryivaniuta.domainflow.service.validation.FetchResult;
import com.github.dimitryivaniuta.domainflow.service.validation.HttpFetcher;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Probes open-circuit personas and proxies once their probe interval has elapsed. A passing probe
 * closes the circuit; a failing one pushes the next probe out by another interval.
 *
 * <p>DNS personas resolve the configured probe domain, HTTP personas and proxies fetch the probe
 * URL. Any answer at all counts as a pass.</p>
 */
@Component
public class ResourceHealthProber {

    private static final Logger log = LoggerFactory.getLogger(ResourceHealthProber.class);

    private final ResourcePoolManager poolManager;
    private final DnsResolver dnsResolver;
    private final HttpFetcher httpFetcher;
    private final AppProperties properties;

    public ResourceHealthProber(ResourcePoolManager poolManager,
                                DnsResolver dnsResolver,
                                HttpFetcher httpFetcher,
                                AppProperties properties) {
        this.poolManager = poolManager;
        this.dnsResolver = dnsResolver;
        this.httpFetcher = httpFetcher;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${app.pool.probe-sweep-interval-ms:30000}")
    public void scheduledProbe() {
        probeDue();
    }

    /**
     * Probes every resource that is due.
     *
     * @return number of probes that passed
     */
    public int probeDue() {
        List<PooledResource> due = poolManager.dueForProbe();
        int passed = 0;
        for (PooledResource resource : due) {
            if (probe(resource)) {
                passed++;
            }
        }
        if (!due.isEmpty()) {
            log.info("Health probes: {} of {} open-circuit resources passed", passed, due.size());
        }
        return passed;
    }

    boolean probe(PooledResource resource) {
        AppProperties.Pool pool = properties.getPool();
        try {
            if (resource instanceof Persona persona && persona.getConfig() instanceof DnsPersonaConfig dns) {
                DnsLookup lookup = dnsResolver.lookup(pool.getProbeDomain(), dns, pool.getProbeTimeout());
                log.debug("DNS probe of persona {} via {}: resolved={}", persona.getId(), lookup.resolver(), lookup.resolved());
            } else if (resource instanceof Persona persona && persona.getConfig() instanceof HttpPersonaConfig http) {
                FetchResult r = httpFetcher.fetch(probeRequest(http.userAgent(), null));
                log.debug("HTTP probe of persona {}: status {}", persona.getId(), r.statusCode());
            } else if (resource instanceof Proxy proxy) {
                FetchResult r = httpFetcher.fetch(probeRequest(null, proxy));
                log.debug("Probe through proxy {}: status {}", proxy.getId(), r.statusCode());
            } else {
                log.warn("No probe for {} {}", resource.kind(), resource.getId());
                return false;
            }
        } catch (TransportException e) {
            poolManager.recordProbe(resource.kind(), resource.getId(), false, e.getMessage());
            log.debug("Probe of {} {} failed: {}", resource.kind(), resource.getId(), e.getMessage());
            return false;
        }
        poolManager.recordProbe(resource.kind(), resource.getId(), true, null);
        return true;
    }

    private FetchRequest probeRequest(String userAgent, Proxy proxy) {
        AppProperties.Pool pool = properties.getPool();
        String ua = userAgent == null || userAgent.isBlank() ? properties.getValidation().getDefaultUserAgent() : userAgent;
        return new FetchRequest(pool.getProbeUrl(), ua, null, pool.getProbeTimeout(), true, 5, proxy, 64 * 1024);
    }
}
