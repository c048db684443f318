package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.DnsValidationParams;
import com.github.dimitryivaniuta.domainflow.domain.DnsValidationResult;
import com.github.dimitryivaniuta.domainflow.domain.DnsValidationStatus;
import com.github.dimitryivaniuta.domainflow.domain.JobType;
import com.github.dimitryivaniuta.domainflow.domain.Persona;
import com.github.dimitryivaniuta.domainflow.domain.PersonaType;
import com.github.dimitryivaniuta.domainflow.domain.SystemStatus;
import com.github.dimitryivaniuta.domainflow.domain.persona.DnsPersonaConfig;
import com.github.dimitryivaniuta.domainflow.repo.DnsValidationParamsRepository;
import com.github.dimitryivaniuta.domainflow.repo.DnsValidationResultRepository;
import com.github.dimitryivaniuta.domainflow.service.error.ErrorMessages;
import com.github.dimitryivaniuta.domainflow.service.error.ResourcePoolExhaustedException;
import com.github.dimitryivaniuta.domainflow.service.error.TransportException;
import com.github.dimitryivaniuta.domainflow.service.pool.ResourcePool;
import com.github.dimitryivaniuta.domainflow.service.pool.ResourcePoolManager;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * DNS validation stage: resolves each candidate through the campaign's rotating DNS personas.
 */
@Service
public class DnsValidationService extends AbstractValidationStage<DnsValidationParams, DnsValidationResult> {

    private final DnsValidationParamsRepository paramsRepository;
    private final DnsValidationResultRepository resultRepository;
    private final ResourcePoolManager poolManager;
    private final DnsResolver resolver;
    private final ResultStore<DnsValidationResult> store = new Store();

    public DnsValidationService(StageSupport support,
                                DnsValidationParamsRepository paramsRepository,
                                DnsValidationResultRepository resultRepository,
                                ResourcePoolManager poolManager,
                                DnsResolver resolver) {
        super(support, "domainflow.dns");
        this.paramsRepository = paramsRepository;
        this.resultRepository = resultRepository;
        this.poolManager = poolManager;
        this.resolver = resolver;
    }

    @Override
    public JobType jobType() {
        return JobType.DNS_VALIDATION;
    }

    @Override
    protected Optional<DnsValidationParams> loadParams(String campaignId) {
        return paramsRepository.findById(campaignId);
    }

    @Override
    protected ResultStore<DnsValidationResult> resultStore() {
        return store;
    }

    @Override
    protected void stamp(DnsValidationResult result, int attempts, long durationMs) {
        result.setAttempts(attempts);
        result.setDurationMs(durationMs);
    }

    @Override
    protected BatchRunner<DnsValidationResult> openBatch(Campaign campaign, DnsValidationParams params) {
        ResourcePool<Persona> personas = poolManager.personaPool(params.getPersonaIds(), PersonaType.DNS,
                params.getSelectionStrategy(), params.getRotationIntervalSeconds());
        if (personas.active().isEmpty()) {
            throw new ResourcePoolExhaustedException("No usable " + personas.getLabel() + " for campaign " + campaign.getId());
        }
        return new Runner(campaign.getId(), personas, Duration.ofSeconds(params.getRequestTimeoutSeconds()));
    }

    private final class Runner implements BatchRunner<DnsValidationResult> {

        private final String campaignId;
        private final ResourcePool<Persona> personas;
        private final Duration campaignTimeout;

        Runner(String campaignId, ResourcePool<Persona> personas, Duration campaignTimeout) {
            this.campaignId = campaignId;
            this.personas = personas;
            this.campaignTimeout = campaignTimeout;
        }

        @Override
        public DnsValidationResult attempt(String domain, Set<String> tried) {
            Persona persona = personas.acquire(domain, tried);
            tried.add(persona.getId());
            DnsPersonaConfig config = persona.getConfig() instanceof DnsPersonaConfig d
                    ? d
                    : new DnsPersonaConfig(List.of(), List.of(), 0);
            Duration timeout = config.queryTimeoutSeconds() > 0 ? Duration.ofSeconds(config.queryTimeoutSeconds()) : campaignTimeout;

            DnsLookup lookup;
            try {
                lookup = resolver.lookup(domain, config, timeout);
            } catch (TransportException e) {
                personas.recordFailure(persona, e.getMessage());
                throw e;
            }
            personas.recordSuccess(persona);

            DnsValidationResult r = DnsValidationResult.newResult(campaignId, domain);
            r.setSystemStatus(SystemStatus.SUCCEEDED);
            r.setDnsStatus(lookup.resolved() ? DnsValidationStatus.RESOLVED : DnsValidationStatus.UNRESOLVED);
            r.setResolvedAddresses(new ArrayList<>(lookup.addresses()));
            r.setResolver(lookup.resolver());
            r.setPersonaId(persona.getId());
            r.setCheckedAt(Instant.now());
            return r;
        }

        @Override
        public DnsValidationResult failed(String domain, TransportException last) {
            DnsValidationResult r = DnsValidationResult.newResult(campaignId, domain);
            r.setSystemStatus(last != null && last.isTimedOut() ? SystemStatus.TIMED_OUT : SystemStatus.FAILED);
            r.setDnsStatus(DnsValidationStatus.ERROR);
            r.setErrorMessage(last == null ? "No attempt completed" : ErrorMessages.safe(last));
            r.setCheckedAt(Instant.now());
            return r;
        }

        @Override
        public String resourceLabel() {
            return personas.getLabel();
        }
    }

    private final class Store implements ResultStore<DnsValidationResult> {

        @Override
        public List<String> existingNames(String campaignId, Collection<String> names) {
            return resultRepository.findExistingNames(campaignId, names);
        }

        @Override
        public void saveAll(List<DnsValidationResult> results) {
            resultRepository.saveAll(results);
        }

        @Override
        public String domainOf(DnsValidationResult result) {
            return result.getDomainName();
        }

        @Override
        public boolean isSuccessful(DnsValidationResult result) {
            return result.getDnsStatus() == DnsValidationStatus.RESOLVED;
        }
    }
}
