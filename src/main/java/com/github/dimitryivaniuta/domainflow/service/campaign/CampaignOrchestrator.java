package com.github.dimitryivaniuta.domainflow.service.campaign;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.CampaignStatus;
import com.github.dimitryivaniuta.domainflow.domain.CampaignType;
import com.github.dimitryivaniuta.domainflow.domain.DnsValidationParams;
import com.github.dimitryivaniuta.domainflow.domain.DomainGenerationParams;
import com.github.dimitryivaniuta.domainflow.domain.GenerationSpec;
import com.github.dimitryivaniuta.domainflow.domain.HttpKeywordParams;
import com.github.dimitryivaniuta.domainflow.domain.HttpSchemePolicy;
import com.github.dimitryivaniuta.domainflow.domain.KeywordSet;
import com.github.dimitryivaniuta.domainflow.domain.PatternType;
import com.github.dimitryivaniuta.domainflow.domain.PersonaType;
import com.github.dimitryivaniuta.domainflow.domain.SelectionStrategy;
import com.github.dimitryivaniuta.domainflow.domain.ValidationParams;
import com.github.dimitryivaniuta.domainflow.repo.CampaignRepository;
import com.github.dimitryivaniuta.domainflow.repo.DnsValidationParamsRepository;
import com.github.dimitryivaniuta.domainflow.repo.DomainGenerationParamsRepository;
import com.github.dimitryivaniuta.domainflow.repo.HttpKeywordParamsRepository;
import com.github.dimitryivaniuta.domainflow.repo.KeywordSetRepository;
import com.github.dimitryivaniuta.domainflow.service.FingerprintService;
import com.github.dimitryivaniuta.domainflow.service.error.CampaignNotFoundException;
import com.github.dimitryivaniuta.domainflow.service.error.IllegalCampaignTransitionException;
import com.github.dimitryivaniuta.domainflow.service.error.InvalidConfigException;
import com.github.dimitryivaniuta.domainflow.service.generation.PatternEnumerator;
import com.github.dimitryivaniuta.domainflow.service.pool.ResourcePoolManager;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressSnapshot;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressSnapshotCache;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobScheduler;
import com.github.dimitryivaniuta.domainflow.service.scheduler.StageLinkageSweeper;
import com.github.dimitryivaniuta.domainflow.service.validation.StageAdmission;
import com.github.dimitryivaniuta.domainflow.web.dto.CreateDnsCampaignRequest;
import com.github.dimitryivaniuta.domainflow.web.dto.CreateGenerationCampaignRequest;
import com.github.dimitryivaniuta.domainflow.web.dto.CreateHttpCampaignRequest;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Campaign lifecycle operations: creation with full parameter validation, start, pause, resume,
 * cancel and archive.
 *
 * <p>Malformed parameters are rejected here, before anything is persisted; execution never sees
 * an unchecked configuration.</p>
 */
@Service
public class CampaignOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CampaignOrchestrator.class);

    static final int DNS_DEFAULT_BATCH = 50;
    static final int DNS_DEFAULT_WORKERS = 10;
    static final int DNS_DEFAULT_TIMEOUT_SECONDS = 5;
    static final int HTTP_DEFAULT_BATCH = 20;
    static final int HTTP_DEFAULT_WORKERS = 5;
    static final int HTTP_DEFAULT_TIMEOUT_SECONDS = 15;
    static final int DEFAULT_RETRY_ATTEMPTS = 1;
    static final int DEFAULT_MAX_REDIRECTS = 5;

    private final CampaignRepository campaignRepository;
    private final DomainGenerationParamsRepository generationParamsRepository;
    private final DnsValidationParamsRepository dnsParamsRepository;
    private final HttpKeywordParamsRepository httpParamsRepository;
    private final KeywordSetRepository keywordSetRepository;
    private final FingerprintService fingerprintService;
    private final ResourcePoolManager poolManager;
    private final StageAdmission admission;
    private final CampaignStateService stateService;
    private final StageLinkageSweeper linkage;
    private final JobScheduler jobScheduler;
    private final ProgressSnapshotCache snapshotCache;
    private final AppProperties properties;

    public CampaignOrchestrator(CampaignRepository campaignRepository,
                                DomainGenerationParamsRepository generationParamsRepository,
                                DnsValidationParamsRepository dnsParamsRepository,
                                HttpKeywordParamsRepository httpParamsRepository,
                                KeywordSetRepository keywordSetRepository,
                                FingerprintService fingerprintService,
                                ResourcePoolManager poolManager,
                                StageAdmission admission,
                                CampaignStateService stateService,
                                StageLinkageSweeper linkage,
                                JobScheduler jobScheduler,
                                ProgressSnapshotCache snapshotCache,
                                AppProperties properties) {
        this.campaignRepository = campaignRepository;
        this.generationParamsRepository = generationParamsRepository;
        this.dnsParamsRepository = dnsParamsRepository;
        this.httpParamsRepository = httpParamsRepository;
        this.keywordSetRepository = keywordSetRepository;
        this.fingerprintService = fingerprintService;
        this.poolManager = poolManager;
        this.admission = admission;
        this.stateService = stateService;
        this.linkage = linkage;
        this.jobScheduler = jobScheduler;
        this.snapshotCache = snapshotCache;
        this.properties = properties;
    }

    /**
     * Creates a PENDING generation campaign.
     *
     * @param request parameters
     * @return created campaign
     * @throws InvalidConfigException when the pattern is unusable
     */
    @Transactional
    public Campaign createGeneration(CreateGenerationCampaignRequest request) {
        PatternType patternType = PatternType.parse(request.patternType());
        if (patternType == null) {
            throw new InvalidConfigException("patternType must be one of prefix, suffix, both");
        }
        GenerationSpec spec = GenerationSpec.normalize(patternType, request.characterSet(), request.constantString(),
                request.variableLength(), request.tld());
        PatternEnumerator.validate(spec);
        long capacity = PatternEnumerator.capacity(spec);
        int batchSize = request.batchSize() == null ? properties.getGeneration().getDefaultBatchSize() : request.batchSize();
        requireRange("batchSize", batchSize, 1, 100_000);

        Campaign campaign = Campaign.newPending(request.name(), CampaignType.DOMAIN_GENERATION, null, null);
        campaign.setTotalItems(request.numDomainsToGenerate());
        campaignRepository.save(campaign);

        DomainGenerationParams params = new DomainGenerationParams();
        params.setCampaignId(campaign.getId());
        params.setPatternType(spec.patternType());
        params.setCharacterSet(spec.characterSet());
        params.setConstantString(spec.constantString());
        params.setVariableLength(spec.variableLength());
        params.setTld(spec.tld());
        params.setNumDomainsToGenerate(request.numDomainsToGenerate());
        params.setBatchSize(batchSize);
        params.setConfigFingerprint(fingerprintService.fingerprint(spec));
        generationParamsRepository.save(params);

        log.info("Created generation campaign {} ({} of {} combinations, fingerprint {})",
                campaign.getId(), request.numDomainsToGenerate(), capacity, params.getConfigFingerprint());
        return campaign;
    }

    /**
     * Creates a PENDING DNS validation campaign over a generation campaign.
     *
     * @param request parameters
     * @return created campaign
     * @throws InvalidConfigException when the source, personas or numbers are unusable
     */
    @Transactional
    public Campaign createDnsValidation(CreateDnsCampaignRequest request) {
        CampaignType declared = request.sourceType() == null || request.sourceType().isBlank()
                ? CampaignType.DOMAIN_GENERATION
                : parseSourceType(request.sourceType());
        admission.admit(CampaignType.DNS_VALIDATION, request.sourceCampaignId(), declared);
        poolManager.requirePersonas(request.personaIds(), PersonaType.DNS);

        Campaign campaign = Campaign.newPending(request.name(), CampaignType.DNS_VALIDATION, request.sourceCampaignId(), declared);
        DnsValidationParams params = new DnsValidationParams();
        applyCommon(params, campaign.getId(), request.personaIds(), request.selectionStrategy(),
                request.rotationIntervalSeconds(), request.batchSize(), request.retryAttempts(), request.parallelWorkers(),
                request.requestTimeoutSeconds(), request.processingSpeedPerMinute(),
                DNS_DEFAULT_BATCH, DNS_DEFAULT_WORKERS, DNS_DEFAULT_TIMEOUT_SECONDS);

        campaignRepository.save(campaign);
        dnsParamsRepository.save(params);
        log.info("Created DNS validation campaign {} over {}", campaign.getId(), request.sourceCampaignId());
        return campaign;
    }

    /**
     * Creates a PENDING HTTP keyword validation campaign over a generation or DNS campaign.
     *
     * @param request parameters
     * @return created campaign
     * @throws InvalidConfigException when the source, resources, keywords or numbers are unusable
     */
    @Transactional
    public Campaign createHttpValidation(CreateHttpCampaignRequest request) {
        CampaignType declared = parseSourceType(request.sourceType());
        admission.admit(CampaignType.HTTP_KEYWORD_VALIDATION, request.sourceCampaignId(), declared);
        poolManager.requirePersonas(request.personaIds(), PersonaType.HTTP);
        List<String> proxyIds = nullToEmpty(request.proxyIds());
        poolManager.requireProxies(proxyIds);

        List<String> keywordSetIds = nullToEmpty(request.keywordSetIds());
        List<String> adHoc = nullToEmpty(request.adHocKeywords()).stream()
                .filter(k -> k != null && !k.isBlank())
                .map(String::trim)
                .toList();
        if (keywordSetIds.isEmpty() && adHoc.isEmpty()) {
            throw new InvalidConfigException("At least one keyword set or ad-hoc keyword is required");
        }
        requireKeywordSets(keywordSetIds);

        int maxRedirects = request.maxRedirects() == null ? DEFAULT_MAX_REDIRECTS : request.maxRedirects();
        requireRange("maxRedirects", maxRedirects, 0, 20);
        HttpSchemePolicy schemePolicy = parseSchemePolicy(request.schemePolicy());
        List<Integer> ports = request.targetHttpPorts() == null ? List.of() : request.targetHttpPorts();
        for (Integer port : ports) {
            if (port == null) {
                throw new InvalidConfigException("targetHttpPorts must not contain null");
            }
            requireRange("targetHttpPorts", port, 1, 65_535);
        }

        Campaign campaign = Campaign.newPending(request.name(), CampaignType.HTTP_KEYWORD_VALIDATION, request.sourceCampaignId(), declared);
        HttpKeywordParams params = new HttpKeywordParams();
        applyCommon(params, campaign.getId(), request.personaIds(), request.selectionStrategy(),
                request.rotationIntervalSeconds(), request.batchSize(), request.retryAttempts(), request.parallelWorkers(),
                request.requestTimeoutSeconds(), request.processingSpeedPerMinute(),
                HTTP_DEFAULT_BATCH, HTTP_DEFAULT_WORKERS, HTTP_DEFAULT_TIMEOUT_SECONDS);
        params.setProxyIds(new ArrayList<>(proxyIds));
        params.setKeywordSetIds(new ArrayList<>(keywordSetIds));
        params.setAdHocKeywords(new ArrayList<>(adHoc));
        params.setFollowRedirects(request.followRedirects() == null || request.followRedirects());
        params.setMaxRedirects(maxRedirects);
        params.setSchemePolicy(schemePolicy);
        params.setTargetHttpPorts(new ArrayList<>(new LinkedHashSet<>(ports)));

        campaignRepository.save(campaign);
        httpParamsRepository.save(params);
        log.info("Created HTTP keyword campaign {} over {} ({})", campaign.getId(), request.sourceCampaignId(),
                declared.getSourceTypeName());
        return campaign;
    }

    /**
     * Queues a PENDING (or FAILED) campaign. Validation campaigns are admitted again and get their
     * first job as soon as the predecessor has an eligible row.
     *
     * @param campaignId campaign id
     * @return queued campaign
     */
    @Transactional
    public Campaign start(String campaignId) {
        Campaign campaign = get(campaignId);
        if (campaign.isValidationStage()) {
            admission.admit(campaign);
        }
        Campaign queued = stateService.transition(campaignId, CampaignStatus.QUEUED);
        boolean enqueued = linkage.tryEnqueue(queued);
        log.info("Campaign {} queued{}", campaignId, enqueued ? "" : ", waiting for its source");
        return queued;
    }

    @Transactional
    public Campaign pause(String campaignId) {
        return stateService.transition(campaignId, CampaignStatus.PAUSED);
    }

    /**
     * PAUSED to QUEUED, clearing a degraded flag, and re-enqueues.
     */
    @Transactional
    public Campaign resume(String campaignId) {
        Campaign current = get(campaignId);
        if (current.getStatus() != CampaignStatus.PAUSED) {
            throw new IllegalCampaignTransitionException(campaignId, current.getStatus(), CampaignStatus.QUEUED);
        }
        Campaign queued = stateService.transition(campaignId, CampaignStatus.QUEUED);
        linkage.tryEnqueue(queued);
        return queued;
    }

    @Transactional
    public Campaign cancel(String campaignId) {
        return stateService.transition(campaignId, CampaignStatus.CANCELLED);
    }

    @Transactional
    public Campaign archive(String campaignId) {
        return stateService.transition(campaignId, CampaignStatus.ARCHIVED);
    }

    @Transactional(readOnly = true)
    public Campaign get(String campaignId) {
        return campaignRepository.findById(campaignId).orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }

    /**
     * Read-only progress snapshot, cached between counter updates.
     */
    public ProgressSnapshot snapshot(String campaignId) {
        ProgressSnapshot snapshot = snapshotCache.get(campaignId);
        if (snapshot == null) {
            throw new CampaignNotFoundException(campaignId);
        }
        return snapshot;
    }

    public List<CampaignJob> jobs(String campaignId) {
        get(campaignId);
        return jobScheduler.jobsOf(campaignId);
    }

    private void applyCommon(ValidationParams params, String campaignId, List<String> personaIds, String strategy,
                             Integer rotation, Integer batch, Integer retries, Integer workers, Integer timeout,
                             Integer speedPerMinute, int defaultBatch, int defaultWorkers, int defaultTimeout) {
        SelectionStrategy selection = SelectionStrategy.parse(strategy);
        if (selection == null) {
            throw new InvalidConfigException("Unknown selection strategy: " + strategy);
        }
        params.setCampaignId(campaignId);
        params.setPersonaIds(new ArrayList<>(personaIds));
        params.setSelectionStrategy(selection);
        params.setRotationIntervalSeconds(orDefault(rotation, 0));
        params.setBatchSize(orDefault(batch, defaultBatch));
        params.setRetryAttempts(orDefault(retries, DEFAULT_RETRY_ATTEMPTS));
        params.setParallelWorkers(orDefault(workers, defaultWorkers));
        params.setRequestTimeoutSeconds(orDefault(timeout, defaultTimeout));
        params.setProcessingSpeedPerMinute(orDefault(speedPerMinute, 0));

        requireRange("rotationIntervalSeconds", params.getRotationIntervalSeconds(), 0, 86_400);
        requireRange("batchSize", params.getBatchSize(), 1, 10_000);
        requireRange("retryAttempts", params.getRetryAttempts(), 0, 10);
        requireRange("parallelWorkers", params.getParallelWorkers(), 1, 200);
        requireRange("requestTimeoutSeconds", params.getRequestTimeoutSeconds(), 1, 300);
        requireRange("processingSpeedPerMinute", params.getProcessingSpeedPerMinute(), 0, 1_000_000);
    }

    private void requireKeywordSets(List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        Set<String> found = new HashSet<>();
        for (KeywordSet s : keywordSetRepository.findAllById(ids)) {
            found.add(s.getId());
        }
        for (String id : ids) {
            if (!found.contains(id)) {
                throw new InvalidConfigException("Unknown keyword set: " + id);
            }
        }
    }

    private static CampaignType parseSourceType(String raw) {
        CampaignType type = CampaignType.fromSourceTypeName(raw);
        if (type == null) {
            throw new InvalidConfigException("Unknown source type: " + raw);
        }
        return type;
    }

    private static HttpSchemePolicy parseSchemePolicy(String raw) {
        if (raw == null || raw.isBlank()) {
            return HttpSchemePolicy.HTTPS_FIRST;
        }
        try {
            return HttpSchemePolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("Unknown scheme policy: " + raw);
        }
    }

    private static void requireRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new InvalidConfigException(field + " must be between " + min + " and " + max + ", was " + value);
        }
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private static List<String> nullToEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }
}
