package com.github.dimitryivaniuta.domainflow.service.validation;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.CampaignStatus;
import com.github.dimitryivaniuta.domainflow.domain.CampaignType;
import com.github.dimitryivaniuta.domainflow.domain.HttpKeywordParams;
import com.github.dimitryivaniuta.domainflow.domain.HttpKeywordResult;
import com.github.dimitryivaniuta.domainflow.domain.HttpSchemePolicy;
import com.github.dimitryivaniuta.domainflow.domain.HttpValidationStatus;
import com.github.dimitryivaniuta.domainflow.domain.JobType;
import com.github.dimitryivaniuta.domainflow.domain.KeywordRule;
import com.github.dimitryivaniuta.domainflow.domain.KeywordRuleType;
import com.github.dimitryivaniuta.domainflow.domain.KeywordSet;
import com.github.dimitryivaniuta.domainflow.domain.Persona;
import com.github.dimitryivaniuta.domainflow.domain.PersonaType;
import com.github.dimitryivaniuta.domainflow.domain.PooledResource;
import com.github.dimitryivaniuta.domainflow.domain.Proxy;
import com.github.dimitryivaniuta.domainflow.domain.ProxyProtocol;
import com.github.dimitryivaniuta.domainflow.domain.SelectionStrategy;
import com.github.dimitryivaniuta.domainflow.domain.SystemStatus;
import com.github.dimitryivaniuta.domainflow.domain.persona.HttpPersonaConfig;
import com.github.dimitryivaniuta.domainflow.repo.CampaignRepository;
import com.github.dimitryivaniuta.domainflow.repo.HttpKeywordParamsRepository;
import com.github.dimitryivaniuta.domainflow.repo.HttpKeywordResultRepository;
import com.github.dimitryivaniuta.domainflow.repo.KeywordSetRepository;
import com.github.dimitryivaniuta.domainflow.service.FingerprintService;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignStateService;
import com.github.dimitryivaniuta.domainflow.service.error.LeaseExpiredException;
import com.github.dimitryivaniuta.domainflow.service.error.TransportException;
import com.github.dimitryivaniuta.domainflow.service.pool.CircuitBreaker;
import com.github.dimitryivaniuta.domainflow.service.pool.ResourcePool;
import com.github.dimitryivaniuta.domainflow.service.pool.ResourcePoolManager;
import com.github.dimitryivaniuta.domainflow.service.pool.RoundRobinSelector;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressAggregator;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobLease;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobOutcome;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

class HttpKeywordValidationServiceTest {

    private static final String PAGE = "<html><head><title> Shop </title><script>var price = 1;</script></head>"
            + "<body><p>Best price in town</p></body></html>";

    private final CampaignRepository campaignRepository = Mockito.mock(CampaignRepository.class);
    private final StageAdmission admission = Mockito.mock(StageAdmission.class);
    private final CandidateSource candidateSource = Mockito.mock(CandidateSource.class);
    private final CampaignStateService stateService = Mockito.mock(CampaignStateService.class);
    private final ProgressAggregator aggregator = Mockito.mock(ProgressAggregator.class);
    private final ValidationResultWriter writer = Mockito.mock(ValidationResultWriter.class);
    private final HttpKeywordParamsRepository paramsRepository = Mockito.mock(HttpKeywordParamsRepository.class);
    private final HttpKeywordResultRepository resultRepository = Mockito.mock(HttpKeywordResultRepository.class);
    private final KeywordSetRepository keywordSetRepository = Mockito.mock(KeywordSetRepository.class);
    private final ResourcePoolManager poolManager = Mockito.mock(ResourcePoolManager.class);
    private final HttpFetcher fetcher = Mockito.mock(HttpFetcher.class);
    private final JobScheduler scheduler = Mockito.mock(JobScheduler.class);

    private final Persona persona = Persona.create("browser", new HttpPersonaConfig(null, Map.of("Accept-Language", "en"), List.of(), 0, null));
    private final Proxy proxy = Proxy.create("edge", "10.1.1.1:3128", ProxyProtocol.HTTP);
    private final KeywordSet pricing = KeywordSet.create("pricing", null,
            List.of(new KeywordRule("price", KeywordRuleType.STRING, 2.0d, true),
                    new KeywordRule("PRICE", KeywordRuleType.STRING, 5.0d, true)));

    private HttpKeywordValidationService service;
    private Campaign source;
    private Campaign campaign;
    private CampaignJob job;
    private JobLease lease;
    private HttpKeywordParams params;
    private ResourcePool<Proxy> proxies;

    @BeforeEach
    void setUp() {
        persona.setId("p1");
        proxy.setId("x1");

        AppProperties properties = new AppProperties();
        properties.getValidation().setRateLimitMaxWait(Duration.ZERO);
        StageSupport support = new StageSupport(campaignRepository, admission, candidateSource, stateService, aggregator,
                writer, Mockito.mock(PlatformTransactionManager.class), new SimpleMeterRegistry(),
                new SimpleAsyncTaskExecutor("test-lane-"), new CampaignRateLimiters(properties));
        service = new HttpKeywordValidationService(support, paramsRepository, resultRepository, keywordSetRepository,
                poolManager, fetcher, new FingerprintService(JsonMapper.builder().build()), properties);

        source = Campaign.newPending("dns", CampaignType.DNS_VALIDATION, null, null);
        source.setStatus(CampaignStatus.RUNNING);
        campaign = Campaign.newPending("http", CampaignType.HTTP_KEYWORD_VALIDATION, source.getId(), CampaignType.DNS_VALIDATION);
        campaign.setStatus(CampaignStatus.RUNNING);
        job = CampaignJob.pending(campaign.getId(), JobType.HTTP_KEYWORD_VALIDATION, 5, 3, 600, Instant.now());
        lease = new JobLease(job.getId(), "w-1", scheduler);

        params = new HttpKeywordParams();
        params.setCampaignId(campaign.getId());
        params.setPersonaIds(List.of("p1"));
        params.setProxyIds(List.of("x1"));
        params.setKeywordSetIds(List.of(pricing.getId()));
        params.setAdHocKeywords(List.of("TOWN", "delivery"));
        params.setSelectionStrategy(SelectionStrategy.ROUND_ROBIN);
        params.setBatchSize(20);
        params.setRetryAttempts(1);
        params.setParallelWorkers(1);
        params.setRequestTimeoutSeconds(15);

        Mockito.when(campaignRepository.findById(campaign.getId())).thenReturn(Optional.of(campaign));
        Mockito.when(paramsRepository.findById(campaign.getId())).thenReturn(Optional.of(params));
        Mockito.when(admission.admit(campaign)).thenReturn(source);
        Mockito.when(keywordSetRepository.findAllById(List.of(pricing.getId()))).thenReturn(List.of(pricing));
        Mockito.when(poolManager.personaPool(List.of("p1"), PersonaType.HTTP, SelectionStrategy.ROUND_ROBIN, 0))
                .thenReturn(pool("http personas", List.of(persona)));
        proxies = pool("proxies", List.of(proxy));
        Mockito.when(poolManager.proxyPool(List.of("x1"), SelectionStrategy.ROUND_ROBIN, 0)).thenReturn(proxies);
        Mockito.when(candidateSource.next(campaign, source, 20)).thenReturn(List.of("shop.com"));
        Mockito.when(writer.write(Mockito.eq(campaign.getId()), Mockito.anyList(), Mockito.any(), Mockito.anyLong(), Mockito.any()))
                .thenAnswer(inv -> ((List<?>) inv.getArgument(1)).size());
    }

    private static <T extends PooledResource> ResourcePool<T> pool(String label, List<T> members) {
        return new ResourcePool<>(label, members, new CircuitBreaker(5, Duration.ofMinutes(1)),
                new RoundRobinSelector<>(), Duration.ZERO, (kind, id, ok, err) -> { }, Clock.systemUTC());
    }

    @SuppressWarnings("unchecked")
    private List<HttpKeywordResult> writtenResults() {
        ArgumentCaptor<List<HttpKeywordResult>> captor = ArgumentCaptor.forClass(List.class);
        Mockito.verify(writer).write(Mockito.eq(campaign.getId()), captor.capture(), Mockito.any(), Mockito.anyLong(), Mockito.any());
        return captor.getValue();
    }

    private HttpKeywordResult writtenResult() {
        List<HttpKeywordResult> results = writtenResults();
        Assertions.assertEquals(1, results.size());
        return results.get(0);
    }

    private static FetchResult ok(String url) {
        return new FetchResult(200, url, 0, PAGE, PAGE.length());
    }

    @Test
    void pageWithKeywords_isScoredAndAttributedToPersonaAndProxy() {
        Mockito.when(fetcher.fetch(Mockito.any())).thenReturn(ok("https://shop.com/"));

        Assertions.assertEquals(JobOutcome.CONTINUE, service.execute(job, lease));

        ArgumentCaptor<FetchRequest> request = ArgumentCaptor.forClass(FetchRequest.class);
        Mockito.verify(fetcher).fetch(request.capture());
        Assertions.assertEquals("https://shop.com/", request.getValue().url());
        Assertions.assertEquals("DomainFlowHTTPValidator/1.0", request.getValue().userAgent());
        Assertions.assertEquals("en", request.getValue().headers().get("Accept-Language"));
        Assertions.assertEquals(Duration.ofSeconds(15), request.getValue().timeout());
        Assertions.assertSame(proxy, request.getValue().proxy());

        HttpKeywordResult r = writtenResult();
        Assertions.assertEquals(HttpValidationStatus.KEYWORDS_FOUND, r.getHttpStatus());
        Assertions.assertEquals(SystemStatus.SUCCEEDED, r.getSystemStatus());
        Assertions.assertEquals(Map.of(pricing.getId(), List.of("price")), r.getKeywordsFromSets());
        Assertions.assertEquals(List.of("TOWN"), r.getAdHocKeywordsFound());
        Assertions.assertEquals(3.0d, r.getKeywordScore(), 1e-9);
        Assertions.assertEquals("Shop", r.getPageTitle());
        Assertions.assertEquals("Best price in town", r.getContentSnippet());
        Assertions.assertEquals(64, r.getContentHash().length());
        Assertions.assertEquals("p1", r.getPersonaId());
        Assertions.assertEquals("x1", r.getProxyId());
        Assertions.assertEquals(1, r.getAttempts());
    }

    @Test
    void pageWithoutKeywords_isNoKeywords() {
        String body = "<html><body>Nothing here</body></html>";
        Mockito.when(fetcher.fetch(Mockito.any())).thenReturn(new FetchResult(200, "http://shop.com/", 0, body, body.length()));

        service.execute(job, lease);

        HttpKeywordResult r = writtenResult();
        Assertions.assertEquals(HttpValidationStatus.NO_KEYWORDS, r.getHttpStatus());
        Assertions.assertEquals(0.0d, r.getKeywordScore(), 1e-9);
    }

    @Test
    void forbidden_isAccessDeniedWithoutScanning() {
        Mockito.when(fetcher.fetch(Mockito.any())).thenReturn(new FetchResult(403, "http://shop.com/", 0, PAGE, PAGE.length()));

        service.execute(job, lease);

        HttpKeywordResult r = writtenResult();
        Assertions.assertEquals(HttpValidationStatus.ACCESS_DENIED, r.getHttpStatus());
        Assertions.assertEquals(403, r.getStatusCode());
        Assertions.assertTrue(r.getKeywordsFromSets().isEmpty());
    }

    @Test
    void statusOutsideAllowedList_isUnexpected() {
        Mockito.when(fetcher.fetch(Mockito.any())).thenReturn(new FetchResult(503, "http://shop.com/", 1, PAGE, PAGE.length()));

        service.execute(job, lease);

        HttpKeywordResult r = writtenResult();
        Assertions.assertEquals(HttpValidationStatus.UNEXPECTED_STATUS, r.getHttpStatus());
        Assertions.assertEquals(1, r.getRedirectCount());
    }

    @Test
    void proxyFailures_exhaustRetriesAndAreChargedToTheProxy() {
        Mockito.when(fetcher.fetch(Mockito.any())).thenThrow(new TransportException("proxy connection reset", false, true, null));

        Assertions.assertEquals(JobOutcome.CONTINUE, service.execute(job, lease));

        Mockito.verify(fetcher, Mockito.times(2)).fetch(Mockito.any());
        HttpKeywordResult r = writtenResult();
        Assertions.assertEquals(HttpValidationStatus.UNREACHABLE, r.getHttpStatus());
        Assertions.assertEquals(SystemStatus.FAILED, r.getSystemStatus());
        Assertions.assertEquals(2, r.getAttempts());
        Assertions.assertEquals("proxy connection reset", r.getErrorMessage());
        Assertions.assertEquals(2, proxies.healthOf(proxy).consecutiveFailures());
    }

    @Test
    void deadDomains_areUnreachableWithoutOpeningAnyCircuit() {
        List<String> batch = List.of("dead1.com", "dead2.com", "dead3.com", "shop.com", "dead4.com", "dead5.com", "dead6.com");
        Mockito.when(candidateSource.next(campaign, source, 20)).thenReturn(batch);
        Mockito.when(fetcher.fetch(Mockito.any())).thenAnswer(inv -> {
            FetchRequest request = inv.getArgument(0);
            if (request.url().contains("dead")) {
                throw new TransportException("Unknown host in " + request.url(), false, false, null);
            }
            return ok(request.url());
        });

        Assertions.assertEquals(JobOutcome.CONTINUE, service.execute(job, lease));

        Mockito.verify(stateService, Mockito.never()).degrade(Mockito.anyString(), Mockito.anyString());
        List<HttpKeywordResult> results = writtenResults();
        Assertions.assertEquals(batch.size(), results.size());
        for (HttpKeywordResult r : results) {
            HttpValidationStatus expected = r.getDomainName().startsWith("dead")
                    ? HttpValidationStatus.UNREACHABLE
                    : HttpValidationStatus.KEYWORDS_FOUND;
            Assertions.assertEquals(expected, r.getHttpStatus(), r.getDomainName());
        }
        Assertions.assertEquals(0, proxies.healthOf(proxy).consecutiveFailures());
        Assertions.assertEquals(1, proxies.active().size());
    }

    @Test
    void httpsFirst_fallsBackToHttpWhenHttpsGetsNoAnswer() {
        Mockito.when(fetcher.fetch(Mockito.any())).thenAnswer(inv -> {
            FetchRequest request = inv.getArgument(0);
            if (request.url().startsWith("https://")) {
                throw new TransportException("Connection refused", false, false, null);
            }
            return ok(request.url());
        });

        service.execute(job, lease);

        ArgumentCaptor<FetchRequest> requests = ArgumentCaptor.forClass(FetchRequest.class);
        Mockito.verify(fetcher, Mockito.times(2)).fetch(requests.capture());
        Assertions.assertEquals(List.of("https://shop.com/", "http://shop.com/"),
                requests.getAllValues().stream().map(FetchRequest::url).toList());
        HttpKeywordResult r = writtenResult();
        Assertions.assertEquals(HttpValidationStatus.KEYWORDS_FOUND, r.getHttpStatus());
        Assertions.assertEquals("http://shop.com/", r.getFinalUrl());
        Assertions.assertEquals(1, r.getAttempts());
    }

    @Test
    void targetPorts_andSchemePolicy_decideTheUrls() {
        params.setSchemePolicy(HttpSchemePolicy.HTTP_ONLY);
        params.setTargetHttpPorts(List.of(8080, 80));
        Mockito.when(fetcher.fetch(Mockito.any()))
                .thenThrow(new TransportException("Connection refused", false, false, null))
                .thenReturn(ok("http://shop.com/"));

        service.execute(job, lease);

        ArgumentCaptor<FetchRequest> requests = ArgumentCaptor.forClass(FetchRequest.class);
        Mockito.verify(fetcher, Mockito.times(2)).fetch(requests.capture());
        Assertions.assertEquals(List.of("http://shop.com:8080/", "http://shop.com/"),
                requests.getAllValues().stream().map(FetchRequest::url).toList());
        Assertions.assertEquals(HttpValidationStatus.KEYWORDS_FOUND, writtenResult().getHttpStatus());
    }

    @Test
    void targetUrls_leaveDefaultPortsOutAndKeepOrder() {
        Assertions.assertEquals(List.of("https://{domain}/", "http://{domain}/"),
                HttpKeywordValidationService.targetUrls(null, List.of()));
        Assertions.assertEquals(List.of("https://{domain}/", "http://{domain}:443/", "https://{domain}:8443/", "http://{domain}:8443/"),
                HttpKeywordValidationService.targetUrls(HttpSchemePolicy.HTTPS_FIRST, List.of(443, 8443)));
        Assertions.assertEquals(List.of("https://{domain}:8080/"),
                HttpKeywordValidationService.targetUrls(HttpSchemePolicy.HTTPS_ONLY, List.of(8080, 8080)));
    }

    @Test
    void proxyAnswering407_isRetriedAndChargedToTheProxy() {
        Mockito.when(fetcher.fetch(Mockito.any())).thenReturn(new FetchResult(407, "https://shop.com/", 0, "", 0));

        service.execute(job, lease);

        Mockito.verify(fetcher, Mockito.times(2)).fetch(Mockito.any());
        HttpKeywordResult r = writtenResult();
        Assertions.assertEquals(HttpValidationStatus.UNREACHABLE, r.getHttpStatus());
        Assertions.assertEquals(2, proxies.healthOf(proxy).consecutiveFailures());
    }

    @Test
    void processingSpeed_capsChecksAndRequeuesTheRest() {
        params.setProcessingSpeedPerMinute(2);
        Mockito.when(candidateSource.next(campaign, source, 20))
                .thenReturn(List.of("a.com", "b.com", "c.com", "d.com", "e.com"));
        Mockito.when(fetcher.fetch(Mockito.any())).thenAnswer(inv -> ok(((FetchRequest) inv.getArgument(0)).url()));

        Assertions.assertEquals(JobOutcome.WAIT, service.execute(job, lease));

        Mockito.verify(fetcher, Mockito.times(2)).fetch(Mockito.any());
        Assertions.assertEquals(List.of("a.com", "b.com"),
                writtenResults().stream().map(HttpKeywordResult::getDomainName).toList());
    }

    @Test
    void longBatch_renewsTheLeaseWhileChecksRun() {
        CampaignJob shortLease = CampaignJob.pending(campaign.getId(), JobType.HTTP_KEYWORD_VALIDATION, 5, 3, 3, Instant.now());
        JobLease held = new JobLease(shortLease.getId(), "w-1", scheduler);
        Mockito.when(fetcher.fetch(Mockito.any())).thenAnswer(inv -> {
            Thread.sleep(2_500L);
            return ok("https://shop.com/");
        });

        Assertions.assertEquals(JobOutcome.CONTINUE, service.execute(shortLease, held));

        // at least one renewal while the check ran, plus the one before the write
        Mockito.verify(scheduler, Mockito.atLeast(2)).renewLease(shortLease.getId(), "w-1");
    }

    @Test
    void lostLease_stopsTheBatchBeforeAnythingIsWritten() {
        CampaignJob shortLease = CampaignJob.pending(campaign.getId(), JobType.HTTP_KEYWORD_VALIDATION, 5, 3, 3, Instant.now());
        JobLease held = new JobLease(shortLease.getId(), "w-1", scheduler);
        Mockito.doThrow(new LeaseExpiredException(shortLease.getId(), "w-1"))
                .when(scheduler).renewLease(shortLease.getId(), "w-1");
        Mockito.when(fetcher.fetch(Mockito.any())).thenAnswer(inv -> {
            Thread.sleep(2_500L);
            return ok("https://shop.com/");
        });

        Assertions.assertThrows(LeaseExpiredException.class, () -> service.execute(shortLease, held));
        Mockito.verifyNoInteractions(writer);
    }

    @Test
    void emptyProxyPool_degradesCampaign() {
        Mockito.when(poolManager.proxyPool(List.of("x1"), SelectionStrategy.ROUND_ROBIN, 0))
                .thenReturn(pool("proxies", List.<Proxy>of()));

        Assertions.assertEquals(JobOutcome.ABANDONED, service.execute(job, lease));
        Mockito.verify(stateService).degrade(Mockito.eq(campaign.getId()), Mockito.anyString());
        Mockito.verifyNoInteractions(fetcher, writer);
    }
}
