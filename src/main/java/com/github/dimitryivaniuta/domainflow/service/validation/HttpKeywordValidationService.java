package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.HttpKeywordParams;
import com.github.dimitryivaniuta.domainflow.domain.HttpKeywordResult;
import com.github.dimitryivaniuta.domainflow.domain.HttpSchemePolicy;
import com.github.dimitryivaniuta.domainflow.domain.HttpValidationStatus;
import com.github.dimitryivaniuta.domainflow.domain.JobType;
import com.github.dimitryivaniuta.domainflow.domain.KeywordSet;
import com.github.dimitryivaniuta.domainflow.domain.Persona;
import com.github.dimitryivaniuta.domainflow.domain.PersonaType;
import com.github.dimitryivaniuta.domainflow.domain.Proxy;
import com.github.dimitryivaniuta.domainflow.domain.SystemStatus;
import com.github.dimitryivaniuta.domainflow.domain.persona.HttpPersonaConfig;
import com.github.dimitryivaniuta.domainflow.repo.HttpKeywordParamsRepository;
import com.github.dimitryivaniuta.domainflow.repo.HttpKeywordResultRepository;
import com.github.dimitryivaniuta.domainflow.repo.KeywordSetRepository;
import com.github.dimitryivaniuta.domainflow.service.FingerprintService;
import com.github.dimitryivaniuta.domainflow.service.error.ErrorMessages;
import com.github.dimitryivaniuta.domainflow.service.error.ResourcePoolExhaustedException;
import com.github.dimitryivaniuta.domainflow.service.error.TransportException;
import com.github.dimitryivaniuta.domainflow.service.pool.ResourcePool;
import com.github.dimitryivaniuta.domainflow.service.pool.ResourcePoolManager;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * HTTP keyword validation stage: fetches each candidate through rotating HTTP personas (and
 * proxies, when configured), classifies the response and scans the page for keywords.
 *
 * <p>Each attempt walks the campaign's target URLs (scheme policy times target ports) until one
 * answers. Only failures blamed on the proxy count against resource health: a dead domain ends as
 * {@code UNREACHABLE} without opening any circuit.</p>
 */
@Service
public class HttpKeywordValidationService extends AbstractValidationStage<HttpKeywordParams, HttpKeywordResult> {

    static final Set<Integer> ACCESS_DENIED_CODES = Set.of(401, 403, 407, 451);

    private static final int PROXY_AUTH_REQUIRED = 407;
    static final String DOMAIN_PLACEHOLDER = "{domain}";
    private static final Map<String, Integer> DEFAULT_PORTS = Map.of("http", 80, "https", 443);

    private final HttpKeywordParamsRepository paramsRepository;
    private final HttpKeywordResultRepository resultRepository;
    private final KeywordSetRepository keywordSetRepository;
    private final ResourcePoolManager poolManager;
    private final HttpFetcher fetcher;
    private final FingerprintService fingerprintService;
    private final AppProperties.Validation settings;
    private final ResultStore<HttpKeywordResult> store = new Store();

    public HttpKeywordValidationService(StageSupport support,
                                        HttpKeywordParamsRepository paramsRepository,
                                        HttpKeywordResultRepository resultRepository,
                                        KeywordSetRepository keywordSetRepository,
                                        ResourcePoolManager poolManager,
                                        HttpFetcher fetcher,
                                        FingerprintService fingerprintService,
                                        AppProperties properties) {
        super(support, "domainflow.http");
        this.paramsRepository = paramsRepository;
        this.resultRepository = resultRepository;
        this.keywordSetRepository = keywordSetRepository;
        this.poolManager = poolManager;
        this.fetcher = fetcher;
        this.fingerprintService = fingerprintService;
        this.settings = properties.getValidation();
    }

    @Override
    public JobType jobType() {
        return JobType.HTTP_KEYWORD_VALIDATION;
    }

    @Override
    protected Optional<HttpKeywordParams> loadParams(String campaignId) {
        return paramsRepository.findById(campaignId);
    }

    @Override
    protected ResultStore<HttpKeywordResult> resultStore() {
        return store;
    }

    @Override
    protected void stamp(HttpKeywordResult result, int attempts, long durationMs) {
        result.setAttempts(attempts);
        result.setDurationMs(durationMs);
    }

    @Override
    protected BatchRunner<HttpKeywordResult> openBatch(Campaign campaign, HttpKeywordParams params) {
        ResourcePool<Persona> personas = poolManager.personaPool(params.getPersonaIds(), PersonaType.HTTP,
                params.getSelectionStrategy(), params.getRotationIntervalSeconds());
        if (personas.active().isEmpty()) {
            throw new ResourcePoolExhaustedException("No usable " + personas.getLabel() + " for campaign " + campaign.getId());
        }
        ResourcePool<Proxy> proxies = null;
        if (!params.proxyIdsOrEmpty().isEmpty()) {
            proxies = poolManager.proxyPool(params.proxyIdsOrEmpty(), params.getSelectionStrategy(), params.getRotationIntervalSeconds());
            if (proxies.active().isEmpty()) {
                throw new ResourcePoolExhaustedException("No usable " + proxies.getLabel() + " for campaign " + campaign.getId());
            }
        }
        List<KeywordSet> sets = keywordSetRepository.findAllById(params.getKeywordSetIds());
        KeywordScanner scanner = KeywordScanner.compile(sets, params.getAdHocKeywords());
        List<String> urls = targetUrls(params.getSchemePolicy(), params.getTargetHttpPorts());
        return new Runner(campaign.getId(), params, personas, proxies, scanner, urls);
    }

    /**
     * URL templates tried for each domain, in order. A port equal to the scheme's default is left
     * out of the URL; {@value #DOMAIN_PLACEHOLDER} stands for the domain.
     */
    static List<String> targetUrls(HttpSchemePolicy policy, List<Integer> ports) {
        HttpSchemePolicy effective = policy == null ? HttpSchemePolicy.HTTPS_FIRST : policy;
        Set<String> urls = new LinkedHashSet<>();
        if (ports == null || ports.isEmpty()) {
            for (String scheme : effective.schemes()) {
                urls.add(scheme + "://" + DOMAIN_PLACEHOLDER + "/");
            }
            return List.copyOf(urls);
        }
        for (Integer port : ports) {
            for (String scheme : effective.schemes()) {
                boolean defaultPort = port.intValue() == DEFAULT_PORTS.get(scheme);
                urls.add(scheme + "://" + DOMAIN_PLACEHOLDER + (defaultPort ? "" : ":" + port) + "/");
            }
        }
        return List.copyOf(urls);
    }

    private final class Runner implements BatchRunner<HttpKeywordResult> {

        private final String campaignId;
        private final HttpKeywordParams params;
        private final ResourcePool<Persona> personas;
        private final ResourcePool<Proxy> proxies;
        private final KeywordScanner scanner;
        private final List<String> urlTemplates;

        Runner(String campaignId, HttpKeywordParams params, ResourcePool<Persona> personas,
               ResourcePool<Proxy> proxies, KeywordScanner scanner, List<String> urlTemplates) {
            this.campaignId = campaignId;
            this.params = params;
            this.personas = personas;
            this.proxies = proxies;
            this.scanner = scanner;
            this.urlTemplates = urlTemplates;
        }

        @Override
        public HttpKeywordResult attempt(String domain, Set<String> tried) {
            Persona persona = personas.acquire(domain, tried);
            tried.add(persona.getId());
            Proxy proxy = null;
            if (proxies != null) {
                proxy = proxies.acquire(domain, tried);
                tried.add(proxy.getId());
            }
            HttpPersonaConfig config = persona.getConfig() instanceof HttpPersonaConfig h
                    ? h
                    : new HttpPersonaConfig(null, null, null, 0, null);
            List<String> urls = urlTemplates.stream().map(t -> t.replace(DOMAIN_PLACEHOLDER, domain)).toList();

            String userAgent = config.userAgent() == null || config.userAgent().isBlank() ? settings.getDefaultUserAgent() : config.userAgent();
            Duration timeout = Duration.ofSeconds(config.requestTimeoutSeconds() > 0 ? config.requestTimeoutSeconds() : params.getRequestTimeoutSeconds());
            boolean followRedirects = config.followRedirects() != null ? config.followRedirects() : params.isFollowRedirects();

            TransportException targetFailure = null;
            for (String url : urls) {
                FetchRequest request = new FetchRequest(url, userAgent, config.headers(), timeout, followRedirects,
                        params.getMaxRedirects(), proxy, settings.getMaxBodyBytes());
                FetchResult response;
                try {
                    response = fetcher.fetch(request);
                } catch (TransportException e) {
                    if (e.isResourceFault()) {
                        if (proxy != null) {
                            proxies.recordFailure(proxy, e.getMessage());
                        } else {
                            personas.recordFailure(persona, e.getMessage());
                        }
                        throw e;
                    }
                    // the target did not answer on this URL; resource health is unaffected
                    targetFailure = e;
                    continue;
                }
                personas.recordSuccess(persona);
                if (proxy != null) {
                    if (response.statusCode() == PROXY_AUTH_REQUIRED) {
                        String error = "Proxy " + proxy.getId() + " rejected the request with 407";
                        proxies.recordFailure(proxy, error);
                        throw new TransportException(error, false, true, null);
                    }
                    proxies.recordSuccess(proxy);
                }
                return classify(domain, response, config, persona, proxy);
            }
            throw targetFailure;
        }

        private HttpKeywordResult classify(String domain, FetchResult response, HttpPersonaConfig config, Persona persona, Proxy proxy) {
            HttpKeywordResult r = HttpKeywordResult.newResult(campaignId, domain);
            r.setSystemStatus(SystemStatus.SUCCEEDED);
            r.setStatusCode(response.statusCode());
            r.setFinalUrl(truncate(response.finalUrl(), 2048));
            r.setRedirectCount(response.redirectCount());
            r.setContentLength(response.contentLength());
            r.setContentHash(fingerprintService.contentHash(response.body()));
            r.setPersonaId(persona.getId());
            r.setProxyId(proxy == null ? null : proxy.getId());
            r.setCheckedAt(Instant.now());

            String text = HtmlContentExtractor.extractText(response.body());
            r.setPageTitle(truncate(HtmlContentExtractor.extractTitle(response.body()), 512));
            r.setContentSnippet(truncate(text, settings.getContentSnippetLength()));

            int code = response.statusCode();
            if (ACCESS_DENIED_CODES.contains(code)) {
                r.setHttpStatus(HttpValidationStatus.ACCESS_DENIED);
            } else if (!config.allowsStatus(code)) {
                r.setHttpStatus(HttpValidationStatus.UNEXPECTED_STATUS);
            } else {
                KeywordScan scan = scanner.scan(text);
                r.setKeywordsFromSets(new LinkedHashMap<>(scan.fromSets()));
                r.setAdHocKeywordsFound(new ArrayList<>(scan.adHocFound()));
                r.setKeywordScore(scan.score());
                r.setHttpStatus(scan.anyFound() ? HttpValidationStatus.KEYWORDS_FOUND : HttpValidationStatus.NO_KEYWORDS);
            }
            return r;
        }

        @Override
        public HttpKeywordResult failed(String domain, TransportException last) {
            HttpKeywordResult r = HttpKeywordResult.newResult(campaignId, domain);
            r.setSystemStatus(last != null && last.isTimedOut() ? SystemStatus.TIMED_OUT : SystemStatus.FAILED);
            r.setHttpStatus(HttpValidationStatus.UNREACHABLE);
            r.setErrorMessage(last == null ? "No attempt completed" : ErrorMessages.safe(last));
            r.setCheckedAt(Instant.now());
            return r;
        }

        @Override
        public String resourceLabel() {
            return proxies == null ? personas.getLabel() : personas.getLabel() + " or " + proxies.getLabel();
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private final class Store implements ResultStore<HttpKeywordResult> {

        @Override
        public List<String> existingNames(String campaignId, Collection<String> names) {
            return resultRepository.findExistingNames(campaignId, names);
        }

        @Override
        public void saveAll(List<HttpKeywordResult> results) {
            resultRepository.saveAll(results);
        }

        @Override
        public String domainOf(HttpKeywordResult result) {
            return result.getDomainName();
        }

        @Override
        public boolean isSuccessful(HttpKeywordResult result) {
            return result.getHttpStatus() == HttpValidationStatus.KEYWORDS_FOUND;
        }
    }
}
