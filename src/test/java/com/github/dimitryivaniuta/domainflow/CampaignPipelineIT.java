package com.github.dimitryivaniuta.domainflow;

import com.github.dimitryivaniuta.domainflow.domain.DomainGenerationParams;
import com.github.dimitryivaniuta.domainflow.repo.DomainGenerationParamsRepository;
import com.github.dimitryivaniuta.domainflow.repo.GeneratedDomainRepository;
import com.github.dimitryivaniuta.domainflow.repo.GenerationConfigRepository;
import com.github.dimitryivaniuta.domainflow.service.generation.GenerationCursorStore;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * End-to-end campaign tests against Postgres (Testcontainers) with the Flyway schema and running
 * worker threads.
 */
@Testcontainers
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CampaignPipelineIT {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("domainflow")
            .withUsername("domainflow")
            .withPassword("domainflow");

    @BeforeAll
    static void start() {
        POSTGRES.start();
    }

    @AfterAll
    static void stop() {
        POSTGRES.stop();
    }

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);
        r.add("spring.flyway.enabled", () -> "true");
        r.add("spring.jpa.hibernate.ddl-auto", () -> "validate");

        r.add("app.worker.auto-start", () -> "true");
        r.add("app.worker.count", () -> "2");
        r.add("app.worker.poll-interval", () -> "100ms");
    }

    @LocalServerPort
    int port;

    @Autowired
    TestRestTemplate rest;

    @Autowired
    DomainGenerationParamsRepository generationParamsRepository;

    @Autowired
    GeneratedDomainRepository generatedDomainRepository;

    @Autowired
    GenerationConfigRepository generationConfigRepository;

    @Autowired
    GenerationCursorStore cursorStore;

    @MockBean
    KafkaTemplate<String, String> kafkaTemplate;

    @Test
    void generationCampaign_producesEveryCombinationAndAdvancesTheCursor() throws Exception {
        ResponseEntity<Map> created = post("/api/campaigns/generation", Map.of(
                "name", "abc-test",
                "patternType", "prefix",
                "characterSet", "abc",
                "constantString", "test",
                "variableLength", 2,
                "tld", "com",
                "numDomainsToGenerate", 9,
                "batchSize", 4));
        Assertions.assertEquals(201, created.getStatusCode().value());
        Assertions.assertNotNull(created.getHeaders().getLocation());
        String campaignId = (String) created.getBody().get("campaignId");
        Assertions.assertEquals("PENDING", created.getBody().get("status"));

        Assertions.assertEquals(202, post("/api/campaigns/" + campaignId + "/start", Map.of()).getStatusCode().value());

        Map<?, ?> progress = awaitStatus(campaignId, "COMPLETED");
        Assertions.assertEquals(9, ((Number) progress.get("processedItems")).intValue());
        Assertions.assertEquals(9, ((Number) progress.get("totalItems")).intValue());
        Assertions.assertEquals(100.0, ((Number) progress.get("progressPercentage")).doubleValue(), 1e-9);

        Assertions.assertEquals(9, generatedDomainRepository.countByCampaignId(campaignId));
        DomainGenerationParams params = generationParamsRepository.findById(campaignId).orElseThrow();
        Assertions.assertEquals(9, params.getGeneratedCount());
        Assertions.assertEquals(9, cursorStore.currentOffset(params.getConfigFingerprint()));
        Assertions.assertTrue(generationConfigRepository.existsById(params.getConfigFingerprint()));

        ResponseEntity<List> jobs = rest.getForEntity(url("/api/campaigns/" + campaignId + "/jobs"), List.class);
        Assertions.assertEquals(200, jobs.getStatusCode().value());
        Assertions.assertFalse(jobs.getBody().isEmpty());
    }

    @Test
    void httpCampaign_declaringWrongSourceType_isRejected() {
        String generationId = (String) post("/api/campaigns/generation", Map.of(
                "name", "source",
                "patternType", "suffix",
                "characterSet", "xyz",
                "constantString", "shop",
                "variableLength", 1,
                "tld", ".net",
                "numDomainsToGenerate", 3)).getBody().get("campaignId");

        String dnsPersona = (String) post("/api/personas", Map.of(
                "name", "resolver",
                "personaType", "dns",
                "config", Map.of("type", "dns", "resolvers", List.of("127.0.0.1"), "recordTypes", List.of("A"),
                        "queryTimeoutSeconds", 1))).getBody().get("personaId");
        String httpPersona = (String) post("/api/personas", Map.of(
                "name", "browser",
                "personaType", "http",
                "config", Map.of("type", "http", "userAgent", "Mozilla/5.0", "requestTimeoutSeconds", 5))).getBody().get("personaId");

        ResponseEntity<Map> dns = post("/api/campaigns/dns-validation", Map.of(
                "name", "dns",
                "sourceCampaignId", generationId,
                "sourceType", "DomainGeneration",
                "personaIds", List.of(dnsPersona)));
        Assertions.assertEquals(201, dns.getStatusCode().value());
        String dnsId = (String) dns.getBody().get("campaignId");

        ResponseEntity<Map> rejected = post("/api/campaigns/http-keyword-validation", Map.of(
                "name", "http",
                "sourceCampaignId", dnsId,
                "sourceType", "DomainGeneration",
                "personaIds", List.of(httpPersona),
                "adHocKeywords", List.of("pricing")));
        Assertions.assertEquals(400, rejected.getStatusCode().value());
        Assertions.assertEquals("INVALID_CONFIG", rejected.getBody().get("code"));

        ResponseEntity<Map> accepted = post("/api/campaigns/http-keyword-validation", Map.of(
                "name", "http",
                "sourceCampaignId", dnsId,
                "sourceType", "DNSValidation",
                "personaIds", List.of(httpPersona),
                "adHocKeywords", List.of("pricing")));
        Assertions.assertEquals(201, accepted.getStatusCode().value());
    }

    @Test
    void unknownCampaign_isNotFound() {
        ResponseEntity<Map> r = rest.getForEntity(url("/api/campaigns/does-not-exist"), Map.class);

        Assertions.assertEquals(404, r.getStatusCode().value());
        Assertions.assertEquals("NOT_FOUND", r.getBody().get("code"));
    }

    @Test
    void illegalTransition_isConflict() {
        String id = (String) post("/api/campaigns/generation", Map.of(
                "name", "idle",
                "patternType", "both",
                "characterSet", "ab",
                "constantString", "x",
                "variableLength", 1,
                "tld", "org",
                "numDomainsToGenerate", 2)).getBody().get("campaignId");

        ResponseEntity<Map> r = post("/api/campaigns/" + id + "/pause", Map.of());

        Assertions.assertEquals(409, r.getStatusCode().value());
        Assertions.assertEquals("ILLEGAL_TRANSITION", r.getBody().get("code"));
    }

    private Map<?, ?> awaitStatus(String campaignId, String status) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(60);
        Map<?, ?> last = null;
        while (System.nanoTime() < deadline) {
            last = rest.getForEntity(url("/api/campaigns/" + campaignId + "/progress"), Map.class).getBody();
            if (last != null && status.equals(last.get("status"))) {
                return last;
            }
            Thread.sleep(200);
        }
        Assertions.fail("Campaign " + campaignId + " did not reach " + status + ", last snapshot: " + last);
        return last;
    }

    @SuppressWarnings("rawtypes")
    private ResponseEntity<Map> post(String path, Object body) {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        return rest.exchange(url(path), HttpMethod.POST, new HttpEntity<>(body, h), Map.class);
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }
}
