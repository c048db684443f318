package com.github.dimitryivaniuta.domainflow.web;

import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignOrchestrator;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressSnapshot;
import com.github.dimitryivaniuta.domainflow.web.dto.CampaignResponse;
import com.github.dimitryivaniuta.domainflow.web.dto.CreateDnsCampaignRequest;
import com.github.dimitryivaniuta.domainflow.web.dto.CreateGenerationCampaignRequest;
import com.github.dimitryivaniuta.domainflow.web.dto.CreateHttpCampaignRequest;
import com.github.dimitryivaniuta.domainflow.web.dto.JobResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for campaigns: creation per stage type, lifecycle commands and progress reads.
 */
@RestController
@RequestMapping("/api/campaigns")
public class CampaignsController {

    private final CampaignOrchestrator orchestrator;

    public CampaignsController(CampaignOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(value = "/generation", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CampaignResponse> createGeneration(@Valid @RequestBody CreateGenerationCampaignRequest request) {
        return created(orchestrator.createGeneration(request));
    }

    @PostMapping(value = "/dns-validation", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CampaignResponse> createDnsValidation(@Valid @RequestBody CreateDnsCampaignRequest request) {
        return created(orchestrator.createDnsValidation(request));
    }

    @PostMapping(value = "/http-keyword-validation", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CampaignResponse> createHttpValidation(@Valid @RequestBody CreateHttpCampaignRequest request) {
        return created(orchestrator.createHttpValidation(request));
    }

    @GetMapping(value = "/{campaignId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CampaignResponse> get(@PathVariable String campaignId) {
        return ResponseEntity.ok(CampaignResponse.from(orchestrator.get(campaignId)));
    }

    /**
     * Cached progress snapshot; may lag the counters by one batch.
     *
     * @param campaignId campaign id
     * @return snapshot
     */
    @GetMapping(value = "/{campaignId}/progress", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProgressSnapshot> progress(@PathVariable String campaignId) {
        return ResponseEntity.ok(orchestrator.snapshot(campaignId));
    }

    @GetMapping(value = "/{campaignId}/jobs", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<JobResponse>> jobs(@PathVariable String campaignId) {
        return ResponseEntity.ok(orchestrator.jobs(campaignId).stream().map(JobResponse::from).toList());
    }

    @PostMapping("/{campaignId}/start")
    public ResponseEntity<CampaignResponse> start(@PathVariable String campaignId) {
        return ResponseEntity.accepted().body(CampaignResponse.from(orchestrator.start(campaignId)));
    }

    @PostMapping("/{campaignId}/pause")
    public ResponseEntity<CampaignResponse> pause(@PathVariable String campaignId) {
        return ResponseEntity.ok(CampaignResponse.from(orchestrator.pause(campaignId)));
    }

    @PostMapping("/{campaignId}/resume")
    public ResponseEntity<CampaignResponse> resume(@PathVariable String campaignId) {
        return ResponseEntity.accepted().body(CampaignResponse.from(orchestrator.resume(campaignId)));
    }

    @PostMapping("/{campaignId}/cancel")
    public ResponseEntity<CampaignResponse> cancel(@PathVariable String campaignId) {
        return ResponseEntity.ok(CampaignResponse.from(orchestrator.cancel(campaignId)));
    }

    @PostMapping("/{campaignId}/archive")
    public ResponseEntity<CampaignResponse> archive(@PathVariable String campaignId) {
        return ResponseEntity.ok(CampaignResponse.from(orchestrator.archive(campaignId)));
    }

    private static ResponseEntity<CampaignResponse> created(Campaign c) {
        return ResponseEntity.created(URI.create("/api/campaigns/" + c.getId())).body(CampaignResponse.from(c));
    }
}
