package com.github.dimitryivaniuta.domainflow.web;

import com.github.dimitryivaniuta.domainflow.domain.KeywordSet;
import com.github.dimitryivaniuta.domainflow.domain.Persona;
import com.github.dimitryivaniuta.domainflow.domain.Proxy;
import com.github.dimitryivaniuta.domainflow.service.resource.ResourceAdminService;
import com.github.dimitryivaniuta.domainflow.web.dto.CreateKeywordSetRequest;
import com.github.dimitryivaniuta.domainflow.web.dto.CreatePersonaRequest;
import com.github.dimitryivaniuta.domainflow.web.dto.CreateProxyRequest;
import com.github.dimitryivaniuta.domainflow.web.dto.KeywordSetResponse;
import com.github.dimitryivaniuta.domainflow.web.dto.PersonaResponse;
import com.github.dimitryivaniuta.domainflow.web.dto.ProxyResponse;
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
 * REST API for the resources campaigns draw on: personas, proxies and keyword sets.
 */
@RestController
@RequestMapping("/api")
public class ResourcesController {

    private final ResourceAdminService resources;

    public ResourcesController(ResourceAdminService resources) {
        this.resources = resources;
    }

    @PostMapping(value = "/personas", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PersonaResponse> createPersona(@Valid @RequestBody CreatePersonaRequest request) {
        Persona p = resources.createPersona(request);
        return ResponseEntity.created(URI.create("/api/personas/" + p.getId())).body(PersonaResponse.from(p));
    }

    @GetMapping(value = "/personas", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<PersonaResponse> personas() {
        return resources.personas().stream().map(PersonaResponse::from).toList();
    }

    @GetMapping(value = "/personas/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public PersonaResponse persona(@PathVariable String id) {
        return PersonaResponse.from(resources.persona(id));
    }

    @PostMapping("/personas/{id}/enable")
    public PersonaResponse enablePersona(@PathVariable String id) {
        return PersonaResponse.from(resources.setPersonaEnabled(id, true));
    }

    @PostMapping("/personas/{id}/disable")
    public PersonaResponse disablePersona(@PathVariable String id) {
        return PersonaResponse.from(resources.setPersonaEnabled(id, false));
    }

    @PostMapping(value = "/proxies", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProxyResponse> createProxy(@Valid @RequestBody CreateProxyRequest request) {
        Proxy p = resources.createProxy(request);
        return ResponseEntity.created(URI.create("/api/proxies/" + p.getId())).body(ProxyResponse.from(p));
    }

    @GetMapping(value = "/proxies", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ProxyResponse> proxies() {
        return resources.proxies().stream().map(ProxyResponse::from).toList();
    }

    @GetMapping(value = "/proxies/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ProxyResponse proxy(@PathVariable String id) {
        return ProxyResponse.from(resources.proxy(id));
    }

    @PostMapping("/proxies/{id}/enable")
    public ProxyResponse enableProxy(@PathVariable String id) {
        return ProxyResponse.from(resources.setProxyEnabled(id, true));
    }

    @PostMapping("/proxies/{id}/disable")
    public ProxyResponse disableProxy(@PathVariable String id) {
        return ProxyResponse.from(resources.setProxyEnabled(id, false));
    }

    @PostMapping(value = "/keyword-sets", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<KeywordSetResponse> createKeywordSet(@Valid @RequestBody CreateKeywordSetRequest request) {
        KeywordSet s = resources.createKeywordSet(request);
        return ResponseEntity.created(URI.create("/api/keyword-sets/" + s.getId())).body(KeywordSetResponse.from(s));
    }

    @GetMapping(value = "/keyword-sets", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<KeywordSetResponse> keywordSets() {
        return resources.keywordSets().stream().map(KeywordSetResponse::from).toList();
    }

    @GetMapping(value = "/keyword-sets/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public KeywordSetResponse keywordSet(@PathVariable String id) {
        return KeywordSetResponse.from(resources.keywordSet(id));
    }

    @PostMapping("/keyword-sets/{id}/enable")
    public KeywordSetResponse enableKeywordSet(@PathVariable String id) {
        return KeywordSetResponse.from(resources.setKeywordSetEnabled(id, true));
    }

    @PostMapping("/keyword-sets/{id}/disable")
    public KeywordSetResponse disableKeywordSet(@PathVariable String id) {
        return KeywordSetResponse.from(resources.setKeywordSetEnabled(id, false));
    }
}
