package com.github.dimitryivaniuta.domainflow.service.resource;

import com.github.dimitryivaniuta.domainflow.domain.KeywordRule;
import com.github.dimitryivaniuta.domainflow.domain.KeywordRuleType;
import com.github.dimitryivaniuta.domainflow.domain.KeywordSet;
import com.github.dimitryivaniuta.domainflow.domain.Persona;
import com.github.dimitryivaniuta.domainflow.domain.PersonaType;
import com.github.dimitryivaniuta.domainflow.domain.Proxy;
import com.github.dimitryivaniuta.domainflow.domain.ProxyProtocol;
import com.github.dimitryivaniuta.domainflow.domain.persona.PersonaConfig;
import com.github.dimitryivaniuta.domainflow.repo.KeywordSetRepository;
import com.github.dimitryivaniuta.domainflow.repo.PersonaRepository;
import com.github.dimitryivaniuta.domainflow.repo.ProxyRepository;
import com.github.dimitryivaniuta.domainflow.service.error.InvalidConfigException;
import com.github.dimitryivaniuta.domainflow.service.error.ResourceNotFoundException;
import com.github.dimitryivaniuta.domainflow.web.dto.CreateKeywordSetRequest;
import com.github.dimitryivaniuta.domainflow.web.dto.CreatePersonaRequest;
import com.github.dimitryivaniuta.domainflow.web.dto.CreateProxyRequest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Registration and enablement of personas, proxies and keyword sets.
 */
@Service
public class ResourceAdminService {

    private static final Logger log = LoggerFactory.getLogger(ResourceAdminService.class);

    private static final Sort BY_NAME = Sort.by("name");

    private final PersonaRepository personaRepository;
    private final ProxyRepository proxyRepository;
    private final KeywordSetRepository keywordSetRepository;

    public ResourceAdminService(PersonaRepository personaRepository,
                                ProxyRepository proxyRepository,
                                KeywordSetRepository keywordSetRepository) {
        this.personaRepository = personaRepository;
        this.proxyRepository = proxyRepository;
        this.keywordSetRepository = keywordSetRepository;
    }

    /**
     * Registers a persona. The declared type must match the config variant.
     *
     * @param request persona payload
     * @return saved persona
     * @throws InvalidConfigException when the type is unknown or the config is invalid
     */
    @Transactional
    public Persona createPersona(CreatePersonaRequest request) {
        PersonaType declared = parsePersonaType(request.personaType());
        PersonaConfig config = request.config();
        if (config.personaType() != declared) {
            throw new InvalidConfigException("personaType " + declared + " does not match config of type " + config.personaType());
        }
        String problem = config.validate();
        if (problem != null) {
            throw new InvalidConfigException(problem);
        }
        Persona persona = personaRepository.save(Persona.create(request.name().trim(), config));
        log.info("Registered {} persona {} ({})", declared, persona.getId(), persona.getName());
        return persona;
    }

    @Transactional
    public Proxy createProxy(CreateProxyRequest request) {
        ProxyProtocol protocol = parseProtocol(request.protocol());
        String address = request.address().trim();
        int colon = address.lastIndexOf(':');
        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new InvalidConfigException("Proxy address must be host:port, was " + address);
        }
        if (colon <= 0 || port < 1 || port > 65535) {
            throw new InvalidConfigException("Proxy port out of range: " + port);
        }
        Proxy proxy = proxyRepository.save(Proxy.create(request.name().trim(), address, protocol));
        log.info("Registered {} proxy {} at {}", protocol, proxy.getId(), proxy.getAddress());
        return proxy;
    }

    /**
     * Registers a keyword set. Regex rules are compiled here so a bad pattern is rejected up front.
     *
     * @param request keyword set payload
     * @return saved set
     */
    @Transactional
    public KeywordSet createKeywordSet(CreateKeywordSetRequest request) {
        List<KeywordRule> rules = new ArrayList<>(request.rules().size());
        for (CreateKeywordSetRequest.KeywordRuleRequest r : request.rules()) {
            KeywordRuleType type = parseRuleType(r.ruleType());
            if (type == KeywordRuleType.REGEX) {
                try {
                    Pattern.compile(r.pattern());
                } catch (PatternSyntaxException e) {
                    throw new InvalidConfigException("Invalid regex '" + r.pattern() + "': " + e.getDescription());
                }
            }
            double weight = r.weight() == null ? 1.0d : r.weight();
            if (weight < 0 || Double.isNaN(weight) || Double.isInfinite(weight)) {
                throw new InvalidConfigException("Keyword weight must be a non-negative number: " + r.weight());
            }
            rules.add(new KeywordRule(r.pattern(), type, weight, r.active() == null || r.active()));
        }
        KeywordSet set = keywordSetRepository.save(KeywordSet.create(request.name().trim(), request.description(), rules));
        log.info("Registered keyword set {} ({}) with {} rules", set.getId(), set.getName(), rules.size());
        return set;
    }

    @Transactional(readOnly = true)
    public List<Persona> personas() {
        return personaRepository.findAll(BY_NAME);
    }

    @Transactional(readOnly = true)
    public List<Proxy> proxies() {
        return proxyRepository.findAll(BY_NAME);
    }

    @Transactional(readOnly = true)
    public List<KeywordSet> keywordSets() {
        return keywordSetRepository.findAll(BY_NAME);
    }

    @Transactional(readOnly = true)
    public Persona persona(String id) {
        return personaRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Persona", id));
    }

    @Transactional(readOnly = true)
    public Proxy proxy(String id) {
        return proxyRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Proxy", id));
    }

    @Transactional(readOnly = true)
    public KeywordSet keywordSet(String id) {
        return keywordSetRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Keyword set", id));
    }

    /**
     * Enables or disables a persona. Disabled personas are skipped by pools built afterwards.
     */
    @Transactional
    public Persona setPersonaEnabled(String id, boolean enabled) {
        Persona p = persona(id);
        p.setEnabled(enabled);
        p.setUpdatedAt(Instant.now());
        log.info("Persona {} {}", id, enabled ? "enabled" : "disabled");
        return p;
    }

    @Transactional
    public Proxy setProxyEnabled(String id, boolean enabled) {
        Proxy p = proxy(id);
        p.setEnabled(enabled);
        p.setUpdatedAt(Instant.now());
        log.info("Proxy {} {}", id, enabled ? "enabled" : "disabled");
        return p;
    }

    @Transactional
    public KeywordSet setKeywordSetEnabled(String id, boolean enabled) {
        KeywordSet s = keywordSet(id);
        s.setEnabled(enabled);
        return s;
    }

    static PersonaType parsePersonaType(String raw) {
        try {
            return PersonaType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("personaType must be dns or http, was " + raw);
        }
    }

    static ProxyProtocol parseProtocol(String raw) {
        try {
            return ProxyProtocol.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("protocol must be http, https or socks5, was " + raw);
        }
    }

    static KeywordRuleType parseRuleType(String raw) {
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return KeywordRuleType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("ruleType must be string, regex or case_insensitive, was " + raw);
        }
    }
}
