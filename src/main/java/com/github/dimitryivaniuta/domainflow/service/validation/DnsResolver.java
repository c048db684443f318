package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.domain.persona.DnsPersonaConfig;
import java.time.Duration;

/**
 * Resolves domains on behalf of a DNS persona.
 */
public interface DnsResolver {

    /**
     * Queries the persona's record types for {@code domain}.
     *
     * @param domain  domain name
     * @param persona persona config (resolvers, record types)
     * @param timeout per-query timeout
     * @return lookup answer; a non-existent name is an unresolved answer, not an error
     * @throws com.github.dimitryivaniuta.domainflow.service.error.TransportException when no answer was obtained
     */
    DnsLookup lookup(String domain, DnsPersonaConfig persona, Duration timeout);
}
