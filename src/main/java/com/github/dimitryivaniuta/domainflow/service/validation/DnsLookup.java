package com.github.dimitryivaniuta.domainflow.service.validation;

import java.util.List;

/**
 * Answer to a DNS query that completed at the transport level.
 *
 * @param resolved  true when at least one address record came back
 * @param addresses A/AAAA record values
 * @param resolver  resolver(s) queried
 */
public record DnsLookup(boolean resolved, List<String> addresses, String resolver) {

    public DnsLookup {
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
    }
}
