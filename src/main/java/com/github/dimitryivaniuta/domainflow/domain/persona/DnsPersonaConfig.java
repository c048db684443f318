package com.github.dimitryivaniuta.domainflow.domain.persona;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.github.dimitryivaniuta.domainflow.domain.PersonaType;
import java.util.List;
import java.util.Locale;

/**
 * DNS persona: which resolvers to ask, for which record types, and how long to wait.
 *
 * @param resolvers           resolver addresses ({@code host} or {@code host:port}); empty means the system resolver
 * @param recordTypes         record types to query, {@code A} and/or {@code AAAA}
 * @param queryTimeoutSeconds per-query timeout; 0 falls back to the campaign timeout
 */
public record DnsPersonaConfig(
        List<String> resolvers,
        List<String> recordTypes,
        int queryTimeoutSeconds
) implements PersonaConfig {

    public DnsPersonaConfig {
        resolvers = resolvers == null ? List.of() : List.copyOf(resolvers);
        recordTypes = recordTypes == null || recordTypes.isEmpty()
                ? List.of("A")
                : recordTypes.stream().map(t -> t.trim().toUpperCase(Locale.ROOT)).toList();
    }

    @Override
    @JsonIgnore
    public PersonaType personaType() {
        return PersonaType.DNS;
    }

    @Override
    public String validate() {
        for (String t : recordTypes) {
            if (!"A".equals(t) && !"AAAA".equals(t)) {
                return "unsupported DNS record type: " + t;
            }
        }
        if (queryTimeoutSeconds < 0) {
            return "queryTimeoutSeconds must be >= 0";
        }
        for (String r : resolvers) {
            if (r == null || r.isBlank()) {
                return "resolver address must not be blank";
            }
        }
        return null;
    }
}
