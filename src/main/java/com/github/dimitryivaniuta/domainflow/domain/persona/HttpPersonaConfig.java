package com.github.dimitryivaniuta.domainflow.domain.persona;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.github.dimitryivaniuta.domainflow.domain.PersonaType;
import java.util.List;
import java.util.Map;

/**
 * HTTP persona: the client identity presented to validated sites.
 *
 * @param userAgent             User-Agent header; blank uses the configured default
 * @param headers               extra request headers
 * @param allowedStatusCodes    status codes treated as a normal page; empty means any 2xx
 * @param requestTimeoutSeconds per-request timeout; 0 falls back to the campaign timeout
 * @param followRedirects       null defers to the campaign setting
 */
public record HttpPersonaConfig(
        String userAgent,
        Map<String, String> headers,
        List<Integer> allowedStatusCodes,
        int requestTimeoutSeconds,
        Boolean followRedirects
) implements PersonaConfig {

    public HttpPersonaConfig {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        allowedStatusCodes = allowedStatusCodes == null ? List.of() : List.copyOf(allowedStatusCodes);
    }

    @Override
    @JsonIgnore
    public PersonaType personaType() {
        return PersonaType.HTTP;
    }

    @Override
    public String validate() {
        if (requestTimeoutSeconds < 0) {
            return "requestTimeoutSeconds must be >= 0";
        }
        for (Integer code : allowedStatusCodes) {
            if (code == null || code < 100 || code > 599) {
                return "invalid allowed status code: " + code;
            }
        }
        return null;
    }

    /**
     * Whether a response status counts as a normal page for this persona.
     *
     * @param status HTTP status
     * @return true when allowed
     */
    public boolean allowsStatus(int status) {
        if (allowedStatusCodes.isEmpty()) {
            return status >= 200 && status < 300;
        }
        return allowedStatusCodes.contains(status);
    }
}
