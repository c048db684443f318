package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.domain.Proxy;
import java.time.Duration;
import java.util.Map;

/**
 * One HTTP GET as issued by the validation stage or a health probe.
 *
 * @param url             target URL
 * @param userAgent       User-Agent header, null for the client default
 * @param headers         extra headers
 * @param timeout         connect and response timeout
 * @param followRedirects whether to follow redirects
 * @param maxRedirects    redirect limit
 * @param proxy           proxy to route through, null for direct
 * @param maxBodyBytes    body read limit
 */
public record FetchRequest(
        String url,
        String userAgent,
        Map<String, String> headers,
        Duration timeout,
        boolean followRedirects,
        int maxRedirects,
        Proxy proxy,
        int maxBodyBytes
) {

    public FetchRequest {
        headers = headers == null ? Map.of() : headers;
    }
}
