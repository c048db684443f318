package com.github.dimitryivaniuta.domainflow.service.validation;

/**
 * Fetches pages for HTTP validation.
 */
public interface HttpFetcher {

    /**
     * Executes the request.
     *
     * @param request request
     * @return response, whatever its status code
     * @throws com.github.dimitryivaniuta.domainflow.service.error.TransportException when no response was obtained
     */
    FetchResult fetch(FetchRequest request);
}
