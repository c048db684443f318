package com.github.dimitryivaniuta.domainflow.service.error;

/**
 * No persona or proxy in a campaign's pool is currently usable.
 */
public class ResourcePoolExhaustedException extends RuntimeException {

    public ResourcePoolExhaustedException(String message) {
        super(message);
    }
}
