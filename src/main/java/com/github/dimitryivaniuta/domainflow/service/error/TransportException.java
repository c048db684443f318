package com.github.dimitryivaniuta.domainflow.service.error;

/**
 * A single DNS or HTTP attempt failed below the business level. Consumes one retry.
 *
 * <p>{@link #isResourceFault()} tells whether the persona or proxy used for the attempt is to blame
 * (unreachable proxy, failed proxy handshake, dead resolver) or the target itself (unknown host,
 * refused connection at the origin, redirect loop). Only resource faults count against a resource's
 * circuit breaker.</p>
 */
public class TransportException extends RuntimeException {

    private final boolean timedOut;
    private final boolean resourceFault;

    public TransportException(String message, boolean timedOut, boolean resourceFault, Throwable cause) {
        super(message, cause);
        this.timedOut = timedOut;
        this.resourceFault = resourceFault;
    }

    public TransportException(String message, boolean timedOut, Throwable cause) {
        this(message, timedOut, true, cause);
    }

    public TransportException(String message, boolean timedOut) {
        this(message, timedOut, true, null);
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isResourceFault() {
        return resourceFault;
    }
}
