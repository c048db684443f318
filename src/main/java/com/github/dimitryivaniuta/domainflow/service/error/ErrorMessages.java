package com.github.dimitryivaniuta.domainflow.service.error;

/**
 * Helpers for error strings persisted on jobs, campaigns and results.
 */
public final class ErrorMessages {

    public static final int MAX_LENGTH = 2000;

    private ErrorMessages() {
    }

    /**
     * Message of {@code ex}, or its class name, truncated to {@link #MAX_LENGTH}.
     *
     * @param ex exception
     * @return storable message
     */
    public static String safe(Throwable ex) {
        String msg = ex.getMessage();
        if (msg == null) {
            msg = ex.getClass().getSimpleName();
        }
        return truncate(msg);
    }

    public static String truncate(String msg) {
        if (msg != null && msg.length() > MAX_LENGTH) {
            return msg.substring(0, MAX_LENGTH);
        }
        return msg;
    }
}
