package com.github.dimitryivaniuta.domainflow.service.error;

/**
 * Campaign parameters rejected at setup time: bad pattern, unknown resources, mismatched source type.
 * A campaign that fails this way never starts.
 */
public class InvalidConfigException extends RuntimeException {

    public InvalidConfigException(String message) {
        super(message);
    }
}
