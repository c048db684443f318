package com.github.dimitryivaniuta.domainflow.service.error;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
