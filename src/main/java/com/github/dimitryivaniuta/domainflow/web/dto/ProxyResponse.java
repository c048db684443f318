package com.github.dimitryivaniuta.domainflow.web.dto;

import com.github.dimitryivaniuta.domainflow.domain.Proxy;

public record ProxyResponse(
        String proxyId,
        String name,
        String address,
        String protocol,
        boolean enabled,
        HealthResponse health
) {
    public static ProxyResponse from(Proxy p) {
        return new ProxyResponse(p.getId(), p.getName(), p.getAddress(), p.getProtocol().name(), p.isEnabled(),
                HealthResponse.from(p.getHealth()));
    }
}
