package com.github.dimitryivaniuta.domainflow.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Request payload for a proxy.
 *
 * @param address  {@code host:port}
 * @param protocol {@code http}, {@code https} or {@code socks5}
 */
public record CreateProxyRequest(
        @NotBlank String name,
        @NotBlank @Pattern(regexp = "^[^\\s:]+:\\d{1,5}$", message = "must be host:port") String address,
        @NotBlank String protocol
) {}
