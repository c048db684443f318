package com.github.dimitryivaniuta.domainflow.domain;

public enum ProxyProtocol {
    HTTP,
    HTTPS,
    SOCKS5
}
