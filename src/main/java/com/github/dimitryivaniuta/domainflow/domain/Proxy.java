package com.github.dimitryivaniuta.domainflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Outbound proxy for HTTP checks. Credentials are out of scope; only open or IP-allowlisted
 * proxies are supported.
 */
@Entity
@Table(name = "proxies")
@Getter
@Setter
@NoArgsConstructor
public class Proxy implements PooledResource {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    /**
     * {@code host:port}.
     */
    @Column(name = "address", nullable = false, length = 255)
    private String address;

    @Enumerated(EnumType.STRING)
    @Column(name = "protocol", nullable = false, length = 8)
    private ProxyProtocol protocol;

    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    @Embedded
    private ResourceHealth health = new ResourceHealth();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static Proxy create(String name, String address, ProxyProtocol protocol) {
        Proxy p = new Proxy();
        p.id = UUID.randomUUID().toString();
        p.name = name;
        p.address = address;
        p.protocol = protocol;
        p.createdAt = Instant.now();
        p.updatedAt = p.createdAt;
        return p;
    }

    public String host() {
        int idx = address.lastIndexOf(':');
        return idx < 0 ? address : address.substring(0, idx);
    }

    public int port() {
        int idx = address.lastIndexOf(':');
        if (idx < 0) {
            return protocol == ProxyProtocol.SOCKS5 ? 1080 : 8080;
        }
        return Integer.parseInt(address.substring(idx + 1));
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.PROXY;
    }
}
