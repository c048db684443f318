package com.github.dimitryivaniuta.domainflow.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.NoArgsConstructor;

/**
 * DNS validation parameters. The source stage is always domain generation.
 */
@Entity
@Table(name = "dns_validation_params")
@NoArgsConstructor
public class DnsValidationParams extends ValidationParams {
}
