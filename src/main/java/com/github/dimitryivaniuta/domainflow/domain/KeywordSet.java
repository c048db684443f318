package com.github.dimitryivaniuta.domainflow.domain;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Named, weighted keyword rules scanned for by HTTP validation.
 */
@Entity
@Table(name = "keyword_sets")
@Getter
@Setter
@NoArgsConstructor
public class KeywordSet {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "name", nullable = false, unique = true, length = 255)
    private String name;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "keyword_rules", joinColumns = @JoinColumn(name = "keyword_set_id"))
    @OrderColumn(name = "rule_index")
    private List<KeywordRule> rules = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static KeywordSet create(String name, String description, List<KeywordRule> rules) {
        KeywordSet s = new KeywordSet();
        s.id = UUID.randomUUID().toString();
        s.name = name;
        s.description = description;
        s.rules = new ArrayList<>(rules);
        s.createdAt = Instant.now();
        return s;
    }
}
