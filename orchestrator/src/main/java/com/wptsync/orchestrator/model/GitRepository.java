package com.wptsync.orchestrator.model;

import jakarta.persistence.*;

/**
 * A named repository known to the sync service (e.g. "web-platform-tests", "gecko").
 *
 * Rows are immutable once created and looked up by name.
 *
 * DB table: repositories  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "repositories")
public class GitRepository {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, updatable = false)
    private String name;

    protected GitRepository() {}   // required by JPA

    public GitRepository(String name) {
        this.name = name;
    }

    public Long   getId()   { return id; }
    public String getName() { return name; }
}
