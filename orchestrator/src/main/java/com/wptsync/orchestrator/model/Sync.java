package com.wptsync.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * One pull request's journey from web-platform-tests into gecko.
 *
 * A Sync is created together with its Bugzilla bug when the PR is opened and
 * is mutated by the orchestrator as processing advances: worktree paths are
 * recorded the first time they are materialized, the state follows
 * {@link SyncStateMachine}, and the last failure is kept for diagnosis.
 *
 * At most one Sync exists per (repository, pr_id, direction).
 *
 * DB table: syncs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "syncs",
       uniqueConstraints = @UniqueConstraint(
               name = "uq_syncs_repository_pr_direction",
               columnNames = {"repository_id", "pr_id", "direction"}))
public class Sync {

    public static final int MAX_ERROR_LENGTH = 65535;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "pr_id", nullable = false, updatable = false)
    private int prId;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR)
    @Column(nullable = false, updatable = false)
    private SyncDirection direction;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "repository_id", nullable = false, updatable = false)
    private GitRepository repository;

    // Bugzilla bug id; set in the same transaction that inserts the row.
    @Column(name = "bug_id")
    private Long bugId;

    // Absolute worktree paths; null until first materialized.
    @Column(name = "upstream_worktree")
    private String upstreamWorktree;

    @Column(name = "downstream_worktree")
    private String downstreamWorktree;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR)
    @Column(nullable = false)
    private SyncState state = SyncState.PENDING_INTAKE;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR)
    @Column(name = "failure_kind")
    private FailureKind failureKind;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Sync() {}   // required by JPA

    public Sync(int prId, SyncDirection direction, GitRepository repository) {
        this.prId       = prId;
        this.direction  = direction;
        this.repository = repository;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()                 { return id; }
    public int           getPrId()               { return prId; }
    public SyncDirection getDirection()          { return direction; }
    public GitRepository getRepository()         { return repository; }
    public Long          getBugId()              { return bugId; }
    public String        getUpstreamWorktree()   { return upstreamWorktree; }
    public String        getDownstreamWorktree() { return downstreamWorktree; }
    public SyncState     getState()              { return state; }
    public FailureKind   getFailureKind()        { return failureKind; }
    public String        getLastError()          { return lastError; }
    public Instant       getCreatedAt()          { return createdAt; }
    public Instant       getUpdatedAt()          { return updatedAt; }

    public void setBugId(Long bugId)             { this.bugId = bugId; }

    /**
     * Move to {@code next}, rejecting edges the state machine does not allow.
     */
    public void advanceTo(SyncState next) {
        this.state = SyncStateMachine.transition(state, next);
    }

    /** Record a failed invocation and move to ERROR. Long messages are cut to fit the column. */
    public void fail(FailureKind kind, String message) {
        advanceTo(SyncState.ERROR);
        this.failureKind = kind;
        this.lastError   = message != null && message.length() > MAX_ERROR_LENGTH
                ? message.substring(0, MAX_ERROR_LENGTH)
                : message;
    }

    /** Clear the previous failure at the start of a new invocation. */
    public void clearFailure() {
        this.failureKind = null;
        this.lastError   = null;
    }

    public String worktreeFor(RepositoryKind kind) {
        return kind == RepositoryKind.UPSTREAM ? upstreamWorktree : downstreamWorktree;
    }

    public void setWorktree(RepositoryKind kind, String path) {
        if (kind == RepositoryKind.UPSTREAM) {
            this.upstreamWorktree = path;
        } else {
            this.downstreamWorktree = path;
        }
    }

    /** Deterministic worktree and branch name for this sync, e.g. "PR_9". */
    public String worktreeName() {
        return "PR_" + prId;
    }
}
