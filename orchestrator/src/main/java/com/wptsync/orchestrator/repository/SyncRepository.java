package com.wptsync.orchestrator.repository;

import com.wptsync.orchestrator.model.GitRepository;
import com.wptsync.orchestrator.model.Sync;
import com.wptsync.orchestrator.model.SyncDirection;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + lookup queries for the syncs table.
 */
public interface SyncRepository extends JpaRepository<Sync, UUID> {

    boolean existsByRepositoryAndPrIdAndDirection(GitRepository repository,
                                                  int prId,
                                                  SyncDirection direction);

    /**
     * Load a sync and hold its row lock until the surrounding transaction ends.
     *
     * Every orchestrator and status-reactor invocation goes through this
     * query, so two invocations for the same sync serialize here: the second
     * one blocks until the first commits and then sees the updated worktree.
     * Must be called inside a @Transactional method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT s FROM Sync s
            WHERE s.repository.name = :repositoryName
              AND s.prId = :prId
              AND s.direction = :direction
            """)
    Optional<Sync> lockByPr(@Param("repositoryName") String repositoryName,
                            @Param("prId") int prId,
                            @Param("direction") SyncDirection direction);

    @Query("""
            SELECT s FROM Sync s
            WHERE s.repository.name = :repositoryName
              AND s.prId = :prId
              AND s.direction = :direction
            """)
    Optional<Sync> findByPr(@Param("repositoryName") String repositoryName,
                            @Param("prId") int prId,
                            @Param("direction") SyncDirection direction);
}
