package com.wptsync.orchestrator.repository;

import com.wptsync.orchestrator.model.GitRepository;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Lookup of the repositories table by name.
 */
public interface GitRepositoryRepository extends JpaRepository<GitRepository, Long> {

    Optional<GitRepository> findByName(String name);
}
