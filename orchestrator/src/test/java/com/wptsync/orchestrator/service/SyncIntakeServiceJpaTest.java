package com.wptsync.orchestrator.service;

import com.wptsync.orchestrator.bugzilla.BugTracker;
import com.wptsync.orchestrator.bugzilla.BugzillaException;
import com.wptsync.orchestrator.event.ChangeRequestEvent;
import com.wptsync.orchestrator.model.FailureKind;
import com.wptsync.orchestrator.model.GitRepository;
import com.wptsync.orchestrator.model.Sync;
import com.wptsync.orchestrator.model.SyncDirection;
import com.wptsync.orchestrator.model.SyncState;
import com.wptsync.orchestrator.repository.GitRepositoryRepository;
import com.wptsync.orchestrator.repository.SyncRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * SyncIntakeService against an embedded database built by the Flyway
 * migrations, with Hibernate validating the entities against that schema.
 * H2 runs in PostgreSQL mode so the production DDL is used as is.
 *
 * The test itself runs outside a transaction so the service commits or rolls
 * back on its own, exactly as it does behind the REST endpoint.
 */
@DataJpaTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:wptsync;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.flyway.enabled=true",
        "spring.jpa.hibernate.ddl-auto=validate"
})
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(SyncIntakeService.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class SyncIntakeServiceJpaTest {

    @Autowired SyncIntakeService       intake;
    @Autowired SyncRepository          syncRepo;
    @Autowired GitRepositoryRepository repositoryRepo;
    @MockitoBean BugTracker            bugTracker;

    // The repository rows come from the migration and are shared by every test.
    @AfterEach
    void cleanUp() {
        syncRepo.deleteAll();
    }

    @Test
    void migration_seedsBothRepositories() {
        assertThat(repositoryRepo.findAll())
                .extracting(GitRepository::getName)
                .containsExactlyInAnyOrder("web-platform-tests", "gecko");
    }

    @Test
    void newPullRequest_persistsSyncWithBug() {
        when(bugTracker.create(anyString(), anyString(), anyString(), anyString())).thenReturn(1500L);

        intake.newPullRequest(new ChangeRequestEvent(9, "Test PR", "blah blah body"));

        Sync stored = syncRepo.findByPr("web-platform-tests", 9, SyncDirection.DOWNSTREAM).orElseThrow();
        assertThat(stored.getBugId()).isEqualTo(1500L);
        assertThat(stored.getId()).isNotNull();
    }

    @Test
    void newPullRequest_bugzillaFails_leavesNoSyncRow() {
        when(bugTracker.create(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new BugzillaException("create bug failed: HTTP 500"));

        assertThatThrownBy(() -> intake.newPullRequest(new ChangeRequestEvent(9, "Test PR", "")))
                .isInstanceOf(BugzillaException.class);

        assertThat(syncRepo.count()).isZero();
    }

    @Test
    void newPullRequest_twice_secondIsDuplicate() {
        when(bugTracker.create(anyString(), anyString(), anyString(), anyString())).thenReturn(1500L);
        intake.newPullRequest(new ChangeRequestEvent(9, "Test PR", ""));

        assertThatThrownBy(() -> intake.newPullRequest(new ChangeRequestEvent(9, "Test PR", "")))
                .isInstanceOf(DuplicateSyncException.class);

        assertThat(syncRepo.count()).isEqualTo(1);
        verify(bugTracker, times(1)).create(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    void failedSync_storesStateAndLongError() {
        when(bugTracker.create(anyString(), anyString(), anyString(), anyString())).thenReturn(1500L);
        intake.newPullRequest(new ChangeRequestEvent(9, "Test PR", ""));

        Sync sync = syncRepo.findByPr("web-platform-tests", 9, SyncDirection.DOWNSTREAM).orElseThrow();
        sync.fail(FailureKind.PATCH_APPLY_FAILURE, "x".repeat(Sync.MAX_ERROR_LENGTH + 100));
        syncRepo.save(sync);

        Sync stored = syncRepo.findByPr("web-platform-tests", 9, SyncDirection.DOWNSTREAM).orElseThrow();
        assertThat(stored.getState()).isEqualTo(SyncState.ERROR);
        assertThat(stored.getFailureKind()).isEqualTo(FailureKind.PATCH_APPLY_FAILURE);
        assertThat(stored.getLastError()).hasSize(Sync.MAX_ERROR_LENGTH);
    }
}
