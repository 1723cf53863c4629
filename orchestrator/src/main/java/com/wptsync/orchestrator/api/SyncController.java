package com.wptsync.orchestrator.api;

import com.wptsync.orchestrator.api.dto.OutcomeResponse;
import com.wptsync.orchestrator.api.dto.PullRequestOpenedRequest;
import com.wptsync.orchestrator.api.dto.StatusRequest;
import com.wptsync.orchestrator.api.dto.SyncResponse;
import com.wptsync.orchestrator.api.dto.TryPushResponse;
import com.wptsync.orchestrator.bugzilla.BugzillaException;
import com.wptsync.orchestrator.buildtool.BuildToolException;
import com.wptsync.orchestrator.command.CommandTimeoutException;
import com.wptsync.orchestrator.service.CiStatusReactor;
import com.wptsync.orchestrator.service.DuplicateSyncException;
import com.wptsync.orchestrator.service.SyncException;
import com.wptsync.orchestrator.service.SyncIntakeService;
import com.wptsync.orchestrator.service.SyncNotFoundException;
import com.wptsync.orchestrator.service.SyncOrchestrator;
import com.wptsync.orchestrator.service.SyncService;
import com.wptsync.orchestrator.trypush.TryPushService;
import com.wptsync.orchestrator.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for downstream syncs.
 *
 * POST   /syncs                      : a wpt PR was opened; create its sync and bug
 * POST   /syncs/{prId}/status        : CI status changed for the PR
 * POST   /syncs/{prId}/update        : re-run the sync now
 * GET    /syncs/{prId}               : current state of the sync
 * DELETE /syncs/{prId}/workspaces    : remove the sync's worktrees
 * POST   /syncs/{prId}/try           : push the gecko branch to try
 */
@RestController
@RequestMapping("/syncs")
public class SyncController {

    private static final Logger log = LoggerFactory.getLogger(SyncController.class);

    private final SyncIntakeService intake;
    private final CiStatusReactor   reactor;
    private final SyncOrchestrator  orchestrator;
    private final SyncService       syncService;
    private final TryPushService    tryPush;

    public SyncController(SyncIntakeService intake,
                          CiStatusReactor reactor,
                          SyncOrchestrator orchestrator,
                          SyncService syncService,
                          TryPushService tryPush) {
        this.intake       = intake;
        this.reactor      = reactor;
        this.orchestrator = orchestrator;
        this.syncService  = syncService;
        this.tryPush      = tryPush;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/syncs \
     *     -H "Content-Type: application/json" \
     *     -d '{"number":9,"title":"Test PR","body":"blah blah body"}'
     */
    @PostMapping
    public ResponseEntity<SyncResponse> open(@RequestBody PullRequestOpenedRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SyncResponse.from(intake.newPullRequest(req.toEvent())));
    }

    /**
     * Always 200 once the event is accepted; a failed sync run is reported
     * in the body, not as an HTTP error.
     */
    @PostMapping("/{prId}/status")
    public OutcomeResponse status(@PathVariable int prId, @RequestBody StatusRequest req) {
        return OutcomeResponse.from(reactor.onStatus(prId, req.toEvent()));
    }

    @PostMapping("/{prId}/update")
    public OutcomeResponse update(@PathVariable int prId) {
        return OutcomeResponse.from(orchestrator.run(prId));
    }

    @GetMapping("/{prId}")
    public SyncResponse get(@PathVariable int prId) {
        return syncService.find(prId)
                .map(SyncResponse::from)
                .orElseThrow(() -> new SyncNotFoundException(prId));
    }

    @DeleteMapping("/{prId}/workspaces")
    public ResponseEntity<Void> removeWorkspaces(@PathVariable int prId) {
        syncService.removeWorkspaces(prId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{prId}/try")
    public TryPushResponse pushToTry(@PathVariable int prId) {
        return TryPushResponse.from(tryPush.push(prId));
    }

    // ------------------------------------------------------------------
    // Error mapping
    // ------------------------------------------------------------------

    @ExceptionHandler(SyncNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(SyncNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(DuplicateSyncException.class)
    public ResponseEntity<Map<String, String>> duplicate(DuplicateSyncException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(SyncException.class)
    public ResponseEntity<Map<String, String>> syncFailure(SyncException e) {
        log.error("Sync request failed ({}): {}", e.getKind(), e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("kind", e.getKind().name(), "error", e.getMessage()));
    }

    @ExceptionHandler({BugzillaException.class, VcsException.class, BuildToolException.class})
    public ResponseEntity<Map<String, String>> upstreamFailure(RuntimeException e) {
        log.error("External tool failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(CommandTimeoutException.class)
    public ResponseEntity<Map<String, String>> timeout(CommandTimeoutException e) {
        log.error("External tool timed out: {}", e.getMessage());
        return error(HttpStatus.GATEWAY_TIMEOUT, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? "" : message));
    }
}
