package com.docfederation.api;

import com.docfederation.service.EnrollmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for repository enrollment and sync status.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/repositories")
@RequiredArgsConstructor
public class RepositoryController {

    private final EnrollmentService enrollmentService;

    /**
     * Enroll a repository and schedule its first sync.
     *
     * POST /api/v1/repositories
     */
    @PostMapping
    public ResponseEntity<EnrollResponse> enroll(@Valid @RequestBody EnrollRequest request) {
        log.info("Enrolling {}/{}", request.getOwner(), request.getName());
        EnrollResponse response = enrollmentService.enroll(
                request.getOwner(), request.getName(), request.getDefaultBranch());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Enroll a list of repositories, reporting success per repository.
     *
     * POST /api/v1/repositories/bulk
     */
    @PostMapping("/bulk")
    public ResponseEntity<BulkEnrollResponse> enrollAll(@Valid @RequestBody BulkEnrollRequest request) {
        log.info("Bulk enrolling {} repositories ({} excluded)",
                request.getRepositories().size(), request.getExclude() == null ? 0 : request.getExclude().size());
        return ResponseEntity.ok(enrollmentService.enrollAll(
                request.getRepositories(), request.getExclude(), request.getDefaultBranch()));
    }

    @GetMapping
    public ResponseEntity<List<EnrollmentStatusResponse>> list() {
        return ResponseEntity.ok(enrollmentService.list());
    }

    @GetMapping("/{owner}/{name}")
    public ResponseEntity<EnrollmentStatusResponse> get(@PathVariable String owner, @PathVariable String name) {
        return ResponseEntity.ok(enrollmentService.status(owner, name));
    }

    /**
     * Sync status query.
     *
     * GET /api/v1/repositories/{owner}/{name}/status
     */
    @GetMapping("/{owner}/{name}/status")
    public ResponseEntity<EnrollmentStatusResponse> status(@PathVariable String owner, @PathVariable String name) {
        return ResponseEntity.ok(enrollmentService.status(owner, name));
    }

    /**
     * Unenroll: the enrollment is suspended and kept for audit.
     *
     * DELETE /api/v1/repositories/{owner}/{name}
     */
    @DeleteMapping("/{owner}/{name}")
    public ResponseEntity<EnrollmentStatusResponse> unenroll(@PathVariable String owner, @PathVariable String name) {
        log.info("Unenrolling {}/{}", owner, name);
        return ResponseEntity.ok(enrollmentService.unenroll(owner, name));
    }

    /**
     * Manual sync of a commit, or of the branch head when no revision is given.
     *
     * POST /api/v1/repositories/{owner}/{name}/sync?revision=
     */
    @PostMapping("/{owner}/{name}/sync")
    public ResponseEntity<SyncTriggerResponse> sync(@PathVariable String owner,
                                                    @PathVariable String name,
                                                    @RequestParam(required = false) String revision) {
        return ResponseEntity.accepted().body(enrollmentService.triggerSync(owner, name, revision));
    }
}
