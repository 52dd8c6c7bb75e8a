package com.osint.leadtrace.controller;

import com.osint.leadtrace.dto.InvestigationRunResponse;
import com.osint.leadtrace.dto.QueueSnapshotResponse;
import com.osint.leadtrace.dto.StartInvestigationRequest;
import com.osint.leadtrace.dto.VerificationCheckResponse;
import com.osint.leadtrace.service.investigation.InvestigationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for recursive investigations of a project.
 */
@RestController
@RequestMapping("/api/projects/{projectId}")
@RequiredArgsConstructor
@Slf4j
public class InvestigationController {

    private final InvestigationService investigationService;

    /**
     * Start an investigation from a seed query.
     * Returns immediately with PENDING status; the run proceeds asynchronously.
     */
    @PostMapping("/investigations")
    public ResponseEntity<InvestigationRunResponse> startInvestigation(
            @PathVariable String projectId,
            @Valid @RequestBody StartInvestigationRequest request) {
        log.info("Starting investigation for project: {}, seed: {}", projectId, request.getSeedQuery());
        InvestigationRunResponse response = investigationService.startInvestigation(projectId, request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping("/investigations")
    public ResponseEntity<List<InvestigationRunResponse>> listInvestigations(@PathVariable String projectId) {
        return ResponseEntity.ok(investigationService.listRuns(projectId));
    }

    @GetMapping("/investigations/{runId}")
    public ResponseEntity<InvestigationRunResponse> getInvestigation(
            @PathVariable String projectId,
            @PathVariable String runId) {
        return ResponseEntity.ok(investigationService.getRun(projectId, runId));
    }

    /**
     * Queues the next investigation depth would work, without searching anything.
     */
    @GetMapping("/queues")
    public ResponseEntity<QueueSnapshotResponse> previewQueues(@PathVariable String projectId) {
        return ResponseEntity.ok(investigationService.previewQueues(projectId));
    }

    @GetMapping("/verification")
    public ResponseEntity<VerificationCheckResponse> checkVerification(
            @PathVariable String projectId,
            @RequestParam String value) {
        return ResponseEntity.ok(investigationService.checkVerification(projectId, value));
    }
}
