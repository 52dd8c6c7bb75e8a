package com.osint.leadtrace.service.investigation;

import com.osint.leadtrace.dto.InvestigationRunResponse;
import com.osint.leadtrace.dto.QueueSnapshotResponse;
import com.osint.leadtrace.dto.StartInvestigationRequest;
import com.osint.leadtrace.dto.VerificationCheckResponse;
import com.osint.leadtrace.exception.InvalidInvestigationRequestException;
import com.osint.leadtrace.exception.InvestigationRunNotFoundException;
import com.osint.leadtrace.model.InvestigationRun;
import com.osint.leadtrace.model.Project;
import com.osint.leadtrace.repository.InvestigationRunRepository;
import com.osint.leadtrace.service.ProjectService;
import com.osint.leadtrace.service.search.CanonicalValueNormalizer;
import com.osint.leadtrace.service.search.QueryType;
import com.osint.leadtrace.service.search.QueryTypeDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Entry point for investigations: starts runs, reports on them and exposes the
 * scheduler's queue and verification views read-only.
 */
@Service
@Slf4j
public class InvestigationService {

    private final InvestigationRunRepository investigationRunRepository;
    private final ProjectService projectService;
    private final InvestigationRunner investigationRunner;
    private final QueueBuilder queueBuilder;
    private final VerificationEvaluator verificationEvaluator;
    private final QueryTypeDetector queryTypeDetector;
    private final CanonicalValueNormalizer canonicalValueNormalizer;
    private final int defaultMaxDepth;
    private final int maxDepthLimit;
    private final long runTtlHours;

    public InvestigationService(InvestigationRunRepository investigationRunRepository,
                                ProjectService projectService,
                                InvestigationRunner investigationRunner,
                                QueueBuilder queueBuilder,
                                VerificationEvaluator verificationEvaluator,
                                QueryTypeDetector queryTypeDetector,
                                CanonicalValueNormalizer canonicalValueNormalizer,
                                @Value("${leadtrace.investigation.default-max-depth:3}") int defaultMaxDepth,
                                @Value("${leadtrace.investigation.max-depth-limit:10}") int maxDepthLimit,
                                @Value("${leadtrace.investigation.run-ttl-hours:72}") long runTtlHours) {
        this.investigationRunRepository = investigationRunRepository;
        this.projectService = projectService;
        this.investigationRunner = investigationRunner;
        this.queueBuilder = queueBuilder;
        this.verificationEvaluator = verificationEvaluator;
        this.queryTypeDetector = queryTypeDetector;
        this.canonicalValueNormalizer = canonicalValueNormalizer;
        this.defaultMaxDepth = defaultMaxDepth;
        this.maxDepthLimit = maxDepthLimit;
        this.runTtlHours = runTtlHours;
    }

    /**
     * Saves a PENDING run and hands it to the async runner. Returns immediately.
     */
    public InvestigationRunResponse startInvestigation(String projectId, StartInvestigationRequest request) {
        Project project = projectService.findProject(projectId);
        if (project.isArchived()) {
            throw new InvalidInvestigationRequestException("Project is archived: " + projectId);
        }

        String seedQuery = request.getSeedQuery();
        if (seedQuery == null || seedQuery.isBlank()) {
            throw new InvalidInvestigationRequestException("Seed query is required");
        }

        QueryType type = queryTypeDetector.detect(seedQuery);
        String seedValue = canonicalValueNormalizer.normalize(type, queryTypeDetector.extractQueryValue(seedQuery, type));
        if (seedValue.isBlank()) {
            throw new InvalidInvestigationRequestException("Seed query has no searchable value: " + seedQuery);
        }

        int maxDepth = clampDepth(request.getMaxDepth());

        InvestigationRun run = InvestigationRun.builder()
                .projectId(projectId)
                .seedQuery(seedQuery)
                .seedValue(seedValue)
                .seedType(type.name())
                .maxDepth(maxDepth)
                .status(InvestigationRun.Status.PENDING)
                .createdAt(LocalDateTime.now())
                .expiresAt(LocalDateTime.now().plusHours(runTtlHours))
                .build();

        InvestigationRun saved = investigationRunRepository.save(run);
        log.info("Created investigation run {} for project {}: seed={} ({}), maxDepth={}",
                saved.getId(), projectId, seedValue, type, maxDepth);

        investigationRunner.runAsync(saved.getId());

        return toResponse(saved);
    }

    public InvestigationRunResponse getRun(String projectId, String runId) {
        return investigationRunRepository.findByIdAndProjectId(runId, projectId)
                .map(this::toResponse)
                .orElseThrow(() -> new InvestigationRunNotFoundException("Investigation run not found: " + runId));
    }

    public List<InvestigationRunResponse> listRuns(String projectId) {
        projectService.findProject(projectId);
        return investigationRunRepository.findByProjectIdOrderByCreatedAtDesc(projectId).stream()
                .map(this::toResponse)
                .toList();
    }

    public QueueSnapshotResponse previewQueues(String projectId) {
        projectService.findProject(projectId);
        PriorityQueues queues = queueBuilder.build(projectId);
        return QueueSnapshotResponse.builder()
                .projectId(projectId)
                .verifiedQueue(queues.getVerifiedQueue())
                .unverifiedQueue(queues.getUnverifiedQueue())
                .verifiedCount(queues.getVerifiedQueue().size())
                .unverifiedCount(queues.getUnverifiedQueue().size())
                .build();
    }

    public VerificationCheckResponse checkVerification(String projectId, String entityValue) {
        projectService.findProject(projectId);
        if (entityValue == null || entityValue.isBlank()) {
            throw new InvalidInvestigationRequestException("Entity value is required");
        }
        VerificationDecision decision = verificationEvaluator.check(entityValue, projectId);
        return VerificationCheckResponse.builder()
                .projectId(projectId)
                .entityValue(entityValue)
                .shouldUpgrade(decision.isShouldUpgrade())
                .reason(decision.getReason())
                .evidence(decision.getEvidence())
                .build();
    }

    /**
     * Removes run records past their retention. Graph content is kept.
     */
    public int cleanupExpiredRuns() {
        List<InvestigationRun> expired = investigationRunRepository.findByExpiresAtBefore(LocalDateTime.now());
        int count = 0;

        for (InvestigationRun run : expired) {
            if (InvestigationRun.Status.RUNNING.equals(run.getStatus())) {
                continue;
            }
            investigationRunRepository.delete(run);
            count++;
            log.debug("Removed expired investigation run: {}/{}", run.getProjectId(), run.getId());
        }

        if (count > 0) {
            log.info("Cleaned up {} expired investigation runs", count);
        }
        return count;
    }

    int clampDepth(Integer requested) {
        int depth = requested != null ? requested : defaultMaxDepth;
        return Math.max(1, Math.min(depth, maxDepthLimit));
    }

    private InvestigationRunResponse toResponse(InvestigationRun run) {
        return InvestigationRunResponse.builder()
                .id(run.getId())
                .projectId(run.getProjectId())
                .seedQuery(run.getSeedQuery())
                .seedValue(run.getSeedValue())
                .seedType(run.getSeedType())
                .maxDepth(run.getMaxDepth())
                .status(run.getStatus())
                .errorMessage(run.getErrorMessage())
                .summary(run.getSummary())
                .createdAt(run.getCreatedAt())
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .expiresAt(run.getExpiresAt())
                .build();
    }
}
