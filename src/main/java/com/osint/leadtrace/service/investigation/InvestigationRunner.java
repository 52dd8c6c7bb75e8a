package com.osint.leadtrace.service.investigation;

import com.osint.leadtrace.model.InvestigationRun;
import com.osint.leadtrace.repository.InvestigationRunRepository;
import com.osint.leadtrace.service.graph.IdentityRegistry;
import com.osint.leadtrace.service.search.LookupSearchExecutor;
import com.osint.leadtrace.service.search.LookupSearchExecutorFactory;
import com.osint.leadtrace.service.search.QueryType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Executes a saved {@link InvestigationRun} off the request thread and records its outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvestigationRunner {

    private final InvestigationRunRepository investigationRunRepository;
    private final InvestigationSchedulerFactory schedulerFactory;
    private final LookupSearchExecutorFactory searchExecutorFactory;

    @Async
    public void runAsync(String runId) {
        run(runId);
    }

    /**
     * Synchronous body of {@link #runAsync(String)}.
     */
    public void run(String runId) {
        InvestigationRun run = investigationRunRepository.findById(runId).orElse(null);
        if (run == null) {
            log.error("Investigation run not found: {}", runId);
            return;
        }

        try {
            run.setStatus(InvestigationRun.Status.RUNNING);
            run.setStartedAt(LocalDateTime.now());
            investigationRunRepository.save(run);

            IdentityRegistry registry = new IdentityRegistry();
            LookupSearchExecutor executor = searchExecutorFactory.create(run.getProjectId(), registry);
            if (run.getSeedType() != null) {
                executor.hintType(run.getSeedValue(), QueryType.valueOf(run.getSeedType()));
            }
            InvestigationSummary summary = schedulerFactory.create(executor, registry)
                    .run(run.getSeedValue(), run.getProjectId(), run.getMaxDepth());

            run.setSummary(summary);
            if (summary.isFailed()) {
                run.setStatus(InvestigationRun.Status.FAILED);
                run.setErrorMessage(summary.getError());
                log.warn("Investigation run {} failed: {}", runId, summary.getError());
            } else {
                run.setStatus(InvestigationRun.Status.COMPLETED);
                log.info("Investigation run {} completed: {} searches, {} upgraded, depth {}",
                        runId, summary.getTotalSearches(), summary.getUpgradedCount(), summary.getFinalDepth());
            }
        } catch (Exception e) {
            log.error("Investigation run {} failed: {}", runId, e.getMessage(), e);
            run.setStatus(InvestigationRun.Status.FAILED);
            run.setErrorMessage(e.getMessage());
        }

        run.setCompletedAt(LocalDateTime.now());
        investigationRunRepository.save(run);
    }
}
