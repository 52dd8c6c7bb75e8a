package com.osint.leadtrace.scheduler;

import com.osint.leadtrace.service.investigation.InvestigationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Removes investigation run records past their retention, once an hour.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InvestigationRunCleanupScheduler {

    private final InvestigationService investigationService;

    @Scheduled(fixedRate = 3600000) // every hour
    public void cleanupExpiredRuns() {
        log.debug("Running investigation run cleanup...");
        try {
            int cleaned = investigationService.cleanupExpiredRuns();
            if (cleaned > 0) {
                log.info("Investigation run cleanup completed: {} expired runs removed", cleaned);
            }
        } catch (Exception e) {
            log.error("Investigation run cleanup failed: {}", e.getMessage(), e);
        }
    }
}
