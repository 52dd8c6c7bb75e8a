package com.osint.leadtrace.service.investigation;

import com.osint.leadtrace.service.graph.IdentityRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedList;
import java.util.List;

/**
 * Depth-bounded driver of a recursive investigation.
 *
 * Each depth rebuilds the queues from the current graph. VERIFIED leads are searched
 * first; UNVERIFIED leads are only worked in a depth whose VERIFIED queue was empty.
 * An UNVERIFIED lead that gains corroboration during that pass is promoted, and all
 * promotions of the pass are searched again (last promoted first) before the next
 * depth starts.
 *
 * Single-threaded and synchronous: every step reads the graph written by the step
 * before it. One instance serves one run.
 */
@Slf4j
public class InvestigationScheduler {

    private final QueueBuilder queueBuilder;
    private final SequenceTagger sequenceTagger;
    private final VerificationEvaluator verificationEvaluator;
    private final PromotionApplier promotionApplier;
    private final SearchedMarker searchedMarker;
    private final SearchExecutor searchExecutor;
    private final IdentityRegistry registry;

    public InvestigationScheduler(QueueBuilder queueBuilder,
                                  SequenceTagger sequenceTagger,
                                  VerificationEvaluator verificationEvaluator,
                                  PromotionApplier promotionApplier,
                                  SearchedMarker searchedMarker,
                                  SearchExecutor searchExecutor,
                                  IdentityRegistry registry) {
        if (searchExecutor == null) {
            throw new IllegalArgumentException("searchExecutor must be provided");
        }
        this.queueBuilder = queueBuilder;
        this.sequenceTagger = sequenceTagger;
        this.verificationEvaluator = verificationEvaluator;
        this.promotionApplier = promotionApplier;
        this.searchedMarker = searchedMarker;
        this.searchExecutor = searchExecutor;
        this.registry = registry != null ? registry : new IdentityRegistry();
    }

    /**
     * Never throws. A failed seed search yields a summary with zero counts and
     * {@code error} set.
     */
    public InvestigationSummary run(String seedQuery, String projectId, int maxDepth) {
        InvestigationSummary summary = new InvestigationSummary();

        log.info("Recursive investigation started: seed={}, project={}, maxDepth={}", seedQuery, projectId, maxDepth);

        try {
            searchExecutor.search(seedQuery);
            summary.setTotalSearches(1);
        } catch (RuntimeException e) {
            log.error("Seed search failed for {}: {}", seedQuery, e.getMessage(), e);
            summary.setError("seed_search_failed: " + e.getMessage());
            return summary;
        }
        searchedMarker.markSearched(projectId, seedQuery, registry);

        int depth = 1;
        try {
            while (depth <= maxDepth) {
                log.info("[Depth {}] Building priority queues...", depth);
                PriorityQueues queues = queueBuilder.build(projectId, registry);

                if (queues.isEmpty()) {
                    log.info("No more entities to search. Stopping at depth {}", depth);
                    break;
                }

                if (!queues.getVerifiedQueue().isEmpty()) {
                    runVerifiedPhase(queues.getVerifiedQueue(), projectId, depth, summary);
                } else {
                    List<String> newlyVerified = runUnverifiedPhase(queues.getUnverifiedQueue(), projectId, depth, summary);
                    runCascade(newlyVerified, projectId, depth, summary);
                }

                depth++;
            }
        } catch (RuntimeException e) {
            log.error("Investigation aborted at depth {}: {}", depth, e.getMessage(), e);
            summary.setError("aborted_at_depth_" + depth + ": " + e.getMessage());
        }

        summary.setFinalDepth(depth - 1);
        log.info("Recursive investigation complete: total={}, verified={}, unverified={}, upgraded={}, finalDepth={}",
                summary.getTotalSearches(), summary.getVerifiedSearches(), summary.getUnverifiedSearches(),
                summary.getUpgradedCount(), summary.getFinalDepth());
        return summary;
    }

    private void runVerifiedPhase(List<String> verifiedQueue, String projectId, int depth, InvestigationSummary summary) {
        log.info("[Depth {}] VERIFIED queue: {} entities", depth, verifiedQueue.size());
        for (String entity : verifiedQueue) {
            log.info("Searching VERIFIED entity: {}", entity);
            if (searchVerified(entity, projectId, summary)) {
                summary.setVerifiedSearches(summary.getVerifiedSearches() + 1);
            }
        }
    }

    /**
     * @return entities promoted in this pass, most recent first
     */
    private List<String> runUnverifiedPhase(List<UnverifiedLead> unverifiedQueue, String projectId, int depth,
                                            InvestigationSummary summary) {
        log.info("[Depth {}] UNVERIFIED queue: {} entities", depth, unverifiedQueue.size());
        LinkedList<String> newlyVerified = new LinkedList<>();

        for (UnverifiedLead lead : unverifiedQueue) {
            String entity = lead.getEntityValue();
            String newTag = sequenceTagger.increment(entity, lead.getTag());
            log.info("Searching UNVERIFIED entity: {} (tag: {} -> {})", entity, lead.getTag(), newTag);
            sequenceTagger.applyTag(projectId, entity, lead.getTag(), newTag);

            if (!searchSafely(entity, summary)) {
                continue;
            }
            summary.setTotalSearches(summary.getTotalSearches() + 1);
            summary.setUnverifiedSearches(summary.getUnverifiedSearches() + 1);

            VerificationDecision decision = verificationEvaluator.check(entity, projectId, registry);
            if (!decision.isShouldUpgrade()) {
                log.info("Remains UNVERIFIED: {} ({})", entity, decision.getReason());
                summary.getDiagnostics().add(entity + ": " + decision.getReason());
                continue;
            }

            PromotionResult result = promotionApplier.apply(entity, projectId, decision.getReason(), registry);
            if (!result.isSuccess()) {
                summary.getDiagnostics().add(entity + ": promotion_failed");
                continue;
            }
            summary.setUpgradedCount(summary.getUpgradedCount() + 1);
            summary.getPromotions().add(new Promotion(entity, decision.getReason(), depth, result.getEdgesUpdated()));
            newlyVerified.addFirst(entity);
            log.info("UPGRADED TO VERIFIED: {} ({})", entity, decision.getReason());
        }
        return newlyVerified;
    }

    private void runCascade(List<String> newlyVerified, String projectId, int depth, InvestigationSummary summary) {
        if (newlyVerified.isEmpty()) {
            return;
        }
        log.info("[Depth {}] VERIFICATION CASCADE: {} entities upgraded", depth, newlyVerified.size());
        for (String entity : newlyVerified) {
            log.info("Searching NEWLY VERIFIED entity: {}", entity);
            if (searchVerified(entity, projectId, summary)) {
                summary.setVerifiedSearches(summary.getVerifiedSearches() + 1);
            }
        }
    }

    private boolean searchVerified(String entity, String projectId, InvestigationSummary summary) {
        if (!searchSafely(entity, summary)) {
            return false;
        }
        summary.setTotalSearches(summary.getTotalSearches() + 1);
        searchedMarker.markSearched(projectId, entity, registry);
        return true;
    }

    private boolean searchSafely(String entity, InvestigationSummary summary) {
        try {
            searchExecutor.search(entity);
            return true;
        } catch (RuntimeException e) {
            log.warn("Search failed for {}: {}", entity, e.getMessage());
            summary.getDiagnostics().add(entity + ": search_failed: " + e.getMessage());
            return false;
        }
    }
}
