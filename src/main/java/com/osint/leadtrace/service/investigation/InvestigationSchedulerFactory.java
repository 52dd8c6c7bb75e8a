package com.osint.leadtrace.service.investigation;

import com.osint.leadtrace.service.graph.IdentityRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds one {@link InvestigationScheduler} per run around the shared, stateless
 * scheduler components.
 */
@Component
@RequiredArgsConstructor
public class InvestigationSchedulerFactory {

    private final QueueBuilder queueBuilder;
    private final SequenceTagger sequenceTagger;
    private final VerificationEvaluator verificationEvaluator;
    private final PromotionApplier promotionApplier;
    private final SearchedMarker searchedMarker;

    public InvestigationScheduler create(SearchExecutor searchExecutor, IdentityRegistry registry) {
        return new InvestigationScheduler(queueBuilder, sequenceTagger, verificationEvaluator,
                promotionApplier, searchedMarker, searchExecutor, registry);
    }

    public InvestigationSummary run(String seedQuery, String projectId, int maxDepth, SearchExecutor searchExecutor) {
        return create(searchExecutor, new IdentityRegistry()).run(seedQuery, projectId, maxDepth);
    }
}
