package com.osint.leadtrace.service.search;

import com.osint.leadtrace.repository.graph.GraphNodeRepository;
import com.osint.leadtrace.service.graph.EvidenceIngestor;
import com.osint.leadtrace.service.graph.IdentityRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LookupSearchExecutorFactory {

    private final QueryTypeDetector queryTypeDetector;
    private final LookupClient lookupClient;
    private final EvidenceIngestor evidenceIngestor;
    private final GraphNodeRepository graphNodeRepository;

    public LookupSearchExecutor create(String projectId, IdentityRegistry registry) {
        return new LookupSearchExecutor(projectId, registry, queryTypeDetector, lookupClient,
                evidenceIngestor, graphNodeRepository);
    }
}
