package com.osint.leadtrace.service.search;

import com.osint.leadtrace.dto.lookup.LookupResponse;
import com.osint.leadtrace.exception.SearchExecutionException;
import com.osint.leadtrace.model.graph.GraphNode;
import com.osint.leadtrace.repository.graph.GraphNodeRepository;
import com.osint.leadtrace.service.graph.EvidenceIngestor;
import com.osint.leadtrace.service.graph.IdentityRegistry;
import com.osint.leadtrace.service.graph.IngestionResult;
import com.osint.leadtrace.service.investigation.SearchExecutor;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SearchExecutor} for one project: looks the value up through the lookup
 * service and ingests the result into that project's graph.
 *
 * The query type comes from an explicit hint, then from the entity's node when the
 * graph already knows it, otherwise from the value's shape.
 */
@Slf4j
public class LookupSearchExecutor implements SearchExecutor {

    private final String projectId;
    private final IdentityRegistry registry;
    private final QueryTypeDetector queryTypeDetector;
    private final LookupClient lookupClient;
    private final EvidenceIngestor evidenceIngestor;
    private final GraphNodeRepository graphNodeRepository;
    private final Map<String, QueryType> typeHints = new HashMap<>();

    public LookupSearchExecutor(String projectId,
                                IdentityRegistry registry,
                                QueryTypeDetector queryTypeDetector,
                                LookupClient lookupClient,
                                EvidenceIngestor evidenceIngestor,
                                GraphNodeRepository graphNodeRepository) {
        this.projectId = projectId;
        this.registry = registry;
        this.queryTypeDetector = queryTypeDetector;
        this.lookupClient = lookupClient;
        this.evidenceIngestor = evidenceIngestor;
        this.graphNodeRepository = graphNodeRepository;
    }

    @Override
    public void search(String value) {
        try {
            QueryType type = resolveType(value);
            String queryValue = queryTypeDetector.extractQueryValue(value, type);
            log.debug("Looking up {} as {}", queryValue, type);

            LookupResponse response = lookupClient.lookup(type, queryValue);
            IngestionResult result = evidenceIngestor.ingest(projectId, queryValue, type, response, registry);
            log.debug("Lookup for {} produced evidence node {} with {} linked entities",
                    queryValue, result.getEvidenceNodeId(), result.getEntitiesLinked());
        } catch (SearchExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SearchExecutionException(value, "Search failed for " + value + ": " + e.getMessage(), e);
        }
    }

    /**
     * Pins the query type of one value, e.g. a seed submitted with a {@code u:} marker.
     */
    public void hintType(String value, QueryType type) {
        typeHints.put(value, type);
    }

    QueryType resolveType(String value) {
        QueryType hinted = typeHints.get(value);
        if (hinted != null) {
            return hinted;
        }
        Optional<QueryType> known = graphNodeRepository.findFirstByProjectIdAndCanonicalValue(projectId, value)
                .map(GraphNode::getType)
                .flatMap(QueryType::fromNodeType);
        return known.orElseGet(() -> queryTypeDetector.detect(value));
    }
}
