package com.osint.leadtrace.repository.graph;

import com.osint.leadtrace.model.graph.GraphNode;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Write-side access to graph nodes, used when lookup results are ingested.
 * Scheduler reads go through {@link com.osint.leadtrace.service.graph.GraphStore}.
 */
@Repository
public interface GraphNodeRepository extends MongoRepository<GraphNode, String> {

    Optional<GraphNode> findFirstByProjectIdAndCanonicalValue(String projectId, String canonicalValue);
}
