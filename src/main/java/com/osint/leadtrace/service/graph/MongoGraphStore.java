package com.osint.leadtrace.service.graph;

import com.osint.leadtrace.exception.GraphStoreException;
import com.osint.leadtrace.model.graph.EmbeddedEdge;
import com.osint.leadtrace.model.graph.GraphNode;
import com.mongodb.client.result.UpdateResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@link GraphStore} over the {@code graph_nodes} collection.
 */
@Service
@Slf4j
public class MongoGraphStore implements GraphStore {

    private final MongoTemplate mongoTemplate;
    private final int nodeScanLimit;
    private final int evidenceScanLimit;

    public MongoGraphStore(MongoTemplate mongoTemplate,
                           @Value("${leadtrace.graph.node-scan-limit:10000}") int nodeScanLimit,
                           @Value("${leadtrace.graph.evidence-scan-limit:100}") int evidenceScanLimit) {
        this.mongoTemplate = mongoTemplate;
        this.nodeScanLimit = nodeScanLimit;
        this.evidenceScanLimit = evidenceScanLimit;
    }

    @Override
    public List<GraphNode> queryNodesWithEdges(String projectId) {
        Query query = new Query(Criteria.where("projectId").is(projectId)
                .and("embeddedEdges").exists(true).not().size(0))
                .limit(nodeScanLimit);
        try {
            List<GraphNode> nodes = mongoTemplate.find(query, GraphNode.class);
            if (nodes.size() >= nodeScanLimit) {
                log.warn("Node scan for project {} hit the limit of {} nodes; queues may be incomplete",
                        projectId, nodeScanLimit);
            }
            return nodes;
        } catch (DataAccessException e) {
            throw new GraphStoreException("Failed to query nodes with edges for project " + projectId, e);
        }
    }

    @Override
    public List<GraphNode> queryEvidenceNodesReferencing(String projectId, String targetId) {
        Query query = new Query(Criteria.where("projectId").is(projectId)
                .and("type").is(GraphNode.EVIDENCE_TYPE)
                .and("embeddedEdges.targetId").is(targetId))
                .limit(evidenceScanLimit);
        try {
            return mongoTemplate.find(query, GraphNode.class);
        } catch (DataAccessException e) {
            throw new GraphStoreException("Failed to query evidence nodes referencing " + targetId, e);
        }
    }

    @Override
    public Optional<GraphNode> getNodeByCanonicalValue(String projectId, String canonicalValue) {
        Query query = new Query(Criteria.where("projectId").is(projectId)
                .and("canonicalValue").is(canonicalValue));
        try {
            return Optional.ofNullable(mongoTemplate.findOne(query, GraphNode.class));
        } catch (DataAccessException e) {
            throw new GraphStoreException("Failed to look up node " + canonicalValue, e);
        }
    }

    @Override
    public List<GraphNode> findNodesByIds(String projectId, Collection<String> nodeIds) {
        if (nodeIds.isEmpty()) {
            return List.of();
        }
        Query query = new Query(Criteria.where("projectId").is(projectId)
                .and("id").in(nodeIds));
        try {
            return mongoTemplate.find(query, GraphNode.class);
        } catch (DataAccessException e) {
            throw new GraphStoreException("Failed to load " + nodeIds.size() + " nodes by id", e);
        }
    }

    @Override
    public boolean updateNode(String nodeId, List<EmbeddedEdge> edges) {
        Query query = new Query(Criteria.where("id").is(nodeId));
        Update update = new Update()
                .set("embeddedEdges", edges)
                .set("updatedAt", LocalDateTime.now());
        try {
            UpdateResult result = mongoTemplate.updateFirst(query, update, GraphNode.class);
            return result.getMatchedCount() > 0;
        } catch (DataAccessException e) {
            throw new GraphStoreException("Failed to update node " + nodeId, e);
        }
    }
}
