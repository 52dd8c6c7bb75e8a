package com.osint.leadtrace.repository;

import com.osint.leadtrace.model.InvestigationRun;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface InvestigationRunRepository extends MongoRepository<InvestigationRun, String> {

    List<InvestigationRun> findByProjectIdOrderByCreatedAtDesc(String projectId);

    Optional<InvestigationRun> findByIdAndProjectId(String id, String projectId);

    List<InvestigationRun> findByExpiresAtBefore(LocalDateTime dateTime);
}
