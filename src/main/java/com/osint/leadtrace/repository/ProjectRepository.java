package com.osint.leadtrace.repository;

import com.osint.leadtrace.model.Project;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProjectRepository extends MongoRepository<Project, String> {

    List<Project> findByArchivedFalse();

    List<Project> findByArchivedTrue();

    List<Project> findByNameContainingIgnoreCase(String name);
}
