package com.osint.leadtrace.service;

import com.osint.leadtrace.dto.CreateProjectRequest;
import com.osint.leadtrace.dto.ProjectResponse;
import com.osint.leadtrace.exception.ProjectNotFoundException;
import com.osint.leadtrace.model.Project;
import com.osint.leadtrace.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectService {

    private final ProjectRepository projectRepository;

    public ProjectResponse createProject(CreateProjectRequest request) {
        log.info("Creating new project with name: {}", request.getName());

        Project project = Project.builder()
                .name(request.getName())
                .description(request.getDescription())
                .archived(false)
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();

        Project savedProject = projectRepository.save(project);
        log.info("Project created successfully with id: {}", savedProject.getId());

        return mapToResponse(savedProject);
    }

    public ProjectResponse getProjectById(String id) {
        log.info("Fetching project with id: {}", id);
        return mapToResponse(findProject(id));
    }

    public List<ProjectResponse> getAllProjects() {
        log.info("Fetching all projects");
        return projectRepository.findAll().stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    public List<ProjectResponse> getActiveProjects() {
        log.info("Fetching active projects");
        return projectRepository.findByArchivedFalse().stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    public List<ProjectResponse> getArchivedProjects() {
        log.info("Fetching archived projects");
        return projectRepository.findByArchivedTrue().stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    public List<ProjectResponse> searchProjects(String name) {
        log.info("Searching projects with name containing: {}", name);
        return projectRepository.findByNameContainingIgnoreCase(name).stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    public ProjectResponse archiveProject(String id) {
        log.info("Archiving project with id: {}", id);

        Project project = findProject(id);
        project.setArchived(true);
        project.setArchivedAt(LocalDateTime.now());
        project.setUpdatedAt(LocalDateTime.now());

        Project archivedProject = projectRepository.save(project);
        log.info("Project archived successfully with id: {}", archivedProject.getId());

        return mapToResponse(archivedProject);
    }

    public ProjectResponse unarchiveProject(String id) {
        log.info("Unarchiving project with id: {}", id);

        Project project = findProject(id);
        project.setArchived(false);
        project.setArchivedAt(null);
        project.setUpdatedAt(LocalDateTime.now());

        Project unarchivedProject = projectRepository.save(project);
        log.info("Project unarchived successfully with id: {}", unarchivedProject.getId());

        return mapToResponse(unarchivedProject);
    }

    /**
     * Loads a project or fails with {@link ProjectNotFoundException}.
     */
    public Project findProject(String id) {
        return projectRepository.findById(id)
                .orElseThrow(() -> new ProjectNotFoundException("Project not found with id: " + id));
    }

    private ProjectResponse mapToResponse(Project project) {
        return ProjectResponse.builder()
                .id(project.getId())
                .name(project.getName())
                .description(project.getDescription())
                .archived(project.isArchived())
                .createdAt(project.getCreatedAt())
                .updatedAt(project.getUpdatedAt())
                .archivedAt(project.getArchivedAt())
                .build();
    }
}
