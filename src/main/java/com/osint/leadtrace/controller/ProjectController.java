package com.osint.leadtrace.controller;

import com.osint.leadtrace.dto.CreateProjectRequest;
import com.osint.leadtrace.dto.ProjectResponse;
import com.osint.leadtrace.service.ProjectService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
public class ProjectController {

    private final ProjectService projectService;

    @PostMapping
    public ResponseEntity<ProjectResponse> createProject(@Valid @RequestBody CreateProjectRequest request) {
        ProjectResponse response = projectService.createProject(request);
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProjectResponse> getProjectById(@PathVariable String id) {
        return ResponseEntity.ok(projectService.getProjectById(id));
    }

    @GetMapping
    public ResponseEntity<List<ProjectResponse>> getAllProjects(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String search) {

        if (search != null && !search.isBlank()) {
            return ResponseEntity.ok(projectService.searchProjects(search));
        }

        if ("active".equalsIgnoreCase(status)) {
            return ResponseEntity.ok(projectService.getActiveProjects());
        } else if ("archived".equalsIgnoreCase(status)) {
            return ResponseEntity.ok(projectService.getArchivedProjects());
        }

        return ResponseEntity.ok(projectService.getAllProjects());
    }

    @PatchMapping("/{id}/archive")
    public ResponseEntity<ProjectResponse> archiveProject(@PathVariable String id) {
        return ResponseEntity.ok(projectService.archiveProject(id));
    }

    @PatchMapping("/{id}/unarchive")
    public ResponseEntity<ProjectResponse> unarchiveProject(@PathVariable String id) {
        return ResponseEntity.ok(projectService.unarchiveProject(id));
    }
}
