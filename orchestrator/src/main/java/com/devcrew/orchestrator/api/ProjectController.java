package com.devcrew.orchestrator.api;

import com.devcrew.orchestrator.api.dto.CreateProjectRequest;
import com.devcrew.orchestrator.api.dto.MessageResponse;
import com.devcrew.orchestrator.api.dto.ProjectCreatedResponse;
import com.devcrew.orchestrator.api.dto.ProjectResponse;
import com.devcrew.orchestrator.messaging.MessageFilter;
import com.devcrew.orchestrator.service.Orchestrator;
import com.devcrew.orchestrator.service.ProjectStatusReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API over the orchestrator.
 *
 * POST /projects                 initialize (or re-initialize) a project workflow
 * GET  /projects                 list stored projects
 * POST /projects/{id}/run        advance the loaded workflow by ?steps agent turns
 * POST /projects/{id}/cancel     stop the loaded workflow before its next step
 * GET  /projects/{id}/status     task/error counts and live agent status
 * GET  /projects/{id}/messages   message history, optionally filtered
 */
@RestController
@RequestMapping("/projects")
public class ProjectController {

    private final Orchestrator orchestrator;

    public ProjectController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/projects \
     *     -H "Content-Type: application/json" \
     *     -d '{"name":"Todo App","description":"demo","requirements":"Build a todo app with login"}'
     */
    @PostMapping
    public ResponseEntity<ProjectCreatedResponse> create(@RequestBody CreateProjectRequest req) {
        if (req.name() == null || req.name().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "name is required");
        }
        if (req.requirements() == null || req.requirements().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "requirements are required");
        }
        UUID id = orchestrator.initializeProject(req.name(), req.description(), req.requirements());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ProjectCreatedResponse(id));
    }

    @GetMapping
    public List<ProjectResponse> list() {
        return orchestrator.listProjects().stream()
                .map(ProjectResponse::from)
                .toList();
    }

    /**
     * Only the project currently loaded in the orchestrator can be run.
     * Returns 409 for any other id.
     */
    @PostMapping("/{id}/run")
    public Map<String, Object> run(@PathVariable UUID id,
                                   @RequestParam(required = false) Integer steps) {
        requireLoaded(id);
        if (steps != null && steps < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "steps must be at least 1");
        }
        return steps == null ? orchestrator.run() : orchestrator.run(steps);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable UUID id) {
        requireLoaded(id);
        orchestrator.cancel();
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{id}/status")
    public ProjectStatusReport status(@PathVariable UUID id) {
        ProjectStatusReport report = orchestrator.getProjectStatus(id);
        if (report.isNotFound()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Project not found: " + id);
        }
        return report;
    }

    /** Message history of the loaded project; empty for any other id. */
    @GetMapping("/{id}/messages")
    public List<MessageResponse> messages(@PathVariable UUID id,
                                          @RequestParam(required = false) String senderId,
                                          @RequestParam(required = false) String receiverId,
                                          @RequestParam(required = false) UUID taskId) {
        return orchestrator.getMessageHistory(new MessageFilter(taskId, id, senderId, receiverId))
                .stream()
                .map(MessageResponse::from)
                .toList();
    }

    private void requireLoaded(UUID id) {
        if (!id.equals(orchestrator.currentProjectId())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Project " + id + " is not the loaded project");
        }
    }
}
