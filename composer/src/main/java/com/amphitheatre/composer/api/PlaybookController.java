package com.amphitheatre.composer.api;

import com.amphitheatre.composer.api.dto.ActorRequest;
import com.amphitheatre.composer.api.dto.PlaybookResponse;
import com.amphitheatre.composer.api.dto.SubmitPlaybookRequest;
import com.amphitheatre.composer.model.Playbook;
import com.amphitheatre.composer.service.PlaybookService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for Playbooks.
 *
 * POST   /playbooks                     — submit a Playbook
 * GET    /playbooks                     — list Playbooks with their derived phase
 * GET    /playbooks/{id}                — one Playbook and its Actors
 * PUT    /playbooks/{id}/actors/{name}  — create or replace an Actor's desired spec
 * DELETE /playbooks/{id}                — request teardown (asynchronous)
 */
@RestController
@RequestMapping("/playbooks")
public class PlaybookController {

    private final PlaybookService playbookService;

    public PlaybookController(PlaybookService playbookService) {
        this.playbookService = playbookService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/playbooks \
     *     -H "Content-Type: application/json" \
     *     -d '{"title":"shop","actors":[{"name":"api","repository":"https://github.com/acme/api"}]}'
     */
    @PostMapping
    public ResponseEntity<PlaybookResponse> submit(@RequestBody SubmitPlaybookRequest req) {
        Playbook playbook = playbookService.submit(req);
        return ResponseEntity.status(HttpStatus.CREATED).body(PlaybookResponse.from(playbook));
    }

    @GetMapping
    public List<PlaybookResponse> list() {
        return playbookService.findAll().stream()
                .map(PlaybookResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public PlaybookResponse get(@PathVariable UUID id) {
        return playbookService.findById(id)
                .map(PlaybookResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    @PutMapping("/{id}/actors/{name}")
    public PlaybookResponse putActor(@PathVariable UUID id,
                                     @PathVariable String name,
                                     @RequestBody ActorRequest req) {
        return playbookService.putActor(id, name, req)
                .map(PlaybookResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    /** Returns 202: objects are deleted by the next reconcile pass. */
    @DeleteMapping("/{id}")
    public ResponseEntity<PlaybookResponse> teardown(@PathVariable UUID id) {
        Playbook playbook = playbookService.requestTeardown(id).orElseThrow(() -> notFound(id));
        return ResponseEntity.accepted().body(PlaybookResponse.from(playbook));
    }

    // ------------------------------------------------------------------
    // Error mapping
    // ------------------------------------------------------------------

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<String> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<String> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Playbook not found: " + id);
    }
}
