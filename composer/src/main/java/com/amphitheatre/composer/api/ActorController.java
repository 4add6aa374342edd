package com.amphitheatre.composer.api;

import com.amphitheatre.composer.api.dto.ActorResponse;
import com.amphitheatre.composer.api.dto.SyncResponse;
import com.amphitheatre.composer.api.dto.SyncSignalRequest;
import com.amphitheatre.composer.service.PlaybookService;
import com.amphitheatre.composer.sync.SyncRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * REST API for individual Actors.
 *
 * GET  /actors/{id}                              — current pipeline state
 * POST /actors/{id}/retry                        — retry a Failed Actor now
 * POST /actors/{id}/sync                         — signal changed source paths (live Actors)
 * POST /actors/{id}/sync/{requestId}/complete    — Syncer completion report
 */
@RestController
@RequestMapping("/actors")
public class ActorController {

    private final PlaybookService playbookService;

    public ActorController(PlaybookService playbookService) {
        this.playbookService = playbookService;
    }

    @GetMapping("/{id}")
    public ActorResponse get(@PathVariable UUID id) {
        return playbookService.findActor(id)
                .map(ActorResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<ActorResponse> retry(@PathVariable UUID id) {
        return playbookService.requestRetry(id)
                .map(actor -> ResponseEntity.accepted().body(ActorResponse.from(actor)))
                .orElseThrow(() -> notFound(id));
    }

    @PostMapping("/{id}/sync")
    public ResponseEntity<SyncResponse> sync(@PathVariable UUID id,
                                             @RequestBody(required = false) SyncSignalRequest req) {
        SyncSignalRequest body = req != null ? req : new SyncSignalRequest(null);
        return playbookService.requestSync(id, body.paths())
                .map(r -> ResponseEntity.accepted().body(SyncResponse.from(r)))
                .orElseThrow(() -> notFound(id));
    }

    @PostMapping("/{id}/sync/{requestId}/complete")
    public ResponseEntity<Void> completeSync(@PathVariable UUID id, @PathVariable UUID requestId) {
        boolean accepted = playbookService.completeSync(id, requestId).orElseThrow(() -> notFound(id));
        if (!accepted) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Sync " + requestId + " is not in flight for actor " + id);
        }
        return ResponseEntity.noContent().build();
    }

    // ------------------------------------------------------------------
    // Error mapping
    // ------------------------------------------------------------------

    @ExceptionHandler({IllegalStateException.class, SyncRejectedException.class})
    ResponseEntity<String> conflict(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Actor not found: " + id);
    }
}
