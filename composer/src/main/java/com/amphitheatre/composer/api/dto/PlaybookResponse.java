package com.amphitheatre.composer.api.dto;

import com.amphitheatre.composer.model.Playbook;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for POST /playbooks and GET /playbooks/{id}.
 * The phase is derived from the Actors at the time of the call.
 */
public record PlaybookResponse(
        UUID    id,
        String  title,
        String  description,
        String  phase,
        String  namespace,
        Long    ttlSeconds,
        Instant createdAt,
        Instant updatedAt,
        List<ActorResponse> actors
) {
    public static PlaybookResponse from(Playbook p) {
        return new PlaybookResponse(
                p.getId(),
                p.getTitle(),
                p.getDescription(),
                p.phase().name(),
                p.targetNamespace(),
                p.getTtlSeconds(),
                p.getCreatedAt(),
                p.getUpdatedAt(),
                p.getActors().stream().map(ActorResponse::from).toList()
        );
    }
}
