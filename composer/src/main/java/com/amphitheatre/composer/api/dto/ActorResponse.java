package com.amphitheatre.composer.api.dto;

import com.amphitheatre.composer.model.Actor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of an Actor and its pipeline state.
 */
public record ActorResponse(
        UUID         id,
        String       name,
        String       description,
        String       repository,
        String       path,
        String       reference,
        String       resolvedCommit,
        List<String> dependencies,
        List<String> discoveredDependencies,
        boolean      implicit,
        boolean      live,
        List<Integer> ports,
        String       stage,
        Instant      stageEnteredAt,
        String       lastError,
        String       errorClass,
        boolean      retryable,
        int          retryCount,
        long         revision,
        List<String> errorHistory
) {
    public static ActorResponse from(Actor a) {
        return new ActorResponse(
                a.getId(),
                a.getName(),
                a.getDescription(),
                a.getSource().getRepository(),
                a.getSource().getPath(),
                a.getSource().getReference(),
                a.getResolvedCommit(),
                List.copyOf(a.getDependencies()),
                List.copyOf(a.getDiscoveredDependencies()),
                a.isImplicit(),
                a.isLive(),
                List.copyOf(a.getPorts()),
                a.getStage().name(),
                a.getStageEnteredAt(),
                a.getLastError(),
                a.getErrorClass() == null ? null : a.getErrorClass().name(),
                a.isRetryable(),
                a.getRetryCount(),
                a.getRevision(),
                List.copyOf(a.getErrorHistory())
        );
    }
}
