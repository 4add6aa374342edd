package com.amphitheatre.composer.api.dto;

import com.amphitheatre.composer.sync.SyncRequest;

import java.util.List;
import java.util.UUID;

public record SyncResponse(UUID requestId, UUID actorId, List<String> paths) {

    public static SyncResponse from(SyncRequest r) {
        return new SyncResponse(r.requestId(), r.actorId(), r.paths());
    }
}
