package com.amphitheatre.composer.api.dto;

import java.util.List;

/** Request body for POST /actors/{id}/sync. No paths means the whole tree changed. */
public record SyncSignalRequest(List<String> paths) {

    public SyncSignalRequest {
        if (paths == null) paths = List.of();
    }
}
