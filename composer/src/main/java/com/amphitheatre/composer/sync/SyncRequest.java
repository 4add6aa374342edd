package com.amphitheatre.composer.sync;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A request to live-patch a running Actor's source tree.
 *
 * @param paths changed paths relative to the Actor's source root; empty means "everything"
 */
public record SyncRequest(UUID requestId, UUID actorId, UUID playbookId, List<String> paths,
                          Instant requestedAt) {
}
