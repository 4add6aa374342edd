package com.amphitheatre.composer.sync;

import com.amphitheatre.composer.events.ComposerEvent;
import com.amphitheatre.composer.events.EventBus;
import com.amphitheatre.composer.model.Actor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Boundary to the Syncer.
 *
 * Per Actor there is at most one pending request (later requests merge their
 * paths into it) and at most one dispatched request. The reconciler dispatches
 * a pending request when it moves the Actor to SYNCING; the Syncer reports
 * back through {@link #complete}, and the next pass moves the Actor back to
 * RUNNING.
 *
 * State is in memory only. After a restart a SYNCING Actor times out through
 * its sync deadline and is retried like any other transient failure.
 */
@Component
public class SyncCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SyncCoordinator.class);

    private final EventBus events;

    private final Map<UUID, SyncRequest> pending    = new ConcurrentHashMap<>();
    private final Map<UUID, SyncRequest> dispatched = new ConcurrentHashMap<>();
    private final Set<UUID>              applied    = ConcurrentHashMap.newKeySet();

    public SyncCoordinator(EventBus events) {
        this.events = events;
    }

    /**
     * Record a sync signal for a live Actor.
     *
     * @throws SyncRejectedException if the Actor is not live
     */
    public SyncRequest request(Actor actor, List<String> paths, Instant now) {
        if (!actor.isLive()) {
            throw new SyncRejectedException("Actor '" + actor.getName() + "' is not live");
        }
        SyncRequest merged = pending.compute(actor.getId(), (id, existing) -> {
            if (existing == null) {
                return new SyncRequest(UUID.randomUUID(), id, actor.getPlaybookId(),
                                       List.copyOf(paths), now);
            }
            Set<String> union = new LinkedHashSet<>(existing.paths());
            union.addAll(paths);
            List<String> all = existing.paths().isEmpty() || paths.isEmpty()
                    ? List.of() : new ArrayList<>(union);
            return new SyncRequest(existing.requestId(), id, existing.playbookId(),
                                   List.copyOf(all), existing.requestedAt());
        });
        log.info("Sync {} requested for actor '{}' ({} paths)",
                merged.requestId(), actor.getName(), merged.paths().size());
        return merged;
    }

    public boolean hasPending(UUID actorId) {
        return pending.containsKey(actorId);
    }

    /** Hand the pending request to the Syncer by publishing it. */
    public Optional<SyncRequest> dispatch(Actor actor, Instant now) {
        SyncRequest request = pending.remove(actor.getId());
        if (request == null) {
            return Optional.empty();
        }
        dispatched.put(actor.getId(), request);
        applied.remove(actor.getId());
        events.publish(ComposerEvent.playbook(ComposerEvent.Type.SYNC_REQUESTED, actor.getPlaybookId(),
                Map.of("key",       request.requestId().toString(),
                       "requestId", request.requestId().toString(),
                       "actorId",   actor.getId().toString(),
                       "actor",     actor.getName(),
                       "paths",     request.paths()), now));
        return Optional.of(request);
    }

    /**
     * Syncer report: the request was applied.
     *
     * @return false if {@code requestId} is not the request in flight for the Actor
     */
    public boolean complete(UUID actorId, UUID requestId) {
        SyncRequest current = dispatched.get(actorId);
        if (current == null || !current.requestId().equals(requestId)) {
            log.warn("Ignoring completion of unknown sync {} for actor {}", requestId, actorId);
            return false;
        }
        applied.add(actorId);
        return true;
    }

    public boolean isApplied(UUID actorId) {
        return applied.contains(actorId);
    }

    /** Clear the dispatched request once the Actor left SYNCING. */
    public void settle(UUID actorId) {
        dispatched.remove(actorId);
        applied.remove(actorId);
    }

    /** Drop all state of a removed Actor. */
    public void forget(UUID actorId) {
        pending.remove(actorId);
        settle(actorId);
    }
}
