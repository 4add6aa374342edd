package com.amphitheatre.composer.store;

import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.Playbook;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Point-in-time read and write-back access to Playbook/Actor records, as seen
 * by the reconciler.
 *
 * Actor writes are optimistic: a concurrent change to the same row makes
 * {@link #saveActor} throw
 * {@link org.springframework.dao.OptimisticLockingFailureException}.
 */
public interface DesiredStateStore {

    /** Playbook with all of its actors loaded, or empty if it no longer exists. */
    Optional<Playbook> load(UUID playbookId);

    /** Persist an actor and return the stored copy (with its new version). */
    Actor saveActor(Actor actor);

    boolean isDeletionRequested(UUID playbookId);

    /** Remove a playbook and, by cascade, all of its actors. */
    void delete(UUID playbookId);

    List<UUID> allPlaybookIds();

    List<UUID> changedSince(Instant since);

    /** Playbooks whose TTL has run out and that are not already being torn down. */
    List<Playbook> expired(Instant now);

    void requestDeletion(UUID playbookId, Instant now);
}
