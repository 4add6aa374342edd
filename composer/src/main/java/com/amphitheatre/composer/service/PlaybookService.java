package com.amphitheatre.composer.service;

import com.amphitheatre.composer.api.dto.ActorRequest;
import com.amphitheatre.composer.api.dto.SubmitPlaybookRequest;
import com.amphitheatre.composer.controller.ReconcileQueue;
import com.amphitheatre.composer.controller.ReconcileReason;
import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.PipelineStage;
import com.amphitheatre.composer.model.Playbook;
import com.amphitheatre.composer.model.SourceLocator;
import com.amphitheatre.composer.repository.ActorRepository;
import com.amphitheatre.composer.repository.PlaybookRepository;
import com.amphitheatre.composer.sync.SyncCoordinator;
import com.amphitheatre.composer.sync.SyncRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Desired-state writes coming from the API.
 *
 * The service never touches pipeline stages. It records what the user wants
 * and enqueues the Playbook; the reconciler does the rest. Enqueueing waits
 * for the transaction to commit so a worker never reads the row before it
 * exists.
 *
 * Validation errors throw {@link IllegalArgumentException} (400), requests
 * that conflict with the current state throw {@link IllegalStateException} (409).
 */
@Service
public class PlaybookService {

    private static final Logger log = LoggerFactory.getLogger(PlaybookService.class);

    private static final Pattern NAMESPACE = Pattern.compile("[a-z0-9]([-a-z0-9]{0,61}[a-z0-9])?");

    private final PlaybookRepository playbookRepo;
    private final ActorRepository    actorRepo;
    private final ReconcileQueue     queue;
    private final SyncCoordinator    sync;
    private final Clock              clock;

    public PlaybookService(PlaybookRepository playbookRepo,
                           ActorRepository actorRepo,
                           ReconcileQueue queue,
                           SyncCoordinator sync,
                           Clock clock) {
        this.playbookRepo = playbookRepo;
        this.actorRepo    = actorRepo;
        this.queue        = queue;
        this.sync         = sync;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Playbooks
    // ------------------------------------------------------------------

    @Transactional
    public Playbook submit(SubmitPlaybookRequest req) {
        if (req.title() == null || req.title().isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (req.actors().isEmpty()) {
            throw new IllegalArgumentException("a playbook needs at least one actor");
        }
        if (req.namespace() != null && !NAMESPACE.matcher(req.namespace()).matches()) {
            throw new IllegalArgumentException("invalid namespace: " + req.namespace());
        }
        if (req.ttlSeconds() != null && req.ttlSeconds() <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive");
        }

        Set<String> names = new HashSet<>();
        for (ActorRequest a : req.actors()) {
            validateActor(a.name(), a);
            if (!names.add(a.name())) {
                throw new IllegalArgumentException("duplicate actor name: " + a.name());
            }
        }

        Playbook playbook = new Playbook(req.title());
        playbook.setDescription(req.description());
        playbook.setNamespace(req.namespace());
        playbook.setTtlSeconds(req.ttlSeconds());
        for (ActorRequest a : req.actors()) {
            Actor actor = playbook.addActor(a.name(), locator(a));
            applySpec(actor, a);
        }

        Playbook saved = playbookRepo.save(playbook);
        log.info("Playbook {} '{}' submitted with {} actors",
                saved.getId(), saved.getTitle(), saved.getActors().size());
        enqueueAfterCommit(saved.getId(), ReconcileReason.SUBMITTED);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Playbook> findById(UUID id) {
        return playbookRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public List<Playbook> findAll() {
        return playbookRepo.findAll();
    }

    /**
     * Create or replace the desired spec of one Actor.
     *
     * @return empty if the Playbook does not exist
     */
    @Transactional
    public Optional<Playbook> putActor(UUID playbookId, String name, ActorRequest req) {
        Optional<Playbook> found = playbookRepo.findById(playbookId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Playbook playbook = found.get();
        if (playbook.isDeletionRequested()) {
            throw new IllegalStateException("Playbook " + playbookId + " is being torn down");
        }
        validateActor(name, req);

        SourceLocator source = locator(req);
        Actor actor = playbook.actor(name).orElseGet(() -> playbook.addActor(name, source));
        applySpec(actor, req);
        // An explicit spec takes ownership of a previously discovered partner.
        actor.setImplicit(false);

        Playbook saved = playbookRepo.save(playbook);
        log.info("Actor '{}' of playbook {} updated", name, playbookId);
        enqueueAfterCommit(playbookId, ReconcileReason.DESIRED_STATE_CHANGED);
        return Optional.of(saved);
    }

    /**
     * Mark the Playbook for deletion. The reconciler tears its objects down
     * and then deletes the row.
     */
    @Transactional
    public Optional<Playbook> requestTeardown(UUID playbookId) {
        return playbookRepo.findById(playbookId).map(playbook -> {
            playbook.requestDeletion(clock.instant());
            Playbook saved = playbookRepo.save(playbook);
            log.info("Teardown requested for playbook {}", playbookId);
            enqueueAfterCommit(playbookId, ReconcileReason.TEARDOWN);
            return saved;
        });
    }

    // ------------------------------------------------------------------
    // Actors
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Actor> findActor(UUID actorId) {
        return actorRepo.findById(actorId);
    }

    /**
     * Ask for an immediate retry of a Failed Actor, skipping the rest of its backoff.
     *
     * @throws IllegalStateException if the Actor is not Failed or its failure is not retryable
     */
    @Transactional
    public Optional<Actor> requestRetry(UUID actorId) {
        return actorRepo.findById(actorId).map(actor -> {
            if (actor.getStage() != PipelineStage.FAILED) {
                throw new IllegalStateException(
                        "Actor '" + actor.getName() + "' is " + actor.getStage() + ", not FAILED");
            }
            if (!actor.isRetryable()) {
                throw new IllegalStateException("Actor '" + actor.getName()
                        + "' failed permanently; update its spec to run it again");
            }
            actor.setRetryRequested(true);
            Actor saved = actorRepo.save(actor);
            log.info("Retry requested for actor '{}' ({})", actor.getName(), actorId);
            enqueueAfterCommit(actor.getPlaybookId(), ReconcileReason.RETRY);
            return saved;
        });
    }

    /**
     * Record a sync signal for a live Actor. It is dispatched the next time
     * the Actor is Running.
     *
     * @throws com.amphitheatre.composer.sync.SyncRejectedException if the Actor is not live
     */
    @Transactional(readOnly = true)
    public Optional<SyncRequest> requestSync(UUID actorId, List<String> paths) {
        return actorRepo.findById(actorId).map(actor -> {
            SyncRequest request = sync.request(actor, paths, clock.instant());
            queue.enqueue(actor.getPlaybookId(), ReconcileReason.SYNC);
            return request;
        });
    }

    /**
     * The Syncer's completion report.
     *
     * @return empty if the Actor does not exist, false if the request is not the one in flight
     */
    @Transactional(readOnly = true)
    public Optional<Boolean> completeSync(UUID actorId, UUID requestId) {
        return actorRepo.findById(actorId).map(actor -> {
            boolean accepted = sync.complete(actorId, requestId);
            if (accepted) {
                queue.enqueue(actor.getPlaybookId(), ReconcileReason.SYNC);
            }
            return accepted;
        });
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void validateActor(String name, ActorRequest a) {
        if (!Actor.isValidName(name)) {
            throw new IllegalArgumentException("invalid actor name: " + name);
        }
        if (a.repository() == null || a.repository().isBlank()) {
            throw new IllegalArgumentException("actor '" + name + "' has no repository");
        }
        if (!SourceLocator.isValidRepository(a.repository())) {
            throw new IllegalArgumentException("actor '" + name
                    + "' needs an https://github.com/<owner>/<repo> repository, got: " + a.repository());
        }
        if (a.commit() != null && !a.commit().isBlank() && !SourceLocator.isValidCommit(a.commit())) {
            throw new IllegalArgumentException("actor '" + name + "' has invalid commit: " + a.commit());
        }
        for (String dep : a.dependencies()) {
            if (!Actor.isValidName(dep)) {
                throw new IllegalArgumentException("actor '" + name + "' has invalid dependency: " + dep);
            }
        }
        for (Integer port : a.ports()) {
            if (port == null || port < 1 || port > 65535) {
                throw new IllegalArgumentException("actor '" + name + "' has invalid port: " + port);
            }
        }
    }

    private static SourceLocator locator(ActorRequest a) {
        return new SourceLocator(a.repository(), a.path(), a.reference(), a.commit());
    }

    private static void applySpec(Actor actor, ActorRequest a) {
        actor.updateSpec(a.description(), locator(a),
                new LinkedHashSet<>(a.dependencies()), a.live(), new LinkedHashSet<>(a.ports()));
    }

    private void enqueueAfterCommit(UUID playbookId, ReconcileReason reason) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            queue.enqueue(playbookId, reason);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                queue.enqueue(playbookId, reason);
            }
        });
    }
}
