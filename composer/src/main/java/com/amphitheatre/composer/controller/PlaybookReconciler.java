package com.amphitheatre.composer.controller;

import com.amphitheatre.composer.config.ComposerProperties;
import com.amphitheatre.composer.events.ComposerEvent;
import com.amphitheatre.composer.events.EventBus;
import com.amphitheatre.composer.metrics.ComposerMetrics;
import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.ErrorClass;
import com.amphitheatre.composer.model.PipelineStage;
import com.amphitheatre.composer.model.Playbook;
import com.amphitheatre.composer.model.PlaybookPhase;
import com.amphitheatre.composer.model.SourceLocator;
import com.amphitheatre.composer.resolver.Resolution;
import com.amphitheatre.composer.resolver.ResolveException;
import com.amphitheatre.composer.resolver.Resolver;
import com.amphitheatre.composer.resources.ApplyException;
import com.amphitheatre.composer.resources.Resources;
import com.amphitheatre.composer.store.DesiredStateStore;
import com.amphitheatre.composer.support.MdcContext;
import com.amphitheatre.composer.sync.SyncCoordinator;
import com.amphitheatre.composer.workflow.Advance;
import com.amphitheatre.composer.workflow.Observation;
import com.amphitheatre.composer.workflow.ObservedState;
import com.amphitheatre.composer.workflow.SideEffect;
import com.amphitheatre.composer.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One reconcile pass over a Playbook:
 *
 *  1. load the Playbook; if deletion was requested, tear it down and stop
 *  2. restart Actors whose desired state changed since their run started
 *  3. resolve dependencies once; a configuration error fails the affected
 *     Actors, a fetch error requeues the Playbook with backoff
 *  4. add discovered partners as implicit Actors
 *  5. advance every Actor in topological order, enacting the requested
 *     cluster work, persisting each step, publishing stage changes
 *
 * An Actor advances through as many stages as it can without cluster work;
 * after a side effect it waits for the next pass to observe the result. A
 * failure of one Actor never stops the others.
 */
public class PlaybookReconciler implements Reconciler {

    private static final Logger log = LoggerFactory.getLogger(PlaybookReconciler.class);

    // Guards against a state machine bug turning one pass into a busy loop.
    private static final int MAX_STEPS_PER_ACTOR = 8;

    private final DesiredStateStore  store;
    private final Resolver           resolver;
    private final WorkflowEngine     engine;
    private final Resources          resources;
    private final SyncCoordinator    sync;
    private final EventBus           events;
    private final ComposerMetrics    metrics;
    private final ComposerProperties properties;
    private final Clock              clock;

    // Consecutive fetch failures per Playbook, for the fetch backoff.
    private final Map<UUID, Integer> fetchFailures = new ConcurrentHashMap<>();

    public PlaybookReconciler(DesiredStateStore store,
                              Resolver resolver,
                              WorkflowEngine engine,
                              Resources resources,
                              SyncCoordinator sync,
                              EventBus events,
                              ComposerMetrics metrics,
                              ComposerProperties properties,
                              Clock clock) {
        this.store      = store;
        this.resolver   = resolver;
        this.engine     = engine;
        this.resources  = resources;
        this.sync       = sync;
        this.events     = events;
        this.metrics    = metrics;
        this.properties = properties;
        this.clock      = clock;
    }

    /** Mutable state of one pass. */
    private static final class Pass {
        final Playbook           playbook;
        final Map<String, Actor> actors = new LinkedHashMap<>();
        Duration requeue;
        boolean  changed;

        Pass(Playbook playbook) {
            this.playbook = playbook;
            playbook.getActors().forEach(a -> actors.put(a.getName(), a));
        }

        void requeueWithin(Duration delay) {
            if (delay != null && (requeue == null || delay.compareTo(requeue) < 0)) {
                requeue = delay;
            }
        }

        UUID id() { return playbook.getId(); }
    }

    @Override
    public ReconcileResult reconcile(UUID playbookId) {
        Instant started = clock.instant();
        MdcContext.setPlaybook(playbookId.toString());
        ReconcileResult result = null;
        try {
            result = reconcileOnce(playbookId);
            return result;
        } finally {
            String outcome = result == null ? "ERROR" : result.outcome().name();
            metrics.recordPass(outcome, Duration.between(started, clock.instant()));
            MdcContext.clear();
        }
    }

    private ReconcileResult reconcileOnce(UUID playbookId) {
        Optional<Playbook> loaded = store.load(playbookId);
        if (loaded.isEmpty()) {
            fetchFailures.remove(playbookId);
            log.debug("Playbook {} no longer exists", playbookId);
            return ReconcileResult.missing(playbookId);
        }
        Playbook playbook = loaded.get();
        if (playbook.isDeletionRequested()) {
            return teardown(playbook);
        }

        Pass pass = new Pass(playbook);
        PlaybookPhase before = PlaybookPhase.derive(false, pass.actors.values());

        restartChangedActors(pass);

        Resolution resolution;
        try {
            resolution = resolver.resolve(new ArrayList<>(pass.actors.values()));
            fetchFailures.remove(playbookId);
        } catch (ResolveException e) {
            if (e.isTransient()) {
                int attempt = fetchFailures.merge(playbookId, 1, Integer::sum);
                Duration delay = fetchBackoff(attempt);
                log.warn("Resolution of playbook {} failed (attempt {}), retrying in {}: {}",
                        playbookId, attempt, delay, e.getMessage());
                publishPhaseChange(pass, before);
                return new ReconcileResult(playbookId, ReconcileResult.Outcome.RETRY_LATER, delay);
            }
            if (failOnConfiguration(pass, e) == 0) {
                // Nothing to charge: wait for a desired-state change or the periodic resync.
                log.warn("Configuration error in playbook {} names no Actor that can fail: {}",
                        playbookId, e.getSubjects());
                return new ReconcileResult(playbookId, ReconcileResult.Outcome.IDLE, pass.requeue);
            }
            publishPhaseChange(pass, before);
            // The failed Actors are left out of the next resolution; the rest proceed then.
            return new ReconcileResult(playbookId, ReconcileResult.Outcome.PROGRESSED, Duration.ZERO);
        }

        materializePartners(pass, resolution);
        recordDiscoveredDependencies(pass, resolution);

        for (String name : resolution.order()) {
            Actor actor = pass.actors.get(name);
            if (actor == null) {
                continue;
            }
            boolean moved = advanceActor(pass, actor, resolution);
            if (moved && store.isDeletionRequested(playbookId)) {
                log.info("Deletion of playbook {} requested mid-pass; switching to teardown", playbookId);
                return store.load(playbookId).map(this::teardown)
                        .orElse(ReconcileResult.missing(playbookId));
            }
        }

        publishPhaseChange(pass, before);
        return new ReconcileResult(playbookId,
                pass.changed ? ReconcileResult.Outcome.PROGRESSED : ReconcileResult.Outcome.IDLE,
                pass.requeue);
    }

    // ------------------------------------------------------------------
    // Desired-state changes
    // ------------------------------------------------------------------

    private void restartChangedActors(Pass pass) {
        boolean defer = properties.getPipeline().getSourceChangePolicy()
                == ComposerProperties.SourceChangePolicy.DEFER;
        for (Actor actor : List.copyOf(pass.actors.values())) {
            if (!actor.specChangedSinceApplied() || actor.getStage() == PipelineStage.PENDING) {
                continue;
            }
            if (defer && actor.getStage().isInFlight()) {
                log.debug("Actor '{}' changed mid-run; deferring restart", actor.getName());
                continue;
            }
            restart(pass, actor, "desired state changed");
        }
    }

    private boolean restart(Pass pass, Actor actor, String reason) {
        PipelineStage from = actor.getStage();
        resolver.invalidate(actor.getSource(), actor.getResolvedCommit());
        sync.settle(actor.getId());
        actor.restart(reason, clock.instant());
        if (!persist(pass, actor)) {
            return false;
        }
        log.info("Actor '{}' restarted from {}: {}", actor.getName(), from, reason);
        pass.changed = true;
        stageChanged(pass.actors.get(actor.getName()), from);
        return true;
    }

    // ------------------------------------------------------------------
    // Resolution results
    // ------------------------------------------------------------------

    /**
     * Fail the Actors a configuration error is charged to. An Actor that
     * already failed terminally for another reason is charged as well, so the
     * next resolution leaves it out instead of hitting the same error.
     *
     * @return the number of Actors failed
     */
    private int failOnConfiguration(Pass pass, ResolveException e) {
        log.warn("Playbook {} has a configuration error: {}", pass.id(), e.getMessage());
        Instant now = clock.instant();
        int failed = 0;
        for (String name : e.getSubjects()) {
            Actor actor = pass.actors.get(name);
            if (actor == null || (actor.isTerminallyFailed()
                    && actor.getErrorClass() == ErrorClass.CONFIGURATION)) {
                continue;
            }
            PipelineStage from = actor.getStage();
            Advance advance = engine.advance(actor, Observation.resolutionFailed(e.getMessage(), now));
            advance.applyTo(actor, now);
            // A changed spec is what lifts a configuration failure.
            actor.markSpecApplied();
            if (persist(pass, actor)) {
                failed++;
                metrics.recordFailure(ErrorClass.CONFIGURATION);
                if (from != PipelineStage.FAILED) {
                    stageChanged(pass.actors.get(name), from);
                }
            }
        }
        return failed;
    }

    private void materializePartners(Pass pass, Resolution resolution) {
        for (Map.Entry<String, SourceLocator> partner : resolution.partners().entrySet()) {
            Actor actor = pass.playbook.addActor(partner.getKey(), partner.getValue());
            actor.setImplicit(true);
            actor.setDescription("Partner discovered from a manifest");
            if (persist(pass, actor)) {
                log.info("Added partner '{}' ({}) to playbook {}",
                        partner.getKey(), partner.getValue(), pass.id());
            }
        }
    }

    private void recordDiscoveredDependencies(Pass pass, Resolution resolution) {
        for (Actor actor : List.copyOf(pass.actors.values())) {
            if (!resolution.discovered().containsKey(actor.getName())) {
                continue;
            }
            Set<String> found = resolution.discoveredBy(actor.getName());
            if (!found.equals(actor.getDiscoveredDependencies())) {
                actor.setDiscoveredDependencies(found);
                persist(pass, actor);
            }
        }
    }

    // ------------------------------------------------------------------
    // Per-Actor advance
    // ------------------------------------------------------------------

    /** @return true if the Actor changed stage in this pass */
    private boolean advanceActor(Pass pass, Actor initial, Resolution resolution) {
        Actor actor = initial;
        boolean moved = false;
        try {
            for (int step = 0; step < MAX_STEPS_PER_ACTOR; step++) {
                MdcContext.setActor(actor.getName(), actor.getStage().name());
                if (!sourceMoved(pass, actor, resolution)) {
                    return moved;
                }
                actor = pass.actors.get(actor.getName());

                PipelineStage from = actor.getStage();
                Instant now = clock.instant();
                Advance advance = engine.advance(actor, observe(pass, actor, resolution, now));
                if (advance.isNoop(from)) {
                    pass.requeueWithin(advance.requeueAfter());
                    pass.requeueWithin(pollIfBusy(actor));
                    return moved;
                }

                // The build manifests are rendered from the commit this step pins.
                if (advance.commit() != null) {
                    actor.setResolvedCommit(advance.commit());
                }
                try {
                    enact(pass, actor, advance.effects(), now);
                } catch (ApplyException e) {
                    advance = e.isTransient()
                            ? engine.transientFailure(actor, e.getMessage())
                            : engine.permanentFailure(ErrorClass.PERMANENT, e.getMessage());
                    log.warn("Cluster work for actor '{}' failed: {}", actor.getName(), e.getMessage());
                }

                if (advance.clearRetryRequest()) {
                    log.warn("Retry of actor '{}' ignored: failure is not retryable ({})",
                            actor.getName(), actor.getLastError());
                }
                advance.applyTo(actor, now);
                if (!persist(pass, actor)) {
                    return moved;
                }
                actor = pass.actors.get(actor.getName());
                if (advance.failure() != null) {
                    metrics.recordFailure(advance.failure().errorClass());
                }
                if (actor.getStage() != from) {
                    moved = true;
                    stageChanged(actor, from);
                    if (from == PipelineStage.SYNCING) {
                        sync.settle(actor.getId());
                    }
                }
                pass.changed = true;
                pass.requeueWithin(advance.requeueAfter());

                if (!advance.effects().isEmpty() || actor.getStage() == PipelineStage.FAILED) {
                    // Back in PENDING after a reset: the new run starts on the next pass.
                    pass.requeueWithin(actor.getStage() == PipelineStage.PENDING
                            ? Duration.ZERO : pollIfBusy(actor));
                    return moved;
                }
            }
            log.warn("Actor '{}' did not settle within {} steps", actor.getName(), MAX_STEPS_PER_ACTOR);
            pass.requeueWithin(Duration.ZERO);
            return moved;
        } catch (ApplyException e) {
            // Observation failed; nothing was changed.
            log.warn("Cannot observe actor '{}': {}", actor.getName(), e.getMessage());
            pass.requeueWithin(properties.getReconcile().getPollInterval());
            return moved;
        } catch (RuntimeException e) {
            log.error("Unexpected error advancing actor '{}': {}", actor.getName(), e.getMessage(), e);
            pass.requeueWithin(properties.getReconcile().getPollInterval());
            return moved;
        } finally {
            MdcContext.clearActor();
        }
    }

    /**
     * Restart an Actor whose branch or tag moved to a new commit, as configured.
     *
     * @return false if a restart was needed but could not be saved
     */
    private boolean sourceMoved(Pass pass, Actor actor, Resolution resolution) {
        String pinned = actor.getResolvedCommit();
        Optional<String> latest = resolution.commitOf(actor.getName());
        if (pinned == null || latest.isEmpty() || pinned.equals(latest.get())) {
            return true;
        }
        PipelineStage stage = actor.getStage();
        boolean serving = stage.isServing() && !actor.isLive();
        boolean inFlight = stage.isInFlight() && properties.getPipeline().getSourceChangePolicy()
                == ComposerProperties.SourceChangePolicy.RESTART;
        if (serving || inFlight) {
            return restart(pass, actor, "source moved to " + latest.get());
        }
        return true;
    }

    private Observation observe(Pass pass, Actor actor, Resolution resolution, Instant now) {
        boolean depsServing = resolution.graph().dependenciesOf(actor.getName()).stream()
                .map(pass.actors::get)
                .allMatch(dep -> dep != null && dep.getStage().isServing());

        ObservedState observed = switch (actor.getStage()) {
            case BUILDING, PUSHING, DEPLOYING, RUNNING -> resources.observe(pass.playbook, actor);
            default -> ObservedState.nothing();
        };

        return Observation.of(depsServing, resolution.commitOf(actor.getName()).orElse(null), observed, now)
                .withSync(sync.hasPending(actor.getId()), sync.isApplied(actor.getId()));
    }

    private void enact(Pass pass, Actor actor, List<SideEffect> effects, Instant now) {
        for (SideEffect effect : effects) {
            if (effect == SideEffect.SYNC) {
                sync.dispatch(actor, now);
            } else {
                resources.enact(pass.playbook, actor, effect);
            }
        }
    }

    private Duration pollIfBusy(Actor actor) {
        PipelineStage stage = actor.getStage();
        return stage.isInFlight() || stage == PipelineStage.SYNCING
                ? properties.getReconcile().getPollInterval()
                : null;
    }

    // ------------------------------------------------------------------
    // Teardown
    // ------------------------------------------------------------------

    private ReconcileResult teardown(Playbook playbook) {
        UUID id = playbook.getId();
        try {
            resources.teardown(playbook);
        } catch (ApplyException e) {
            log.warn("Teardown of playbook {} failed, will retry: {}", id, e.getMessage());
            return new ReconcileResult(id, ReconcileResult.Outcome.RETRY_LATER,
                    properties.getReconcile().getPollInterval());
        }
        playbook.getActors().forEach(a -> sync.forget(a.getId()));
        store.delete(id);
        fetchFailures.remove(id);

        events.publish(ComposerEvent.playbook(ComposerEvent.Type.PLAYBOOK_DELETED, id,
                Map.of("key", "deleted", "actors", playbook.getActors().size()), clock.instant()));
        log.info("Playbook {} torn down", id);
        return new ReconcileResult(id, ReconcileResult.Outcome.TORN_DOWN, null);
    }

    // ------------------------------------------------------------------
    // Persistence and events
    // ------------------------------------------------------------------

    /**
     * Save an Actor and swap the stored copy into the pass.
     *
     * @return false if a concurrent writer got there first; the Playbook is
     *         then requeued and the Actor skipped for the rest of the pass
     */
    private boolean persist(Pass pass, Actor actor) {
        try {
            Actor saved = store.saveActor(actor);
            pass.actors.put(saved.getName(), saved);
            return true;
        } catch (OptimisticLockingFailureException e) {
            log.info("Actor '{}' was modified concurrently; requeueing playbook {}",
                    actor.getName(), pass.id());
            pass.requeueWithin(Duration.ZERO);
            return false;
        }
    }

    private void stageChanged(Actor actor, PipelineStage from) {
        if (actor.getStage() != from) {
            metrics.recordTransition(from, actor.getStage());
        }
        log.info("Actor '{}' {} -> {} (rev {}){}", actor.getName(), from, actor.getStage(),
                actor.getRevision(), actor.getLastError() == null || actor.getStage() != PipelineStage.FAILED
                        ? "" : ": " + actor.getLastError());
        events.publish(ComposerEvent.stageChanged(actor, from, clock.instant()));
    }

    private void publishPhaseChange(Pass pass, PlaybookPhase before) {
        PlaybookPhase after = PlaybookPhase.derive(false, pass.actors.values());
        if (after != before) {
            log.info("Playbook {} phase {} -> {}", pass.id(), before, after);
            events.publish(ComposerEvent.playbook(ComposerEvent.Type.PLAYBOOK_PHASE_CHANGED, pass.id(),
                    Map.of("key", after.name(), "from", before.name(), "to", after.name()),
                    clock.instant()));
        }
    }

    private Duration fetchBackoff(int attempt) {
        ComposerProperties.Reconcile settings = properties.getReconcile();
        int shift = Math.max(0, Math.min(attempt - 1, 20));
        Duration delay = settings.getFetchBackoffBase().multipliedBy(1L << shift);
        return delay.compareTo(settings.getFetchBackoffMax()) > 0 ? settings.getFetchBackoffMax() : delay;
    }
}
