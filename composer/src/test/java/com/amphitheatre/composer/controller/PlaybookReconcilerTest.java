package com.amphitheatre.composer.controller;

import com.amphitheatre.composer.cluster.ClusterException;
import com.amphitheatre.composer.cluster.ObjectKind;
import com.amphitheatre.composer.config.ComposerProperties;
import com.amphitheatre.composer.events.ComposerEvent;
import com.amphitheatre.composer.events.EventBus;
import com.amphitheatre.composer.fakes.InMemoryClusterClient;
import com.amphitheatre.composer.fakes.InMemoryDesiredStateStore;
import com.amphitheatre.composer.fakes.MutableClock;
import com.amphitheatre.composer.fakes.StaticSourceFetcher;
import com.amphitheatre.composer.metrics.ComposerMetrics;
import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.ErrorClass;
import com.amphitheatre.composer.model.PipelineStage;
import com.amphitheatre.composer.model.Playbook;
import com.amphitheatre.composer.model.SourceLocator;
import com.amphitheatre.composer.resolver.ManifestCache;
import com.amphitheatre.composer.resolver.ManifestParser;
import com.amphitheatre.composer.resolver.Resolver;
import com.amphitheatre.composer.resources.ObjectTemplates;
import com.amphitheatre.composer.resources.Resources;
import com.amphitheatre.composer.sync.SyncCoordinator;
import com.amphitheatre.composer.sync.SyncRequest;
import com.amphitheatre.composer.workflow.WorkflowEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full passes over in-memory fakes of the store, the source host and the
 * cluster. Cluster objects only move when the test marks them.
 */
class PlaybookReconcilerTest {

    private static final String SHOP   = "https://github.com/acme/shop";
    private static final String PG     = "https://github.com/acme/postgres";
    private static final String CACHE  = "https://github.com/acme/cache";
    private static final String COMMIT = "c0ffee01c0ffee01c0ffee01c0ffee01c0ffee01";
    private static final String NEXT   = "d00dfeedd00dfeedd00dfeedd00dfeedd00dfeed";

    ComposerProperties properties;
    InMemoryDesiredStateStore store;
    InMemoryClusterClient cluster;
    StaticSourceFetcher fetcher;
    SyncCoordinator sync;
    MutableClock clock;
    SimpleMeterRegistry registry;
    PlaybookReconciler reconciler;
    List<ComposerEvent> received;

    Playbook playbook;
    String ns;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        properties = new ComposerProperties();
        store    = new InMemoryDesiredStateStore();
        cluster  = new InMemoryClusterClient();
        fetcher  = new StaticSourceFetcher()
                .repo(SHOP, COMMIT, "api", "api/main.go", "web", "web/index.html")
                .repo(PG, "feedbeef");
        clock    = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        registry = new SimpleMeterRegistry();

        EventBus events = new EventBus();
        received = new ArrayList<>();
        events.subscribeAll(received::add);
        sync = new SyncCoordinator(events);

        reconciler = new PlaybookReconciler(
                store,
                new Resolver(fetcher, new ManifestParser(), new ManifestCache(64)),
                new WorkflowEngine(properties.getPipeline()),
                new Resources(cluster, new ObjectTemplates(mapper, properties.getRegistry(), "1Gi"), mapper),
                sync,
                events,
                new ComposerMetrics(registry),
                properties,
                clock);

        playbook = store.put(new Playbook("shop"));
        ns = playbook.targetNamespace();
    }

    // ------------------------------------------------------------------
    // Single Actor pipeline
    // ------------------------------------------------------------------

    @Test
    void firstPass_resolvesAndStartsTheBuild() {
        Actor api = actor("api", "api");

        ReconcileResult result = reconcile();

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.PROGRESSED);
        assertThat(result.requeueAfter()).isEqualTo(Duration.ofSeconds(5));
        assertThat(api.getStage()).isEqualTo(PipelineStage.BUILDING);
        assertThat(api.getResolvedCommit()).isEqualTo(COMMIT);
        assertThat(cluster.applies()).isEqualTo(3);
        assertThat(cluster.contains(ObjectKind.NAMESPACE, null, ns)).isTrue();
        assertThat(cluster.contains(ObjectKind.JOB, ns, "api-build")).isTrue();
        assertThat(received).extracting(ComposerEvent::newStage)
                .contains(PipelineStage.RESOLVING, PipelineStage.BUILDING);
    }

    @Test
    void unchangedPass_isIdleAndMakesNoWrites() {
        actor("api", "api");
        reconcile();

        ReconcileResult again = reconcile();

        assertThat(again.outcome()).isEqualTo(ReconcileResult.Outcome.IDLE);
        assertThat(again.requeueAfter()).isEqualTo(Duration.ofSeconds(5));
        assertThat(cluster.applies()).isEqualTo(3);
    }

    @Test
    void pipeline_runsThroughToRunningAndRetiresJobs() {
        Actor api = actor("api", "api");

        driveToRunning("api");

        assertThat(api.getStage()).isEqualTo(PipelineStage.RUNNING);
        assertThat(cluster.contains(ObjectKind.DEPLOYMENT, ns, "api")).isTrue();
        assertThat(cluster.contains(ObjectKind.SERVICE, ns, "api")).isTrue();
        assertThat(cluster.contains(ObjectKind.JOB, ns, "api-build")).isFalse();
        assertThat(cluster.contains(ObjectKind.JOB, ns, "api-push")).isFalse();

        ReconcileResult settled = reconcile();
        assertThat(settled.outcome()).isEqualTo(ReconcileResult.Outcome.IDLE);
        assertThat(settled.requeueAfter()).isNull();
    }

    @Test
    void rejectedManifest_failsTheActorWithoutRetry() {
        Actor api = actor("api", "api");
        cluster.failApplies(new ClusterException(ClusterException.Kind.PERMANENT, 422, "Job.batch is invalid"));

        ReconcileResult result = reconcile();

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.PROGRESSED);
        assertThat(result.requeueAfter()).isNull();
        assertThat(api.getStage()).isEqualTo(PipelineStage.FAILED);
        assertThat(api.getErrorClass()).isEqualTo(ErrorClass.PERMANENT);
        assertThat(api.isRetryable()).isFalse();
        assertThat(api.getRetryCount()).isZero();
        assertThat(api.getLastError()).contains("Job.batch is invalid");
        assertThat(registry.get("composer.actor.failures").tag("class", "PERMANENT").counter().count())
                .isEqualTo(1.0);

        clock.advance(Duration.ofHours(1));
        assertThat(reconcile().outcome()).isEqualTo(ReconcileResult.Outcome.IDLE);
        assertThat(api.getStage()).isEqualTo(PipelineStage.FAILED);
    }

    // ------------------------------------------------------------------
    // Dependencies and isolation
    // ------------------------------------------------------------------

    @Test
    void dependent_waitsUntilItsDependencyIsRunning() {
        Actor api = actor("api", "api");
        Actor web = actor("web", "web", "api");

        reconcile();
        assertThat(api.getStage()).isEqualTo(PipelineStage.BUILDING);
        assertThat(web.getStage()).isEqualTo(PipelineStage.PENDING);

        cluster.markJobSucceeded(ns, "api-build");
        reconcile();
        cluster.markJobSucceeded(ns, "api-push");
        reconcile();
        assertThat(web.getStage()).isEqualTo(PipelineStage.PENDING);

        cluster.markDeploymentReady(ns, "api");
        reconcile();

        assertThat(api.getStage()).isEqualTo(PipelineStage.RUNNING);
        assertThat(web.getStage()).isEqualTo(PipelineStage.BUILDING);
    }

    @Test
    void failingActor_doesNotStopItsSiblings() {
        Actor api = actor("api", "api");
        Actor web = actor("web", "web");
        reconcile();

        cluster.markJobFailed(ns, "api-build");
        cluster.markJobSucceeded(ns, "web-build");
        reconcile();

        assertThat(api.getStage()).isEqualTo(PipelineStage.FAILED);
        assertThat(api.getErrorClass()).isEqualTo(ErrorClass.TRANSIENT_INFRA);
        assertThat(api.isRetryable()).isTrue();
        assertThat(api.getRetryCount()).isEqualTo(1);
        assertThat(api.getLastError()).contains("build job failed");
        assertThat(web.getStage()).isEqualTo(PipelineStage.PUSHING);
    }

    @Test
    void failedActor_isRetriedOnceItsBackoffElapsed() {
        Actor api = actor("api", "api");
        reconcile();
        cluster.markJobFailed(ns, "api-build");
        ReconcileResult failed = reconcile();
        assertThat(failed.requeueAfter()).isEqualTo(Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(10));
        ReconcileResult reset = reconcile();

        assertThat(api.getStage()).isEqualTo(PipelineStage.PENDING);
        assertThat(reset.requeueAfter()).isEqualTo(Duration.ZERO);
        assertThat(cluster.contains(ObjectKind.JOB, ns, "api-build")).isFalse();

        reconcile();

        assertThat(api.getStage()).isEqualTo(PipelineStage.BUILDING);
        assertThat(api.getRetryCount()).isEqualTo(1);
        assertThat(cluster.contains(ObjectKind.JOB, ns, "api-build")).isTrue();
    }

    // ------------------------------------------------------------------
    // Resolution
    // ------------------------------------------------------------------

    @Test
    void cycle_failsEveryActorOnItAsConfiguration() {
        Actor api = actor("api", "api", "web");
        Actor web = actor("web", "web", "api");

        ReconcileResult result = reconcile();

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.PROGRESSED);
        assertThat(result.requeueAfter()).isEqualTo(Duration.ZERO);
        for (Actor actor : List.of(api, web)) {
            assertThat(actor.getStage()).isEqualTo(PipelineStage.FAILED);
            assertThat(actor.getErrorClass()).isEqualTo(ErrorClass.CONFIGURATION);
            assertThat(actor.isRetryable()).isFalse();
        }
        assertThat(cluster.applies()).isZero();

        ReconcileResult next = reconcile();
        assertThat(next.outcome()).isEqualTo(ReconcileResult.Outcome.IDLE);
        assertThat(next.requeueAfter()).isNull();
    }

    @Test
    void cycleAmongDiscoveredPartners_failsTheActorThatIntroducedThem() {
        fetcher.repo(CACHE, "cafe0001");
        fetcher.manifest(SHOP, "api", "[partners.db]\nrepository = \"" + PG + "\"\n");
        fetcher.manifest(PG, "", "[partners.cache]\nrepository = \"" + CACHE + "\"\n");
        fetcher.manifest(CACHE, "", "[partners.db]\nrepository = \"" + PG + "\"\n");
        Actor api = actor("api", "api");

        ReconcileResult result = reconcile();

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.PROGRESSED);
        assertThat(api.getStage()).isEqualTo(PipelineStage.FAILED);
        assertThat(api.getErrorClass()).isEqualTo(ErrorClass.CONFIGURATION);
        assertThat(api.isRetryable()).isFalse();
        assertThat(api.getLastError()).contains("dependency cycle", "db", "cache");
        assertThat(playbook.getActors()).hasSize(1);

        ReconcileResult next = reconcile();
        assertThat(next.outcome()).isEqualTo(ReconcileResult.Outcome.IDLE);
        assertThat(next.requeueAfter()).isNull();
        assertThat(cluster.applies()).isZero();
    }

    @Test
    void terminallyFailedActor_takesALaterConfigurationErrorAndStopsBlockingThePass() {
        Actor api = actor("api", "api");
        cluster.failApplies(new ClusterException(ClusterException.Kind.PERMANENT, 422, "invalid"));
        reconcile();
        assertThat(api.getErrorClass()).isEqualTo(ErrorClass.PERMANENT);

        // The new commit declares a partner directory that does not exist.
        fetcher.advance(SHOP, NEXT);
        fetcher.manifest(SHOP, "api", "[partners.db]\npath = \"db\"\n");
        ReconcileResult charged = reconcile();

        assertThat(charged.outcome()).isEqualTo(ReconcileResult.Outcome.PROGRESSED);
        assertThat(api.getStage()).isEqualTo(PipelineStage.FAILED);
        assertThat(api.getErrorClass()).isEqualTo(ErrorClass.CONFIGURATION);
        assertThat(api.getLastError()).contains("path 'db' not found");

        ReconcileResult next = reconcile();
        assertThat(next.outcome()).isEqualTo(ReconcileResult.Outcome.IDLE);
        assertThat(next.requeueAfter()).isNull();
    }

    @Test
    void unavailableSourceHost_backsOffForTheWholePlaybook() {
        Actor api = actor("api", "api");
        fetcher.unavailable(SHOP);

        ReconcileResult first = reconcile();
        ReconcileResult second = reconcile();

        assertThat(first.outcome()).isEqualTo(ReconcileResult.Outcome.RETRY_LATER);
        assertThat(first.requeueAfter()).isEqualTo(Duration.ofSeconds(5));
        assertThat(second.requeueAfter()).isEqualTo(Duration.ofSeconds(10));
        assertThat(api.getStage()).isEqualTo(PipelineStage.PENDING);

        fetcher.available(SHOP);
        reconcile();
        assertThat(api.getStage()).isEqualTo(PipelineStage.BUILDING);
    }

    @Test
    void discoveredPartner_becomesAnImplicitActorAndADependency() {
        fetcher.manifest(SHOP, "api", "[partners.db]\nrepository = \"" + PG + "\"\n");
        Actor api = actor("api", "api");

        reconcile();

        Actor db = playbook.actor("db").orElseThrow();
        assertThat(db.isImplicit()).isTrue();
        assertThat(db.getSource().getRepository()).isEqualTo(PG);
        assertThat(db.getStage()).isEqualTo(PipelineStage.BUILDING);
        assertThat(api.getDiscoveredDependencies()).containsExactly("db");
        assertThat(api.getStage()).isEqualTo(PipelineStage.PENDING);

        reconcile();
        assertThat(playbook.getActors()).hasSize(2);
    }

    // ------------------------------------------------------------------
    // Desired-state and source changes
    // ------------------------------------------------------------------

    @Test
    void specChange_restartsTheActorWithAFreshBudget() {
        Actor api = actor("api", "api");
        reconcile();
        long revision = api.getRevision();

        api.updateSpec(null, api.getSource(), Set.of(), false, Set.of(9090));
        reconcile();

        assertThat(api.getStage()).isEqualTo(PipelineStage.BUILDING);
        assertThat(api.getRevision()).isGreaterThan(revision);
        assertThat(api.getRetryCount()).isZero();
        assertThat(api.getErrorHistory()).anyMatch(e -> e.startsWith("[RESTART] desired state changed"));
    }

    @Test
    void movedBranch_rebuildsARunningActor() {
        Actor api = actor("api", "api");
        driveToRunning("api");

        fetcher.advance(SHOP, NEXT);
        reconcile();

        assertThat(api.getStage()).isEqualTo(PipelineStage.BUILDING);
        assertThat(api.getResolvedCommit()).isEqualTo(NEXT);
        assertThat(cluster.contains(ObjectKind.JOB, ns, "api-build")).isTrue();
        assertThat(api.getErrorHistory()).anyMatch(e -> e.startsWith("[RESTART] source moved"));
    }

    @Test
    void deferPolicy_letsTheRunFinishBeforeRestarting() {
        properties.getPipeline().setSourceChangePolicy(ComposerProperties.SourceChangePolicy.DEFER);
        Actor api = actor("api", "api");
        reconcile();
        assertThat(api.getStage()).isEqualTo(PipelineStage.BUILDING);

        api.updateSpec(null, api.getSource(), Set.of(), false, Set.of(9090));
        fetcher.advance(SHOP, NEXT);
        reconcile();

        assertThat(api.getStage()).isEqualTo(PipelineStage.BUILDING);
        assertThat(api.getResolvedCommit()).isEqualTo(COMMIT);
        assertThat(api.getErrorHistory()).noneMatch(e -> e.startsWith("[RESTART]"));

        cluster.markJobSucceeded(ns, "api-build");
        reconcile();
        cluster.markJobSucceeded(ns, "api-push");
        reconcile();
        cluster.markDeploymentReady(ns, "api");
        reconcile();
        assertThat(api.getStage()).isEqualTo(PipelineStage.RUNNING);

        reconcile();

        assertThat(api.getStage()).isEqualTo(PipelineStage.BUILDING);
        assertThat(api.getResolvedCommit()).isEqualTo(NEXT);
        assertThat(api.getErrorHistory()).anyMatch(e -> e.startsWith("[RESTART]"));
    }

    // ------------------------------------------------------------------
    // Sync
    // ------------------------------------------------------------------

    @Test
    void syncRequest_movesALiveActorThroughSyncing() {
        Actor api = actor("api", "api");
        api.setLive(true);
        driveToRunning("api");

        SyncRequest request = sync.request(api, List.of("main.go"), clock.instant());
        reconcile();

        assertThat(api.getStage()).isEqualTo(PipelineStage.SYNCING);
        assertThat(received).extracting(ComposerEvent::type).contains(ComposerEvent.Type.SYNC_REQUESTED);

        assertThat(sync.complete(api.getId(), request.requestId())).isTrue();
        reconcile();

        assertThat(api.getStage()).isEqualTo(PipelineStage.RUNNING);
        assertThat(sync.isApplied(api.getId())).isFalse();
    }

    // ------------------------------------------------------------------
    // Teardown and concurrency
    // ------------------------------------------------------------------

    @Test
    void deletionRequest_tearsEverythingDown() {
        actor("api", "api");
        reconcile();
        playbook.requestDeletion(clock.instant());

        ReconcileResult result = reconcile();

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.TORN_DOWN);
        assertThat(cluster.size()).isZero();
        assertThat(store.load(playbook.getId())).isEmpty();
        assertThat(received).extracting(ComposerEvent::type).contains(ComposerEvent.Type.PLAYBOOK_DELETED);
        assertThat(reconcile().outcome()).isEqualTo(ReconcileResult.Outcome.MISSING);
    }

    @Test
    void deletionSeenMidPass_switchesToTeardown() {
        actor("api", "api");
        Actor web = actor("web", "web");
        store.requestDeletionOnSaveOf("api");

        ReconcileResult result = reconcile();

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.TORN_DOWN);
        assertThat(web.getStage()).isEqualTo(PipelineStage.PENDING);
        assertThat(cluster.size()).isZero();
        assertThat(store.load(playbook.getId())).isEmpty();
        assertThat(received).extracting(ComposerEvent::type).contains(ComposerEvent.Type.PLAYBOOK_DELETED);
    }

    @Test
    void concurrentWrite_requeuesImmediately() {
        actor("api", "api");
        store.conflictOnNextSave("api");

        ReconcileResult result = reconcile();

        assertThat(result.requeueAfter()).isEqualTo(Duration.ZERO);
        assertThat(store.saves()).isZero();
        assertThat(cluster.applies()).isZero();
    }

    @Test
    void everyPassIsCounted() {
        actor("api", "api");
        reconcile();
        reconcile();

        assertThat(registry.get("composer.reconcile.passes").tag("outcome", "PROGRESSED").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("composer.reconcile.passes").tag("outcome", "IDLE").counter().count())
                .isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Actor actor(String name, String path, String... deps) {
        Actor actor = playbook.addActor(name, SourceLocator.of(SHOP, path, "main"));
        actor.updateSpec(null, actor.getSource(), Set.of(deps), false, Set.of(8080));
        return actor;
    }

    private ReconcileResult reconcile() {
        return reconciler.reconcile(playbook.getId());
    }

    private void driveToRunning(String name) {
        reconcile();
        cluster.markJobSucceeded(ns, name + "-build");
        reconcile();
        cluster.markJobSucceeded(ns, name + "-push");
        reconcile();
        cluster.markDeploymentReady(ns, name);
        reconcile();
    }
}
