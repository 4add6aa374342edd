package com.amphitheatre.composer.service;

import com.amphitheatre.composer.api.dto.ActorRequest;
import com.amphitheatre.composer.api.dto.SubmitPlaybookRequest;
import com.amphitheatre.composer.controller.ReconcileQueue;
import com.amphitheatre.composer.controller.ReconcileReason;
import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.ErrorClass;
import com.amphitheatre.composer.model.PipelineStage;
import com.amphitheatre.composer.model.Playbook;
import com.amphitheatre.composer.model.SourceLocator;
import com.amphitheatre.composer.repository.ActorRepository;
import com.amphitheatre.composer.repository.PlaybookRepository;
import com.amphitheatre.composer.sync.SyncCoordinator;
import com.amphitheatre.composer.sync.SyncRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PlaybookService.
 *
 * Repositories, queue and sync coordinator are mocked; no Spring context and
 * no transaction, so enqueueing happens immediately.
 */
@ExtendWith(MockitoExtension.class)
class PlaybookServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
    private static final String  REPO = "https://github.com/acme/shop";

    @Mock PlaybookRepository playbookRepo;
    @Mock ActorRepository    actorRepo;
    @Mock ReconcileQueue     queue;
    @Mock SyncCoordinator    sync;

    PlaybookService service;

    @BeforeEach
    void setUp() {
        service = new PlaybookService(playbookRepo, actorRepo, queue, sync, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_validRequest_savesPlaybookAndEnqueues() {
        when(playbookRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        Playbook result = service.submit(new SubmitPlaybookRequest("shop", null, null, 3600L, List.of(
                actor("api", List.of(), 8080),
                actor("web", List.of("api")))));

        assertThat(result.getActors()).extracting(Actor::getName).containsExactly("api", "web");
        assertThat(result.actor("web").orElseThrow().getDependencies()).containsExactly("api");
        assertThat(result.actor("api").orElseThrow().getPorts()).containsExactly(8080);
        assertThat(result.getTtlSeconds()).isEqualTo(3600L);
        assertThat(result.managesNamespace()).isTrue();
        verify(queue).enqueue(result.getId(), ReconcileReason.SUBMITTED);
    }

    @Test
    void submit_blankTitle_rejected() {
        assertThatThrownBy(() -> service.submit(
                new SubmitPlaybookRequest(" ", null, null, null, List.of(actor("api", List.of())))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("title");
        verifyNoInteractions(playbookRepo, queue);
    }

    @Test
    void submit_noActors_rejected() {
        assertThatThrownBy(() -> service.submit(new SubmitPlaybookRequest("shop", null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void submit_duplicateActorNames_rejected() {
        assertThatThrownBy(() -> service.submit(new SubmitPlaybookRequest("shop", null, null, null,
                List.of(actor("api", List.of()), actor("api", List.of())))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    void submit_invalidActorName_rejected() {
        assertThatThrownBy(() -> service.submit(new SubmitPlaybookRequest("shop", null, null, null,
                List.of(actor("Api_1", List.of())))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Api_1");
    }

    @Test
    void submit_portOutOfRange_rejected() {
        assertThatThrownBy(() -> service.submit(new SubmitPlaybookRequest("shop", null, null, null,
                List.of(actor("api", List.of(), 70000)))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("70000");
    }

    @Test
    void submit_invalidNamespace_rejected() {
        assertThatThrownBy(() -> service.submit(new SubmitPlaybookRequest("shop", null, "Not_A_Namespace", null,
                List.of(actor("api", List.of())))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("namespace");
    }

    @Test
    void submit_repositoryWithShellSyntax_rejected() {
        ActorRequest evil = new ActorRequest("api", null,
                "https://evil.example/$(touch${IFS}x)#github.com/acme/shop", "api", "main", null,
                List.of(), false, List.of());

        assertThatThrownBy(() -> service.submit(new SubmitPlaybookRequest("shop", null, null, null, List.of(evil))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("https://github.com/<owner>/<repo>");
        verifyNoInteractions(playbookRepo, queue);
    }

    @Test
    void submit_commitThatIsNotASha_rejected() {
        ActorRequest pinned = new ActorRequest("api", null, REPO, "api", "main", "--help",
                List.of(), false, List.of());

        assertThatThrownBy(() -> service.submit(new SubmitPlaybookRequest("shop", null, null, null, List.of(pinned))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("invalid commit");
    }

    // ------------------------------------------------------------------
    // putActor()
    // ------------------------------------------------------------------

    @Test
    void putActor_newName_addsActorAndEnqueues() {
        Playbook playbook = playbook();
        when(playbookRepo.findById(playbook.getId())).thenReturn(Optional.of(playbook));
        when(playbookRepo.save(playbook)).thenReturn(playbook);

        Optional<Playbook> result = service.putActor(playbook.getId(), "web", actor(null, List.of("api")));

        assertThat(result).isPresent();
        assertThat(playbook.actor("web")).hasValueSatisfying(a ->
                assertThat(a.getDependencies()).containsExactly("api"));
        verify(queue).enqueue(playbook.getId(), ReconcileReason.DESIRED_STATE_CHANGED);
    }

    @Test
    void putActor_discoveredPartner_becomesExplicit() {
        Playbook playbook = playbook();
        Actor db = playbook.addActor("db", SourceLocator.of("https://github.com/acme/postgres", "", "main"));
        db.setImplicit(true);
        when(playbookRepo.findById(playbook.getId())).thenReturn(Optional.of(playbook));
        when(playbookRepo.save(playbook)).thenReturn(playbook);

        service.putActor(playbook.getId(), "db", actor(null, List.of(), 5432));

        assertThat(db.isImplicit()).isFalse();
        assertThat(db.getPorts()).containsExactly(5432);
        assertThat(db.getSource().getRepository()).isEqualTo(REPO);
    }

    @Test
    void putActor_unknownPlaybook_returnsEmpty() {
        UUID unknown = UUID.randomUUID();
        when(playbookRepo.findById(unknown)).thenReturn(Optional.empty());

        assertThat(service.putActor(unknown, "api", actor(null, List.of()))).isEmpty();
        verifyNoInteractions(queue);
    }

    @Test
    void putActor_playbookBeingTornDown_conflicts() {
        Playbook playbook = playbook();
        playbook.requestDeletion(NOW);
        when(playbookRepo.findById(playbook.getId())).thenReturn(Optional.of(playbook));

        assertThatThrownBy(() -> service.putActor(playbook.getId(), "api", actor(null, List.of())))
                .isInstanceOf(IllegalStateException.class);
        verify(playbookRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // requestTeardown()
    // ------------------------------------------------------------------

    @Test
    void requestTeardown_marksDeletionAndEnqueues() {
        Playbook playbook = playbook();
        when(playbookRepo.findById(playbook.getId())).thenReturn(Optional.of(playbook));
        when(playbookRepo.save(playbook)).thenReturn(playbook);

        Optional<Playbook> result = service.requestTeardown(playbook.getId());

        assertThat(result).isPresent();
        assertThat(playbook.getDeletionRequestedAt()).isEqualTo(NOW);
        verify(queue).enqueue(playbook.getId(), ReconcileReason.TEARDOWN);
    }

    // ------------------------------------------------------------------
    // requestRetry()
    // ------------------------------------------------------------------

    @Test
    void requestRetry_retryableFailure_setsFlagAndEnqueues() {
        Actor actor = failedActor(true);
        when(actorRepo.findById(actor.getId())).thenReturn(Optional.of(actor));
        when(actorRepo.save(actor)).thenReturn(actor);

        Optional<Actor> result = service.requestRetry(actor.getId());

        assertThat(result).isPresent();
        assertThat(actor.isRetryRequested()).isTrue();
        verify(queue).enqueue(actor.getPlaybookId(), ReconcileReason.RETRY);
    }

    @Test
    void requestRetry_permanentFailure_conflicts() {
        Actor actor = failedActor(false);
        when(actorRepo.findById(actor.getId())).thenReturn(Optional.of(actor));

        assertThatThrownBy(() -> service.requestRetry(actor.getId()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("permanently");
        assertThat(actor.isRetryRequested()).isFalse();
        verifyNoInteractions(queue);
    }

    @Test
    void requestRetry_actorNotFailed_conflicts() {
        Actor actor = playbook().actor("api").orElseThrow();
        when(actorRepo.findById(actor.getId())).thenReturn(Optional.of(actor));

        assertThatThrownBy(() -> service.requestRetry(actor.getId()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("PENDING");
    }

    // ------------------------------------------------------------------
    // Sync
    // ------------------------------------------------------------------

    @Test
    void requestSync_recordsRequestAndEnqueues() {
        Actor actor = playbook().actor("api").orElseThrow();
        actor.setLive(true);
        SyncRequest request = new SyncRequest(UUID.randomUUID(), actor.getId(), actor.getPlaybookId(),
                List.of("main.go"), NOW);
        when(actorRepo.findById(actor.getId())).thenReturn(Optional.of(actor));
        when(sync.request(eq(actor), eq(List.of("main.go")), eq(NOW))).thenReturn(request);

        Optional<SyncRequest> result = service.requestSync(actor.getId(), List.of("main.go"));

        assertThat(result).contains(request);
        verify(queue).enqueue(actor.getPlaybookId(), ReconcileReason.SYNC);
    }

    @Test
    void completeSync_unknownRequest_returnsFalseWithoutEnqueue() {
        Actor actor = playbook().actor("api").orElseThrow();
        UUID requestId = UUID.randomUUID();
        when(actorRepo.findById(actor.getId())).thenReturn(Optional.of(actor));
        when(sync.complete(actor.getId(), requestId)).thenReturn(false);

        assertThat(service.completeSync(actor.getId(), requestId)).contains(false);
        verifyNoInteractions(queue);
    }

    @Test
    void completeSync_inFlightRequest_enqueues() {
        Actor actor = playbook().actor("api").orElseThrow();
        UUID requestId = UUID.randomUUID();
        when(actorRepo.findById(actor.getId())).thenReturn(Optional.of(actor));
        when(sync.complete(actor.getId(), requestId)).thenReturn(true);

        assertThat(service.completeSync(actor.getId(), requestId)).contains(true);
        verify(queue).enqueue(actor.getPlaybookId(), ReconcileReason.SYNC);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ActorRequest actor(String name, List<String> dependencies, Integer... ports) {
        return new ActorRequest(name, null, REPO, name, "main", null, dependencies, false, List.of(ports));
    }

    private static Playbook playbook() {
        Playbook playbook = new Playbook("shop");
        playbook.addActor("api", SourceLocator.of(REPO, "api", "main"));
        return playbook;
    }

    private static Actor failedActor(boolean retryable) {
        Actor actor = playbook().actor("api").orElseThrow();
        ErrorClass errorClass = retryable ? ErrorClass.TRANSIENT_INFRA : ErrorClass.PERMANENT;
        actor.recordFailure(errorClass, "build job failed", retryable, retryable, NOW);
        actor.transitionTo(PipelineStage.FAILED, NOW);
        return actor;
    }
}
