package com.amphitheatre.composer.store;

import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.Playbook;
import com.amphitheatre.composer.repository.ActorRepository;
import com.amphitheatre.composer.repository.PlaybookRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link DesiredStateStore} on top of the Spring Data repositories.
 *
 * Every collection on Playbook and Actor is eagerly fetched, so the entities
 * returned here are safe to use from a worker thread after the transaction
 * has closed.
 */
@Component
public class JpaDesiredStateStore implements DesiredStateStore {

    private static final Logger log = LoggerFactory.getLogger(JpaDesiredStateStore.class);

    private final PlaybookRepository playbookRepo;
    private final ActorRepository    actorRepo;

    public JpaDesiredStateStore(PlaybookRepository playbookRepo, ActorRepository actorRepo) {
        this.playbookRepo = playbookRepo;
        this.actorRepo    = actorRepo;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Playbook> load(UUID playbookId) {
        return playbookRepo.findById(playbookId);
    }

    @Override
    @Transactional
    public Actor saveActor(Actor actor) {
        return actorRepo.save(actor);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isDeletionRequested(UUID playbookId) {
        return playbookRepo.existsByIdAndDeletionRequestedAtIsNotNull(playbookId);
    }

    @Override
    @Transactional
    public void delete(UUID playbookId) {
        playbookRepo.deleteById(playbookId);
        log.info("Playbook {} removed from the desired-state store", playbookId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> allPlaybookIds() {
        return playbookRepo.findAllIds();
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> changedSince(Instant since) {
        return playbookRepo.findIdsChangedSince(since);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Playbook> expired(Instant now) {
        return playbookRepo.findByTtlSecondsIsNotNullAndDeletionRequestedAtIsNull().stream()
                .filter(p -> p.expiresAt().map(at -> !at.isAfter(now)).orElse(false))
                .toList();
    }

    @Override
    @Transactional
    public void requestDeletion(UUID playbookId, Instant now) {
        playbookRepo.findById(playbookId).ifPresent(p -> {
            p.requestDeletion(now);
            playbookRepo.save(p);
        });
    }
}
