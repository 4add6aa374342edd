package com.amphitheatre.composer.controller;

import com.amphitheatre.composer.model.Playbook;
import com.amphitheatre.composer.store.DesiredStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Turns desired-state changes and the passage of time into reconcile tasks.
 *
 *  - changed rows (by updated_at watermark) are enqueued every few seconds,
 *    catching writes made by other service instances;
 *  - every Playbook is enqueued on the resync interval, so drift in the
 *    cluster is noticed even without a trigger;
 *  - Playbooks whose TTL ran out get a teardown request.
 */
@Component
public class DesiredStateWatcher {

    private static final Logger log = LoggerFactory.getLogger(DesiredStateWatcher.class);

    private final DesiredStateStore store;
    private final ReconcileQueue    queue;
    private final Clock             clock;

    private volatile Instant watermark;

    public DesiredStateWatcher(DesiredStateStore store, ReconcileQueue queue, Clock clock) {
        this.store     = store;
        this.queue     = queue;
        this.clock     = clock;
        this.watermark = clock.instant();
    }

    @Scheduled(fixedDelayString = "${composer.reconcile.change-poll-ms:2000}")
    public void pollChanges() {
        Instant now = clock.instant();
        List<UUID> changed = store.changedSince(watermark);
        watermark = now;
        changed.forEach(id -> queue.enqueue(id, ReconcileReason.DESIRED_STATE_CHANGED));
        if (!changed.isEmpty()) {
            log.debug("{} playbooks changed since last poll", changed.size());
        }
    }

    @Scheduled(fixedDelayString = "${composer.reconcile.resync-interval-ms:60000}",
               initialDelayString = "${composer.reconcile.resync-initial-delay-ms:5000}")
    public void resyncAll() {
        List<UUID> ids = store.allPlaybookIds();
        ids.forEach(id -> queue.enqueue(id, ReconcileReason.RESYNC));
        log.debug("Resync enqueued {} playbooks", ids.size());
    }

    @Scheduled(fixedDelayString = "${composer.reconcile.expiry-sweep-ms:300000}")
    public void expireTtl() {
        Instant now = clock.instant();
        for (Playbook playbook : store.expired(now)) {
            log.info("Playbook {} expired (ttl {} s); requesting teardown",
                    playbook.getId(), playbook.getTtlSeconds());
            store.requestDeletion(playbook.getId(), now);
            queue.enqueue(playbook.getId(), ReconcileReason.TEARDOWN);
        }
    }
}
