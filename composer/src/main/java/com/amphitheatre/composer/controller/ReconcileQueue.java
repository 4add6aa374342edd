package com.amphitheatre.composer.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Deduplicating work queue of Playbook ids.
 *
 * A Playbook is either pending, in flight, or neither:
 *   - enqueueing a pending id only replaces its reason (last trigger wins);
 *   - enqueueing an in-flight id marks it dirty, and {@link #done} puts it
 *     back exactly once, however many triggers arrived meanwhile;
 *   - {@link #take} never hands out an id that is already in flight.
 */
@Component
public class ReconcileQueue {

    private static final Logger log = LoggerFactory.getLogger(ReconcileQueue.class);

    private final Object lock = new Object();

    private final LinkedHashMap<UUID, ReconcileReason> pending  = new LinkedHashMap<>();
    private final Set<UUID>                            inFlight = new HashSet<>();
    private final Map<UUID, ReconcileReason>           dirty    = new HashMap<>();

    private final Map<UUID, ScheduledFuture<?>> timers = new HashMap<>();
    private final ScheduledExecutorService delayer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "reconcile-requeue");
        t.setDaemon(true);
        return t;
    });

    public void enqueue(UUID playbookId, ReconcileReason reason) {
        synchronized (lock) {
            if (inFlight.contains(playbookId)) {
                dirty.put(playbookId, reason);
            } else {
                pending.put(playbookId, reason);
                lock.notifyAll();
            }
        }
    }

    /**
     * Enqueue after {@code delay}. A later call for the same id keeps only the
     * earlier of the two deadlines.
     */
    public void enqueueAfter(UUID playbookId, ReconcileReason reason, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            enqueue(playbookId, reason);
            return;
        }
        synchronized (lock) {
            ScheduledFuture<?> existing = timers.get(playbookId);
            if (existing != null && !existing.isDone()
                    && existing.getDelay(TimeUnit.MILLISECONDS) <= delay.toMillis()) {
                return;
            }
            if (existing != null) {
                existing.cancel(false);
            }
            timers.put(playbookId, delayer.schedule(() -> {
                synchronized (lock) {
                    timers.remove(playbookId);
                }
                enqueue(playbookId, reason);
            }, delay.toMillis(), TimeUnit.MILLISECONDS));
        }
    }

    /**
     * Wait up to {@code timeout} for a pending Playbook and mark it in flight.
     */
    public Optional<ReconcileTask> take(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (pending.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return Optional.empty();
                }
                TimeUnit.NANOSECONDS.timedWait(lock, remaining);
            }
            Iterator<Map.Entry<UUID, ReconcileReason>> it = pending.entrySet().iterator();
            Map.Entry<UUID, ReconcileReason> next = it.next();
            it.remove();
            inFlight.add(next.getKey());
            return Optional.of(new ReconcileTask(next.getKey(), next.getValue()));
        }
    }

    /** Release an in-flight Playbook; re-queue it once if it was triggered meanwhile. */
    public void done(UUID playbookId) {
        synchronized (lock) {
            inFlight.remove(playbookId);
            ReconcileReason again = dirty.remove(playbookId);
            if (again != null) {
                pending.put(playbookId, again);
                lock.notifyAll();
            }
        }
    }

    public int depth() {
        synchronized (lock) {
            return pending.size() + dirty.size();
        }
    }

    public boolean isInFlight(UUID playbookId) {
        synchronized (lock) {
            return inFlight.contains(playbookId);
        }
    }

    @PreDestroy
    public void shutdown() {
        delayer.shutdownNow();
        log.debug("Reconcile queue stopped");
    }
}
