package com.amphitheatre.composer.controller;

import com.amphitheatre.composer.config.ComposerProperties;
import com.amphitheatre.composer.metrics.ComposerMetrics;
import com.amphitheatre.composer.support.MdcContext;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of worker threads draining the {@link ReconcileQueue}.
 *
 * Each worker takes a Playbook id, runs one reconcile pass, schedules the
 * requeue the pass asked for, and releases the id. The queue guarantees a
 * Playbook is never reconciled by two workers at once; different Playbooks
 * run fully in parallel.
 */
@Component
public class ReconcileWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(ReconcileWorkerPool.class);

    private static final Duration TAKE_TIMEOUT  = Duration.ofSeconds(1);
    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(30);

    private final ReconcileQueue  queue;
    private final Reconciler      reconciler;
    private final int             workerCount;
    private final ExecutorService workers;

    private volatile boolean running;

    public ReconcileWorkerPool(ReconcileQueue queue,
                               Reconciler reconciler,
                               ComposerProperties properties,
                               ComposerMetrics metrics) {
        this.queue       = queue;
        this.reconciler  = reconciler;
        this.workerCount = properties.getReconcile().getWorkers();
        AtomicInteger n = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerCount,
                r -> new Thread(r, "reconcile-worker-" + n.incrementAndGet()));
        metrics.bindQueueDepth(queue::depth);
    }

    @PostConstruct
    public void start() {
        running = true;
        for (int i = 0; i < workerCount; i++) {
            workers.submit(this::workLoop);
        }
        log.info("Started {} reconcile workers", workerCount);
    }

    @PreDestroy
    public void stop() throws InterruptedException {
        running = false;
        workers.shutdownNow();
        if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
            log.warn("Reconcile workers did not stop within 10 s");
        }
    }

    private void workLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            Optional<ReconcileTask> next;
            try {
                next = queue.take(TAKE_TIMEOUT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            next.ifPresent(this::runOne);
        }
    }

    void runOne(ReconcileTask task) {
        try {
            log.debug("Reconciling playbook {} ({})", task.playbookId(), task.reason());
            ReconcileResult result = reconciler.reconcile(task.playbookId());
            if (result.requeueAfter() != null) {
                queue.enqueueAfter(task.playbookId(), ReconcileReason.REQUEUE, result.requeueAfter());
            }
        } catch (Exception e) {
            log.error("Unhandled error reconciling playbook {}: {}",
                    task.playbookId(), e.getMessage(), e);
            queue.enqueueAfter(task.playbookId(), ReconcileReason.REQUEUE, ERROR_BACKOFF);
        } finally {
            MdcContext.clear();
            queue.done(task.playbookId());
        }
    }
}
