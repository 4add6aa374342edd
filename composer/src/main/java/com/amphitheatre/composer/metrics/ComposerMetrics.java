package com.amphitheatre.composer.metrics;

import com.amphitheatre.composer.model.ErrorClass;
import com.amphitheatre.composer.model.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer meters for reconcile passes and Actor pipelines.
 */
@Service
public class ComposerMetrics {

    private final MeterRegistry registry;

    public ComposerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPass(String outcome, Duration elapsed) {
        Counter.builder("composer.reconcile.passes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("composer.reconcile.duration")
                .register(registry)
                .record(elapsed);
    }

    public void recordTransition(PipelineStage from, PipelineStage to) {
        Counter.builder("composer.stage.transitions")
                .tag("from", from.name())
                .tag("to", to.name())
                .register(registry)
                .increment();
    }

    public void recordFailure(ErrorClass errorClass) {
        Counter.builder("composer.actor.failures")
                .tag("class", errorClass.name())
                .register(registry)
                .increment();
    }

    /** Register the queue depth gauge; the supplier is sampled on scrape. */
    public void bindQueueDepth(Supplier<Number> depth) {
        Gauge.builder("composer.queue.depth", depth)
                .description("Playbooks waiting for a reconcile pass")
                .register(registry);
    }
}
