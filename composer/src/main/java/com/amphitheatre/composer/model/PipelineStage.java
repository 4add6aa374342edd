package com.amphitheatre.composer.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Position of an Actor in its build → push → deploy pipeline.
 *
 * Legal transitions (anything else is rejected by {@link Actor#transitionTo}):
 *   PENDING   → RESOLVING, FAILED
 *   RESOLVING → BUILDING,  FAILED
 *   BUILDING  → PUSHING,   FAILED
 *   PUSHING   → DEPLOYING, FAILED
 *   DEPLOYING → RUNNING,   FAILED
 *   RUNNING   → SYNCING,   FAILED
 *   SYNCING   → RUNNING,   FAILED
 *   FAILED    → PENDING   (retry)
 *
 * A restart after a desired-state change is not a transition; it goes
 * through {@link Actor#restart} instead.
 */
public enum PipelineStage {
    PENDING,
    RESOLVING,
    BUILDING,
    PUSHING,
    DEPLOYING,
    RUNNING,
    SYNCING,
    FAILED;

    public Set<PipelineStage> next() {
        return switch (this) {
            case PENDING   -> EnumSet.of(RESOLVING, FAILED);
            case RESOLVING -> EnumSet.of(BUILDING, FAILED);
            case BUILDING  -> EnumSet.of(PUSHING, FAILED);
            case PUSHING   -> EnumSet.of(DEPLOYING, FAILED);
            case DEPLOYING -> EnumSet.of(RUNNING, FAILED);
            case RUNNING   -> EnumSet.of(SYNCING, FAILED);
            case SYNCING   -> EnumSet.of(RUNNING, FAILED);
            case FAILED    -> EnumSet.of(PENDING);
        };
    }

    public boolean canTransitionTo(PipelineStage target) {
        return next().contains(target);
    }

    /** True while a workload is serving: dependents may proceed. */
    public boolean isServing() {
        return this == RUNNING || this == SYNCING;
    }

    /** Stages between Resolving and Running, i.e. a pipeline run is underway. */
    public boolean isInFlight() {
        return this == RESOLVING || this == BUILDING || this == PUSHING || this == DEPLOYING;
    }
}
