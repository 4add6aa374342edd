package com.amphitheatre.composer.workflow;

import java.time.Instant;

/**
 * Everything {@link WorkflowEngine#advance} needs to know besides the Actor.
 *
 * @param dependenciesServing every dependency is Running or Syncing
 * @param resolvedCommit      commit this pass resolved the Actor's source to
 * @param resolutionError     configuration error found by the resolver for this Actor, or null
 * @param observed            cluster objects as last observed
 * @param syncPending         a sync request is waiting for this Actor
 * @param syncApplied         the Syncer reported the in-flight request as applied
 * @param now                 wall-clock time of the pass
 */
public record Observation(boolean dependenciesServing,
                          String resolvedCommit,
                          String resolutionError,
                          ObservedState observed,
                          boolean syncPending,
                          boolean syncApplied,
                          Instant now) {

    public static Observation of(boolean dependenciesServing, String resolvedCommit,
                                 ObservedState observed, Instant now) {
        return new Observation(dependenciesServing, resolvedCommit, null, observed, false, false, now);
    }

    public static Observation resolutionFailed(String error, Instant now) {
        return new Observation(false, null, error, ObservedState.nothing(), false, false, now);
    }

    public Observation withSync(boolean pending, boolean applied) {
        return new Observation(dependenciesServing, resolvedCommit, resolutionError, observed,
                               pending, applied, now);
    }
}
