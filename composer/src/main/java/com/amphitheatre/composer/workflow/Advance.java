package com.amphitheatre.composer.workflow;

import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.PipelineStage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one {@link WorkflowEngine#advance} step.
 *
 * @param next              stage after the step (equal to the current one if nothing moved)
 * @param effects           cluster work to enact, in order
 * @param failure           set when the step failed the Actor
 * @param commit            commit to pin on entering BUILDING, else null
 * @param resetState        clear per-run state before re-entering PENDING
 * @param clearRetryRequest drop a manual retry request that cannot be honoured
 * @param requeueAfter      when the Actor next needs looking at without any event, or null
 */
public record Advance(PipelineStage next,
                      List<SideEffect> effects,
                      Failure failure,
                      String commit,
                      boolean resetState,
                      boolean clearRetryRequest,
                      Duration requeueAfter) {

    static Advance stay(PipelineStage current) {
        return new Advance(current, List.of(), null, null, false, false, null);
    }

    static Advance stay(PipelineStage current, Duration requeueAfter) {
        return new Advance(current, List.of(), null, null, false, false, requeueAfter);
    }

    static Advance to(PipelineStage next, SideEffect... effects) {
        return new Advance(next, List.of(effects), null, null, false, false, null);
    }

    static Advance fail(Failure failure, Duration requeueAfter) {
        return new Advance(PipelineStage.FAILED, List.of(), failure, null, false, false, requeueAfter);
    }

    Advance withEffects(SideEffect... requested) {
        return new Advance(next, List.of(requested), failure, commit, resetState, clearRetryRequest, requeueAfter);
    }

    Advance withCommit(String pinned) {
        return new Advance(next, effects, failure, pinned, resetState, clearRetryRequest, requeueAfter);
    }

    Advance withReset() {
        return new Advance(next, effects, failure, commit, true, clearRetryRequest, requeueAfter);
    }

    Advance withRetryRequestCleared() {
        return new Advance(next, effects, failure, commit, resetState, true, requeueAfter);
    }

    public boolean movesFrom(PipelineStage current) {
        return next != current;
    }

    /** True when the step changes nothing at all on the Actor or in the cluster. */
    public boolean isNoop(PipelineStage current) {
        return !movesFrom(current) && effects.isEmpty() && failure == null && !clearRetryRequest;
    }

    /**
     * Write the step onto the Actor. The only place engine decisions mutate
     * pipeline state.
     */
    public void applyTo(Actor actor, Instant now) {
        if (failure != null) {
            actor.recordFailure(failure.errorClass(), failure.message(), failure.retryable(),
                                failure.consumeRetry(), now);
        }
        if (resetState || clearRetryRequest) {
            actor.setRetryRequested(false);
        }
        if (resetState) {
            actor.resetForRetry();
        }
        if (next != actor.getStage()) {
            actor.transitionTo(next, now);
        }
        if (next == PipelineStage.RESOLVING) {
            actor.markSpecApplied();
        }
        if (commit != null) {
            actor.setResolvedCommit(commit);
        }
    }
}
