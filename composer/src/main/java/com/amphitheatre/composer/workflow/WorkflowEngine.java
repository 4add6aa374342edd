package com.amphitheatre.composer.workflow;

import com.amphitheatre.composer.config.ComposerProperties;
import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.ErrorClass;
import com.amphitheatre.composer.model.PipelineStage;

import java.time.Duration;

/**
 * Per-Actor pipeline state machine.
 *
 * {@link #advance} is pure: it reads the Actor and an {@link Observation} and
 * returns an {@link Advance} describing the next stage and the cluster work
 * to request. It never blocks and never touches the Actor; the caller applies
 * the result with {@link Advance#applyTo}.
 *
 * Level-triggered: every decision is taken from observed state, so calling it
 * again with the same input yields the same answer, and an object that went
 * missing is simply requested again.
 */
public class WorkflowEngine {

    private final ComposerProperties.Pipeline settings;

    public WorkflowEngine(ComposerProperties.Pipeline settings) {
        this.settings = settings;
    }

    public Advance advance(Actor actor, Observation obs) {
        PipelineStage stage = actor.getStage();

        if (obs.resolutionError() != null) {
            return permanentFailure(ErrorClass.CONFIGURATION, obs.resolutionError());
        }

        return switch (stage) {
            case PENDING   -> pending(obs);
            case RESOLVING -> resolving(obs);
            case BUILDING  -> building(actor, obs);
            case PUSHING   -> pushing(actor, obs);
            case DEPLOYING -> deploying(actor, obs);
            case RUNNING   -> running(actor, obs);
            case SYNCING   -> syncing(actor, obs);
            case FAILED    -> failed(actor, obs);
        };
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    private Advance pending(Observation obs) {
        // Held here while any dependency is not serving, including a failed one.
        return obs.dependenciesServing() ? Advance.to(PipelineStage.RESOLVING)
                                         : Advance.stay(PipelineStage.PENDING);
    }

    private Advance resolving(Observation obs) {
        if (obs.resolvedCommit() == null) {
            return Advance.stay(PipelineStage.RESOLVING);
        }
        return Advance.to(PipelineStage.BUILDING, SideEffect.BUILD).withCommit(obs.resolvedCommit());
    }

    private Advance building(Actor actor, Observation obs) {
        return switch (obs.observed().build()) {
            case SUCCEEDED -> Advance.to(PipelineStage.PUSHING, SideEffect.PUSH);
            case FAILED    -> transientFailure(actor, "build job failed" + detail(obs));
            case ABSENT    -> Advance.stay(PipelineStage.BUILDING).withEffects(SideEffect.BUILD);
            case ACTIVE    -> awaitDeadline(actor, obs, settings.getBuildDeadline(), "build");
        };
    }

    private Advance pushing(Actor actor, Observation obs) {
        return switch (obs.observed().push()) {
            case SUCCEEDED -> Advance.to(PipelineStage.DEPLOYING, SideEffect.DEPLOY);
            case FAILED    -> transientFailure(actor, "push job failed" + detail(obs));
            case ABSENT    -> Advance.stay(PipelineStage.PUSHING).withEffects(SideEffect.PUSH);
            case ACTIVE    -> awaitDeadline(actor, obs, settings.getPushDeadline(), "push");
        };
    }

    private Advance deploying(Actor actor, Observation obs) {
        return switch (obs.observed().deployment()) {
            case READY       -> Advance.to(PipelineStage.RUNNING, SideEffect.RETIRE);
            case FAILING     -> transientFailure(actor, "deployment failing" + detail(obs));
            case ABSENT      -> Advance.stay(PipelineStage.DEPLOYING).withEffects(SideEffect.DEPLOY);
            case PROGRESSING -> awaitDeadline(actor, obs, settings.getDeployDeadline(), "deploy");
        };
    }

    private Advance running(Actor actor, Observation obs) {
        DeploymentCondition deployment = obs.observed().deployment();
        if (deployment == DeploymentCondition.FAILING) {
            return transientFailure(actor, "deployment failing" + detail(obs));
        }
        if (deployment == DeploymentCondition.ABSENT) {
            return Advance.stay(PipelineStage.RUNNING).withEffects(SideEffect.DEPLOY);
        }
        if (obs.syncPending() && actor.isLive()) {
            return Advance.to(PipelineStage.SYNCING, SideEffect.SYNC);
        }
        return Advance.stay(PipelineStage.RUNNING);
    }

    private Advance syncing(Actor actor, Observation obs) {
        if (obs.syncApplied()) {
            return Advance.to(PipelineStage.RUNNING);
        }
        return awaitDeadline(actor, obs, settings.getSyncDeadline(), "sync");
    }

    private Advance failed(Actor actor, Observation obs) {
        if (!actor.isRetryable()) {
            return actor.isRetryRequested()
                    ? Advance.stay(PipelineStage.FAILED).withRetryRequestCleared()
                    : Advance.stay(PipelineStage.FAILED);
        }
        if (actor.isRetryRequested()) {
            return Advance.to(PipelineStage.PENDING, SideEffect.RESET).withReset();
        }
        Duration wait = backoff(actor.getRetryCount());
        Duration elapsed = Duration.between(actor.getFailedAt(), obs.now());
        if (elapsed.compareTo(wait) >= 0) {
            return Advance.to(PipelineStage.PENDING, SideEffect.RESET).withReset();
        }
        return Advance.stay(PipelineStage.FAILED, wait.minus(elapsed));
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    /**
     * Fail on a transient infrastructure error. While budget remains the
     * failure is retryable and consumes one retry; once the retry count has
     * reached the budget the Actor fails terminally and the count stays put.
     */
    public Advance transientFailure(Actor actor, String message) {
        if (actor.getRetryCount() < settings.getRetryBudget()) {
            Failure failure = new Failure(ErrorClass.TRANSIENT_INFRA, message, true, true);
            return Advance.fail(failure, backoff(actor.getRetryCount() + 1));
        }
        Failure failure = new Failure(ErrorClass.TRANSIENT_INFRA,
                message + " (retry budget of " + settings.getRetryBudget() + " exhausted)",
                false, false);
        return Advance.fail(failure, null);
    }

    /** Fail without retry; used for configuration and permanent apply errors. */
    public Advance permanentFailure(ErrorClass errorClass, String message) {
        return Advance.fail(new Failure(errorClass, message, false, false), null);
    }

    private Advance awaitDeadline(Actor actor, Observation obs, Duration deadline, String what) {
        Duration elapsed = Duration.between(actor.getStageEnteredAt(), obs.now());
        if (elapsed.compareTo(deadline) >= 0) {
            return transientFailure(actor, what + " exceeded its deadline of " + deadline);
        }
        return Advance.stay(actor.getStage(), deadline.minus(elapsed));
    }

    /** min(base * 2^(attempt - 1), max) for attempt >= 1. */
    Duration backoff(int attempt) {
        int shift = Math.max(0, Math.min(attempt - 1, 20));
        Duration delay = settings.getBackoffBase().multipliedBy(1L << shift);
        return delay.compareTo(settings.getBackoffMax()) > 0 ? settings.getBackoffMax() : delay;
    }

    private static String detail(Observation obs) {
        String d = obs.observed().detail();
        return d == null || d.isBlank() ? "" : ": " + d;
    }
}
