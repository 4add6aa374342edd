package com.amphitheatre.composer.controller;

import java.time.Duration;
import java.util.UUID;

/**
 * Outcome of one reconcile pass.
 *
 * @param requeueAfter when the Playbook should be looked at again without a
 *                     new trigger; null if only a trigger should wake it
 */
public record ReconcileResult(UUID playbookId, Outcome outcome, Duration requeueAfter) {

    public enum Outcome {
        /** Nothing changed: no stage moved and no cluster write was made. */
        IDLE,
        /** At least one Actor moved or had cluster work enacted. */
        PROGRESSED,
        /** The pass could not complete (fetch or cluster error); try again later. */
        RETRY_LATER,
        /** Deletion was requested; everything was torn down and the record removed. */
        TORN_DOWN,
        /** The Playbook no longer exists. */
        MISSING
    }

    public static ReconcileResult missing(UUID playbookId) {
        return new ReconcileResult(playbookId, Outcome.MISSING, null);
    }
}
