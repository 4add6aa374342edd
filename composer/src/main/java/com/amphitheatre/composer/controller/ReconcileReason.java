package com.amphitheatre.composer.controller;

/** Why a Playbook was enqueued. Informational; every pass does the same work. */
public enum ReconcileReason {
    SUBMITTED,
    DESIRED_STATE_CHANGED,
    RESYNC,
    REQUEUE,
    RETRY,
    SYNC,
    TEARDOWN
}
