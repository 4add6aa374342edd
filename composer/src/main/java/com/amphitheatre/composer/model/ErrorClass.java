package com.amphitheatre.composer.model;

/**
 * Classification of an Actor failure.
 *
 *   CONFIGURATION   — cycle, unresolved reference, malformed manifest. Never
 *                     retried; a new desired-state submission re-triggers.
 *   TRANSIENT_INFRA — failed/timed-out job, failing deployment, cluster
 *                     throttling. Retried with backoff within the retry budget.
 *   PERMANENT       — desired state the cluster rejects (e.g. a missing
 *                     pinned namespace). Not retried.
 */
public enum ErrorClass {
    CONFIGURATION,
    TRANSIENT_INFRA,
    PERMANENT
}
