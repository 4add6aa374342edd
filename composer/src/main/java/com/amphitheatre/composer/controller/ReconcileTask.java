package com.amphitheatre.composer.controller;

import java.util.UUID;

/** One pending reconcile of a Playbook. */
public record ReconcileTask(UUID playbookId, ReconcileReason reason) {
}
