package com.amphitheatre.composer.controller;

import java.util.UUID;

/**
 * Brings one Playbook's observed state one step closer to its desired state.
 *
 * Callers guarantee at most one concurrent call per Playbook id.
 */
public interface Reconciler {

    ReconcileResult reconcile(UUID playbookId);
}
