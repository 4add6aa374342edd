package com.amphitheatre.composer.workflow;

/** Cluster work the engine asks for; enacted by the Resources adapter. */
public enum SideEffect {
    /** Workspace volume plus build Job (and the namespace, if managed). */
    BUILD,
    /** Push Job. */
    PUSH,
    /** Deployment, plus a Service when the Actor declares ports. */
    DEPLOY,
    /** Delete build and push Jobs once the Deployment is ready. */
    RETIRE,
    /** Emit a sync request to the Syncer. */
    SYNC,
    /** Delete leftover Jobs of a failed run before starting over. */
    RESET
}
