package com.amphitheatre.composer.workflow;

/** Observed condition of an Actor's Deployment. */
public enum DeploymentCondition {
    ABSENT,
    PROGRESSING,
    READY,
    FAILING
}
