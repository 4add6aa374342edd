package com.amphitheatre.composer.workflow;

/** Observed condition of a build or push Job. */
public enum JobCondition {
    ABSENT,
    ACTIVE,
    SUCCEEDED,
    FAILED
}
