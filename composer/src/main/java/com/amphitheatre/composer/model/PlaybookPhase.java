package com.amphitheatre.composer.model;

import java.util.Collection;

/**
 * Overall phase of a Playbook. Always derived from its Actors, never stored.
 */
public enum PlaybookPhase {
    PENDING,        // no Actor has started yet
    PROGRESSING,    // at least one Actor is moving through the pipeline
    RUNNING,        // every Actor is serving
    DEGRADED,       // some Actors serve, at least one is terminally failed
    FAILED,         // every Actor is terminally failed
    TERMINATING;    // teardown requested

    public static PlaybookPhase derive(boolean deletionRequested, Collection<Actor> actors) {
        if (deletionRequested) return TERMINATING;
        if (actors.isEmpty()) return PENDING;

        long serving  = actors.stream().filter(a -> a.getStage().isServing()).count();
        long terminal = actors.stream().filter(Actor::isTerminallyFailed).count();
        long pending  = actors.stream().filter(a -> a.getStage() == PipelineStage.PENDING).count();

        if (serving == actors.size())  return RUNNING;
        if (terminal == actors.size()) return FAILED;
        if (serving + terminal == actors.size()) return DEGRADED;
        if (pending == actors.size())  return PENDING;
        return PROGRESSING;
    }
}
