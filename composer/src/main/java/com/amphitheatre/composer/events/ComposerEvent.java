package com.amphitheatre.composer.events;

import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.PipelineStage;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A state change published on the {@link EventBus}.
 *
 * Delivery is at-least-once; consumers dedup by {@link #dedupKey()}.
 *
 * @param type       what happened
 * @param playbookId owning Playbook
 * @param actorId    Actor the event is about, null for Playbook-level events
 * @param actorName  Actor name, null for Playbook-level events
 * @param oldStage   stage before the change (null for Playbook-level events)
 * @param newStage   stage after the change
 * @param error      last error recorded on the Actor, if any
 * @param revision   Actor revision after the change; 0 for Playbook-level events
 * @param payload    extra key-value data (phase, sync request id, changed paths, ...)
 * @param timestamp  when the change happened
 */
public record ComposerEvent(
    Type type,
    UUID playbookId,
    UUID actorId,
    String actorName,
    PipelineStage oldStage,
    PipelineStage newStage,
    String error,
    long revision,
    Map<String, Object> payload,
    Instant timestamp
) {

    public enum Type {
        STAGE_CHANGED,
        PLAYBOOK_PHASE_CHANGED,
        SYNC_REQUESTED,
        PLAYBOOK_DELETED
    }

    public static ComposerEvent stageChanged(Actor actor, PipelineStage from, Instant now) {
        return new ComposerEvent(Type.STAGE_CHANGED, actor.getPlaybookId(), actor.getId(),
                actor.getName(), from, actor.getStage(), actor.getLastError(),
                actor.getRevision(), Map.of(), now);
    }

    public static ComposerEvent playbook(Type type, UUID playbookId, Map<String, Object> payload,
                                         Instant now) {
        return new ComposerEvent(type, playbookId, null, null, null, null, null, 0, payload, now);
    }

    /** (identifier, stage, revision); identical for redeliveries of the same change. */
    public String dedupKey() {
        String id = actorId != null ? actorId.toString() : playbookId.toString();
        return type + ":" + id + ":" + newStage + ":" + revision + ":" + payload.getOrDefault("key", "");
    }
}
