package com.amphitheatre.composer.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for Actor and Playbook state changes.
 * <p>
 * Each Playbook has a channel holding its subscribers and the last
 * {@link ComposerEvent#dedupKey()} published per subject (an Actor, or the
 * Playbook itself for Playbook-level events). An event whose key matches the
 * last one for its subject is a redelivery and is dropped here; consumers
 * still dedup, since delivery is only at-least-once across restarts.
 * <p>
 * {@link ComposerEvent.Type#PLAYBOOK_DELETED} is the last event of a
 * Playbook: it is delivered, then the channel is closed. A subscriber that
 * throws never stops delivery to the others, and never fails the publisher.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private static final class Channel {
        final CopyOnWriteArrayList<Consumer<ComposerEvent>> subscribers = new CopyOnWriteArrayList<>();
        final Map<String, String>                           lastKeys    = new ConcurrentHashMap<>();
    }

    private final ConcurrentHashMap<UUID, Channel> channels = new ConcurrentHashMap<>();

    /** Receive events from every Playbook. */
    private final CopyOnWriteArrayList<Consumer<ComposerEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(ComposerEvent event) {
        Channel channel = channels.computeIfAbsent(event.playbookId(), id -> new Channel());
        String key = event.dedupKey();
        if (key.equals(channel.lastKeys.put(subject(event), key))) {
            log.debug("Dropping redelivery of {}", key);
            return;
        }
        log.debug("Publishing {} for playbook {} actor {} ({} -> {}, rev {})",
                event.type(), event.playbookId(), event.actorName(),
                event.oldStage(), event.newStage(), event.revision());

        for (Consumer<ComposerEvent> subscriber : channel.subscribers) {
            deliverSafely(subscriber, event);
        }
        for (Consumer<ComposerEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }

        if (event.type() == ComposerEvent.Type.PLAYBOOK_DELETED) {
            channels.remove(event.playbookId());
            log.debug("Closed event channel of playbook {}", event.playbookId());
        }
    }

    /**
     * Subscribe to events of one Playbook, until it is deleted.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(UUID playbookId, Consumer<ComposerEvent> consumer) {
        Channel channel = channels.computeIfAbsent(playbookId, id -> new Channel());
        channel.subscribers.add(consumer);
        return () -> channel.subscribers.remove(consumer);
    }

    public Subscription subscribeAll(Consumer<ComposerEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static String subject(ComposerEvent event) {
        return event.type() + ":" + (event.actorId() != null ? event.actorId() : event.playbookId());
    }

    private void deliverSafely(Consumer<ComposerEvent> subscriber, ComposerEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Event subscriber failed on {} for playbook {}: {}",
                    event.type(), event.playbookId(), e.getMessage(), e);
        }
    }
}
