package com.amphitheatre.composer.model;

import jakarta.persistence.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A declared application: a named set of Actors deployed together.
 *
 * The phase is not a column — {@link #phase()} derives it from the Actors.
 *
 * DB table: playbooks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "playbooks")
public class Playbook {

    private static final String MANAGED_NAMESPACE_PREFIX = "amp-";

    @Id
    private UUID id;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    // Pinned namespace. Null means the composer creates and owns "amp-<id>".
    @Column(name = "namespace")
    private String namespace;

    @Column(name = "ttl_seconds")
    private Long ttlSeconds;

    // Set by a teardown request; the reconciler then deletes the row.
    @Column(name = "deletion_requested_at")
    private Instant deletionRequestedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @OneToMany(mappedBy = "playbook", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("createdAt ASC")
    private List<Actor> actors = new ArrayList<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Playbook() {}   // required by JPA

    public Playbook(String title) {
        this.id    = UUID.randomUUID();
        this.title = title;
    }

    // ------------------------------------------------------------------
    // Derived values
    // ------------------------------------------------------------------

    public PlaybookPhase phase() {
        return PlaybookPhase.derive(isDeletionRequested(), actors);
    }

    /** Namespace every object of this playbook lives in. */
    public String targetNamespace() {
        return namespace != null ? namespace
                : MANAGED_NAMESPACE_PREFIX + id.toString().replace("-", "").substring(0, 8);
    }

    /** True when the composer created the namespace and may delete it on teardown. */
    public boolean managesNamespace() {
        return namespace == null;
    }

    public boolean isDeletionRequested() {
        return deletionRequestedAt != null;
    }

    public void requestDeletion(Instant now) {
        if (deletionRequestedAt == null) {
            deletionRequestedAt = now;
        }
    }

    public Optional<Instant> expiresAt() {
        return Optional.ofNullable(ttlSeconds).map(ttl -> createdAt.plus(Duration.ofSeconds(ttl)));
    }

    public Optional<Actor> actor(String name) {
        return actors.stream().filter(a -> a.getName().equals(name)).findFirst();
    }

    public Actor addActor(String name, SourceLocator source) {
        Actor actor = new Actor(this, name, source);
        actors.add(actor);
        return actor;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID        getId()                  { return id; }
    public String      getTitle()               { return title; }
    public String      getDescription()         { return description; }
    public String      getNamespace()           { return namespace; }
    public Long        getTtlSeconds()          { return ttlSeconds; }
    public Instant     getDeletionRequestedAt() { return deletionRequestedAt; }
    public Instant     getCreatedAt()           { return createdAt; }
    public Instant     getUpdatedAt()           { return updatedAt; }
    public List<Actor> getActors()              { return actors; }

    public void setDescription(String description) { this.description = description; }
    public void setNamespace(String namespace)     { this.namespace = namespace; }
    public void setTtlSeconds(Long ttlSeconds)     { this.ttlSeconds = ttlSeconds; }
}
