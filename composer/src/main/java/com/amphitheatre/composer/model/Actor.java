package com.amphitheatre.composer.model;

import com.amphitheatre.composer.support.Digests;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * One independently buildable and deployable service inside a Playbook.
 *
 * The desired-state half (source, dependencies, live, ports) is written by the
 * API layer. The pipeline half (stage, errors, retry count, revision) is
 * written only by the reconciler, one pass at a time.
 *
 * DB table: actors  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "actors",
       uniqueConstraints = @UniqueConstraint(columnNames = {"playbook_id", "name"}))
public class Actor {

    private static final int MAX_ERROR_HISTORY = 20;

    // Actor names become cluster object names (DNS-1123 label, room for suffixes).
    private static final Pattern NAME = Pattern.compile("[a-z0-9]([-a-z0-9]{0,38}[a-z0-9])?");

    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches();
    }

    @Id
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "playbook_id", nullable = false)
    private Playbook playbook;

    // Unique within the playbook; dependency declarations refer to it.
    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Embedded
    private SourceLocator source;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "actor_dependencies", joinColumns = @JoinColumn(name = "actor_id"))
    @Column(name = "dependency_name", nullable = false)
    private Set<String> dependencies = new LinkedHashSet<>();

    // Written by the reconciler from the resolver's manifest walk.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "actor_discovered_dependencies", joinColumns = @JoinColumn(name = "actor_id"))
    @Column(name = "dependency_name", nullable = false)
    private Set<String> discoveredDependencies = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "actor_ports", joinColumns = @JoinColumn(name = "actor_id"))
    @Column(name = "port", nullable = false)
    private Set<Integer> ports = new LinkedHashSet<>();

    // True when the actor was added by partner discovery rather than submitted.
    @Column(nullable = false)
    private boolean implicit = false;

    @Column(nullable = false)
    private boolean live = false;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineStage stage = PipelineStage.PENDING;

    @Column(name = "stage_entered_at", nullable = false)
    private Instant stageEnteredAt = Instant.now();

    // Commit the current pipeline run builds; pinned when Building starts.
    @Column(name = "resolved_commit")
    private String resolvedCommit;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_class")
    private ErrorClass errorClass;

    // Only meaningful while stage = FAILED.
    @Column(nullable = false)
    private boolean retryable = false;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "retry_requested", nullable = false)
    private boolean retryRequested = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "actor_error_history", joinColumns = @JoinColumn(name = "actor_id"))
    @OrderColumn(name = "position")
    @Column(name = "message", columnDefinition = "TEXT", nullable = false)
    private List<String> errorHistory = new ArrayList<>();

    // Spec hash the current pipeline run started from; null before the first run.
    @Column(name = "applied_spec_hash")
    private String appliedSpecHash;

    // Incremented on every stage transition; consumers dedup events by it.
    @Column(nullable = false)
    private long revision = 0;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Actor() {}   // required by JPA

    public Actor(Playbook playbook, String name, SourceLocator source) {
        this.id       = UUID.randomUUID();
        this.playbook = playbook;
        this.name     = name;
        this.source   = source;
    }

    // ------------------------------------------------------------------
    // Pipeline state changes
    // ------------------------------------------------------------------

    /**
     * Move to {@code next}, bumping the revision.
     *
     * @throws IllegalStateException if the transition table does not allow it
     */
    public void transitionTo(PipelineStage next, Instant now) {
        if (!stage.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal transition " + stage + " -> " + next + " for actor " + name);
        }
        this.stage          = next;
        this.stageEnteredAt = now;
        this.revision++;
    }

    /**
     * Record the cause of a move to FAILED.
     *
     * @param consumeRetry whether this failure uses up one unit of the retry budget
     */
    public void recordFailure(ErrorClass errorClass, String message, boolean retryable,
                              boolean consumeRetry, Instant now) {
        this.errorClass = errorClass;
        this.lastError  = message;
        this.retryable  = retryable;
        this.failedAt   = now;
        if (consumeRetry) {
            this.retryCount++;
        }
        appendHistory("[" + errorClass + "] " + message);
    }

    /** Record an error that did not change the stage (e.g. a throttled apply). */
    public void recordTransientError(String message) {
        this.lastError = message;
        appendHistory("[" + ErrorClass.TRANSIENT_INFRA + "] " + message);
    }

    /** Clear per-run state before re-entering PENDING from FAILED. History is kept. */
    public void resetForRetry() {
        this.lastError      = null;
        this.errorClass     = null;
        this.retryable      = false;
        this.failedAt       = null;
        this.retryRequested = false;
        this.resolvedCommit = null;
    }

    /**
     * Start over at PENDING after the desired state changed. Allowed from any
     * stage; grants a fresh retry budget.
     */
    public void restart(String reason, Instant now) {
        resetForRetry();
        this.stage           = PipelineStage.PENDING;
        this.stageEnteredAt  = now;
        this.retryCount      = 0;
        this.appliedSpecHash = null;
        this.revision++;
        appendHistory("[RESTART] " + reason);
    }

    public boolean isTerminallyFailed() {
        return stage == PipelineStage.FAILED && !retryable;
    }

    // ------------------------------------------------------------------
    // Desired state
    // ------------------------------------------------------------------

    /** Hash of every desired-state field that affects what gets built or deployed. */
    public String specHash() {
        return Digests.sha256(String.join("\n",
                source.getRepository(),
                source.getPath(),
                source.getReference(),
                String.valueOf(source.getCommit()),
                String.join(",", new TreeSet<>(dependencies)),
                String.valueOf(live),
                new TreeSet<>(ports).toString()));
    }

    public void markSpecApplied() {
        this.appliedSpecHash = specHash();
    }

    /** True when the desired state changed after the current pipeline run started. */
    public boolean specChangedSinceApplied() {
        return appliedSpecHash != null && !appliedSpecHash.equals(specHash());
    }

    public void updateSpec(String description, SourceLocator source, Set<String> dependencies,
                           boolean live, Set<Integer> ports) {
        this.description = description;
        this.source      = source;
        this.live        = live;
        this.dependencies.clear();
        this.dependencies.addAll(dependencies);
        this.ports.clear();
        this.ports.addAll(ports);
    }

    /** Declared plus discovered dependency names. */
    public Set<String> allDependencies() {
        Set<String> all = new LinkedHashSet<>(dependencies);
        all.addAll(discoveredDependencies);
        return all;
    }

    private void appendHistory(String entry) {
        errorHistory.add(entry);
        while (errorHistory.size() > MAX_ERROR_HISTORY) {
            errorHistory.remove(0);
        }
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()                     { return id; }
    public Playbook      getPlaybook()               { return playbook; }
    public UUID          getPlaybookId()             { return playbook.getId(); }
    public String        getName()                   { return name; }
    public String        getDescription()            { return description; }
    public SourceLocator getSource()                 { return source; }
    public Set<String>   getDependencies()           { return dependencies; }
    public Set<String>   getDiscoveredDependencies() { return discoveredDependencies; }
    public Set<Integer>  getPorts()                  { return ports; }
    public boolean       isImplicit()                { return implicit; }
    public boolean       isLive()                    { return live; }
    public PipelineStage getStage()                  { return stage; }
    public Instant       getStageEnteredAt()         { return stageEnteredAt; }
    public String        getResolvedCommit()         { return resolvedCommit; }
    public String        getLastError()              { return lastError; }
    public ErrorClass    getErrorClass()             { return errorClass; }
    public boolean       isRetryable()               { return retryable; }
    public int           getRetryCount()             { return retryCount; }
    public Instant       getFailedAt()               { return failedAt; }
    public boolean       isRetryRequested()          { return retryRequested; }
    public List<String>  getErrorHistory()           { return errorHistory; }
    public String        getAppliedSpecHash()        { return appliedSpecHash; }
    public long          getRevision()               { return revision; }
    public Instant       getCreatedAt()              { return createdAt; }
    public Instant       getUpdatedAt()              { return updatedAt; }

    public void setDescription(String description)      { this.description = description; }
    public void setImplicit(boolean implicit)           { this.implicit = implicit; }
    public void setLive(boolean live)                   { this.live = live; }
    public void setResolvedCommit(String commit)        { this.resolvedCommit = commit; }
    public void setRetryRequested(boolean requested)    { this.retryRequested = requested; }

    public void setDiscoveredDependencies(Set<String> discovered) {
        this.discoveredDependencies.clear();
        this.discoveredDependencies.addAll(discovered);
    }
}
