package com.amphitheatre.composer.resources;

import com.amphitheatre.composer.cluster.ClusterClient;
import com.amphitheatre.composer.cluster.ClusterException;
import com.amphitheatre.composer.cluster.ClusterObject;
import com.amphitheatre.composer.cluster.ObjectKind;
import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.Playbook;
import com.amphitheatre.composer.support.Digests;
import com.amphitheatre.composer.workflow.DeploymentCondition;
import com.amphitheatre.composer.workflow.JobCondition;
import com.amphitheatre.composer.workflow.ObservedState;
import com.amphitheatre.composer.workflow.SideEffect;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Materializes the cluster objects an Actor's pipeline stage needs, and
 * reports what the cluster holds for it.
 *
 * Every applied object carries a {@value #HASH_ANNOTATION} annotation with the
 * SHA-256 of its desired manifest. An object whose annotation already matches
 * is left alone, so re-applying unchanged desired state makes no write calls.
 * Jobs cannot be patched in place; a changed Job is deleted and recreated.
 */
public class Resources {

    private static final Logger log = LoggerFactory.getLogger(Resources.class);

    public static final String HASH_ANNOTATION = "amphitheatre.app/last-applied-hash";

    private final ClusterClient   cluster;
    private final ObjectTemplates templates;
    private final ObjectMapper    json;

    public Resources(ClusterClient cluster, ObjectTemplates templates, ObjectMapper json) {
        this.cluster   = cluster;
        this.templates = templates;
        this.json      = json;
    }

    // ------------------------------------------------------------------
    // Desired state
    // ------------------------------------------------------------------

    /**
     * Objects one side effect asks for.
     *
     * @throws IllegalArgumentException for SYNC, which is not a cluster write
     */
    public DesiredObjectSet desired(Playbook playbook, Actor actor, SideEffect effect) {
        String ns = playbook.targetNamespace();
        return switch (effect) {
            case BUILD -> {
                List<ClusterObject> objects = new ArrayList<>();
                if (playbook.managesNamespace()) {
                    objects.add(templates.namespace(playbook));
                }
                objects.add(templates.workspace(playbook, actor));
                objects.add(templates.buildJob(playbook, actor));
                yield DesiredObjectSet.of(objects);
            }
            case PUSH -> DesiredObjectSet.of(List.of(templates.pushJob(playbook, actor)));
            case DEPLOY -> {
                List<ClusterObject> objects = new ArrayList<>();
                objects.add(templates.deployment(playbook, actor));
                if (!actor.getPorts().isEmpty()) {
                    objects.add(templates.service(playbook, actor));
                }
                yield DesiredObjectSet.of(objects);
            }
            case RETIRE, RESET -> DesiredObjectSet.retiring(List.of(
                    new ObjectRef(ObjectKind.JOB, ns, ObjectTemplates.buildJobName(actor)),
                    new ObjectRef(ObjectKind.JOB, ns, ObjectTemplates.pushJobName(actor))));
            case SYNC -> throw new IllegalArgumentException("SYNC is not enacted through the cluster");
        };
    }

    /** {@link #desired} followed by {@link #apply}. */
    public ApplyReport enact(Playbook playbook, Actor actor, SideEffect effect) {
        ApplyReport report = apply(desired(playbook, actor, effect));
        if (report.writes() > 0) {
            log.info("{} for actor '{}': created={} updated={} deleted={}", effect, actor.getName(),
                    report.created(), report.updated(), report.deleted());
        }
        return report;
    }

    /**
     * Create-or-update every desired object, then delete every retired one.
     *
     * @throws ApplyException TRANSIENT or PERMANENT, from the first failing call
     */
    public ApplyReport apply(DesiredObjectSet desired) {
        List<String> created   = new ArrayList<>();
        List<String> updated   = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        List<String> deleted   = new ArrayList<>();

        for (ClusterObject object : desired.objects()) {
            String hash = hash(object);
            ClusterObject stamped = stamp(object, hash);
            try {
                Optional<ClusterObject> existing =
                        cluster.get(object.kind(), object.namespace(), object.name());
                if (existing.isEmpty()) {
                    cluster.apply(stamped);
                    created.add(object.key());
                } else if (existing.get().annotation(HASH_ANNOTATION).filter(hash::equals).isPresent()) {
                    unchanged.add(object.key());
                } else {
                    if (object.kind() == ObjectKind.JOB) {
                        cluster.delete(object.kind(), object.namespace(), object.name());
                    }
                    cluster.apply(stamped);
                    updated.add(object.key());
                }
            } catch (ClusterException e) {
                throw wrap(e, "apply " + object.key());
            }
        }

        for (ObjectRef ref : desired.retire()) {
            try {
                if (cluster.get(ref.kind(), ref.namespace(), ref.name()).isPresent()) {
                    cluster.delete(ref.kind(), ref.namespace(), ref.name());
                    deleted.add(ref.toString());
                }
            } catch (ClusterException e) {
                throw wrap(e, "delete " + ref);
            }
        }
        return new ApplyReport(created, updated, unchanged, deleted);
    }

    // ------------------------------------------------------------------
    // Observed state
    // ------------------------------------------------------------------

    /**
     * Build Job, push Job and Deployment conditions for the Actor's current
     * run. An object that does not match the current desired manifest (a Job
     * of an older commit, say) is reported ABSENT so it gets requested again.
     */
    public ObservedState observe(Playbook playbook, Actor actor) {
        if (actor.getResolvedCommit() == null) {
            return ObservedState.nothing();
        }
        try {
            List<String> details = new ArrayList<>();
            JobCondition build = jobCondition(
                    current(templates.buildJob(playbook, actor)), "build", details);
            JobCondition push = jobCondition(
                    current(templates.pushJob(playbook, actor)), "push", details);
            DeploymentCondition deployment = deploymentCondition(
                    current(templates.deployment(playbook, actor)), details);
            return new ObservedState(build, push, deployment,
                    details.isEmpty() ? null : String.join("; ", details));
        } catch (ClusterException e) {
            throw wrap(e, "observe actor " + actor.getName());
        }
    }

    // ------------------------------------------------------------------
    // Teardown
    // ------------------------------------------------------------------

    /**
     * Remove everything the Playbook owns. A managed namespace is deleted
     * whole and the cluster garbage-collects its content; in a pinned
     * namespace the labelled objects are deleted one by one.
     *
     * @return number of delete calls issued
     */
    public int teardown(Playbook playbook) {
        String ns = playbook.targetNamespace();
        try {
            if (playbook.managesNamespace()) {
                cluster.delete(ObjectKind.NAMESPACE, null, ns);
                log.info("Deleted namespace {} of playbook {}", ns, playbook.getId());
                return 1;
            }
            int deletes = 0;
            for (ObjectKind kind : List.of(ObjectKind.SERVICE, ObjectKind.DEPLOYMENT,
                                           ObjectKind.JOB, ObjectKind.PERSISTENT_VOLUME_CLAIM)) {
                for (ClusterObject obj : cluster.list(kind, ns, ObjectTemplates.playbookSelector(playbook))) {
                    cluster.delete(kind, ns, obj.name());
                    deletes++;
                }
            }
            log.info("Deleted {} objects of playbook {} from pinned namespace {}",
                    deletes, playbook.getId(), ns);
            return deletes;
        } catch (ClusterException e) {
            throw wrap(e, "teardown playbook " + playbook.getId());
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** The live object, but only if it was applied from the given desired manifest. */
    private Optional<ClusterObject> current(ClusterObject desired) {
        String hash = hash(desired);
        return cluster.get(desired.kind(), desired.namespace(), desired.name())
                .filter(live -> live.annotation(HASH_ANNOTATION).filter(hash::equals).isPresent());
    }

    private static JobCondition jobCondition(Optional<ClusterObject> job, String what, List<String> details) {
        if (job.isEmpty()) {
            return JobCondition.ABSENT;
        }
        JsonNode status = job.get().status();
        if (status.path("succeeded").asInt(0) > 0) {
            return JobCondition.SUCCEEDED;
        }
        for (JsonNode c : status.path("conditions")) {
            if ("Failed".equals(c.path("type").asText()) && "True".equals(c.path("status").asText())) {
                details.add((what + ": " + c.path("reason").asText("Failed")
                             + " " + c.path("message").asText("")).trim());
                return JobCondition.FAILED;
            }
        }
        if (status.path("failed").asInt(0) > 0) {
            details.add(what + ": pod failed");
            return JobCondition.FAILED;
        }
        return JobCondition.ACTIVE;
    }

    private static DeploymentCondition deploymentCondition(Optional<ClusterObject> deployment,
                                                           List<String> details) {
        if (deployment.isEmpty()) {
            return DeploymentCondition.ABSENT;
        }
        JsonNode manifest = deployment.get().manifest();
        JsonNode status = manifest.path("status");
        for (JsonNode c : status.path("conditions")) {
            String type = c.path("type").asText();
            String value = c.path("status").asText();
            if (("Progressing".equals(type) && "False".equals(value))
                    || ("ReplicaFailure".equals(type) && "True".equals(value))) {
                details.add(("deployment: " + c.path("reason").asText(type)
                             + " " + c.path("message").asText("")).trim());
                return DeploymentCondition.FAILING;
            }
        }
        int wanted = manifest.path("spec").path("replicas").asInt(1);
        long generation = manifest.path("metadata").path("generation").asLong(0);
        boolean observed = status.path("observedGeneration").asLong(0) >= generation;
        if (observed && status.path("readyReplicas").asInt(0) >= wanted) {
            return DeploymentCondition.READY;
        }
        return DeploymentCondition.PROGRESSING;
    }

    String hash(ClusterObject object) {
        try {
            return Digests.sha256(json.writeValueAsString(object.manifest()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + object.key(), e);
        }
    }

    private static ClusterObject stamp(ClusterObject object, String hash) {
        ObjectNode copy = object.manifest().deepCopy();
        JsonNode metadata = copy.get("metadata");
        if (metadata instanceof ObjectNode meta) {
            ObjectNode annotations = meta.get("annotations") instanceof ObjectNode existing
                    ? existing : meta.putObject("annotations");
            annotations.put(HASH_ANNOTATION, hash);
        }
        return new ClusterObject(object.kind(), object.namespace(), object.name(), copy);
    }

    private static ApplyException wrap(ClusterException e, String what) {
        ApplyException.Kind kind = e.getKind() == ClusterException.Kind.TRANSIENT
                ? ApplyException.Kind.TRANSIENT
                : ApplyException.Kind.PERMANENT;
        return new ApplyException(kind, what + " failed: " + e.getMessage(), e);
    }
}
