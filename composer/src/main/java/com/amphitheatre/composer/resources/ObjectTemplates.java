package com.amphitheatre.composer.resources;

import com.amphitheatre.composer.cluster.ClusterObject;
import com.amphitheatre.composer.cluster.ObjectKind;
import com.amphitheatre.composer.config.ComposerProperties;
import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.Playbook;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.TreeSet;

/**
 * Pure Actor/Playbook → cluster manifest mapping.
 *
 * Naming, per Actor {@code a} in the Playbook namespace:
 *   a-workspace   PersistentVolumeClaim, holds the checkout and the image tarball
 *   a-build       Job, git clone and checkout, then kaniko build to a tarball (no push)
 *   a-push        Job, crane push of the tarball
 *   a             Deployment (and Service when ports are declared)
 */
public class ObjectTemplates {

    public static final String LABEL_PLAYBOOK   = "amphitheatre.app/playbook";
    public static final String LABEL_CHARACTER  = "amphitheatre.app/character";
    public static final String LABEL_MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY       = "Amphitheatre";
    public static final String ANNOTATION_COMMIT = "amphitheatre.app/commit";

    private static final String WORKSPACE_DIR = "/workspace";
    private static final String IMAGE_TARBALL = WORKSPACE_DIR + "/image.tar";

    private final ObjectMapper                json;
    private final ComposerProperties.Registry registry;
    private final String                      workspaceSize;

    public ObjectTemplates(ObjectMapper json, ComposerProperties.Registry registry, String workspaceSize) {
        this.json          = json;
        this.registry      = registry;
        this.workspaceSize = workspaceSize;
    }

    // ------------------------------------------------------------------
    // Names
    // ------------------------------------------------------------------

    public static String workspaceName(Actor actor) { return actor.getName() + "-workspace"; }
    public static String buildJobName(Actor actor)  { return actor.getName() + "-build"; }
    public static String pushJobName(Actor actor)   { return actor.getName() + "-push"; }
    public static String deploymentName(Actor actor) { return actor.getName(); }

    /** {registry}/{namespace}/{actor}:{first 12 chars of the commit}. */
    public String image(Playbook playbook, Actor actor) {
        String commit = actor.getResolvedCommit();
        String tag = commit == null ? "latest" : commit.substring(0, Math.min(12, commit.length()));
        return registry.getHost() + "/" + playbook.targetNamespace() + "/" + actor.getName() + ":" + tag;
    }

    public static Map<String, String> playbookSelector(Playbook playbook) {
        return Map.of(LABEL_PLAYBOOK, playbook.getId().toString());
    }

    // ------------------------------------------------------------------
    // Manifests
    // ------------------------------------------------------------------

    public ClusterObject namespace(Playbook playbook) {
        ObjectNode root = root(ObjectKind.NAMESPACE, playbook.targetNamespace(), null);
        ObjectNode labels = child(root, "metadata").putObject("labels");
        labels.put(LABEL_MANAGED_BY, MANAGED_BY);
        labels.put(LABEL_PLAYBOOK, playbook.getId().toString());
        return new ClusterObject(ObjectKind.NAMESPACE, null, playbook.targetNamespace(), root);
    }

    public ClusterObject workspace(Playbook playbook, Actor actor) {
        String ns = playbook.targetNamespace();
        ObjectNode root = root(ObjectKind.PERSISTENT_VOLUME_CLAIM, workspaceName(actor), ns);
        labels(child(root, "metadata"), playbook, actor);
        ObjectNode spec = root.putObject("spec");
        spec.putArray("accessModes").add("ReadWriteOnce");
        spec.putObject("resources").putObject("requests").put("storage", workspaceSize);
        return new ClusterObject(ObjectKind.PERSISTENT_VOLUME_CLAIM, ns, workspaceName(actor), root);
    }

    public ClusterObject buildJob(Playbook playbook, Actor actor) {
        String ns = playbook.targetNamespace();
        String src = WORKSPACE_DIR + "/src";
        String context = actor.getSource().getPath().isEmpty() ? src : src + "/" + actor.getSource().getPath();

        ObjectNode root = job(playbook, actor, buildJobName(actor));
        ObjectNode pod = child(child(child(root, "spec"), "template"), "spec");

        // No shell: the repository and commit reach git as plain arguments.
        ArrayNode init = pod.putArray("initContainers");
        gitStep(init, "clean", "rm", "-rf", src);
        gitStep(init, "git-clone", "git", "clone", "--", actor.getSource().getRepository(), src);
        gitStep(init, "git-checkout", "git", "-C", src, "checkout", "--detach", actor.getResolvedCommit());

        ObjectNode builder = pod.putArray("containers").addObject();
        builder.put("name", "builder");
        builder.put("image", registry.getBuilderImage());
        builder.putArray("args")
                .add("--context=dir://" + context)
                .add("--destination=" + image(playbook, actor))
                .add("--no-push")
                .add("--tar-path=" + IMAGE_TARBALL)
                .add("--verbosity=info");
        workspaceMount(builder);
        workspaceVolume(pod, actor);

        return new ClusterObject(ObjectKind.JOB, ns, buildJobName(actor), root);
    }

    public ClusterObject pushJob(Playbook playbook, Actor actor) {
        String ns = playbook.targetNamespace();
        ObjectNode root = job(playbook, actor, pushJobName(actor));
        ObjectNode pod = child(child(child(root, "spec"), "template"), "spec");

        ObjectNode pusher = pod.putArray("containers").addObject();
        pusher.put("name", "pusher");
        pusher.put("image", registry.getPushImage());
        pusher.putArray("args").add("push").add(IMAGE_TARBALL).add(image(playbook, actor));
        workspaceMount(pusher);
        workspaceVolume(pod, actor);

        return new ClusterObject(ObjectKind.JOB, ns, pushJobName(actor), root);
    }

    public ClusterObject deployment(Playbook playbook, Actor actor) {
        String ns = playbook.targetNamespace();
        ObjectNode root = root(ObjectKind.DEPLOYMENT, deploymentName(actor), ns);
        labels(child(root, "metadata"), playbook, actor);
        commitAnnotation(root, actor);

        ObjectNode spec = root.putObject("spec");
        spec.put("replicas", 1);
        selectorLabels(spec.putObject("selector").putObject("matchLabels"), playbook, actor);

        ObjectNode template = spec.putObject("template");
        labels(template.putObject("metadata"), playbook, actor);
        ObjectNode pod = template.putObject("spec");

        ObjectNode app = pod.putArray("containers").addObject();
        app.put("name", actor.getName());
        app.put("image", image(playbook, actor));
        app.put("imagePullPolicy", "IfNotPresent");
        if (!actor.getPorts().isEmpty()) {
            ArrayNode ports = app.putArray("ports");
            for (Integer port : new TreeSet<>(actor.getPorts())) {
                ports.addObject().put("containerPort", port);
            }
        }
        if (actor.isLive()) {
            workspaceMount(app);
            workspaceVolume(pod, actor);
        }
        return new ClusterObject(ObjectKind.DEPLOYMENT, ns, deploymentName(actor), root);
    }

    public ClusterObject service(Playbook playbook, Actor actor) {
        String ns = playbook.targetNamespace();
        ObjectNode root = root(ObjectKind.SERVICE, actor.getName(), ns);
        labels(child(root, "metadata"), playbook, actor);

        ObjectNode spec = root.putObject("spec");
        spec.put("type", "ClusterIP");
        selectorLabels(spec.putObject("selector"), playbook, actor);
        ArrayNode ports = spec.putArray("ports");
        for (Integer port : new TreeSet<>(actor.getPorts())) {
            ports.addObject()
                    .put("name", "p" + port)
                    .put("port", port)
                    .put("targetPort", port);
        }
        return new ClusterObject(ObjectKind.SERVICE, ns, actor.getName(), root);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private ObjectNode root(ObjectKind kind, String name, String namespace) {
        ObjectNode root = json.createObjectNode();
        root.put("apiVersion", kind.apiVersion());
        root.put("kind", kind.kind());
        ObjectNode metadata = root.putObject("metadata");
        metadata.put("name", name);
        if (namespace != null) {
            metadata.put("namespace", namespace);
        }
        return root;
    }

    private ObjectNode job(Playbook playbook, Actor actor, String name) {
        ObjectNode root = root(ObjectKind.JOB, name, playbook.targetNamespace());
        labels(child(root, "metadata"), playbook, actor);
        commitAnnotation(root, actor);

        ObjectNode spec = root.putObject("spec");
        // Retries are decided by the workflow engine, not by the Job controller.
        spec.put("backoffLimit", 0);
        ObjectNode template = spec.putObject("template");
        labels(template.putObject("metadata"), playbook, actor);
        template.putObject("spec").put("restartPolicy", "Never");
        return root;
    }

    /** Existing object-valued field, created when absent. */
    private static ObjectNode child(ObjectNode parent, String field) {
        return parent.get(field) instanceof ObjectNode existing ? existing : parent.putObject(field);
    }

    private static void labels(ObjectNode metadata, Playbook playbook, Actor actor) {
        ObjectNode labels = metadata.putObject("labels");
        labels.put(LABEL_MANAGED_BY, MANAGED_BY);
        selectorLabels(labels, playbook, actor);
    }

    private static void selectorLabels(ObjectNode labels, Playbook playbook, Actor actor) {
        labels.put(LABEL_PLAYBOOK, playbook.getId().toString());
        labels.put(LABEL_CHARACTER, actor.getName());
    }

    private static void commitAnnotation(ObjectNode root, Actor actor) {
        if (actor.getResolvedCommit() != null) {
            child(root, "metadata").putObject("annotations")
                    .put(ANNOTATION_COMMIT, actor.getResolvedCommit());
        }
    }

    private void gitStep(ArrayNode initContainers, String name, String... command) {
        ObjectNode container = initContainers.addObject();
        container.put("name", name);
        container.put("image", registry.getGitImage());
        ArrayNode args = container.putArray("command");
        for (String arg : command) {
            args.add(arg);
        }
        workspaceMount(container);
    }

    private static void workspaceMount(ObjectNode container) {
        container.putArray("volumeMounts").addObject()
                .put("name", "workspace")
                .put("mountPath", WORKSPACE_DIR);
    }

    private static void workspaceVolume(ObjectNode pod, Actor actor) {
        pod.putArray("volumes").addObject()
                .put("name", "workspace")
                .putObject("persistentVolumeClaim").put("claimName", workspaceName(actor));
    }
}
