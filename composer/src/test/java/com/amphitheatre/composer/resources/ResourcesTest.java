package com.amphitheatre.composer.resources;

import com.amphitheatre.composer.cluster.ClusterException;
import com.amphitheatre.composer.cluster.ClusterObject;
import com.amphitheatre.composer.cluster.ObjectKind;
import com.amphitheatre.composer.config.ComposerProperties;
import com.amphitheatre.composer.fakes.InMemoryClusterClient;
import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.Playbook;
import com.amphitheatre.composer.model.SourceLocator;
import com.amphitheatre.composer.workflow.DeploymentCondition;
import com.amphitheatre.composer.workflow.JobCondition;
import com.amphitheatre.composer.workflow.ObservedState;
import com.amphitheatre.composer.workflow.SideEffect;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourcesTest {

    private static final String COMMIT = "9a8b7c6d5e4f9a8b7c6d5e4f9a8b7c6d5e4f9a8b";

    InMemoryClusterClient cluster;
    ObjectTemplates templates;
    Resources resources;
    Playbook playbook;
    Actor api;
    String ns;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        cluster = new InMemoryClusterClient();
        templates = new ObjectTemplates(mapper, new ComposerProperties.Registry(), "1Gi");
        resources = new Resources(cluster, templates, mapper);

        playbook = new Playbook("shop");
        api = playbook.addActor("api", SourceLocator.of("https://github.com/acme/shop", "api", "main"));
        api.updateSpec(null, api.getSource(), Set.of(), false, Set.of(8080));
        api.setResolvedCommit(COMMIT);
        ns = playbook.targetNamespace();
    }

    @Test
    void buildCreatesNamespaceWorkspaceAndJob() {
        ApplyReport report = resources.enact(playbook, api, SideEffect.BUILD);

        assertThat(report.created()).hasSize(3);
        assertThat(cluster.contains(ObjectKind.NAMESPACE, null, ns)).isTrue();
        assertThat(cluster.contains(ObjectKind.PERSISTENT_VOLUME_CLAIM, ns, "api-workspace")).isTrue();
        assertThat(cluster.contains(ObjectKind.JOB, ns, "api-build")).isTrue();
    }

    @Test
    void reapplyingUnchangedStateMakesNoWrites() {
        resources.enact(playbook, api, SideEffect.BUILD);
        int applies = cluster.applies();

        ApplyReport again = resources.enact(playbook, api, SideEffect.BUILD);

        assertThat(again.writes()).isZero();
        assertThat(again.unchanged()).hasSize(3);
        assertThat(cluster.applies()).isEqualTo(applies);
    }

    @Test
    void changedJobIsDeletedAndRecreated() {
        resources.enact(playbook, api, SideEffect.BUILD);
        api.setResolvedCommit("0000000000000000000000000000000000000001");

        ApplyReport report = resources.enact(playbook, api, SideEffect.BUILD);

        assertThat(report.updated()).containsExactly("Job/" + ns + "/api-build");
        assertThat(cluster.deletes()).isEqualTo(1);
    }

    @Test
    void pinnedNamespaceIsNeverCreated() {
        playbook.setNamespace("team-x");

        resources.enact(playbook, api, SideEffect.BUILD);

        assertThat(cluster.contains(ObjectKind.NAMESPACE, null, "team-x")).isFalse();
        assertThat(cluster.contains(ObjectKind.JOB, "team-x", "api-build")).isTrue();
    }

    @Test
    void deployAddsAServiceForDeclaredPorts() {
        resources.enact(playbook, api, SideEffect.DEPLOY);

        ClusterObject service = cluster.get(ObjectKind.SERVICE, ns, "api").orElseThrow();
        assertThat(service.manifest().at("/spec/ports/0/port").asInt()).isEqualTo(8080);
        assertThat(service.labels()).containsEntry(ObjectTemplates.LABEL_CHARACTER, "api");
    }

    @Test
    void buildJobChecksOutThePinnedCommit() {
        ClusterObject job = templates.buildJob(playbook, api);

        JsonNode init = job.manifest().at("/spec/template/spec/initContainers");
        assertThat(init).hasSize(3);
        assertThat(init.get(1).get("command")).extracting(JsonNode::asText)
                .containsExactly("git", "clone", "--", "https://github.com/acme/shop", "/workspace/src");
        assertThat(init.get(2).get("command")).extracting(JsonNode::asText)
                .containsExactly("git", "-C", "/workspace/src", "checkout", "--detach", COMMIT);
        assertThat(job.manifest().at("/spec/backoffLimit").asInt()).isZero();
        assertThat(templates.image(playbook, api)).endsWith("/" + ns + "/api:" + COMMIT.substring(0, 12));
    }

    @Test
    void observeReportsJobConditions() {
        resources.enact(playbook, api, SideEffect.BUILD);
        assertThat(resources.observe(playbook, api).build()).isEqualTo(JobCondition.ACTIVE);

        cluster.markJobSucceeded(ns, "api-build");
        assertThat(resources.observe(playbook, api).build()).isEqualTo(JobCondition.SUCCEEDED);
    }

    @Test
    void observeCarriesTheFailureReason() {
        resources.enact(playbook, api, SideEffect.BUILD);
        cluster.markJobFailed(ns, "api-build");

        ObservedState state = resources.observe(playbook, api);

        assertThat(state.build()).isEqualTo(JobCondition.FAILED);
        assertThat(state.detail()).contains("BackoffLimitExceeded");
    }

    @Test
    void jobOfAnOlderCommitIsReportedAbsent() {
        resources.enact(playbook, api, SideEffect.BUILD);
        cluster.markJobSucceeded(ns, "api-build");

        api.setResolvedCommit("1111111111111111111111111111111111111111");

        assertThat(resources.observe(playbook, api).build()).isEqualTo(JobCondition.ABSENT);
    }

    @Test
    void observeReportsDeploymentConditions() {
        resources.enact(playbook, api, SideEffect.DEPLOY);
        assertThat(resources.observe(playbook, api).deployment()).isEqualTo(DeploymentCondition.PROGRESSING);

        cluster.markDeploymentReady(ns, "api");
        assertThat(resources.observe(playbook, api).deployment()).isEqualTo(DeploymentCondition.READY);
    }

    @Test
    void retireDeletesOnlyExistingJobs() {
        resources.enact(playbook, api, SideEffect.BUILD);

        ApplyReport report = resources.enact(playbook, api, SideEffect.RETIRE);

        assertThat(report.deleted()).hasSize(1);
        assertThat(cluster.contains(ObjectKind.JOB, ns, "api-build")).isFalse();
    }

    @Test
    void syncIsNotAClusterEffect() {
        assertThatThrownBy(() -> resources.desired(playbook, api, SideEffect.SYNC))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clusterErrorsKeepTheirClassification() {
        cluster.failApplies(new ClusterException(ClusterException.Kind.TRANSIENT, 429, "throttled"));
        assertThatThrownBy(() -> resources.enact(playbook, api, SideEffect.BUILD))
                .isInstanceOfSatisfying(ApplyException.class, e -> assertThat(e.isTransient()).isTrue());

        cluster.failApplies(new ClusterException(ClusterException.Kind.PERMANENT, 422, "invalid"));
        assertThatThrownBy(() -> resources.enact(playbook, api, SideEffect.BUILD))
                .isInstanceOfSatisfying(ApplyException.class, e -> assertThat(e.isTransient()).isFalse());
    }

    @Test
    void teardownOfAManagedPlaybookDeletesItsNamespace() {
        resources.enact(playbook, api, SideEffect.BUILD);
        resources.enact(playbook, api, SideEffect.DEPLOY);

        int deletes = resources.teardown(playbook);

        assertThat(deletes).isEqualTo(1);
        assertThat(cluster.size()).isZero();
    }

    @Test
    void teardownInAPinnedNamespaceDeletesLabelledObjectsOnly() {
        playbook.setNamespace("team-x");
        resources.enact(playbook, api, SideEffect.BUILD);
        resources.enact(playbook, api, SideEffect.DEPLOY);

        int deletes = resources.teardown(playbook);

        // service, deployment, build job, workspace
        assertThat(deletes).isEqualTo(4);
        assertThat(cluster.size()).isZero();
    }
}
