package com.amphitheatre.composer.config;

import com.amphitheatre.composer.cluster.ClusterClient;
import com.amphitheatre.composer.cluster.KubernetesClusterClient;
import com.amphitheatre.composer.controller.PlaybookReconciler;
import com.amphitheatre.composer.controller.Reconciler;
import com.amphitheatre.composer.events.EventBus;
import com.amphitheatre.composer.metrics.ComposerMetrics;
import com.amphitheatre.composer.resolver.GitHubSourceFetcher;
import com.amphitheatre.composer.resolver.ManifestCache;
import com.amphitheatre.composer.resolver.ManifestParser;
import com.amphitheatre.composer.resolver.Resolver;
import com.amphitheatre.composer.resolver.SourceFetcher;
import com.amphitheatre.composer.resources.ObjectTemplates;
import com.amphitheatre.composer.resources.Resources;
import com.amphitheatre.composer.store.DesiredStateStore;
import com.amphitheatre.composer.sync.SyncCoordinator;
import com.amphitheatre.composer.workflow.WorkflowEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wiring for the reconcile core. The core classes are plain Java so tests
 * can build them with fakes; this is where the production collaborators are
 * chosen.
 */
@Configuration
public class ComposerConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    SourceFetcher sourceFetcher(ComposerProperties properties, ObjectMapper objectMapper) {
        ComposerProperties.Source source = properties.getSource();
        return new GitHubSourceFetcher(source.getApiBaseUrl(), source.getToken(), objectMapper);
    }

    @Bean
    Resolver resolver(SourceFetcher fetcher, ManifestParser parser, ComposerProperties properties) {
        return new Resolver(fetcher, parser,
                new ManifestCache(properties.getReconcile().getManifestCacheSize()));
    }

    @Bean
    WorkflowEngine workflowEngine(ComposerProperties properties) {
        return new WorkflowEngine(properties.getPipeline());
    }

    @Bean
    ClusterClient clusterClient(ComposerProperties properties, ObjectMapper objectMapper) {
        ComposerProperties.Cluster cluster = properties.getCluster();
        return new KubernetesClusterClient(
                cluster.getBaseUrl(),
                Path.of(cluster.getTokenPath()),
                KubernetesClusterClient.trustingCa(Path.of(cluster.getCaPath())),
                cluster.getFieldManager(),
                cluster.getRequestTimeout(),
                objectMapper);
    }

    @Bean
    Resources resources(ClusterClient cluster, ComposerProperties properties, ObjectMapper objectMapper) {
        ObjectTemplates templates = new ObjectTemplates(
                objectMapper, properties.getRegistry(), properties.getCluster().getWorkspaceSize());
        return new Resources(cluster, templates, objectMapper);
    }

    @Bean
    Reconciler reconciler(DesiredStateStore store,
                          Resolver resolver,
                          WorkflowEngine engine,
                          Resources resources,
                          SyncCoordinator sync,
                          EventBus events,
                          ComposerMetrics metrics,
                          ComposerProperties properties,
                          Clock clock) {
        return new PlaybookReconciler(store, resolver, engine, resources, sync, events,
                                      metrics, properties, clock);
    }
}
