package com.amphitheatre.composer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Every {@code composer.*} setting, with defaults that let the service start
 * with nothing but a datasource configured.
 */
@Component
@ConfigurationProperties(prefix = "composer")
public class ComposerProperties {

    /** What to do when an Actor's source moves while a pipeline run is underway. */
    public enum SourceChangePolicy { RESTART, DEFER }

    private Reconcile reconcile = new Reconcile();
    private Pipeline  pipeline  = new Pipeline();
    private Cluster   cluster   = new Cluster();
    private Source    source    = new Source();
    private Registry  registry  = new Registry();

    public Reconcile getReconcile() { return reconcile; }
    public void setReconcile(Reconcile reconcile) { this.reconcile = reconcile; }
    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }
    public Cluster getCluster() { return cluster; }
    public void setCluster(Cluster cluster) { this.cluster = cluster; }
    public Source getSource() { return source; }
    public void setSource(Source source) { this.source = source; }
    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }

    public static class Reconcile {
        private int workers = 4;
        // How often a Playbook with work underway is looked at again.
        private Duration pollInterval = Duration.ofSeconds(5);
        private int manifestCacheSize = 512;
        // Delay before retrying a Playbook whose sources could not be fetched.
        private Duration fetchBackoffBase = Duration.ofSeconds(5);
        private Duration fetchBackoffMax = Duration.ofMinutes(5);

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public int getManifestCacheSize() { return manifestCacheSize; }
        public void setManifestCacheSize(int manifestCacheSize) { this.manifestCacheSize = manifestCacheSize; }
        public Duration getFetchBackoffBase() { return fetchBackoffBase; }
        public void setFetchBackoffBase(Duration fetchBackoffBase) { this.fetchBackoffBase = fetchBackoffBase; }
        public Duration getFetchBackoffMax() { return fetchBackoffMax; }
        public void setFetchBackoffMax(Duration fetchBackoffMax) { this.fetchBackoffMax = fetchBackoffMax; }
    }

    public static class Pipeline {
        private int retryBudget = 3;
        private Duration backoffBase = Duration.ofSeconds(10);
        private Duration backoffMax = Duration.ofMinutes(10);
        private Duration buildDeadline = Duration.ofMinutes(30);
        private Duration pushDeadline = Duration.ofMinutes(10);
        private Duration deployDeadline = Duration.ofMinutes(10);
        private Duration syncDeadline = Duration.ofMinutes(5);
        private SourceChangePolicy sourceChangePolicy = SourceChangePolicy.RESTART;

        public int getRetryBudget() { return retryBudget; }
        public void setRetryBudget(int retryBudget) { this.retryBudget = retryBudget; }
        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
        public Duration getBackoffMax() { return backoffMax; }
        public void setBackoffMax(Duration backoffMax) { this.backoffMax = backoffMax; }
        public Duration getBuildDeadline() { return buildDeadline; }
        public void setBuildDeadline(Duration buildDeadline) { this.buildDeadline = buildDeadline; }
        public Duration getPushDeadline() { return pushDeadline; }
        public void setPushDeadline(Duration pushDeadline) { this.pushDeadline = pushDeadline; }
        public Duration getDeployDeadline() { return deployDeadline; }
        public void setDeployDeadline(Duration deployDeadline) { this.deployDeadline = deployDeadline; }
        public Duration getSyncDeadline() { return syncDeadline; }
        public void setSyncDeadline(Duration syncDeadline) { this.syncDeadline = syncDeadline; }
        public SourceChangePolicy getSourceChangePolicy() { return sourceChangePolicy; }
        public void setSourceChangePolicy(SourceChangePolicy sourceChangePolicy) { this.sourceChangePolicy = sourceChangePolicy; }
    }

    public static class Cluster {
        private String baseUrl = "https://kubernetes.default.svc";
        private String tokenPath = "/var/run/secrets/kubernetes.io/serviceaccount/token";
        private String caPath = "/var/run/secrets/kubernetes.io/serviceaccount/ca.crt";
        private String fieldManager = "amp-composer";
        private String workspaceSize = "1Gi";
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getTokenPath() { return tokenPath; }
        public void setTokenPath(String tokenPath) { this.tokenPath = tokenPath; }
        public String getCaPath() { return caPath; }
        public void setCaPath(String caPath) { this.caPath = caPath; }
        public String getFieldManager() { return fieldManager; }
        public void setFieldManager(String fieldManager) { this.fieldManager = fieldManager; }
        public String getWorkspaceSize() { return workspaceSize; }
        public void setWorkspaceSize(String workspaceSize) { this.workspaceSize = workspaceSize; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }

    public static class Source {
        private String apiBaseUrl = "https://api.github.com";
        private String token = "";

        public String getApiBaseUrl() { return apiBaseUrl; }
        public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
    }

    public static class Registry {
        private String host = "registry.local:5000";
        private String gitImage = "alpine/git:2.45.2";
        private String builderImage = "gcr.io/kaniko-project/executor:v1.23.2";
        private String pushImage = "gcr.io/go-containerregistry/crane:v0.20.2";

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public String getGitImage() { return gitImage; }
        public void setGitImage(String gitImage) { this.gitImage = gitImage; }
        public String getBuilderImage() { return builderImage; }
        public void setBuilderImage(String builderImage) { this.builderImage = builderImage; }
        public String getPushImage() { return pushImage; }
        public void setPushImage(String pushImage) { this.pushImage = pushImage; }
    }
}
