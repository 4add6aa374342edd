package com.amphitheatre.composer.cluster;

/**
 * The cluster object kinds the composer manages, with their REST paths.
 */
public enum ObjectKind {
    NAMESPACE              ("v1",       "Namespace",             "namespaces",             false),
    PERSISTENT_VOLUME_CLAIM("v1",       "PersistentVolumeClaim", "persistentvolumeclaims", true),
    JOB                    ("batch/v1", "Job",                   "jobs",                   true),
    DEPLOYMENT             ("apps/v1",  "Deployment",            "deployments",            true),
    SERVICE                ("v1",       "Service",               "services",               true);

    private final String  apiVersion;
    private final String  kind;
    private final String  plural;
    private final boolean namespaced;

    ObjectKind(String apiVersion, String kind, String plural, boolean namespaced) {
        this.apiVersion = apiVersion;
        this.kind       = kind;
        this.plural     = plural;
        this.namespaced = namespaced;
    }

    public String  apiVersion()   { return apiVersion; }
    public String  kind()         { return kind; }
    public boolean isNamespaced() { return namespaced; }

    /** "/api/v1/namespaces/ns/services", "/apis/batch/v1/namespaces/ns/jobs", "/api/v1/namespaces". */
    public String collectionPath(String namespace) {
        String prefix = apiVersion.contains("/") ? "/apis/" + apiVersion : "/api/" + apiVersion;
        return namespaced
                ? prefix + "/namespaces/" + namespace + "/" + plural
                : prefix + "/" + plural;
    }

    public String objectPath(String namespace, String name) {
        return collectionPath(namespace) + "/" + name;
    }
}
