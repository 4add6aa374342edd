package com.amphitheatre.composer.cluster;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Create/update/delete/get against the cluster API.
 *
 * Every method blocks and throws {@link ClusterException} on failure.
 */
public interface ClusterClient {

    Optional<ClusterObject> get(ObjectKind kind, String namespace, String name);

    /** Create the object, or update it in place if it already exists. */
    ClusterObject apply(ClusterObject object);

    /** Delete the object; succeeds quietly if it does not exist. */
    void delete(ObjectKind kind, String namespace, String name);

    /** Objects of {@code kind} in {@code namespace} carrying every given label. */
    List<ClusterObject> list(ObjectKind kind, String namespace, Map<String, String> labels);
}
