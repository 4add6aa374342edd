package com.amphitheatre.composer.resources;

import com.amphitheatre.composer.cluster.ClusterObject;

import java.util.List;

/**
 * Objects that should exist (applied in list order) and objects that should
 * no longer exist, for one Actor and one side effect.
 */
public record DesiredObjectSet(List<ClusterObject> objects, List<ObjectRef> retire) {

    public static DesiredObjectSet of(List<ClusterObject> objects) {
        return new DesiredObjectSet(List.copyOf(objects), List.of());
    }

    public static DesiredObjectSet retiring(List<ObjectRef> retire) {
        return new DesiredObjectSet(List.of(), List.copyOf(retire));
    }
}
