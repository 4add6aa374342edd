package com.amphitheatre.composer.resources;

import com.amphitheatre.composer.cluster.ObjectKind;

/** Identity of a cluster object without its content. */
public record ObjectRef(ObjectKind kind, String namespace, String name) {

    @Override
    public String toString() {
        return kind.kind() + "/" + (namespace == null ? "" : namespace + "/") + name;
    }
}
