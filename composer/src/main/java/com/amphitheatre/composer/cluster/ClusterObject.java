package com.amphitheatre.composer.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A cluster object as a typed key plus its JSON manifest.
 *
 * {@code namespace} is null for cluster-scoped kinds.
 */
public record ClusterObject(ObjectKind kind, String namespace, String name, ObjectNode manifest) {

    public String key() {
        return kind.kind() + "/" + (namespace == null ? "" : namespace + "/") + name;
    }

    public Map<String, String> labels() {
        return stringMap(manifest.path("metadata").path("labels"));
    }

    public Optional<String> annotation(String key) {
        JsonNode value = manifest.path("metadata").path("annotations").get(key);
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value.asText());
    }

    /** The object's status subtree; a missing node if the server has not written one. */
    public JsonNode status() {
        return manifest.path("status");
    }

    private static Map<String, String> stringMap(JsonNode node) {
        Map<String, String> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), e.getValue().asText());
        }
        return out;
    }
}
