package com.amphitheatre.composer.resolver;

import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.SourceLocator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses {@code .amp.toml} manifests.
 *
 * <pre>
 * [character]
 * name = "api"
 *
 * [partners.db]
 * repository = "https://github.com/acme/postgres"
 * reference  = "v15"
 *
 * [partners.web]       # no repository: a directory of the same repository
 * path = "web"
 * </pre>
 */
@Component
public class ManifestParser {

    private final TomlMapper toml;

    public ManifestParser() {
        this.toml = new TomlMapper();
    }

    /**
     * @param origin locator of the Actor the manifest belongs to; partners
     *               without a repository inherit its repository and reference
     * @throws IllegalArgumentException if the text is not a valid manifest
     */
    public ActorManifest parse(String text, SourceLocator origin) {
        JsonNode root;
        try {
            root = toml.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid TOML: " + e.getOriginalMessage(), e);
        }

        String character = root.path("character").path("name").asText(null);

        JsonNode partnersNode = root.path("partners");
        if (partnersNode.isMissingNode()) {
            return new ActorManifest(character, Map.of());
        }
        if (!partnersNode.isObject()) {
            throw new IllegalArgumentException("[partners] must be a table");
        }

        Map<String, SourceLocator> partners = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = partnersNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            partners.put(e.getKey(), partner(e.getKey(), e.getValue(), origin));
        }
        return new ActorManifest(character, partners);
    }

    private SourceLocator partner(String name, JsonNode node, SourceLocator origin) {
        if (!Actor.isValidName(name)) {
            throw new IllegalArgumentException("invalid partner name '" + name + "'");
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("[partners." + name + "] must be a table");
        }
        String repository = text(node, "repository");
        String path       = text(node, "path");
        String reference  = text(node, "reference");
        String commit     = text(node, "commit");

        if (repository != null && !SourceLocator.isValidRepository(repository)) {
            throw new IllegalArgumentException(
                    "[partners." + name + "] repository must be https://github.com/<owner>/<repo>");
        }
        if (commit != null && !SourceLocator.isValidCommit(commit)) {
            throw new IllegalArgumentException("[partners." + name + "] has an invalid commit");
        }
        if (repository == null) {
            if (path == null) {
                throw new IllegalArgumentException(
                        "[partners." + name + "] needs a repository or a path");
            }
            repository = origin.getRepository();
            if (reference == null && commit == null) {
                reference = origin.getReference();
                commit    = origin.getCommit();
            }
        }
        return new SourceLocator(repository, normalizePath(path), reference, commit);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new IllegalArgumentException("'" + field + "' must be a string");
        }
        return value.asText();
    }

    /** "./svc/api/" → "svc/api"; "." and null → "" (repository root). */
    static String normalizePath(String path) {
        if (path == null) {
            return "";
        }
        String p = path.trim();
        while (p.startsWith("./")) p = p.substring(2);
        while (p.startsWith("/"))  p = p.substring(1);
        while (p.endsWith("/"))    p = p.substring(0, p.length() - 1);
        return p.equals(".") ? "" : p;
    }
}
