package com.amphitheatre.composer.resolver;

import com.amphitheatre.composer.model.SourceLocator;

import java.util.Map;

/**
 * Parsed content of an Actor's {@code .amp.toml}.
 *
 * @param character display name from the {@code [character]} table, may be null
 * @param partners  further Actors this one depends on, by name, in file order
 */
public record ActorManifest(String character, Map<String, SourceLocator> partners) {

    public static final ActorManifest EMPTY = new ActorManifest(null, Map.of());
}
