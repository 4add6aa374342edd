package com.amphitheatre.composer.resolver;

import com.amphitheatre.composer.model.SourceLocator;
import com.amphitheatre.composer.support.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded LRU cache of fetched trees and parsed manifests, keyed by the
 * SHA-256 of (repository, path, resolved commit).
 *
 * A commit never changes content, so entries only leave through eviction or
 * an explicit {@link #invalidate}.
 */
public class ManifestCache {

    private static final Logger log = LoggerFactory.getLogger(ManifestCache.class);

    public record Entry(SourceTree tree, ActorManifest manifest) {}

    private final Map<String, Entry> entries;

    public ManifestCache(int capacity) {
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized Optional<Entry> get(SourceLocator source, String commit) {
        return Optional.ofNullable(entries.get(key(source, commit)));
    }

    public synchronized void put(SourceLocator source, String commit, Entry entry) {
        entries.put(key(source, commit), entry);
    }

    public synchronized void invalidate(SourceLocator source, String commit) {
        if (entries.remove(key(source, commit)) != null) {
            log.debug("Invalidated cached manifest for {} at {}", source, commit);
        }
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    static String key(SourceLocator source, String commit) {
        return Digests.sha256(source.getRepository() + "\n" + source.getPath() + "\n" + commit);
    }
}
