package com.amphitheatre.composer.resolver;

import com.amphitheatre.composer.model.SourceLocator;

/**
 * Read-only access to Actor source repositories.
 *
 * Implementations block on network I/O and throw {@link FetchException}; they
 * never retry on their own.
 */
public interface SourceFetcher {

    /** Resolve the locator's branch or tag to a full commit sha. */
    String resolveCommit(SourceLocator source);

    /** List the repository tree at {@code commit} and read the manifest at the locator's path. */
    SourceTree fetch(SourceLocator source, String commit);
}
