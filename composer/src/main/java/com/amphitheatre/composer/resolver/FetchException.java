package com.amphitheatre.composer.resolver;

/**
 * Thrown by a {@link SourceFetcher} when a repository cannot be read.
 */
public class FetchException extends RuntimeException {

    public enum Kind {
        /** Network error, throttling or a 5xx from the SCM API. */
        UNAVAILABLE,
        /** The repository or reference does not exist (yet). */
        NOT_FOUND,
        /** The locator itself is unusable, e.g. not a supported repository URL. */
        INVALID_LOCATOR
    }

    private final Kind kind;

    public FetchException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FetchException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
