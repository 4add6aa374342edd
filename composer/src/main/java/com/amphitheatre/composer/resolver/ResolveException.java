package com.amphitheatre.composer.resolver;

import java.util.List;

/**
 * Thrown when a Playbook's dependencies cannot be resolved.
 *
 * {@link Kind#FETCH} is transient: the caller requeues the Playbook with
 * backoff and leaves every Actor where it is. All other kinds are
 * configuration errors; the Actors named in {@link #getSubjects()} fail and
 * are not retried until their desired state changes.
 */
public class ResolveException extends RuntimeException {

    public enum Kind { CYCLE, UNRESOLVED, MALFORMED_MANIFEST, FETCH }

    private final Kind         kind;
    private final List<String> subjects;

    public ResolveException(Kind kind, List<String> subjects, String message) {
        super("[" + kind + "] " + message);
        this.kind     = kind;
        this.subjects = List.copyOf(subjects);
    }

    public ResolveException(Kind kind, List<String> subjects, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind     = kind;
        this.subjects = List.copyOf(subjects);
    }

    public Kind getKind()             { return kind; }
    public List<String> getSubjects() { return subjects; }

    public boolean isTransient() {
        return kind == Kind.FETCH;
    }
}
