package com.amphitheatre.composer.resources;

/**
 * Thrown when desired cluster objects cannot be applied or observed.
 *
 * TRANSIENT: back off and retry on a later pass. PERMANENT: the desired state
 * is malformed (or its target namespace is missing) and the Actor fails.
 */
public class ApplyException extends RuntimeException {

    public enum Kind { TRANSIENT, PERMANENT }

    private final Kind kind;

    public ApplyException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }
}
