package com.amphitheatre.composer.cluster;

/**
 * Thrown when a cluster API call fails.
 *
 * TRANSIENT covers conflicts, throttling, 5xx and I/O errors: retry later.
 * PERMANENT means the request itself was rejected and will be rejected again.
 */
public class ClusterException extends RuntimeException {

    public enum Kind { TRANSIENT, PERMANENT }

    private final Kind kind;
    private final int  status;

    public ClusterException(Kind kind, int status, String message) {
        super("[" + kind + "] " + message);
        this.kind   = kind;
        this.status = status;
    }

    public ClusterException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind   = kind;
        this.status = 0;
    }

    public Kind getKind()  { return kind; }

    /** HTTP status of the failed call, or 0 if no response was received. */
    public int getStatus() { return status; }

    /** Map an API response status to an error kind. */
    public static Kind classify(int status) {
        if (status == 401 || status == 409 || status == 429 || status >= 500) {
            return Kind.TRANSIENT;
        }
        return Kind.PERMANENT;
    }
}
