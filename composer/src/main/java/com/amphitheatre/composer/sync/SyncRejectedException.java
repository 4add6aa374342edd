package com.amphitheatre.composer.sync;

/** Thrown when a sync is requested for an Actor that does not accept one. */
public class SyncRejectedException extends RuntimeException {

    public SyncRejectedException(String message) {
        super(message);
    }
}
