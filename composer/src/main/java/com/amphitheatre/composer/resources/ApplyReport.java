package com.amphitheatre.composer.resources;

import java.util.List;

/**
 * What {@link Resources#apply} actually did, by object key.
 */
public record ApplyReport(List<String> created,
                          List<String> updated,
                          List<String> unchanged,
                          List<String> deleted) {

    /** Number of write calls made against the cluster. */
    public int writes() {
        return created.size() + updated.size() + deleted.size();
    }
}
