package com.amphitheatre.composer.api.dto;

import java.util.List;

/**
 * Request body for POST /playbooks.
 *
 * namespace pins the Playbook to an existing namespace; when omitted the
 * composer creates one. ttlSeconds, when set, tears the Playbook down that
 * long after creation.
 */
public record SubmitPlaybookRequest(String title,
                                    String description,
                                    String namespace,
                                    Long ttlSeconds,
                                    List<ActorRequest> actors) {

    public SubmitPlaybookRequest {
        if (actors == null) actors = List.of();
    }
}
