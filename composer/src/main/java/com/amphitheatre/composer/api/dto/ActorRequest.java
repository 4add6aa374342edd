package com.amphitheatre.composer.api.dto;

import java.util.List;

/**
 * Desired state of one Actor, in POST /playbooks and PUT /playbooks/{id}/actors/{name}.
 *
 * Required: repository. Name is required inside a Playbook submission and
 * taken from the path on PUT. Reference defaults to "main"; commit, when
 * given, pins the build to that exact revision.
 */
public record ActorRequest(String name,
                           String description,
                           String repository,
                           String path,
                           String reference,
                           String commit,
                           List<String> dependencies,
                           Boolean live,
                           List<Integer> ports) {

    public ActorRequest {
        if (dependencies == null) dependencies = List.of();
        if (ports == null) ports = List.of();
        if (live == null) live = false;
    }
}
