package com.amphitheatre.composer.repository;

import com.amphitheatre.composer.model.Actor;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD operations for the actors table.
 */
public interface ActorRepository extends JpaRepository<Actor, UUID> {

    /** All actors of a playbook, in creation order. */
    List<Actor> findByPlaybookIdOrderByCreatedAtAsc(UUID playbookId);
}
