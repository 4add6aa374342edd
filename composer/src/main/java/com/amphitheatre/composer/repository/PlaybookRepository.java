package com.amphitheatre.composer.repository;

import com.amphitheatre.composer.model.Playbook;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + watcher queries for the playbooks table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface PlaybookRepository extends JpaRepository<Playbook, UUID> {

    @Query("SELECT p.id FROM Playbook p ORDER BY p.createdAt ASC")
    List<UUID> findAllIds();

    /** Playbooks whose own row or any actor row changed after {@code since}. */
    @Query("""
            SELECT DISTINCT p.id FROM Playbook p LEFT JOIN p.actors a
            WHERE p.updatedAt > :since OR a.updatedAt > :since
            """)
    List<UUID> findIdsChangedSince(@Param("since") Instant since);

    /** Candidates for TTL expiry; the caller compares createdAt + ttl against now. */
    List<Playbook> findByTtlSecondsIsNotNullAndDeletionRequestedAtIsNull();

    boolean existsByIdAndDeletionRequestedAtIsNotNull(UUID id);
}
