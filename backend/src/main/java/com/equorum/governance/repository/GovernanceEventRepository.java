package com.equorum.governance.repository;

import com.equorum.governance.domain.GovernanceEvent;
import io.micronaut.data.annotation.Query;
import io.micronaut.data.annotation.Repository;
import io.micronaut.data.model.Pageable;
import io.micronaut.data.repository.CrudRepository;
import jakarta.annotation.Nullable;

import java.util.List;

@Repository
public interface GovernanceEventRepository extends CrudRepository<GovernanceEvent, Long> {

    /** Events older than {@code beforeId}, newest first, with optional type filter. */
    @Query("FROM GovernanceEvent e WHERE e.id < :beforeId AND (:type IS NULL OR e.type = :type) ORDER BY e.id DESC")
    List<GovernanceEvent> findBefore(Long beforeId, @Nullable String type, Pageable pageable);

    List<GovernanceEvent> findBySubjectOrderByIdAsc(String subject);
}
