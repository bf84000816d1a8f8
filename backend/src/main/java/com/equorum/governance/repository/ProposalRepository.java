package com.equorum.governance.repository;

import com.equorum.governance.domain.Proposal;
import io.micronaut.data.annotation.Query;
import io.micronaut.data.annotation.Repository;
import io.micronaut.data.jpa.repository.JpaRepository;
import io.micronaut.data.model.Pageable;

import java.util.List;

@Repository
public interface ProposalRepository extends JpaRepository<Proposal, Long> {

    /** Newest first; the pageable carries offset and size only. */
    @Query("FROM Proposal p ORDER BY p.id DESC")
    List<Proposal> findNewestFirst(Pageable pageable);
}
