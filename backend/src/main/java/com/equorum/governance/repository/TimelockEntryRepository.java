package com.equorum.governance.repository;

import com.equorum.governance.domain.EntryStatus;
import com.equorum.governance.domain.TimelockEntry;
import io.micronaut.data.annotation.Repository;
import io.micronaut.data.jpa.repository.JpaRepository;

import java.util.List;

@Repository
public interface TimelockEntryRepository extends JpaRepository<TimelockEntry, String> {

    List<TimelockEntry> findByProposalId(Long proposalId);

    List<TimelockEntry> findByProposalIdAndStatus(Long proposalId, EntryStatus status);
}
