package com.equorum.governance.repository;

import com.equorum.governance.domain.ProposalVote;
import io.micronaut.data.annotation.Repository;
import io.micronaut.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProposalVoteRepository extends JpaRepository<ProposalVote, Long> {

    Optional<ProposalVote> findByProposalIdAndVoter(Long proposalId, String voter);

    boolean existsByProposalIdAndVoter(Long proposalId, String voter);

    List<ProposalVote> findByProposalIdOrderByIdAsc(Long proposalId);
}
