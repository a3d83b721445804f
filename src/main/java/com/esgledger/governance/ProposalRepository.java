package com.esgledger.governance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for committee proposals.
 */
@Repository
public interface ProposalRepository extends JpaRepository<Proposal, String> {

    List<Proposal> findByExecutedFalseOrderByCreatedAtAsc();
}
