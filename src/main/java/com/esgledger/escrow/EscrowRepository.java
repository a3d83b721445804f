package com.esgledger.escrow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for enterprise escrows.
 */
@Repository
public interface EscrowRepository extends JpaRepository<Escrow, String> {

    List<Escrow> findByBuyerIdOrSellerIdOrderByCreatedAtDesc(String buyerId, String sellerId);
}
