package com.esgledger.escrow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EscrowBookRepository extends JpaRepository<EscrowBook, String> {
}
