package com.tennis.edge.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LedgerAccountRepository extends JpaRepository<LedgerAccountEntity, Long> {

    /**
     * The ledger keeps a single account row; the oldest one wins if several exist.
     */
    Optional<LedgerAccountEntity> findFirstByOrderByIdAsc();

}
