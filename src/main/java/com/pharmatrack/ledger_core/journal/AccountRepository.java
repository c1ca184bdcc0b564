package com.pharmatrack.ledger_core.journal;

import com.pharmatrack.ledger_core.stock.EntityKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    boolean existsByCode(String code);

    /**
     * Finds the account an entity uses for a given role, if it has one.
     */
    Optional<AccountEntity> findByOwnerKindAndOwnerIdAndRole(EntityKind ownerKind, UUID ownerId, AccountRole role);
}
