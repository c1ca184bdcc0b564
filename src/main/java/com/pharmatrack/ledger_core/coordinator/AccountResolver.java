package com.pharmatrack.ledger_core.coordinator;

import com.pharmatrack.ledger_core.stock.EntityRef;

/**
 * Finds the accounts a transfer posts to for a given entity.
 *
 * @see RoleBasedAccountResolver
 */
public interface AccountResolver {

    /**
     * @throws AccountResolutionException if the entity lacks one of the accounts
     */
    TransferAccounts accountsFor(EntityRef entity);
}
