package com.pharmatrack.ledger_core.coordinator;

import com.pharmatrack.ledger_core.journal.Account;
import com.pharmatrack.ledger_core.journal.AccountRole;
import com.pharmatrack.ledger_core.journal.AccountService;
import com.pharmatrack.ledger_core.stock.EntityRef;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Resolves transfer accounts from the accounts an entity owns, one per role.
 */
@Component
@RequiredArgsConstructor
public class RoleBasedAccountResolver implements AccountResolver {

    private final AccountService accountService;

    @Override
    public TransferAccounts accountsFor(EntityRef entity) {
        return new TransferAccounts(
            require(entity, AccountRole.RECEIVABLE),
            require(entity, AccountRole.PAYABLE),
            require(entity, AccountRole.INVENTORY),
            require(entity, AccountRole.REVENUE)
        );
    }

    private UUID require(EntityRef entity, AccountRole role) {
        return accountService.findEntityAccount(entity, role)
            .map(Account::getId)
            .orElseThrow(() -> new AccountResolutionException(entity, role));
    }
}
