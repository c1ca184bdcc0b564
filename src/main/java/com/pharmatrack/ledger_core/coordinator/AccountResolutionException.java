package com.pharmatrack.ledger_core.coordinator;

import com.pharmatrack.ledger_core.exception.LedgerValidationException;
import com.pharmatrack.ledger_core.journal.AccountRole;
import com.pharmatrack.ledger_core.stock.EntityRef;

public class AccountResolutionException extends LedgerValidationException {

    public AccountResolutionException(EntityRef entity, AccountRole role) {
        super("No " + role + " account configured for " + entity.getKind() + ":" + entity.getId());
    }
}
