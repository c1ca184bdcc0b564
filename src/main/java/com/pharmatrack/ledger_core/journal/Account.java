package com.pharmatrack.ledger_core.journal;

import com.pharmatrack.ledger_core.stock.EntityKind;
import lombok.Value;

import java.util.UUID;

/**
 * Account in the chart of accounts.
 * System-level accounts have no owner and no role.
 */
@Value
public class Account {
    UUID id;
    String code;
    String name;
    AccountClass accountClass;
    EntityKind ownerKind;
    UUID ownerId;
    AccountRole role;
}
