package com.pharmatrack.ledger_core.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmatrack.ledger_core.journal.AccountClass;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class AccountBalanceResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("code")
    String code;

    @JsonProperty("account_class")
    AccountClass accountClass;

    @JsonProperty("balance")
    BigDecimal balance;
}
