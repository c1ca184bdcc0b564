package com.pharmatrack.ledger_core.exception;

import java.util.UUID;

/**
 * The lot registry reported the lot as not usable (expired, recalled or blocked).
 */
public class LotUnusableException extends LedgerException {

    public static final String CODE = "LOT_UNUSABLE";

    public LotUnusableException(UUID lotId) {
        super(CODE, "Lot " + lotId + " is not usable");
    }
}
