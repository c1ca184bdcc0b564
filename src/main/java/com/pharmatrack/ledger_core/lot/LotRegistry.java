package com.pharmatrack.ledger_core.lot;

import java.util.UUID;

/**
 * Answers whether a lot may still move (not expired, recalled or blocked).
 *
 * The ledger never calls this inside a critical section; callers resolve it
 * first and pass the answer along as {@code lotUsable}.
 */
public interface LotRegistry {

    boolean isLotUsable(UUID lotId);
}
