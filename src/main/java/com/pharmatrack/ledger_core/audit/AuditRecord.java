package com.pharmatrack.ledger_core.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One audit trail entry: who did what to which record, with the record's
 * state before and after. {@code beforeState} is null for creations.
 */
@Value
@Builder
public class AuditRecord {
    UUID actorId;
    AuditAction action;
    String entityDescriptor;
    Map<String, Object> beforeState;
    Map<String, Object> afterState;
    Instant timestamp;
}
