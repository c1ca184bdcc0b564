package com.pharmatrack.ledger_core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Writes audit records to {@code audit_log} in the caller's transaction.
 * States are stored as JSON.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcAuditSink implements AuditSink {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void record(AuditRecord auditRecord) {
        Instant timestamp = auditRecord.getTimestamp() != null ? auditRecord.getTimestamp() : Instant.now();

        jdbcTemplate.update(
            "INSERT INTO audit_log (id, actor_id, action, entity_descriptor, before_state, after_state, recorded_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            UUID.randomUUID(),
            auditRecord.getActorId(),
            auditRecord.getAction().name(),
            auditRecord.getEntityDescriptor(),
            toJson(auditRecord.getBeforeState()),
            toJson(auditRecord.getAfterState()),
            Timestamp.from(timestamp)
        );

        log.debug("Audit {} {} by {}", auditRecord.getAction(), auditRecord.getEntityDescriptor(),
            auditRecord.getActorId());
    }

    private String toJson(Map<String, Object> state) {
        if (state == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit state", e);
        }
    }
}
