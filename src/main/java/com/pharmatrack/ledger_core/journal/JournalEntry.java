package com.pharmatrack.ledger_core.journal;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Journal entry with its lines.
 *
 * {@code postedBy} and {@code postedAt} are null until the entry is posted.
 * {@code reversesEntryId} is set only on the reversal of another entry.
 */
@Value
@Builder(toBuilder = true)
public class JournalEntry {
    UUID id;
    LocalDate entryDate;
    String reference;
    String description;
    JournalStatus status;
    UUID createdBy;
    Instant createdAt;
    UUID postedBy;
    Instant postedAt;
    UUID reversesEntryId;
    @Singular
    List<JournalLine> lines;

    public boolean isPosted() {
        return status == JournalStatus.POSTED;
    }

    public BigDecimal totalDebit() {
        return lines.stream().map(JournalLine::getDebit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalCredit() {
        return lines.stream().map(JournalLine::getCredit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public Map<String, Object> toAuditState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("id", id);
        state.put("entryDate", entryDate);
        state.put("reference", reference);
        state.put("description", description);
        state.put("status", status);
        state.put("postedBy", postedBy);
        state.put("postedAt", postedAt);
        state.put("reversesEntryId", reversesEntryId);
        state.put("lines", lines.stream().map(JournalLine::toAuditState).toList());
        return state;
    }
}
