package com.pharmatrack.ledger_core.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmatrack.ledger_core.journal.JournalEntry;
import com.pharmatrack.ledger_core.journal.JournalLine;
import com.pharmatrack.ledger_core.journal.JournalStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entry_date")
    LocalDate entryDate;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("description")
    String description;

    @JsonProperty("status")
    JournalStatus status;

    @JsonProperty("created_by")
    UUID createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("posted_by")
    UUID postedBy;

    @JsonProperty("posted_at")
    Instant postedAt;

    @JsonProperty("reverses_entry_id")
    UUID reversesEntryId;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("lines")
    List<Line> lines;

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
            .id(entry.getId())
            .entryDate(entry.getEntryDate())
            .reference(entry.getReference())
            .description(entry.getDescription())
            .status(entry.getStatus())
            .createdBy(entry.getCreatedBy())
            .createdAt(entry.getCreatedAt())
            .postedBy(entry.getPostedBy())
            .postedAt(entry.getPostedAt())
            .reversesEntryId(entry.getReversesEntryId())
            .totalDebit(entry.totalDebit())
            .totalCredit(entry.totalCredit())
            .lines(entry.getLines().stream().map(Line::from).toList())
            .build();
    }

    @Value
    public static class Line {

        @JsonProperty("line_number")
        int lineNumber;

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("debit")
        BigDecimal debit;

        @JsonProperty("credit")
        BigDecimal credit;

        @JsonProperty("memo")
        String memo;

        static Line from(JournalLine line) {
            return new Line(line.getLineNumber(), line.getAccountId(), line.getDebit(), line.getCredit(), line.getMemo());
        }
    }
}
