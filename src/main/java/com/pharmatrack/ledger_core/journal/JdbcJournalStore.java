package com.pharmatrack.ledger_core.journal;

import com.pharmatrack.ledger_core.exception.ImmutableRecordViolationException;
import com.pharmatrack.ledger_core.exception.LedgerValidationException;
import com.pharmatrack.ledger_core.exception.RecordNotFoundException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link JournalStore} over the {@code journal_entries} and {@code journal_lines} tables.
 *
 * On PostgreSQL, triggers reject changes to posted entries and posting of an
 * unbalanced entry, whatever path the change comes from.
 */
@Repository
public class JdbcJournalStore implements JournalStore {

    private static final String ENTRY_COLUMNS =
        "id, entry_date, reference, description, status, created_by, created_at, " +
        "posted_by, posted_at, reverses_entry_id";

    private static final String LINE_COLUMNS =
        "id, entry_id, line_number, account_id, debit, credit, memo";

    private final JdbcTemplate jdbcTemplate;

    public JdbcJournalStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public UUID append(JournalEntry entry, List<JournalLineRequest> lines) {
        JournalLines.validate(lines);
        if (entry.getStatus() != JournalStatus.DRAFT) {
            throw new LedgerValidationException("New journal entries start as DRAFT");
        }

        try {
            jdbcTemplate.update(
                "INSERT INTO journal_entries (id, entry_date, reference, description, status, created_by, " +
                "created_at, reverses_entry_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                entry.getId(),
                Date.valueOf(entry.getEntryDate()),
                entry.getReference(),
                entry.getDescription(),
                entry.getStatus().name(),
                entry.getCreatedBy(),
                Timestamp.from(entry.getCreatedAt()),
                entry.getReversesEntryId()
            );
        } catch (DuplicateKeyException e) {
            if (entry.getReversesEntryId() != null) {
                throw new ImmutableRecordViolationException(
                    "Journal entry " + entry.getReversesEntryId() + " has already been reversed", e);
            }
            throw new ImmutableRecordViolationException("Journal entry " + entry.getId() + " already exists", e);
        }

        insertLines(entry.getId(), lines);
        return entry.getId();
    }

    @Override
    public Optional<JournalEntry> get(UUID entryId) {
        List<JournalEntry> found = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE id = ?",
            entryRowMapper(),
            entryId
        );
        return found.stream().findFirst().map(this::withLines);
    }

    @Override
    public void replaceDraftLines(UUID entryId, List<JournalLineRequest> lines) {
        JournalLines.validate(lines);

        List<String> status = jdbcTemplate.queryForList(
            "SELECT status FROM journal_entries WHERE id = ? FOR UPDATE",
            String.class,
            entryId
        );
        if (status.isEmpty()) {
            throw new RecordNotFoundException("Journal entry", entryId);
        }
        if (JournalStatus.valueOf(status.get(0)) != JournalStatus.DRAFT) {
            throw new ImmutableRecordViolationException("Journal entry " + entryId + " is posted and cannot be modified");
        }

        jdbcTemplate.update("DELETE FROM journal_lines WHERE entry_id = ?", entryId);
        insertLines(entryId, lines);
    }

    @Override
    public boolean markPosted(UUID entryId, UUID postedBy, Instant postedAt) {
        int updated = jdbcTemplate.update(
            "UPDATE journal_entries SET status = ?, posted_by = ?, posted_at = ? WHERE id = ? AND status = ?",
            JournalStatus.POSTED.name(),
            postedBy,
            Timestamp.from(postedAt),
            entryId,
            JournalStatus.DRAFT.name()
        );
        return updated == 1;
    }

    @Override
    public List<JournalEntry> findByReference(String reference) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE reference = ? ORDER BY created_at",
            entryRowMapper(),
            reference
        ).stream().map(this::withLines).toList();
    }

    @Override
    public Optional<JournalEntry> findReversalOf(UUID entryId) {
        List<JournalEntry> found = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE reverses_entry_id = ?",
            entryRowMapper(),
            entryId
        );
        return found.stream().findFirst().map(this::withLines);
    }

    @Override
    public AccountTotals postedTotalsForAccount(UUID accountId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(l.debit), 0) AS debit_total, COALESCE(SUM(l.credit), 0) AS credit_total " +
            "FROM journal_lines l JOIN journal_entries e ON e.id = l.entry_id " +
            "WHERE l.account_id = ? AND e.status = ?",
            (rs, rowNum) -> new AccountTotals(rs.getBigDecimal("debit_total"), rs.getBigDecimal("credit_total")),
            accountId,
            JournalStatus.POSTED.name()
        );
    }

    @Override
    public long countUnbalancedPostedEntries() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM (" +
            "  SELECT e.id FROM journal_entries e " +
            "  LEFT JOIN journal_lines l ON l.entry_id = e.id " +
            "  WHERE e.status = ? " +
            "  GROUP BY e.id " +
            "  HAVING COUNT(l.id) = 0 OR COALESCE(SUM(l.debit), 0) <> COALESCE(SUM(l.credit), 0)" +
            ") unbalanced",
            Long.class,
            JournalStatus.POSTED.name()
        );
        return count != null ? count : 0L;
    }

    private void insertLines(UUID entryId, List<JournalLineRequest> lines) {
        int lineNumber = 1;
        for (JournalLineRequest line : lines) {
            jdbcTemplate.update(
                "INSERT INTO journal_lines (" + LINE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
                UUID.randomUUID(),
                entryId,
                lineNumber++,
                line.getAccountId(),
                line.getDebit() != null ? line.getDebit() : BigDecimal.ZERO,
                line.getCredit() != null ? line.getCredit() : BigDecimal.ZERO,
                line.getMemo()
            );
        }
    }

    private JournalEntry withLines(JournalEntry entry) {
        List<JournalLine> lines = jdbcTemplate.query(
            "SELECT " + LINE_COLUMNS + " FROM journal_lines WHERE entry_id = ? ORDER BY line_number",
            lineRowMapper(),
            entry.getId()
        );
        return entry.toBuilder().clearLines().lines(lines).build();
    }

    private RowMapper<JournalEntry> entryRowMapper() {
        return (rs, rowNum) -> {
            Timestamp postedAt = rs.getTimestamp("posted_at");
            return JournalEntry.builder()
                .id(UUID.fromString(rs.getString("id")))
                .entryDate(rs.getDate("entry_date").toLocalDate())
                .reference(rs.getString("reference"))
                .description(rs.getString("description"))
                .status(JournalStatus.valueOf(rs.getString("status")))
                .createdBy(uuidOrNull(rs.getString("created_by")))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .postedBy(uuidOrNull(rs.getString("posted_by")))
                .postedAt(postedAt != null ? postedAt.toInstant() : null)
                .reversesEntryId(uuidOrNull(rs.getString("reverses_entry_id")))
                .build();
        };
    }

    private RowMapper<JournalLine> lineRowMapper() {
        return (rs, rowNum) -> new JournalLine(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("entry_id")),
            rs.getInt("line_number"),
            UUID.fromString(rs.getString("account_id")),
            rs.getBigDecimal("debit"),
            rs.getBigDecimal("credit"),
            rs.getString("memo")
        );
    }

    private static UUID uuidOrNull(String value) {
        return value != null ? UUID.fromString(value) : null;
    }
}
