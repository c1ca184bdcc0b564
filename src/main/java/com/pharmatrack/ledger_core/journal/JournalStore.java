package com.pharmatrack.ledger_core.journal;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage of journal entries and their lines.
 *
 * Entries are appended as DRAFT. A DRAFT entry's lines may be replaced
 * until it is posted; a POSTED entry has no update or delete path.
 */
public interface JournalStore {

    /**
     * Appends a new DRAFT entry and its lines, numbered in list order.
     *
     * @throws com.pharmatrack.ledger_core.exception.LedgerValidationException if lines are
     *         empty or a line has both or neither of debit and credit positive
     */
    UUID append(JournalEntry entry, List<JournalLineRequest> lines);

    Optional<JournalEntry> get(UUID entryId);

    /**
     * Deletes and recreates the lines of a DRAFT entry.
     *
     * @throws com.pharmatrack.ledger_core.exception.ImmutableRecordViolationException if the
     *         entry is POSTED
     */
    void replaceDraftLines(UUID entryId, List<JournalLineRequest> lines);

    /**
     * Moves a DRAFT entry to POSTED.
     *
     * @return false if the entry was not DRAFT any more
     */
    boolean markPosted(UUID entryId, UUID postedBy, Instant postedAt);

    List<JournalEntry> findByReference(String reference);

    Optional<JournalEntry> findReversalOf(UUID entryId);

    AccountTotals postedTotalsForAccount(UUID accountId);

    /**
     * Number of POSTED entries whose lines do not balance. Always zero unless
     * the table was modified outside the ledger.
     */
    long countUnbalancedPostedEntries();
}
