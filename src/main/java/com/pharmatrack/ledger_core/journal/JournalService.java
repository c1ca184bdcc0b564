package com.pharmatrack.ledger_core.journal;

import com.pharmatrack.ledger_core.audit.AuditAction;
import com.pharmatrack.ledger_core.audit.AuditRecord;
import com.pharmatrack.ledger_core.audit.AuditSink;
import com.pharmatrack.ledger_core.exception.ImmutableRecordViolationException;
import com.pharmatrack.ledger_core.exception.LedgerException;
import com.pharmatrack.ledger_core.exception.LedgerValidationException;
import com.pharmatrack.ledger_core.exception.RecordNotFoundException;
import com.pharmatrack.ledger_core.exception.UnbalancedEntryException;
import com.pharmatrack.ledger_core.observability.CorrelationContext;
import com.pharmatrack.ledger_core.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Double-entry journal: creation, posting and reversal of entries.
 *
 * This service enforces the core invariants:
 * 1. Debits equal credits, checked before anything is written
 * 2. POSTED is terminal; a posted entry is never changed or deleted
 * 3. Corrections are reversals, never edits
 *
 * Every accepted write is audited in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    public static final String REVERSAL_PREFIX = "REVERSAL:";
    private static final int MAX_REFERENCE_LENGTH = 200;
    static final int MAX_DESCRIPTION_LENGTH = 1000;

    private final JournalStore journalStore;
    private final AccountService accountService;
    private final AuditSink auditSink;
    private final LedgerMetrics metrics;

    /**
     * Creates a DRAFT entry.
     *
     * @throws UnbalancedEntryException if total debits differ from total credits
     * @throws LedgerValidationException for empty or malformed lines, or unknown accounts
     */
    @Transactional
    public JournalEntry createEntry(LocalDate entryDate, String reference, String description,
                                    List<JournalLineRequest> lines, UUID creatorId) {
        return tracked("create", () -> {
            if (entryDate == null) {
                throw new LedgerValidationException("Entry date is required");
            }
            validateReference(reference);
            if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
                throw new LedgerValidationException(
                    "Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
            }
            validateLines(lines);

            JournalEntry draft = JournalEntry.builder()
                .id(UUID.randomUUID())
                .entryDate(entryDate)
                .reference(reference)
                .description(description)
                .status(JournalStatus.DRAFT)
                .createdBy(creatorId)
                .createdAt(Instant.now())
                .build();

            journalStore.append(draft, lines);
            JournalEntry created = load(draft.getId());

            audit(creatorId, AuditAction.CREATE, created, null);
            log.info("Journal entry created: id={}, reference={}, total={}",
                created.getId(), reference, created.totalDebit());
            return created;
        });
    }

    /**
     * Replaces the lines of a DRAFT entry.
     *
     * @throws ImmutableRecordViolationException if the entry is already POSTED
     */
    @Transactional
    public JournalEntry updateDraft(UUID entryId, List<JournalLineRequest> lines, UUID actorId) {
        return tracked("update", () -> {
            MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, String.valueOf(entryId));
            JournalEntry before = load(entryId);
            if (before.isPosted()) {
                throw new ImmutableRecordViolationException("Journal entry " + entryId + " is posted and cannot be modified");
            }
            validateLines(lines);

            journalStore.replaceDraftLines(entryId, lines);
            JournalEntry after = load(entryId);

            audit(actorId, AuditAction.UPDATE, after, before);
            log.info("Journal draft updated: id={}, lines={}", entryId, lines.size());
            return after;
        });
    }

    /**
     * Posts a DRAFT entry, stamping poster and time.
     *
     * @throws LedgerValidationException if no poster is given
     * @throws ImmutableRecordViolationException if the entry is already POSTED
     */
    @Transactional
    public JournalEntry post(UUID entryId, UUID posterId) {
        return tracked("post", () -> {
            MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, String.valueOf(entryId));
            JournalEntry before = load(entryId);
            JournalEntry after = postLoaded(before, posterId);

            audit(posterId, AuditAction.POST, after, before);
            log.info("Journal entry posted: id={}, reference={}", entryId, after.getReference());
            return after;
        });
    }

    /**
     * Reverses a POSTED entry by creating and immediately posting a new entry
     * with every line's debit and credit swapped. An entry can be reversed once.
     *
     * @return the posted reversal entry
     * @throws LedgerValidationException if the entry is still a DRAFT
     * @throws ImmutableRecordViolationException if the entry was already reversed
     */
    @Transactional
    public JournalEntry reverse(UUID entryId, UUID posterId) {
        return tracked("reverse", () -> {
            MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, String.valueOf(entryId));
            JournalEntry original = load(entryId);
            if (!original.isPosted()) {
                throw new LedgerValidationException("Only posted entries can be reversed; " + entryId + " is a draft");
            }
            if (journalStore.findReversalOf(entryId).isPresent()) {
                throw new ImmutableRecordViolationException("Journal entry " + entryId + " has already been reversed");
            }

            List<JournalLineRequest> swapped = original.getLines().stream()
                .map(line -> line.toRequest().swapped())
                .toList();

            JournalEntry draft = JournalEntry.builder()
                .id(UUID.randomUUID())
                .entryDate(LocalDate.now())
                .reference(REVERSAL_PREFIX + entryId)
                .description("Reversal of " + original.getReference())
                .status(JournalStatus.DRAFT)
                .createdBy(posterId)
                .createdAt(Instant.now())
                .reversesEntryId(entryId)
                .build();

            journalStore.append(draft, swapped);
            JournalEntry reversal = postLoaded(load(draft.getId()), posterId);

            recordAudit(posterId, AuditAction.REVERSE, reversal, original.toAuditState());
            log.info("Journal entry reversed: original={}, reversal={}", entryId, reversal.getId());
            return reversal;
        });
    }

    @Transactional(readOnly = true)
    public JournalEntry getEntry(UUID entryId) {
        return load(entryId);
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> findByReference(String reference) {
        return journalStore.findByReference(reference);
    }

    /**
     * Balance of an account from POSTED lines, signed by the account's normal side.
     */
    @Transactional(readOnly = true)
    public BigDecimal getAccountBalance(UUID accountId) {
        Account account = accountService.getAccount(accountId);
        AccountTotals totals = journalStore.postedTotalsForAccount(accountId);

        return account.getAccountClass().isDebitNormal()
            ? totals.getDebitTotal().subtract(totals.getCreditTotal())
            : totals.getCreditTotal().subtract(totals.getDebitTotal());
    }

    private JournalEntry postLoaded(JournalEntry entry, UUID posterId) {
        if (posterId == null) {
            throw new LedgerValidationException("Poster is required to post journal entry " + entry.getId());
        }
        if (entry.isPosted()) {
            throw new ImmutableRecordViolationException("Journal entry " + entry.getId() + " is already posted");
        }
        if (entry.getLines().isEmpty()) {
            throw new LedgerValidationException("Journal entry " + entry.getId() + " has no lines");
        }
        if (entry.totalDebit().compareTo(entry.totalCredit()) != 0) {
            throw new UnbalancedEntryException(entry.totalDebit(), entry.totalCredit());
        }
        if (!journalStore.markPosted(entry.getId(), posterId, Instant.now())) {
            throw new ImmutableRecordViolationException("Journal entry " + entry.getId() + " is already posted");
        }
        return load(entry.getId());
    }

    private void validateLines(List<JournalLineRequest> lines) {
        JournalLines.validate(lines);
        JournalLines.requireBalanced(lines);
        accountService.requireExisting(lines.stream().map(JournalLineRequest::getAccountId).toList());
    }

    private static void validateReference(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new LedgerValidationException("Reference is required");
        }
        if (reference.length() > MAX_REFERENCE_LENGTH) {
            throw new LedgerValidationException("Reference must be at most " + MAX_REFERENCE_LENGTH + " characters");
        }
    }

    private JournalEntry load(UUID entryId) {
        return journalStore.get(entryId)
            .orElseThrow(() -> new RecordNotFoundException("Journal entry", entryId));
    }

    private void audit(UUID actorId, AuditAction action, JournalEntry after, JournalEntry before) {
        recordAudit(actorId, action, after, before != null ? before.toAuditState() : null);
    }

    private void recordAudit(UUID actorId, AuditAction action, JournalEntry after, Map<String, Object> beforeState) {
        auditSink.record(AuditRecord.builder()
            .actorId(actorId)
            .action(action)
            .entityDescriptor("JournalEntry:" + after.getId())
            .beforeState(beforeState)
            .afterState(after.toAuditState())
            .timestamp(Instant.now())
            .build());
    }

    private <T> T tracked(String action, Supplier<T> operation) {
        long startTime = System.currentTimeMillis();
        try {
            T result = operation.get();
            metrics.recordJournalEntry(action, "success");
            return result;
        } catch (LedgerException e) {
            metrics.recordJournalEntry(action, e.getErrorCode());
            log.warn("Journal {} rejected: {}", action, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("journal_" + action, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }
}
