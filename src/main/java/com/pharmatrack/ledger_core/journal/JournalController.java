package com.pharmatrack.ledger_core.journal;

import com.pharmatrack.ledger_core.journal.dto.AccountBalanceResponse;
import com.pharmatrack.ledger_core.journal.dto.CreateEntryRequest;
import com.pharmatrack.ledger_core.journal.dto.JournalEntryResponse;
import com.pharmatrack.ledger_core.journal.dto.JournalLinePayload;
import com.pharmatrack.ledger_core.journal.dto.ReplaceLinesRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for journal entries and account balances.
 */
@RestController
@RequestMapping("/api/journal")
@RequiredArgsConstructor
@Slf4j
public class JournalController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final JournalService journalService;
    private final AccountService accountService;

    @PostMapping("/entries")
    public ResponseEntity<JournalEntryResponse> createEntry(@Valid @RequestBody CreateEntryRequest request,
                                                            @RequestHeader(ACTOR_HEADER) UUID actorId) {
        log.info("Received journal entry request: reference={}, lines={}",
            request.getReference(), request.getLines().size());

        JournalEntry entry = journalService.createEntry(
            request.getEntryDate(),
            request.getReference(),
            request.getDescription(),
            toLineRequests(request.getLines()),
            actorId
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(JournalEntryResponse.from(entry));
    }

    @GetMapping("/entries/{id}")
    public ResponseEntity<JournalEntryResponse> getEntry(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(JournalEntryResponse.from(journalService.getEntry(id)));
    }

    @PutMapping("/entries/{id}/lines")
    public ResponseEntity<JournalEntryResponse> replaceLines(@PathVariable("id") UUID id,
                                                             @Valid @RequestBody ReplaceLinesRequest request,
                                                             @RequestHeader(ACTOR_HEADER) UUID actorId) {
        JournalEntry entry = journalService.updateDraft(id, toLineRequests(request.getLines()), actorId);
        return ResponseEntity.ok(JournalEntryResponse.from(entry));
    }

    @PostMapping("/entries/{id}/post")
    public ResponseEntity<JournalEntryResponse> post(@PathVariable("id") UUID id,
                                                     @RequestHeader(ACTOR_HEADER) UUID actorId) {
        return ResponseEntity.ok(JournalEntryResponse.from(journalService.post(id, actorId)));
    }

    @PostMapping("/entries/{id}/reverse")
    public ResponseEntity<JournalEntryResponse> reverse(@PathVariable("id") UUID id,
                                                        @RequestHeader(ACTOR_HEADER) UUID actorId) {
        JournalEntry reversal = journalService.reverse(id, actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(JournalEntryResponse.from(reversal));
    }

    @GetMapping("/accounts/{id}/balance")
    public ResponseEntity<AccountBalanceResponse> getAccountBalance(@PathVariable("id") UUID id) {
        Account account = accountService.getAccount(id);
        BigDecimal balance = journalService.getAccountBalance(id);
        return ResponseEntity.ok(new AccountBalanceResponse(
            account.getId(), account.getCode(), account.getAccountClass(), balance));
    }

    private static List<JournalLineRequest> toLineRequests(List<JournalLinePayload> lines) {
        return lines.stream().map(JournalLinePayload::toRequest).toList();
    }
}
