package com.pharmatrack.ledger_core.journal;

import com.pharmatrack.ledger_core.exception.LedgerValidationException;
import com.pharmatrack.ledger_core.exception.RecordNotFoundException;
import com.pharmatrack.ledger_core.stock.EntityRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Manages the chart of accounts.
 *
 * Accounts are reference data created at configuration time; the
 * transactional flows only read them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;

    /**
     * Creates a system-level account with no owning entity.
     */
    @Transactional
    public Account createAccount(String code, String name, AccountClass accountClass) {
        return save(new Account(UUID.randomUUID(), code, name, accountClass, null, null, null));
    }

    /**
     * Creates an account owned by a stock-holding entity for the given role.
     */
    @Transactional
    public Account createEntityAccount(String code, String name, AccountClass accountClass,
                                       EntityRef owner, AccountRole role) {
        if (owner == null || owner.getKind() == null || owner.getId() == null) {
            throw new LedgerValidationException("Owner entity is required for an entity account");
        }
        if (role == null) {
            throw new LedgerValidationException("Role is required for an entity account");
        }
        if (accountRepository.findByOwnerKindAndOwnerIdAndRole(owner.getKind(), owner.getId(), role).isPresent()) {
            throw new LedgerValidationException(
                "Entity " + owner.getKind() + ":" + owner.getId() + " already has a " + role + " account");
        }
        return save(new Account(UUID.randomUUID(), code, name, accountClass, owner.getKind(), owner.getId(), role));
    }

    @Transactional(readOnly = true)
    public Account getAccount(UUID accountId) {
        return accountRepository.findById(accountId)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> new RecordNotFoundException("Account", accountId));
    }

    @Transactional(readOnly = true)
    public Optional<Account> findEntityAccount(EntityRef owner, AccountRole role) {
        return accountRepository.findByOwnerKindAndOwnerIdAndRole(owner.getKind(), owner.getId(), role)
            .map(AccountEntity::toDomain);
    }

    /**
     * Loads the given accounts, failing if any of them does not exist.
     *
     * @throws LedgerValidationException naming the first missing account
     */
    @Transactional(readOnly = true)
    public Map<UUID, Account> requireExisting(Collection<UUID> accountIds) {
        Set<UUID> wanted = new LinkedHashSet<>(accountIds);
        Map<UUID, Account> found = accountRepository.findAllById(wanted).stream()
            .map(AccountEntity::toDomain)
            .collect(Collectors.toMap(Account::getId, Function.identity()));

        for (UUID accountId : wanted) {
            if (!found.containsKey(accountId)) {
                throw new LedgerValidationException("Account not found: " + accountId);
            }
        }
        return found;
    }

    private Account save(Account account) {
        if (account.getCode() == null || account.getCode().isBlank()) {
            throw new LedgerValidationException("Account code is required");
        }
        if (account.getName() == null || account.getName().isBlank()) {
            throw new LedgerValidationException("Account name is required");
        }
        if (account.getAccountClass() == null) {
            throw new LedgerValidationException("Account class is required");
        }
        if (accountRepository.existsByCode(account.getCode())) {
            throw new LedgerValidationException("Account code already in use: " + account.getCode());
        }

        AccountEntity saved = accountRepository.saveAndFlush(AccountEntity.fromDomain(account));
        log.info("Account created: code={}, class={}, role={}", account.getCode(),
            account.getAccountClass(), account.getRole());
        return saved.toDomain();
    }
}
