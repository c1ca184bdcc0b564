package com.pharmatrack.ledger_core.journal;

import com.pharmatrack.ledger_core.stock.EntityKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the {@code accounts} reference table.
 *
 * No setters: accounts are created once through {@link #fromDomain(Account)}
 * and never modified by the ledger.
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, updatable = false, length = 64)
    private String code;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_class", nullable = false, updatable = false, length = 16)
    private AccountClass accountClass;

    @Enumerated(EnumType.STRING)
    @Column(name = "owner_kind", updatable = false, length = 32)
    private EntityKind ownerKind;

    @Column(name = "owner_id", updatable = false)
    private UUID ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_role", updatable = false, length = 16)
    private AccountRole role;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static AccountEntity fromDomain(Account account) {
        return new AccountEntity(
            account.getId(),
            account.getCode(),
            account.getName(),
            account.getAccountClass(),
            account.getOwnerKind(),
            account.getOwnerId(),
            account.getRole(),
            null // createdAt - set by @PrePersist
        );
    }

    public Account toDomain() {
        return new Account(id, code, name, accountClass, ownerKind, ownerId, role);
    }
}
