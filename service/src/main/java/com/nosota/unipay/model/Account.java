package com.nosota.unipay.model;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.AccountStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A balance-bearing account of the ledger.
 * <p>
 * The balance is mutated only by the transfer engine while the row is locked, and every
 * mutation bumps {@link #version}. Ownership rules:
 * - WALLET, BUDGET_CARD and LOAN accounts have a non-null ownerId
 * - ESCROW accounts are system-owned (ownerId=null), one per marketplace order
 * </p>
 */
@Entity
@Table(name = "account")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Account {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * ID of the owner in the user service. Null for ESCROW accounts.
     */
    @Column(name = "owner_id")
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false)
    private AccountKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private AccountStatus status = AccountStatus.ACTIVE;

    /**
     * Current balance, scale 2.
     * <p>
     * Never negative for WALLET, BUDGET_CARD and ESCROW. For LOAN accounts this is the
     * outstanding principal.
     * </p>
     */
    @Column(name = "balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal balance = BigDecimal.ZERO;

    /**
     * Currency of the account (ISO 4217 code).
     * <p>
     * All accounts touched by one operation must share the same currency.
     * </p>
     */
    @Column(name = "currency", nullable = false, length = 3)
    private String currency = "USD";

    /**
     * Monotonic counter bumped by every balance or status change.
     */
    @Column(name = "version", nullable = false)
    private Long version = 0L;

    private String name;

    /**
     * Budget card: the funding wallet. Loan: the borrower wallet.
     */
    @Column(name = "parent_account_id")
    private Long parentAccountId;

    /**
     * Loan: the lender wallet receiving repayments.
     */
    @Column(name = "counterparty_account_id")
    private Long counterpartyAccountId;

    /**
     * Budget card monthly spending limit. Null means unlimited.
     */
    @Column(name = "monthly_limit", precision = 19, scale = 2)
    private BigDecimal monthlyLimit;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public boolean isOwnedBy(Long candidateOwnerId) {
        return ownerId != null && ownerId.equals(candidateOwnerId);
    }
}
