package com.nosota.unipay.model;

import com.nosota.unipay.api.model.LedgerReason;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Immutable ledger entry: one signed balance change of one account.
 *
 * <p>Entries are append-only and written exclusively by the transfer engine, in the same
 * database transaction that changes the account balance. The entries of one operation share
 * its {@code operationId}.
 */
@Entity
@Table(name = "ledger_entry")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LedgerEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(name = "delta", nullable = false, precision = 19, scale = 2)
    private BigDecimal delta;

    /**
     * Account balance right after this entry was applied.
     */
    @Column(name = "balance_after", nullable = false, precision = 19, scale = 2)
    private BigDecimal balanceAfter;

    @Column(name = "operation_id", nullable = false, length = 64)
    private String operationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false)
    private LedgerReason reason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
