package com.nosota.unipay.model;

import com.nosota.unipay.api.model.ObligationStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A materialized future charge of a subscription.
 * <p>
 * At most one obligation exists per (subscriptionId, dueDate), enforced by a unique constraint.
 * SCHEDULED becomes SETTLED in the same transaction that applies the charge.
 * </p>
 */
@Entity
@Table(name = "scheduled_obligation",
        uniqueConstraints = @UniqueConstraint(name = "uq_obligation_subscription_due",
                columnNames = {"subscription_id", "due_date"}))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ScheduledObligation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "subscription_id", nullable = false)
    private Long subscriptionId;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ObligationStatus status = ObligationStatus.SCHEDULED;

    /**
     * Ledger operation that settled this obligation.
     */
    @Column(name = "operation_id", length = 64)
    private String operationId;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "settled_at")
    private LocalDateTime settledAt;
}
