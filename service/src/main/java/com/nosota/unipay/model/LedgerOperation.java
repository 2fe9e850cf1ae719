package com.nosota.unipay.model;

import com.nosota.unipay.api.model.LedgerReason;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One row per applied operation. The primary key is the client supplied operation id,
 * so a second application of the same id fails on insert.
 */
@Entity
@Table(name = "ledger_operation")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LedgerOperation {
    @Id
    @Column(name = "operation_id", length = 64)
    private String operationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false)
    private LedgerReason reason;

    private String description;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
