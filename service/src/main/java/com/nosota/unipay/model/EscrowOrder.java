package com.nosota.unipay.model;

import com.nosota.unipay.api.model.EscrowStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Marketplace order whose amount is held in a dedicated ESCROW account until the seller
 * is paid or the buyer refunded.
 * <p>
 * Status changes happen only inside the transfer that moves the escrow money, while the
 * escrow account row is locked. Orders are never deleted.
 * </p>
 */
@Entity
@Table(name = "escrow_order")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class EscrowOrder {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "listing_id", nullable = false)
    private String listingId;

    @Column(name = "buyer_owner_id", nullable = false)
    private Long buyerOwnerId;

    @Column(name = "buyer_account_id", nullable = false)
    private Long buyerAccountId;

    @Column(name = "seller_owner_id", nullable = false)
    private Long sellerOwnerId;

    @Column(name = "seller_account_id", nullable = false)
    private Long sellerAccountId;

    @Column(name = "escrow_account_id")
    private Long escrowAccountId;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private EscrowStatus status;

    @Column(name = "resolution_note")
    private String resolutionNote;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
