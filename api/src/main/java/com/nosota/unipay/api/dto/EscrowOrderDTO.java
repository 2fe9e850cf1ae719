package com.nosota.unipay.api.dto;

import com.nosota.unipay.api.model.EscrowStatus;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class EscrowOrderDTO {
    private UUID id;
    private String listingId;
    private Long buyerOwnerId;
    private Long buyerAccountId;
    private Long sellerOwnerId;
    private Long sellerAccountId;
    private Long escrowAccountId;
    private BigDecimal amount;
    private EscrowStatus status;
    private String resolutionNote;
    private LocalDateTime createdAt;
    private LocalDateTime resolvedAt;
}
