package com.nosota.unipay.api.dto;

import com.nosota.unipay.api.model.LedgerReason;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class LedgerEntryDTO {
    private Long id;
    private Long accountId;
    private BigDecimal delta;
    private BigDecimal balanceAfter;
    private String operationId;
    private LedgerReason reason;
    private LocalDateTime createdAt;
}
