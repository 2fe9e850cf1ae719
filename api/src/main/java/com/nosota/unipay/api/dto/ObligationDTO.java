package com.nosota.unipay.api.dto;

import com.nosota.unipay.api.model.ObligationStatus;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class ObligationDTO {
    private Long id;
    private Long subscriptionId;
    private Long accountId;
    private BigDecimal amount;
    private LocalDate dueDate;
    private ObligationStatus status;
    private String operationId;
    private String failureReason;
    private LocalDateTime createdAt;
    private LocalDateTime settledAt;
}
