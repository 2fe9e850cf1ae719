package com.nosota.unipay.api.dto;

import com.nosota.unipay.api.model.BillingCycle;
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
public class SubscriptionDTO {
    private Long id;
    private Long accountId;
    private Long ownerId;
    private String serviceName;
    private String serviceCategory;
    private BigDecimal amount;
    private String currency;
    private BillingCycle billingCycle;
    private LocalDate nextBillingDate;
    private LocalDate lastPaymentDate;
    private boolean active;
    private boolean autoRenew;
    private LocalDateTime createdAt;
    private LocalDateTime cancelledAt;
}
