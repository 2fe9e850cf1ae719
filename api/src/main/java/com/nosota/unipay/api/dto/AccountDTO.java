package com.nosota.unipay.api.dto;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.AccountStatus;
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
public class AccountDTO {
    private Long id;
    private Long ownerId;
    private AccountKind kind;
    private AccountStatus status;
    private BigDecimal balance;
    private String currency;
    private String name;
    private Long parentAccountId;
    private Long counterpartyAccountId;
    private BigDecimal monthlyLimit;
    private Long version;
    private LocalDateTime createdAt;
}
