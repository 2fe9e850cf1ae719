package com.nosota.unipay.notification;

public enum LedgerEventType {
    TRANSFER_COMPLETED,
    TOPUP_COMPLETED,
    WITHDRAWAL_COMPLETED,
    BUDGET_SPEND,
    ESCROW_HELD,
    ESCROW_RELEASED,
    ESCROW_REFUNDED,
    LOAN_DISBURSED,
    LOAN_REPAID,
    SUBSCRIPTION_CHARGED,
    SUBSCRIPTION_PAYMENT_FAILED
}
