package com.nosota.unipay.api.response;

import java.math.BigDecimal;

/**
 * System wide conservation check.
 *
 * @param totalBalances    Sum of balances of fund-holding accounts (wallets, budget cards, escrow)
 * @param escrowHeld       Part of totalBalances sitting in escrow accounts
 * @param loanOutstanding  Sum of LOAN memo balances
 * @param externalInflow   Money that entered the ledger (top-ups)
 * @param externalOutflow  Money that left the ledger (withdrawals, spends, subscription charges)
 * @param entrySum         Sum of every ledger entry delta on fund-holding accounts
 * @param balanced         true when totalBalances == externalInflow - externalOutflow == entrySum
 */
public record ReconciliationResponse(
        BigDecimal totalBalances,
        BigDecimal escrowHeld,
        BigDecimal loanOutstanding,
        BigDecimal externalInflow,
        BigDecimal externalOutflow,
        BigDecimal entrySum,
        boolean balanced
) {}
