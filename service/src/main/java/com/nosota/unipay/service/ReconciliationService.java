package com.nosota.unipay.service;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.LedgerReason;
import com.nosota.unipay.api.response.ReconciliationResponse;
import com.nosota.unipay.model.Account;
import com.nosota.unipay.repository.AccountRepository;
import com.nosota.unipay.repository.LedgerEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Conservation check over the whole store.
 * <p>
 * Money only enters through top-ups and only leaves through withdrawals, budget spends and
 * subscription charges, so the balances of fund-holding accounts must equal inflow minus outflow
 * and the sum of all their entries. LOAN balances are memo figures and reported on their own.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    static final Set<AccountKind> FUND_KINDS = EnumSet.of(AccountKind.WALLET, AccountKind.BUDGET_CARD, AccountKind.ESCROW);

    private static final Set<LedgerReason> OUTFLOW_REASONS = EnumSet.of(
            LedgerReason.WITHDRAWAL, LedgerReason.BUDGET_SPEND, LedgerReason.SUBSCRIPTION_CHARGE);

    private final AccountRepository accountRepository;
    private final LedgerEntryRepository ledgerEntryRepository;

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public ReconciliationResponse reconcile() {
        BigDecimal totalBalances = accountRepository.sumBalancesByKinds(FUND_KINDS);
        BigDecimal escrowHeld = accountRepository.sumBalancesByKinds(EnumSet.of(AccountKind.ESCROW));
        BigDecimal loanOutstanding = accountRepository.sumBalancesByKinds(EnumSet.of(AccountKind.LOAN));
        BigDecimal inflow = ledgerEntryRepository.sumDeltasByReasons(FUND_KINDS, EnumSet.of(LedgerReason.TOPUP));
        BigDecimal outflow = ledgerEntryRepository.sumDeltasByReasons(FUND_KINDS, OUTFLOW_REASONS).negate();
        BigDecimal entrySum = ledgerEntryRepository.sumAllDeltas(FUND_KINDS);

        List<Account> negative = accountRepository.findNegativeBalances(FUND_KINDS);
        boolean balanced = negative.isEmpty()
                && totalBalances.compareTo(inflow.subtract(outflow)) == 0
                && totalBalances.compareTo(entrySum) == 0;

        if (balanced) {
            log.info("Ledger reconciled: totalBalances={}, escrowHeld={}, loanOutstanding={}",
                    totalBalances, escrowHeld, loanOutstanding);
        } else {
            log.error("Ledger out of balance: totalBalances={}, inflow={}, outflow={}, entrySum={}, negativeAccounts={}",
                    totalBalances, inflow, outflow, entrySum, negative.stream().map(Account::getId).toList());
        }
        return new ReconciliationResponse(totalBalances, escrowHeld, loanOutstanding, inflow, outflow, entrySum, balanced);
    }
}
