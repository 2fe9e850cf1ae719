package com.nosota.unipay.service;

import com.nosota.unipay.TestBase;
import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.LedgerErrorCode;
import com.nosota.unipay.api.model.SpendConstraint;
import com.nosota.unipay.api.response.CardSummaryResponse;
import com.nosota.unipay.ledger.LedgerResult;
import com.nosota.unipay.ledger.TransferReceipt;
import com.nosota.unipay.model.Account;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("4. Budget cards")
class BudgetCardServiceTest extends TestBase {

    private Account card(Long ownerId, Account wallet, String monthlyLimit, String allocation) {
        Account card = budgetCardService.createCard(ownerId, wallet.getId(), "Groceries",
                monthlyLimit == null ? null : usd(monthlyLimit)).orElseThrow();
        budgetCardService.allocate(ownerId, card.getId(), usd(allocation), opId("alloc")).orElseThrow();
        return card;
    }

    @Test
    @DisplayName("Allocation moves money from the wallet to the card and back")
    void allocateAndReturn() {
        Long owner = newOwner();
        Account wallet = fundedWallet(owner, "300.00");
        Account card = card(owner, wallet, null, "120.00");

        assertThat(card.getKind()).isEqualTo(AccountKind.BUDGET_CARD);
        assertThat(card.getParentAccountId()).isEqualTo(wallet.getId());
        assertThat(balanceOf(wallet.getId())).isEqualByComparingTo("180.00");
        assertThat(balanceOf(card.getId())).isEqualByComparingTo("120.00");

        budgetCardService.returnToWallet(owner, card.getId(), usd("20"), opId("return")).orElseThrow();

        assertThat(balanceOf(wallet.getId())).isEqualByComparingTo("200.00");
        assertThat(balanceOf(card.getId())).isEqualByComparingTo("100.00");
    }

    @Test
    @DisplayName("Limit 100 with 90 spent: a 20 spend is refused for the monthly limit")
    void monthlyLimitScenario() {
        Long owner = newOwner();
        Account wallet = fundedWallet(owner, "500.00");
        Account card = card(owner, wallet, "100.00", "300.00");
        budgetCardService.spend(owner, card.getId(), usd("90"), opId("spend"), "Weekly shop").orElseThrow();

        SpendDecision decision = budgetCardService.canSpend(card.getId(), usd("20"));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.constraint()).isEqualTo(SpendConstraint.MONTHLY_LIMIT);
        assertThat(decision.message()).contains("monthly limit");
        assertThat(decision.shortfall()).isEqualByComparingTo("10");

        LedgerResult<TransferReceipt> spend = budgetCardService.spend(owner, card.getId(), usd("20"), opId("spend"), null);
        assertThat(spend.hasCode(LedgerErrorCode.LIMIT_EXCEEDED)).isTrue();
        assertThat(spend.getFailure().shortfall()).isEqualByComparingTo("10");
        assertThat(balanceOf(card.getId())).isEqualByComparingTo("210.00");

        CardSummaryResponse summary = budgetCardService.getCardSummary(card.getId());
        assertThat(summary.spentThisMonth()).isEqualByComparingTo("90");
        assertThat(summary.remainingThisMonth()).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("Spending above the allocated balance is refused as insufficient funds")
    void allocatedBalanceExceeded() {
        Long owner = newOwner();
        Account wallet = fundedWallet(owner, "500.00");
        Account card = card(owner, wallet, null, "50.00");

        SpendDecision decision = budgetCardService.canSpend(card.getId(), usd("70"));
        LedgerResult<TransferReceipt> spend = budgetCardService.spend(owner, card.getId(), usd("70"), opId("spend"), null);

        assertThat(decision.constraint()).isEqualTo(SpendConstraint.ALLOCATED_BALANCE);
        assertThat(decision.message()).contains("allocated balance");
        assertThat(spend.hasCode(LedgerErrorCode.INSUFFICIENT_FUNDS)).isTrue();
        assertThat(spend.getFailure().shortfall()).isEqualByComparingTo("20");
    }

    @Test
    @DisplayName("A frozen card reports its status even when the spend also breaks the limit")
    void frozenCardOverLimit() {
        Long owner = newOwner();
        Account wallet = fundedWallet(owner, "500.00");
        Account card = card(owner, wallet, "100.00", "300.00");
        accountService.freeze(card.getId()).orElseThrow();

        LedgerResult<TransferReceipt> spend = budgetCardService.spend(owner, card.getId(), usd("150"), opId("spend"), null);

        assertThat(spend.hasCode(LedgerErrorCode.ACCOUNT_FROZEN)).isTrue();
        assertThat(balanceOf(card.getId())).isEqualByComparingTo("300.00");
    }

    @Test
    @DisplayName("Raising the limit lets the next spend through")
    void updateMonthlyLimit() {
        Long owner = newOwner();
        Account wallet = fundedWallet(owner, "500.00");
        Account card = card(owner, wallet, "50.00", "200.00");

        assertThat(budgetCardService.canSpend(card.getId(), usd("80")).allowed()).isFalse();
        budgetCardService.updateMonthlyLimit(owner, card.getId(), usd("100")).orElseThrow();
        assertThat(budgetCardService.canSpend(card.getId(), usd("80")).allowed()).isTrue();

        budgetCardService.updateMonthlyLimit(owner, card.getId(), null).orElseThrow();
        assertThat(budgetCardService.getCardSummary(card.getId()).monthlyLimit()).isNull();
        assertThat(budgetCardService.updateMonthlyLimit(newOwner(), card.getId(), usd("10"))
                .hasCode(LedgerErrorCode.UNAUTHORIZED)).isTrue();
    }

    @Test
    @DisplayName("Concurrent spends cannot jointly exceed the monthly limit")
    void concurrentSpendsRespectLimit() throws Exception {
        Long owner = newOwner();
        Account wallet = fundedWallet(owner, "500.00");
        Account card = card(owner, wallet, "100.00", "400.00");

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<LedgerResult<TransferReceipt>> first = executor.submit(() -> {
                start.await();
                return budgetCardService.spend(owner, card.getId(), usd("60"), opId("spend-a"), null);
            });
            Future<LedgerResult<TransferReceipt>> second = executor.submit(() -> {
                start.await();
                return budgetCardService.spend(owner, card.getId(), usd("60"), opId("spend-b"), null);
            });
            start.countDown();

            List<LedgerResult<TransferReceipt>> results = List.of(
                    first.get(30, TimeUnit.SECONDS), second.get(30, TimeUnit.SECONDS));
            assertThat(results).filteredOn(LedgerResult::isSuccess).hasSize(1);
            assertThat(results).filteredOn(r -> r.hasCode(LedgerErrorCode.LIMIT_EXCEEDED)).hasSize(1);
        } finally {
            executor.shutdownNow();
        }
        assertThat(budgetCardService.spentThisMonth(card.getId())).isEqualByComparingTo("60");
    }

    @Test
    @DisplayName("Repeated spend operation is applied once")
    void idempotentSpend() {
        Long owner = newOwner();
        Account wallet = fundedWallet(owner, "500.00");
        Account card = card(owner, wallet, "100.00", "200.00");
        String operationId = opId("spend");

        budgetCardService.spend(owner, card.getId(), usd("70"), operationId, null).orElseThrow();
        LedgerResult<TransferReceipt> repeated = budgetCardService.spend(owner, card.getId(), usd("70"), operationId, null);

        assertThat(repeated.isDuplicate()).isTrue();
        assertThat(balanceOf(card.getId())).isEqualByComparingTo("130.00");
    }
}
