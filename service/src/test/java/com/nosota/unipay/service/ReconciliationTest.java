package com.nosota.unipay.service;

import com.nosota.unipay.TestBase;
import com.nosota.unipay.api.response.ReconciliationResponse;
import com.nosota.unipay.marketplace.ListingInfo;
import com.nosota.unipay.model.Account;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@DisplayName("7. Reconciliation")
class ReconciliationTest extends TestBase {

    @Test
    @DisplayName("Balances equal external inflow minus outflow after a mix of operations")
    void balancedAfterMixedOperations() {
        ReconciliationResponse before = reconciliationService.reconcile();

        Long alice = newOwner();
        Long bob = newOwner();
        Account aliceWallet = fundedWallet(alice, "1000.00");
        Account bobWallet = fundedWallet(bob, "200.00");

        accountService.transfer(alice, aliceWallet.getId(), bobWallet.getId(), usd("150.00"), opId("p2p")).orElseThrow();
        accountService.withdraw(bob, bobWallet.getId(), usd("30.00"), opId("withdraw")).orElseThrow();

        Account card = budgetCardService.createCard(alice, aliceWallet.getId(), "Travel", usd("500")).orElseThrow();
        budgetCardService.allocate(alice, card.getId(), usd("100.00"), opId("alloc")).orElseThrow();
        budgetCardService.spend(alice, card.getId(), usd("40.00"), opId("spend"), "Train").orElseThrow();

        Account loan = loanService.disburse(alice, aliceWallet.getId(), bobWallet.getId(),
                usd("60.00"), opId("loan")).orElseThrow();
        loanService.repay(bob, loan.getId(), usd("20.00"), opId("repay")).orElseThrow();

        String listingId = "listing-" + UUID.randomUUID();
        when(listingCatalog.findListing(listingId))
                .thenReturn(Optional.of(new ListingInfo(listingId, bob, bobWallet.getId(), true)));
        escrowService.createOrder(alice, aliceWallet.getId(), listingId, usd("25.00")).orElseThrow();

        ReconciliationResponse after = reconciliationService.reconcile();

        assertThat(after.balanced()).isTrue();
        assertThat(after.externalInflow().subtract(before.externalInflow())).isEqualByComparingTo("1200.00");
        assertThat(after.externalOutflow().subtract(before.externalOutflow())).isEqualByComparingTo("70.00");
        assertThat(after.totalBalances().subtract(before.totalBalances())).isEqualByComparingTo("1130.00");
        assertThat(after.escrowHeld().subtract(before.escrowHeld())).isEqualByComparingTo("25.00");
        assertThat(after.loanOutstanding().subtract(before.loanOutstanding())).isEqualByComparingTo("40.00");
        assertThat(after.entrySum()).isEqualByComparingTo(after.totalBalances());
    }
}
