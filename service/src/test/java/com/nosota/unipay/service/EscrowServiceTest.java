package com.nosota.unipay.service;

import com.nosota.unipay.TestBase;
import com.nosota.unipay.api.model.AccountStatus;
import com.nosota.unipay.api.model.EscrowStatus;
import com.nosota.unipay.api.model.LedgerErrorCode;
import com.nosota.unipay.ledger.LedgerResult;
import com.nosota.unipay.marketplace.ListingInfo;
import com.nosota.unipay.model.Account;
import com.nosota.unipay.model.EscrowOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@DisplayName("3. Escrow")
class EscrowServiceTest extends TestBase {

    private record Parties(Long buyerOwner, Account buyerWallet, Long sellerOwner, Account sellerWallet, String listingId) {
    }

    private Parties parties(String buyerFunds) {
        Long buyerOwner = newOwner();
        Long sellerOwner = newOwner();
        Account buyerWallet = fundedWallet(buyerOwner, buyerFunds);
        Account sellerWallet = openWallet(sellerOwner);
        String listingId = "listing-" + UUID.randomUUID();
        when(listingCatalog.findListing(listingId))
                .thenReturn(Optional.of(new ListingInfo(listingId, sellerOwner, sellerWallet.getId(), true)));
        return new Parties(buyerOwner, buyerWallet, sellerOwner, sellerWallet, listingId);
    }

    private EscrowOrder heldOrder(Parties parties, String amount) {
        return escrowService.createOrder(parties.buyerOwner(), parties.buyerWallet().getId(),
                parties.listingId(), usd(amount)).orElseThrow();
    }

    @Test
    @DisplayName("Creating an order moves the amount into a dedicated escrow account and holds it")
    void createOrderHoldsFunds() {
        Parties parties = parties("100.00");

        EscrowOrder order = heldOrder(parties, "80.00");

        assertThat(order.getStatus()).isEqualTo(EscrowStatus.HELD);
        assertThat(order.getEscrowAccountId()).isNotNull();
        assertThat(balanceOf(parties.buyerWallet().getId())).isEqualByComparingTo("20.00");
        Account escrow = accountService.getAccount(order.getEscrowAccountId());
        assertThat(escrow.getBalance()).isEqualByComparingTo("80.00");
        assertThat(escrow.getOwnerId()).isNull();
        assertThat(ledgerEntryRepository.countByOperationId("escrow-hold:" + order.getId())).isEqualTo(2);
    }

    @Test
    @DisplayName("Seller release pays the seller and closes the escrow account")
    void releaseBySeller() {
        Parties parties = parties("100.00");
        EscrowOrder order = heldOrder(parties, "80.00");

        LedgerResult<EscrowOrder> released = escrowService.release(order.getId(), parties.sellerOwner());

        assertThat(released.isSuccess()).isTrue();
        assertThat(released.getValue().getStatus()).isEqualTo(EscrowStatus.RELEASED);
        assertThat(released.getValue().getResolvedAt()).isNotNull();
        assertThat(balanceOf(parties.sellerWallet().getId())).isEqualByComparingTo("80.00");
        Account escrow = accountService.getAccount(order.getEscrowAccountId());
        assertThat(escrow.getBalance()).isEqualByComparingTo("0");
        assertThat(escrow.getStatus()).isEqualTo(AccountStatus.CLOSED);
    }

    @Test
    @DisplayName("A resolved order cannot be resolved again")
    void secondResolutionRejected() {
        Parties parties = parties("100.00");
        EscrowOrder order = heldOrder(parties, "50.00");
        escrowService.refundByDispute(order.getId()).orElseThrow();

        LedgerResult<EscrowOrder> release = escrowService.releaseByFulfillment(order.getId());

        assertThat(release.hasCode(LedgerErrorCode.INVALID_STATE_TRANSITION)).isTrue();
        assertThat(balanceOf(parties.buyerWallet().getId())).isEqualByComparingTo("100.00");
        assertThat(balanceOf(parties.sellerWallet().getId())).isEqualByComparingTo("0");
        assertThat(escrowService.getOrder(order.getId()).getStatus()).isEqualTo(EscrowStatus.REFUNDED);
    }

    @Test
    @DisplayName("Only the seller may release or refund")
    void onlySellerResolves() {
        Parties parties = parties("100.00");
        EscrowOrder order = heldOrder(parties, "50.00");

        assertThat(escrowService.release(order.getId(), parties.buyerOwner())
                .hasCode(LedgerErrorCode.UNAUTHORIZED)).isTrue();
        assertThat(escrowService.refund(order.getId(), newOwner())
                .hasCode(LedgerErrorCode.UNAUTHORIZED)).isTrue();
        assertThat(escrowService.getOrder(order.getId()).getStatus()).isEqualTo(EscrowStatus.HELD);
    }

    @Test
    @DisplayName("Unavailable listing, foreign wallet and insufficient funds create no order")
    void createOrderRejections() {
        Parties parties = parties("30.00");
        when(listingCatalog.findListing("gone")).thenReturn(Optional.empty());

        assertThat(escrowService.createOrder(parties.buyerOwner(), parties.buyerWallet().getId(), "gone", usd("10"))
                .hasCode(LedgerErrorCode.LISTING_UNAVAILABLE)).isTrue();
        assertThat(escrowService.createOrder(newOwner(), parties.buyerWallet().getId(), parties.listingId(), usd("10"))
                .hasCode(LedgerErrorCode.UNAUTHORIZED)).isTrue();

        LedgerResult<EscrowOrder> tooMuch = escrowService.createOrder(parties.buyerOwner(),
                parties.buyerWallet().getId(), parties.listingId(), usd("50"));
        assertThat(tooMuch.hasCode(LedgerErrorCode.INSUFFICIENT_FUNDS)).isTrue();
        assertThat(tooMuch.getFailure().shortfall()).isEqualByComparingTo("20");

        assertThat(escrowService.getOrdersOfBuyer(parties.buyerOwner())).isEmpty();
        assertThat(balanceOf(parties.buyerWallet().getId())).isEqualByComparingTo("30.00");
    }

    @Test
    @DisplayName("Concurrent release and dispute refund: exactly one resolves the order")
    void exactlyOnceResolution() throws Exception {
        Parties parties = parties("100.00");
        EscrowOrder order = heldOrder(parties, "60.00");

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<LedgerResult<EscrowOrder>> release = executor.submit(() -> {
                start.await();
                return escrowService.release(order.getId(), parties.sellerOwner());
            });
            Future<LedgerResult<EscrowOrder>> refund = executor.submit(() -> {
                start.await();
                return escrowService.refundByDispute(order.getId());
            });
            start.countDown();

            List<LedgerResult<EscrowOrder>> results = List.of(
                    release.get(30, TimeUnit.SECONDS), refund.get(30, TimeUnit.SECONDS));

            assertThat(results).filteredOn(LedgerResult::isSuccess).hasSize(1);
            assertThat(results).filteredOn(r -> r.hasCode(LedgerErrorCode.INVALID_STATE_TRANSITION)).hasSize(1);
        } finally {
            executor.shutdownNow();
        }

        EscrowOrder resolved = escrowService.getOrder(order.getId());
        assertThat(resolved.getStatus()).isIn(EscrowStatus.RELEASED, EscrowStatus.REFUNDED);
        assertThat(balanceOf(parties.buyerWallet().getId()).add(balanceOf(parties.sellerWallet().getId())))
                .isEqualByComparingTo("100.00");
        assertThat(balanceOf(order.getEscrowAccountId())).isEqualByComparingTo("0");
    }
}
