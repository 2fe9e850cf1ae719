package com.nosota.unipay.service;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.AccountStatus;
import com.nosota.unipay.api.model.EscrowStatus;
import com.nosota.unipay.api.model.LedgerErrorCode;
import com.nosota.unipay.api.model.LedgerReason;
import com.nosota.unipay.ledger.LedgerFailure;
import com.nosota.unipay.ledger.LedgerResult;
import com.nosota.unipay.ledger.LockedAccounts;
import com.nosota.unipay.ledger.Move;
import com.nosota.unipay.ledger.TransferEngine;
import com.nosota.unipay.ledger.TransferHook;
import com.nosota.unipay.ledger.TransferReceipt;
import com.nosota.unipay.ledger.TransferRetryExecutor;
import com.nosota.unipay.marketplace.ListingCatalog;
import com.nosota.unipay.marketplace.ListingInfo;
import com.nosota.unipay.model.Account;
import com.nosota.unipay.model.EscrowOrder;
import com.nosota.unipay.notification.LedgerEventPublisher;
import com.nosota.unipay.notification.LedgerEventType;
import com.nosota.unipay.repository.AccountRepository;
import com.nosota.unipay.repository.EscrowOrderRepository;
import com.nosota.unipay.repository.LedgerStore;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Marketplace escrow on top of the transfer engine.
 *
 * <p>Every order gets its own ESCROW account. The order status only changes inside the transfer
 * that moves the escrow money, after the escrow account row is locked:
 * <ul>
 *   <li>createOrder: buyer → escrow, PENDING → HELD</li>
 *   <li>release: escrow → seller, HELD → RELEASED</li>
 *   <li>refund: escrow → buyer, HELD → REFUNDED</li>
 * </ul>
 * A release racing a refund therefore serializes on the escrow account; the loser re-reads the
 * order under the lock, finds it terminal and gets INVALID_STATE_TRANSITION.
 */
@Service
@Validated
@Slf4j
public class EscrowService {

    static final String HOLD_PREFIX = "escrow-hold:";
    static final String RELEASE_PREFIX = "escrow-release:";
    static final String REFUND_PREFIX = "escrow-refund:";

    private final EscrowOrderRepository orderRepository;
    private final AccountRepository accountRepository;
    private final AccountService accountService;
    private final LedgerStore ledgerStore;
    private final TransferEngine transferEngine;
    private final TransferRetryExecutor retryExecutor;
    private final EscrowStateMachine stateMachine;
    private final ListingCatalog listingCatalog;
    private final LedgerEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public EscrowService(EscrowOrderRepository orderRepository,
                         AccountRepository accountRepository,
                         AccountService accountService,
                         LedgerStore ledgerStore,
                         TransferEngine transferEngine,
                         TransferRetryExecutor retryExecutor,
                         EscrowStateMachine stateMachine,
                         ListingCatalog listingCatalog,
                         LedgerEventPublisher eventPublisher,
                         PlatformTransactionManager transactionManager,
                         Clock clock) {
        this.orderRepository = orderRepository;
        this.accountRepository = accountRepository;
        this.accountService = accountService;
        this.ledgerStore = ledgerStore;
        this.transferEngine = transferEngine;
        this.retryExecutor = retryExecutor;
        this.stateMachine = stateMachine;
        this.listingCatalog = listingCatalog;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Commits the buyer to a listing and holds {@code amount} in a new escrow account.
     * <p>
     * Order, escrow account, the hold transfer and PENDING → HELD commit together or not at all.
     * </p>
     *
     * @return the HELD order, or LISTING_UNAVAILABLE, UNAUTHORIZED, INSUFFICIENT_FUNDS, ...
     */
    public LedgerResult<EscrowOrder> createOrder(@NotNull Long buyerOwnerId, @NotNull Long buyerAccountId,
                                                 @NotNull String listingId, @NotNull @Positive BigDecimal amount) {
        Optional<ListingInfo> listing = listingCatalog.findListing(listingId);
        if (listing.isEmpty() || !listing.get().available()) {
            log.warn("Listing unavailable: listingId={}, buyerOwnerId={}", listingId, buyerOwnerId);
            return LedgerResult.failure(LedgerFailure.of(LedgerErrorCode.LISTING_UNAVAILABLE,
                    "Listing " + listingId + " is not available"));
        }
        ListingInfo seller = listing.get();

        Optional<LedgerFailure> denied = accountService.requireOwned(buyerAccountId, buyerOwnerId);
        if (denied.isPresent()) {
            return LedgerResult.failure(denied.get());
        }
        Account buyerAccount = accountService.getAccount(buyerAccountId);
        if (buyerAccount.getKind() != AccountKind.WALLET) {
            return LedgerResult.failure(LedgerFailure.invalidRequest("Orders are paid from wallets only"));
        }
        if (buyerOwnerId.equals(seller.sellerOwnerId())) {
            return LedgerResult.failure(LedgerFailure.invalidRequest("Cannot buy your own listing " + listingId));
        }
        if (seller.sellerAccountId() == null || !accountRepository.existsById(seller.sellerAccountId())) {
            return LedgerResult.failure(LedgerFailure.accountNotFound(seller.sellerAccountId()));
        }
        if (buyerAccount.getBalance().compareTo(amount) < 0) {
            return LedgerResult.failure(LedgerFailure.insufficientFunds(buyerAccountId, amount, buyerAccount.getBalance()));
        }

        LedgerResult<EscrowOrder> result = retryExecutor.execute(HOLD_PREFIX + listingId,
                () -> holdInNewOrder(buyerOwnerId, buyerAccount, seller, amount));

        if (result.isSuccess()) {
            EscrowOrder order = result.getValue();
            log.info("Escrow order created: orderId={}, listingId={}, amount={}", order.getId(), listingId, amount);
            eventPublisher.publish(LedgerEventType.ESCROW_HELD, buyerOwnerId, buyerAccountId,
                    order.getId().toString(), amount, "Payment held in escrow for listing " + listingId);
            eventPublisher.publish(LedgerEventType.ESCROW_HELD, seller.sellerOwnerId(), seller.sellerAccountId(),
                    order.getId().toString(), amount, "Buyer paid into escrow for listing " + listingId);
        }
        return result;
    }

    /**
     * Seller releases the escrow to their wallet.
     */
    public LedgerResult<EscrowOrder> release(@NotNull UUID orderId, @NotNull Long callerOwnerId) {
        EscrowOrder order = getOrder(orderId);
        if (!callerOwnerId.equals(order.getSellerOwnerId())) {
            log.warn("Release denied: orderId={}, callerOwnerId={}", orderId, callerOwnerId);
            return LedgerResult.failure(LedgerFailure.unauthorized("Only the seller can release order " + orderId));
        }
        return resolve(order, EscrowStatus.RELEASED, "Released by seller");
    }

    /**
     * Release triggered by an authorized fulfillment event (delivery confirmed).
     */
    public LedgerResult<EscrowOrder> releaseByFulfillment(@NotNull UUID orderId) {
        return resolve(getOrder(orderId), EscrowStatus.RELEASED, "Released on fulfillment");
    }

    /**
     * Seller refunds the buyer voluntarily.
     */
    public LedgerResult<EscrowOrder> refund(@NotNull UUID orderId, @NotNull Long callerOwnerId) {
        EscrowOrder order = getOrder(orderId);
        if (!callerOwnerId.equals(order.getSellerOwnerId())) {
            log.warn("Refund denied: orderId={}, callerOwnerId={}", orderId, callerOwnerId);
            return LedgerResult.failure(LedgerFailure.unauthorized("Only the seller can refund order " + orderId));
        }
        return resolve(order, EscrowStatus.REFUNDED, "Refunded by seller");
    }

    /**
     * Refund decided by dispute resolution in favour of the buyer.
     */
    public LedgerResult<EscrowOrder> refundByDispute(@NotNull UUID orderId) {
        return resolve(getOrder(orderId), EscrowStatus.REFUNDED, "Refunded by dispute resolution");
    }

    /**
     * @throws EntityNotFoundException if no such order exists
     */
    public EscrowOrder getOrder(@NotNull UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new EntityNotFoundException("Escrow order not found: " + orderId));
    }

    public List<EscrowOrder> getOrdersOfBuyer(@NotNull Long buyerOwnerId) {
        return orderRepository.findByBuyerOwnerIdOrderByCreatedAtDesc(buyerOwnerId);
    }

    private LedgerResult<EscrowOrder> holdInNewOrder(Long buyerOwnerId, Account buyerAccount,
                                                     ListingInfo listing, BigDecimal amount) {
        return transactionTemplate.execute(status -> {
            EscrowOrder order = new EscrowOrder();
            order.setListingId(listing.listingId());
            order.setBuyerOwnerId(buyerOwnerId);
            order.setBuyerAccountId(buyerAccount.getId());
            order.setSellerOwnerId(listing.sellerOwnerId());
            order.setSellerAccountId(listing.sellerAccountId());
            order.setAmount(amount);
            order.setStatus(EscrowStatus.PENDING);
            order.setCreatedAt(LocalDateTime.now(clock));
            order = orderRepository.saveAndFlush(order);

            Account escrow = accountService.newAccount(AccountKind.ESCROW, null, buyerAccount.getCurrency(),
                    "Escrow for order " + order.getId());
            escrow = accountRepository.save(escrow);
            order.setEscrowAccountId(escrow.getId());
            orderRepository.saveAndFlush(order);

            UUID orderId = order.getId();
            LedgerResult<TransferReceipt> hold = transferEngine.applyTransfer(
                    List.of(Move.debit(buyerAccount.getId(), amount), Move.credit(escrow.getId(), amount)),
                    LedgerReason.ESCROW_HOLD, HOLD_PREFIX + orderId, "Listing " + listing.listingId(),
                    new StatusTransitionHook(orderId, EscrowStatus.PENDING, EscrowStatus.HELD, null, false));

            if (hold.isFailure()) {
                status.setRollbackOnly();
                return LedgerResult.failure(hold.getFailure());
            }
            return LedgerResult.success(reload(orderId));
        });
    }

    private LedgerResult<EscrowOrder> resolve(EscrowOrder order, EscrowStatus target, String note) {
        UUID orderId = order.getId();
        boolean release = target == EscrowStatus.RELEASED;
        Long counterpartyAccountId = release ? order.getSellerAccountId() : order.getBuyerAccountId();
        String operationId = (release ? RELEASE_PREFIX : REFUND_PREFIX) + orderId;

        LedgerResult<TransferReceipt> result = retryExecutor.execute(operationId, () -> transferEngine.applyTransfer(
                List.of(Move.debit(order.getEscrowAccountId(), order.getAmount()),
                        Move.credit(counterpartyAccountId, order.getAmount())),
                release ? LedgerReason.ESCROW_RELEASE : LedgerReason.ESCROW_REFUND,
                operationId, note,
                new StatusTransitionHook(orderId, EscrowStatus.HELD, target, note, true)));

        if (result.isFailure()) {
            return LedgerResult.failure(result.getFailure());
        }

        EscrowOrder resolved = getOrder(orderId);
        if (!result.isDuplicate()) {
            log.info("Escrow order resolved: orderId={}, status={}, note={}", orderId, target, note);
            LedgerEventType type = release ? LedgerEventType.ESCROW_RELEASED : LedgerEventType.ESCROW_REFUNDED;
            eventPublisher.publish(type, resolved.getBuyerOwnerId(), resolved.getBuyerAccountId(),
                    orderId.toString(), resolved.getAmount(), note);
            eventPublisher.publish(type, resolved.getSellerOwnerId(), resolved.getSellerAccountId(),
                    orderId.toString(), resolved.getAmount(), note);
            return LedgerResult.success(resolved);
        }
        return LedgerResult.duplicate(resolved);
    }

    private EscrowOrder reload(UUID orderId) {
        return ledgerStore.reload(EscrowOrder.class, orderId)
                .orElseThrow(() -> new EntityNotFoundException("Escrow order not found: " + orderId));
    }

    /**
     * Re-reads the order once the escrow account is locked and moves it from {@code expected}
     * to {@code target} in the transfer's transaction.
     */
    private class StatusTransitionHook implements TransferHook {

        private final UUID orderId;
        private final EscrowStatus expected;
        private final EscrowStatus target;
        private final String note;
        private final boolean closeEscrowAccount;

        StatusTransitionHook(UUID orderId, EscrowStatus expected, EscrowStatus target,
                             String note, boolean closeEscrowAccount) {
            this.orderId = orderId;
            this.expected = expected;
            this.target = target;
            this.note = note;
            this.closeEscrowAccount = closeEscrowAccount;
        }

        @Override
        public Optional<LedgerFailure> beforeApply(LockedAccounts accounts) {
            EscrowOrder order = reload(orderId);
            if (order.getStatus() != expected || !stateMachine.isTransitionAllowed(order.getStatus(), target)) {
                return Optional.of(LedgerFailure.invalidState(
                        "Order " + orderId + " is " + order.getStatus() + ": "
                                + stateMachine.describe(order.getStatus(), target)));
            }
            return Optional.empty();
        }

        @Override
        public void afterApply(String operationId, LockedAccounts accounts) {
            EscrowOrder order = reload(orderId);
            stateMachine.validateTransition(order.getStatus(), target);
            order.setStatus(target);
            if (target.isTerminal()) {
                order.setResolvedAt(LocalDateTime.now(clock));
                order.setResolutionNote(note);
            }
            if (closeEscrowAccount) {
                Account escrow = accounts.get(order.getEscrowAccountId());
                if (escrow.getBalance().signum() == 0) {
                    escrow.setStatus(AccountStatus.CLOSED);
                    escrow.setVersion(escrow.getVersion() + 1);
                }
            }
        }
    }
}
