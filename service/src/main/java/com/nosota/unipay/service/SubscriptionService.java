package com.nosota.unipay.service;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.AccountStatus;
import com.nosota.unipay.api.model.BillingCycle;
import com.nosota.unipay.api.model.ObligationStatus;
import com.nosota.unipay.ledger.LedgerFailure;
import com.nosota.unipay.ledger.LedgerResult;
import com.nosota.unipay.model.Account;
import com.nosota.unipay.model.ScheduledObligation;
import com.nosota.unipay.model.Subscription;
import com.nosota.unipay.repository.LedgerStore;
import com.nosota.unipay.repository.ScheduledObligationRepository;
import com.nosota.unipay.repository.SubscriptionRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Subscription lifecycle: creation, pause and resume, cancellation and manual retry of failed payments.
 * Payments themselves are scheduled and charged by {@link SubscriptionScheduler}.
 */
@Service
@Validated
@Slf4j
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final ScheduledObligationRepository obligationRepository;
    private final AccountService accountService;
    private final SubscriptionScheduler scheduler;
    private final LedgerStore ledgerStore;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public SubscriptionService(SubscriptionRepository subscriptionRepository,
                               ScheduledObligationRepository obligationRepository,
                               AccountService accountService,
                               SubscriptionScheduler scheduler,
                               LedgerStore ledgerStore,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
        this.subscriptionRepository = subscriptionRepository;
        this.obligationRepository = obligationRepository;
        this.accountService = accountService;
        this.scheduler = scheduler;
        this.ledgerStore = ledgerStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Creates a subscription paid from a wallet or budget card of the owner and schedules its
     * first payment if it falls inside the horizon.
     */
    public LedgerResult<Subscription> create(@NotNull Long ownerId, @NotNull Long accountId,
                                             @NotBlank String serviceName, String serviceCategory,
                                             @NotNull @Positive BigDecimal amount, BillingCycle billingCycle,
                                             @NotNull LocalDate firstBillingDate) {
        Optional<LedgerFailure> denied = accountService.requireOwned(accountId, ownerId);
        if (denied.isPresent()) {
            return LedgerResult.failure(denied.get());
        }
        Account account = accountService.getAccount(accountId);
        if (account.getKind() != AccountKind.WALLET && account.getKind() != AccountKind.BUDGET_CARD) {
            return LedgerResult.failure(LedgerFailure.invalidRequest(
                    "Subscriptions are paid from wallets or budget cards, account " + accountId + " is " + account.getKind()));
        }
        if (account.getStatus() != AccountStatus.ACTIVE) {
            return LedgerResult.failure(LedgerFailure.accountFrozen(accountId, account.getStatus()));
        }

        Subscription subscription = new Subscription();
        subscription.setAccountId(accountId);
        subscription.setOwnerId(ownerId);
        subscription.setServiceName(serviceName);
        subscription.setServiceCategory(serviceCategory);
        subscription.setAmount(amount);
        subscription.setCurrency(account.getCurrency());
        subscription.setBillingCycle(billingCycle != null ? billingCycle : BillingCycle.MONTHLY);
        subscription.setNextBillingDate(firstBillingDate);
        subscription.setCreatedAt(LocalDateTime.now(clock));
        Subscription saved = subscriptionRepository.save(subscription);
        log.info("Subscription created: subscriptionId={}, ownerId={}, accountId={}, service={}, amount={}, cycle={}",
                saved.getId(), ownerId, accountId, serviceName, amount, saved.getBillingCycle());

        scheduler.ensureNextPayment(saved);
        return LedgerResult.success(saved);
    }

    public Subscription getSubscription(@NotNull Long subscriptionId) {
        return subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new EntityNotFoundException("Subscription not found: " + subscriptionId));
    }

    public List<Subscription> getSubscriptionsOfOwner(@NotNull Long ownerId) {
        return subscriptionRepository.findByOwnerIdOrderByIdAsc(ownerId);
    }

    public List<ScheduledObligation> getObligations(@NotNull Long subscriptionId) {
        getSubscription(subscriptionId);
        return obligationRepository.findBySubscriptionIdOrderByDueDateAsc(subscriptionId);
    }

    /**
     * Cancels the subscription and every obligation not yet charged.
     * Runs under the paying account's lock, so it cannot interleave with a charge of the same account.
     */
    public LedgerResult<Subscription> cancel(@NotNull Long ownerId, @NotNull Long subscriptionId) {
        return changeUnderLock(ownerId, subscriptionId, "cancel-subscription:", current -> {
            if (!current.isActive()) {
                return Optional.of(LedgerFailure.invalidState(
                        "Subscription " + subscriptionId + " is already cancelled"));
            }
            current.setActive(false);
            current.setAutoRenew(false);
            current.setCancelledAt(LocalDateTime.now(clock));
            ledgerStore.flush();
            int cancelled = obligationRepository.cancelScheduled(subscriptionId);
            log.info("Subscription cancelled: subscriptionId={}, cancelledObligations={}", subscriptionId, cancelled);
            return Optional.empty();
        });
    }

    /**
     * Stops automatic renewal without cancelling. Payments still SCHEDULED are cancelled; the
     * subscription stays active and can be resumed.
     */
    public LedgerResult<Subscription> pause(@NotNull Long ownerId, @NotNull Long subscriptionId) {
        return changeUnderLock(ownerId, subscriptionId, "pause-subscription:", current -> {
            if (!current.isActive() || !current.isAutoRenew()) {
                return Optional.of(LedgerFailure.invalidState("Subscription " + subscriptionId + " is "
                        + (current.isActive() ? "already paused" : "cancelled")));
            }
            current.setAutoRenew(false);
            ledgerStore.flush();
            int cancelled = obligationRepository.cancelScheduled(subscriptionId);
            log.info("Subscription paused: subscriptionId={}, cancelledObligations={}", subscriptionId, cancelled);
            return Optional.empty();
        });
    }

    /**
     * Turns automatic renewal back on and schedules the next payment. Billing dates that passed
     * while paused are skipped, not charged.
     */
    public LedgerResult<Subscription> resume(@NotNull Long ownerId, @NotNull Long subscriptionId) {
        LedgerResult<Subscription> resumed = changeUnderLock(ownerId, subscriptionId, "resume-subscription:", current -> {
            if (!current.isActive() || current.isAutoRenew()) {
                return Optional.of(LedgerFailure.invalidState("Subscription " + subscriptionId + " is "
                        + (current.isActive() ? "not paused" : "cancelled")));
            }
            current.setAutoRenew(true);
            LocalDate today = LocalDate.now(clock);
            LocalDate next = current.getNextBillingDate();
            while (next != null && next.isBefore(today)) {
                next = current.getBillingCycle().next(next);
            }
            current.setNextBillingDate(next);
            ledgerStore.flush();
            // the payment cancelled by the pause is reinstated rather than duplicated
            if (next != null) {
                obligationRepository.findBySubscriptionIdAndDueDate(subscriptionId, next)
                        .filter(obligation -> obligation.getStatus() == ObligationStatus.CANCELLED)
                        .ifPresent(obligation -> obligationRepository.transition(obligation.getId(),
                                ObligationStatus.CANCELLED, ObligationStatus.SCHEDULED, null));
            }
            log.info("Subscription resumed: subscriptionId={}, nextBillingDate={}", subscriptionId, next);
            return Optional.empty();
        });
        if (resumed.isSuccess()) {
            scheduler.ensureNextPayment(subscriptionId);
        }
        return resumed;
    }

    /**
     * Puts a FAILED obligation back to SCHEDULED so the next execution run charges it again.
     */
    public LedgerResult<ScheduledObligation> retryObligation(@NotNull Long ownerId, @NotNull Long obligationId) {
        ScheduledObligation obligation = obligationRepository.findById(obligationId)
                .orElseThrow(() -> new EntityNotFoundException("Obligation not found: " + obligationId));
        Subscription subscription = getSubscription(obligation.getSubscriptionId());
        if (!ownerId.equals(subscription.getOwnerId())) {
            return LedgerResult.failure(LedgerFailure.unauthorized(
                    "Obligation " + obligationId + " does not belong to owner " + ownerId));
        }
        if (!subscription.isActive()) {
            return LedgerResult.failure(LedgerFailure.invalidState(
                    "Subscription " + subscription.getId() + " is cancelled"));
        }
        try {
            return transactionTemplate.execute(status -> {
                ledgerStore.lockAccount(obligation.getAccountId());
                int changed = obligationRepository.transition(obligationId, ObligationStatus.FAILED,
                        ObligationStatus.SCHEDULED, null);
                if (changed == 0) {
                    return LedgerResult.failure(LedgerFailure.invalidState(
                            "Only FAILED obligations can be retried, obligation " + obligationId + " is "
                                    + obligationRepository.findById(obligationId).map(o -> o.getStatus().name()).orElse("gone")));
                }
                log.info("Obligation rescheduled for retry: obligationId={}", obligationId);
                return LedgerResult.success(obligationRepository.findById(obligationId).orElseThrow());
            });
        } catch (PessimisticLockingFailureException e) {
            log.warn("Retry timed out waiting for account lock: obligationId={}", obligationId);
            return LedgerResult.failure(LedgerFailure.lockTimeout("retry-obligation:" + obligationId));
        }
    }

    private LedgerResult<Subscription> changeUnderLock(Long ownerId, Long subscriptionId, String lockName,
                                                      Function<Subscription, Optional<LedgerFailure>> change) {
        Subscription subscription = getSubscription(subscriptionId);
        if (!ownerId.equals(subscription.getOwnerId())) {
            return LedgerResult.failure(LedgerFailure.unauthorized(
                    "Subscription " + subscriptionId + " does not belong to owner " + ownerId));
        }
        try {
            return transactionTemplate.execute(status -> {
                // subscription changes are serialized on the paying account, like its charges
                ledgerStore.lockAccount(subscription.getAccountId());
                Subscription current = ledgerStore.reload(Subscription.class, subscriptionId)
                        .orElseThrow(() -> new EntityNotFoundException("Subscription not found: " + subscriptionId));
                Optional<LedgerFailure> rejected = change.apply(current);
                if (rejected.isPresent()) {
                    return LedgerResult.<Subscription>failure(rejected.get());
                }
                return LedgerResult.success(subscriptionRepository.findById(subscriptionId).orElseThrow());
            });
        } catch (PessimisticLockingFailureException e) {
            log.warn("Subscription change timed out waiting for account lock: subscriptionId={}", subscriptionId);
            return LedgerResult.failure(LedgerFailure.lockTimeout(lockName + subscriptionId));
        }
    }
}
