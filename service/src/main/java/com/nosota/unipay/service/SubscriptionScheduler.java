package com.nosota.unipay.service;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.LedgerErrorCode;
import com.nosota.unipay.api.model.LedgerReason;
import com.nosota.unipay.api.model.ObligationStatus;
import com.nosota.unipay.api.response.ExecutionReportResponse;
import com.nosota.unipay.api.response.SyncResponse;
import com.nosota.unipay.config.SchedulerProperties;
import com.nosota.unipay.ledger.LedgerFailure;
import com.nosota.unipay.ledger.LedgerResult;
import com.nosota.unipay.ledger.LockedAccounts;
import com.nosota.unipay.ledger.Move;
import com.nosota.unipay.ledger.TransferEngine;
import com.nosota.unipay.ledger.TransferHook;
import com.nosota.unipay.ledger.TransferReceipt;
import com.nosota.unipay.ledger.TransferRetryExecutor;
import com.nosota.unipay.model.Account;
import com.nosota.unipay.model.ScheduledObligation;
import com.nosota.unipay.model.Subscription;
import com.nosota.unipay.notification.LedgerEventPublisher;
import com.nosota.unipay.notification.LedgerEventType;
import com.nosota.unipay.repository.LedgerStore;
import com.nosota.unipay.repository.ScheduledObligationRepository;
import com.nosota.unipay.repository.SubscriptionRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Materializes upcoming subscription payments and charges them when due.
 *
 * <p>Scheduling is idempotent: at most one obligation exists per (subscription, due date), backed
 * by a unique constraint, so {@link #ensureNextPayment} and {@link #syncAll} may run any number
 * of times, from the cron job or on demand.
 *
 * <p>Charging goes through the transfer engine. The obligation flips SCHEDULED → SETTLED and the
 * subscription's billing anchor advances in the same transaction as the charge, while the paying
 * account is locked. The next cycle is then scheduled, forming a self-sustaining chain.
 */
@Service
@Validated
@Slf4j
public class SubscriptionScheduler {

    static final String CHARGE_PREFIX = "subscription-charge:";

    private final SubscriptionRepository subscriptionRepository;
    private final ScheduledObligationRepository obligationRepository;
    private final LedgerStore ledgerStore;
    private final TransferEngine transferEngine;
    private final TransferRetryExecutor retryExecutor;
    private final BudgetCardService budgetCardService;
    private final LedgerEventPublisher eventPublisher;
    private final SchedulerProperties schedulerProperties;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate newTransactionTemplate;
    private final Clock clock;

    public SubscriptionScheduler(SubscriptionRepository subscriptionRepository,
                                 ScheduledObligationRepository obligationRepository,
                                 LedgerStore ledgerStore,
                                 TransferEngine transferEngine,
                                 TransferRetryExecutor retryExecutor,
                                 BudgetCardService budgetCardService,
                                 LedgerEventPublisher eventPublisher,
                                 SchedulerProperties schedulerProperties,
                                 PlatformTransactionManager transactionManager,
                                 Clock clock) {
        this.subscriptionRepository = subscriptionRepository;
        this.obligationRepository = obligationRepository;
        this.ledgerStore = ledgerStore;
        this.transferEngine = transferEngine;
        this.retryExecutor = retryExecutor;
        this.budgetCardService = budgetCardService;
        this.eventPublisher = eventPublisher;
        this.schedulerProperties = schedulerProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.newTransactionTemplate = new TransactionTemplate(transactionManager);
        this.newTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public Optional<ScheduledObligation> ensureNextPayment(@NotNull Long subscriptionId) {
        Subscription subscription = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new EntityNotFoundException("Subscription not found: " + subscriptionId));
        return ensureNextPayment(subscription);
    }

    /**
     * Makes sure the subscription's next payment exists as an obligation if it falls inside the horizon.
     *
     * @return the obligation for the next billing date (created now or earlier), empty when nothing
     *         is to be scheduled: inactive, not auto-renewing, no next date or beyond the horizon
     */
    public Optional<ScheduledObligation> ensureNextPayment(@NotNull Subscription subscription) {
        return ensure(subscription, LocalDate.now(clock).plusDays(schedulerProperties.getHorizonDays())).obligation();
    }

    /**
     * Runs {@link #ensureNextPayment} for every active auto-renewing subscription.
     * Only ever adds missing obligations.
     */
    public SyncResponse syncAll() {
        LocalDate horizonEnd = LocalDate.now(clock).plusDays(schedulerProperties.getHorizonDays());
        List<Subscription> subscriptions = subscriptionRepository.findByActiveTrueAndAutoRenewTrueOrderByIdAsc();

        int synced = 0;
        int skipped = 0;
        int created = 0;
        for (Subscription subscription : subscriptions) {
            Ensured ensured = ensure(subscription, horizonEnd);
            if (ensured.obligation().isPresent()) {
                synced++;
                if (ensured.created()) {
                    created++;
                }
            } else {
                skipped++;
            }
        }
        log.info("Subscription sync finished: totalActive={}, synced={}, created={}, skipped={}",
                subscriptions.size(), synced, created, skipped);
        return new SyncResponse(synced, skipped, created, subscriptions.size());
    }

    /**
     * Charges every SCHEDULED obligation due on or before {@code date}.
     * <p>
     * A rejected charge marks the obligation FAILED and notifies the owner. Budget-card charges count
     * against the card's monthly limit. Failed obligations are not retried automatically. A lock
     * timeout leaves the obligation SCHEDULED for the next run.
     * </p>
     */
    public ExecutionReportResponse executeDue(@NotNull LocalDate date) {
        List<ScheduledObligation> due = obligationRepository.findDue(date);
        int settled = 0;
        int failed = 0;
        int deferred = 0;

        for (ScheduledObligation obligation : due) {
            LedgerResult<TransferReceipt> result = charge(obligation);
            if (result.isSuccess()) {
                if (!result.isDuplicate()) {
                    settled++;
                }
                processCompletion(obligation.getId());
            } else if (result.hasCode(LedgerErrorCode.LOCK_TIMEOUT)) {
                deferred++;
                log.warn("Obligation deferred after lock timeouts: obligationId={}", obligation.getId());
            } else if (result.hasCode(LedgerErrorCode.INVALID_STATE_TRANSITION)) {
                log.info("Obligation no longer scheduled: obligationId={}", obligation.getId());
            } else {
                if (markFailed(obligation, result.getFailure())) {
                    failed++;
                }
            }
        }

        log.info("Executed due obligations: date={}, due={}, settled={}, failed={}, deferred={}",
                date, due.size(), settled, failed, deferred);
        return new ExecutionReportResponse(settled, failed, deferred);
    }

    /**
     * Advances the billing anchor past a settled obligation and schedules the following payment.
     * Safe to call again for the same obligation.
     */
    public Optional<ScheduledObligation> processCompletion(@NotNull Long obligationId) {
        Subscription subscription = transactionTemplate.execute(status -> {
            ScheduledObligation obligation = obligationRepository.findById(obligationId)
                    .orElseThrow(() -> new EntityNotFoundException("Obligation not found: " + obligationId));
            if (obligation.getStatus() != ObligationStatus.SETTLED) {
                throw new IllegalStateException("Obligation " + obligationId + " is " + obligation.getStatus()
                        + ", only SETTLED obligations complete a billing cycle");
            }
            Subscription current = subscriptionRepository.findById(obligation.getSubscriptionId())
                    .orElseThrow(() -> new EntityNotFoundException(
                            "Subscription not found: " + obligation.getSubscriptionId()));
            advanceBillingAnchor(current, obligation);
            return current;
        });
        return ensureNextPayment(subscription);
    }

    private LedgerResult<TransferReceipt> charge(ScheduledObligation obligation) {
        String operationId = CHARGE_PREFIX + obligation.getId();
        Long obligationId = obligation.getId();

        TransferHook settle = new TransferHook() {
            @Override
            public Optional<LedgerFailure> beforeApply(LockedAccounts accounts) {
                ScheduledObligation current = reloadObligation(obligationId);
                if (current.getStatus() != ObligationStatus.SCHEDULED) {
                    return Optional.of(LedgerFailure.invalidState(
                            "Obligation " + obligationId + " is " + current.getStatus()));
                }
                Account payer = accounts.get(current.getAccountId());
                if (payer.getKind() == AccountKind.BUDGET_CARD) {
                    return budgetCardService.authorizeLocked(payer, current.getAmount());
                }
                return Optional.empty();
            }

            @Override
            public void afterApply(String appliedOperationId, LockedAccounts accounts) {
                ScheduledObligation current = reloadObligation(obligationId);
                current.setStatus(ObligationStatus.SETTLED);
                current.setOperationId(appliedOperationId);
                current.setSettledAt(LocalDateTime.now(clock));
                current.setFailureReason(null);
                ledgerStore.reload(Subscription.class, current.getSubscriptionId())
                        .ifPresent(subscription -> advanceBillingAnchor(subscription, current));
            }
        };

        LedgerResult<TransferReceipt> result = retryExecutor.execute(operationId, () -> transferEngine.applyTransfer(
                List.of(Move.debit(obligation.getAccountId(), obligation.getAmount())),
                LedgerReason.SUBSCRIPTION_CHARGE, operationId, "Subscription " + obligation.getSubscriptionId(),
                settle));

        if (result.isSuccess() && !result.isDuplicate()) {
            log.info("Obligation settled: obligationId={}, subscriptionId={}, amount={}",
                    obligationId, obligation.getSubscriptionId(), obligation.getAmount());
            subscriptionRepository.findById(obligation.getSubscriptionId()).ifPresent(subscription ->
                    eventPublisher.publish(LedgerEventType.SUBSCRIPTION_CHARGED, subscription.getOwnerId(),
                            obligation.getAccountId(), obligationId.toString(), obligation.getAmount(),
                            subscription.getServiceName() + " charged " + obligation.getAmount().toPlainString()));
        }
        return result;
    }

    private boolean markFailed(ScheduledObligation obligation, LedgerFailure failure) {
        Long obligationId = obligation.getId();
        int changed;
        try {
            changed = transactionTemplate.execute(status -> {
                // obligation changes are serialized on the paying account
                ledgerStore.lockAccount(obligation.getAccountId());
                return obligationRepository.transition(obligationId, ObligationStatus.SCHEDULED,
                        ObligationStatus.FAILED, truncate(failure.code() + ": " + failure.message()));
            });
        } catch (PessimisticLockingFailureException e) {
            log.warn("Could not mark obligation failed, lock wait exceeded: obligationId={}", obligationId);
            return false;
        }
        if (changed == 0) {
            return false;
        }

        log.warn("Obligation failed: obligationId={}, subscriptionId={}, code={}, message={}",
                obligationId, obligation.getSubscriptionId(), failure.code(), failure.message());
        subscriptionRepository.findById(obligation.getSubscriptionId()).ifPresent(subscription ->
                eventPublisher.publish(LedgerEventType.SUBSCRIPTION_PAYMENT_FAILED, subscription.getOwnerId(),
                        obligation.getAccountId(), obligationId.toString(), obligation.getAmount(),
                        subscription.getServiceName() + " payment failed: " + failure.message()));
        return true;
    }

    private Ensured ensure(Subscription subscription, LocalDate horizonEnd) {
        LocalDate dueDate = subscription.getNextBillingDate();
        if (!subscription.isActive() || !subscription.isAutoRenew() || dueDate == null) {
            log.debug("Nothing to schedule: subscriptionId={}, active={}, autoRenew={}, nextBillingDate={}",
                    subscription.getId(), subscription.isActive(), subscription.isAutoRenew(), dueDate);
            return Ensured.none();
        }
        if (dueDate.isAfter(horizonEnd)) {
            log.debug("Next payment beyond horizon: subscriptionId={}, dueDate={}, horizonEnd={}",
                    subscription.getId(), dueDate, horizonEnd);
            return Ensured.none();
        }

        Optional<ScheduledObligation> existing =
                obligationRepository.findBySubscriptionIdAndDueDate(subscription.getId(), dueDate);
        if (existing.isPresent()) {
            return new Ensured(existing, false);
        }

        ScheduledObligation obligation = new ScheduledObligation();
        obligation.setSubscriptionId(subscription.getId());
        obligation.setAccountId(subscription.getAccountId());
        obligation.setAmount(subscription.getAmount());
        obligation.setDueDate(dueDate);
        obligation.setStatus(ObligationStatus.SCHEDULED);
        obligation.setCreatedAt(LocalDateTime.now(clock));
        try {
            ScheduledObligation saved = newTransactionTemplate.execute(status -> obligationRepository.saveAndFlush(obligation));
            log.info("Scheduled payment: subscriptionId={}, dueDate={}, amount={}, obligationId={}",
                    subscription.getId(), dueDate, subscription.getAmount(), saved.getId());
            return new Ensured(Optional.of(saved), true);
        } catch (DataIntegrityViolationException e) {
            log.info("Payment scheduled concurrently: subscriptionId={}, dueDate={}", subscription.getId(), dueDate);
            return new Ensured(obligationRepository.findBySubscriptionIdAndDueDate(subscription.getId(), dueDate), false);
        }
    }

    private void advanceBillingAnchor(Subscription subscription, ScheduledObligation settledObligation) {
        LocalDate dueDate = settledObligation.getDueDate();
        if (subscription.getLastPaymentDate() == null || subscription.getLastPaymentDate().isBefore(dueDate)) {
            subscription.setLastPaymentDate(dueDate);
        }
        LocalDate next = subscription.getBillingCycle().next(dueDate);
        if (subscription.getNextBillingDate() == null || subscription.getNextBillingDate().isBefore(next)) {
            subscription.setNextBillingDate(next);
            log.debug("Billing anchor advanced: subscriptionId={}, nextBillingDate={}", subscription.getId(), next);
        }
    }

    private ScheduledObligation reloadObligation(Long obligationId) {
        return ledgerStore.reload(ScheduledObligation.class, obligationId)
                .orElseThrow(() -> new EntityNotFoundException("Obligation not found: " + obligationId));
    }

    private static String truncate(String reason) {
        return reason.length() <= 255 ? reason : reason.substring(0, 255);
    }

    private record Ensured(Optional<ScheduledObligation> obligation, boolean created) {
        static Ensured none() {
            return new Ensured(Optional.empty(), false);
        }
    }
}
