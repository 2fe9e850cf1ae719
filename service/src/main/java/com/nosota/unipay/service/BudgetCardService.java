package com.nosota.unipay.service;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.AccountStatus;
import com.nosota.unipay.api.model.LedgerErrorCode;
import com.nosota.unipay.api.model.LedgerReason;
import com.nosota.unipay.api.model.SpendConstraint;
import com.nosota.unipay.api.response.CardSummaryResponse;
import com.nosota.unipay.ledger.LedgerFailure;
import com.nosota.unipay.ledger.LedgerResult;
import com.nosota.unipay.ledger.LockedAccounts;
import com.nosota.unipay.ledger.Move;
import com.nosota.unipay.ledger.TransferEngine;
import com.nosota.unipay.ledger.TransferHook;
import com.nosota.unipay.ledger.TransferReceipt;
import com.nosota.unipay.ledger.TransferRetryExecutor;
import com.nosota.unipay.model.Account;
import com.nosota.unipay.notification.LedgerEventPublisher;
import com.nosota.unipay.notification.LedgerEventType;
import com.nosota.unipay.repository.AccountRepository;
import com.nosota.unipay.repository.LedgerEntryRepository;
import com.nosota.unipay.repository.LedgerStore;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

/**
 * Budget cards: sub-accounts of a wallet that pay for purchases, optionally capped per calendar month.
 *
 * <p>The amount spent this month is never stored. It is summed from this month's BUDGET_SPEND
 * entries of the card, which are only written while the card row is locked, so the sum taken
 * under that lock is exact.
 */
@Service
@Validated
@Slf4j
public class BudgetCardService {

    private static final List<LedgerReason> SPEND_REASONS =
            List.of(LedgerReason.BUDGET_SPEND, LedgerReason.SUBSCRIPTION_CHARGE);

    private final AccountRepository accountRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final LedgerStore ledgerStore;
    private final AccountService accountService;
    private final TransferEngine transferEngine;
    private final TransferRetryExecutor retryExecutor;
    private final LedgerEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public BudgetCardService(AccountRepository accountRepository,
                             LedgerEntryRepository ledgerEntryRepository,
                             LedgerStore ledgerStore,
                             AccountService accountService,
                             TransferEngine transferEngine,
                             TransferRetryExecutor retryExecutor,
                             LedgerEventPublisher eventPublisher,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.accountRepository = accountRepository;
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.ledgerStore = ledgerStore;
        this.accountService = accountService;
        this.transferEngine = transferEngine;
        this.retryExecutor = retryExecutor;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Creates an empty card funded from one of the owner's wallets.
     *
     * @param monthlyLimit optional monthly spending limit, null for none
     */
    public LedgerResult<Account> createCard(@NotNull Long ownerId, @NotNull Long walletId,
                                            @NotNull String name, BigDecimal monthlyLimit) {
        Optional<LedgerFailure> denied = accountService.requireOwned(walletId, ownerId);
        if (denied.isPresent()) {
            return LedgerResult.failure(denied.get());
        }
        Account wallet = accountService.getAccount(walletId);
        if (wallet.getKind() != AccountKind.WALLET) {
            return LedgerResult.failure(LedgerFailure.invalidRequest("Budget cards are funded from wallets only"));
        }
        if (wallet.getStatus() != AccountStatus.ACTIVE) {
            return LedgerResult.failure(LedgerFailure.accountFrozen(walletId, wallet.getStatus()));
        }
        if (monthlyLimit != null && monthlyLimit.signum() < 0) {
            return LedgerResult.failure(LedgerFailure.invalidRequest("Monthly limit must not be negative"));
        }

        Account card = accountService.newAccount(AccountKind.BUDGET_CARD, ownerId, wallet.getCurrency(), name);
        card.setParentAccountId(walletId);
        card.setMonthlyLimit(monthlyLimit);
        card = accountRepository.save(card);
        log.info("Created budget card: cardId={}, walletId={}, monthlyLimit={}", card.getId(), walletId, monthlyLimit);
        return LedgerResult.success(card);
    }

    /**
     * Moves money from the funding wallet onto the card.
     */
    public LedgerResult<TransferReceipt> allocate(@NotNull Long ownerId, @NotNull Long cardId,
                                                  @NotNull @Positive BigDecimal amount, @NotNull String operationId) {
        LedgerResult<Account> card = requireOwnedCard(ownerId, cardId);
        if (card.isFailure()) {
            return LedgerResult.failure(card.getFailure());
        }
        Long walletId = card.getValue().getParentAccountId();
        return retryExecutor.execute(operationId, () -> transferEngine.applyTransfer(
                List.of(Move.debit(walletId, amount), Move.credit(cardId, amount)),
                LedgerReason.BUDGET_ALLOCATE, operationId));
    }

    /**
     * Moves unspent money from the card back to the funding wallet.
     */
    public LedgerResult<TransferReceipt> returnToWallet(@NotNull Long ownerId, @NotNull Long cardId,
                                                        @NotNull @Positive BigDecimal amount, @NotNull String operationId) {
        LedgerResult<Account> card = requireOwnedCard(ownerId, cardId);
        if (card.isFailure()) {
            return LedgerResult.failure(card.getFailure());
        }
        Long walletId = card.getValue().getParentAccountId();
        return retryExecutor.execute(operationId, () -> transferEngine.applyTransfer(
                List.of(Move.debit(cardId, amount), Move.credit(walletId, amount)),
                LedgerReason.BUDGET_ALLOCATE, operationId));
    }

    /**
     * Sets the monthly limit, or removes it when {@code monthlyLimit} is null.
     * Takes the card lock so the change never lands in the middle of a spend.
     */
    public LedgerResult<Account> updateMonthlyLimit(@NotNull Long ownerId, @NotNull Long cardId, BigDecimal monthlyLimit) {
        if (monthlyLimit != null && monthlyLimit.signum() < 0) {
            return LedgerResult.failure(LedgerFailure.invalidRequest("Monthly limit must not be negative"));
        }
        LedgerResult<Account> card = requireOwnedCard(ownerId, cardId);
        if (card.isFailure()) {
            return card;
        }
        try {
            return transactionTemplate.execute(status -> {
                Account locked = ledgerStore.lockAccount(cardId)
                        .orElseThrow(() -> new EntityNotFoundException("Account not found: " + cardId));
                locked.setMonthlyLimit(monthlyLimit);
                locked.setVersion(locked.getVersion() + 1);
                log.info("Updated monthly limit: cardId={}, monthlyLimit={}", cardId, monthlyLimit);
                return LedgerResult.success(locked);
            });
        } catch (PessimisticLockingFailureException e) {
            log.warn("Lock wait exceeded on limit update: cardId={}", cardId);
            return LedgerResult.failure(LedgerFailure.lockTimeout("monthly-limit:" + cardId));
        }
    }

    /**
     * Decides whether {@code amount} may be spent from the card right now.
     * <p>
     * The monthly limit is evaluated first, then the allocated balance. Both must allow the spend,
     * and the message names the constraint that did not.
     * </p>
     *
     * @throws EntityNotFoundException if the card does not exist
     */
    public SpendDecision canSpend(@NotNull Long cardId, @NotNull @Positive BigDecimal amount) {
        Account card = requireCard(cardId);
        return evaluate(card, amount, spentThisMonth(cardId));
    }

    /**
     * Pays a purchase from the card. The spend leaves the ledger (BUDGET_SPEND has no counterpart account).
     */
    public LedgerResult<TransferReceipt> spend(@NotNull Long ownerId, @NotNull Long cardId,
                                               @NotNull @Positive BigDecimal amount, @NotNull String operationId,
                                               String description) {
        LedgerResult<Account> card = requireOwnedCard(ownerId, cardId);
        if (card.isFailure()) {
            return LedgerResult.failure(card.getFailure());
        }

        boolean alreadyApplied = ledgerEntryRepository.countByOperationId(operationId) > 0;
        if (!alreadyApplied && card.getValue().getStatus() != AccountStatus.ACTIVE) {
            return LedgerResult.failure(LedgerFailure.accountFrozen(cardId, card.getValue().getStatus()));
        }
        if (!alreadyApplied) {
            SpendDecision decision = evaluate(card.getValue(), amount, spentThisMonth(cardId));
            if (!decision.allowed()) {
                log.warn("Spend rejected: cardId={}, amount={}, constraint={}", cardId, amount, decision.constraint());
                return LedgerResult.failure(toFailure(cardId, amount, decision));
            }
        }

        TransferHook limitGuard = new TransferHook() {
            @Override
            public Optional<LedgerFailure> beforeApply(LockedAccounts accounts) {
                return authorizeLocked(accounts.get(cardId), amount);
            }
        };

        LedgerResult<TransferReceipt> result = retryExecutor.execute(operationId, () -> transferEngine.applyTransfer(
                List.of(Move.debit(cardId, amount)), LedgerReason.BUDGET_SPEND, operationId, description, limitGuard));

        if (result.isSuccess() && !result.isDuplicate()) {
            eventPublisher.publish(LedgerEventType.BUDGET_SPEND, ownerId, cardId, operationId, amount,
                    "Spent " + amount.toPlainString() + " from " + card.getValue().getName());
        }
        return result;
    }

    public CardSummaryResponse getCardSummary(@NotNull Long cardId) {
        Account card = requireCard(cardId);
        BigDecimal spent = spentThisMonth(cardId);
        BigDecimal remaining = card.getMonthlyLimit() == null ? null
                : card.getMonthlyLimit().subtract(spent).max(BigDecimal.ZERO);
        return new CardSummaryResponse(card.getId(), card.getParentAccountId(), card.getName(), card.getStatus(),
                card.getBalance(), card.getMonthlyLimit(), spent, remaining, card.getCurrency());
    }

    /**
     * Authorizes a debit of {@code amount} from a card the caller holds locked in the transfer engine.
     * Every outflow from a budget card goes through here, purchases and subscription charges alike.
     *
     * @return the rejection, empty if the card's monthly limit and balance both allow the debit
     */
    public Optional<LedgerFailure> authorizeLocked(Account card, BigDecimal amount) {
        SpendDecision decision = evaluate(card, amount, spentThisMonth(card.getId()));
        if (decision.allowed()) {
            return Optional.empty();
        }
        log.warn("Card debit rejected under lock: cardId={}, amount={}, constraint={}",
                card.getId(), amount, decision.constraint());
        return Optional.of(toFailure(card.getId(), amount, decision));
    }

    /**
     * Total outflow of the card (purchases and subscription charges) in the current calendar month
     * of the ledger zone.
     */
    public BigDecimal spentThisMonth(Long cardId) {
        YearMonth month = YearMonth.now(clock);
        LocalDateTime from = month.atDay(1).atStartOfDay();
        LocalDateTime to = month.plusMonths(1).atDay(1).atStartOfDay();
        return ledgerEntryRepository.sumDeltas(cardId, SPEND_REASONS, from, to).negate();
    }

    static SpendDecision evaluate(Account card, BigDecimal amount, BigDecimal spentThisMonth) {
        String currency = card.getCurrency();
        if (card.getMonthlyLimit() != null) {
            BigDecimal remaining = card.getMonthlyLimit().subtract(spentThisMonth).max(BigDecimal.ZERO);
            if (amount.compareTo(remaining) > 0) {
                BigDecimal excess = amount.subtract(remaining);
                return new SpendDecision(false, SpendConstraint.MONTHLY_LIMIT,
                        String.format("Exceeds monthly limit by %s %s (limit %s, spent this month %s, remaining %s)",
                                plain(excess), currency, plain(card.getMonthlyLimit()), plain(spentThisMonth),
                                plain(remaining)),
                        excess, remaining);
            }
        }
        if (amount.compareTo(card.getBalance()) > 0) {
            BigDecimal excess = amount.subtract(card.getBalance());
            return new SpendDecision(false, SpendConstraint.ALLOCATED_BALANCE,
                    String.format("Exceeds allocated balance by %s %s (balance %s)",
                            plain(excess), currency, plain(card.getBalance())),
                    excess, card.getBalance());
        }
        return SpendDecision.allow();
    }

    private static LedgerFailure toFailure(Long cardId, BigDecimal amount, SpendDecision decision) {
        LedgerErrorCode code = decision.constraint() == SpendConstraint.MONTHLY_LIMIT
                ? LedgerErrorCode.LIMIT_EXCEEDED
                : LedgerErrorCode.INSUFFICIENT_FUNDS;
        return new LedgerFailure(code, decision.message(), cardId, amount, decision.available(), decision.shortfall());
    }

    private Account requireCard(Long cardId) {
        Account card = accountService.getAccount(cardId);
        if (card.getKind() != AccountKind.BUDGET_CARD) {
            throw new EntityNotFoundException("Budget card not found: " + cardId);
        }
        return card;
    }

    private LedgerResult<Account> requireOwnedCard(Long ownerId, Long cardId) {
        Optional<LedgerFailure> denied = accountService.requireOwned(cardId, ownerId);
        if (denied.isPresent()) {
            return LedgerResult.failure(denied.get());
        }
        Account card = accountService.getAccount(cardId);
        if (card.getKind() != AccountKind.BUDGET_CARD) {
            return LedgerResult.failure(LedgerFailure.invalidRequest("Account " + cardId + " is not a budget card"));
        }
        return LedgerResult.success(card);
    }

    private static String plain(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
