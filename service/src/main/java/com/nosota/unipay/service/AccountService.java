package com.nosota.unipay.service;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.AccountStatus;
import com.nosota.unipay.api.model.LedgerErrorCode;
import com.nosota.unipay.api.model.LedgerReason;
import com.nosota.unipay.config.LedgerProperties;
import com.nosota.unipay.ledger.LedgerFailure;
import com.nosota.unipay.ledger.LedgerResult;
import com.nosota.unipay.ledger.Move;
import com.nosota.unipay.ledger.TransferEngine;
import com.nosota.unipay.ledger.TransferReceipt;
import com.nosota.unipay.ledger.TransferRetryExecutor;
import com.nosota.unipay.model.Account;
import com.nosota.unipay.model.LedgerEntry;
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
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Wallet accounts: opening, funding from and paying out to the external funding source,
 * peer transfers and status changes.
 *
 * <p>Balance changes go through the {@link TransferEngine}; status changes lock the account row
 * the same way, so a freeze never interleaves with a running transfer.
 */
@Service
@Validated
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final LedgerStore ledgerStore;
    private final TransferEngine transferEngine;
    private final TransferRetryExecutor retryExecutor;
    private final LedgerEventPublisher eventPublisher;
    private final LedgerProperties ledgerProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public AccountService(AccountRepository accountRepository,
                          LedgerEntryRepository ledgerEntryRepository,
                          LedgerStore ledgerStore,
                          TransferEngine transferEngine,
                          TransferRetryExecutor retryExecutor,
                          LedgerEventPublisher eventPublisher,
                          LedgerProperties ledgerProperties,
                          PlatformTransactionManager transactionManager,
                          Clock clock) {
        this.accountRepository = accountRepository;
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.ledgerStore = ledgerStore;
        this.transferEngine = transferEngine;
        this.retryExecutor = retryExecutor;
        this.eventPublisher = eventPublisher;
        this.ledgerProperties = ledgerProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Opens a new empty wallet.
     *
     * @param ownerId  Owner of the wallet
     * @param name     Optional label
     * @param currency ISO 4217 code, the configured default when null
     * @return the persisted wallet
     */
    public Account openWallet(@NotNull Long ownerId, String name, String currency) {
        Account wallet = newAccount(AccountKind.WALLET, ownerId,
                currency != null ? currency : ledgerProperties.getDefaultCurrency(), name);
        wallet = accountRepository.save(wallet);
        log.info("Opened wallet: accountId={}, ownerId={}, currency={}", wallet.getId(), ownerId, wallet.getCurrency());
        return wallet;
    }

    /**
     * Builds an unsaved ACTIVE account with a zero balance.
     */
    public Account newAccount(AccountKind kind, Long ownerId, String currency, String name) {
        Account account = new Account();
        account.setKind(kind);
        account.setOwnerId(ownerId);
        account.setCurrency(currency);
        account.setName(name);
        account.setStatus(AccountStatus.ACTIVE);
        account.setBalance(BigDecimal.ZERO.setScale(2));
        account.setVersion(0L);
        account.setCreatedAt(LocalDateTime.now(clock));
        return account;
    }

    /**
     * @throws EntityNotFoundException if the account does not exist
     */
    public Account getAccount(@NotNull Long accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new EntityNotFoundException("Account not found: " + accountId));
    }

    /**
     * Entries of an account, newest first.
     */
    public Page<LedgerEntry> getEntries(@NotNull Long accountId, int page, int size) {
        getAccount(accountId);
        return ledgerEntryRepository.findByAccountIdOrderByIdDesc(accountId, PageRequest.of(page, size));
    }

    public List<LedgerEntry> getOperationEntries(@NotNull String operationId) {
        return ledgerEntryRepository.findByOperationIdOrderByIdAsc(operationId);
    }

    /**
     * Credits money received from the external funding source.
     */
    public LedgerResult<TransferReceipt> topUp(@NotNull Long accountId, @NotNull @Positive BigDecimal amount,
                                               @NotNull String operationId) {
        LedgerResult<TransferReceipt> result = retryExecutor.execute(operationId, () -> transferEngine.applyTransfer(
                List.of(Move.credit(accountId, amount)), LedgerReason.TOPUP, operationId));

        if (result.isSuccess() && !result.isDuplicate()) {
            accountRepository.findById(accountId).ifPresent(account ->
                    eventPublisher.publish(LedgerEventType.TOPUP_COMPLETED, account.getOwnerId(), accountId,
                            operationId, amount, "Top-up of " + amount.toPlainString() + " " + account.getCurrency()));
        }
        return result;
    }

    /**
     * Pays money out of the caller's account to the external funding source.
     */
    public LedgerResult<TransferReceipt> withdraw(@NotNull Long ownerId, @NotNull Long accountId,
                                                  @NotNull @Positive BigDecimal amount, @NotNull String operationId) {
        Optional<LedgerFailure> denied = requireOwned(accountId, ownerId);
        if (denied.isPresent()) {
            return LedgerResult.failure(denied.get());
        }

        LedgerResult<TransferReceipt> result = retryExecutor.execute(operationId, () -> transferEngine.applyTransfer(
                List.of(Move.debit(accountId, amount)), LedgerReason.WITHDRAWAL, operationId));

        if (result.isSuccess() && !result.isDuplicate()) {
            eventPublisher.publish(LedgerEventType.WITHDRAWAL_COMPLETED, ownerId, accountId, operationId, amount,
                    "Withdrawal of " + amount.toPlainString());
        }
        return result;
    }

    /**
     * Peer-to-peer transfer between two wallets. The sender wallet must belong to the caller.
     */
    public LedgerResult<TransferReceipt> transfer(@NotNull Long ownerId, @NotNull Long fromAccountId,
                                                  @NotNull Long toAccountId, @NotNull @Positive BigDecimal amount,
                                                  @NotNull String operationId) {
        if (fromAccountId.equals(toAccountId)) {
            return LedgerResult.failure(LedgerFailure.invalidRequest("Cannot transfer to the same account"));
        }
        Optional<LedgerFailure> denied = requireOwned(fromAccountId, ownerId);
        if (denied.isPresent()) {
            return LedgerResult.failure(denied.get());
        }
        Optional<Account> recipient = accountRepository.findById(toAccountId);
        if (recipient.isEmpty()) {
            return LedgerResult.failure(LedgerFailure.accountNotFound(toAccountId));
        }
        if (recipient.get().getKind() != AccountKind.WALLET || getAccount(fromAccountId).getKind() != AccountKind.WALLET) {
            return LedgerResult.failure(LedgerFailure.invalidRequest("Peer transfers move money between wallets only"));
        }

        LedgerResult<TransferReceipt> result = retryExecutor.execute(operationId, () -> transferEngine.applyTransfer(
                List.of(Move.debit(fromAccountId, amount), Move.credit(toAccountId, amount)),
                LedgerReason.TRANSFER, operationId));

        if (result.isSuccess() && !result.isDuplicate()) {
            eventPublisher.publish(LedgerEventType.TRANSFER_COMPLETED, recipient.get().getOwnerId(), toAccountId,
                    operationId, amount, "Received " + amount.toPlainString() + " " + recipient.get().getCurrency());
        }
        return result;
    }

    public LedgerResult<Account> freeze(@NotNull Long accountId) {
        return changeStatus(accountId, AccountStatus.FROZEN, account ->
                account.getStatus() == AccountStatus.ACTIVE ? Optional.empty()
                        : Optional.of(LedgerFailure.invalidState(
                        "Only ACTIVE accounts can be frozen, account " + accountId + " is " + account.getStatus())));
    }

    public LedgerResult<Account> unfreeze(@NotNull Long accountId) {
        return changeStatus(accountId, AccountStatus.ACTIVE, account ->
                account.getStatus() == AccountStatus.FROZEN ? Optional.empty()
                        : Optional.of(LedgerFailure.invalidState(
                        "Only FROZEN accounts can be unfrozen, account " + accountId + " is " + account.getStatus())));
    }

    /**
     * Closes an empty account of the caller. Closed accounts reject every further operation.
     */
    public LedgerResult<Account> close(@NotNull Long ownerId, @NotNull Long accountId) {
        return changeStatus(accountId, AccountStatus.CLOSED, account -> {
            if (!account.isOwnedBy(ownerId)) {
                return Optional.of(LedgerFailure.unauthorized(
                        "Account " + accountId + " does not belong to owner " + ownerId));
            }
            if (account.getStatus() == AccountStatus.CLOSED) {
                return Optional.of(LedgerFailure.invalidState("Account " + accountId + " is already closed"));
            }
            if (account.getBalance().signum() != 0) {
                return Optional.of(new LedgerFailure(LedgerErrorCode.INVALID_STATE_TRANSITION,
                        "Account " + accountId + " still holds " + account.getBalance().toPlainString(),
                        accountId, null, account.getBalance(), null));
            }
            return Optional.empty();
        });
    }

    /**
     * Checks that the account exists and belongs to the owner.
     *
     * @return the failure to report, empty if the owner may operate the account
     */
    public Optional<LedgerFailure> requireOwned(Long accountId, Long ownerId) {
        Optional<Account> account = accountRepository.findById(accountId);
        if (account.isEmpty()) {
            return Optional.of(LedgerFailure.accountNotFound(accountId));
        }
        if (!account.get().isOwnedBy(ownerId)) {
            log.warn("Ownership check failed: accountId={}, ownerId={}", accountId, ownerId);
            return Optional.of(LedgerFailure.unauthorized(
                    "Account " + accountId + " does not belong to owner " + ownerId));
        }
        return Optional.empty();
    }

    private LedgerResult<Account> changeStatus(Long accountId, AccountStatus target,
                                               Function<Account, Optional<LedgerFailure>> guard) {
        try {
            return transactionTemplate.execute(status -> {
                Optional<Account> locked = ledgerStore.lockAccount(accountId);
                if (locked.isEmpty()) {
                    return LedgerResult.failure(LedgerFailure.accountNotFound(accountId));
                }
                Account account = locked.get();
                Optional<LedgerFailure> rejected = guard.apply(account);
                if (rejected.isPresent()) {
                    log.warn("Status change rejected: accountId={}, target={}, cause={}",
                            accountId, target, rejected.get().message());
                    return LedgerResult.failure(rejected.get());
                }
                AccountStatus previous = account.getStatus();
                account.setStatus(target);
                account.setVersion(account.getVersion() + 1);
                log.info("Account status changed: accountId={}, from={}, to={}", accountId, previous, target);
                return LedgerResult.success(account);
            });
        } catch (PessimisticLockingFailureException e) {
            log.warn("Lock wait exceeded on status change: accountId={}, target={}", accountId, target);
            return LedgerResult.failure(LedgerFailure.lockTimeout("status-change:" + accountId));
        }
    }
}
