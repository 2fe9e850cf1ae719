package com.nosota.unipay.ledger;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.AccountStatus;
import com.nosota.unipay.api.model.LedgerErrorCode;
import com.nosota.unipay.api.model.LedgerReason;
import com.nosota.unipay.error.StoreUnavailableException;
import com.nosota.unipay.model.Account;
import com.nosota.unipay.model.LedgerEntry;
import com.nosota.unipay.model.LedgerOperation;
import com.nosota.unipay.repository.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The only component that changes account balances.
 *
 * <p>{@link #applyTransfer} runs one operation as a single database transaction:
 * <ol>
 *   <li>order the touched accounts with the {@link LockCoordinator}</li>
 *   <li>lock each account row in that order with a bounded wait and re-read it under the lock</li>
 *   <li>report an already applied operation id as DUPLICATE_OPERATION</li>
 *   <li>validate existence and account status, then the hook's state guard, then currency, the
 *       reason's flow rule and non-negative balances against the fresh values</li>
 *   <li>write balances, bump versions, insert the operation row and one entry per move, commit</li>
 * </ol>
 *
 * <p>Any rejection rolls the transaction back and is returned as a {@link LedgerFailure}; nothing is
 * partially committed. When called inside an existing transaction the engine joins it, and a
 * rejection marks the whole transaction rollback-only.
 */
@Component
@Slf4j
public class TransferEngine {

    private static final int MAX_OPERATION_ID_LENGTH = 64;

    private final LedgerStore ledgerStore;
    private final LockCoordinator lockCoordinator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public TransferEngine(LedgerStore ledgerStore,
                          LockCoordinator lockCoordinator,
                          PlatformTransactionManager transactionManager,
                          Clock clock) {
        this.ledgerStore = ledgerStore;
        this.lockCoordinator = lockCoordinator;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.clock = clock;
    }

    public LedgerResult<TransferReceipt> applyTransfer(List<Move> moves, LedgerReason reason, String operationId) {
        return applyTransfer(moves, reason, operationId, null, TransferHook.NONE);
    }

    public LedgerResult<TransferReceipt> applyTransfer(List<Move> moves, LedgerReason reason,
                                                       String operationId, TransferHook hook) {
        return applyTransfer(moves, reason, operationId, null, hook);
    }

    /**
     * Applies all moves atomically or none of them.
     *
     * @param moves       signed balance changes, each account at most once
     * @param reason      ledger reason; decides which accounts' deltas must net to zero
     * @param operationId idempotence key
     * @param description optional note stored with the operation
     * @param hook        state guard and transition of the calling state machine
     * @return receipt of the applied (or previously applied) operation, or the rejection
     * @throws StoreUnavailableException if the store cannot be reached
     */
    public LedgerResult<TransferReceipt> applyTransfer(List<Move> moves, LedgerReason reason, String operationId,
                                                       String description, TransferHook hook) {
        Optional<LedgerFailure> malformed = validateRequest(moves, reason, operationId);
        if (malformed.isPresent()) {
            log.warn("Rejected malformed operation: operationId={}, reason={}, cause={}",
                    operationId, reason, malformed.get().message());
            return LedgerResult.failure(malformed.get());
        }

        boolean joinsOuterTransaction = TransactionSynchronizationManager.isActualTransactionActive();
        LedgerResult<TransferReceipt> result;
        try {
            result = transactionTemplate.execute(status -> {
                try {
                    LedgerResult<TransferReceipt> outcome = applyLocked(moves, reason, operationId, description, hook);
                    if (outcome.isFailure()) {
                        status.setRollbackOnly();
                    }
                    return outcome;
                } catch (PessimisticLockingFailureException e) {
                    status.setRollbackOnly();
                    log.warn("Lock wait exceeded: operationId={}, reason={}, cause={}",
                            operationId, reason, e.getMessage());
                    return LedgerResult.failure(LedgerFailure.lockTimeout(operationId));
                } catch (DataIntegrityViolationException e) {
                    status.setRollbackOnly();
                    log.warn("Integrity violation while applying: operationId={}, reason={}, cause={}",
                            operationId, reason, e.getMessage());
                    return LedgerResult.failure(LedgerFailure.of(LedgerErrorCode.DUPLICATE_OPERATION,
                            "Operation " + operationId + " was applied concurrently"));
                }
            });
        } catch (CannotCreateTransactionException | DataAccessResourceFailureException e) {
            log.error("Ledger store unavailable: operationId={}, reason={}", operationId, reason, e);
            throw new StoreUnavailableException("Ledger store unavailable while applying " + operationId, e);
        }

        if (result != null && result.hasCode(LedgerErrorCode.DUPLICATE_OPERATION)) {
            return resolveConcurrentDuplicate(operationId, reason, joinsOuterTransaction, result);
        }
        return result;
    }

    private LedgerResult<TransferReceipt> applyLocked(List<Move> moves, LedgerReason reason, String operationId,
                                                      String description, TransferHook hook) {
        List<Long> lockOrder = lockCoordinator.order(moves.stream().map(Move::accountId).toList());

        Map<Long, Account> locked = new LinkedHashMap<>();
        List<Long> missing = new ArrayList<>();
        for (Long accountId : lockOrder) {
            Optional<Account> account = ledgerStore.lockAccount(accountId);
            if (account.isPresent()) {
                locked.put(accountId, account.get());
            } else {
                missing.add(accountId);
            }
        }

        Optional<LedgerOperation> applied = ledgerStore.findOperation(operationId);
        if (applied.isPresent()) {
            log.info("Operation already applied: operationId={}, reason={}", operationId, applied.get().getReason());
            return LedgerResult.duplicate(new TransferReceipt(operationId, applied.get().getReason(), true,
                    ledgerStore.findEntries(operationId)));
        }

        if (!missing.isEmpty()) {
            return reject(operationId, LedgerFailure.accountNotFound(missing.get(0)));
        }

        Optional<LedgerFailure> inactive = checkStatus(locked.values());
        if (inactive.isPresent()) {
            return reject(operationId, inactive.get());
        }

        LockedAccounts accounts = new LockedAccounts(locked);

        Optional<LedgerFailure> guard = hook.beforeApply(accounts);
        if (guard.isPresent()) {
            return reject(operationId, guard.get());
        }

        Optional<LedgerFailure> invalid = validateAccounts(moves, reason, locked);
        if (invalid.isPresent()) {
            return reject(operationId, invalid.get());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        ledgerStore.insertOperation(new LedgerOperation(operationId, reason, description, now));

        List<LedgerEntry> entries = new ArrayList<>();
        for (Long accountId : lockOrder) {
            Account account = locked.get(accountId);
            BigDecimal delta = deltaOf(moves, accountId).setScale(2);
            BigDecimal balanceAfter = account.getBalance().add(delta).setScale(2);
            account.setBalance(balanceAfter);
            account.setVersion(account.getVersion() + 1);
            entries.add(ledgerStore.appendEntry(
                    new LedgerEntry(null, accountId, delta, balanceAfter, operationId, reason, now)));
        }

        hook.afterApply(operationId, accounts);
        ledgerStore.flush();

        log.info("Applied operation: operationId={}, reason={}, accounts={}", operationId, reason, lockOrder);
        return LedgerResult.success(new TransferReceipt(operationId, reason, false, entries));
    }

    private Optional<LedgerFailure> validateRequest(List<Move> moves, LedgerReason reason, String operationId) {
        if (operationId == null || operationId.isBlank()) {
            return Optional.of(LedgerFailure.invalidRequest("Operation ID is required"));
        }
        if (operationId.length() > MAX_OPERATION_ID_LENGTH) {
            return Optional.of(LedgerFailure.invalidRequest(
                    "Operation ID must be at most " + MAX_OPERATION_ID_LENGTH + " characters"));
        }
        if (reason == null) {
            return Optional.of(LedgerFailure.invalidRequest("Reason is required"));
        }
        if (moves == null || moves.isEmpty()) {
            return Optional.of(LedgerFailure.invalidRequest("At least one move is required"));
        }
        Set<Long> seen = new HashSet<>();
        for (Move move : moves) {
            if (move.accountId() == null || move.delta() == null) {
                return Optional.of(LedgerFailure.invalidRequest("Move must name an account and a delta"));
            }
            if (move.delta().signum() == 0) {
                return Optional.of(LedgerFailure.invalidRequest(
                        "Zero delta for account " + move.accountId()));
            }
            if (move.delta().stripTrailingZeros().scale() > 2) {
                return Optional.of(LedgerFailure.invalidRequest(
                        "Amounts are limited to two decimal places: " + move.delta().toPlainString()));
            }
            if (!seen.add(move.accountId())) {
                return Optional.of(LedgerFailure.invalidRequest(
                        "Account " + move.accountId() + " appears more than once"));
            }
        }
        return Optional.empty();
    }

    /**
     * A closed escrow account is left to the hook: its order's state machine reports the
     * resolution conflict more precisely than the account status does.
     */
    private Optional<LedgerFailure> checkStatus(Iterable<Account> accounts) {
        for (Account account : accounts) {
            boolean resolvedEscrow = account.getKind() == AccountKind.ESCROW
                    && account.getStatus() == AccountStatus.CLOSED;
            if (account.getStatus() != AccountStatus.ACTIVE && !resolvedEscrow) {
                return Optional.of(LedgerFailure.accountFrozen(account.getId(), account.getStatus()));
            }
        }
        return Optional.empty();
    }

    private Optional<LedgerFailure> validateAccounts(List<Move> moves, LedgerReason reason, Map<Long, Account> locked) {
        String currency = null;
        for (Account account : locked.values()) {
            if (account.getStatus() != AccountStatus.ACTIVE) {
                return Optional.of(LedgerFailure.accountFrozen(account.getId(), account.getStatus()));
            }
            if (currency == null) {
                currency = account.getCurrency();
            } else if (!currency.equals(account.getCurrency())) {
                return Optional.of(LedgerFailure.invalidRequest(
                        "Cross-currency operations are not supported: " + currency + " and " + account.getCurrency()));
            }
        }

        BigDecimal fundsNet = BigDecimal.ZERO;
        for (Move move : moves) {
            if (locked.get(move.accountId()).getKind().holdsFunds()) {
                fundsNet = fundsNet.add(move.delta());
            }
        }
        Optional<LedgerFailure> flowViolation = switch (reason.getFlow()) {
            case INTERNAL -> fundsNet.signum() == 0 ? Optional.empty() : Optional.of(LedgerFailure.invalidRequest(
                    reason + " must move money between accounts, net change was " + fundsNet.toPlainString()));
            case INFLOW -> fundsNet.signum() > 0 ? Optional.empty() : Optional.of(LedgerFailure.invalidRequest(
                    reason + " must bring money into the ledger, net change was " + fundsNet.toPlainString()));
            case OUTFLOW -> fundsNet.signum() < 0 ? Optional.empty() : Optional.of(LedgerFailure.invalidRequest(
                    reason + " must take money out of the ledger, net change was " + fundsNet.toPlainString()));
        };
        if (flowViolation.isPresent()) {
            return flowViolation;
        }

        for (Move move : moves) {
            Account account = locked.get(move.accountId());
            if (account.getKind().isNonNegative()
                    && account.getBalance().add(move.delta()).signum() < 0) {
                return Optional.of(LedgerFailure.insufficientFunds(
                        account.getId(), move.delta().negate(), account.getBalance()));
            }
        }
        return Optional.empty();
    }

    private LedgerResult<TransferReceipt> resolveConcurrentDuplicate(String operationId, LedgerReason reason,
                                                                     boolean joinsOuterTransaction,
                                                                     LedgerResult<TransferReceipt> result) {
        if (joinsOuterTransaction) {
            // the outer transaction is rollback-only, it cannot read the winner's entries
            return result;
        }
        Optional<LedgerOperation> winner = transactionTemplate.execute(status -> ledgerStore.findOperation(operationId));
        if (winner == null || winner.isEmpty()) {
            log.error("Integrity violation without a committed operation: operationId={}, reason={}",
                    operationId, reason);
            return LedgerResult.failure(LedgerFailure.invalidRequest(
                    "Operation " + operationId + " violates a ledger constraint"));
        }
        List<LedgerEntry> entries = transactionTemplate.execute(status -> ledgerStore.findEntries(operationId));
        return LedgerResult.duplicate(new TransferReceipt(operationId, winner.get().getReason(), true, entries));
    }

    private LedgerResult<TransferReceipt> reject(String operationId, LedgerFailure failure) {
        log.warn("Rejected operation: operationId={}, code={}, message={}",
                operationId, failure.code(), failure.message());
        return LedgerResult.failure(failure);
    }

    private static BigDecimal deltaOf(List<Move> moves, Long accountId) {
        for (Move move : moves) {
            if (move.accountId().equals(accountId)) {
                return move.delta();
            }
        }
        throw new IllegalArgumentException("No move for account " + accountId);
    }
}
