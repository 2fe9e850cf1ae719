package com.nosota.unipay.service;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.AccountStatus;
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
import com.nosota.unipay.model.Account;
import com.nosota.unipay.model.LedgerEntry;
import com.nosota.unipay.notification.LedgerEventPublisher;
import com.nosota.unipay.notification.LedgerEventType;
import com.nosota.unipay.repository.AccountRepository;
import com.nosota.unipay.repository.LedgerEntryRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Loans between two wallets.
 *
 * <p>Each loan has a LOAN account owned by the borrower whose balance is the outstanding principal.
 * It is a memo figure: the lent money itself sits in the borrower wallet, so LOAN deltas are left
 * out of the zero-sum rule and of the conservation total.
 * <ul>
 *   <li>disburse: lender −P, borrower +P, loan +P</li>
 *   <li>repay: borrower −R, lender +R, loan −R; the loan is CLOSED once nothing is outstanding</li>
 * </ul>
 */
@Service
@Validated
@Slf4j
public class LoanService {

    private final AccountRepository accountRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final AccountService accountService;
    private final TransferEngine transferEngine;
    private final TransferRetryExecutor retryExecutor;
    private final LedgerEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;

    public LoanService(AccountRepository accountRepository,
                       LedgerEntryRepository ledgerEntryRepository,
                       AccountService accountService,
                       TransferEngine transferEngine,
                       TransferRetryExecutor retryExecutor,
                       LedgerEventPublisher eventPublisher,
                       PlatformTransactionManager transactionManager) {
        this.accountRepository = accountRepository;
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.accountService = accountService;
        this.transferEngine = transferEngine;
        this.retryExecutor = retryExecutor;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Lends {@code principal} from the caller's wallet to the borrower wallet.
     *
     * @return the new LOAN account; for a repeated operation id the loan created the first time
     */
    public LedgerResult<Account> disburse(@NotNull Long lenderOwnerId, @NotNull Long lenderAccountId,
                                          @NotNull Long borrowerAccountId, @NotNull @Positive BigDecimal principal,
                                          @NotNull String operationId) {
        Optional<Account> earlier = findLoanOfOperation(operationId);
        if (earlier.isPresent()) {
            log.info("Loan already disbursed: operationId={}, loanAccountId={}", operationId, earlier.get().getId());
            return LedgerResult.duplicate(earlier.get());
        }
        if (lenderAccountId.equals(borrowerAccountId)) {
            return LedgerResult.failure(LedgerFailure.invalidRequest("Lender and borrower must be different wallets"));
        }
        Optional<LedgerFailure> denied = accountService.requireOwned(lenderAccountId, lenderOwnerId);
        if (denied.isPresent()) {
            return LedgerResult.failure(denied.get());
        }
        Optional<Account> borrower = accountRepository.findById(borrowerAccountId);
        if (borrower.isEmpty()) {
            return LedgerResult.failure(LedgerFailure.accountNotFound(borrowerAccountId));
        }
        if (borrower.get().getKind() != AccountKind.WALLET
                || accountService.getAccount(lenderAccountId).getKind() != AccountKind.WALLET) {
            return LedgerResult.failure(LedgerFailure.invalidRequest("Loans are made between wallets only"));
        }

        LedgerResult<Account> result = retryExecutor.execute(operationId,
                () -> disburseInNewLoan(lenderAccountId, borrower.get(), principal, operationId));

        if (result.hasCode(LedgerErrorCode.DUPLICATE_OPERATION)) {
            return findLoanOfOperation(operationId)
                    .map(LedgerResult::duplicate)
                    .orElse(result);
        }
        if (result.isSuccess() && !result.isDuplicate()) {
            log.info("Loan disbursed: loanAccountId={}, lender={}, borrower={}, principal={}",
                    result.getValue().getId(), lenderAccountId, borrowerAccountId, principal);
            eventPublisher.publish(LedgerEventType.LOAN_DISBURSED, borrower.get().getOwnerId(), borrowerAccountId,
                    operationId, principal, "Received a loan of " + principal.toPlainString());
        }
        return result;
    }

    /**
     * Repays part or all of the outstanding principal from the borrower wallet to the lender wallet.
     *
     * @return the LOAN account after repayment; LIMIT_EXCEEDED when paying more than is outstanding
     */
    public LedgerResult<Account> repay(@NotNull Long borrowerOwnerId, @NotNull Long loanAccountId,
                                       @NotNull @Positive BigDecimal amount, @NotNull String operationId) {
        Optional<LedgerFailure> denied = accountService.requireOwned(loanAccountId, borrowerOwnerId);
        if (denied.isPresent()) {
            return LedgerResult.failure(denied.get());
        }
        Account loan = accountService.getAccount(loanAccountId);
        if (loan.getKind() != AccountKind.LOAN) {
            return LedgerResult.failure(LedgerFailure.invalidRequest("Account " + loanAccountId + " is not a loan"));
        }
        Long borrowerAccountId = loan.getParentAccountId();
        Long lenderAccountId = loan.getCounterpartyAccountId();

        TransferHook outstandingGuard = new TransferHook() {
            @Override
            public Optional<LedgerFailure> beforeApply(LockedAccounts accounts) {
                BigDecimal outstanding = accounts.get(loanAccountId).getBalance();
                if (amount.compareTo(outstanding) > 0) {
                    return Optional.of(LedgerFailure.limitExceeded(loanAccountId,
                            "Repayment exceeds outstanding loan by " + amount.subtract(outstanding).toPlainString(),
                            amount, outstanding));
                }
                return Optional.empty();
            }

            @Override
            public void afterApply(String appliedOperationId, LockedAccounts accounts) {
                Account locked = accounts.get(loanAccountId);
                if (locked.getBalance().signum() == 0) {
                    locked.setStatus(AccountStatus.CLOSED);
                    locked.setVersion(locked.getVersion() + 1);
                    log.info("Loan repaid in full: loanAccountId={}", loanAccountId);
                }
            }
        };

        LedgerResult<TransferReceipt> result = retryExecutor.execute(operationId, () -> transferEngine.applyTransfer(
                List.of(Move.debit(borrowerAccountId, amount),
                        Move.credit(lenderAccountId, amount),
                        Move.debit(loanAccountId, amount)),
                LedgerReason.LOAN_REPAY, operationId, "Repayment of loan " + loanAccountId, outstandingGuard));

        if (result.isSuccess() && !result.isDuplicate()) {
            accountRepository.findById(lenderAccountId).ifPresent(lender ->
                    eventPublisher.publish(LedgerEventType.LOAN_REPAID, lender.getOwnerId(), lenderAccountId,
                            operationId, amount, "Loan repayment of " + amount.toPlainString()));
        }
        return result.map(receipt -> accountService.getAccount(loanAccountId));
    }

    private LedgerResult<Account> disburseInNewLoan(Long lenderAccountId, Account borrower,
                                                    BigDecimal principal, String operationId) {
        return transactionTemplate.execute(status -> {
            Account loan = accountService.newAccount(AccountKind.LOAN, borrower.getOwnerId(), borrower.getCurrency(),
                    "Loan from account " + lenderAccountId);
            loan.setParentAccountId(borrower.getId());
            loan.setCounterpartyAccountId(lenderAccountId);
            loan = accountRepository.save(loan);

            LedgerResult<TransferReceipt> result = transferEngine.applyTransfer(
                    List.of(Move.debit(lenderAccountId, principal),
                            Move.credit(borrower.getId(), principal),
                            Move.credit(loan.getId(), principal)),
                    LedgerReason.LOAN_DISBURSE, operationId, "Loan " + loan.getId(), TransferHook.NONE);

            if (result.isFailure() || result.isDuplicate()) {
                // a duplicate must not leave the freshly created loan account behind
                status.setRollbackOnly();
                return result.isFailure() ? LedgerResult.<Account>failure(result.getFailure())
                        : LedgerResult.<Account>failure(LedgerFailure.of(
                        LedgerErrorCode.DUPLICATE_OPERATION,
                        "Operation " + operationId + " was already applied"));
            }
            return LedgerResult.success(loan);
        });
    }

    private Optional<Account> findLoanOfOperation(String operationId) {
        List<LedgerEntry> entries = ledgerEntryRepository.findByOperationIdOrderByIdAsc(operationId);
        for (LedgerEntry entry : entries) {
            Optional<Account> account = accountRepository.findById(entry.getAccountId());
            if (account.isPresent() && account.get().getKind() == AccountKind.LOAN) {
                return account;
            }
        }
        return Optional.empty();
    }

    public Account getLoan(@NotNull Long loanAccountId) {
        Account loan = accountService.getAccount(loanAccountId);
        if (loan.getKind() != AccountKind.LOAN) {
            throw new EntityNotFoundException("Loan not found: " + loanAccountId);
        }
        return loan;
    }
}
