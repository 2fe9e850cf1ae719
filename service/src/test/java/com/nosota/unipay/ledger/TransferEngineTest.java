package com.nosota.unipay.ledger;

import com.nosota.unipay.TestBase;
import com.nosota.unipay.api.model.AccountStatus;
import com.nosota.unipay.api.model.LedgerErrorCode;
import com.nosota.unipay.api.model.LedgerReason;
import com.nosota.unipay.model.Account;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("1. Transfer engine")
class TransferEngineTest extends TestBase {

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    @DisplayName("Applies all moves, writes one entry per account and bumps versions")
    void appliesTransfer() {
        Account from = fundedWallet(newOwner(), "100.00");
        Account to = openWallet(newOwner());
        long fromVersion = accountService.getAccount(from.getId()).getVersion();
        String operationId = opId("engine");

        LedgerResult<TransferReceipt> result = transferEngine.applyTransfer(
                List.of(Move.debit(from.getId(), usd("40")), Move.credit(to.getId(), usd("40"))),
                LedgerReason.TRANSFER, operationId);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isDuplicate()).isFalse();
        assertThat(result.getValue().entries()).hasSize(2);
        assertThat(balanceOf(from.getId())).isEqualByComparingTo("60.00");
        assertThat(balanceOf(to.getId())).isEqualByComparingTo("40.00");
        assertThat(accountService.getAccount(from.getId()).getVersion()).isEqualTo(fromVersion + 1);
        assertThat(ledgerEntryRepository.findByOperationIdOrderByIdAsc(operationId))
                .extracting(entry -> entry.getDelta().signum())
                .containsExactlyInAnyOrder(-1, 1);
    }

    @Test
    @DisplayName("Repeated operation id returns the original entries and changes nothing")
    void duplicateOperation() {
        Account from = fundedWallet(newOwner(), "100.00");
        Account to = openWallet(newOwner());
        String operationId = opId("dup");
        List<Move> moves = List.of(Move.debit(from.getId(), usd("25")), Move.credit(to.getId(), usd("25")));

        LedgerResult<TransferReceipt> first = transferEngine.applyTransfer(moves, LedgerReason.TRANSFER, operationId);
        LedgerResult<TransferReceipt> second = transferEngine.applyTransfer(moves, LedgerReason.TRANSFER, operationId);

        assertThat(first.isDuplicate()).isFalse();
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.isDuplicate()).isTrue();
        assertThat(second.getValue().entries()).hasSize(2);
        assertThat(balanceOf(from.getId())).isEqualByComparingTo("75.00");
        assertThat(ledgerEntryRepository.countByOperationId(operationId)).isEqualTo(2);
    }

    @Test
    @DisplayName("Overdraft is rejected with requested, available and shortfall")
    void insufficientFunds() {
        Account from = fundedWallet(newOwner(), "30.00");
        Account to = openWallet(newOwner());

        LedgerResult<TransferReceipt> result = transferEngine.applyTransfer(
                List.of(Move.debit(from.getId(), usd("50")), Move.credit(to.getId(), usd("50"))),
                LedgerReason.TRANSFER, opId("overdraft"));

        assertThat(result.hasCode(LedgerErrorCode.INSUFFICIENT_FUNDS)).isTrue();
        LedgerFailure failure = result.getFailure();
        assertThat(failure.accountId()).isEqualTo(from.getId());
        assertThat(failure.requested()).isEqualByComparingTo("50");
        assertThat(failure.available()).isEqualByComparingTo("30");
        assertThat(failure.shortfall()).isEqualByComparingTo("20");
        assertThat(balanceOf(from.getId())).isEqualByComparingTo("30.00");
        assertThat(balanceOf(to.getId())).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Frozen account rejects the whole operation")
    void frozenAccount() {
        Account from = fundedWallet(newOwner(), "30.00");
        Account to = openWallet(newOwner());
        accountService.freeze(to.getId()).orElseThrow();

        LedgerResult<TransferReceipt> result = transferEngine.applyTransfer(
                List.of(Move.debit(from.getId(), usd("10")), Move.credit(to.getId(), usd("10"))),
                LedgerReason.TRANSFER, opId("frozen"));

        assertThat(result.hasCode(LedgerErrorCode.ACCOUNT_FROZEN)).isTrue();
        assertThat(result.getFailure().accountId()).isEqualTo(to.getId());
        assertThat(balanceOf(from.getId())).isEqualByComparingTo("30.00");
        assertThat(accountService.getAccount(to.getId()).getStatus()).isEqualTo(AccountStatus.FROZEN);
    }

    @Test
    @DisplayName("Account status is checked before the caller's state guard")
    void frozenAccountBeforeGuard() {
        Account wallet = fundedWallet(newOwner(), "30.00");
        accountService.freeze(wallet.getId()).orElseThrow();
        AtomicBoolean guardCalled = new AtomicBoolean();
        TransferHook refusing = new TransferHook() {
            @Override
            public Optional<LedgerFailure> beforeApply(LockedAccounts accounts) {
                guardCalled.set(true);
                return Optional.of(LedgerFailure.invalidState("guard refused"));
            }
        };

        LedgerResult<TransferReceipt> result = transferEngine.applyTransfer(
                List.of(Move.debit(wallet.getId(), usd("10"))), LedgerReason.WITHDRAWAL, opId("frozen-guard"), refusing);

        assertThat(result.hasCode(LedgerErrorCode.ACCOUNT_FROZEN)).isTrue();
        assertThat(guardCalled).isFalse();
    }

    @Test
    @DisplayName("Unknown account is reported as not found")
    void missingAccount() {
        Account from = fundedWallet(newOwner(), "30.00");

        LedgerResult<TransferReceipt> result = transferEngine.applyTransfer(
                List.of(Move.debit(from.getId(), usd("10")), Move.credit(Long.MAX_VALUE, usd("10"))),
                LedgerReason.TRANSFER, opId("missing"));

        assertThat(result.hasCode(LedgerErrorCode.ACCOUNT_NOT_FOUND)).isTrue();
        assertThat(result.getFailure().accountId()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    @DisplayName("Internal reasons must net to zero, top-ups must bring money in")
    void flowRules() {
        Account from = fundedWallet(newOwner(), "30.00");
        Account to = openWallet(newOwner());

        LedgerResult<TransferReceipt> unbalanced = transferEngine.applyTransfer(
                List.of(Move.debit(from.getId(), usd("10")), Move.credit(to.getId(), usd("5"))),
                LedgerReason.TRANSFER, opId("unbalanced"));
        LedgerResult<TransferReceipt> negativeTopUp = transferEngine.applyTransfer(
                List.of(Move.debit(from.getId(), usd("10"))), LedgerReason.TOPUP, opId("topup"));

        assertThat(unbalanced.hasCode(LedgerErrorCode.INVALID_REQUEST)).isTrue();
        assertThat(negativeTopUp.hasCode(LedgerErrorCode.INVALID_REQUEST)).isTrue();
        assertThat(balanceOf(from.getId())).isEqualByComparingTo("30.00");
    }

    @Test
    @DisplayName("Malformed requests are rejected before locking")
    void malformedRequests() {
        Account wallet = fundedWallet(newOwner(), "30.00");

        assertThat(transferEngine.applyTransfer(List.of(), LedgerReason.TRANSFER, opId("empty"))
                .hasCode(LedgerErrorCode.INVALID_REQUEST)).isTrue();
        assertThat(transferEngine.applyTransfer(
                List.of(new Move(wallet.getId(), BigDecimal.ZERO)), LedgerReason.TOPUP, opId("zero"))
                .hasCode(LedgerErrorCode.INVALID_REQUEST)).isTrue();
        assertThat(transferEngine.applyTransfer(
                List.of(Move.credit(wallet.getId(), usd("1")), Move.credit(wallet.getId(), usd("2"))),
                LedgerReason.TOPUP, opId("twice"))
                .hasCode(LedgerErrorCode.INVALID_REQUEST)).isTrue();
        assertThat(transferEngine.applyTransfer(
                List.of(Move.credit(wallet.getId(), usd("1"))), LedgerReason.TOPUP, " ")
                .hasCode(LedgerErrorCode.INVALID_REQUEST)).isTrue();
        assertThat(transferEngine.applyTransfer(
                List.of(Move.credit(wallet.getId(), usd("1.005"))), LedgerReason.TOPUP, opId("precision"))
                .hasCode(LedgerErrorCode.INVALID_REQUEST)).isTrue();
    }

    @Test
    @DisplayName("Accounts in different currencies cannot be mixed")
    void crossCurrency() {
        Account usdWallet = fundedWallet(newOwner(), "30.00");
        Account eurWallet = accountService.openWallet(newOwner(), "EUR wallet", "EUR");

        LedgerResult<TransferReceipt> result = transferEngine.applyTransfer(
                List.of(Move.debit(usdWallet.getId(), usd("10")), Move.credit(eurWallet.getId(), usd("10"))),
                LedgerReason.TRANSFER, opId("fx"));

        assertThat(result.hasCode(LedgerErrorCode.INVALID_REQUEST)).isTrue();
    }

    @Test
    @DisplayName("Crash before commit leaves no trace and the retry applies exactly once")
    void retryAfterCrashBeforeCommit() {
        Account from = fundedWallet(newOwner(), "100.00");
        Account to = openWallet(newOwner());
        String operationId = opId("crash");
        List<Move> moves = List.of(Move.debit(from.getId(), usd("70")), Move.credit(to.getId(), usd("70")));
        TransactionTemplate outer = new TransactionTemplate(transactionManager);

        assertThatThrownBy(() -> outer.executeWithoutResult(status -> {
            LedgerResult<TransferReceipt> applied = transferEngine.applyTransfer(moves, LedgerReason.TRANSFER, operationId);
            assertThat(applied.isSuccess()).isTrue();
            throw new IllegalStateException("simulated crash before commit");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(balanceOf(from.getId())).isEqualByComparingTo("100.00");
        assertThat(ledgerEntryRepository.countByOperationId(operationId)).isZero();

        LedgerResult<TransferReceipt> retried = transferEngine.applyTransfer(moves, LedgerReason.TRANSFER, operationId);
        LedgerResult<TransferReceipt> again = transferEngine.applyTransfer(moves, LedgerReason.TRANSFER, operationId);

        assertThat(retried.isSuccess()).isTrue();
        assertThat(retried.isDuplicate()).isFalse();
        assertThat(again.isDuplicate()).isTrue();
        assertThat(balanceOf(from.getId())).isEqualByComparingTo("30.00");
        assertThat(balanceOf(to.getId())).isEqualByComparingTo("70.00");
        assertThat(ledgerEntryRepository.countByOperationId(operationId)).isEqualTo(2);
    }

    @Test
    @DisplayName("Failing hook rolls back balances and entries")
    void hookFailureRollsBack() {
        Account from = fundedWallet(newOwner(), "100.00");
        Account to = openWallet(newOwner());
        String operationId = opId("hook");

        TransferHook failing = new TransferHook() {
            @Override
            public void afterApply(String appliedOperationId, LockedAccounts accounts) {
                throw new IllegalStateException("state machine refused");
            }
        };

        assertThatThrownBy(() -> transferEngine.applyTransfer(
                List.of(Move.debit(from.getId(), usd("10")), Move.credit(to.getId(), usd("10"))),
                LedgerReason.TRANSFER, operationId, failing))
                .isInstanceOf(IllegalStateException.class);

        assertThat(balanceOf(from.getId())).isEqualByComparingTo("100.00");
        assertThat(ledgerEntryRepository.countByOperationId(operationId)).isZero();
    }
}
