package com.nosota.unipay.ledger;

import com.nosota.unipay.TestBase;
import com.nosota.unipay.api.model.LedgerErrorCode;
import com.nosota.unipay.model.Account;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("2. Concurrency")
class ConcurrencyTest extends TestBase {

    @Test
    @DisplayName("Concurrent transfers of 60 and 50 from A to B: exactly one succeeds")
    void concurrentTransfersToSameRecipient() throws Exception {
        Long ownerA = newOwner();
        Account a = fundedWallet(ownerA, "100.00");
        Account b = openWallet(newOwner());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<LedgerResult<TransferReceipt>> sixty = executor.submit(() -> {
                start.await();
                return accountService.transfer(ownerA, a.getId(), b.getId(), usd("60"), opId("race-60"));
            });
            Future<LedgerResult<TransferReceipt>> fifty = executor.submit(() -> {
                start.await();
                return accountService.transfer(ownerA, a.getId(), b.getId(), usd("50"), opId("race-50"));
            });
            start.countDown();

            LedgerResult<TransferReceipt> first = sixty.get(30, TimeUnit.SECONDS);
            LedgerResult<TransferReceipt> second = fifty.get(30, TimeUnit.SECONDS);

            assertThat(List.of(first, second)).filteredOn(LedgerResult::isSuccess).hasSize(1);
            LedgerResult<TransferReceipt> rejected = first.isSuccess() ? second : first;
            assertThat(rejected.hasCode(LedgerErrorCode.INSUFFICIENT_FUNDS)).isTrue();

            BigDecimal remaining = balanceOf(a.getId());
            BigDecimal received = balanceOf(b.getId());
            assertThat(received).isEqualByComparingTo(first.isSuccess() ? "60" : "50");
            assertThat(remaining.add(received)).isEqualByComparingTo("100.00");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Balance 100 with concurrent debits of 60 and 50: exactly one succeeds")
    void concurrentDebitsNeverOverdraw() throws Exception {
        Long ownerA = newOwner();
        Account a = fundedWallet(ownerA, "100.00");
        Account b = openWallet(newOwner());
        Account c = openWallet(newOwner());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<LedgerResult<TransferReceipt>> toB = executor.submit(() -> {
                start.await();
                return accountService.transfer(ownerA, a.getId(), b.getId(), usd("60"), opId("race-b"));
            });
            Future<LedgerResult<TransferReceipt>> toC = executor.submit(() -> {
                start.await();
                return accountService.transfer(ownerA, a.getId(), c.getId(), usd("50"), opId("race-c"));
            });
            start.countDown();

            LedgerResult<TransferReceipt> first = toB.get(30, TimeUnit.SECONDS);
            LedgerResult<TransferReceipt> second = toC.get(30, TimeUnit.SECONDS);

            assertThat(List.of(first, second)).filteredOn(LedgerResult::isSuccess).hasSize(1);
            LedgerResult<TransferReceipt> rejected = first.isSuccess() ? second : first;
            assertThat(rejected.hasCode(LedgerErrorCode.INSUFFICIENT_FUNDS)).isTrue();

            BigDecimal remaining = balanceOf(a.getId());
            assertThat(remaining.signum()).isGreaterThanOrEqualTo(0);
            assertThat(remaining.compareTo(usd("40")) == 0 || remaining.compareTo(usd("50")) == 0)
                    .as("remaining balance %s", remaining).isTrue();
            assertThat(remaining.add(balanceOf(b.getId())).add(balanceOf(c.getId()))).isEqualByComparingTo("100.00");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Randomized transfers over shared accounts finish without deadlock and conserve money")
    void randomizedContentionConservesMoney() throws Exception {
        int walletCount = 5;
        List<Long> owners = new ArrayList<>();
        List<Account> wallets = new ArrayList<>();
        for (int i = 0; i < walletCount; i++) {
            Long owner = newOwner();
            owners.add(owner);
            wallets.add(fundedWallet(owner, "200.00"));
        }

        int threads = 8;
        int transfersPerThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                long seed = 31L * t;
                Callable<Integer> worker = () -> {
                    Random random = new Random(seed);
                    start.await();
                    int unexpected = 0;
                    for (int i = 0; i < transfersPerThread; i++) {
                        int from = random.nextInt(walletCount);
                        int to = (from + 1 + random.nextInt(walletCount - 1)) % walletCount;
                        BigDecimal amount = BigDecimal.valueOf(1 + random.nextInt(60));
                        LedgerResult<TransferReceipt> result = accountService.transfer(owners.get(from),
                                wallets.get(from).getId(), wallets.get(to).getId(), amount, opId("rnd"));
                        if (result.isFailure() && !result.hasCode(LedgerErrorCode.INSUFFICIENT_FUNDS)) {
                            unexpected++;
                        }
                    }
                    return unexpected;
                };
                futures.add(executor.submit(worker));
            }
            start.countDown();

            int unexpected = 0;
            for (Future<Integer> future : futures) {
                unexpected += future.get(120, TimeUnit.SECONDS);
            }
            assertThat(unexpected).isZero();
        } finally {
            executor.shutdownNow();
        }

        BigDecimal total = BigDecimal.ZERO;
        for (Account wallet : wallets) {
            BigDecimal balance = balanceOf(wallet.getId());
            assertThat(balance.signum()).isGreaterThanOrEqualTo(0);
            total = total.add(balance);
        }
        assertThat(total).isEqualByComparingTo(BigDecimal.valueOf(200L * walletCount));
    }
}
