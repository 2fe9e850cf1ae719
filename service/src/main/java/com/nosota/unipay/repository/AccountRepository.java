package com.nosota.unipay.repository;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.model.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

/**
 * Plain reads of accounts. Locked reads go through {@link LedgerStore}.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

    List<Account> findByOwnerIdAndKind(Long ownerId, AccountKind kind);

    List<Account> findByParentAccountIdAndKind(Long parentAccountId, AccountKind kind);

    /**
     * Sums the balances of all accounts of the given kinds.
     *
     * @param kinds account kinds to include
     * @return total balance, zero when no account matches
     */
    @Query("SELECT COALESCE(SUM(a.balance), 0) FROM Account a WHERE a.kind IN :kinds")
    BigDecimal sumBalancesByKinds(@Param("kinds") Collection<AccountKind> kinds);

    /**
     * Accounts of the given kinds with a negative balance. Empty on a consistent ledger.
     */
    @Query("SELECT a FROM Account a WHERE a.kind IN :kinds AND a.balance < 0")
    List<Account> findNegativeBalances(@Param("kinds") Collection<AccountKind> kinds);
}
