package com.nosota.unipay.ledger;

import com.nosota.unipay.model.Account;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

/**
 * Accounts of one operation, locked and re-read in lock order.
 */
public class LockedAccounts {

    private final Map<Long, Account> accounts;

    LockedAccounts(Map<Long, Account> accounts) {
        this.accounts = Collections.unmodifiableMap(accounts);
    }

    /**
     * @throws IllegalArgumentException if the account is not part of the operation
     */
    public Account get(Long accountId) {
        Account account = accounts.get(accountId);
        if (account == null) {
            throw new IllegalArgumentException("Account " + accountId + " is not locked by this operation");
        }
        return account;
    }

    public Collection<Account> all() {
        return accounts.values();
    }
}
