package com.nosota.unipay.ledger;

import java.util.Optional;

/**
 * Extension point for state machines built on the transfer engine.
 *
 * <p>Both callbacks run inside the engine's database transaction while every account of the
 * operation is locked. A state machine whose records are only ever changed under those locks
 * can therefore check and change its own state race-free.
 */
public interface TransferHook {

    TransferHook NONE = new TransferHook() {
    };

    /**
     * Called after the accounts are locked and re-read, before balances are validated.
     *
     * @return a failure to reject the operation, empty to proceed
     */
    default Optional<LedgerFailure> beforeApply(LockedAccounts accounts) {
        return Optional.empty();
    }

    /**
     * Called after balances and entries are written, before commit.
     */
    default void afterApply(String operationId, LockedAccounts accounts) {
    }
}
