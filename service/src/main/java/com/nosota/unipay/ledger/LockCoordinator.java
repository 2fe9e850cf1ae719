package com.nosota.unipay.ledger;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Computes the order in which the accounts of an operation are locked.
 *
 * <p>Every component that locks more than one account row takes its order from here. Ids are
 * locked in ascending order, so two operations sharing accounts always acquire the shared ones
 * in the same relative order and cannot wait on each other in a cycle.
 */
@Component
public class LockCoordinator {

    /**
     * @param accountIds ids touched by one operation, in any order, duplicates allowed
     * @return the distinct ids in lock acquisition order
     */
    public List<Long> order(Collection<Long> accountIds) {
        return accountIds.stream()
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
    }
}
