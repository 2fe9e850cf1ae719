package com.nosota.unipay.repository;

import com.nosota.unipay.config.LedgerProperties;
import com.nosota.unipay.model.Account;
import com.nosota.unipay.model.LedgerEntry;
import com.nosota.unipay.model.LedgerOperation;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row locking and write access used by the transfer engine.
 * <p>
 * Being a {@link Repository}, persistence exceptions thrown here are translated into Spring's
 * {@code DataAccessException} hierarchy: a lock wait that runs out surfaces as
 * {@code PessimisticLockingFailureException}, a unique key violation as
 * {@code DataIntegrityViolationException}.
 * </p>
 */
@Repository
@RequiredArgsConstructor
public class LedgerStore {

    private static final String LOCK_TIMEOUT_HINT = "jakarta.persistence.lock.timeout";

    private final LedgerProperties ledgerProperties;

    @PersistenceContext
    private EntityManager entityManager;

    /**
     * Locks the account row ({@code SELECT ... FOR UPDATE}) and re-reads its state under the lock.
     * <p>
     * Must run inside a transaction; the lock is held until it ends. A copy of the account already
     * held by the persistence context is refreshed, so callers always see the committed values.
     * </p>
     *
     * @param accountId id of the account to lock
     * @return the locked account, empty if no such account exists
     */
    public Optional<Account> lockAccount(Long accountId) {
        Account account = entityManager.find(Account.class, accountId);
        if (account == null) {
            return Optional.empty();
        }
        entityManager.refresh(account, LockModeType.PESSIMISTIC_WRITE, lockHints());
        return Optional.of(account);
    }

    /**
     * Reads a record bypassing whatever copy the persistence context holds.
     */
    public <T> Optional<T> reload(Class<T> type, Object id) {
        T entity = entityManager.find(type, id);
        if (entity == null) {
            return Optional.empty();
        }
        entityManager.refresh(entity);
        return Optional.of(entity);
    }

    public Optional<LedgerOperation> findOperation(String operationId) {
        return Optional.ofNullable(entityManager.find(LedgerOperation.class, operationId));
    }

    /**
     * Inserts the operation row and flushes, so a concurrent application of the same
     * operation id fails here on the primary key.
     */
    public void insertOperation(LedgerOperation operation) {
        entityManager.persist(operation);
        entityManager.flush();
    }

    public LedgerEntry appendEntry(LedgerEntry entry) {
        entityManager.persist(entry);
        return entry;
    }

    public List<LedgerEntry> findEntries(String operationId) {
        return entityManager.createQuery(
                        "SELECT e FROM LedgerEntry e WHERE e.operationId = :operationId ORDER BY e.id", LedgerEntry.class)
                .setParameter("operationId", operationId)
                .getResultList();
    }

    public void flush() {
        entityManager.flush();
    }

    private Map<String, Object> lockHints() {
        return Map.of(LOCK_TIMEOUT_HINT, ledgerProperties.getLock().getTimeout().toMillis());
    }
}
