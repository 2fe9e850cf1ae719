package com.nosota.unipay.repository;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.LedgerReason;
import com.nosota.unipay.model.LedgerEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    List<LedgerEntry> findByOperationIdOrderByIdAsc(String operationId);

    Page<LedgerEntry> findByAccountIdOrderByIdDesc(Long accountId, Pageable pageable);

    long countByOperationId(String operationId);

    /**
     * Sums the deltas of one account for the given reasons within [from, to).
     * <p>
     * Spends are negative deltas, so the amount spent in a period is the negated result.
     * </p>
     */
    @Query("SELECT COALESCE(SUM(e.delta), 0) FROM LedgerEntry e " +
           "WHERE e.accountId = :accountId " +
           "AND e.reason IN :reasons " +
           "AND e.createdAt >= :from AND e.createdAt < :to")
    BigDecimal sumDeltas(@Param("accountId") Long accountId,
                         @Param("reasons") Collection<LedgerReason> reasons,
                         @Param("from") LocalDateTime from,
                         @Param("to") LocalDateTime to);

    /**
     * Sums the deltas written for the given reasons on accounts of the given kinds.
     */
    @Query("SELECT COALESCE(SUM(e.delta), 0) FROM LedgerEntry e, Account a " +
           "WHERE e.accountId = a.id " +
           "AND a.kind IN :kinds " +
           "AND e.reason IN :reasons")
    BigDecimal sumDeltasByReasons(@Param("kinds") Collection<AccountKind> kinds,
                                  @Param("reasons") Collection<LedgerReason> reasons);

    /**
     * Sums every delta ever written on accounts of the given kinds.
     */
    @Query("SELECT COALESCE(SUM(e.delta), 0) FROM LedgerEntry e, Account a " +
           "WHERE e.accountId = a.id AND a.kind IN :kinds")
    BigDecimal sumAllDeltas(@Param("kinds") Collection<AccountKind> kinds);
}
