package com.nosota.unipay.repository;

import com.nosota.unipay.api.model.ObligationStatus;
import com.nosota.unipay.model.ScheduledObligation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScheduledObligationRepository extends JpaRepository<ScheduledObligation, Long> {

    Optional<ScheduledObligation> findBySubscriptionIdAndDueDate(Long subscriptionId, LocalDate dueDate);

    List<ScheduledObligation> findBySubscriptionIdOrderByDueDateAsc(Long subscriptionId);

    long countBySubscriptionIdAndDueDate(Long subscriptionId, LocalDate dueDate);

    /**
     * Obligations ready to be charged: SCHEDULED with a due date on or before {@code date}.
     */
    @Query("SELECT o FROM ScheduledObligation o " +
           "WHERE o.status = com.nosota.unipay.api.model.ObligationStatus.SCHEDULED " +
           "AND o.dueDate <= :date " +
           "ORDER BY o.dueDate ASC, o.id ASC")
    List<ScheduledObligation> findDue(@Param("date") LocalDate date);

    /**
     * Changes the status only if the obligation still has the expected one.
     *
     * @return number of rows changed (0 or 1)
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ScheduledObligation o " +
           "SET o.status = :target, o.failureReason = :failureReason " +
           "WHERE o.id = :id AND o.status = :expected")
    int transition(@Param("id") Long id,
                   @Param("expected") ObligationStatus expected,
                   @Param("target") ObligationStatus target,
                   @Param("failureReason") String failureReason);

    /**
     * Cancels the pending obligations of a subscription.
     *
     * @return number of obligations cancelled
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ScheduledObligation o " +
           "SET o.status = com.nosota.unipay.api.model.ObligationStatus.CANCELLED " +
           "WHERE o.subscriptionId = :subscriptionId " +
           "AND o.status = com.nosota.unipay.api.model.ObligationStatus.SCHEDULED")
    int cancelScheduled(@Param("subscriptionId") Long subscriptionId);
}
