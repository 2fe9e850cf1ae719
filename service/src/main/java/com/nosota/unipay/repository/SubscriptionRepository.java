package com.nosota.unipay.repository;

import com.nosota.unipay.model.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    /**
     * Subscriptions the scheduler keeps materializing payments for.
     */
    List<Subscription> findByActiveTrueAndAutoRenewTrueOrderByIdAsc();

    List<Subscription> findByOwnerIdOrderByIdAsc(Long ownerId);
}
