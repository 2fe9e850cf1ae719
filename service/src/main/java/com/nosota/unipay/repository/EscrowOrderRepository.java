package com.nosota.unipay.repository;

import com.nosota.unipay.api.model.EscrowStatus;
import com.nosota.unipay.model.EscrowOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EscrowOrderRepository extends JpaRepository<EscrowOrder, UUID> {

    List<EscrowOrder> findByStatus(EscrowStatus status);

    List<EscrowOrder> findByBuyerOwnerIdOrderByCreatedAtDesc(Long buyerOwnerId);
}
