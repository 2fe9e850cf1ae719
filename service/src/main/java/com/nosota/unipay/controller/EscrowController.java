package com.nosota.unipay.controller;

import com.nosota.unipay.api.EscrowApi;
import com.nosota.unipay.api.dto.EscrowOrderDTO;
import com.nosota.unipay.api.request.CreateOrderRequest;
import com.nosota.unipay.ledger.LedgerResult;
import com.nosota.unipay.mapper.EscrowOrderMapper;
import com.nosota.unipay.model.EscrowOrder;
import com.nosota.unipay.service.EscrowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class EscrowController implements EscrowApi {

    private final EscrowService escrowService;

    @Override
    public ResponseEntity<EscrowOrderDTO> createOrder(Long ownerId, CreateOrderRequest request) {
        EscrowOrder order = escrowService.createOrder(ownerId, request.buyerAccountId(),
                request.listingId(), request.amount()).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(EscrowOrderMapper.INSTANCE.toDTO(order));
    }

    @Override
    public ResponseEntity<EscrowOrderDTO> getOrder(UUID orderId) {
        return ResponseEntity.ok(EscrowOrderMapper.INSTANCE.toDTO(escrowService.getOrder(orderId)));
    }

    @Override
    public ResponseEntity<EscrowOrderDTO> release(Long ownerId, UUID orderId) {
        return toResponse(escrowService.release(orderId, ownerId));
    }

    @Override
    public ResponseEntity<EscrowOrderDTO> refund(Long ownerId, UUID orderId) {
        return toResponse(escrowService.refund(orderId, ownerId));
    }

    @Override
    public ResponseEntity<EscrowOrderDTO> fulfill(UUID orderId) {
        return toResponse(escrowService.releaseByFulfillment(orderId));
    }

    @Override
    public ResponseEntity<EscrowOrderDTO> refundByDispute(UUID orderId) {
        return toResponse(escrowService.refundByDispute(orderId));
    }

    private static ResponseEntity<EscrowOrderDTO> toResponse(LedgerResult<EscrowOrder> result) {
        return ResponseEntity.ok(EscrowOrderMapper.INSTANCE.toDTO(result.orElseThrow()));
    }
}
