package com.nosota.unipay.api;

import com.nosota.unipay.api.dto.EscrowOrderDTO;
import com.nosota.unipay.api.request.CreateOrderRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Marketplace escrow API.
 *
 * <p>Order lifecycle: PENDING → HELD → RELEASED | REFUNDED. An order leaves HELD exactly once,
 * even when release and refund requests race.
 */
@RequestMapping("/api/v1/escrow/orders")
public interface EscrowApi {

    /**
     * Commits the caller to a listing and moves the amount from the buyer wallet into escrow.
     */
    @PostMapping
    ResponseEntity<EscrowOrderDTO> createOrder(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @RequestBody @Valid CreateOrderRequest request);

    @GetMapping("/{orderId}")
    ResponseEntity<EscrowOrderDTO> getOrder(@PathVariable("orderId") UUID orderId);

    /**
     * Seller releases the escrow to their own wallet.
     */
    @PostMapping("/{orderId}/release")
    ResponseEntity<EscrowOrderDTO> release(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("orderId") UUID orderId);

    /**
     * Seller returns the escrow to the buyer.
     */
    @PostMapping("/{orderId}/refund")
    ResponseEntity<EscrowOrderDTO> refund(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("orderId") UUID orderId);

    /**
     * Fulfillment event from the delivery integration: releases the escrow to the seller.
     */
    @PostMapping("/{orderId}/fulfillment")
    ResponseEntity<EscrowOrderDTO> fulfill(@PathVariable("orderId") UUID orderId);

    /**
     * Dispute resolved in favour of the buyer: refunds the escrow.
     */
    @PostMapping("/{orderId}/dispute-refund")
    ResponseEntity<EscrowOrderDTO> refundByDispute(@PathVariable("orderId") UUID orderId);
}
