package com.nosota.unipay.api;

import com.nosota.unipay.api.dto.ObligationDTO;
import com.nosota.unipay.api.dto.SubscriptionDTO;
import com.nosota.unipay.api.request.CreateSubscriptionRequest;
import com.nosota.unipay.api.response.ExecutionReportResponse;
import com.nosota.unipay.api.response.SyncResponse;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Subscription API: recurring charges and their scheduled obligations.
 *
 * <p>{@code /sync} and {@code /execute-due} are the on-demand triggers of the same jobs the
 * scheduler runs on its cron; both are idempotent.
 */
@RequestMapping("/api/v1/subscriptions")
public interface SubscriptionApi {

    @PostMapping
    ResponseEntity<SubscriptionDTO> createSubscription(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @RequestBody @Valid CreateSubscriptionRequest request);

    @GetMapping("/{subscriptionId}")
    ResponseEntity<SubscriptionDTO> getSubscription(@PathVariable("subscriptionId") Long subscriptionId);

    @DeleteMapping("/{subscriptionId}")
    ResponseEntity<SubscriptionDTO> cancelSubscription(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("subscriptionId") Long subscriptionId);

    /**
     * Stops automatic renewal and cancels payments not yet charged.
     */
    @PostMapping("/{subscriptionId}/pause")
    ResponseEntity<SubscriptionDTO> pauseSubscription(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("subscriptionId") Long subscriptionId);

    @PostMapping("/{subscriptionId}/resume")
    ResponseEntity<SubscriptionDTO> resumeSubscription(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("subscriptionId") Long subscriptionId);

    /**
     * Materializes the next payment of a subscription if it falls inside the horizon.
     *
     * @return the scheduled obligation, or 204 when nothing needs scheduling
     */
    @PostMapping("/{subscriptionId}/next-payment")
    ResponseEntity<ObligationDTO> ensureNextPayment(@PathVariable("subscriptionId") Long subscriptionId);

    @GetMapping("/{subscriptionId}/obligations")
    ResponseEntity<List<ObligationDTO>> getObligations(@PathVariable("subscriptionId") Long subscriptionId);

    @PostMapping("/sync")
    ResponseEntity<SyncResponse> syncAll();

    /**
     * Charges every scheduled obligation due on or before {@code date} (today when omitted).
     */
    @PostMapping("/execute-due")
    ResponseEntity<ExecutionReportResponse> executeDue(
            @RequestParam(value = "date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date);

    /**
     * Puts a FAILED obligation back to SCHEDULED so the next execution run charges it again.
     */
    @PostMapping("/obligations/{obligationId}/retry")
    ResponseEntity<ObligationDTO> retryObligation(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("obligationId") Long obligationId);
}
