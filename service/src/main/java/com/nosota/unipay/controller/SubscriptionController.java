package com.nosota.unipay.controller;

import com.nosota.unipay.api.SubscriptionApi;
import com.nosota.unipay.api.dto.ObligationDTO;
import com.nosota.unipay.api.dto.SubscriptionDTO;
import com.nosota.unipay.api.request.CreateSubscriptionRequest;
import com.nosota.unipay.api.response.ExecutionReportResponse;
import com.nosota.unipay.api.response.SyncResponse;
import com.nosota.unipay.mapper.SubscriptionMapper;
import com.nosota.unipay.model.Subscription;
import com.nosota.unipay.service.SubscriptionScheduler;
import com.nosota.unipay.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class SubscriptionController implements SubscriptionApi {

    private final SubscriptionService subscriptionService;
    private final SubscriptionScheduler subscriptionScheduler;
    private final Clock clock;

    @Override
    public ResponseEntity<SubscriptionDTO> createSubscription(Long ownerId, CreateSubscriptionRequest request) {
        Subscription subscription = subscriptionService.create(ownerId, request.accountId(), request.serviceName(),
                request.serviceCategory(), request.amount(), request.billingCycle(),
                request.firstBillingDate()).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(SubscriptionMapper.INSTANCE.toDTO(subscription));
    }

    @Override
    public ResponseEntity<SubscriptionDTO> getSubscription(Long subscriptionId) {
        return ResponseEntity.ok(SubscriptionMapper.INSTANCE.toDTO(subscriptionService.getSubscription(subscriptionId)));
    }

    @Override
    public ResponseEntity<SubscriptionDTO> cancelSubscription(Long ownerId, Long subscriptionId) {
        Subscription cancelled = subscriptionService.cancel(ownerId, subscriptionId).orElseThrow();
        return ResponseEntity.ok(SubscriptionMapper.INSTANCE.toDTO(cancelled));
    }

    @Override
    public ResponseEntity<SubscriptionDTO> pauseSubscription(Long ownerId, Long subscriptionId) {
        Subscription paused = subscriptionService.pause(ownerId, subscriptionId).orElseThrow();
        return ResponseEntity.ok(SubscriptionMapper.INSTANCE.toDTO(paused));
    }

    @Override
    public ResponseEntity<SubscriptionDTO> resumeSubscription(Long ownerId, Long subscriptionId) {
        Subscription resumed = subscriptionService.resume(ownerId, subscriptionId).orElseThrow();
        return ResponseEntity.ok(SubscriptionMapper.INSTANCE.toDTO(resumed));
    }

    @Override
    public ResponseEntity<ObligationDTO> ensureNextPayment(Long subscriptionId) {
        return subscriptionScheduler.ensureNextPayment(subscriptionId)
                .map(obligation -> ResponseEntity.ok(SubscriptionMapper.INSTANCE.toDTO(obligation)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @Override
    public ResponseEntity<List<ObligationDTO>> getObligations(Long subscriptionId) {
        return ResponseEntity.ok(SubscriptionMapper.INSTANCE.toObligationDTOList(
                subscriptionService.getObligations(subscriptionId)));
    }

    @Override
    public ResponseEntity<SyncResponse> syncAll() {
        return ResponseEntity.ok(subscriptionScheduler.syncAll());
    }

    @Override
    public ResponseEntity<ExecutionReportResponse> executeDue(LocalDate date) {
        LocalDate effective = date != null ? date : LocalDate.now(clock);
        return ResponseEntity.ok(subscriptionScheduler.executeDue(effective));
    }

    @Override
    public ResponseEntity<ObligationDTO> retryObligation(Long ownerId, Long obligationId) {
        return ResponseEntity.ok(SubscriptionMapper.INSTANCE.toDTO(
                subscriptionService.retryObligation(ownerId, obligationId).orElseThrow()));
    }
}
