package com.nosota.unipay.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Publishes ledger events as Spring application events. Delivery happens in
 * {@link NotificationListener} once the surrounding transaction (if any) has committed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public void publish(LedgerEventType type, Long ownerId, Long accountId,
                        String reference, BigDecimal amount, String message) {
        if (ownerId == null) {
            return;
        }
        log.debug("Publishing ledger event: type={}, ownerId={}, reference={}", type, ownerId, reference);
        applicationEventPublisher.publishEvent(new LedgerEvent(type, ownerId, accountId, reference, amount, message));
    }
}
