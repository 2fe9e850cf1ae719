package com.nosota.unipay.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands committed ledger events to the {@link NotificationGateway}, fire-and-forget.
 *
 * <p>Runs after commit on an async executor, so a slow or failing delivery never delays or
 * rolls back the money movement. Events published outside a transaction are delivered as well.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationListener {

    private final NotificationGateway notificationGateway;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onLedgerEvent(LedgerEvent event) {
        try {
            notificationGateway.send(event);
        } catch (RuntimeException e) {
            log.error("Notification delivery failed: type={}, ownerId={}, reference={}",
                    event.type(), event.ownerId(), event.reference(), e);
        }
    }
}
