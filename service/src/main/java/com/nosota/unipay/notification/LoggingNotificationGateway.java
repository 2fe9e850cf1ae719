package com.nosota.unipay.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Gateway writing notifications to the log. Replace with the delivery integration's bean.
 */
@Component
@Slf4j
public class LoggingNotificationGateway implements NotificationGateway {

    @Override
    public void send(LedgerEvent event) {
        log.info("Notification: type={}, ownerId={}, accountId={}, reference={}, amount={}, message={}",
                event.type(), event.ownerId(), event.accountId(), event.reference(), event.amount(), event.message());
    }
}
