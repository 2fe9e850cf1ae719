package com.nosota.unipay.notification;

/**
 * Delivery channel of the notification layer (push, e-mail, in-app inbox).
 */
public interface NotificationGateway {

    void send(LedgerEvent event);
}
