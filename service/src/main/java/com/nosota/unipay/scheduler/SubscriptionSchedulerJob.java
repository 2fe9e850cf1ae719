package com.nosota.unipay.scheduler;

import com.nosota.unipay.api.response.ExecutionReportResponse;
import com.nosota.unipay.api.response.SyncResponse;
import com.nosota.unipay.service.SubscriptionScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Cron triggers of the subscription scheduler.
 *
 * <p>Configuration:
 * <pre>
 * subscription:
 *   scheduler:
 *     enabled: true                  # enable/disable both jobs
 *     horizon-days: 31               # how far ahead payments are materialized
 *     sync-cron: "0 0 * * * *"       # every hour
 *     execute-cron: "0 15 * * * *"   # every hour, quarter past
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "subscription.scheduler.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SubscriptionSchedulerJob {

    private final SubscriptionScheduler subscriptionScheduler;
    private final Clock clock;

    @Scheduled(cron = "${subscription.scheduler.sync-cron:0 0 * * * *}")
    public void syncSubscriptions() {
        log.info("Starting scheduled job: sync subscription payments");

        try {
            SyncResponse report = subscriptionScheduler.syncAll();
            if (report.created() > 0) {
                log.info("Scheduled {} new subscription payments", report.created());
            } else {
                log.debug("No new subscription payments to schedule");
            }
        } catch (Exception e) {
            log.error("Failed to sync subscription payments: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${subscription.scheduler.execute-cron:0 15 * * * *}")
    public void executeDueObligations() {
        log.info("Starting scheduled job: execute due subscription payments");

        try {
            ExecutionReportResponse report = subscriptionScheduler.executeDue(LocalDate.now(clock));
            if (report.failed() > 0 || report.deferred() > 0) {
                log.warn("Subscription payments: settled={}, failed={}, deferred={}",
                        report.settled(), report.failed(), report.deferred());
            } else {
                log.info("Subscription payments settled: {}", report.settled());
            }
        } catch (Exception e) {
            log.error("Failed to execute due subscription payments: {}", e.getMessage(), e);
        }
    }
}
