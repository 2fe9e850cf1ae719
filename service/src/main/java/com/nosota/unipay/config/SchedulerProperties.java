package com.nosota.unipay.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Subscription scheduler settings ({@code subscription.scheduler.*}).
 */
@ConfigurationProperties(prefix = "subscription.scheduler")
@Getter
@Setter
public class SchedulerProperties {

    private boolean enabled = true;

    /**
     * Only due dates at most this many days ahead are materialized as obligations.
     */
    private int horizonDays = 31;

    private String syncCron = "0 0 * * * *";

    private String executeCron = "0 15 * * * *";
}
