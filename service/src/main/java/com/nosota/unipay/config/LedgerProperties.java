package com.nosota.unipay.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Ledger settings ({@code ledger.*}).
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    /**
     * Zone defining calendar months for budget card limits and entry timestamps.
     */
    private ZoneId zone = ZoneId.of("UTC");

    /**
     * Currency of new accounts when the request does not name one.
     */
    private String defaultCurrency = "USD";

    private final Lock lock = new Lock();

    @Getter
    @Setter
    public static class Lock {
        /**
         * Bounded wait for a row lock. On PostgreSQL the effective wait is the session
         * {@code lock_timeout} set on every pooled connection.
         */
        private Duration timeout = Duration.ofSeconds(5);

        /**
         * Attempts of an operation that keeps hitting LOCK_TIMEOUT, first one included.
         */
        private int maxAttempts = 3;

        private Duration retryBackoff = Duration.ofMillis(100);
    }
}
