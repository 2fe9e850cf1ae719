package com.nosota.unipay.config;

import com.nosota.unipay.error.LockContentionException;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({LedgerProperties.class, SchedulerProperties.class})
public class LedgerConfig {

    /**
     * Clock in the ledger zone. Entry timestamps and calendar months are derived from it.
     */
    @Bean
    public Clock clock(LedgerProperties ledgerProperties) {
        return Clock.system(ledgerProperties.getZone());
    }

    /**
     * Retries operations rejected with LOCK_TIMEOUT, see {@code TransferRetryExecutor}.
     */
    @Bean
    public RetryTemplate lockRetryTemplate(LedgerProperties ledgerProperties) {
        LedgerProperties.Lock lock = ledgerProperties.getLock();
        return RetryTemplate.builder()
                .maxAttempts(lock.getMaxAttempts())
                .fixedBackoff(lock.getRetryBackoff().toMillis())
                .retryOn(LockContentionException.class)
                .build();
    }
}
