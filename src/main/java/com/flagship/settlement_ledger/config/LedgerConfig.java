package com.flagship.settlement_ledger.config;

import com.flagship.settlement_ledger.ledger.DisputePolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Ledger rule configuration.
 *
 * ledger.dispute-policy.allow-on-locked-account (default false)
 * ledger.dispute-policy.allow-redispute-after-chargeback (default false)
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public DisputePolicy disputePolicy(
            @Value("${ledger.dispute-policy.allow-on-locked-account:false}") boolean allowOnLockedAccount,
            @Value("${ledger.dispute-policy.allow-redispute-after-chargeback:false}") boolean allowRedispute) {
        DisputePolicy policy = new DisputePolicy(allowOnLockedAccount, allowRedispute);
        log.info("Dispute policy: allowOnLockedAccount={}, allowRedisputeAfterChargeback={}",
                allowOnLockedAccount, allowRedispute);
        return policy;
    }
}
