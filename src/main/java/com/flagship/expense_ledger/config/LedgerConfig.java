package com.flagship.expense_ledger.config;

import com.flagship.expense_ledger.settlement.SettlementPolicy;
import com.flagship.expense_ledger.settlement.SettlementPolicyRegistry;
import com.flagship.expense_ledger.split.SplitPolicy;
import com.flagship.expense_ledger.split.SplitPolicyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the policy lookup tables from every policy bean in the context.
 *
 * Both tables are complete before any ledger can be created, since
 * {@link com.flagship.expense_ledger.ledger.LedgerService} depends on them.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public SplitPolicyRegistry splitPolicyRegistry(List<SplitPolicy> policies) {
        SplitPolicyRegistry registry = new SplitPolicyRegistry(policies);
        log.info("Split policies registered: {}", registry.getKeys());
        return registry;
    }

    @Bean
    public SettlementPolicyRegistry settlementPolicyRegistry(List<SettlementPolicy> policies) {
        SettlementPolicyRegistry registry = new SettlementPolicyRegistry(policies);
        log.info("Settlement policies registered: {}", registry.getKeys());
        return registry;
    }
}
