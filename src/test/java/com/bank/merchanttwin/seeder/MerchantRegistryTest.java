package com.bank.merchanttwin.seeder;

import com.bank.merchanttwin.engine.DefaultRuleCatalog;
import com.bank.merchanttwin.engine.RuleEngine;
import com.bank.merchanttwin.model.Failure;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MerchantRegistryTest {

    private final MerchantRegistry registry = new MerchantRegistry();
    private final RuleEngine ruleEngine = new RuleEngine(DefaultRuleCatalog.create());

    @Test
    void merchants_fiveCuratedProfiles() {
        assertThat(registry.merchants()).extracting(Merchant::getId)
                .containsExactly("M001", "M002", "M003", "M004", "M005");
    }

    @Test
    void findById_unknown_empty() {
        assertThat(registry.findById("M999")).isEmpty();
        assertThat(registry.findById("M004")).get().extracting(Merchant::getBusinessName)
                .isEqualTo("Rotich Electronics Hub");
    }

    @Test
    void healthyProfiles_passEveryAction() {
        assertThat(ruleEngine.scanAll(registry.findById("M001").orElseThrow())).isEmpty();
        assertThat(ruleEngine.scanAll(registry.findById("M005").orElseThrow())).isEmpty();
    }

    @Test
    void multiFailureProfile_leadsWithSuspendedSettlement() {
        List<Failure> failures = ruleEngine.scanAll(registry.findById("M002").orElseThrow());

        assertThat(failures.get(0).getCode()).isEqualTo("ACC_SUSPENDED");
        assertThat(failures.get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(failures.get(0).getDemandRank()).isEqualTo(1);
        assertThat(failures).hasSizeGreaterThanOrEqualTo(8);
    }

    @Test
    void frozenProfile_startKeyExpired() {
        Merchant m004 = registry.findById("M004").orElseThrow();

        assertThat(ruleEngine.evaluate(m004, "START_KEY").getCode()).isEqualTo("START_KEY_EXPIRED");
        assertThat(ruleEngine.evaluate(m004, "DORMANT_OP").getCode()).isEqualTo("OP_FULLY_DORMANT");
    }
}
