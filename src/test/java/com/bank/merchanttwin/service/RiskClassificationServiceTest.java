package com.bank.merchanttwin.service;

import com.bank.merchanttwin.config.TwinProperties;
import com.bank.merchanttwin.engine.DefaultRuleCatalog;
import com.bank.merchanttwin.engine.RuleEngine;
import com.bank.merchanttwin.model.AccountStatus;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.RiskTier;
import com.bank.merchanttwin.model.SensorHealth;
import com.bank.merchanttwin.model.Severity;
import com.bank.merchanttwin.model.SimStatus;
import com.bank.merchanttwin.seeder.MerchantGenerator;
import com.bank.merchanttwin.seeder.MerchantRegistry;
import com.bank.merchanttwin.testutil.TestMerchants;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskClassificationServiceTest {

    private final RiskClassificationService service = new RiskClassificationService();

    @Test
    void sensorHealth_healthyMerchant_allGreen() {
        SensorHealth health = service.sensorHealth(TestMerchants.healthy());

        assertThat(health.getGreen()).hasSize(9);
        assertThat(health.getAmber()).isEmpty();
        assertThat(health.getRed()).isEmpty();
        assertThat(health.getScore()).isEqualTo(1.0);
        assertThat(service.riskTier(TestMerchants.healthy())).isEqualTo(RiskTier.HEALTHY);
    }

    @Test
    void sensorHealth_frozenScenario_criticalTier() {
        Merchant frozen = TestMerchants.frozen("F1");

        SensorHealth health = service.sensorHealth(frozen);

        assertThat(health.getRed()).containsExactly("account_status", "kyc_status", "pin_locked", "settlement_on_hold");
        assertThat(health.getScore()).isCloseTo(5.0 / 9, within(0.001));
        assertThat(service.riskTier(frozen)).isEqualTo(RiskTier.CRITICAL);
    }

    @Test
    void riskTier_frozenAloneIsCritical() {
        // frozen with the hold lifted leaves a single red sensor
        Merchant merchant = TestMerchants.healthy().toBuilder()
                .accountStatus(AccountStatus.FROZEN)
                .build();

        assertThat(service.sensorHealth(merchant).getRed()).hasSize(1);
        assertThat(service.riskTier(merchant)).isEqualTo(RiskTier.CRITICAL);
    }

    @Test
    void riskTier_singleRedSensor_high() {
        Merchant merchant = TestMerchants.healthy().toBuilder().settlementOnHold(true).build();

        assertThat(service.riskTier(merchant)).isEqualTo(RiskTier.HIGH);
    }

    @Test
    void riskTier_threeAmberSensors_high() {
        Merchant merchant = TestMerchants.swapped("S1", 40).toBuilder()
                .notificationsEnabled(false)
                .dormantDays(35)
                .build();

        SensorHealth health = service.sensorHealth(merchant);

        assertThat(health.getAmber()).containsExactly("sim_status", "dormant_days", "notifications");
        assertThat(health.getRed()).isEmpty();
        assertThat(service.riskTier(merchant)).isEqualTo(RiskTier.HIGH);
    }

    @Test
    void riskTier_partialMerchant_medium() {
        Merchant m003 = new MerchantRegistry().findById("M003").orElseThrow();

        SensorHealth health = service.sensorHealth(m003);

        assertThat(health.getAmber()).containsExactly("kyc_status", "pin_attempts");
        assertThat(service.riskTier(m003)).isEqualTo(RiskTier.MEDIUM);
    }

    @Test
    void sensorHealth_unregisteredSimAndOperatorDormancy() {
        Merchant merchant = TestMerchants.healthy().toBuilder()
                .simStatus(SimStatus.UNREGISTERED)
                .operatorDormantDays(60)
                .build();

        SensorHealth health = service.sensorHealth(merchant);

        assertThat(health.getRed()).containsExactly("sim_status");
        assertThat(health.getAmber()).containsExactly("operator_dormant");
        assertThat(health.total()).isEqualTo(9);
    }

    @Test
    void riskTier_criticalRuleFailure_neverHealthy() {
        RuleEngine ruleEngine = new RuleEngine(DefaultRuleCatalog.create());
        MerchantGenerator generator = new MerchantGenerator(new TwinProperties(), TestMerchants.FIXED_CLOCK);

        for (Merchant merchant : generator.generateBatch(300)) {
            boolean anyCritical = ruleEngine.summarize(merchant).countOf(Severity.CRITICAL) > 0;
            if (anyCritical) {
                assertThat(service.riskTier(merchant)).as(merchant.getId()).isNotEqualTo(RiskTier.HEALTHY);
            }
        }
    }
}
