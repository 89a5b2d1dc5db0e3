package com.bank.merchanttwin.engine;

import com.bank.merchanttwin.model.AccountStatus;
import com.bank.merchanttwin.model.ActionKey;
import com.bank.merchanttwin.model.EvaluationResult;
import com.bank.merchanttwin.model.KycStatus;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.Outcome;
import com.bank.merchanttwin.model.RuleDefinition;
import com.bank.merchanttwin.model.Severity;
import com.bank.merchanttwin.model.StartKeyStatus;
import com.bank.merchanttwin.testutil.TestMerchants;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultRuleCatalogTest {

    private final RuleCatalog catalog = DefaultRuleCatalog.create();

    @Test
    void create_twelveDefinitionsRankedByDemand() {
        List<RuleDefinition> defs = catalog.definitions();

        assertThat(defs).hasSize(12);
        assertThat(defs).extracting(RuleDefinition::getDemandRank)
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12);
        assertThat(defs).extracting(RuleDefinition::getActionKey).containsExactly(ActionKey.values());
        assertThat(catalog.maxDemandTotal()).isEqualTo(14144);
        assertThat(defs.stream().mapToLong(RuleDefinition::getDemandTotal).sum()).isEqualTo(91815);
    }

    @Test
    void definition_dormantOperator_carriesDemandMetadata() {
        RuleDefinition def = catalog.definition(ActionKey.DORMANT_OP);

        assertThat(def.getLabel()).isEqualTo("Operator Status");
        assertThat(def.getDemandRank()).isEqualTo(10);
        assertThat(def.getDemandTotal()).isEqualTo(3778);
        assertThat(def.getMenuPath()).isEqualTo("SIM & Operator > Operator Status");
    }

    @Test
    void constructor_definitionWithoutRule_rejected() {
        List<ActionRule> elevenRules = DefaultRuleCatalog.rules().stream()
                .filter(r -> r.getActionKey() != ActionKey.APPLICATION)
                .collect(Collectors.toList());

        assertThatThrownBy(() -> new RuleCatalog(DefaultRuleCatalog.definitions(), elevenRules))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("APPLICATION");
    }

    @Test
    void settleFunds_simSwapHold_liftsAfterThirtyDays() {
        EvaluationResult held = evaluate(TestMerchants.swapped("S1", 29), ActionKey.SETTLE_FUNDS);
        EvaluationResult lifted = evaluate(TestMerchants.swapped("S1", 30), ActionKey.SETTLE_FUNDS);

        assertThat(held.getCode()).isEqualTo("SIM_SWAP_HOLD");
        assertThat(held.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(held.getInline()).contains("1 more day(s)");
        assertThat(lifted.isPassing()).isTrue();
        assertThat(lifted.getInline()).contains("KES 10,000.00").contains("Equity Bank");
    }

    @Test
    void settleFunds_zeroBalance_failsHigh() {
        EvaluationResult result = evaluate(TestMerchants.healthy().toBuilder().balance(0).build(), ActionKey.SETTLE_FUNDS);

        assertThat(result.getCode()).isEqualTo("ZERO_BALANCE");
        assertThat(result.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(result.getEscalation()).isEqualTo(Verdicts.ESCALATE_HIGH);
    }

    @Test
    void settleFunds_holdReportedBeforeExpiredKyc() {
        Merchant merchant = TestMerchants.healthy().toBuilder()
                .settlementOnHold(true)
                .kycStatus(KycStatus.EXPIRED).kycAgeDays(380)
                .build();

        assertThat(evaluate(merchant, ActionKey.SETTLE_FUNDS).getCode()).isEqualTo("SETTLE_HOLD");
    }

    @Test
    void accountStatus_activeButDormant_passesWithReviewMessage() {
        Merchant merchant = TestMerchants.healthy().toBuilder().dormantDays(45).build();

        EvaluationResult result = evaluate(merchant, ActionKey.ACCOUNT_STATUS);

        assertThat(result.isPassing()).isTrue();
        assertThat(result.getInline()).contains("Review required").contains("Dormant days: 45");
    }

    @Test
    void accountStatus_dormancyThresholds() {
        Merchant suspended = TestMerchants.healthy().toBuilder().accountStatus(AccountStatus.SUSPENDED).build();

        assertThat(evaluate(suspended.toBuilder().dormantDays(59).build(), ActionKey.ACCOUNT_STATUS).getCode())
                .isEqualTo("COMPLIANCE_HOLD");
        assertThat(evaluate(suspended.toBuilder().dormantDays(60).build(), ActionKey.ACCOUNT_STATUS).getCode())
                .isEqualTo("DORMANT_60");
        assertThat(evaluate(suspended.toBuilder().dormantDays(90).build(), ActionKey.ACCOUNT_STATUS).getCode())
                .isEqualTo("FULLY_DORMANT");
    }

    @Test
    void startKey_validKeyOnSuspendedAccount_failsNotActive() {
        Merchant merchant = TestMerchants.healthy().toBuilder().accountStatus(AccountStatus.SUSPENDED).build();

        EvaluationResult result = evaluate(merchant, ActionKey.START_KEY);

        assertThat(result.getCode()).isEqualTo("ACC_NOT_ACTIVE");
        assertThat(result.getReason()).contains("suspended");
    }

    @Test
    void startKey_expiredKey_failsCritical() {
        Merchant merchant = TestMerchants.healthy().toBuilder().startKeyStatus(StartKeyStatus.EXPIRED).build();

        EvaluationResult result = evaluate(merchant, ActionKey.START_KEY);

        assertThat(result.getCode()).isEqualTo("START_KEY_EXPIRED");
        assertThat(result.getEscalation()).isEqualTo(Verdicts.ESCALATE_CRITICAL);
    }

    @Test
    void statement_notificationsOff_warnsButCompletes() {
        Merchant merchant = TestMerchants.healthy().toBuilder().notificationsEnabled(false).build();

        EvaluationResult result = evaluate(merchant, ActionKey.STATEMENT);

        assertThat(result.getOutcome()).isEqualTo(Outcome.WARN);
        assertThat(result.isPassing()).isFalse();
        assertThat(result.getCode()).isEqualTo("NOTIF_OFF");
        assertThat(result.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(result.getEscalation()).isEqualTo(Verdicts.ESCALATE_WARNING);
    }

    @Test
    void dormantOperator_escalatesNoticeWarningRevocation() {
        EvaluationResult notice = evaluate(operatorDormant(30), ActionKey.DORMANT_OP);
        EvaluationResult warning = evaluate(operatorDormant(60), ActionKey.DORMANT_OP);
        EvaluationResult revoked = evaluate(operatorDormant(90), ActionKey.DORMANT_OP);

        assertThat(evaluate(operatorDormant(29), ActionKey.DORMANT_OP).isPassing()).isTrue();
        assertThat(notice.getOutcome()).isEqualTo(Outcome.WARN);
        assertThat(notice.getCode()).isEqualTo("OP_DORMANT_NOTICE");
        assertThat(warning.getCode()).isEqualTo("OP_DORMANT_WARN");
        assertThat(warning.getReason()).contains("30 day(s)");
        assertThat(revoked.getCode()).isEqualTo("OP_FULLY_DORMANT");
        assertThat(revoked.getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void pinUnlock_notLocked_passesEvenWhenSuspended() {
        Merchant merchant = TestMerchants.healthy().toBuilder()
                .accountStatus(AccountStatus.SUSPENDED)
                .pinAttempts(2)
                .build();

        EvaluationResult result = evaluate(merchant, ActionKey.PIN_UNLOCK);

        assertThat(result.isPassing()).isTrue();
        assertThat(result.getInline()).contains("2/3");
    }

    @Test
    void kycChange_recentSwap_holdsForFourteenDays() {
        assertThat(evaluate(TestMerchants.swapped("S1", 13), ActionKey.KYC_CHANGE).getCode())
                .isEqualTo("SIM_SWAP_KYC_HOLD");
        assertThat(evaluate(TestMerchants.swapped("S1", 14), ActionKey.KYC_CHANGE).isPassing()).isTrue();
    }

    @Test
    void notifications_swappedSim_failsUnregistered() {
        EvaluationResult result = evaluate(TestMerchants.swapped("S1", 40), ActionKey.NOTIFICATIONS);

        assertThat(result.getCode()).isEqualTo("SIM_NOTIF_UNREG");
        assertThat(result.getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void application_pass_referenceDerivedFromPaybill() {
        EvaluationResult first = evaluate(TestMerchants.healthy(), ActionKey.APPLICATION);
        EvaluationResult second = evaluate(TestMerchants.healthy(), ActionKey.APPLICATION);

        assertThat(first.getInline()).contains("Reference: APP-123456");
        assertThat(first).isEqualTo(second);
    }

    @Test
    void application_pendingKycReportedBeforeSuspension() {
        Merchant merchant = TestMerchants.healthy().toBuilder()
                .kycStatus(KycStatus.PENDING)
                .accountStatus(AccountStatus.SUSPENDED)
                .build();

        assertThat(evaluate(merchant, ActionKey.APPLICATION).getCode()).isEqualTo("KYC_PENDING_APP");
    }

    private EvaluationResult evaluate(Merchant merchant, ActionKey key) {
        return catalog.rule(key).evaluate(merchant);
    }

    private static Merchant operatorDormant(int days) {
        return TestMerchants.healthy().toBuilder().operatorDormantDays(days).build();
    }
}
