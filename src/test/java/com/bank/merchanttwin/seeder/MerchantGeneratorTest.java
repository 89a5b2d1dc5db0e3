package com.bank.merchanttwin.seeder;

import com.bank.merchanttwin.config.TwinProperties;
import com.bank.merchanttwin.exception.InvalidMerchantStateException;
import com.bank.merchanttwin.model.AccountStatus;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.SimStatus;
import com.bank.merchanttwin.testutil.TestMerchants;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MerchantGeneratorTest {

    @Test
    void generateBatch_sameSeed_sameFleet() {
        List<Merchant> first = generator(42L).generateBatch(25);
        List<Merchant> second = generator(42L).generateBatch(25);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void generateBatch_differentSeed_differentFleet() {
        assertThat(generator(1L).generateBatch(10)).isNotEqualTo(generator(2L).generateBatch(10));
    }

    @Test
    void generateBatch_zero_empty() {
        assertThat(generator(42L).generateBatch(0)).isEmpty();
    }

    @Test
    void generateBatch_negative_rejected() {
        assertThatThrownBy(() -> generator(42L).generateBatch(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generateBatch_snapshotsHonourInvariants() {
        List<Merchant> batch = generator(42L).generateBatch(500);

        assertThat(batch).extracting(Merchant::getId).doesNotHaveDuplicates();
        assertThat(batch).allSatisfy(m -> {
            assertThat(m.getId()).startsWith("GEN-");
            assertThat(m.isPinLocked()).isEqualTo(m.getPinAttempts() >= 3);
            assertThat(m.getSimSwapDaysAgo() != null).isEqualTo(m.getSimStatus() == SimStatus.SWAPPED);
            assertThat(m.getOperatorDormantDays()).isBetween(0, 160);
            assertThat(m.isGenerated()).isTrue();
            assertThat(m.getGeneratedAt()).isEqualTo(TestMerchants.NOW);
        });
    }

    @Test
    void generateBatch_mostMerchantsActive() {
        List<Merchant> batch = generator(42L).generateBatch(1000);

        long active = batch.stream().filter(m -> m.getAccountStatus() == AccountStatus.ACTIVE).count();
        long frozen = batch.stream().filter(m -> m.getAccountStatus() == AccountStatus.FROZEN).count();

        assertThat(active).isBetween(580L, 720L);
        assertThat(frozen).isBetween(50L, 150L);
        assertThat(batch.stream().map(Merchant::getApplicationStatus).collect(Collectors.toSet()))
                .containsExactlyInAnyOrder("approved", "suspended", "frozen");
    }

    @Test
    void generateMerchant_overridesApplied() {
        Merchant merchant = generator(42L).generateMerchant(b -> b
                .id("OVR-1")
                .accountStatus(AccountStatus.FROZEN)
                .settlementOnHold(true));

        assertThat(merchant.getId()).isEqualTo("OVR-1");
        assertThat(merchant.getAccountStatus()).isEqualTo(AccountStatus.FROZEN);
        assertThat(merchant.isSettlementOnHold()).isTrue();
    }

    @Test
    void generateMerchant_overrideBreakingInvariant_rejected() {
        assertThatThrownBy(() -> generator(42L).generateMerchant(b -> b.pinAttempts(0).pinLocked(true)))
                .isInstanceOf(InvalidMerchantStateException.class);
    }

    private static MerchantGenerator generator(long seed) {
        TwinProperties properties = new TwinProperties();
        properties.getGenerator().setSeed(seed);
        return new MerchantGenerator(properties, TestMerchants.FIXED_CLOCK);
    }
}
