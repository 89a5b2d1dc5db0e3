package com.bank.merchanttwin.transition;

import com.bank.merchanttwin.model.AccountStatus;
import com.bank.merchanttwin.model.KycStatus;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.StartKeyStatus;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * State changes triggered when aged day-counters cross a threshold.
 * Declaration order is application order.
 */
enum TimeCascade {

    KYC_EXPIRY(
            m -> m.getKycStatus() == KycStatus.VERIFIED && m.getKycAgeDays() >= 365,
            b -> b.kycStatus(KycStatus.EXPIRED)),

    DORMANCY_SUSPENSION(
            m -> m.getAccountStatus() == AccountStatus.ACTIVE && m.getDormantDays() >= 60,
            b -> b.accountStatus(AccountStatus.SUSPENDED)
                    .settlementOnHold(true)
                    .suspendReason("DORMANCY")),

    START_KEY_EXPIRY(
            m -> m.getStartKeyStatus() == StartKeyStatus.VALID && m.getDormantDays() >= 540,
            b -> b.startKeyStatus(StartKeyStatus.EXPIRED));

    private final Predicate<Merchant> trigger;
    private final UnaryOperator<Merchant.MerchantBuilder> effect;

    TimeCascade(Predicate<Merchant> trigger, UnaryOperator<Merchant.MerchantBuilder> effect) {
        this.trigger = trigger;
        this.effect = effect;
    }

    boolean triggeredBy(Merchant aged) {
        return trigger.test(aged);
    }

    Merchant.MerchantBuilder apply(Merchant.MerchantBuilder builder) {
        return effect.apply(builder);
    }
}
