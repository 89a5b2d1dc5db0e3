package com.bank.merchanttwin.transition;

import com.bank.merchanttwin.engine.MerchantValidator;
import com.bank.merchanttwin.model.AccountStatus;
import com.bank.merchanttwin.model.KycStatus;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.SimStatus;
import com.bank.merchanttwin.model.StartKeyStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.function.UnaryOperator;

/**
 * Discrete events that move a merchant twin from one snapshot to the next.
 * The input snapshot is never modified; each event returns a new one stamped
 * with the event name and the clock's current instant.
 */
@Component
public class MerchantTransitions {

    public static final String DEFAULT_SUSPEND_REASON = "MANUAL";

    private final Clock clock;

    public MerchantTransitions(Clock clock) {
        this.clock = clock;
    }

    /**
     * New SIM on the merchant's number. Notification channels stay on the old SIM.
     */
    public Merchant applySimSwap(Merchant merchant) {
        return transition(merchant, "SIM_SWAP", b -> b
                .simStatus(SimStatus.SWAPPED)
                .simSwapDaysAgo(0)
                .notificationsEnabled(false));
    }

    /**
     * One failed PIN entry. The counter saturates at the lockout threshold.
     */
    public Merchant applyPinAttempt(Merchant merchant) {
        int attempts = Math.min(MerchantValidator.MAX_PIN_ATTEMPTS, merchant.getPinAttempts() + 1);
        return transition(merchant, "PIN_ATTEMPT", b -> b
                .pinAttempts(attempts)
                .pinLocked(attempts >= MerchantValidator.MAX_PIN_ATTEMPTS));
    }

    public Merchant applyPinReset(Merchant merchant) {
        return transition(merchant, "PIN_RESET", b -> b.pinAttempts(0).pinLocked(false));
    }

    public Merchant applyAccountSuspend(Merchant merchant) {
        return applyAccountSuspend(merchant, DEFAULT_SUSPEND_REASON);
    }

    public Merchant applyAccountSuspend(Merchant merchant, String reason) {
        String suspendReason = reason != null ? reason : DEFAULT_SUSPEND_REASON;
        return transition(merchant, "ACCOUNT_SUSPEND", b -> b
                .accountStatus(AccountStatus.SUSPENDED)
                .settlementOnHold(true)
                .suspendReason(suspendReason));
    }

    public Merchant applyAccountReactivate(Merchant merchant) {
        return transition(merchant, "ACCOUNT_REACTIVATE", b -> b
                .accountStatus(AccountStatus.ACTIVE)
                .settlementOnHold(false)
                .dormantDays(0)
                .operatorDormantDays(0)
                .suspendReason(null));
    }

    /**
     * Compliance freeze. Outflows are held until the freeze is lifted.
     */
    public Merchant applyAccountFreeze(Merchant merchant) {
        return transition(merchant, "ACCOUNT_FREEZE", b -> b
                .accountStatus(AccountStatus.FROZEN)
                .settlementOnHold(true));
    }

    /**
     * Fresh documents submitted; they sit in review until approved.
     */
    public Merchant applyKycRenewal(Merchant merchant) {
        return transition(merchant, "KYC_RENEWAL", b -> b.kycStatus(KycStatus.PENDING).kycAgeDays(0));
    }

    public Merchant applyKycApproval(Merchant merchant) {
        return transition(merchant, "KYC_APPROVED", b -> b.kycStatus(KycStatus.VERIFIED).kycAgeDays(0));
    }

    /**
     * Ages every day-counter by {@code days}, then applies each {@link TimeCascade}
     * whose threshold the aged counters cross. All changes land in one snapshot.
     *
     * @throws IllegalArgumentException if {@code days} is negative or would overflow a counter
     */
    public Merchant advanceDays(Merchant merchant, int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must be >= 0, got " + days);
        }
        MerchantValidator.validate(merchant);

        Merchant aged = merchant.toBuilder()
                .kycAgeDays(age(merchant.getKycAgeDays(), days))
                .dormantDays(age(merchant.getDormantDays(), days))
                .operatorDormantDays(age(merchant.getOperatorDormantDays(), days))
                .simSwapDaysAgo(merchant.getSimSwapDaysAgo() != null ? age(merchant.getSimSwapDaysAgo(), days) : null)
                .build();

        Merchant.MerchantBuilder builder = aged.toBuilder();
        for (TimeCascade cascade : TimeCascade.values()) {
            if (cascade.triggeredBy(aged)) {
                cascade.apply(builder);
            }
        }
        return stamp(builder, "TIME_ADVANCE");
    }

    private static int age(int counter, int days) {
        try {
            return Math.addExact(counter, days);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Advancing " + counter + " by " + days + " days overflows a day counter", e);
        }
    }

    /**
     * Any transaction resets both dormancy timers.
     *
     * @throws IllegalArgumentException if {@code amount} is negative or not a finite number
     */
    public Merchant applyTransaction(Merchant merchant, double amount) {
        if (Double.isNaN(amount) || Double.isInfinite(amount) || amount < 0) {
            throw new IllegalArgumentException("amount must be a non-negative amount, got " + amount);
        }
        return transition(merchant, "TRANSACTION", b -> b
                .balance(merchant.getBalance() + amount)
                .dormantDays(0)
                .operatorDormantDays(0));
    }

    /**
     * Withdraws the whole balance.
     */
    public Merchant applySettlement(Merchant merchant) {
        return transition(merchant, "SETTLEMENT", b -> b.balance(0).dormantDays(0));
    }

    public Merchant applyStartKeyReset(Merchant merchant) {
        return transition(merchant, "START_KEY_RESET", b -> b.startKeyStatus(StartKeyStatus.VALID));
    }

    public Merchant applyNotificationToggle(Merchant merchant) {
        return transition(merchant, "NOTIF_TOGGLE", b -> b.notificationsEnabled(!merchant.isNotificationsEnabled()));
    }

    private Merchant transition(Merchant merchant, String mutation,
                                UnaryOperator<Merchant.MerchantBuilder> change) {
        MerchantValidator.validate(merchant);
        return stamp(change.apply(merchant.toBuilder()), mutation);
    }

    private Merchant stamp(Merchant.MerchantBuilder builder, String mutation) {
        Merchant next = builder
                .lastMutation(mutation)
                .mutatedAt(clock.instant())
                .build();
        return MerchantValidator.validate(next);
    }
}
