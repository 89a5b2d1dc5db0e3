package com.bank.merchanttwin.engine;

import com.bank.merchanttwin.exception.InvalidMerchantStateException;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.SimStatus;

/**
 * Checks the sensor invariants of a snapshot. Every engine entry point and
 * every transition runs this on its input, and transitions on their output too.
 */
public final class MerchantValidator {

    public static final int MAX_PIN_ATTEMPTS = 3;

    private MerchantValidator() {}

    public static Merchant validate(Merchant m) {
        if (m == null) {
            throw new IllegalArgumentException("Merchant snapshot must not be null");
        }
        String id = m.getId();

        if (m.getAccountStatus() == null) fail(id, "account_status is missing");
        if (m.getKycStatus() == null) fail(id, "kyc_status is missing");
        if (m.getSimStatus() == null) fail(id, "sim_status is missing");
        if (m.getStartKeyStatus() == null) fail(id, "start_key_status is missing");

        if (m.getKycAgeDays() < 0) fail(id, "kyc_age_days is negative: " + m.getKycAgeDays());
        if (m.getDormantDays() < 0) fail(id, "dormant_days is negative: " + m.getDormantDays());
        if (m.getOperatorDormantDays() < 0) {
            fail(id, "operator_dormant_days is negative: " + m.getOperatorDormantDays());
        }

        if (m.getPinAttempts() < 0 || m.getPinAttempts() > MAX_PIN_ATTEMPTS) {
            fail(id, "pin_attempts out of range 0-3: " + m.getPinAttempts());
        }
        if (m.isPinLocked() != (m.getPinAttempts() >= MAX_PIN_ATTEMPTS)) {
            fail(id, "pin_locked=" + m.isPinLocked() + " disagrees with pin_attempts=" + m.getPinAttempts());
        }

        boolean swapped = m.getSimStatus() == SimStatus.SWAPPED;
        if (swapped && m.getSimSwapDaysAgo() == null) {
            fail(id, "sim_swap_days_ago is required when sim_status is swapped");
        }
        if (!swapped && m.getSimSwapDaysAgo() != null) {
            fail(id, "sim_swap_days_ago must be null when sim_status is " + m.getSimStatus().value());
        }
        if (m.getSimSwapDaysAgo() != null && m.getSimSwapDaysAgo() < 0) {
            fail(id, "sim_swap_days_ago is negative: " + m.getSimSwapDaysAgo());
        }

        if (Double.isNaN(m.getBalance()) || Double.isInfinite(m.getBalance()) || m.getBalance() < 0) {
            fail(id, "balance must be a non-negative amount: " + m.getBalance());
        }
        return m;
    }

    private static void fail(String merchantId, String message) {
        throw new InvalidMerchantStateException(merchantId, message);
    }
}
