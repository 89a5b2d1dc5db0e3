package com.bank.merchanttwin.service;

import com.bank.merchanttwin.engine.MerchantValidator;
import com.bank.merchanttwin.model.AccountStatus;
import com.bank.merchanttwin.model.ContactPropensity;
import com.bank.merchanttwin.model.KycStatus;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.PropensityTier;
import com.bank.merchanttwin.model.SimStatus;
import com.bank.merchanttwin.model.StartKeyStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores how likely a merchant is to call the contact centre within 7 days,
 * from how close each sensor sits to its failure threshold.
 */
@Service
public class ContactPropensityService {

    static final int MAX_SCORE = 100;

    public ContactPropensity predict(Merchant merchant) {
        MerchantValidator.validate(merchant);
        List<String> factors = new ArrayList<>();
        int score = 0;

        if (merchant.getAccountStatus() == AccountStatus.SUSPENDED) {
            score += add(factors, "Account suspended", 30);
        } else if (merchant.getAccountStatus() == AccountStatus.FROZEN) {
            score += add(factors, "Account frozen", 35);
        }

        // KYC expires at 365 days
        if (merchant.getKycStatus() == KycStatus.EXPIRED) {
            score += add(factors, "KYC expired", 25);
        } else if (merchant.getKycAgeDays() > 300) {
            score += add(factors, "KYC aging " + merchant.getKycAgeDays() + "d", 15);
        } else if (merchant.getKycAgeDays() > 240) {
            score += add(factors, "KYC aging " + merchant.getKycAgeDays() + "d", 8);
        }

        if (merchant.isPinLocked()) {
            score += add(factors, "PIN locked", 20);
        } else if (merchant.getPinAttempts() == 2) {
            score += add(factors, "2 PIN attempts", 12);
        }

        if (merchant.getSimStatus() == SimStatus.SWAPPED) {
            int daysAgo = merchant.getSimSwapDaysAgo();
            if (daysAgo < 7) {
                score += add(factors, "SIM swap " + daysAgo + "d ago", 18);
            } else if (daysAgo < 30) {
                score += add(factors, "SIM swap " + daysAgo + "d ago", 10);
            }
        }

        if (merchant.getStartKeyStatus() == StartKeyStatus.EXPIRED) {
            score += add(factors, "Start key expired", 22);
        } else if (merchant.getStartKeyStatus() == StartKeyStatus.INVALID) {
            score += add(factors, "Start key invalid", 18);
        }

        if (merchant.getDormantDays() >= 60) {
            score += add(factors, "Dormant " + merchant.getDormantDays() + "d", 20);
        } else if (merchant.getDormantDays() >= 45) {
            score += add(factors, "Dormant " + merchant.getDormantDays() + "d", 12);
        } else if (merchant.getDormantDays() >= 30) {
            score += add(factors, "Dormant " + merchant.getDormantDays() + "d", 6);
        }

        if (!merchant.isNotificationsEnabled()) {
            score += add(factors, "Notifications off", 8);
        }
        if (merchant.isSettlementOnHold()) {
            score += add(factors, "Settlement on hold", 10);
        }
        if (merchant.getOperatorDormantDays() >= 60) {
            score += add(factors, "Operator dormant " + merchant.getOperatorDormantDays() + "d", 10);
        }

        int capped = Math.min(score, MAX_SCORE);
        return ContactPropensity.builder()
                .merchantId(merchant.getId())
                .score(capped)
                .tier(PropensityTier.fromScore(capped))
                .factors(List.copyOf(factors))
                .build();
    }

    private static int add(List<String> factors, String factor, int points) {
        factors.add(factor + " (+" + points + ")");
        return points;
    }
}
