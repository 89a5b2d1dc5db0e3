package com.bank.merchanttwin.service;

import com.bank.merchanttwin.engine.MerchantValidator;
import com.bank.merchanttwin.model.AccountStatus;
import com.bank.merchanttwin.model.KycStatus;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.RiskTier;
import com.bank.merchanttwin.model.SensorHealth;
import com.bank.merchanttwin.model.SimStatus;
import com.bank.merchanttwin.model.StartKeyStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Traffic-light view of a merchant's sensors and the coarse risk tier derived
 * from it. Independent of the per-action rule catalog.
 */
@Service
public class RiskClassificationService {

    /**
     * Bucket each sensor into green, amber or red using fixed thresholds.
     * PIN state is reported under {@code pin_locked} when red and
     * {@code pin_attempts} otherwise.
     */
    public SensorHealth sensorHealth(Merchant merchant) {
        MerchantValidator.validate(merchant);
        List<String> green = new ArrayList<>();
        List<String> amber = new ArrayList<>();
        List<String> red = new ArrayList<>();

        if (merchant.getAccountStatus() != AccountStatus.ACTIVE) red.add("account_status");
        else green.add("account_status");

        if (merchant.getKycStatus() == KycStatus.EXPIRED) red.add("kyc_status");
        else if (merchant.getKycStatus() == KycStatus.PENDING) amber.add("kyc_status");
        else green.add("kyc_status");

        if (merchant.isPinLocked()) red.add("pin_locked");
        else if (merchant.getPinAttempts() >= 2) amber.add("pin_attempts");
        else green.add("pin_attempts");

        if (merchant.getStartKeyStatus() != StartKeyStatus.VALID) red.add("start_key_status");
        else green.add("start_key_status");

        if (merchant.getSimStatus() == SimStatus.UNREGISTERED) red.add("sim_status");
        else if (merchant.getSimStatus() == SimStatus.SWAPPED) amber.add("sim_status");
        else green.add("sim_status");

        if (merchant.getDormantDays() >= 60) red.add("dormant_days");
        else if (merchant.getDormantDays() >= 30) amber.add("dormant_days");
        else green.add("dormant_days");

        if (!merchant.isNotificationsEnabled()) amber.add("notifications");
        else green.add("notifications");

        if (merchant.isSettlementOnHold()) red.add("settlement_on_hold");
        else green.add("settlement_on_hold");

        if (merchant.getOperatorDormantDays() >= 90) red.add("operator_dormant");
        else if (merchant.getOperatorDormantDays() >= 60) amber.add("operator_dormant");
        else green.add("operator_dormant");

        int total = green.size() + amber.size() + red.size();
        return SensorHealth.builder()
                .green(List.copyOf(green))
                .amber(List.copyOf(amber))
                .red(List.copyOf(red))
                .score(Math.round((double) green.size() / total * 1000.0) / 1000.0)
                .build();
    }

    public RiskTier riskTier(Merchant merchant) {
        return riskTier(merchant, sensorHealth(merchant));
    }

    RiskTier riskTier(Merchant merchant, SensorHealth health) {
        return RiskTier.fromSensorCounts(health.getRed().size(), health.getAmber().size(),
                merchant.getAccountStatus() == AccountStatus.FROZEN);
    }
}
