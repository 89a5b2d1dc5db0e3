package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Declares every merchant field and marks the sensors: live, twin-monitored
 * state that the rules read. Field names follow the upstream paybill payload.
 */
public final class SensorSchema {

    @Value
    @Builder
    public static class FieldSpec {
        String name;
        String type;
        boolean sensor;
        boolean nullable;
        List<String> allowedValues;
        String description;
    }

    private static final List<FieldSpec> FIELDS;

    static {
        List<FieldSpec> f = new ArrayList<>();
        // Identity
        f.add(profile("id", "Unique twin ID, e.g. M001"));
        f.add(profile("first_name", "Applicant first name"));
        f.add(profile("middle_name", "Applicant middle name"));
        f.add(profile("last_name", "Applicant last name"));
        f.add(profile("date_of_birth", "ISO date YYYY-MM-DD"));
        f.add(profile("gender", "Male | Female"));
        f.add(profile("nationality", "e.g. Kenyan"));
        f.add(profile("document_type", "National ID | Passport"));
        f.add(profile("document_number", "ID / passport number"));
        // Contact
        f.add(profile("phone_number", "Primary phone, e.g. 0704737162"));
        f.add(profile("email", "Email address"));
        f.add(profile("county", "e.g. Nairobi"));
        f.add(profile("city", "e.g. Nairobi"));
        f.add(profile("physical_address", "e.g. Roysambu, Nairobi"));
        f.add(profile("postal_address", "Box number"));
        f.add(profile("postal_code", "e.g. 00100"));
        // Business
        f.add(profile("business_name", "Registered business name"));
        f.add(profile("business_category", "Retail | Hardware | Services | etc."));
        f.add(profile("business_region", "e.g. Nairobi"));
        f.add(profile("paybill", "M-PESA paybill number"));
        f.add(profile("kra_pin", "KRA PIN e.g. A0098499583"));
        f.add(profile("certificate_number", "Business certificate number"));
        f.add(profile("product", "Short Term Paybill | Long Term Paybill"));
        f.add(profile("duration", "e.g. 6 months"));
        f.add(profile("application_status", "approved | pending | suspended | frozen"));
        // Bank
        f.add(profile("bank", "Bank name e.g. Equity Bank"));
        f.add(profile("bank_branch", "Branch name e.g. Kasarani"));
        f.add(profile("bank_branch_code", "Branch code"));
        f.add(profile("bank_account_name", "Account name"));
        f.add(profile("bank_account", "Account number"));
        f.add(profile("source_of_funds", "Business income | Investments | etc."));
        f.add(profile("purpose_of_funds", "Business operations | etc."));
        f.add(profile("expected_turnover", "Monthly turnover estimate"));
        // Sensors
        f.add(sensor("account_status", "enum", false, wireValues(Arrays.stream(AccountStatus.values()).map(AccountStatus::value)), "Current account lifecycle state"));
        f.add(sensor("kyc_status", "enum", false, wireValues(Arrays.stream(KycStatus.values()).map(KycStatus::value)), "KYC verification status"));
        f.add(sensor("kyc_age_days", "integer", false, null, "Days since KYC was last verified"));
        f.add(sensor("sim_status", "enum", false, wireValues(Arrays.stream(SimStatus.values()).map(SimStatus::value)), "SIM card status"));
        f.add(sensor("sim_swap_days_ago", "integer", true, null, "Days since last SIM swap (null = never)"));
        f.add(sensor("pin_attempts", "integer", false, null, "Failed PIN attempts (0-3)"));
        f.add(sensor("pin_locked", "boolean", false, null, "True when PIN locked after 3 attempts"));
        f.add(sensor("start_key_status", "enum", false, wireValues(Arrays.stream(StartKeyStatus.values()).map(StartKeyStatus::value)), "Merchant start key state"));
        f.add(sensor("balance", "number", false, null, "Available paybill balance in KES"));
        f.add(sensor("dormant_days", "integer", false, null, "Days since last transaction"));
        f.add(sensor("notifications_enabled", "boolean", false, null, "SMS/Push notifications active"));
        f.add(sensor("settlement_on_hold", "boolean", false, null, "Manual settlement hold applied"));
        f.add(sensor("operator_dormant_days", "integer", false, null, "Days since operator last used the G2 system"));
        FIELDS = Collections.unmodifiableList(f);
    }

    private SensorSchema() {}

    public static List<FieldSpec> fields() {
        return FIELDS;
    }

    public static List<String> sensorFields() {
        return FIELDS.stream()
                .filter(FieldSpec::isSensor)
                .map(FieldSpec::getName)
                .collect(Collectors.toList());
    }

    /**
     * Current sensor readings of a snapshot, keyed and ordered as declared.
     */
    public static Map<String, Object> sensorValues(Merchant m) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("account_status", m.getAccountStatus().value());
        values.put("kyc_status", m.getKycStatus().value());
        values.put("kyc_age_days", m.getKycAgeDays());
        values.put("sim_status", m.getSimStatus().value());
        values.put("sim_swap_days_ago", m.getSimSwapDaysAgo());
        values.put("pin_attempts", m.getPinAttempts());
        values.put("pin_locked", m.isPinLocked());
        values.put("start_key_status", m.getStartKeyStatus().value());
        values.put("balance", m.getBalance());
        values.put("dormant_days", m.getDormantDays());
        values.put("notifications_enabled", m.isNotificationsEnabled());
        values.put("settlement_on_hold", m.isSettlementOnHold());
        values.put("operator_dormant_days", m.getOperatorDormantDays());
        return values;
    }

    private static FieldSpec profile(String name, String description) {
        return FieldSpec.builder().name(name).type("string").sensor(false).description(description).build();
    }

    private static FieldSpec sensor(String name, String type, boolean nullable,
                                    List<String> allowed, String description) {
        return FieldSpec.builder()
                .name(name)
                .type(type)
                .sensor(true)
                .nullable(nullable)
                .allowedValues(allowed)
                .description(description)
                .build();
    }

    private static List<String> wireValues(Stream<String> values) {
        return values.collect(Collectors.toList());
    }
}
