package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;

/**
 * Immutable snapshot of one merchant's twin. Profile fields are carried for
 * display and messaging only; rules read the sensor fields.
 *
 * Transitions never mutate a snapshot. They derive a new one with {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class Merchant {

    // Identity
    String id;
    String firstName;
    String middleName;
    String lastName;
    String dateOfBirth;
    String gender;
    String nationality;
    String documentType;
    String documentNumber;

    // Contact
    String phoneNumber;
    String email;
    String county;
    String city;
    String physicalAddress;
    String postalAddress;
    String postalCode;

    // Business
    String businessName;
    String businessCategory;
    String businessRegion;
    String paybill;
    String kraPin;
    String certificateNumber;
    String product;
    String duration;
    String applicationStatus;

    // Bank
    String bank;
    String bankBranch;
    String bankBranchCode;
    String bankAccountName;
    String bankAccount;
    String sourceOfFunds;
    String purposeOfFunds;
    String expectedTurnover;

    // Sensors
    AccountStatus accountStatus;
    KycStatus kycStatus;
    int kycAgeDays;
    SimStatus simStatus;
    Integer simSwapDaysAgo;     // null unless simStatus == SWAPPED
    int pinAttempts;
    boolean pinLocked;
    StartKeyStatus startKeyStatus;
    double balance;
    int dormantDays;
    int operatorDormantDays;
    boolean notificationsEnabled;
    boolean settlementOnHold;

    // Audit
    String lastMutation;
    Instant mutatedAt;
    String suspendReason;
    boolean generated;
    Instant generatedAt;

    public String displayName() {
        return firstName + " " + lastName;
    }

    /**
     * True when the SIM was swapped fewer than {@code days} days ago.
     */
    public boolean simSwappedWithin(int days) {
        return simStatus == SimStatus.SWAPPED && simSwapDaysAgo != null && simSwapDaysAgo < days;
    }

    public static String formatKes(double amount) {
        return String.format(Locale.US, "KES %,.2f", amount);
    }
}
