package com.bank.merchanttwin.engine;

import com.bank.merchanttwin.model.AccountStatus;
import com.bank.merchanttwin.model.ActionKey;
import com.bank.merchanttwin.model.KycStatus;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.RuleDefinition;
import com.bank.merchanttwin.model.SimStatus;
import com.bank.merchanttwin.model.StartKeyStatus;

import java.util.List;

import static com.bank.merchanttwin.engine.RuleCondition.when;
import static com.bank.merchanttwin.engine.Verdicts.fail;
import static com.bank.merchanttwin.engine.Verdicts.ok;
import static com.bank.merchanttwin.engine.Verdicts.warn;
import static com.bank.merchanttwin.model.Severity.CRITICAL;
import static com.bank.merchanttwin.model.Severity.HIGH;
import static com.bank.merchanttwin.model.Severity.LOW;
import static com.bank.merchanttwin.model.Severity.MEDIUM;

/**
 * The production catalog: twelve actions ranked by Oct-Dec 2025 contact-centre
 * demand, each with its priority-ordered blocking conditions.
 *
 * Policy changes belong here as table edits. Messages may quote merchant data
 * but never clocks or random values, so evaluation stays deterministic.
 */
public final class DefaultRuleCatalog {

    static final int KYC_VALIDITY_DAYS = 365;
    static final int OPERATOR_DORMANT_LOCK_DAYS = 90;

    private DefaultRuleCatalog() {}

    public static RuleCatalog create() {
        return new RuleCatalog(definitions(), rules());
    }

    public static List<RuleDefinition> definitions() {
        return List.of(
                definition(ActionKey.SETTLE_FUNDS, "Withdraw / Settle Funds", 1, 14144,
                        "Lipa na M-PESA > Withdraw / Settle Funds", "*234# > 1 > 1",
                        "Merchant withdraws accumulated paybill balance to their bank account."),
                definition(ActionKey.PIN_PUK, "Change / Reset PIN", 2, 11353,
                        "Security & PIN > Change / Reset PIN", "*234# > 2 > 1",
                        "Merchant changes or resets their M-PESA Business PIN."),
                definition(ActionKey.SIM_SWAP, "SIM Swap Request", 3, 10076,
                        "SIM & Operator > SIM Swap Request", "*234# > 4 > 1",
                        "Merchant requests replacement SIM for their registered number."),
                definition(ActionKey.ACCOUNT_STATUS, "Account Status & Issues", 4, 9951,
                        "My Account > Account Status & Issues", "*234# > 3 > 1",
                        "Merchant checks or resolves account suspension / freeze."),
                definition(ActionKey.START_KEY, "Reset Start Key", 5, 9303,
                        "Security & PIN > Reset Start Key", "*234# > 2 > 3",
                        "Merchant resets the start key used to authenticate transactions."),
                definition(ActionKey.STATEMENT, "Mini Statement", 6, 8330,
                        "Lipa na M-PESA > Mini Statement", "*234# > 1 > 3",
                        "Merchant requests a transaction statement for the last 90 days."),
                definition(ActionKey.KYC_CHANGE, "Update KYC Details", 7, 8157,
                        "My Account > Update KYC Details", "*234# > 3 > 2",
                        "Merchant updates identity or business KYC information."),
                definition(ActionKey.NOTIFICATIONS, "Notification Settings", 8, 5013,
                        "My Account > Notification Settings", "*234# > 3 > 4",
                        "Merchant manages SMS and push notification preferences."),
                definition(ActionKey.BALANCE, "Balance Enquiry", 9, 4439,
                        "Lipa na M-PESA > Balance Enquiry", "*234# > 1 > 2",
                        "Merchant checks available paybill balance."),
                definition(ActionKey.DORMANT_OP, "Operator Status", 10, 3778,
                        "SIM & Operator > Operator Status", "*234# > 4 > 2",
                        "Merchant checks G2 operator active status and dormancy days."),
                definition(ActionKey.PIN_UNLOCK, "Unlock PIN", 11, 3788,
                        "Security & PIN > Unlock PIN", "*234# > 2 > 2",
                        "Merchant unlocks their PIN after security lockout."),
                definition(ActionKey.APPLICATION, "New Application", 12, 3483,
                        "My Account > New Application", "*234# > 3 > 3",
                        "Merchant submits a new paybill or product application.")
        );
    }

    public static List<ActionRule> rules() {
        return List.of(
                settleFunds(), pinPuk(), simSwap(), accountStatus(), startKey(), statement(),
                kycChange(), notifications(), balance(), dormantOperator(), pinUnlock(), application());
    }

    // Rank 1: blocked by suspension, freeze, hold, expired KYC, recent SIM swap, empty balance
    static ActionRule settleFunds() {
        return new ActionRule(ActionKey.SETTLE_FUNDS, List.of(
                when(m -> m.getAccountStatus() == AccountStatus.SUSPENDED, m -> fail("ACC_SUSPENDED", CRITICAL,
                        "Your account is suspended. Settlement is blocked.",
                        "Account suspension prevents all fund disbursements until resolved.",
                        "Visit the nearest Safaricom Shop or call 100 with your National ID to resolve the suspension.")),
                when(m -> m.getAccountStatus() == AccountStatus.FROZEN, m -> fail("ACC_FROZEN", CRITICAL,
                        "Account frozen: settlement on hold pending compliance review.",
                        "A compliance hold prevents outflows. It is triggered by regulatory review or KYC overdue beyond 365 days.",
                        "Contact Safaricom Business Compliance on 0722 000 100 to initiate account unfreeze.")),
                when(Merchant::isSettlementOnHold, m -> fail("SETTLE_HOLD", HIGH,
                        "Settlement is manually on hold for your paybill " + m.getPaybill() + ".",
                        "A settlement hold has been applied, often after a dispute or fraud investigation.",
                        "Call 100 and reference your paybill " + m.getPaybill() + " to request hold removal.")),
                when(m -> m.getKycStatus() == KycStatus.EXPIRED, m -> fail("KYC_EXPIRED", HIGH,
                        "Settlement blocked: your KYC documents have expired.",
                        "Valid KYC is required for all fund settlements. Your KYC is " + m.getKycAgeDays() + " days old.",
                        "Update KYC at any Safaricom Shop. Bring: National ID + business certificate.")),
                when(m -> m.simSwappedWithin(30), m -> fail("SIM_SWAP_HOLD", MEDIUM,
                        "Settlement locked for " + (30 - m.getSimSwapDaysAgo()) + " more day(s) after SIM swap.",
                        "A 30-day fraud prevention hold applies after every SIM swap event.",
                        "Wait " + (30 - m.getSimSwapDaysAgo())
                                + " day(s) or visit Safaricom Shop with original ID to request early lift.")),
                when(m -> m.getBalance() <= 0, m -> fail("ZERO_BALANCE", HIGH,
                        "No balance available to settle.",
                        "Your paybill has zero balance, so there is nothing to disburse.",
                        "Accept customer payments to accumulate balance, then initiate settlement."))
        ), m -> "Settlement of " + Merchant.formatKes(m.getBalance()) + " processed to " + m.getBankAccountName()
                + " (" + m.getBank() + "). Funds arrive within 24 working hours.");
    }

    // Rank 2
    static ActionRule pinPuk() {
        return new ActionRule(ActionKey.PIN_PUK, List.of(
                when(m -> m.getAccountStatus() == AccountStatus.SUSPENDED, m -> fail("ACC_SUSPENDED", CRITICAL,
                        "PIN operations are blocked: account is suspended.",
                        "Account suspension restricts all authentication and security operations.",
                        "Resolve the account suspension first by calling 100 or visiting Safaricom Shop.")),
                when(Merchant::isPinLocked, m -> fail("PIN_LOCKED", HIGH,
                        "Account locked after 3 failed PIN attempts.",
                        "Security lockout is triggered automatically after 3 consecutive wrong PINs.",
                        "Visit any Safaricom Shop with your National ID for PIN reset. "
                                + "USSD/App self-service is unavailable after lockout.")),
                when(m -> m.simSwappedWithin(7), m -> fail("SIM_SWAP_RECENT", MEDIUM,
                        "PIN request blocked: SIM swap was " + m.getSimSwapDaysAgo() + " day(s) ago (7-day hold).",
                        "A 7-day security hold prevents PIN changes immediately after SIM swap.",
                        "Wait " + (7 - m.getSimSwapDaysAgo()) + " more day(s) or visit Safaricom Shop in person."))
        ), m -> "PIN/PUK request initiated. A confirmation SMS will be sent to " + m.getPhoneNumber()
                + " within 2 minutes.");
    }

    // Rank 3
    static ActionRule simSwap() {
        return new ActionRule(ActionKey.SIM_SWAP, List.of(
                when(m -> m.getAccountStatus() == AccountStatus.FROZEN, m -> fail("ACC_FROZEN", CRITICAL,
                        "SIM swap not permitted: account is frozen.",
                        "Frozen accounts cannot process identity changes until the freeze is lifted.",
                        "Request account unfreeze via 0722 000 100, then retry SIM swap.")),
                when(m -> m.getAccountStatus() == AccountStatus.SUSPENDED, m -> fail("ACC_SUSPENDED", CRITICAL,
                        "SIM swap blocked: account is suspended.",
                        "Suspended accounts cannot initiate SIM swaps.",
                        "Resolve the suspension first by calling 100 or visiting Safaricom Shop.")),
                when(m -> m.getKycStatus() == KycStatus.EXPIRED, m -> fail("KYC_EXPIRED", HIGH,
                        "SIM swap requires valid KYC. Yours expired "
                                + Math.max(0, m.getKycAgeDays() - KYC_VALIDITY_DAYS) + " day(s) ago.",
                        "Valid KYC must be on file for SIM swap.",
                        "Renew KYC at any Safaricom Shop before proceeding with SIM swap.")),
                when(m -> m.getKycStatus() == KycStatus.PENDING, m -> fail("KYC_PENDING", MEDIUM,
                        "SIM swap on hold: KYC review is still in progress.",
                        "Cannot process SIM swap while KYC is actively under review.",
                        "Wait 24-48hrs for KYC approval, or visit Safaricom Shop to expedite review.")),
                when(Merchant::isPinLocked, m -> fail("PIN_LOCKED", HIGH,
                        "Cannot process SIM swap: PIN is locked.",
                        "A valid PIN is required to authenticate the SIM swap request.",
                        "Reset PIN at Safaricom Shop first, then retry SIM swap."))
        ), m -> "SIM swap initiated. Present your National ID at any Safaricom Shop. Reference: SWP-"
                + m.getPaybill() + ". Processing takes 2-4 hours.");
    }

    // Rank 4: a fully healthy account short-circuits to a pass before any block is considered
    static ActionRule accountStatus() {
        return new ActionRule(ActionKey.ACCOUNT_STATUS, List.of(
                when(m -> m.getAccountStatus() == AccountStatus.ACTIVE && m.getDormantDays() < 30
                                && m.getKycStatus() == KycStatus.VERIFIED,
                        m -> ok("Account is fully active. KYC: VERIFIED. Last activity: " + m.getDormantDays()
                                + " day(s) ago. All services operational.")),
                when(m -> m.getKycAgeDays() > KYC_VALIDITY_DAYS, m -> fail("KYC_OVERDUE_365", CRITICAL,
                        "Account frozen: KYC overdue by " + (m.getKycAgeDays() - KYC_VALIDITY_DAYS) + " day(s).",
                        "Accounts with KYC older than 1 year are automatically frozen per compliance policy.",
                        "Renew KYC immediately at any Safaricom Shop. Bring: National ID, Business Certificate, KRA PIN.")),
                when(m -> m.getDormantDays() >= 90, m -> fail("FULLY_DORMANT", CRITICAL,
                        "Account suspended: no transactions in " + m.getDormantDays() + " days.",
                        "Accounts with no activity for 90+ days are automatically suspended by the dormancy system.",
                        "Visit Safaricom Shop or call 100 to reactivate. A transaction history review will be required.")),
                when(m -> m.getDormantDays() >= 60, m -> fail("DORMANT_60", HIGH,
                        "Account suspended: inactive for " + m.getDormantDays() + " days.",
                        "Dormancy suspension is triggered at 60 days of inactivity.",
                        "Call 100 or visit Safaricom Shop with National ID to reactivate your account.")),
                when(m -> m.getAccountStatus() == AccountStatus.FROZEN, m -> fail("COMPLIANCE_FREEZE", CRITICAL,
                        "Account is under a compliance freeze. All services restricted.",
                        "The compliance team has placed a hold on your account for regulatory review.",
                        "Contact Safaricom Business Compliance: 0722 000 100. Have paybill "
                                + m.getPaybill() + " and ID ready.")),
                when(m -> m.getAccountStatus() == AccountStatus.SUSPENDED, m -> fail("COMPLIANCE_HOLD", HIGH,
                        "Account is suspended. Services are restricted.",
                        "Account suspension may be due to inactivity, compliance review, or manual hold.",
                        "Call 100 or visit Safaricom Shop with National ID to resolve and reactivate."))
        ), m -> "Account status: " + m.getAccountStatus().name() + ". KYC: " + m.getKycStatus().name()
                + ". Dormant days: " + m.getDormantDays() + ". Review required.");
    }

    // Rank 5
    static ActionRule startKey() {
        return new ActionRule(ActionKey.START_KEY, List.of(
                when(m -> m.getStartKeyStatus() == StartKeyStatus.EXPIRED, m -> fail("START_KEY_EXPIRED", CRITICAL,
                        "Start key expired: you cannot send or receive any payments.",
                        "An expired start key breaks the merchant payment pipeline. Customers cannot pay you.",
                        "Request urgent start key renewal via the Safaricom Business portal or call 100 immediately.")),
                when(m -> m.getStartKeyStatus() == StartKeyStatus.INVALID, m -> fail("START_KEY_CORRUPT", CRITICAL,
                        "Start key is corrupted. Customer payments are actively failing.",
                        "Key corruption is caused by SIM swap without re-registration, or a system error. "
                                + "Payments fail silently.",
                        "Visit any Safaricom Shop immediately with National ID. "
                                + "Request emergency start key regeneration.")),
                when(m -> m.getAccountStatus() != AccountStatus.ACTIVE, m -> fail("ACC_NOT_ACTIVE", HIGH,
                        "Start key reset requires an active account.",
                        "Key operations are locked when account is " + m.getAccountStatus().value() + ".",
                        "Reactivate the account first, then retry the start key reset.")),
                when(m -> m.simSwappedWithin(2), m -> fail("SIM_SWAP_KEY_HOLD", MEDIUM,
                        "Start key reset available in " + (2 - m.getSimSwapDaysAgo()) + " day(s): SIM swap too recent.",
                        "System requires SIM stabilisation before issuing new start key.",
                        "Wait 1-2 days after SIM swap, then retry. Or visit Safaricom Shop for same-day resolution."))
        ), m -> "Start key reset successful. New key provisioned to " + m.getPhoneNumber()
                + ". Key activates within 5 minutes. Test a payment to confirm.");
    }

    // Rank 6: disabled notifications degrade delivery but do not block generation
    static ActionRule statement() {
        return new ActionRule(ActionKey.STATEMENT, List.of(
                when(m -> m.getAccountStatus() == AccountStatus.SUSPENDED, m -> fail("ACC_SUSPENDED", MEDIUM,
                        "Statement access restricted: account is suspended.",
                        "Suspended accounts have limited portal access. Full statements are unavailable.",
                        "Call 100 for a partial statement via agent access. Resolve suspension to restore full access.")),
                when(m -> m.getAccountStatus() == AccountStatus.FROZEN, m -> fail("ACC_FROZEN", MEDIUM,
                        "Statement access restricted: account is under compliance freeze.",
                        "Frozen accounts have read-restricted access. Statement generation is paused.",
                        "Contact the compliance team on 0722 000 100 to request a statement during the freeze period.")),
                when(m -> !m.isNotificationsEnabled(), m -> warn("NOTIF_OFF", LOW,
                        "Statement generated but cannot be delivered: notifications are disabled.",
                        "SMS and email notifications are turned off. The statement was created but won't be sent.",
                        "Enable notifications: App > Settings > Notifications > Enable All. Then request statement again."))
        ), m -> "Statement for paybill " + m.getPaybill() + " generated and sent to " + m.getEmail() + " and "
                + m.getPhoneNumber() + ". Covers last 90 days.");
    }

    // Rank 7
    static ActionRule kycChange() {
        return new ActionRule(ActionKey.KYC_CHANGE, List.of(
                when(m -> m.getAccountStatus() == AccountStatus.FROZEN, m -> fail("ACC_FROZEN", CRITICAL,
                        "KYC changes blocked: account is frozen.",
                        "Frozen accounts require compliance clearance before any KYC modifications.",
                        "Request account unfreeze first via 0722 000 100, then resubmit KYC change.")),
                when(m -> m.simSwappedWithin(14), m -> fail("SIM_SWAP_KYC_HOLD", MEDIUM,
                        "KYC change blocked: " + (14 - m.getSimSwapDaysAgo()) + " day(s) remaining on post-SIM swap hold.",
                        "A 14-day fraud prevention hold restricts KYC changes after every SIM swap.",
                        "Wait " + (14 - m.getSimSwapDaysAgo())
                                + " day(s), or visit Safaricom Shop in person for an assisted KYC update.")),
                when(m -> m.getKycStatus() == KycStatus.PENDING, m -> fail("KYC_REVIEW_ACTIVE", MEDIUM,
                        "KYC change locked: a review is already in progress.",
                        "You cannot modify KYC details while an existing review is active.",
                        "Wait 24-48 hours for current review to complete, then submit your changes."))
        ), m -> "KYC update submitted for paybill " + m.getPaybill()
                + ". Review expected within 24-48 hours. Reference: KYC-" + m.getDocumentNumber() + ".");
    }

    // Rank 8
    static ActionRule notifications() {
        return new ActionRule(ActionKey.NOTIFICATIONS, List.of(
                when(m -> !m.isNotificationsEnabled(), m -> fail("NOTIF_DISABLED", LOW,
                        "Notifications are OFF: you will miss payment alerts, settlement SMS, and security warnings.",
                        "Notifications are disabled, causing missed payment confirmations and delayed fraud alerts.",
                        "Enable via: App > Settings > Notifications > Enable All. Or: *234# > 3 > 4.")),
                when(m -> m.getSimStatus() == SimStatus.SWAPPED, m -> fail("SIM_NOTIF_UNREG", MEDIUM,
                        "New SIM not registered: notifications are going to your old number.",
                        "SIM swap does not re-register notification channels. Your old SIM receives alerts.",
                        "Update via: *234# > My Account > Update Phone Number, or visit Safaricom Shop.")),
                when(m -> m.getAccountStatus() != AccountStatus.ACTIVE, m -> fail("ACC_INACTIVE_NOTIF", MEDIUM,
                        "Notifications are paused while account is " + m.getAccountStatus().value() + ".",
                        "Non-active accounts have notification services suspended as part of account lifecycle policy.",
                        "Reactivate the account to restore full notification delivery."))
        ), m -> "Notification test sent to " + m.getPhoneNumber() + " and " + m.getEmail()
                + ". All channels are operational.");
    }

    // Rank 9
    static ActionRule balance() {
        return new ActionRule(ActionKey.BALANCE, List.of(
                when(m -> m.getAccountStatus() == AccountStatus.FROZEN, m -> fail("ACC_FROZEN_BAL", MEDIUM,
                        "Balance display restricted: account is frozen.",
                        "Frozen accounts have read-limited access. Balance cannot be confirmed via self-service.",
                        "Contact 0722 000 100 for a balance confirmation from a Safaricom agent.")),
                when(Merchant::isPinLocked, m -> fail("PIN_LOCKED_BAL", HIGH,
                        "Balance enquiry unavailable: PIN is locked.",
                        "PIN lockout restricts all authenticated account actions including balance checks.",
                        "Reset PIN at any Safaricom Shop with National ID, then retry balance enquiry."))
        ), m -> "Available Balance: " + Merchant.formatKes(m.getBalance()) + " | Paybill: " + m.getPaybill()
                + " | Last activity: " + m.getDormantDays() + " day(s) ago.");
    }

    // Rank 10: operator dormancy escalates notice -> warning -> revocation
    static ActionRule dormantOperator() {
        return new ActionRule(ActionKey.DORMANT_OP, List.of(
                when(m -> m.getOperatorDormantDays() >= OPERATOR_DORMANT_LOCK_DAYS, m -> fail("OP_FULLY_DORMANT", CRITICAL,
                        "Operator access revoked: inactive for " + m.getOperatorDormantDays() + " days.",
                        "G2 operator permissions are revoked after 90 days without login or transaction.",
                        "Visit Safaricom Shop for operator reactivation. "
                                + "Bring: National ID + business registration documents.")),
                when(m -> m.getOperatorDormantDays() >= 60, m -> fail("OP_DORMANT_WARN", HIGH,
                        "Operator approaching dormancy lock (" + m.getOperatorDormantDays() + "/90 days inactive).",
                        "Operator will be fully locked in "
                                + (OPERATOR_DORMANT_LOCK_DAYS - m.getOperatorDormantDays()) + " day(s) if no action is taken.",
                        "Initiate any transaction or G2 login now to reset your dormancy timer.")),
                when(m -> m.getOperatorDormantDays() >= 30, m -> warn("OP_DORMANT_NOTICE", LOW,
                        "Operator inactive for " + m.getOperatorDormantDays() + " days. Dormancy warning at 60 days.",
                        "Early notice: operator has been inactive for " + m.getOperatorDormantDays() + " days.",
                        "Make a transaction soon to prevent dormancy escalation."))
        ), m -> "Operator is active. Last activity " + m.getOperatorDormantDays()
                + " day(s) ago. Dormancy warning triggers at 60 days.");
    }

    // Rank 11: nothing to unlock short-circuits to a pass
    static ActionRule pinUnlock() {
        return new ActionRule(ActionKey.PIN_UNLOCK, List.of(
                when(m -> !m.isPinLocked(), m -> ok("PIN is not locked. Current failed attempts: "
                        + m.getPinAttempts() + "/3. No unlock needed.")),
                when(m -> m.getAccountStatus() == AccountStatus.SUSPENDED, m -> fail("ACC_SUSPENDED_UNLOCK", CRITICAL,
                        "Cannot unlock PIN: account is suspended.",
                        "Account suspension blocks all authentication management including PIN unlock.",
                        "Resolve the suspension first (call 100), then proceed with PIN unlock.")),
                when(m -> m.getKycStatus() == KycStatus.EXPIRED, m -> fail("KYC_EXPIRED_UNLOCK", HIGH,
                        "PIN unlock requires valid KYC. Your KYC has expired.",
                        "Identity verification for PIN unlock fails when KYC is expired.",
                        "Renew KYC at Safaricom Shop, then return for PIN unlock via OTP.")),
                when(m -> m.simSwappedWithin(7), m -> fail("SIM_SWAP_PIN_UNLOCK", MEDIUM,
                        "PIN unlock blocked: SIM swap too recent (" + m.getSimSwapDaysAgo() + " day(s) ago).",
                        "OTP for PIN unlock cannot be sent to a new SIM within 7 days of swap.",
                        "Wait " + (7 - m.getSimSwapDaysAgo())
                                + " more day(s), or visit Safaricom Shop in person for immediate unlock."))
        ), m -> "PIN unlock OTP sent to " + m.getPhoneNumber()
                + ". Enter the code within 5 minutes to complete unlock.");
    }

    // Rank 12
    static ActionRule application() {
        return new ActionRule(ActionKey.APPLICATION, List.of(
                when(m -> m.getKycStatus() == KycStatus.EXPIRED, m -> fail("KYC_EXPIRED_APP", HIGH,
                        "Application rejected: KYC has expired.",
                        "All new applications require valid KYC on file. Your KYC expired "
                                + Math.max(0, m.getKycAgeDays() - KYC_VALIDITY_DAYS) + " day(s) ago.",
                        "Renew KYC first. Required documents: National ID, Business Certificate, KRA PIN.")),
                when(m -> m.getKycStatus() == KycStatus.PENDING, m -> fail("KYC_PENDING_APP", MEDIUM,
                        "Application on hold: KYC review is in progress.",
                        "New applications cannot be processed while a KYC review is active for the same merchant.",
                        "Wait 24-48hrs for current KYC review to complete, then resubmit.")),
                when(m -> m.getAccountStatus() == AccountStatus.SUSPENDED, m -> fail("ACC_SUSPENDED_APP", CRITICAL,
                        "Application blocked: account is suspended.",
                        "Suspended merchants cannot initiate new product applications.",
                        "Resolve the suspension first, then resubmit your application.")),
                when(m -> m.getAccountStatus() == AccountStatus.FROZEN, m -> fail("ACC_FROZEN_APP", CRITICAL,
                        "Application blocked: account is frozen.",
                        "Frozen accounts cannot initiate new applications until the compliance freeze is lifted.",
                        "Contact the compliance team to unfreeze, then resubmit."))
        ), m -> "Application submitted for paybill " + m.getPaybill() + ". Reference: APP-" + m.getPaybill()
                + ". Expected review: 3-5 business days.");
    }

    private static RuleDefinition definition(ActionKey key, String label, int rank, long demandTotal,
                                              String menuPath, String ussdPath, String description) {
        return RuleDefinition.builder()
                .actionKey(key)
                .label(label)
                .demandRank(rank)
                .demandTotal(demandTotal)
                .menuPath(menuPath)
                .ussdPath(ussdPath)
                .description(description)
                .build();
    }
}
