package com.bank.merchanttwin.engine;

import com.bank.merchanttwin.model.EvaluationResult;
import com.bank.merchanttwin.model.Outcome;
import com.bank.merchanttwin.model.Severity;

/**
 * Factories for the three verdict shapes a rule condition can produce.
 * Escalation is derived from severity, not chosen per rule.
 */
public final class Verdicts {

    static final String ESCALATE_CRITICAL =
            "Call Safaricom Business: 0722 000 100 (available 24/7 for urgent cases)";
    static final String ESCALATE_HIGH =
            "Call 100 (free) or visit your nearest Safaricom Shop with National ID";
    static final String ESCALATE_STANDARD =
            "Chat via My Safaricom App > Help, or SMS 'HELP' to 100";
    static final String ESCALATE_WARNING =
            "Chat via My Safaricom App > Help";

    private Verdicts() {}

    public static EvaluationResult ok(String inline) {
        return EvaluationResult.builder()
                .outcome(Outcome.PASS)
                .code(EvaluationResult.OK_CODE)
                .inline(inline)
                .build();
    }

    public static EvaluationResult fail(String code, Severity severity, String inline,
                                        String reason, String fix) {
        return EvaluationResult.builder()
                .outcome(Outcome.FAIL)
                .code(code)
                .severity(severity)
                .inline(inline)
                .reason(reason)
                .fix(fix)
                .escalation(escalationFor(severity))
                .build();
    }

    /**
     * The action completes, but with a known degradation.
     */
    public static EvaluationResult warn(String code, Severity severity, String inline,
                                        String reason, String fix) {
        return EvaluationResult.builder()
                .outcome(Outcome.WARN)
                .code(code)
                .severity(severity)
                .inline(inline)
                .reason(reason)
                .fix(fix)
                .escalation(ESCALATE_WARNING)
                .build();
    }

    public static String escalationFor(Severity severity) {
        switch (severity) {
            case CRITICAL:
                return ESCALATE_CRITICAL;
            case HIGH:
                return ESCALATE_HIGH;
            default:
                return ESCALATE_STANDARD;
        }
    }
}
