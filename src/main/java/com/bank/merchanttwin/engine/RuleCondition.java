package com.bank.merchanttwin.engine;

import com.bank.merchanttwin.model.EvaluationResult;
import com.bank.merchanttwin.model.Merchant;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of an action's condition table: when the predicate matches, the
 * verdict function produces the result and evaluation stops.
 */
public final class RuleCondition {

    private final Predicate<Merchant> predicate;
    private final Function<Merchant, EvaluationResult> verdict;

    private RuleCondition(Predicate<Merchant> predicate, Function<Merchant, EvaluationResult> verdict) {
        this.predicate = predicate;
        this.verdict = verdict;
    }

    public static RuleCondition when(Predicate<Merchant> predicate,
                                     Function<Merchant, EvaluationResult> verdict) {
        return new RuleCondition(predicate, verdict);
    }

    public boolean matches(Merchant merchant) {
        return predicate.test(merchant);
    }

    public EvaluationResult verdict(Merchant merchant) {
        return verdict.apply(merchant);
    }
}
