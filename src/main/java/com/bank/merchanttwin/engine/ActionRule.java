package com.bank.merchanttwin.engine;

import com.bank.merchanttwin.model.ActionKey;
import com.bank.merchanttwin.model.EvaluationResult;
import com.bank.merchanttwin.model.Merchant;

import java.util.List;
import java.util.function.Function;

/**
 * Priority-ordered conditions for one action. The first matching condition
 * decides the verdict; if none matches the action passes with
 * {@code passMessage}.
 */
public final class ActionRule {

    private final ActionKey actionKey;
    private final List<RuleCondition> conditions;
    private final Function<Merchant, String> passMessage;

    public ActionRule(ActionKey actionKey, List<RuleCondition> conditions,
                      Function<Merchant, String> passMessage) {
        this.actionKey = actionKey;
        this.conditions = List.copyOf(conditions);
        this.passMessage = passMessage;
    }

    public ActionKey getActionKey() {
        return actionKey;
    }

    public List<RuleCondition> getConditions() {
        return conditions;
    }

    public EvaluationResult evaluate(Merchant merchant) {
        for (RuleCondition condition : conditions) {
            if (condition.matches(merchant)) {
                return condition.verdict(merchant).toBuilder().actionKey(actionKey).build();
            }
        }
        return Verdicts.ok(passMessage.apply(merchant)).toBuilder().actionKey(actionKey).build();
    }
}
