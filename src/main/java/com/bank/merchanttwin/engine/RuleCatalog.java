package com.bank.merchanttwin.engine;

import com.bank.merchanttwin.exception.UnknownActionException;
import com.bank.merchanttwin.model.ActionKey;
import com.bank.merchanttwin.model.RuleDefinition;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable pairing of rule metadata with condition tables, one per action.
 * Definitions are held in demand-rank order.
 */
public final class RuleCatalog {

    private final List<RuleDefinition> definitions;
    private final Map<ActionKey, RuleDefinition> definitionsByAction;
    private final Map<ActionKey, ActionRule> rulesByAction;

    public RuleCatalog(Collection<RuleDefinition> definitions, Collection<ActionRule> rules) {
        this.definitions = definitions.stream()
                .sorted(Comparator.comparingInt(RuleDefinition::getDemandRank))
                .collect(Collectors.toUnmodifiableList());

        Map<ActionKey, RuleDefinition> defs = new EnumMap<>(ActionKey.class);
        for (RuleDefinition def : this.definitions) {
            if (defs.put(def.getActionKey(), def) != null) {
                throw new IllegalArgumentException("Duplicate rule definition for " + def.getActionKey());
            }
        }
        Map<ActionKey, ActionRule> byAction = new EnumMap<>(ActionKey.class);
        for (ActionRule rule : rules) {
            if (!defs.containsKey(rule.getActionKey())) {
                throw new IllegalArgumentException("Rule " + rule.getActionKey() + " has no definition");
            }
            if (byAction.put(rule.getActionKey(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule for " + rule.getActionKey());
            }
        }
        for (ActionKey key : defs.keySet()) {
            if (!byAction.containsKey(key)) {
                throw new IllegalArgumentException("Definition " + key + " has no rule");
            }
        }
        this.definitionsByAction = defs;
        this.rulesByAction = byAction;
    }

    public List<RuleDefinition> definitions() {
        return definitions;
    }

    public RuleDefinition definition(ActionKey actionKey) {
        RuleDefinition def = definitionsByAction.get(actionKey);
        if (def == null) {
            throw new UnknownActionException(String.valueOf(actionKey));
        }
        return def;
    }

    public ActionRule rule(ActionKey actionKey) {
        ActionRule rule = rulesByAction.get(actionKey);
        if (rule == null) {
            throw new UnknownActionException(String.valueOf(actionKey));
        }
        return rule;
    }

    public long maxDemandTotal() {
        return definitions.stream().mapToLong(RuleDefinition::getDemandTotal).max().orElse(0);
    }

    public int size() {
        return definitions.size();
    }
}
