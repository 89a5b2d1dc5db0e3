package com.bank.merchanttwin.engine;

import com.bank.merchanttwin.model.ActionKey;
import com.bank.merchanttwin.model.EvaluationResult;
import com.bank.merchanttwin.model.Failure;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.MerchantScanResult;
import com.bank.merchanttwin.model.MerchantSummary;
import com.bank.merchanttwin.model.Outcome;
import com.bank.merchanttwin.model.RuleDefinition;
import com.bank.merchanttwin.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates the rule catalog against merchant snapshots.
 * Every operation is a pure function of the snapshot it is given.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final RuleCatalog catalog;

    public RuleEngine(RuleCatalog catalog) {
        this.catalog = catalog;

        for (RuleDefinition def : catalog.definitions()) {
            log.info("Registered rule: #{} {} -> {} condition(s)",
                    def.getDemandRank(), def.getActionKey(), catalog.rule(def.getActionKey()).getConditions().size());
        }
    }

    public List<RuleDefinition> ruleCatalog() {
        return catalog.definitions();
    }

    public RuleDefinition definition(ActionKey actionKey) {
        return catalog.definition(actionKey);
    }

    /**
     * Evaluate one action against a snapshot. Only the highest-priority
     * blocking condition is reported.
     *
     * @throws com.bank.merchanttwin.exception.InvalidMerchantStateException if the snapshot breaks an invariant
     */
    public EvaluationResult evaluate(Merchant merchant, ActionKey actionKey) {
        MerchantValidator.validate(merchant);
        return catalog.rule(actionKey).evaluate(merchant);
    }

    /**
     * @throws com.bank.merchanttwin.exception.UnknownActionException if the key is not in the catalog
     */
    public EvaluationResult evaluate(Merchant merchant, String actionKey) {
        return evaluate(merchant, ActionKey.fromKey(actionKey));
    }

    /**
     * Results for every action in demand-rank order, passes included.
     */
    public Map<ActionKey, EvaluationResult> evaluateAll(Merchant merchant) {
        MerchantValidator.validate(merchant);
        Map<ActionKey, EvaluationResult> results = new EnumMap<>(ActionKey.class);
        for (RuleDefinition def : catalog.definitions()) {
            results.put(def.getActionKey(), catalog.rule(def.getActionKey()).evaluate(merchant));
        }
        return results;
    }

    public List<Failure> scanAll(Merchant merchant) {
        return failures(evaluateAll(merchant));
    }

    public MerchantSummary summarize(Merchant merchant) {
        return summarize(evaluateAll(merchant));
    }

    /**
     * Failures and summary derived from a single evaluation pass.
     */
    public MerchantScanResult scan(Merchant merchant) {
        Map<ActionKey, EvaluationResult> results = evaluateAll(merchant);
        return MerchantScanResult.builder()
                .merchant(merchant)
                .summary(summarize(results))
                .failures(failures(results))
                .build();
    }

    private List<Failure> failures(Map<ActionKey, EvaluationResult> results) {
        List<Failure> failures = new ArrayList<>();
        for (EvaluationResult result : results.values()) {
            if (result.isPassing()) {
                continue;
            }
            RuleDefinition def = catalog.definition(result.getActionKey());
            failures.add(Failure.builder()
                    .actionLabel(def.getLabel())
                    .demandRank(def.getDemandRank())
                    .demandTotal(def.getDemandTotal())
                    .menuPath(def.getMenuPath())
                    .ussdPath(def.getUssdPath())
                    .result(result)
                    .build());
        }
        failures.sort(Failure.RISK_ORDER);
        return failures;
    }

    private MerchantSummary summarize(Map<ActionKey, EvaluationResult> results) {
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0);
        }
        int passing = 0;
        int warnings = 0;
        long callsAtRisk = 0;

        for (EvaluationResult result : results.values()) {
            if (result.isPassing()) {
                passing++;
                continue;
            }
            if (result.getOutcome() == Outcome.WARN) {
                warnings++;
            }
            bySeverity.merge(result.getSeverity(), 1, Integer::sum);
            callsAtRisk += catalog.definition(result.getActionKey()).getDemandTotal();
        }

        return MerchantSummary.builder()
                .total(results.size())
                .passing(passing)
                .failing(results.size() - passing)
                .warnings(warnings)
                .bySeverity(bySeverity)
                .callsAtRisk(callsAtRisk)
                .build();
    }
}
