package com.bank.merchanttwin.engine;

import com.bank.merchanttwin.config.TwinProperties;
import com.bank.merchanttwin.model.ActionKey;
import com.bank.merchanttwin.model.ActionRisk;
import com.bank.merchanttwin.model.BatchResult;
import com.bank.merchanttwin.model.Failure;
import com.bank.merchanttwin.model.FailureCodeCount;
import com.bank.merchanttwin.model.FleetStats;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.MerchantScanResult;
import com.bank.merchanttwin.model.RuleDefinition;
import com.bank.merchanttwin.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scans a fleet: an independent per-merchant scan followed by a reduce into
 * fleet aggregates. Input order never changes the aggregates; per-merchant
 * results come back ordered by merchant id.
 */
@Component
public class FleetScanner {

    private static final Comparator<MerchantScanResult> BY_MERCHANT_ID = Comparator.comparing(
            (MerchantScanResult r) -> r.getMerchant().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

    private final RuleEngine ruleEngine;
    private final TwinProperties properties;

    public FleetScanner(RuleEngine ruleEngine, TwinProperties properties) {
        this.ruleEngine = ruleEngine;
        this.properties = properties;
    }

    public BatchResult scanBatch(Collection<Merchant> merchants) {
        Stream<Merchant> stream = properties.getFleet().isParallel()
                ? merchants.parallelStream()
                : merchants.stream();

        List<MerchantScanResult> results = stream
                .map(ruleEngine::scan)
                .sorted(BY_MERCHANT_ID)
                .collect(Collectors.toList());

        return BatchResult.builder()
                .merchantResults(results)
                .fleet(fleetStats(results))
                .actionRisk(actionRisk(results))
                .build();
    }

    FleetStats fleetStats(List<MerchantScanResult> results) {
        int total = results.size();
        int healthy = 0;
        int withCritical = 0;
        long callsAtRisk = 0;

        Map<String, Integer> merchantsByCode = new HashMap<>();
        Map<String, Integer> occurrencesByCode = new HashMap<>();

        for (MerchantScanResult result : results) {
            if (result.getFailures().isEmpty()) {
                healthy++;
            }
            if (result.getSummary().countOf(Severity.CRITICAL) > 0) {
                withCritical++;
            }
            callsAtRisk += result.getSummary().getCallsAtRisk();

            // Each scanned snapshot counts once per code, even when snapshots share an id
            Set<String> codes = new HashSet<>();
            for (Failure failure : result.getFailures()) {
                codes.add(failure.getCode());
                occurrencesByCode.merge(failure.getCode(), 1, Integer::sum);
            }
            for (String code : codes) {
                merchantsByCode.merge(code, 1, Integer::sum);
            }
        }

        List<FailureCodeCount> topFailures = merchantsByCode.entrySet().stream()
                .map(e -> FailureCodeCount.builder()
                        .code(e.getKey())
                        .count(e.getValue())
                        .occurrences(occurrencesByCode.get(e.getKey()))
                        .pct((int) Math.round(e.getValue() * 100.0 / total))
                        .build())
                .sorted(Comparator.comparingInt(FailureCodeCount::getCount).reversed()
                        .thenComparing(FailureCodeCount::getCode))
                .limit(Math.max(0, properties.getFleet().getTopFailureLimit()))
                .collect(Collectors.toList());

        return FleetStats.builder()
                .totalMerchants(total)
                .healthyMerchants(healthy)
                .merchantsWithAnyFailure(total - healthy)
                .merchantsWithCritical(withCritical)
                .totalCallsAtRisk(callsAtRisk)
                .topFailures(topFailures)
                .build();
    }

    List<ActionRisk> actionRisk(List<MerchantScanResult> results) {
        Map<ActionKey, Integer> failingByAction = new EnumMap<>(ActionKey.class);
        for (MerchantScanResult result : results) {
            for (Failure failure : result.getFailures()) {
                failingByAction.merge(failure.getActionKey(), 1, Integer::sum);
            }
        }

        List<RuleDefinition> definitions = ruleEngine.ruleCatalog();
        long maxDemand = definitions.stream().mapToLong(RuleDefinition::getDemandTotal).max().orElse(0);

        List<ActionRisk> rows = new ArrayList<>();
        for (RuleDefinition def : definitions) {
            int failing = failingByAction.getOrDefault(def.getActionKey(), 0);
            double ratePct = results.isEmpty() ? 0.0 : failing * 100.0 / results.size();
            double weight = maxDemand > 0 ? (double) def.getDemandTotal() / maxDemand : 0.0;

            rows.add(ActionRisk.builder()
                    .actionKey(def.getActionKey())
                    .label(def.getLabel())
                    .demandRank(def.getDemandRank())
                    .demandTotal(def.getDemandTotal())
                    .failingMerchants(failing)
                    .failureRatePct(round2(ratePct))
                    .riskScore(round2(weight * ratePct))
                    .build());
        }

        rows.sort(Comparator.comparingDouble(ActionRisk::getRiskScore).reversed()
                .thenComparingInt(ActionRisk::getDemandRank));
        return rows;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
